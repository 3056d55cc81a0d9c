package com.flamingo.ai.mentions.api.dto.request;

import com.flamingo.ai.mentions.domain.model.Post;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for previewing how posts would be chunked. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChunkPreviewRequest {

  @NotEmpty(message = "At least one post is required")
  @Size(max = 200, message = "Preview must not exceed 200 posts")
  private List<Post> posts;
}
