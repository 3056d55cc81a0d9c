package com.flamingo.ai.mentions.api.dto.response;

import com.flamingo.ai.mentions.domain.model.ChunkMetadata;
import com.flamingo.ai.mentions.service.chunking.ChunkValidationReport;
import java.util.List;

/** Chunk metadata and validation of a chunking preview. */
public record ChunkPreviewResponse(List<ChunkMetadata> chunks, ChunkValidationReport validation) {}
