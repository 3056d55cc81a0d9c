package com.flamingo.ai.mentions.agent;

import com.flamingo.ai.mentions.agent.dto.ExtractionResponse;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that extracts restaurant and dish mentions from one chunk of a forum thread. Uses
 * LangChain4j AI Services for structured output.
 */
public interface MentionExtractionAgent {

  @SystemMessage(
      """
        You extract restaurant and food mentions from food-community forum threads.

        For every restaurant a post or comment talks about, emit one mention per dish discussed,
        or a single mention with generalPraise=true when the restaurant is praised without a
        specific dish.

        Rules:
        - restaurantName: the restaurant's own name only, lower-cased, never including dish words
        - restaurantOriginalText / dishOriginalText: the exact surface text used by the author
        - restaurantTempId / dishTempId: short ids, reused for the same entity within this chunk
        - dishName: the dish, lower-cased; dishCategories: broader food categories
        - dishIsMenuItem: true for a specific menu item, false for a general category
        - sourceType: "post" or "comment"; sourceId: the id of the post or comment it came from
        - Only extract from the post itself when post.extractFromPost is true
        - Never copy source text into other fields
        - Return ONLY valid JSON
        """)
  @UserMessage(
      """
        Thread chunk:
        {{chunk}}

        Return JSON: {"mentions": [ ... ]}
        """)
  ExtractionResponse extract(@V("chunk") String chunkJson);
}
