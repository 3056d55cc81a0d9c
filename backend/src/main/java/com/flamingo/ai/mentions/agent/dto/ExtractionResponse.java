package com.flamingo.ai.mentions.agent.dto;

import java.util.List;

/** Structured output of MentionExtractionAgent. */
public record ExtractionResponse(List<ExtractedMention> mentions) {}
