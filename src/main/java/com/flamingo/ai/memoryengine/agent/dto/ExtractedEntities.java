package com.flamingo.ai.memoryengine.agent.dto;

import java.util.List;

/** Structured output from EntityExtractionAgent. */
public record ExtractedEntities(
    List<String> entities // Canonical entity names, most salient first
    ) {}
