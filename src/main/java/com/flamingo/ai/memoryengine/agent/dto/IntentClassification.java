package com.flamingo.ai.memoryengine.agent.dto;

/** Structured output from QueryIntentAgent. */
public record IntentClassification(
    String intent, // "FACT", "SUMMARY" or "ANALYSIS"
    String reasoning) {}
