package com.flamingo.ai.memoryengine.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent for condensing one long memory, or a group of closely related memories, into a short
 * plain-text summary.
 */
public interface MemorySummaryAgent {

  @SystemMessage(
      """
        You condense an agent's memories. Write a single plain-text paragraph of at most
        80 words that keeps every concrete fact, preference and decision in the input.
        Do not add information. Do not use markdown. Do not start with "The memories" or
        "This memory".
        """)
  @UserMessage("""
        Memories:
        {{memories}}
        """)
  String summarize(@V("memories") String memories);
}
