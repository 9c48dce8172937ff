package com.flamingo.ai.memoryengine.agent;

import com.flamingo.ai.memoryengine.agent.dto.IntentClassification;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent for classifying the intent of a memory search query. */
public interface QueryIntentAgent {

  @SystemMessage(
      """
        You classify search queries against an agent's memory into exactly one intent.

        Intents:
        - FACT: asks for a specific fact, name, date, number, setting or definition
        - SUMMARY: asks for an overview of what is known about a topic
        - ANALYSIS: asks for reasons, comparisons or relationships between things

        Return ONLY valid JSON with fields "intent" (one of FACT, SUMMARY, ANALYSIS)
        and "reasoning" (one short sentence).
        """)
  @UserMessage("""
        Query: {{query}}
        """)
  IntentClassification classify(@V("query") String query);
}
