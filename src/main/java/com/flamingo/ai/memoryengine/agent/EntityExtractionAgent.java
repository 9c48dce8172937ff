package com.flamingo.ai.memoryengine.agent;

import com.flamingo.ai.memoryengine.agent.dto.ExtractedEntities;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent for recognizing named entities in memory content and search queries. The names feed the
 * knowledge graph at ingest and seed graph expansion at query time.
 */
public interface EntityExtractionAgent {

  @SystemMessage(
      """
        You are an entity recognition assistant for a personal memory store.
        Extract the people, organizations, places, products, projects and concepts
        that the text is about.

        Rules:
        - Use the canonical, singular form of each name ("dark mode", not "dark modes")
        - Do not include pronouns, dates or generic words ("user", "thing")
        - At most 10 entities, most salient first
        - Return an empty array if the text names nothing specific
        - Return ONLY valid JSON
        """)
  @UserMessage("""
        Text:
        {{text}}

        Return JSON: {"entities": ["...", "..."]}
        """)
  ExtractedEntities extract(@V("text") String text);
}
