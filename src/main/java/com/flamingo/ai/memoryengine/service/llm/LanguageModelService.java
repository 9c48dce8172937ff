package com.flamingo.ai.memoryengine.service.llm;

import com.flamingo.ai.memoryengine.domain.enums.QueryIntent;
import java.util.List;

/**
 * Narrow interface to the language-model and embedding service. Every call has its own timeout
 * and fails with {@link com.flamingo.ai.memoryengine.exception.LlmServiceException} (rate limited,
 * timed out, invalid response) or {@link
 * com.flamingo.ai.memoryengine.exception.UpstreamUnavailableException}.
 */
public interface LanguageModelService {

  /** Embeds text; the result always has the store-wide configured dimensionality. */
  float[] embed(String text);

  /** Condenses one or more memory texts into a single short plain-text summary. */
  String summarize(List<String> texts);

  QueryIntent classifyIntent(String text);

  /** Named entities in {@code text}, most salient first, without duplicates. */
  List<String> extractEntities(String text);
}
