package com.flamingo.ai.memoryengine.exception;

import java.util.function.Predicate;

/**
 * Resilience4j retry predicate: only transient upstream failures are retried. Wired by name from
 * {@code resilience4j.retry.configs.default.retry-exception-predicate}.
 */
public class RetryableUpstreamPredicate implements Predicate<Throwable> {

  @Override
  public boolean test(Throwable throwable) {
    return throwable instanceof UpstreamUnavailableException upstream && upstream.isRetryable();
  }
}
