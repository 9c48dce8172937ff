package com.flamingo.ai.memoryengine.exception;

/**
 * Exception thrown when the data store or the language-model service cannot serve a request.
 * Connection errors, timeouts and overload are retryable; a request the upstream rejected as
 * malformed is not.
 */
public class UpstreamUnavailableException extends MemoryEngineException {

  private final String upstream;
  private final boolean retryable;

  public UpstreamUnavailableException(String upstream, String message) {
    this(upstream, message, null, true);
  }

  public UpstreamUnavailableException(String upstream, String message, Throwable cause) {
    this(upstream, message, cause, true);
  }

  public UpstreamUnavailableException(
      String upstream, String message, Throwable cause, boolean retryable) {
    super(message, cause);
    this.upstream = upstream;
    this.retryable = retryable;
  }

  /** Name of the collaborator that failed ("memoryStore", "graphStore", "llm"). */
  public String getUpstream() {
    return upstream;
  }

  /** Whether repeating the call can succeed. */
  public boolean isRetryable() {
    return retryable;
  }

  @Override
  public String getCode() {
    return UPSTREAM_UNAVAILABLE;
  }
}
