package dev.jbang.sitecache.client;

/**
 * Network level failure: connection errors, timeouts and login requests that did not get an HTTP
 * success back. Retryable by the caller at a later point, never retried inline.
 */
public class TransportException extends ScrapeException {
	public TransportException(String message) {
		super(message);
	}

	public TransportException(String message, Throwable cause) {
		super(message, cause);
	}
}
