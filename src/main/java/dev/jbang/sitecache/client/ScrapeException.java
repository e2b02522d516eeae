package dev.jbang.sitecache.client;

/** Base class for all failures raised while talking to the site or refreshing cached data */
public class ScrapeException extends RuntimeException {
	public ScrapeException(String message) {
		super(message);
	}

	public ScrapeException(String message, Throwable cause) {
		super(message, cause);
	}
}
