package dev.jbang.sitecache.client;

/** A page request ended in an HTTP status that could not be turned into page content */
public class FetchException extends ScrapeException {
	private final int statusCode;

	public FetchException(String message, int statusCode) {
		super(message);
		this.statusCode = statusCode;
	}

	/** The HTTP status of the failing response, or -1 if no response was involved */
	public int statusCode() {
		return statusCode;
	}
}
