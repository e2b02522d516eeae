package dev.jbang.sitecache.parser;

import dev.jbang.sitecache.client.ScrapeException;

/** The fetched page did not have the expected structure */
public class PageParseException extends ScrapeException {
	public PageParseException(String message) {
		super(message);
	}

	public PageParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
