package dev.jbang.sitecache.cache;

import dev.jbang.sitecache.client.ScrapeException;

/** A refresh produced no payload, or one that its freshness policy does not accept */
public class IncompletePayloadException extends ScrapeException {
	public IncompletePayloadException(String message) {
		super(message);
	}
}
