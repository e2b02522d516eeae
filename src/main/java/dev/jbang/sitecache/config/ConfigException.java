package dev.jbang.sitecache.config;

import dev.jbang.sitecache.client.ScrapeException;

/** Missing or invalid configuration, detected before any network traffic happens */
public class ConfigException extends ScrapeException {
	public ConfigException(String message) {
		super(message);
	}

	public ConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
