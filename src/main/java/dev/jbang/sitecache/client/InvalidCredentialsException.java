package dev.jbang.sitecache.client;

/** The site answered the login request but did not accept the configured username/password. */
public class InvalidCredentialsException extends ScrapeException {
	public InvalidCredentialsException(String message) {
		super(message);
	}
}
