package dev.jbang.sitecache.client;

import java.io.Closeable;
import java.io.IOException;

/**
 * Executes exactly one HTTP exchange. Implementations must not follow redirects nor keep cookies
 * on their own, both are handled by {@link ScrapingClient} and {@link CookieJar}.
 */
public interface HttpTransport extends Closeable {

	TransportResponse execute(TransportRequest request) throws IOException;

	/** Abort the exchanges currently in flight, their {@code execute} calls fail with an IOException */
	default void abort() {}

	@Override
	default void close() throws IOException {}
}
