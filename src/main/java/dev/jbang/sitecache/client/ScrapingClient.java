package dev.jbang.sitecache.client;

import dev.jbang.sitecache.config.Credentials;
import dev.jbang.sitecache.config.SiteConfig;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.apache.hc.core5.http.NameValuePair;
import org.apache.hc.core5.http.message.BasicNameValuePair;
import org.apache.hc.core5.net.WWWFormCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticated client for the site. All calls share one session and go through one {@link
 * RequestSerializer}, so the site never sees two requests from us at the same time.
 *
 * <p>When the site answers with a redirect to its login page the session has expired on the
 * server side: the client logs in again and repeats the original request once.
 */
public class ScrapingClient implements PageSource, AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(ScrapingClient.class);

	private final SiteConfig config;
	private final HttpTransport transport;
	private final SessionManager session;
	private final RequestSerializer serializer;

	public ScrapingClient(SiteConfig config, Credentials credentials) {
		this(config, credentials, new ApacheHttpTransport(config.timeout()), Clock.systemUTC());
	}

	public ScrapingClient(SiteConfig config, Credentials credentials, HttpTransport transport, Clock clock) {
		this.config = config;
		this.transport = transport;
		this.session = new SessionManager(config, credentials, transport, new CookieJar(), clock);
		this.serializer = new RequestSerializer(config.timeout(), transport::abort);
	}

	/** Fetch a page (relative to the base URL, or absolute) and return its HTML */
	@Override
	public String fetchPage(String pathOrUrl) {
		return await(fetchPageAsync(pathOrUrl));
	}

	public CompletableFuture<String> fetchPageAsync(String pathOrUrl) {
		URI uri = config.resolve(pathOrUrl);
		return serializer.submit("GET " + uri.getPath(), () -> perform(TransportRequest.get(uri)));
	}

	/** POST an already URL-encoded form body and return the resulting HTML */
	public String submitForm(String pathOrUrl, String formBody) {
		return await(submitFormAsync(pathOrUrl, formBody));
	}

	public String submitForm(String pathOrUrl, Map<String, String> fields) {
		return submitForm(pathOrUrl, encodeForm(fields));
	}

	public CompletableFuture<String> submitFormAsync(String pathOrUrl, String formBody) {
		URI uri = config.resolve(pathOrUrl);
		TransportRequest request = TransportRequest.post(uri, formBody);
		return serializer.submit("POST " + uri.getPath(), () -> perform(request));
	}

	/** Log in through the request queue, e.g. to verify the credentials at startup */
	public void login(boolean force) {
		await(serializer.submit("login", () -> {
			session.login(force);
			return null;
		}));
	}

	private String perform(TransportRequest request) {
		session.login(false);
		return resolve(request, execute(request), true, 0);
	}

	private String resolve(TransportRequest request, TransportResponse response, boolean allowLoginRetry, int redirects) {
		if (response.isSuccess()) {
			return response.body();
		}
		if (!response.isRedirect()) {
			throw new FetchException(
					"Request to " + request.uri() + " failed with HTTP status " + response.statusCode(),
					response.statusCode());
		}

		String location = response.header("Location").orElse(null);
		if (location == null || location.isBlank()) {
			throw new FetchException(
					"Redirect without Location header from " + request.uri(), response.statusCode());
		}
		URI target = request.uri().resolve(location.trim());

		if (isLoginPage(target)) {
			if (!allowLoginRetry) {
				throw new FetchException(
						"Redirected to the login page and no login retry is left: " + request.uri(),
						response.statusCode());
			}
			logger.info("Session expired while requesting {}, logging in again", request.uri());
			session.invalidate();
			session.login(true);
			return resolve(request, execute(request), false, redirects);
		}

		if (redirects >= config.maxRedirects()) {
			throw new FetchException("Too many redirects, last one to " + target, response.statusCode());
		}
		logger.debug("Following redirect from {} to {}", request.uri(), target);
		TransportRequest follow = TransportRequest.get(target);
		return resolve(follow, execute(follow), false, redirects + 1);
	}

	private boolean isLoginPage(URI target) {
		String path = target.getPath();
		return path != null && path.equalsIgnoreCase(config.loginUri().getPath());
	}

	private TransportResponse execute(TransportRequest request) {
		try {
			return session.exchange(request);
		} catch (IOException e) {
			throw new TransportException("Request to " + request.uri() + " failed: " + e.getMessage(), e);
		}
	}

	static String encodeForm(Map<String, String> fields) {
		List<NameValuePair> pairs = fields.entrySet().stream()
				.map(e -> (NameValuePair) new BasicNameValuePair(e.getKey(), e.getValue()))
				.toList();
		return WWWFormCodec.format(pairs, StandardCharsets.UTF_8);
	}

	private static <T> T await(CompletableFuture<T> future) {
		try {
			return future.get();
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			throw new ScrapeException(cause.getMessage(), cause);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new TransportException("Interrupted while waiting for the site", e);
		}
	}

	@Override
	public void close() {
		serializer.close();
		try {
			transport.close();
		} catch (IOException e) {
			logger.warn("Failed to close HTTP transport: {}", e.getMessage());
		}
	}
}
