package dev.jbang.sitecache.client;

import dev.jbang.sitecache.config.Credentials;
import dev.jbang.sitecache.config.SiteConfig;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.apache.hc.core5.http.NameValuePair;
import org.apache.hc.core5.http.message.BasicNameValuePair;
import org.apache.hc.core5.net.WWWFormCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the login session of a single {@link ScrapingClient}: performs the form login, remembers
 * when it last succeeded and sends every exchange with the session cookies.
 */
public class SessionManager {
	private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

	private final SiteConfig config;
	private final Credentials credentials;
	private final HttpTransport transport;
	private final CookieJar cookieJar;
	private final Clock clock;

	private boolean valid;
	private Instant authenticatedAt;

	public SessionManager(
			SiteConfig config, Credentials credentials, HttpTransport transport, CookieJar cookieJar, Clock clock) {
		this.config = config;
		this.credentials = credentials;
		this.transport = transport;
		this.cookieJar = cookieJar;
		this.clock = clock;
	}

	/**
	 * Send a request with the client's User-Agent and the current session cookies, merging any
	 * cookies the response sets.
	 */
	public TransportResponse exchange(TransportRequest request) throws IOException {
		TransportRequest outgoing = request.withHeader("User-Agent", config.userAgent());
		String cookies = cookieJar.header();
		if (!cookies.isEmpty()) {
			outgoing = outgoing.withHeader("Cookie", cookies);
		}
		TransportResponse response = transport.execute(outgoing);
		cookieJar.merge(response.setCookies());
		return response;
	}

	/**
	 * Make sure there is an authenticated session.
	 *
	 * @param force log in again even if the current session still looks valid
	 * @throws TransportException if the login request failed on the network or HTTP level
	 * @throws InvalidCredentialsException if the site rejected the credentials
	 */
	public synchronized void login(boolean force) {
		Instant now = clock.instant();
		if (!force && valid && authenticatedAt != null && withinWindow(now)) {
			return;
		}

		List<NameValuePair> form = List.of(
				new BasicNameValuePair(config.usernameField(), credentials.username()),
				new BasicNameValuePair(config.passwordField(), credentials.password()));
		TransportRequest request =
				TransportRequest.post(config.loginUri(), WWWFormCodec.format(form, StandardCharsets.UTF_8));

		logger.debug("Logging in to {} (forced: {})", config.loginUri(), force);
		TransportResponse response;
		try {
			response = exchange(request);
		} catch (IOException e) {
			valid = false;
			throw new TransportException("Login request failed: " + e.getMessage(), e);
		}

		if (!response.isSuccess() && !response.isRedirect()) {
			valid = false;
			throw new TransportException("Login failed with HTTP status " + response.statusCode());
		}
		String body = response.body();
		if (!body.isEmpty() && !body.contains(config.loginMarker())) {
			valid = false;
			logger.error("Login rejected for user {}", credentials.username());
			throw new InvalidCredentialsException("Login rejected, check the configured credentials");
		}

		valid = true;
		authenticatedAt = clock.instant();
		logger.info("Logged in as {}", credentials.username());
	}

	public synchronized void invalidate() {
		valid = false;
	}

	public synchronized boolean isValid() {
		return valid;
	}

	public synchronized Instant authenticatedAt() {
		return authenticatedAt;
	}

	public CookieJar cookieJar() {
		return cookieJar;
	}

	private boolean withinWindow(Instant now) {
		Duration age = Duration.between(authenticatedAt, now);
		return age.compareTo(config.sessionWindow()) < 0;
	}
}
