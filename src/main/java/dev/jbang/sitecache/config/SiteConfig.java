package dev.jbang.sitecache.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings for talking to the site and for running the refresh schedules.
 *
 * <p>Values are read from the {@code sitecache.properties} resource, then from an optional
 * properties file and finally from {@code sitecache.*} system properties, later sources winning.
 */
public record SiteConfig(
		URI baseUrl,
		String loginPath,
		String usernameField,
		String passwordField,
		String loginMarker,
		String userAgent,
		Duration timeout,
		Duration sessionWindow,
		int maxRedirects,
		String usernameEnv,
		String passwordEnv,
		Duration tickInterval,
		ZoneId timeZone,
		Path cacheDir) {
	private static final Logger logger = LoggerFactory.getLogger(SiteConfig.class);

	public static final String RESOURCE = "/sitecache.properties";
	public static final String PREFIX = "sitecache.";

	/** Configuration from the bundled defaults and system properties only */
	public static SiteConfig defaults() {
		return load(null);
	}

	/**
	 * Load the configuration
	 *
	 * @param file optional properties file overriding the bundled defaults, may be null
	 */
	public static SiteConfig load(Path file) {
		Properties props = new Properties();
		try (InputStream in = SiteConfig.class.getResourceAsStream(RESOURCE)) {
			if (in != null) {
				props.load(in);
			}
		} catch (IOException e) {
			throw new ConfigException("Unable to read " + RESOURCE, e);
		}
		if (file != null) {
			if (!Files.isRegularFile(file)) {
				throw new ConfigException("Configuration file not found: " + file);
			}
			try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
				props.load(reader);
			} catch (IOException e) {
				throw new ConfigException("Unable to read configuration file " + file, e);
			}
			logger.debug("Loaded configuration from {}", file);
		}
		for (String name : System.getProperties().stringPropertyNames()) {
			if (name.startsWith(PREFIX)) {
				props.setProperty(name, System.getProperty(name));
			}
		}
		return fromProperties(props);
	}

	public static SiteConfig fromProperties(Properties props) {
		String base = value(props, "base-url", "https://www.tppcrpg.net");
		URI baseUrl;
		try {
			baseUrl = URI.create(base.endsWith("/") ? base.substring(0, base.length() - 1) : base);
		} catch (IllegalArgumentException e) {
			throw new ConfigException("Invalid base URL: " + base, e);
		}
		ZoneId zone;
		String zoneName = value(props, "time-zone", "America/New_York");
		try {
			zone = ZoneId.of(zoneName);
		} catch (DateTimeException e) {
			throw new ConfigException("Invalid time zone: " + zoneName, e);
		}
		int maxRedirects;
		try {
			maxRedirects = Integer.parseInt(value(props, "max-redirects", "1"));
		} catch (NumberFormatException e) {
			throw new ConfigException("Invalid max-redirects: " + props.getProperty(PREFIX + "max-redirects"), e);
		}
		return new SiteConfig(
				baseUrl,
				value(props, "login-path", "/login.php"),
				value(props, "login.username-field", "LoginID"),
				value(props, "login.password-field", "NewPass"),
				value(props, "login.marker", "Logout"),
				value(props, "user-agent", "Mozilla/5.0 (compatible; SiteCache/1.0)"),
				duration(props, "timeout", "30s"),
				duration(props, "session-window", "10m"),
				maxRedirects,
				value(props, "credentials.username-env", "RPG_USERNAME"),
				value(props, "credentials.password-env", "RPG_PASSWORD"),
				duration(props, "tick-interval", "10m"),
				zone,
				Path.of(value(props, "cache-dir", "cache")));
	}

	public URI loginUri() {
		return resolve(loginPath);
	}

	/** Resolve a site relative path (or pass through an absolute URL) */
	public URI resolve(String pathOrUrl) {
		if (pathOrUrl.startsWith("http://") || pathOrUrl.startsWith("https://")) {
			return URI.create(pathOrUrl);
		}
		String path = pathOrUrl.startsWith("/") ? pathOrUrl : "/" + pathOrUrl;
		return URI.create(baseUrl + path);
	}

	public SiteConfig withBaseUrl(URI url) {
		return new SiteConfig(
				url,
				loginPath,
				usernameField,
				passwordField,
				loginMarker,
				userAgent,
				timeout,
				sessionWindow,
				maxRedirects,
				usernameEnv,
				passwordEnv,
				tickInterval,
				timeZone,
				cacheDir);
	}

	public SiteConfig withCacheDir(Path dir) {
		return new SiteConfig(
				baseUrl,
				loginPath,
				usernameField,
				passwordField,
				loginMarker,
				userAgent,
				timeout,
				sessionWindow,
				maxRedirects,
				usernameEnv,
				passwordEnv,
				tickInterval,
				timeZone,
				dir);
	}

	private static String value(Properties props, String name, String defaultValue) {
		String value = props.getProperty(PREFIX + name);
		if (value == null || value.trim().isEmpty()) {
			return defaultValue;
		}
		return value.trim();
	}

	private static Duration duration(Properties props, String name, String defaultValue) {
		return DurationParser.require(PREFIX + name, value(props, name, defaultValue));
	}
}
