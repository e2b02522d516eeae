package dev.jbang.sitecache.config;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Login credentials for the site, read once from the environment */
public record Credentials(String username, String password) {
	private static final Logger logger = LoggerFactory.getLogger(Credentials.class);

	public static Credentials fromEnvironment(SiteConfig config, Map<String, String> env) {
		return new Credentials(trimToNull(env.get(config.usernameEnv())), trimToNull(env.get(config.passwordEnv())));
	}

	public boolean isConfigured() {
		return username != null && password != null;
	}

	public static boolean isConfigured(SiteConfig config, Map<String, String> env) {
		return fromEnvironment(config, env).isConfigured();
	}

	/**
	 * Return the configured credentials or fail before any network call is made.
	 *
	 * @param label what needs the credentials, used in the log message
	 * @throws ConfigException if either variable is missing or blank
	 */
	public static Credentials require(SiteConfig config, Map<String, String> env, String label) {
		Credentials credentials = fromEnvironment(config, env);
		if (!credentials.isConfigured()) {
			logger.error(
					"{} requires the {} and {} environment variables", label, config.usernameEnv(), config.passwordEnv());
			throw new ConfigException("Credentials not configured: set " + config.usernameEnv() + " and "
					+ config.passwordEnv());
		}
		return credentials;
	}

	@Override
	public String toString() {
		return "Credentials[username=" + username + ", password=" + (password == null ? "null" : "****") + "]";
	}

	private static String trimToNull(String value) {
		if (value == null || value.trim().isEmpty()) {
			return null;
		}
		return value.trim();
	}
}
