package dev.jbang.sitecache.client;

import dev.jbang.sitecache.config.Credentials;
import dev.jbang.sitecache.config.SiteConfig;
import java.util.Map;
import java.util.function.Function;

/** Creates the {@link ScrapingClient} on first use and hands out that same instance afterwards */
public class ClientFactory implements AutoCloseable {
	private final SiteConfig config;
	private final Map<String, String> env;
	private final Function<Credentials, ScrapingClient> creator;
	private ScrapingClient client;

	public ClientFactory(SiteConfig config) {
		this(config, System.getenv(), credentials -> new ScrapingClient(config, credentials));
	}

	public ClientFactory(SiteConfig config, Map<String, String> env, Function<Credentials, ScrapingClient> creator) {
		this.config = config;
		this.env = env;
		this.creator = creator;
	}

	/**
	 * Return the shared client, creating it if needed.
	 *
	 * @param label who is asking, used when credentials are missing
	 * @throws dev.jbang.sitecache.config.ConfigException if no credentials are configured
	 */
	public synchronized ScrapingClient get(String label) {
		if (client == null) {
			client = creator.apply(Credentials.require(config, env, label));
		}
		return client;
	}

	public synchronized boolean isCreated() {
		return client != null;
	}

	@Override
	public synchronized void close() {
		if (client != null) {
			client.close();
			client = null;
		}
	}
}
