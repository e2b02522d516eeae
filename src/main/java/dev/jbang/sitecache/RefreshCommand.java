package dev.jbang.sitecache;

import dev.jbang.sitecache.cache.CacheEntry;
import dev.jbang.sitecache.cache.FreshnessGatedCache;
import dev.jbang.sitecache.client.ClientFactory;
import dev.jbang.sitecache.config.SiteConfig;
import dev.jbang.sitecache.feed.FeedCatalog;
import dev.jbang.sitecache.feed.FeedDefinition;
import dev.jbang.sitecache.feed.FeedRefresher;
import dev.jbang.sitecache.util.JsonUtils;
import java.time.Clock;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/** Refresh command returning a feed's payload, fetching it only when the cache is stale */
@Command(
		name = "refresh",
		description = "Get a feed from the cache, refreshing it from the site when stale",
		mixinStandardHelpOptions = true)
public class RefreshCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Mixin
	SiteOptions options;

	@Parameters(index = "0", description = "Feed key or alias")
	String feedName;

	@Option(
			names = {"--id"},
			description = "Id for feeds with per-id pages")
	String id;

	@Option(
			names = {"-f", "--force"},
			description = "Refresh even if the cached entry is still fresh")
	boolean force;

	@Override
	public Integer call() throws Exception {
		SiteConfig config = options.config();
		FeedCatalog catalog = options.catalog();
		FeedDefinition feed = catalog.require(feedName);
		Clock clock = Clock.systemUTC();
		FreshnessGatedCache cache = options.cache(config, clock);

		try (ClientFactory clients = new ClientFactory(config)) {
			FeedRefresher refresher = new FeedRefresher(path -> clients.get("refresh").fetchPage(path), cache, config.timeZone());
			CacheEntry entry = force ? refresher.refresh(feed, id) : refresher.get(feed, id);
			System.out.println(JsonUtils.pretty(entry.payload()));
			logger.info("{}: {}", feed.displayName(), ListCommand.describeAge(entry, clock.instant()));
		}
		return 0;
	}
}
