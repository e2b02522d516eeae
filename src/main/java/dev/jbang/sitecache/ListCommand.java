package dev.jbang.sitecache;

import dev.jbang.sitecache.cache.CacheEntry;
import dev.jbang.sitecache.cache.FreshnessGatedCache;
import dev.jbang.sitecache.config.SiteConfig;
import dev.jbang.sitecache.feed.FeedCatalog;
import dev.jbang.sitecache.feed.FeedDefinition;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/** List command showing all feeds and the age of their cached entries */
@Command(name = "list", description = "List the known feeds and how old their cached data is", mixinStandardHelpOptions = true)
public class ListCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Mixin
	SiteOptions options;

	@Override
	public Integer call() throws Exception {
		SiteConfig config = options.config();
		FeedCatalog catalog = options.catalog();
		Clock clock = Clock.systemUTC();
		FreshnessGatedCache cache = options.cache(config, clock);

		logger.info("Feeds");
		logger.info("=====");
		for (FeedDefinition feed : catalog.feeds()) {
			String age;
			if (feed.needsId()) {
				age = "per id";
			} else {
				Optional<CacheEntry> entry = cache.peek(feed.cacheKey(null));
				age = entry.map(e -> describeAge(e, clock.instant())).orElse("not cached");
			}
			String aliases = feed.aliases().isEmpty() ? "" : " (" + String.join(", ", feed.aliases()) + ")";
			logger.info("  - {}{}: {}", feed.key(), aliases, age);
		}
		logger.info("");
		logger.info("Total: {} feeds", catalog.feeds().size());
		return 0;
	}

	/** Human readable age like "updated 5 minutes ago" */
	public static String describeAge(CacheEntry entry, Instant now) {
		Duration age = entry.age(now);
		long minutes = Math.max(0, age.toMinutes());
		if (minutes < 1) {
			return "updated just now";
		}
		if (minutes < 60) {
			return "updated " + minutes + (minutes == 1 ? " minute" : " minutes") + " ago";
		}
		long hours = age.toHours();
		if (hours < 48) {
			return "updated " + hours + (hours == 1 ? " hour" : " hours") + " ago";
		}
		return "updated " + age.toDays() + " days ago";
	}
}
