package dev.jbang.sitecache;

import dev.jbang.sitecache.cache.FileCacheStore;
import dev.jbang.sitecache.cache.FreshnessGatedCache;
import dev.jbang.sitecache.config.SiteConfig;
import dev.jbang.sitecache.feed.FeedCatalog;
import java.nio.file.Path;
import java.time.Clock;
import picocli.CommandLine.Option;

/** Options shared by all commands */
public class SiteOptions {

	@Option(
			names = {"--config"},
			description = "Properties file overriding the built-in site configuration")
	Path configFile;

	@Option(
			names = {"--feeds"},
			description = "JSON feed catalog to use instead of the built-in one")
	Path feedsFile;

	@Option(
			names = {"--cache-dir"},
			description = "Directory to store cached payloads (default: from configuration)")
	Path cacheDir;

	public SiteConfig config() {
		SiteConfig config = SiteConfig.load(configFile);
		return cacheDir != null ? config.withCacheDir(cacheDir) : config;
	}

	public FeedCatalog catalog() {
		return feedsFile != null ? FeedCatalog.load(feedsFile) : FeedCatalog.loadDefault();
	}

	public FreshnessGatedCache cache(SiteConfig config, Clock clock) {
		return new FreshnessGatedCache(new FileCacheStore(config.cacheDir(), clock), clock);
	}
}
