package dev.jbang.sitecache;

import dev.jbang.sitecache.cache.FreshnessGatedCache;
import dev.jbang.sitecache.client.ClientFactory;
import dev.jbang.sitecache.config.SiteConfig;
import dev.jbang.sitecache.feed.FeedCatalog;
import dev.jbang.sitecache.feed.FeedRefresher;
import dev.jbang.sitecache.schedule.JobScheduler;
import java.time.Clock;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/** Run command keeping the scheduled feeds up to date until the process is stopped */
@Command(name = "run", description = "Refresh all scheduled feeds on their calendar until interrupted", mixinStandardHelpOptions = true)
public class RunCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Mixin
	SiteOptions options;

	@Override
	public Integer call() throws Exception {
		SiteConfig config = options.config();
		FeedCatalog catalog = options.catalog();
		Clock clock = Clock.systemUTC();
		FreshnessGatedCache cache = options.cache(config, clock);

		ClientFactory clients = new ClientFactory(config);
		startSession(clients);

		JobScheduler scheduler = new JobScheduler(config.tickInterval());
		FeedRefresher refresher = new FeedRefresher(path -> clients.get("run").fetchPage(path), cache, config.timeZone());
		int count = refresher.registerSchedules(scheduler, catalog, clock);
		logger.info("Scheduled {} feeds, tick interval {}, press Ctrl+C to stop", count, config.tickInterval());

		CountDownLatch stopped = new CountDownLatch(1);
		Runtime.getRuntime().addShutdownHook(new Thread(() -> {
			logger.info("Shutting down");
			scheduler.close();
			clients.close();
			stopped.countDown();
		}));
		stopped.await();
		return 0;
	}

	// bad credentials should stop the command, not show up in every tick
	static void startSession(ClientFactory clients) {
		try {
			clients.get("run").login(false);
		} catch (RuntimeException e) {
			clients.close();
			throw e;
		}
	}
}
