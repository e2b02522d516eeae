package dev.jbang.sitecache.feed;

import com.fasterxml.jackson.databind.JsonNode;
import dev.jbang.sitecache.cache.CacheEntry;
import dev.jbang.sitecache.cache.FreshnessGatedCache;
import dev.jbang.sitecache.client.PageSource;
import dev.jbang.sitecache.schedule.DailyJob;
import dev.jbang.sitecache.schedule.JobScheduler;
import dev.jbang.sitecache.schedule.ZonedCalendar;
import java.time.Clock;
import java.time.ZoneId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Connects feeds to the site and the cache: fetch, parse, store */
public class FeedRefresher {
	private static final Logger logger = LoggerFactory.getLogger(FeedRefresher.class);

	private final PageSource pages;
	private final FreshnessGatedCache cache;
	private final ZoneId defaultZone;

	public FeedRefresher(PageSource pages, FreshnessGatedCache cache, ZoneId defaultZone) {
		this.pages = pages;
		this.cache = cache;
		this.defaultZone = defaultZone;
	}

	public CacheEntry get(FeedDefinition feed) {
		return get(feed, null);
	}

	/** The cached payload of the feed, fetching the page only when the cached one is stale */
	public CacheEntry get(FeedDefinition feed, String id) {
		return cache.getOrRefresh(feed.cacheKey(id), feed.policy(), () -> load(feed, id));
	}

	public CacheEntry refresh(FeedDefinition feed) {
		return refresh(feed, null);
	}

	public CacheEntry refresh(FeedDefinition feed, String id) {
		return cache.refresh(feed.cacheKey(id), feed.policy(), () -> load(feed, id));
	}

	private JsonNode load(FeedDefinition feed, String id) {
		String path = feed.path(id);
		logger.debug("Fetching {} for feed {}", path, feed.key());
		return feed.parser().parse(pages.fetchPage(path));
	}

	/** Daily job that refreshes the feed, skipping the fetch while the cached entry is still fresh */
	public DailyJob scheduledJob(FeedDefinition feed, Clock clock) {
		FeedDefinition.ScheduleSpec schedule = feed.schedule();
		return DailyJob.create("feed:" + feed.key(), calendar(schedule), () -> get(feed))
				.notBefore(schedule.notBeforeHour())
				.failurePolicy(schedule.policy())
				.clock(clock);
	}

	/** Register every scheduled feed of the catalog, returns the number of jobs registered */
	public int registerSchedules(JobScheduler scheduler, FeedCatalog catalog, Clock clock) {
		int count = 0;
		for (FeedDefinition feed : catalog.scheduledFeeds()) {
			if (feed.needsId()) {
				logger.warn("Feed {} needs an id and cannot be scheduled", feed.key());
				continue;
			}
			if (feed.schedule().isMidnight()) {
				scheduler.registerMidnight("feed:" + feed.key(), calendar(feed.schedule()), () -> refresh(feed));
			} else {
				scheduler.register(scheduledJob(feed, clock));
			}
			count++;
		}
		return count;
	}

	private ZonedCalendar calendar(FeedDefinition.ScheduleSpec schedule) {
		return schedule.zone() == null || schedule.zone().isBlank()
				? new ZonedCalendar(defaultZone)
				: ZonedCalendar.of(schedule.zone());
	}
}
