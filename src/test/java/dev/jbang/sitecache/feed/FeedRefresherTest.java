package dev.jbang.sitecache.feed;

import static org.assertj.core.api.Assertions.*;

import dev.jbang.sitecache.MutableClock;
import dev.jbang.sitecache.cache.CacheEntry;
import dev.jbang.sitecache.cache.FreshnessGatedCache;
import dev.jbang.sitecache.cache.InMemoryCacheStore;
import dev.jbang.sitecache.cache.IncompletePayloadException;
import dev.jbang.sitecache.client.PageSource;
import dev.jbang.sitecache.config.SiteConfig;
import dev.jbang.sitecache.schedule.DailyJob;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FeedRefresherTest {
	private static final String PAGE =
			"<table class=\"ranks\"><tr><th>Rank</th></tr><tr><td>1</td><td>ash</td></tr></table>";
	private static final String EMPTY_PAGE = "<table class=\"ranks\"><tr><th>Rank</th></tr></table>";

	private MutableClock clock;
	private List<String> fetched;
	private String page;
	private FeedRefresher refresher;
	private FeedCatalog catalog;

	@BeforeEach
	void setUp() {
		clock = MutableClock.at("2024-05-01T12:00:00Z");
		fetched = new ArrayList<>();
		page = PAGE;
		PageSource pages = path -> {
			fetched.add(path);
			return page;
		};
		refresher = new FeedRefresher(
				pages, new FreshnessGatedCache(new InMemoryCacheStore(clock), clock), ZoneId.of("America/New_York"));
		catalog = FeedCatalog.loadDefault();
	}

	@Test
	void testGetFetchesOnlyWhenStale() {
		// Given
		FeedDefinition ssanne = catalog.require("ssanne");

		// When
		CacheEntry first = refresher.get(ssanne);
		clock.advance(Duration.ofMinutes(4));
		CacheEntry cached = refresher.get(ssanne);
		clock.advance(Duration.ofMinutes(2));
		CacheEntry refreshed = refresher.get(ssanne);

		// Then
		assertThat(fetched).containsExactly("/ss_anne.php", "/ss_anne.php");
		assertThat(cached).isEqualTo(first);
		assertThat(refreshed.updatedAt()).isAfter(first.updatedAt());
		assertThat(first.payload().get("rows").get(0).get(1).asText()).isEqualTo("ash");
	}

	@Test
	void testEmptyRowsAreNotCached() {
		// Given
		page = EMPTY_PAGE;

		// When/Then
		assertThatThrownBy(() -> refresher.get(catalog.require("ssanne")))
				.isInstanceOf(IncompletePayloadException.class);
		page = PAGE;
		refresher.get(catalog.require("ssanne"));
		assertThat(fetched).hasSize(2);
	}

	@Test
	void testPerIdFeedsUseTheirOwnKey() {
		// Given
		FeedDefinition pokedex = catalog.require("pokedex");
		page = "<table class=\"dex\"><tr><td>Pikachu</td></tr></table>";

		// When
		CacheEntry entry = refresher.get(pokedex, "25");
		refresher.get(pokedex, "25");

		// Then
		assertThat(entry.key()).isEqualTo("pokedex:25");
		assertThat(fetched).containsExactly("/pokedex_entry.php?id=25&t=1");
	}

	@Test
	void testIdIsEncodedIntoTheQuery() {
		// Given
		FeedDefinition pokedex = catalog.require("pokedex");
		page = "<table class=\"dex\"><tr><td>Pikachu</td></tr></table>";

		// When
		CacheEntry entry = refresher.get(pokedex, "1/../logout.php x");

		// Then
		assertThat(entry.key()).isEqualTo("pokedex:1/../logout.php x");
		assertThat(fetched).containsExactly("/pokedex_entry.php?id=1%2F..%2Flogout.php+x&t=1");
		URI uri = SiteConfig.defaults().resolve(fetched.get(0));
		assertThat(uri.getPath()).isEqualTo("/pokedex_entry.php");
	}

	@Test
	void testForcedRefreshIgnoresFreshness() {
		// Given
		FeedDefinition ssanne = catalog.require("ssanne");
		refresher.get(ssanne);

		// When
		refresher.refresh(ssanne);

		// Then
		assertThat(fetched).hasSize(2);
	}

	@Test
	void testScheduledJobSkipsFetchWhileFresh() {
		// Given: tc is scheduled daily at 09:00 New York time with a 24h TTL
		FeedDefinition tc = catalog.require("tc");
		DailyJob job = refresher.scheduledJob(tc, clock);
		refresher.get(tc);
		clock.set(Instant.parse("2024-05-01T13:10:00Z")); // 09:10 EDT

		// When
		boolean ran = job.tick();

		// Then
		assertThat(ran).isTrue();
		assertThat(fetched).hasSize(1);

		// The next day the entry is older than its TTL
		clock.advance(Duration.ofDays(1));
		job.tick();
		assertThat(fetched).hasSize(2);
		assertThat(job.lastFiredDateKey()).isEqualTo("2024-05-02");
	}
}
