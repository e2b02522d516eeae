package dev.jbang.sitecache.feed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.jbang.sitecache.config.ConfigException;
import dev.jbang.sitecache.schedule.ZonedCalendar;
import dev.jbang.sitecache.util.JsonUtils;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** The set of known feeds, looked up by key or alias */
public class FeedCatalog {
	public static final String RESOURCE = "/feeds.json";

	private final Map<String, FeedDefinition> feeds = new LinkedHashMap<>();
	private final Map<String, FeedDefinition> lookup = new LinkedHashMap<>();

	@JsonIgnoreProperties(ignoreUnknown = true)
	record CatalogFile(@JsonProperty("feeds") List<FeedDefinition> feeds) {}

	public FeedCatalog(List<FeedDefinition> definitions) {
		for (FeedDefinition feed : definitions) {
			if (feed.key() == null || feed.key().isBlank()) {
				throw new ConfigException("Feed without key in catalog");
			}
			if (feed.path() == null || feed.path().isBlank()) {
				throw new ConfigException("Feed " + feed.key() + " has no path");
			}
			// fail early on bad TTLs, parsers and schedules
			feed.ttlDuration();
			feed.parser();
			if (feed.schedule() != null) {
				feed.schedule().policy();
				checkZone(feed);
			}
			if (feeds.putIfAbsent(feed.key(), feed) != null) {
				throw new ConfigException("Duplicate feed key: " + feed.key());
			}
			register(feed.key(), feed);
			for (String alias : feed.aliases()) {
				register(alias, feed);
			}
		}
	}

	private static void checkZone(FeedDefinition feed) {
		String zone = feed.schedule().zone();
		if (zone != null && !zone.isBlank()) {
			try {
				ZonedCalendar.of(zone);
			} catch (IllegalArgumentException e) {
				throw new ConfigException("Feed " + feed.key() + " has an invalid time zone: " + zone, e);
			}
		}
	}

	private void register(String name, FeedDefinition feed) {
		FeedDefinition existing = lookup.putIfAbsent(normalize(name), feed);
		if (existing != null && existing != feed) {
			throw new ConfigException(
					"Feed name '" + name + "' is used by both " + existing.key() + " and " + feed.key());
		}
	}

	public static FeedCatalog loadDefault() {
		try (InputStream in = FeedCatalog.class.getResourceAsStream(RESOURCE)) {
			if (in == null) {
				throw new ConfigException("Feed catalog resource not found: " + RESOURCE);
			}
			return new FeedCatalog(read(JsonUtils.mapper().readValue(in, CatalogFile.class)));
		} catch (IOException e) {
			throw new ConfigException("Unable to read feed catalog " + RESOURCE, e);
		}
	}

	public static FeedCatalog load(Path file) {
		if (!Files.isRegularFile(file)) {
			throw new ConfigException("Feed catalog not found: " + file);
		}
		try {
			return new FeedCatalog(read(JsonUtils.mapper().readValue(file.toFile(), CatalogFile.class)));
		} catch (IOException e) {
			throw new ConfigException("Unable to read feed catalog " + file + ": " + e.getMessage(), e);
		}
	}

	private static List<FeedDefinition> read(CatalogFile file) {
		return file == null || file.feeds() == null ? List.of() : file.feeds();
	}

	/** Look a feed up by key or alias, ignoring case, spaces, dashes and underscores */
	public Optional<FeedDefinition> find(String name) {
		if (name == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(lookup.get(normalize(name)));
	}

	public FeedDefinition require(String name) {
		return find(name).orElseThrow(() -> new ConfigException("Unknown feed: " + name));
	}

	public List<FeedDefinition> feeds() {
		return List.copyOf(feeds.values());
	}

	public List<FeedDefinition> scheduledFeeds() {
		List<FeedDefinition> result = new ArrayList<>();
		for (FeedDefinition feed : feeds.values()) {
			if (feed.schedule() != null) {
				result.add(feed);
			}
		}
		return result;
	}

	static String normalize(String name) {
		return name.toLowerCase(Locale.ROOT).replaceAll("[\\s_-]+", "");
	}
}
