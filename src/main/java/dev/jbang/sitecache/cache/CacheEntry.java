package dev.jbang.sitecache.cache;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.time.Instant;

/** The most recently stored payload for a cache key and when it was stored */
public record CacheEntry(String key, JsonNode payload, Instant updatedAt) {

	public Duration age(Instant now) {
		return Duration.between(updatedAt, now);
	}
}
