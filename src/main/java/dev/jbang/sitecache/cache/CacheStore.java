package dev.jbang.sitecache.cache;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Optional;

/** Key/value persistence for cached payloads. Implementations must be thread-safe. */
public interface CacheStore {

	/**
	 * Insert or overwrite the payload for a key. The store assigns the timestamp, and it is
	 * always later than the timestamp of the entry being replaced.
	 */
	CacheEntry upsert(String key, JsonNode payload);

	Optional<CacheEntry> get(String key);

	/**
	 * Timestamp for a new version of an entry: {@code now}, or one nanosecond after the previous
	 * timestamp if the clock has not moved past it.
	 */
	static Instant stamp(Instant now, CacheEntry previous) {
		if (previous != null && !now.isAfter(previous.updatedAt())) {
			return previous.updatedAt().plusNanos(1);
		}
		return now;
	}
}
