package dev.jbang.sitecache.cache;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Non-persistent {@link CacheStore}, used in tests and for one-off command runs */
public class InMemoryCacheStore implements CacheStore {
	private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
	private final Clock clock;

	public InMemoryCacheStore(Clock clock) {
		this.clock = clock;
	}

	@Override
	public CacheEntry upsert(String key, JsonNode payload) {
		return entries.compute(
				key, (k, previous) -> new CacheEntry(k, payload.deepCopy(), CacheStore.stamp(clock.instant(), previous)));
	}

	@Override
	public Optional<CacheEntry> get(String key) {
		return Optional.ofNullable(entries.get(key));
	}
}
