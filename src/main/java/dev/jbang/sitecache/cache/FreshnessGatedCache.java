package dev.jbang.sitecache.cache;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-through cache in front of an expensive refresh function: the refresh only runs when the
 * stored entry is missing, too old, or structurally incomplete.
 */
public class FreshnessGatedCache {
	private static final Logger logger = LoggerFactory.getLogger(FreshnessGatedCache.class);

	private final CacheStore store;
	private final Clock clock;

	public FreshnessGatedCache(CacheStore store, Clock clock) {
		this.store = store;
		this.clock = clock;
	}

	/**
	 * Return the stored entry for the key, refreshing it first if the policy considers it stale.
	 * Exceptions from the refresh function propagate and leave the stored entry untouched.
	 *
	 * @throws IncompletePayloadException if the refresh returned nothing usable
	 */
	public CacheEntry getOrRefresh(String key, FreshnessPolicy policy, Supplier<JsonNode> refreshFn) {
		Optional<CacheEntry> current = store.get(key);
		if (current.isPresent() && !policy.isStale(current.get(), clock.instant())) {
			logger.debug("Cache hit for {}", key);
			return current.get();
		}
		logger.debug(current.isPresent() ? "Cache entry {} is stale" : "No cache entry for {}", key);
		return refresh(key, policy, refreshFn);
	}

	/** Run the refresh function unconditionally and store its result */
	public CacheEntry refresh(String key, FreshnessPolicy policy, Supplier<JsonNode> refreshFn) {
		JsonNode payload = refreshFn.get();
		if (!policy.accepts(payload)) {
			throw new IncompletePayloadException("Refreshed payload for " + key + " is empty or incomplete");
		}
		CacheEntry entry = store.upsert(key, payload);
		logger.info("Refreshed {}", key);
		return entry;
	}

	public boolean isStale(String key, FreshnessPolicy policy) {
		return policy.isStale(store.get(key).orElse(null), clock.instant());
	}

	/** Read the stored entry without any freshness check */
	public Optional<CacheEntry> peek(String key) {
		return store.get(key);
	}
}
