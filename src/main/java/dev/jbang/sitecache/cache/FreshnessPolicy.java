package dev.jbang.sitecache.cache;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Predicate;

/**
 * Decides whether a cached entry can still be used.
 *
 * @param ttl maximum age of an entry, or null if entries never expire by age
 * @param validator structural check of the payload, or null to accept any payload
 */
public record FreshnessPolicy(Duration ttl, Predicate<JsonNode> validator) {

	public static FreshnessPolicy ttl(Duration ttl) {
		return new FreshnessPolicy(ttl, null);
	}

	/** Entries are only refreshed when missing or rejected by a validator */
	public static FreshnessPolicy noTtl() {
		return new FreshnessPolicy(null, null);
	}

	public FreshnessPolicy requiring(Predicate<JsonNode> check) {
		return new FreshnessPolicy(ttl, check);
	}

	/** Validator requiring a non-empty array or object, or non-blank text, at the given field */
	public static Predicate<JsonNode> hasField(String field) {
		return payload -> {
			JsonNode value = payload.get(field);
			if (value == null || value.isNull() || value.isMissingNode()) {
				return false;
			}
			if (value.isContainerNode()) {
				return value.size() > 0;
			}
			if (value.isTextual()) {
				return !value.asText().isBlank();
			}
			return true;
		};
	}

	public boolean accepts(JsonNode payload) {
		if (payload == null || payload.isNull() || payload.isMissingNode()) {
			return false;
		}
		return validator == null || validator.test(payload);
	}

	public boolean isStale(CacheEntry entry, Instant now) {
		if (entry == null) {
			return true;
		}
		if (ttl != null && entry.age(now).compareTo(ttl) > 0) {
			return true;
		}
		return !accepts(entry.payload());
	}
}
