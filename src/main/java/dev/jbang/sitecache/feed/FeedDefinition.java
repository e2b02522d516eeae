package dev.jbang.sitecache.feed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.jbang.sitecache.cache.FreshnessPolicy;
import dev.jbang.sitecache.config.ConfigException;
import dev.jbang.sitecache.config.DurationParser;
import dev.jbang.sitecache.parser.PageParser;
import dev.jbang.sitecache.parser.RowsPageParser;
import dev.jbang.sitecache.parser.TextPageParser;
import dev.jbang.sitecache.schedule.FailurePolicy;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/** One cached page of the site as described in the feed catalog */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FeedDefinition(
		@JsonProperty("key") String key,
		@JsonProperty("name") String name,
		@JsonProperty("path") String path,
		@JsonProperty("aliases") List<String> aliases,
		@JsonProperty("ttl") String ttl,
		@JsonProperty("parser") ParserSpec parserSpec,
		@JsonProperty("required_field") String requiredField,
		@JsonProperty("schedule") ScheduleSpec schedule) {

	public static final String ID_PLACEHOLDER = "{id}";

	public FeedDefinition {
		aliases = aliases == null ? List.of() : List.copyOf(aliases);
	}

	/** How the page is turned into a payload */
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ParserSpec(
			@JsonProperty("type") String type,
			@JsonProperty("selector") String selector,
			@JsonProperty("cell_selector") String cellSelector) {}

	/** When the feed is refreshed without anybody asking for it */
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ScheduleSpec(
			@JsonProperty("mode") String mode,
			@JsonProperty("zone") String zone,
			@JsonProperty("not_before") Integer notBefore,
			@JsonProperty("failure_policy") String failurePolicy) {

		public boolean isMidnight() {
			return "midnight".equalsIgnoreCase(mode);
		}

		public int notBeforeHour() {
			return notBefore == null ? 0 : notBefore;
		}

		public FailurePolicy policy() {
			if (failurePolicy == null || failurePolicy.isBlank()) {
				return FailurePolicy.MARK_FIRED;
			}
			try {
				return FailurePolicy.valueOf(failurePolicy.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
			} catch (IllegalArgumentException e) {
				throw new ConfigException("Unknown failure policy: " + failurePolicy, e);
			}
		}
	}

	/** The TTL as a duration, null when the feed never expires by age */
	public Duration ttlDuration() {
		if (ttl == null || ttl.isBlank()) {
			return null;
		}
		return DurationParser.require("feed " + key + " ttl", ttl);
	}

	public FreshnessPolicy policy() {
		FreshnessPolicy policy = new FreshnessPolicy(ttlDuration(), null);
		if (requiredField != null && !requiredField.isBlank()) {
			policy = policy.requiring(FreshnessPolicy.hasField(requiredField));
		}
		return policy;
	}

	public boolean needsId() {
		return path != null && path.contains(ID_PLACEHOLDER);
	}

	/** The cache key, {@code key} or {@code key:id} for per-id pages */
	public String cacheKey(String id) {
		return id == null || id.isBlank() ? key : key + ":" + id;
	}

	/** The page path, with the id URL-encoded into the placeholder for per-id pages */
	public String path(String id) {
		if (needsId()) {
			if (id == null || id.isBlank()) {
				throw new ConfigException("Feed " + key + " needs an id");
			}
			return path.replace(ID_PLACEHOLDER, URLEncoder.encode(id, StandardCharsets.UTF_8));
		}
		return path;
	}

	public PageParser parser() {
		if (parserSpec == null || parserSpec.type() == null) {
			throw new ConfigException("Feed " + key + " has no parser");
		}
		if (parserSpec.selector() == null || parserSpec.selector().isBlank()) {
			throw new ConfigException("Feed " + key + " has no parser selector");
		}
		return switch (parserSpec.type().toLowerCase(Locale.ROOT)) {
			case "rows" -> new RowsPageParser(parserSpec.selector(), parserSpec.cellSelector());
			case "text" -> new TextPageParser(parserSpec.selector());
			default -> throw new ConfigException("Unknown parser type for feed " + key + ": " + parserSpec.type());
		};
	}

	public String displayName() {
		return name != null && !name.isBlank() ? name : key;
	}
}
