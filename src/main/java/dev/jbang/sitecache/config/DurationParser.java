package dev.jbang.sitecache.config;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parses the short duration notation used in configuration files (e.g. "30", "10s", "5m", "2h") */
public final class DurationParser {
	private static final Pattern DURATION_PATTERN =
			Pattern.compile("^(\\d+)\\s*(s|sec|secs|seconds?|m|min|mins|minutes?|h|hr|hrs|hours?|d|days?|w|weeks?)?$");

	private DurationParser() {}

	/**
	 * Parse a duration string. A bare number is read as seconds.
	 *
	 * @param text Duration string with format [number][unit]
	 * @return Duration object or null if format is invalid
	 */
	public static Duration parse(String text) {
		if (text == null) {
			return null;
		}
		Matcher matcher = DURATION_PATTERN.matcher(text.trim().toLowerCase(Locale.ROOT));
		if (!matcher.matches()) {
			return null;
		}

		long amount = Long.parseLong(matcher.group(1));
		String unit = matcher.group(2);
		if (unit == null) {
			return Duration.ofSeconds(amount);
		}

		return switch (unit.charAt(0)) {
			case 's' -> Duration.ofSeconds(amount);
			case 'm' -> Duration.ofMinutes(amount);
			case 'h' -> Duration.ofHours(amount);
			case 'd' -> Duration.ofDays(amount);
			case 'w' -> Duration.ofDays(amount * 7);
			default -> null;
		};
	}

	/** Like {@link #parse(String)} but falls back to the given default for blank or invalid input */
	public static Duration parse(String text, Duration defaultValue) {
		Duration d = parse(text);
		return d != null ? d : defaultValue;
	}

	/** Like {@link #parse(String)} but rejects invalid input with a {@link ConfigException} */
	public static Duration require(String name, String text) {
		Duration d = parse(text);
		if (d == null) {
			throw new ConfigException("Invalid duration for " + name + ": '" + text + "'");
		}
		return d;
	}
}
