package dev.jbang.sitecache.schedule;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/** Calendar arithmetic in one named time zone */
public class ZonedCalendar {
	private final ZoneId zone;

	public ZonedCalendar(ZoneId zone) {
		this.zone = zone;
	}

	/**
	 * @throws IllegalArgumentException for an unknown zone id
	 */
	public static ZonedCalendar of(String zoneId) {
		try {
			return new ZonedCalendar(ZoneId.of(zoneId));
		} catch (DateTimeException e) {
			throw new IllegalArgumentException("Unknown time zone: " + zoneId, e);
		}
	}

	public ZoneId zone() {
		return zone;
	}

	/** The local date of the instant in this zone, formatted yyyy-MM-dd */
	public String dateKey(Instant instant) {
		return DateTimeFormatter.ISO_LOCAL_DATE.format(instant.atZone(zone).toLocalDate());
	}

	public int hour(Instant instant) {
		return instant.atZone(zone).getHour();
	}

	/** The first instant strictly after {@code now} that starts a local day in this zone */
	public Instant nextMidnight(Instant now) {
		LocalDate today = now.atZone(zone).toLocalDate();
		ZonedDateTime start = today.atStartOfDay(zone);
		if (start.toInstant().isAfter(now)) {
			return start.toInstant();
		}
		return today.plusDays(1).atStartOfDay(zone).toInstant();
	}

	public Duration untilNextMidnight(Instant now) {
		return Duration.between(now, nextMidnight(now));
	}

	@Override
	public String toString() {
		return String.valueOf(zone);
	}
}
