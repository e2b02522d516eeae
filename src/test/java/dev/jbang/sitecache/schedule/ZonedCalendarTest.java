package dev.jbang.sitecache.schedule;

import static org.assertj.core.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class ZonedCalendarTest {
	private final ZonedCalendar eastern = ZonedCalendar.of("America/New_York");

	@Test
	void testDateKeyUsesLocalDate() {
		// 03:30 UTC is still the previous evening in New York
		assertThat(eastern.dateKey(Instant.parse("2024-05-02T03:30:00Z"))).isEqualTo("2024-05-01");
		assertThat(eastern.dateKey(Instant.parse("2024-05-02T04:00:00Z"))).isEqualTo("2024-05-02");
		assertThat(eastern.hour(Instant.parse("2024-05-02T13:00:00Z"))).isEqualTo(9);
	}

	@Test
	void testNextMidnightFromEvening() {
		// Given
		Instant tenPm = Instant.parse("2024-05-02T02:00:00Z"); // 22:00 EDT on May 1st

		// When
		Instant midnight = eastern.nextMidnight(tenPm);

		// Then
		assertThat(midnight).isEqualTo(Instant.parse("2024-05-02T04:00:00Z"));
		assertThat(midnight.atZone(eastern.zone()).toLocalTime()).isEqualTo(LocalTime.MIDNIGHT);
		assertThat(eastern.untilNextMidnight(tenPm)).isEqualTo(Duration.ofHours(2));
	}

	@Test
	void testNextMidnightIsStrictlyAfterNow() {
		// Given
		Instant midnight = Instant.parse("2024-05-02T04:00:00Z");

		// When/Then
		assertThat(eastern.nextMidnight(midnight)).isEqualTo(Instant.parse("2024-05-03T04:00:00Z"));
	}

	@Test
	void testNextMidnightAcrossDstChanges() {
		// Spring forward on 2024-03-10: the day is 23 hours long
		Instant springStart = Instant.parse("2024-03-10T05:00:00Z");
		Instant afterSpring = eastern.nextMidnight(springStart);
		assertThat(afterSpring).isEqualTo(Instant.parse("2024-03-11T04:00:00Z"));
		assertThat(Duration.between(springStart, afterSpring)).isEqualTo(Duration.ofHours(23));

		// Fall back on 2024-11-03: the day is 25 hours long
		Instant fallStart = Instant.parse("2024-11-03T04:00:00Z");
		Instant afterFall = eastern.nextMidnight(fallStart);
		assertThat(afterFall).isEqualTo(Instant.parse("2024-11-04T05:00:00Z"));
		assertThat(Duration.between(fallStart, afterFall)).isEqualTo(Duration.ofHours(25));
		assertThat(afterFall.atZone(eastern.zone()).toLocalTime()).isEqualTo(LocalTime.MIDNIGHT);
	}

	@Test
	void testZoneWhereMidnightDoesNotExist() {
		// Sao Paulo skipped midnight when DST started on 2018-11-04, the day began at 01:00
		ZonedCalendar saoPaulo = new ZonedCalendar(ZoneId.of("America/Sao_Paulo"));
		Instant evening = Instant.parse("2018-11-04T01:00:00Z"); // 22:00 on Nov 3rd

		Instant next = saoPaulo.nextMidnight(evening);

		assertThat(next).isAfter(evening);
		assertThat(saoPaulo.dateKey(next)).isEqualTo("2018-11-04");
		assertThat(next.atZone(saoPaulo.zone()).toLocalTime()).isEqualTo(LocalTime.of(1, 0));
	}

	@Test
	void testUnknownZone() {
		assertThatThrownBy(() -> ZonedCalendar.of("Mars/Olympus")).isInstanceOf(IllegalArgumentException.class);
	}
}
