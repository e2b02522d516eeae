package dev.jbang.sitecache.client;

import static org.assertj.core.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class CookieJarTest {

	@Test
	void testMergeKeepsNameAndValueOnly() {
		// Given
		CookieJar jar = new CookieJar();

		// When
		jar.merge(List.of("PHPSESSID=abc123; path=/; HttpOnly", "  user = ash ; Secure"));

		// Then
		assertThat(jar.snapshot()).containsEntry("PHPSESSID", "abc123").containsEntry("user", "ash");
		assertThat(jar.size()).isEqualTo(2);
	}

	@Test
	void testMostRecentValueWins() {
		// Given
		CookieJar jar = new CookieJar();
		jar.merge(List.of("PHPSESSID=first"));

		// When
		jar.merge(List.of("PHPSESSID=second; path=/"));

		// Then
		assertThat(jar.get("PHPSESSID")).contains("second");
		assertThat(jar.size()).isEqualTo(1);
	}

	@Test
	void testValueMayContainEquals() {
		// When
		String[] pair = CookieJar.parseCookiePair("token=a=b==; path=/");

		// Then
		assertThat(pair).containsExactly("token", "a=b==");
	}

	@Test
	void testMalformedCookiesAreIgnored() {
		// Given
		CookieJar jar = new CookieJar();

		// When
		jar.merge(List.of("=nameless", "novalue", "", " ; path=/"));

		// Then
		assertThat(jar.size()).isZero();
		assertThat(CookieJar.parseCookiePair(null)).isNull();
	}

	@Test
	void testHeaderJoinsCookiesInInsertionOrder() {
		// Given
		CookieJar jar = new CookieJar();
		assertThat(jar.header()).isEmpty();

		// When
		jar.put("a", "1");
		jar.put("b", "2");

		// Then
		assertThat(jar.header()).isEqualTo("a=1; b=2");
	}
}
