package dev.jbang.sitecache.config;

import static org.assertj.core.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CredentialsTest {
	private final SiteConfig config = SiteConfig.defaults();

	@Test
	void testReadFromEnvironment() {
		// When
		Credentials credentials =
				Credentials.fromEnvironment(config, Map.of("RPG_USERNAME", " ash ", "RPG_PASSWORD", "pikachu"));

		// Then
		assertThat(credentials.isConfigured()).isTrue();
		assertThat(credentials.username()).isEqualTo("ash");
		assertThat(credentials.toString()).doesNotContain("pikachu");
	}

	@Test
	void testBlankValuesAreNotConfigured() {
		assertThat(Credentials.isConfigured(config, Map.of("RPG_USERNAME", "ash", "RPG_PASSWORD", "  ")))
				.isFalse();
		assertThat(Credentials.isConfigured(config, Map.of())).isFalse();
	}

	@Test
	void testRequireFailsWithConfigException() {
		assertThatThrownBy(() -> Credentials.require(config, Map.of(), "leaderboard"))
				.isInstanceOf(ConfigException.class)
				.hasMessageContaining("RPG_USERNAME");
	}
}
