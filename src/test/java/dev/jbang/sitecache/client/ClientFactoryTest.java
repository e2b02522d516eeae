package dev.jbang.sitecache.client;

import static org.assertj.core.api.Assertions.*;

import dev.jbang.sitecache.MutableClock;
import dev.jbang.sitecache.config.ConfigException;
import dev.jbang.sitecache.config.Credentials;
import dev.jbang.sitecache.config.SiteConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ClientFactoryTest {
	private final SiteConfig config = SiteConfig.defaults();

	@Test
	void testClientIsCreatedOnceAndReused() {
		// Given
		List<Credentials> created = new ArrayList<>();
		ClientFactory factory = new ClientFactory(
				config, Map.of("RPG_USERNAME", "ash", "RPG_PASSWORD", "pikachu"), credentials -> {
					created.add(credentials);
					return new ScrapingClient(
							config, credentials, new FakeTransport(), MutableClock.at("2024-05-01T00:00:00Z"));
				});
		assertThat(factory.isCreated()).isFalse();

		// When
		ScrapingClient first = factory.get("test");
		ScrapingClient second = factory.get("test");

		// Then
		assertThat(first).isSameAs(second);
		assertThat(created).containsExactly(new Credentials("ash", "pikachu"));
		factory.close();
		assertThat(factory.isCreated()).isFalse();
	}

	@Test
	void testMissingCredentialsFailBeforeCreatingClient() {
		// Given
		List<Credentials> created = new ArrayList<>();
		ClientFactory factory = new ClientFactory(config, Map.of("RPG_USERNAME", "ash"), credentials -> {
			created.add(credentials);
			return null;
		});

		// When/Then
		assertThatThrownBy(() -> factory.get("leaderboard"))
				.isInstanceOf(ConfigException.class)
				.hasMessageContaining("RPG_PASSWORD");
		assertThat(created).isEmpty();
	}
}
