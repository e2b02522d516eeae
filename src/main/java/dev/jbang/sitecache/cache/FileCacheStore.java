package dev.jbang.sitecache.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.jbang.sitecache.util.JsonUtils;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CacheStore} keeping one JSON file per key in a directory. Files are replaced atomically
 * so a reader never sees a half written entry.
 */
public class FileCacheStore implements CacheStore {
	private static final Logger logger = LoggerFactory.getLogger(FileCacheStore.class);

	private final Path dir;
	private final Clock clock;

	public FileCacheStore(Path dir, Clock clock) {
		this.dir = dir;
		this.clock = clock;
	}

	@Override
	public synchronized CacheEntry upsert(String key, JsonNode payload) {
		CacheEntry previous = get(key).orElse(null);
		CacheEntry entry = new CacheEntry(key, payload.deepCopy(), CacheStore.stamp(clock.instant(), previous));

		ObjectNode node = JsonUtils.objectNode();
		node.put("key", key);
		node.put("updated_at", entry.updatedAt().toString());
		node.set("payload", entry.payload());

		Path file = fileFor(key);
		try {
			Files.createDirectories(dir);
			Path tmp = Files.createTempFile(dir, ".entry", ".tmp");
			try {
				Files.write(tmp, JsonUtils.prettyBytes(node));
				Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			} finally {
				Files.deleteIfExists(tmp);
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to write cache entry " + key, e);
		}
		logger.debug("Stored cache entry {} at {}", key, entry.updatedAt());
		return entry;
	}

	@Override
	public synchronized Optional<CacheEntry> get(String key) {
		Path file = fileFor(key);
		if (!Files.isRegularFile(file)) {
			return Optional.empty();
		}
		try {
			JsonNode node = JsonUtils.mapper().readTree(file.toFile());
			JsonNode payload = node.get("payload");
			JsonNode updatedAt = node.get("updated_at");
			if (payload == null || updatedAt == null) {
				logger.warn("Ignoring incomplete cache file {}", file);
				return Optional.empty();
			}
			return Optional.of(new CacheEntry(key, payload, Instant.parse(updatedAt.asText())));
		} catch (IOException | DateTimeParseException e) {
			// A corrupt entry reads as missing so the next refresh overwrites it
			logger.warn("Ignoring unreadable cache file {}: {}", file, e.getMessage());
			return Optional.empty();
		}
	}

	public Path fileFor(String key) {
		return dir.resolve(URLEncoder.encode(key, StandardCharsets.UTF_8) + ".json");
	}
}
