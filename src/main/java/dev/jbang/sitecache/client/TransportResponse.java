package dev.jbang.sitecache.client;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The parts of an HTTP response the client needs. Header names are stored in lower case, every
 * value of a repeated header (like {@code Set-Cookie}) is kept.
 */
public record TransportResponse(int statusCode, Map<String, List<String>> headers, String body) {

	public TransportResponse {
		Map<String, List<String>> normalized = new LinkedHashMap<>();
		for (var entry : headers.entrySet()) {
			normalized.put(entry.getKey().toLowerCase(Locale.ROOT), List.copyOf(entry.getValue()));
		}
		headers = Map.copyOf(normalized);
		body = body == null ? "" : body;
	}

	public Optional<String> header(String name) {
		return headers(name).stream().findFirst();
	}

	public List<String> headers(String name) {
		return headers.getOrDefault(name.toLowerCase(Locale.ROOT), List.of());
	}

	public List<String> setCookies() {
		return headers("Set-Cookie");
	}

	public boolean isSuccess() {
		return statusCode >= 200 && statusCode < 300;
	}

	public boolean isRedirect() {
		return statusCode >= 300 && statusCode < 400;
	}
}
