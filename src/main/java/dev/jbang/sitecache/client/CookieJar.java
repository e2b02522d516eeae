package dev.jbang.sitecache.client;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Session cookies collected from {@code Set-Cookie} response headers. Cookies are only ever added
 * or overwritten, the most recent value for a name wins.
 */
public class CookieJar {
	private final Map<String, String> cookies = new LinkedHashMap<>();

	/** Merge all {@code Set-Cookie} header values of a response into the jar */
	public synchronized void merge(List<String> setCookieHeaders) {
		for (String line : setCookieHeaders) {
			String[] pair = parseCookiePair(line);
			if (pair != null) {
				cookies.put(pair[0], pair[1]);
			}
		}
	}

	public synchronized void put(String name, String value) {
		cookies.put(name, value);
	}

	public synchronized Optional<String> get(String name) {
		return Optional.ofNullable(cookies.get(name));
	}

	public synchronized int size() {
		return cookies.size();
	}

	/** The value for an outgoing {@code Cookie} header, empty if there are no cookies yet */
	public synchronized String header() {
		return cookies.entrySet().stream()
				.map(e -> e.getKey() + "=" + e.getValue())
				.collect(Collectors.joining("; "));
	}

	public synchronized Map<String, String> snapshot() {
		return Map.copyOf(cookies);
	}

	/**
	 * Extract name and value from a single {@code Set-Cookie} line. Attributes like Path or HttpOnly
	 * are ignored.
	 *
	 * @return a two element array, or null if the line holds no usable cookie
	 */
	static String[] parseCookiePair(String setCookieLine) {
		if (setCookieLine == null) {
			return null;
		}
		String first = setCookieLine.split(";", 2)[0];
		int eq = first.indexOf('=');
		if (eq <= 0) {
			return null;
		}
		String name = first.substring(0, eq).trim();
		String value = first.substring(eq + 1).trim();
		if (name.isEmpty()) {
			return null;
		}
		return new String[] {name, value};
	}
}
