package dev.jbang.sitecache.client;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/** A single outgoing HTTP request, independent of the HTTP library that executes it */
public record TransportRequest(String method, URI uri, Map<String, String> headers, String body) {

	public TransportRequest {
		headers = Map.copyOf(headers);
	}

	public static TransportRequest get(URI uri) {
		return new TransportRequest("GET", uri, Map.of(), null);
	}

	/** A POST carrying an already URL-encoded form body */
	public static TransportRequest post(URI uri, String formBody) {
		return new TransportRequest("POST", uri, Map.of(), formBody == null ? "" : formBody);
	}

	/** Copy of this request with the given header added or replaced */
	public TransportRequest withHeader(String name, String value) {
		Map<String, String> copy = new LinkedHashMap<>(headers);
		copy.put(name, value);
		return new TransportRequest(method, uri, copy, body);
	}

	public boolean hasBody() {
		return body != null;
	}
}
