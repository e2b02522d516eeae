package dev.jbang.sitecache.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.Instantiatable;
import com.fasterxml.jackson.core.util.MinimalPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;

/** Shared Jackson setup for payloads, cache files and the feed catalog */
public final class JsonUtils {

	private static final ObjectMapper mapper = JsonMapper.builder()
			.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.build();

	/**
	 * Two space indentation, {@code "key": value}, no space before colons. Jackson asks for a fresh
	 * instance per write, so the nesting depth is never shared between threads.
	 */
	static final class CompactPrettyPrinter extends MinimalPrettyPrinter
			implements Instantiatable<CompactPrettyPrinter> {
		private int depth = 0;

		@Override
		public CompactPrettyPrinter createInstance() {
			return new CompactPrettyPrinter();
		}

		private void newLine(JsonGenerator g) throws IOException {
			g.writeRaw("\n");
			for (int i = 0; i < depth; i++) {
				g.writeRaw("  ");
			}
		}

		@Override
		public void writeStartArray(JsonGenerator g) throws IOException {
			g.writeRaw('[');
			depth++;
		}

		@Override
		public void beforeArrayValues(JsonGenerator g) throws IOException {
			newLine(g);
		}

		@Override
		public void writeArrayValueSeparator(JsonGenerator g) throws IOException {
			g.writeRaw(',');
			newLine(g);
		}

		@Override
		public void writeEndArray(JsonGenerator g, int values) throws IOException {
			depth--;
			if (values > 0) {
				newLine(g);
			}
			g.writeRaw(']');
		}

		@Override
		public void writeStartObject(JsonGenerator g) throws IOException {
			g.writeRaw('{');
			depth++;
		}

		@Override
		public void beforeObjectEntries(JsonGenerator g) throws IOException {
			newLine(g);
		}

		@Override
		public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
			g.writeRaw(": ");
		}

		@Override
		public void writeObjectEntrySeparator(JsonGenerator g) throws IOException {
			g.writeRaw(',');
			newLine(g);
		}

		@Override
		public void writeEndObject(JsonGenerator g, int entries) throws IOException {
			depth--;
			if (entries > 0) {
				newLine(g);
			}
			g.writeRaw('}');
		}
	}

	private static final ObjectMapper prettyMapper = JsonMapper.builder()
			.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
			.enable(SerializationFeature.INDENT_OUTPUT)
			.defaultPrettyPrinter(new CompactPrettyPrinter())
			.build();

	private JsonUtils() {}

	public static ObjectMapper mapper() {
		return mapper;
	}

	public static ObjectNode objectNode() {
		return JsonNodeFactory.instance.objectNode();
	}

	/** Render a node with the project's pretty printing */
	public static String pretty(JsonNode node) {
		try {
			return prettyMapper.writeValueAsString(node);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	/** Write a node with the project's pretty printing, used for cache files */
	public static byte[] prettyBytes(JsonNode node) {
		try {
			return prettyMapper.writeValueAsBytes(node);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}
}
