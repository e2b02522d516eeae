package dev.jbang.sitecache.parser;

import com.fasterxml.jackson.databind.JsonNode;

/** Turns the raw HTML of a page into the structured payload that gets cached. Must be side effect free. */
@FunctionalInterface
public interface PageParser {
	JsonNode parse(String html);
}
