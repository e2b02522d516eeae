package dev.jbang.sitecache.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.jbang.sitecache.util.JsonUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;

/** Extracts the text of the first element matching a selector as {@code {"value": "..."}} */
public class TextPageParser implements PageParser {
	private final String selector;

	public TextPageParser(String selector) {
		this.selector = selector;
	}

	@Override
	public JsonNode parse(String html) {
		Element element;
		try {
			element = Jsoup.parse(html).selectFirst(selector);
		} catch (Selector.SelectorParseException | IllegalArgumentException e) {
			throw new PageParseException("Invalid selector '" + selector + "'", e);
		}
		if (element == null) {
			throw new PageParseException("No element matches '" + selector + "'");
		}
		ObjectNode result = JsonUtils.objectNode();
		result.put("value", element.text().trim());
		return result;
	}
}
