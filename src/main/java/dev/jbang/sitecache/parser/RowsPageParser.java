package dev.jbang.sitecache.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.jbang.sitecache.util.JsonUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;

/**
 * Extracts table-like rows: every element matching the row selector becomes an array of the
 * trimmed texts of its cells. The payload looks like {@code {"rows": [["a", "b"], ...]}}.
 */
public class RowsPageParser implements PageParser {
	private final String rowSelector;
	private final String cellSelector;

	public RowsPageParser(String rowSelector) {
		this(rowSelector, "td");
	}

	public RowsPageParser(String rowSelector, String cellSelector) {
		this.rowSelector = rowSelector;
		this.cellSelector = cellSelector == null || cellSelector.isBlank() ? "td" : cellSelector;
	}

	@Override
	public JsonNode parse(String html) {
		Document doc = Jsoup.parse(html);
		ObjectNode result = JsonUtils.objectNode();
		ArrayNode rows = result.putArray("rows");
		try {
			for (Element row : doc.select(rowSelector)) {
				Elements cells = row.select(cellSelector);
				if (cells.isEmpty()) {
					// header rows only have th cells
					continue;
				}
				ArrayNode values = rows.addArray();
				for (Element cell : cells) {
					values.add(cell.text().trim());
				}
			}
		} catch (Selector.SelectorParseException | IllegalArgumentException e) {
			throw new PageParseException("Invalid selector '" + rowSelector + "' / '" + cellSelector + "'", e);
		}
		return result;
	}
}
