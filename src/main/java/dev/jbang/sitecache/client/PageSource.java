package dev.jbang.sitecache.client;

/** Something that can return the HTML of a site page */
@FunctionalInterface
public interface PageSource {
	String fetchPage(String pathOrUrl);
}
