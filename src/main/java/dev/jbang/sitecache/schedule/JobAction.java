package dev.jbang.sitecache.schedule;

@FunctionalInterface
public interface JobAction {
	void run() throws Exception;
}
