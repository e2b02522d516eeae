package dev.jbang.sitecache.schedule;

/** What a daily job does with the current day when its action fails */
public enum FailurePolicy {
	/** The day counts as done even if the action failed; the next attempt is tomorrow */
	MARK_FIRED,
	/** The day stays open and the next tick tries again */
	RETRY_UNTIL_SUCCESS
}
