package dev.jbang.sitecache.schedule;

import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an action at most once per local calendar day. Meant to be ticked periodically by a
 * {@link JobScheduler}; each tick checks the hour threshold and whether today already fired.
 */
public class DailyJob implements Runnable {
	private static final Logger logger = LoggerFactory.getLogger(DailyJob.class);

	private final String id;
	private final ZonedCalendar calendar;
	private final JobAction action;
	private int notBeforeHour = 0;
	private FailurePolicy failurePolicy = FailurePolicy.MARK_FIRED;
	private Clock clock = Clock.systemUTC();

	private String lastFiredDateKey;

	private DailyJob(String id, ZonedCalendar calendar, JobAction action) {
		this.id = id;
		this.calendar = calendar;
		this.action = action;
	}

	public static DailyJob create(String id, ZonedCalendar calendar, JobAction action) {
		return new DailyJob(id, calendar, action);
	}

	/** Only fire once the local hour is at least the given hour (0-23) */
	public DailyJob notBefore(int hour) {
		if (hour < 0 || hour > 23) {
			throw new IllegalArgumentException("Hour must be between 0 and 23: " + hour);
		}
		this.notBeforeHour = hour;
		return this;
	}

	public DailyJob failurePolicy(FailurePolicy policy) {
		this.failurePolicy = policy;
		return this;
	}

	public DailyJob clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	public String id() {
		return id;
	}

	@Override
	public void run() {
		tick();
	}

	/**
	 * Check the calendar and run the action if today has not fired yet.
	 *
	 * @return true if the action was started on this tick
	 */
	public synchronized boolean tick() {
		Instant now = clock.instant();
		if (calendar.hour(now) < notBeforeHour) {
			return false;
		}
		String dateKey = calendar.dateKey(now);
		if (dateKey.equals(lastFiredDateKey)) {
			return false;
		}

		if (failurePolicy == FailurePolicy.MARK_FIRED) {
			lastFiredDateKey = dateKey;
		}
		logger.info("Running daily job {} for {}", id, dateKey);
		try {
			action.run();
			lastFiredDateKey = dateKey;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.warn("Daily job {} interrupted", id);
		} catch (Exception e) {
			if (failurePolicy == FailurePolicy.MARK_FIRED) {
				logger.error("Daily job {} failed for {}, next attempt tomorrow", id, dateKey, e);
			} else {
				logger.error("Daily job {} failed for {}, retrying on the next tick", id, dateKey, e);
			}
		}
		return true;
	}

	public synchronized String lastFiredDateKey() {
		return lastFiredDateKey;
	}
}
