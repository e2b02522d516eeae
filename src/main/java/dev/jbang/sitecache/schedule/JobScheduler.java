package dev.jbang.sitecache.schedule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives registered jobs from a single timer thread. Periodic jobs are ticked at a fixed interval
 * starting immediately, midnight jobs run at startup and then at every local midnight.
 */
public class JobScheduler implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(JobScheduler.class);

	static final Duration STARTUP_FALLBACK = Duration.ofMinutes(1);
	static final Duration RESCHEDULE_FALLBACK = Duration.ofHours(24);

	private final Duration tickInterval;
	private final Clock clock;
	private final ScheduledExecutorService executor;
	private final Map<String, ScheduledFuture<?>> jobs = new LinkedHashMap<>();

	public JobScheduler(Duration tickInterval) {
		this(tickInterval, Clock.systemUTC(), Executors.newSingleThreadScheduledExecutor(r -> {
			Thread t = new Thread(r, "job-scheduler");
			t.setDaemon(true);
			return t;
		}));
	}

	public JobScheduler(Duration tickInterval, Clock clock, ScheduledExecutorService executor) {
		this.tickInterval = tickInterval;
		this.clock = clock;
		this.executor = executor;
	}

	/**
	 * Tick the given function every tick interval, the first time right away.
	 *
	 * @throws IllegalStateException if a job with this id is already registered
	 */
	public synchronized void register(String jobId, Runnable tickFn) {
		checkNew(jobId);
		ScheduledFuture<?> future = executor.scheduleAtFixedRate(
				() -> guarded(jobId, tickFn), 0, tickInterval.toMillis(), TimeUnit.MILLISECONDS);
		jobs.put(jobId, future);
		logger.info("Scheduled job {} every {}", jobId, tickInterval);
	}

	public void register(DailyJob job) {
		register(job.id(), job);
	}

	/**
	 * Run the action once now and then at every local midnight of the calendar's zone. The delay
	 * is recomputed for every run so daylight saving changes are followed.
	 */
	public synchronized void registerMidnight(String jobId, ZonedCalendar calendar, JobAction action) {
		checkNew(jobId);
		Runnable tick = () -> runAction(jobId, action);
		jobs.put(jobId, executor.schedule(() -> {
			tick.run();
			scheduleNextMidnight(jobId, calendar, tick, STARTUP_FALLBACK);
		}, 0, TimeUnit.MILLISECONDS));
		logger.info("Scheduled job {} at midnight {}", jobId, calendar);
	}

	private synchronized void scheduleNextMidnight(
			String jobId, ZonedCalendar calendar, Runnable tick, Duration fallback) {
		Instant now = clock.instant();
		Duration delay = delayUntilMidnight(calendar, now, fallback);
		jobs.computeIfPresent(jobId, (id, previous) -> {
			logger.debug("Next run of {} in {}", id, delay);
			return executor.schedule(
					() -> {
						tick.run();
						scheduleNextMidnight(jobId, calendar, tick, RESCHEDULE_FALLBACK);
					},
					delay.toMillis(),
					TimeUnit.MILLISECONDS);
		});
	}

	static Duration delayUntilMidnight(ZonedCalendar calendar, Instant now, Duration fallback) {
		Duration delay;
		try {
			delay = calendar.untilNextMidnight(now);
		} catch (RuntimeException e) {
			logger.warn("Unable to compute next midnight in {}: {}", calendar, e.getMessage());
			return fallback;
		}
		if (delay.isNegative() || delay.isZero()) {
			return fallback;
		}
		return delay;
	}

	private static void runAction(String jobId, JobAction action) {
		try {
			action.run();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.warn("Job {} interrupted", jobId);
		} catch (Exception e) {
			logger.error("Job {} failed", jobId, e);
		}
	}

	private static void guarded(String jobId, Runnable tickFn) {
		try {
			tickFn.run();
		} catch (RuntimeException e) {
			// an exception escaping here cancels the periodic schedule
			logger.error("Tick of job {} failed", jobId, e);
		}
	}

	private void checkNew(String jobId) {
		if (executor.isShutdown()) {
			throw new IllegalStateException("Scheduler is closed");
		}
		if (jobs.containsKey(jobId)) {
			throw new IllegalStateException("Job already registered: " + jobId);
		}
	}

	public synchronized List<String> jobIds() {
		return List.copyOf(jobs.keySet());
	}

	/** Stop a single job, returns false if it was not registered */
	public synchronized boolean cancel(String jobId) {
		ScheduledFuture<?> future = jobs.remove(jobId);
		if (future == null) {
			return false;
		}
		future.cancel(false);
		logger.info("Stopped job {}", jobId);
		return true;
	}

	@Override
	public synchronized void close() {
		for (String jobId : List.copyOf(jobs.keySet())) {
			cancel(jobId);
		}
		executor.shutdownNow();
	}
}
