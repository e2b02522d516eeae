package dev.jbang.sitecache.client;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs network tasks strictly one at a time, in the order they were submitted. Each task gets a
 * fixed time budget. A task that overruns it fails, is interrupted and has its exchange aborted,
 * and the next task only starts once the overrunning one has actually returned.
 */
public class RequestSerializer implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(RequestSerializer.class);

	private final ExecutorService dispatcher;
	private final ExecutorService workers;
	private final Duration timeout;
	private final Runnable onAbort;
	private final AtomicInteger queuedTasks = new AtomicInteger(0);
	private final AtomicInteger completedTasks = new AtomicInteger(0);
	private final AtomicInteger failedTasks = new AtomicInteger(0);
	private final Set<CompletableFuture<?>> pending = ConcurrentHashMap.newKeySet();
	private volatile boolean closed;

	public RequestSerializer(Duration timeout) {
		this(timeout, () -> {});
	}

	/** @param onAbort called when a task overruns its budget, to abort whatever I/O it is blocked on */
	public RequestSerializer(Duration timeout, Runnable onAbort) {
		this.timeout = timeout;
		this.onAbort = onAbort;
		this.dispatcher = Executors.newSingleThreadExecutor(daemonThreads("request-dispatcher"));
		this.workers = Executors.newCachedThreadPool(daemonThreads("request-worker"));
	}

	/**
	 * Queue a task. The returned future completes with the task's result, or exceptionally with
	 * whatever the task threw, or with a {@link TransportException} when it timed out.
	 *
	 * @throws IllegalStateException if the serializer has been closed
	 */
	public <T> CompletableFuture<T> submit(String label, Callable<T> task) {
		if (closed) {
			throw new IllegalStateException("Request serializer is closed, rejecting " + label);
		}
		CompletableFuture<T> result = new CompletableFuture<>();
		pending.add(result);
		result.whenComplete((r, e) -> pending.remove(result));
		queuedTasks.incrementAndGet();
		try {
			dispatcher.execute(() -> dispatch(label, task, result));
		} catch (RejectedExecutionException e) {
			queuedTasks.decrementAndGet();
			pending.remove(result);
			throw new IllegalStateException("Request serializer is closed, rejecting " + label, e);
		}
		return result;
	}

	private <T> void dispatch(String label, Callable<T> task, CompletableFuture<T> result) {
		queuedTasks.decrementAndGet();
		CompletableFuture<T> attempt = new CompletableFuture<>();
		CountDownLatch finished = new CountDownLatch(1);
		AtomicReference<Thread> runner = new AtomicReference<>();
		try {
			workers.execute(() -> {
				runner.set(Thread.currentThread());
				try {
					attempt.complete(task.call());
				} catch (Throwable e) {
					attempt.completeExceptionally(e);
				} finally {
					runner.set(null);
					finished.countDown();
				}
			});
		} catch (RejectedExecutionException e) {
			failedTasks.incrementAndGet();
			result.completeExceptionally(new IllegalStateException("Request serializer is closed", e));
			return;
		}
		try {
			T value = attempt.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
			completedTasks.incrementAndGet();
			result.complete(value);
		} catch (TimeoutException e) {
			failedTasks.incrementAndGet();
			logger.warn("Request '{}' timed out after {} ms, aborting it", label, timeout.toMillis());
			stop(runner);
			result.completeExceptionally(
					new TransportException("Request '" + label + "' timed out after " + timeout.toMillis() + " ms", e));
			awaitFinished(label, finished, runner);
		} catch (ExecutionException e) {
			failedTasks.incrementAndGet();
			logger.debug("Request '{}' failed: {}", label, e.getCause().getMessage());
			result.completeExceptionally(e.getCause());
		} catch (InterruptedException e) {
			stop(runner);
			failedTasks.incrementAndGet();
			Thread.currentThread().interrupt();
			result.completeExceptionally(new TransportException("Request '" + label + "' interrupted", e));
		}
		logger.debug(
				"Requests: {} queued, {} completed, {} failed",
				queuedTasks.get(),
				completedTasks.get(),
				failedTasks.get());
	}

	private void stop(AtomicReference<Thread> runner) {
		Thread thread = runner.get();
		if (thread != null) {
			thread.interrupt();
		}
		onAbort.run();
	}

	// The next task must not start while the timed out one can still reach the host
	private void awaitFinished(String label, CountDownLatch finished, AtomicReference<Thread> runner) {
		try {
			while (!finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
				logger.warn("Request '{}' is still running after being aborted, holding the queue", label);
				stop(runner);
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	public int getCompletedCount() {
		return completedTasks.get();
	}

	public int getFailedCount() {
		return failedTasks.get();
	}

	public boolean isClosed() {
		return closed;
	}

	/** Stop accepting tasks. Tasks still waiting in the queue fail with an IllegalStateException. */
	@Override
	public void close() {
		closed = true;
		dispatcher.shutdownNow();
		workers.shutdownNow();
		for (CompletableFuture<?> future : pending) {
			future.completeExceptionally(new IllegalStateException("Request serializer closed"));
		}
		logger.debug("Request serializer closed ({} completed, {} failed)", completedTasks.get(), failedTasks.get());
	}

	private static ThreadFactory daemonThreads(String name) {
		AtomicInteger counter = new AtomicInteger();
		return r -> {
			Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
			t.setDaemon(true);
			return t;
		};
	}
}
