package dev.jbang.sitecache.client;

import static org.assertj.core.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RequestSerializerTest {
	private RequestSerializer serializer;

	@AfterEach
	void tearDown() {
		if (serializer != null) {
			serializer.close();
		}
	}

	@Test
	void testTasksRunInSubmissionOrderWithoutOverlap() throws Exception {
		// Given
		serializer = new RequestSerializer(Duration.ofSeconds(5));
		List<Integer> order = Collections.synchronizedList(new ArrayList<>());
		AtomicInteger running = new AtomicInteger();
		AtomicBoolean overlapped = new AtomicBoolean();
		List<CompletableFuture<Integer>> futures = new ArrayList<>();

		// When
		for (int i = 0; i < 20; i++) {
			int n = i;
			futures.add(serializer.submit("task " + n, () -> {
				if (running.incrementAndGet() > 1) {
					overlapped.set(true);
				}
				Thread.sleep(2);
				order.add(n);
				running.decrementAndGet();
				return n;
			}));
		}
		CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

		// Then
		assertThat(overlapped).isFalse();
		assertThat(order).hasSize(20).isSorted();
		assertThat(futures.get(7).get()).isEqualTo(7);
		assertThat(serializer.getCompletedCount()).isEqualTo(20);
	}

	@Test
	void testFailingTaskOnlyFailsItsOwnFuture() throws Exception {
		// Given
		serializer = new RequestSerializer(Duration.ofSeconds(5));

		// When
		CompletableFuture<String> failing = serializer.submit("boom", () -> {
			throw new FetchException("boom", 500);
		});
		CompletableFuture<String> next = serializer.submit("ok", () -> "ok");

		// Then
		assertThat(next.get(5, TimeUnit.SECONDS)).isEqualTo("ok");
		assertThatThrownBy(failing::get)
				.isInstanceOf(ExecutionException.class)
				.hasCauseInstanceOf(FetchException.class);
		assertThat(serializer.getFailedCount()).isEqualTo(1);
	}

	@Test
	void testTimedOutTaskIsInterruptedAndQueueMovesOn() throws Exception {
		// Given
		serializer = new RequestSerializer(Duration.ofMillis(200));
		CountDownLatch interrupted = new CountDownLatch(1);

		// When
		CompletableFuture<String> slow = serializer.submit("slow", () -> {
			try {
				Thread.sleep(10_000);
			} catch (InterruptedException e) {
				interrupted.countDown();
				throw e;
			}
			return "too late";
		});
		CompletableFuture<String> next = serializer.submit("next", () -> "next");

		// Then
		assertThat(next.get(5, TimeUnit.SECONDS)).isEqualTo("next");
		assertThatThrownBy(() -> slow.get(5, TimeUnit.SECONDS))
				.isInstanceOf(ExecutionException.class)
				.hasCauseInstanceOf(TransportException.class);
		assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
	}

	@Test
	void testNextTaskWaitsForTimedOutTaskThatIgnoresInterrupts() throws Exception {
		// Given
		AtomicInteger aborts = new AtomicInteger();
		serializer = new RequestSerializer(Duration.ofMillis(200), aborts::incrementAndGet);
		AtomicInteger running = new AtomicInteger();
		AtomicInteger maxRunning = new AtomicInteger();
		Callable<String> stubborn = () -> {
			maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
			long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(600);
			while (System.nanoTime() < deadline) {
				Thread.onSpinWait();
			}
			running.decrementAndGet();
			return "late";
		};

		// When
		CompletableFuture<String> slow = serializer.submit("stubborn", stubborn);
		CompletableFuture<String> next = serializer.submit("next", () -> {
			maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
			running.decrementAndGet();
			return "next";
		});

		// Then
		assertThatThrownBy(() -> slow.get(5, TimeUnit.SECONDS))
				.isInstanceOf(ExecutionException.class)
				.hasCauseInstanceOf(TransportException.class);
		assertThat(next.get(5, TimeUnit.SECONDS)).isEqualTo("next");
		assertThat(maxRunning.get()).isEqualTo(1);
		assertThat(aborts.get()).isPositive();
	}

	@Test
	void testSubmitAfterCloseIsRejected() {
		// Given
		serializer = new RequestSerializer(Duration.ofSeconds(1));

		// When
		serializer.close();

		// Then
		assertThat(serializer.isClosed()).isTrue();
		assertThatThrownBy(() -> serializer.submit("late", () -> "x")).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void testCloseFailsQueuedTasks() throws Exception {
		// Given
		serializer = new RequestSerializer(Duration.ofSeconds(5));
		CountDownLatch started = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		serializer.submit("blocking", () -> {
			started.countDown();
			release.await();
			return "done";
		});
		CompletableFuture<String> queued = serializer.submit("queued", () -> "queued");
		assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

		// When
		serializer.close();

		// Then
		assertThatThrownBy(() -> queued.get(5, TimeUnit.SECONDS))
				.isInstanceOf(ExecutionException.class)
				.hasCauseInstanceOf(IllegalStateException.class);
		release.countDown();
	}
}
