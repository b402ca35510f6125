package org.metricshub.llmlang.backend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * LLM.lang
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 - 2026 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.metricshub.llmlang.jrt.LlmRuntimeException;
import org.metricshub.llmlang.jrt.RuntimeErrorKind;
import org.metricshub.llmlang.util.LlmLogger;
import org.slf4j.Logger;

/**
 * Runs named branches of work on a bounded pool of threads and joins all of
 * them before returning.
 * <p>
 * Worker threads get a large stack, since branches run the recursive
 * interpreter.
 */
public class ParallelExecutor {

	private static final Logger LOGGER = LlmLogger.getLogger(ParallelExecutor.class);

	/** Stack size of worker threads */
	static final long WORKER_STACK_SIZE = 64L * 1024 * 1024;

	private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

	/**
	 * One unit of work with the name it is reported under.
	 *
	 * @param <T> result type
	 */
	public static final class Branch<T> {
		private final String name;
		private final Callable<T> body;

		public Branch(String name, Callable<T> body) {
			this.name = Objects.requireNonNull(name, "Branch name must not be null");
			this.body = Objects.requireNonNull(body, "Branch body must not be null");
		}

		public String getName() {
			return name;
		}
	}

	/**
	 * Outcome of one branch: its value or its failure, and how long it ran.
	 *
	 * @param <T> result type
	 */
	public static final class BranchResult<T> {
		private final String name;
		private final T value;
		private final RuntimeException error;
		private final long elapsedNanos;

		BranchResult(String name, T value, RuntimeException error, long elapsedNanos) {
			this.name = name;
			this.value = value;
			this.error = error;
			this.elapsedNanos = elapsedNanos;
		}

		public String getName() {
			return name;
		}

		/**
		 * @return the value, {@code null} when the branch failed
		 */
		public T getValue() {
			return value;
		}

		/**
		 * @return the failure, {@code null} when the branch succeeded
		 */
		public RuntimeException getError() {
			return error;
		}

		public boolean isSuccess() {
			return error == null;
		}

		/**
		 * @return wall time spent running the branch, queueing excluded
		 */
		public long getElapsedNanos() {
			return elapsedNanos;
		}
	}

	private final int maxThreads;

	/**
	 * @param maxThreads maximum number of branches running at once
	 */
	public ParallelExecutor(int maxThreads) {
		if (maxThreads < 1) {
			throw new IllegalArgumentException("At least one thread is required: " + maxThreads);
		}
		this.maxThreads = maxThreads;
	}

	public int getMaxThreads() {
		return maxThreads;
	}

	/**
	 * Runs every branch and waits for all of them. A branch failing with a
	 * runtime exception is reported in its result; it does not stop the others.
	 *
	 * @param branches branches to run
	 * @param timeoutMillis overall time budget, {@code null} for none
	 * @param <T> result type
	 * @return one result per branch, in the order of {@code branches}
	 * @throws LlmRuntimeException {@link RuntimeErrorKind#TIME_LIMIT_EXCEEDED}
	 *         when the budget runs out (unfinished branches are cancelled), or
	 *         {@link RuntimeErrorKind#INTERRUPTED} when the caller is interrupted
	 */
	public <T> List<BranchResult<T>> execute(List<Branch<T>> branches, Long timeoutMillis) {
		List<BranchResult<T>> results = new ArrayList<BranchResult<T>>();
		if (branches.isEmpty()) {
			return results;
		}
		ExecutorService pool = Executors
				.newFixedThreadPool(Math.min(branches.size(), maxThreads), threadFactory("llm-parallel"));
		List<Future<BranchResult<T>>> futures = new ArrayList<Future<BranchResult<T>>>();
		try {
			for (Branch<T> branch : branches) {
				futures.add(pool.submit(() -> run(branch)));
			}
			long deadline = timeoutMillis == null ? 0 : System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
			for (Future<BranchResult<T>> future : futures) {
				BranchResult<T> result;
				if (timeoutMillis == null) {
					result = future.get();
				} else {
					result = future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
				}
				LOGGER.debug("Branch '{}' finished in {} ms", result.getName(), TimeUnit.NANOSECONDS.toMillis(result.getElapsedNanos()));
				results.add(result);
			}
			return results;
		} catch (TimeoutException e) {
			throw new LlmRuntimeException(
					RuntimeErrorKind.TIME_LIMIT_EXCEEDED,
					"Parallel execution exceeded the time limit of " + timeoutMillis + " ms",
					null,
					timeoutMillis,
					timeoutMillis,
					e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new LlmRuntimeException(RuntimeErrorKind.INTERRUPTED, "Interrupted while waiting for parallel paths", null, e);
		} catch (ExecutionException e) {
			throw unwrap(e);
		} finally {
			for (Future<BranchResult<T>> future : futures) {
				future.cancel(true);
			}
			pool.shutdownNow();
		}
	}

	/**
	 * Runs a single task on its own worker thread, with the large worker
	 * stack, and gives up waiting after {@code timeoutMillis}, interrupting the
	 * task.
	 *
	 * @param task the task
	 * @param timeoutMillis time budget, {@code null} to wait for completion
	 * @param <T> result type
	 * @return the task result
	 * @throws LlmRuntimeException {@link RuntimeErrorKind#TIME_LIMIT_EXCEEDED}
	 *         on timeout; runtime exceptions of the task are rethrown as is
	 */
	public static <T> T executeWithTimeout(Callable<T> task, Long timeoutMillis) {
		ExecutorService single = Executors.newSingleThreadExecutor(threadFactory("llm-main"));
		Future<T> future = single.submit(task);
		try {
			if (timeoutMillis == null) {
				return future.get();
			}
			return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
		} catch (TimeoutException e) {
			throw new LlmRuntimeException(
					RuntimeErrorKind.TIME_LIMIT_EXCEEDED,
					"Execution exceeded the time limit of " + timeoutMillis + " ms",
					null,
					timeoutMillis,
					timeoutMillis,
					e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new LlmRuntimeException(RuntimeErrorKind.INTERRUPTED, "Interrupted while waiting for execution", null, e);
		} catch (ExecutionException e) {
			throw unwrap(e);
		} finally {
			future.cancel(true);
			single.shutdownNow();
		}
	}

	private static <T> BranchResult<T> run(Branch<T> branch) {
		long start = System.nanoTime();
		try {
			T value = branch.body.call();
			return new BranchResult<T>(branch.name, value, null, System.nanoTime() - start);
		} catch (RuntimeException e) {
			return new BranchResult<T>(branch.name, null, e, System.nanoTime() - start);
		} catch (StackOverflowError e) {
			LlmRuntimeException overflow = new LlmRuntimeException(
					RuntimeErrorKind.STACK_OVERFLOW,
					"Stack overflow in path '" + branch.name + "'",
					null,
					e);
			return new BranchResult<T>(branch.name, null, overflow, System.nanoTime() - start);
		} catch (Exception e) {
			return new BranchResult<T>(branch.name, null, new IllegalStateException(e), System.nanoTime() - start);
		}
	}

	private static RuntimeException unwrap(ExecutionException e) {
		Throwable cause = e.getCause();
		if (cause instanceof RuntimeException) {
			return (RuntimeException) cause;
		}
		if (cause instanceof StackOverflowError) {
			return new LlmRuntimeException(RuntimeErrorKind.STACK_OVERFLOW, "Stack overflow", null, cause);
		}
		if (cause instanceof Error) {
			throw (Error) cause;
		}
		return new IllegalStateException(cause);
	}

	private static ThreadFactory threadFactory(String prefix) {
		final int pool = POOL_COUNTER.incrementAndGet();
		final AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(null, runnable, prefix + "-" + pool + "-" + counter.incrementAndGet(), WORKER_STACK_SIZE);
			thread.setDaemon(true);
			return thread;
		};
	}
}
