package org.metricshub.llmlang.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.Test;
import org.metricshub.llmlang.jrt.LlmRuntimeException;
import org.metricshub.llmlang.jrt.RuntimeErrorKind;

public class ParallelExecutorTest {

	@Test
	public void testResultsKeepBranchOrder() {
		List<ParallelExecutor.Branch<Integer>> branches = new ArrayList<ParallelExecutor.Branch<Integer>>();
		branches.add(new ParallelExecutor.Branch<Integer>("slow", () -> {
			Thread.sleep(100);
			return 1;
		}));
		branches.add(new ParallelExecutor.Branch<Integer>("quick", () -> 2));
		List<ParallelExecutor.BranchResult<Integer>> results = new ParallelExecutor(4).execute(branches, null);
		assertEquals(2, results.size());
		assertEquals("slow", results.get(0).getName());
		assertEquals(Integer.valueOf(1), results.get(0).getValue());
		assertEquals(Integer.valueOf(2), results.get(1).getValue());
		assertTrue(results.get(0).getElapsedNanos() >= TimeUnit.MILLISECONDS.toNanos(100));
	}

	@Test
	public void testBranchesRunConcurrently() {
		CountDownLatch latch = new CountDownLatch(2);
		List<ParallelExecutor.Branch<Boolean>> branches = new ArrayList<ParallelExecutor.Branch<Boolean>>();
		for (String name : new String[] { "a", "b" }) {
			branches.add(new ParallelExecutor.Branch<Boolean>(name, () -> {
				latch.countDown();
				return latch.await(5, TimeUnit.SECONDS);
			}));
		}
		for (ParallelExecutor.BranchResult<Boolean> result : new ParallelExecutor(2).execute(branches, 10_000L)) {
			assertEquals(Boolean.TRUE, result.getValue());
		}
	}

	@Test
	public void testFailuresAreCapturedPerBranch() {
		List<ParallelExecutor.Branch<String>> branches = new ArrayList<ParallelExecutor.Branch<String>>();
		branches.add(new ParallelExecutor.Branch<String>("broken", () -> {
			throw new LlmRuntimeException(RuntimeErrorKind.DIVISION_BY_ZERO, "Division by zero");
		}));
		branches.add(new ParallelExecutor.Branch<String>("fine", () -> "ok"));
		List<ParallelExecutor.BranchResult<String>> results = new ParallelExecutor(2).execute(branches, null);
		assertTrue(!results.get(0).isSuccess());
		assertNull(results.get(0).getValue());
		assertEquals(RuntimeErrorKind.DIVISION_BY_ZERO, ((LlmRuntimeException) results.get(0).getError()).getKind());
		assertTrue(results.get(1).isSuccess());
		assertEquals("ok", results.get(1).getValue());
	}

	@Test
	public void testCheckedExceptionsAreWrapped() {
		List<ParallelExecutor.Branch<String>> branches = new ArrayList<ParallelExecutor.Branch<String>>();
		branches.add(new ParallelExecutor.Branch<String>("io", () -> {
			throw new IOException("disk");
		}));
		ParallelExecutor.BranchResult<String> result = new ParallelExecutor(1).execute(branches, null).get(0);
		assertTrue(result.getError() instanceof IllegalStateException);
	}

	@Test
	public void testTimeLimit() {
		List<ParallelExecutor.Branch<Integer>> branches = new ArrayList<ParallelExecutor.Branch<Integer>>();
		branches.add(new ParallelExecutor.Branch<Integer>("sleepy", () -> {
			Thread.sleep(10_000);
			return 0;
		}));
		LlmRuntimeException e = assertThrows(
				LlmRuntimeException.class,
				() -> new ParallelExecutor(1).execute(branches, 50L));
		assertEquals(RuntimeErrorKind.TIME_LIMIT_EXCEEDED, e.getKind());
		assertEquals(50, e.getExpected());
	}

	@Test
	public void testNoBranches() {
		assertTrue(new ParallelExecutor(1).execute(new ArrayList<ParallelExecutor.Branch<Integer>>(), 10L).isEmpty());
	}

	@Test
	public void testThreadCountMustBePositive() {
		assertThrows(IllegalArgumentException.class, () -> new ParallelExecutor(0));
		assertEquals(3, new ParallelExecutor(3).getMaxThreads());
	}

	@Test
	public void testExecuteWithTimeout() {
		assertEquals("done", ParallelExecutor.executeWithTimeout(() -> "done", 5_000L));
		assertEquals(Integer.valueOf(7), ParallelExecutor.executeWithTimeout(() -> 7, null));

		LlmRuntimeException timeout = assertThrows(
				LlmRuntimeException.class,
				() -> ParallelExecutor.executeWithTimeout(() -> {
					Thread.sleep(10_000);
					return null;
				}, 50L));
		assertEquals(RuntimeErrorKind.TIME_LIMIT_EXCEEDED, timeout.getKind());

		IllegalStateException rethrown = assertThrows(
				IllegalStateException.class,
				() -> ParallelExecutor.executeWithTimeout(() -> {
					throw new IllegalStateException("as is");
				}, null));
		assertEquals("as is", rethrown.getMessage());
	}

	@Test
	public void testWorkerStackAbsorbsDeepRecursion() {
		assertEquals(Integer.valueOf(20_000), ParallelExecutor.executeWithTimeout(() -> depth(20_000), null));
	}

	private static int depth(int remaining) {
		return remaining == 0 ? 0 : 1 + depth(remaining - 1);
	}
}
