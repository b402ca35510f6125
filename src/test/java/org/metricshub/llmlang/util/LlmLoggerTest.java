package org.metricshub.llmlang.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.metricshub.llmlang.LlmLang;
import org.metricshub.llmlang.backend.Engine;
import org.metricshub.llmlang.backend.ParallelExecutor;
import org.metricshub.llmlang.modify.ModifyManager;

public class LlmLoggerTest {

	@Test
	public void testLoggersShareTheInterpreterRoot() {
		for (Class<?> clazz : new Class<?>[] { LlmLang.class, Engine.class, ParallelExecutor.class, ModifyManager.class }) {
			String name = LlmLogger.getLogger(clazz).getName();
			assertEquals(clazz.getName(), name);
			assertTrue(name, name.startsWith(LlmLogger.ROOT_LOGGER_NAME + "."));
		}
	}
}
