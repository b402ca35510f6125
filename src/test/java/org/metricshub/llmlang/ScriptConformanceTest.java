package org.metricshub.llmlang;

import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.stream.Collectors;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

/**
 * Runs each LLM.lang program of the src/test/resources/scripts directory
 * through the command line and compares its output to the corresponding
 * *.ok file.
 */
@RunWith(Parameterized.class)
public class ScriptConformanceTest {

	private static final String SCRIPTS_PATH = "/scripts";
	private static Path scriptsDirectory;

	/**
	 * @return the names of the *.llm programs in /src/test/resources/scripts
	 * @throws Exception when the directory cannot be found
	 */
	@Parameters(name = "{0}")
	public static Iterable<String> scriptList() throws Exception {
		URL scriptsUrl = ScriptConformanceTest.class.getResource(SCRIPTS_PATH);
		if (scriptsUrl == null) {
			throw new IOException("Couldn't find resource " + SCRIPTS_PATH);
		}
		scriptsDirectory = Paths.get(scriptsUrl.toURI());
		if (!scriptsDirectory.toFile().isDirectory()) {
			throw new IOException(SCRIPTS_PATH + " is not a directory");
		}

		return Arrays
				.stream(scriptsDirectory.toFile().listFiles())
				.map(File::getName)
				.filter(name -> name.endsWith(".llm"))
				.sorted()
				.collect(Collectors.toList());
	}

	/** Name of the program to execute */
	@Parameter
	public String scriptName;

	/**
	 * Execute the program stored in {@link #scriptName}
	 *
	 * @throws Exception
	 */
	@Test
	public void test() throws Exception {
		Path scriptPath = scriptsDirectory.resolve(scriptName);

		// Get the file with the expected result
		String baseName = scriptName.substring(0, scriptName.length() - ".llm".length());
		Path okFilePath = scriptsDirectory.resolve(baseName + ".ok");

		LlmTestSupport
				.cliTest("script " + scriptName)
				.argument(scriptPath.toString())
				.expectLines(okFilePath)
				.build()
				.runAndAssert();
	}
}
