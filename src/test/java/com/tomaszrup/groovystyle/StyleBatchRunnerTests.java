////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.groovystyle;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tomaszrup.groovystyle.config.StyleConfiguration;
import com.tomaszrup.groovystyle.engine.RuleRegistry;

/**
 * Tests for {@link StyleBatchRunner}: exit codes, report format and fixing
 * files in place.
 */
class StyleBatchRunnerTests {

	private static final String DIRTY = "def user = repo.getById(id)\n";
	private static final String CLEAN = "def user =\n\trepo.getById(id)\n";

	private ExecutorPools pools;
	private StyleBatchRunner runner;
	private ByteArrayOutputStream output;
	private PrintStream out;

	@TempDir
	Path workspace;

	@BeforeEach
	void setup() {
		pools = new ExecutorPools(2);
		runner = new StyleBatchRunner(RuleRegistry.builtIn(), StyleConfiguration.defaults(), pools);
		output = new ByteArrayOutputStream();
		out = new PrintStream(output, true);
	}

	@AfterEach
	void tearDown() {
		pools.shutdownAll();
	}

	private Path write(String name, String text) throws IOException {
		Path file = workspace.resolve(name);
		Files.createDirectories(file.getParent());
		Files.write(file, text.getBytes(StandardCharsets.UTF_8));
		return file;
	}

	private String read(Path file) throws IOException {
		return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
	}

	private String printed() {
		return new String(output.toByteArray(), StandardCharsets.UTF_8);
	}

	// --- check

	@Test
	void testCleanTreeExitsZero() throws IOException {
		write("src/Clean.groovy", CLEAN);
		Assertions.assertEquals(StyleBatchRunner.EXIT_CLEAN,
				runner.run(Collections.singletonList(workspace), false, out));
		Assertions.assertEquals("", printed());
	}

	@Test
	void testViolationsArePrinted() throws IOException {
		Path file = write("src/Dirty.groovy", DIRTY);
		Assertions.assertEquals(StyleBatchRunner.EXIT_VIOLATIONS,
				runner.run(Collections.singletonList(workspace), false, out));
		Assertions.assertEquals(file + ":1:12: assignment-newline: Expected newline after '='",
				printed().trim());
		Assertions.assertEquals(DIRTY, read(file), "Check mode must not modify files");
	}

	@Test
	void testFilesAreReportedInSortedOrder() throws IOException {
		Path second = write("b/Second.groovy", DIRTY);
		Path first = write("a/First.gradle", DIRTY);
		runner.run(Collections.singletonList(workspace), false, out);
		String[] lines = printed().trim().split("\\R");
		Assertions.assertEquals(2, lines.length);
		Assertions.assertTrue(lines[0].startsWith(first.toString()));
		Assertions.assertTrue(lines[1].startsWith(second.toString()));
	}

	@Test
	void testOtherFilesAreSkipped() throws IOException {
		write("notes.txt", DIRTY);
		Assertions.assertEquals(StyleBatchRunner.EXIT_CLEAN,
				runner.run(Collections.singletonList(workspace), false, out));
	}

	@Test
	void testParseErrorExitsTwo() throws IOException {
		Path file = write("Broken.groovy", "def x = (\n");
		Assertions.assertEquals(StyleBatchRunner.EXIT_ERRORS,
				runner.run(Collections.singletonList(workspace), false, out));
		Assertions.assertTrue(printed().startsWith(file + ":"));
		Assertions.assertTrue(printed().contains(": error: "));
	}

	@Test
	void testMissingPathExitsTwo() {
		Path missing = workspace.resolve("missing");
		Assertions.assertEquals(StyleBatchRunner.EXIT_ERRORS,
				runner.run(Collections.singletonList(missing), false, out));
		Assertions.assertTrue(printed().startsWith(missing + ": error: "));
	}

	@Test
	void testNoPathsPrintsUsage() {
		Assertions.assertEquals(StyleBatchRunner.EXIT_ERRORS, runner.run(Collections.emptyList(), false, out));
		Assertions.assertTrue(printed().startsWith("Usage: "));
	}

	// --- fix

	@Test
	void testFixRewritesFiles() throws IOException {
		Path file = write("Dirty.groovy", DIRTY);
		Assertions.assertEquals(StyleBatchRunner.EXIT_CLEAN,
				runner.run(Collections.singletonList(file), true, out));
		Assertions.assertEquals(CLEAN, read(file));
	}

	@Test
	void testFixReportsUnfixableViolations() throws IOException {
		Path file = write("Commented.groovy", "def user = /* cached */ repo.getById(id)\n");
		Assertions.assertEquals(StyleBatchRunner.EXIT_VIOLATIONS,
				runner.run(Collections.singletonList(file), true, out));
		Assertions.assertTrue(printed().contains("assignment-newline"));
	}

	// --- helpers

	@Test
	void testIsStyledFile() {
		Assertions.assertTrue(StyleBatchRunner.isStyledFile(Paths.get("src", "App.groovy")));
		Assertions.assertTrue(StyleBatchRunner.isStyledFile(Paths.get("build.gradle")));
		Assertions.assertFalse(StyleBatchRunner.isStyledFile(Paths.get("App.java")));
	}
}
