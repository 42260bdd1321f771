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

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.groovystyle.config.LogLevels;
import com.tomaszrup.groovystyle.config.StyleConfiguration;
import com.tomaszrup.groovystyle.config.StyleConfigurationLoader;
import com.tomaszrup.groovystyle.engine.CheckResult;
import com.tomaszrup.groovystyle.engine.FixOutcome;
import com.tomaszrup.groovystyle.engine.RuleRegistry;
import com.tomaszrup.groovystyle.engine.StyleChecker;
import com.tomaszrup.groovystyle.engine.StyleEngine;
import com.tomaszrup.groovystyle.parser.GroovySourceParser;
import com.tomaszrup.groovystyle.parser.SourceParseException;
import com.tomaszrup.groovystyle.rules.Violation;

/**
 * Command line checking and fixing of {@code *.groovy} and {@code *.gradle}
 * files.
 *
 * <p>Each violation is printed as {@code path:line:column: rule-id: message}
 * with a 1-based column. Files are checked in parallel; output follows the
 * sorted file order.</p>
 */
public class StyleBatchRunner {

    private static final Logger logger = LoggerFactory.getLogger(StyleBatchRunner.class);

    public static final String CHECK_OPTION = "--check";
    public static final String FIX_OPTION = "--fix";

    public static final int EXIT_CLEAN = 0;
    public static final int EXIT_VIOLATIONS = 1;
    public static final int EXIT_ERRORS = 2;

    private final StyleChecker checker;
    private final ExecutorPools executorPools;

    public StyleBatchRunner(RuleRegistry registry, StyleConfiguration configuration, ExecutorPools executorPools) {
        this.checker = new StyleChecker(new GroovySourceParser(), new StyleEngine(registry, configuration));
        this.executorPools = executorPools;
    }

    /**
     * Runs with the built-in rules and {@code .groovy-style.json} from the
     * working directory.
     */
    public static int run(String[] paths, boolean fix, PrintStream out) {
        RuleRegistry registry = RuleRegistry.builtIn();
        StyleConfiguration configuration = new StyleConfigurationLoader(registry)
                .loadFromDirectory(Paths.get("").toAbsolutePath(), StyleConfiguration.defaults());
        if (configuration.getLogLevel() != null) {
            LogLevels.applyLogLevel(configuration.getLogLevel());
        }
        ExecutorPools pools = new ExecutorPools();
        try {
            List<Path> roots = new ArrayList<>();
            for (String path : paths) {
                roots.add(Paths.get(path));
            }
            return new StyleBatchRunner(registry, configuration, pools).run(roots, fix, out);
        } finally {
            pools.shutdownAll();
        }
    }

    public int run(List<Path> roots, boolean fix, PrintStream out) {
        if (roots.isEmpty()) {
            out.println("Usage: " + CHECK_OPTION + "|" + FIX_OPTION + " <path>...");
            return EXIT_ERRORS;
        }
        boolean errors = false;
        List<Path> files = new ArrayList<>();
        for (Path root : roots) {
            try {
                files.addAll(collectFiles(root));
            } catch (IOException e) {
                out.println(root + ": error: " + e.getMessage());
                errors = true;
            }
        }

        List<Future<FileReport>> futures = new ArrayList<>();
        for (Path file : files) {
            futures.add(executorPools.getCheckPool().submit(() -> processFile(file, fix)));
        }

        int violationCount = 0;
        int fixedFiles = 0;
        for (Future<FileReport> future : futures) {
            FileReport report;
            try {
                report = future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                out.println("error: interrupted");
                return EXIT_ERRORS;
            } catch (ExecutionException e) {
                logger.error("Checking failed: {}", e.getCause().getMessage(), e.getCause());
                out.println("error: " + e.getCause().getMessage());
                errors = true;
                continue;
            }
            for (String line : report.lines) {
                out.println(line);
            }
            errors |= report.error;
            violationCount += report.violationCount;
            if (report.fixed) {
                fixedFiles++;
            }
        }
        logger.info("Checked {} file(s): {} violation(s){}", files.size(), violationCount,
                fix ? ", " + fixedFiles + " file(s) fixed" : "");
        if (errors) {
            return EXIT_ERRORS;
        }
        return violationCount > 0 ? EXIT_VIOLATIONS : EXIT_CLEAN;
    }

    static boolean isStyledFile(Path path) {
        String name = path.getFileName() != null ? path.getFileName().toString() : "";
        return name.endsWith(".groovy") || name.endsWith(".gradle");
    }

    private static List<Path> collectFiles(Path root) throws IOException {
        if (!Files.exists(root)) {
            throw new IOException("No such file or directory");
        }
        if (Files.isRegularFile(root)) {
            List<Path> single = new ArrayList<>();
            single.add(root);
            return single;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .filter(StyleBatchRunner::isStyledFile)
                    .collect(Collectors.toCollection(TreeSet::new))
                    .stream()
                    .collect(Collectors.toList());
        }
    }

    private FileReport processFile(Path file, boolean fix) {
        FileReport report = new FileReport();
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            report.lines.add(file + ": error: cannot read file: " + e.getMessage());
            report.error = true;
            return report;
        }
        CheckResult result;
        if (fix) {
            FixOutcome outcome = checker.fix(file.toString(), text);
            if (outcome.isChanged()) {
                try {
                    Files.writeString(file, outcome.getText(), StandardCharsets.UTF_8);
                    report.fixed = true;
                    logger.debug("Fixed {} ({} fix(es) in {} pass(es))", file, outcome.getAppliedFixes(),
                            outcome.getPasses());
                } catch (IOException e) {
                    report.lines.add(file + ": error: cannot write file: " + e.getMessage());
                    report.error = true;
                }
            }
            result = outcome.getRemaining();
        } else {
            result = checker.check(file.toString(), text);
        }
        if (!result.isParsed()) {
            SourceParseException failure = result.getFailure();
            report.lines.add(file + ":" + Math.max(failure.getLine(), 1) + ":" + Math.max(failure.getColumn(), 1)
                    + ": error: " + failure.getMessage());
            report.error = true;
            return report;
        }
        for (Violation violation : result.getViolations()) {
            report.lines.add(format(file, violation));
        }
        report.violationCount = result.getViolations().size();
        return report;
    }

    static String format(Path file, Violation violation) {
        return file + ":" + violation.getStart().getLine() + ":" + (violation.getStart().getColumn() + 1) + ": "
                + violation.getRuleId() + ": " + violation.getMessage();
    }

    private static final class FileReport {
        final List<String> lines = new ArrayList<>();
        boolean error;
        boolean fixed;
        int violationCount;
    }
}
