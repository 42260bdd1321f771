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
package com.tomaszrup.groovystyle.engine;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.groovystyle.StyleTestSupport;
import com.tomaszrup.groovystyle.rules.ClosingParenSameLineRule;
import com.tomaszrup.groovystyle.rules.RuleContext;
import com.tomaszrup.groovystyle.rules.RuleOptions;
import com.tomaszrup.groovystyle.rules.Violation;
import com.tomaszrup.groovystyle.source.Indentation;
import com.tomaszrup.groovystyle.source.TextRange;
import com.tomaszrup.groovystyle.tree.ChainAnalyzer;
import com.tomaszrup.groovystyle.tree.ParsedSource;

class FixApplierTests {

	private static final String TEXT = "def value = compute(a, b)";

	private List<Violation> violations;
	private RuleContext context;

	@BeforeEach
	void setup() throws Exception {
		violations = new ArrayList<>();
		context = contextFor(TEXT, violations);
	}

	private static RuleContext contextFor(String text, List<Violation> sink) throws Exception {
		ParsedSource parsed = StyleTestSupport.parse(text);
		return new RuleContext("test-rule", parsed, Indentation.defaults(),
				RuleOptions.defaults(new ClosingParenSameLineRule()), new ChainAnalyzer(parsed.getTree()), sink::add);
	}

	private void replace(int start, int end, String replacement) {
		TextRange range = new TextRange(start, end);
		context.report(range, "replace", fixer -> fixer.replaceRange(range, replacement));
	}

	// --- basic application

	@Test
	void testAppliesFixesInOffsetOrder() {
		replace(20, 21, "x");
		replace(0, 3, "var");
		FixApplier.FixApplication application = FixApplier.apply(TEXT, violations);
		Assertions.assertEquals("var value = compute(x, b)", application.getText());
		Assertions.assertEquals(2, application.getAppliedCount());
		Assertions.assertEquals(0, application.getSkippedCount());
	}

	@Test
	void testViolationsWithoutFixAreIgnored() {
		context.report(new TextRange(0, 3), "no fix", null);
		FixApplier.FixApplication application = FixApplier.apply(TEXT, violations);
		Assertions.assertEquals(TEXT, application.getText());
		Assertions.assertEquals(0, application.getAppliedCount());
		Assertions.assertEquals(0, application.getSkippedCount());
	}

	@Test
	void testEmptyListLeavesTextUnchanged() {
		FixApplier.FixApplication application = FixApplier.apply(TEXT, new ArrayList<>());
		Assertions.assertEquals(TEXT, application.getText());
	}

	// --- conflicts

	@Test
	void testOverlappingFixIsSkipped() {
		replace(4, 9, "result");
		replace(6, 12, "zzz");
		FixApplier.FixApplication application = FixApplier.apply(TEXT, violations);
		Assertions.assertEquals("def result = compute(a, b)", application.getText());
		Assertions.assertEquals(1, application.getAppliedCount());
		Assertions.assertEquals(1, application.getSkippedCount());
	}

	@Test
	void testFixAtSameStartIsSkipped() {
		replace(0, 0, "final ");
		replace(0, 3, "var");
		FixApplier.FixApplication application = FixApplier.apply(TEXT, violations);
		Assertions.assertEquals("final def value = compute(a, b)", application.getText());
		Assertions.assertEquals(1, application.getSkippedCount());
	}

	@Test
	void testAdjacentFixesAreBothApplied() {
		replace(0, 3, "var");
		replace(3, 4, "\t");
		FixApplier.FixApplication application = FixApplier.apply(TEXT, violations);
		Assertions.assertEquals("var\tvalue = compute(a, b)", application.getText());
		Assertions.assertEquals(2, application.getAppliedCount());
	}

	@Test
	void testFixIsHeldBackWhenItsBasisIsRewritten() {
		TextRange gap = new TextRange(19, 20);
		context.report(gap, "dependent", fixer -> fixer.replaceRange(gap, "\n\t").dependingOn(new TextRange(0, 12)));
		replace(0, 0, "\t");
		FixApplier.FixApplication application = FixApplier.apply(TEXT, violations);
		Assertions.assertEquals("\t" + TEXT, application.getText());
		Assertions.assertEquals(1, application.getAppliedCount());
		Assertions.assertEquals(1, application.getSkippedCount());
	}

	@Test
	void testFixWithUntouchedBasisIsApplied() {
		TextRange gap = new TextRange(19, 20);
		context.report(gap, "dependent", fixer -> fixer.replaceRange(gap, "(\n\t").dependingOn(new TextRange(0, 3)));
		replace(4, 9, "result");
		FixApplier.FixApplication application = FixApplier.apply(TEXT, violations);
		Assertions.assertEquals("def result = compute(\n\ta, b)", application.getText());
		Assertions.assertEquals(2, application.getAppliedCount());
	}

	@Test
	void testFixBeyondTextIsSkipped() {
		replace(20, 25, "");
		FixApplier.FixApplication application = FixApplier.apply("def value = 1", violations);
		Assertions.assertEquals("def value = 1", application.getText());
		Assertions.assertEquals(1, application.getSkippedCount());
	}
}
