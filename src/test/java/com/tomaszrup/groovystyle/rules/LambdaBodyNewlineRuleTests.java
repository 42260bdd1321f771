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
package com.tomaszrup.groovystyle.rules;

import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.groovystyle.StyleTestSupport;
import com.tomaszrup.groovystyle.config.RuleSettings;
import com.tomaszrup.groovystyle.config.StyleConfiguration;
import com.tomaszrup.groovystyle.engine.StyleChecker;

class LambdaBodyNewlineRuleTests {

	private static final String LONG_LAMBDA =
			"def result = source.switchMap((username) -> from(checkAvailability(username)))";

	private final StyleChecker checker = StyleTestSupport.checkerFor(LambdaBodyNewlineRule.ID);

	@Test
	void testLongLambdaBodyIsMovedToNextLine() {
		List<Violation> violations = StyleTestSupport.violations(checker, LONG_LAMBDA);
		Assertions.assertEquals(1, violations.size());
		Violation violation = violations.get(0);
		Assertions.assertEquals(LambdaBodyNewlineRule.ID, violation.getRuleId());
		Assertions.assertEquals(LONG_LAMBDA.indexOf("from("), violation.getRange().getStart());
		Assertions.assertTrue(violation.isFixable());

		Assertions.assertEquals(
				"def result = source.switchMap((username) ->\n\tfrom(checkAvailability(username)))",
				StyleTestSupport.fix(checker, LONG_LAMBDA));
	}

	@Test
	void testFixIsIdempotent() {
		String fixed = StyleTestSupport.fix(checker, LONG_LAMBDA);
		Assertions.assertEquals(fixed, StyleTestSupport.fix(checker, fixed));
		Assertions.assertTrue(StyleTestSupport.violations(checker, fixed).isEmpty());
	}

	@Test
	void testBodyIndentFollowsArrowLine() {
		String text = "def run() {\n\tsource.switchMap((username) -> from(checkAvailability(username)))\n}\n";
		Assertions.assertEquals(
				"def run() {\n\tsource.switchMap((username) ->\n\t\tfrom(checkAvailability(username)))\n}\n",
				StyleTestSupport.fix(checker, text));
	}

	@Test
	void testShortLambdaIsAccepted() {
		Assertions.assertTrue(StyleTestSupport.violations(checker, "def f = list.collect((x) -> x * 2)").isEmpty());
	}

	@Test
	void testBodyAlreadyOnNewLineIsNotReported() {
		String text = "def result = source.switchMap((username) ->\n\tfrom(checkAvailability(username)))";
		Assertions.assertTrue(StyleTestSupport.violations(checker, text).isEmpty());
	}

	@Test
	void testBlockBodyIsIgnored() {
		String text = "def result = source.switchMap((username) -> { from(checkAvailability(username)) })";
		Assertions.assertTrue(StyleTestSupport.violations(checker, text).isEmpty());
	}

	@Test
	void testCommentBeforeBodySuppressesFix() {
		String text = "def result = source.switchMap((username) -> /* lookup */ from(checkAvailability(username)))";
		List<Violation> violations = StyleTestSupport.violations(checker, text);
		Assertions.assertEquals(1, violations.size());
		Assertions.assertFalse(violations.get(0).isFixable());
		Assertions.assertEquals(text, StyleTestSupport.fix(checker, text));
	}

	@Test
	void testMaxLengthOption() {
		StyleConfiguration configuration = StyleConfiguration.defaults()
				.onlyRule(LambdaBodyNewlineRule.ID)
				.withRule(LambdaBodyNewlineRule.ID, new RuleSettings(true,
						Collections.singletonMap(LambdaBodyNewlineRule.MAX_LENGTH_OPTION, 100)));
		StyleChecker relaxed = StyleTestSupport.checker(configuration);
		Assertions.assertTrue(StyleTestSupport.violations(relaxed, LONG_LAMBDA).isEmpty());
	}
}
