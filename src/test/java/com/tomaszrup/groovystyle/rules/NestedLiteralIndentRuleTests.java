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

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.groovystyle.StyleTestSupport;
import com.tomaszrup.groovystyle.engine.StyleChecker;

class NestedLiteralIndentRuleTests {

	private final StyleChecker checker = StyleTestSupport.checkerFor(NestedLiteralIndentRule.ID);

	@Test
	void testNestedMapMemberIsReported() {
		String text = "def config =\n\t[\n\t\tfirst: 1,\n\t\tsecond: [\n\t\tinner: 2\n\t\t]\n\t]";
		List<Violation> violations = StyleTestSupport.violations(checker, text);
		Assertions.assertEquals(1, violations.size());
		Violation violation = violations.get(0);
		Assertions.assertEquals(5, violation.getStart().getLine());
		Assertions.assertEquals(text.indexOf("inner"), violation.getRange().getStart());
		Assertions.assertEquals("Content should be indented 3 level(s) from assignment", violation.getMessage());

		String fixed = StyleTestSupport.fix(checker, text);
		Assertions.assertEquals("def config =\n\t[\n\t\tfirst: 1,\n\t\tsecond: [\n\t\t\tinner: 2\n\t\t]\n\t]", fixed);
		Assertions.assertTrue(StyleTestSupport.violations(checker, fixed).isEmpty());
	}

	@Test
	void testWellIndentedLiteralIsAccepted() {
		String text = "def config =\n\t[\n\t\tname: 'app',\n\t\tlimits: [\n\t\t\tcpu: 2\n\t\t]\n\t]";
		Assertions.assertTrue(StyleTestSupport.violations(checker, text).isEmpty());
	}

	@Test
	void testListElements() {
		String text = "def items =\n\t[\n\t\t1,\n\t2\n\t]";
		List<Violation> violations = StyleTestSupport.violations(checker, text);
		Assertions.assertEquals(1, violations.size());
		Assertions.assertEquals(4, violations.get(0).getStart().getLine());
		Assertions.assertEquals("def items =\n\t[\n\t\t1,\n\t\t2\n\t]", StyleTestSupport.fix(checker, text));
	}

	@Test
	void testClosingBracketAlignment() {
		String text = "def items =\n\t[\n\t\t1,\n\t\t2\n\t\t]";
		List<Violation> violations = StyleTestSupport.violations(checker, text);
		Assertions.assertEquals(1, violations.size());
		Assertions.assertEquals("Closing bracket should align with opening bracket", violations.get(0).getMessage());
		Assertions.assertEquals("def items =\n\t[\n\t\t1,\n\t\t2\n\t]", StyleTestSupport.fix(checker, text));
	}

	@Test
	void testLiteralOnAssignmentLineIsIgnored() {
		Assertions.assertTrue(StyleTestSupport.violations(checker, "def items = [\n1,\n2\n]").isEmpty());
	}

	@Test
	void testSingleLineLiteralIsIgnored() {
		Assertions.assertTrue(StyleTestSupport.violations(checker, "def items =\n\t[1, 2, 3]").isEmpty());
	}

	@Test
	void testValueOnLineAfterPropertyColon() {
		String text = "def config =\n\t[\n\t\tlimits:\n\t\t[\n\t\tcpu: 2\n\t\t]\n\t]";
		List<Violation> violations = StyleTestSupport.violations(checker, text);
		Assertions.assertEquals(1, violations.size());
		Assertions.assertEquals(5, violations.get(0).getStart().getLine());
		Assertions.assertEquals("Content should be indented 3 level(s) from assignment", violations.get(0).getMessage());
		Assertions.assertEquals("def config =\n\t[\n\t\tlimits:\n\t\t[\n\t\t\tcpu: 2\n\t\t]\n\t]",
				StyleTestSupport.fix(checker, text));
	}

	@Test
	void testClassPropertyLiteral() {
		String text = "class Settings {\n\tdef config =\n\t\t[\n\t\t\tname: 'app',\n\t\tport: 80\n\t\t]\n}\n";
		List<Violation> violations = StyleTestSupport.violations(checker, text);
		Assertions.assertEquals(1, violations.size());
		Assertions.assertEquals(5, violations.get(0).getStart().getLine());
		Assertions.assertEquals("class Settings {\n\tdef config =\n\t\t[\n\t\t\tname: 'app',\n\t\t\tport: 80\n\t\t]\n}\n",
				StyleTestSupport.fix(checker, text));
	}

	@Test
	void testModifierQualifiedFieldLiteral() {
		String text = "class Settings {\n\tstatic final List NAMES =\n\t\t[\n\t\t\t'a',\n\t\t\t'b'\n\t\t\t]\n}\n";
		List<Violation> violations = StyleTestSupport.violations(checker, text);
		Assertions.assertEquals(1, violations.size());
		Assertions.assertEquals("Closing bracket should align with opening bracket", violations.get(0).getMessage());
		Assertions.assertEquals("class Settings {\n\tstatic final List NAMES =\n\t\t[\n\t\t\t'a',\n\t\t\t'b'\n\t\t]\n}\n",
				StyleTestSupport.fix(checker, text));
	}
}
