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

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.groovystyle.StyleTestSupport;
import com.tomaszrup.groovystyle.config.StyleConfiguration;
import com.tomaszrup.groovystyle.rules.AssignmentNewlineRule;
import com.tomaszrup.groovystyle.rules.ClosingParenSameLineRule;
import com.tomaszrup.groovystyle.rules.NodeHandler;
import com.tomaszrup.groovystyle.rules.RuleContext;
import com.tomaszrup.groovystyle.rules.StyleRule;
import com.tomaszrup.groovystyle.rules.Violation;
import com.tomaszrup.groovystyle.tree.SyntaxKind;

class StyleEngineTests {

	private static final String TEXT = "def r = compute(\n\ta, b\n)\ndef user = repo.getById(id)";

	private static StyleRule failingRule() {
		return new StyleRule() {
			@Override
			public String getId() {
				return "failing";
			}

			@Override
			public String getDescription() {
				return "always throws";
			}

			@Override
			public Map<SyntaxKind, NodeHandler> createHandlers(RuleContext context) {
				Map<SyntaxKind, NodeHandler> handlers = new EnumMap<>(SyntaxKind.class);
				handlers.put(SyntaxKind.IDENTIFIER, node -> {
					throw new IllegalStateException("boom");
				});
				return handlers;
			}
		};
	}

	@Test
	void testViolationsAreInDocumentOrder() throws Exception {
		StyleEngine engine = new StyleEngine(RuleRegistry.builtIn(), StyleConfiguration.defaults());
		List<Violation> violations = engine.lint(StyleTestSupport.parse(TEXT));
		Assertions.assertFalse(violations.isEmpty());
		for (int i = 1; i < violations.size(); i++) {
			Assertions.assertTrue(Violation.DOCUMENT_ORDER.compare(violations.get(i - 1), violations.get(i)) <= 0);
		}
	}

	@Test
	void testDisabledRuleIsNotRun() throws Exception {
		StyleConfiguration configuration = StyleConfiguration.defaults()
				.withRuleEnabled(AssignmentNewlineRule.ID, false);
		StyleEngine engine = new StyleEngine(RuleRegistry.builtIn(), configuration);
		List<String> ids = StyleTestSupport.ruleIds(engine.lint(StyleTestSupport.parse(TEXT)));
		Assertions.assertFalse(ids.contains(AssignmentNewlineRule.ID));
		Assertions.assertTrue(ids.contains(ClosingParenSameLineRule.ID));
	}

	@Test
	void testNoEnabledRulesYieldsNoViolations() throws Exception {
		StyleConfiguration configuration = StyleConfiguration.defaults().onlyRule("unknown-rule");
		StyleEngine engine = new StyleEngine(RuleRegistry.builtIn(), configuration);
		Assertions.assertTrue(engine.lint(StyleTestSupport.parse(TEXT)).isEmpty());
	}

	@Test
	void testFailingRuleDoesNotStopOtherRules() throws Exception {
		RuleRegistry registry = new RuleRegistry()
				.register(failingRule())
				.register(new ClosingParenSameLineRule());
		StyleEngine engine = new StyleEngine(registry, StyleConfiguration.defaults());
		List<Violation> violations = engine.lint(StyleTestSupport.parse(TEXT));
		Assertions.assertEquals(1, violations.size());
		Assertions.assertEquals(ClosingParenSameLineRule.ID, violations.get(0).getRuleId());
	}
}
