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

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.groovystyle.rules.ClosingParenSameLineRule;
import com.tomaszrup.groovystyle.rules.LambdaBodyNewlineRule;
import com.tomaszrup.groovystyle.rules.StyleRule;

class RuleRegistryTests {

	@Test
	void testBuiltInRulesInRegistrationOrder() {
		List<StyleRule> rules = RuleRegistry.builtIn().getRules();
		Assertions.assertEquals(6, rules.size());
		Assertions.assertEquals(LambdaBodyNewlineRule.ID, rules.get(0).getId());
		Assertions.assertEquals(ClosingParenSameLineRule.ID, rules.get(5).getId());
	}

	@Test
	void testLookupById() {
		RuleRegistry registry = RuleRegistry.builtIn();
		Assertions.assertTrue(registry.contains(ClosingParenSameLineRule.ID));
		Assertions.assertTrue(registry.get(ClosingParenSameLineRule.ID) instanceof ClosingParenSameLineRule);
		Assertions.assertFalse(registry.contains("no-such-rule"));
		Assertions.assertNull(registry.get("no-such-rule"));
	}

	@Test
	void testDuplicateIdIsRejected() {
		RuleRegistry registry = new RuleRegistry().register(new ClosingParenSameLineRule());
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> registry.register(new ClosingParenSameLineRule()));
	}

	@Test
	void testRulesListIsUnmodifiable() {
		List<StyleRule> rules = RuleRegistry.builtIn().getRules();
		Assertions.assertThrows(UnsupportedOperationException.class, () -> rules.add(new ClosingParenSameLineRule()));
	}
}
