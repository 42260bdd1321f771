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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.tomaszrup.groovystyle.rules.AssignmentContinuationIndentRule;
import com.tomaszrup.groovystyle.rules.AssignmentNewlineRule;
import com.tomaszrup.groovystyle.rules.ClosingParenSameLineRule;
import com.tomaszrup.groovystyle.rules.LambdaBodyNewlineRule;
import com.tomaszrup.groovystyle.rules.NestedLiteralIndentRule;
import com.tomaszrup.groovystyle.rules.OperatorContinuationIndentRule;
import com.tomaszrup.groovystyle.rules.StyleRule;

/**
 * Rules known to the engine, keyed by id in registration order.
 */
public class RuleRegistry {

    private final Map<String, StyleRule> rules = new LinkedHashMap<>();

    /** A registry holding every built-in rule. */
    public static RuleRegistry builtIn() {
        RuleRegistry registry = new RuleRegistry();
        registry.register(new LambdaBodyNewlineRule());
        registry.register(new OperatorContinuationIndentRule());
        registry.register(new AssignmentNewlineRule());
        registry.register(new NestedLiteralIndentRule());
        registry.register(new AssignmentContinuationIndentRule());
        registry.register(new ClosingParenSameLineRule());
        return registry;
    }

    public RuleRegistry register(StyleRule rule) {
        if (rules.containsKey(rule.getId())) {
            throw new IllegalArgumentException("Duplicate rule id: " + rule.getId());
        }
        rules.put(rule.getId(), rule);
        return this;
    }

    public StyleRule get(String id) {
        return rules.get(id);
    }

    public boolean contains(String id) {
        return rules.containsKey(id);
    }

    public List<StyleRule> getRules() {
        return Collections.unmodifiableList(new ArrayList<>(rules.values()));
    }
}
