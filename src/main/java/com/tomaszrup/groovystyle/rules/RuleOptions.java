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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolved option values for one rule. Every declared option has a value:
 * absent or invalid settings fall back to the declared default.
 */
public final class RuleOptions {

    private static final Logger logger = LoggerFactory.getLogger(RuleOptions.class);

    private final Map<String, Object> values;

    private RuleOptions(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static RuleOptions defaults(StyleRule rule) {
        return resolve(rule, Collections.emptyMap());
    }

    /**
     * Resolves {@code raw} settings against the rule's option specs. Invalid
     * values and unknown option names are logged and ignored.
     */
    public static RuleOptions resolve(StyleRule rule, Map<String, ?> raw) {
        List<RuleOptionSpec> specs = rule.getOptionSpecs();
        Map<String, Object> values = new LinkedHashMap<>();
        for (RuleOptionSpec spec : specs) {
            Object value = raw.get(spec.getName());
            if (value == null) {
                values.put(spec.getName(), spec.getDefaultValue());
            } else if (spec.accepts(value)) {
                values.put(spec.getName(), spec.normalize(value));
            } else {
                logger.warn("Invalid value '{}' for option '{}' of rule '{}', using default {}",
                        value, spec.getName(), rule.getId(), spec.getDefaultValue());
                values.put(spec.getName(), spec.getDefaultValue());
            }
        }
        for (String name : raw.keySet()) {
            if (!values.containsKey(name)) {
                logger.warn("Rule '{}' has no option '{}', ignoring it", rule.getId(), name);
            }
        }
        return new RuleOptions(values);
    }

    public int getInt(String name) {
        return (Integer) require(name);
    }

    public boolean getBoolean(String name) {
        return (Boolean) require(name);
    }

    public String getString(String name) {
        return (String) require(name);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private Object require(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("Undeclared option: " + name);
        }
        return values.get(name);
    }
}
