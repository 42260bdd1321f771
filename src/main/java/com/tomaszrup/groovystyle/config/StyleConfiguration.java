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
package com.tomaszrup.groovystyle.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.tomaszrup.groovystyle.rules.RuleOptions;
import com.tomaszrup.groovystyle.rules.StyleRule;
import com.tomaszrup.groovystyle.source.Indentation;

/**
 * Immutable style configuration. Rules without an entry are enabled with
 * default options unless the configuration was narrowed with
 * {@link #onlyRule(String)}.
 */
public final class StyleConfiguration {

    private static final StyleConfiguration DEFAULTS =
            new StyleConfiguration(Indentation.defaults(), Collections.emptyMap(), null, true);

    private final Indentation indentation;
    private final Map<String, RuleSettings> rules;
    private final String logLevel;
    private final boolean enabledByDefault;

    private StyleConfiguration(Indentation indentation, Map<String, RuleSettings> rules, String logLevel,
            boolean enabledByDefault) {
        this.indentation = indentation;
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
        this.logLevel = logLevel;
        this.enabledByDefault = enabledByDefault;
    }

    public static StyleConfiguration defaults() {
        return DEFAULTS;
    }

    public Indentation getIndentation() {
        return indentation;
    }

    /** Configured log level name, or {@code null} to leave logging alone. */
    public String getLogLevel() {
        return logLevel;
    }

    public Map<String, RuleSettings> getRuleSettings() {
        return rules;
    }

    public RuleSettings getRuleSettings(String ruleId) {
        RuleSettings settings = rules.get(ruleId);
        if (settings != null) {
            return settings;
        }
        return enabledByDefault ? RuleSettings.enabledWithDefaults()
                : RuleSettings.enabledWithDefaults().withEnabled(false);
    }

    public boolean isRuleEnabled(String ruleId) {
        return getRuleSettings(ruleId).isEnabled();
    }

    public RuleOptions getRuleOptions(StyleRule rule) {
        return RuleOptions.resolve(rule, getRuleSettings(rule.getId()).getOptions());
    }

    public StyleConfiguration withIndentation(Indentation value) {
        return new StyleConfiguration(value, rules, logLevel, enabledByDefault);
    }

    public StyleConfiguration withLogLevel(String value) {
        return new StyleConfiguration(indentation, rules, value, enabledByDefault);
    }

    public StyleConfiguration withRule(String ruleId, RuleSettings settings) {
        Map<String, RuleSettings> copy = new LinkedHashMap<>(rules);
        copy.put(ruleId, settings);
        return new StyleConfiguration(indentation, copy, logLevel, enabledByDefault);
    }

    public StyleConfiguration withRuleEnabled(String ruleId, boolean enabled) {
        return withRule(ruleId, getRuleSettings(ruleId).withEnabled(enabled));
    }

    /** A copy with every rule disabled except {@code ruleId}, which keeps its options. */
    public StyleConfiguration onlyRule(String ruleId) {
        Map<String, RuleSettings> copy = new LinkedHashMap<>();
        copy.put(ruleId, getRuleSettings(ruleId).withEnabled(true));
        return new StyleConfiguration(indentation, copy, logLevel, false);
    }

    @Override
    public String toString() {
        return "StyleConfiguration{indentation=" + indentation + ", rules=" + rules + ", logLevel=" + logLevel + "}";
    }
}
