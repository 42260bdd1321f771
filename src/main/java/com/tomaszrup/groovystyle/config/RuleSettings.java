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

/**
 * Raw user settings for one rule: the enabled flag and unvalidated option
 * values. Validation happens when the rule's options are resolved.
 */
public final class RuleSettings {

    private static final RuleSettings ENABLED = new RuleSettings(true, Collections.emptyMap());

    private final boolean enabled;
    private final Map<String, Object> options;

    public RuleSettings(boolean enabled, Map<String, Object> options) {
        this.enabled = enabled;
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public static RuleSettings enabledWithDefaults() {
        return ENABLED;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Map<String, Object> getOptions() {
        return options;
    }

    public RuleSettings withEnabled(boolean value) {
        return new RuleSettings(value, options);
    }

    /** Settings with {@code overrides} laid over the current option values. */
    public RuleSettings withOptions(Map<String, Object> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>(options);
        merged.putAll(overrides);
        return new RuleSettings(enabled, merged);
    }

    @Override
    public String toString() {
        return "RuleSettings{enabled=" + enabled + ", options=" + options + "}";
    }
}
