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

/**
 * Declares one configurable option of a {@link StyleRule}.
 */
public final class RuleOptionSpec {

    private final String name;
    private final OptionType type;
    private final Object defaultValue;
    private final String description;

    private RuleOptionSpec(String name, OptionType type, Object defaultValue, String description) {
        this.name = name;
        this.type = type;
        this.defaultValue = defaultValue;
        this.description = description;
    }

    public static RuleOptionSpec positiveInteger(String name, int defaultValue, String description) {
        return new RuleOptionSpec(name, OptionType.POSITIVE_INTEGER, defaultValue, description);
    }

    public static RuleOptionSpec bool(String name, boolean defaultValue, String description) {
        return new RuleOptionSpec(name, OptionType.BOOLEAN, defaultValue, description);
    }

    public static RuleOptionSpec string(String name, String defaultValue, String description) {
        return new RuleOptionSpec(name, OptionType.STRING, defaultValue, description);
    }

    public String getName() {
        return name;
    }

    public OptionType getType() {
        return type;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Whether {@code value} is acceptable for this option. Integral numbers
     * arrive from JSON as doubles, so any number without a fraction counts.
     */
    boolean accepts(Object value) {
        switch (type) {
            case POSITIVE_INTEGER:
                if (!(value instanceof Number)) {
                    return false;
                }
                double number = ((Number) value).doubleValue();
                return number == Math.rint(number) && number >= 1 && number <= Integer.MAX_VALUE;
            case BOOLEAN:
                return value instanceof Boolean;
            case STRING:
                return value instanceof String;
            default:
                return false;
        }
    }

    Object normalize(Object value) {
        return type == OptionType.POSITIVE_INTEGER ? ((Number) value).intValue() : value;
    }
}
