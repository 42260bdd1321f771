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
package com.tomaszrup.groovystyle.source;

import java.util.Locale;

/**
 * Character emitted for one indentation unit.
 */
public enum IndentStyle {
    TAB,
    SPACES;

    /**
     * Parses {@code "tab"}/{@code "tabs"} or {@code "space"}/{@code "spaces"},
     * case-insensitively.
     *
     * @return the style, or {@code null} if the name is not recognised
     */
    public static IndentStyle fromName(String name) {
        if (name == null) {
            return null;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "tab":
            case "tabs":
                return TAB;
            case "space":
            case "spaces":
                return SPACES;
            default:
                return null;
        }
    }
}
