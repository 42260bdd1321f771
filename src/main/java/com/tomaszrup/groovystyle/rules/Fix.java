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

import com.tomaszrup.groovystyle.source.TextRange;

/**
 * Replace the text in {@link #getRange()} with {@link #getReplacement()}.
 *
 * <p>A fix may name a {@linkplain #getBasis() basis}: text outside its range
 * that its replacement was computed from. The fix is held back for a pass
 * in which another fix rewrites that text.</p>
 */
public final class Fix {

    private final TextRange range;
    private final String replacement;
    private final TextRange basis;

    Fix(TextRange range, String replacement) {
        this(range, replacement, null);
    }

    private Fix(TextRange range, String replacement, TextRange basis) {
        this.range = range;
        this.replacement = replacement;
        this.basis = basis;
    }

    public Fix dependingOn(TextRange basis) {
        return new Fix(range, replacement, basis);
    }

    public TextRange getRange() {
        return range;
    }

    public String getReplacement() {
        return replacement;
    }

    /** The text this fix's replacement was derived from, or {@code null}. */
    public TextRange getBasis() {
        return basis;
    }

    @Override
    public String toString() {
        return "Fix" + range + " -> '" + replacement.replace("\n", "\\n").replace("\t", "\\t") + "'";
    }
}
