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

import com.tomaszrup.groovystyle.source.SourceText;
import com.tomaszrup.groovystyle.source.TextRange;

/**
 * Capability handed to a {@link FixFunction} for creating {@link Fix}es
 * against the file being checked.
 */
public final class Fixer {

    private final SourceText source;

    Fixer(SourceText source) {
        this.source = source;
    }

    public Fix replaceRange(TextRange range, String text) {
        if (range.getEnd() > source.length()) {
            throw new IllegalArgumentException("Range " + range + " exceeds text length " + source.length());
        }
        return new Fix(range, text == null ? "" : text);
    }

    /**
     * Replaces the leading whitespace of a 1-based line.
     */
    public Fix replaceLineIndent(int line, String indent) {
        int start = source.getLineStart(line);
        return replaceRange(new TextRange(start, start + source.lineIndent(line).length()), indent);
    }
}
