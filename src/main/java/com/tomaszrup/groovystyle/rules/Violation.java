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

import java.util.Comparator;

import com.tomaszrup.groovystyle.source.SourcePosition;
import com.tomaszrup.groovystyle.source.TextRange;

/**
 * One reported style problem, with an optional {@link Fix}.
 */
public final class Violation {

    /** Document order, then rule id. */
    public static final Comparator<Violation> DOCUMENT_ORDER = Comparator
            .comparing(Violation::getRange, TextRange.COMPARATOR)
            .thenComparing(Violation::getRuleId);

    private final String ruleId;
    private final TextRange range;
    private final SourcePosition start;
    private final SourcePosition end;
    private final String message;
    private final Fix fix;

    public Violation(String ruleId, TextRange range, SourcePosition start, SourcePosition end,
            String message, Fix fix) {
        this.ruleId = ruleId;
        this.range = range;
        this.start = start;
        this.end = end;
        this.message = message;
        this.fix = fix;
    }

    public String getRuleId() {
        return ruleId;
    }

    public TextRange getRange() {
        return range;
    }

    public SourcePosition getStart() {
        return start;
    }

    public SourcePosition getEnd() {
        return end;
    }

    public String getMessage() {
        return message;
    }

    /** The fix, or {@code null} if this violation must be corrected by hand. */
    public Fix getFix() {
        return fix;
    }

    public boolean isFixable() {
        return fix != null;
    }

    @Override
    public String toString() {
        return start + " " + ruleId + ": " + message;
    }
}
