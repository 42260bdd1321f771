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
import java.util.Comparator;
import java.util.List;

import com.tomaszrup.groovystyle.rules.Fix;
import com.tomaszrup.groovystyle.rules.Violation;
import com.tomaszrup.groovystyle.source.TextRange;

/**
 * Applies the fixes of one check pass in a single sweep over the text.
 *
 * <p>Fixes are applied in order of their start offset. A fix overlapping an
 * already applied one, or starting at the same offset, is skipped, as is a
 * fix whose {@linkplain Fix#getBasis() basis} another fix rewrites. The next
 * check pass reports a skipped fix again against the updated text.</p>
 */
public final class FixApplier {

    private static final Comparator<Fix> FIX_ORDER = Comparator.comparing(Fix::getRange, TextRange.COMPARATOR);

    private FixApplier() {
    }

    public static FixApplication apply(String text, List<Violation> violations) {
        List<Fix> fixes = new ArrayList<>();
        for (Violation violation : violations) {
            if (violation.getFix() != null) {
                fixes.add(violation.getFix());
            }
        }
        fixes.sort(FIX_ORDER);

        StringBuilder result = new StringBuilder(text.length() + 64);
        int copied = 0;
        int lastStart = -1;
        int applied = 0;
        int skipped = 0;
        for (Fix fix : fixes) {
            TextRange range = fix.getRange();
            if (range.getStart() < copied || range.getStart() == lastStart || range.getEnd() > text.length()
                    || basisRewritten(fix, fixes)) {
                skipped++;
                continue;
            }
            result.append(text, copied, range.getStart());
            result.append(fix.getReplacement());
            copied = range.getEnd();
            lastStart = range.getStart();
            applied++;
        }
        result.append(text, copied, text.length());
        return new FixApplication(result.toString(), applied, skipped);
    }

    private static boolean basisRewritten(Fix fix, List<Fix> fixes) {
        TextRange basis = fix.getBasis();
        if (basis == null) {
            return false;
        }
        for (Fix other : fixes) {
            TextRange range = other.getRange();
            if (other != fix && range.getStart() <= basis.getEnd() && range.getEnd() >= basis.getStart()) {
                return true;
            }
        }
        return false;
    }

    /** Outcome of {@link FixApplier#apply}. */
    public static final class FixApplication {
        private final String text;
        private final int appliedCount;
        private final int skippedCount;

        FixApplication(String text, int appliedCount, int skippedCount) {
            this.text = text;
            this.appliedCount = appliedCount;
            this.skippedCount = skippedCount;
        }

        public String getText() {
            return text;
        }

        public int getAppliedCount() {
            return appliedCount;
        }

        public int getSkippedCount() {
            return skippedCount;
        }
    }
}
