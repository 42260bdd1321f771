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

/**
 * Result of running the check-and-fix loop over one file.
 */
public final class FixOutcome {

    private final String originalText;
    private final String text;
    private final int passes;
    private final int appliedFixes;
    private final CheckResult remaining;

    FixOutcome(String originalText, String text, int passes, int appliedFixes, CheckResult remaining) {
        this.originalText = originalText;
        this.text = text;
        this.passes = passes;
        this.appliedFixes = appliedFixes;
        this.remaining = remaining;
    }

    public String getOriginalText() {
        return originalText;
    }

    /** The text after all fix passes. */
    public String getText() {
        return text;
    }

    public boolean isChanged() {
        return !originalText.equals(text);
    }

    public int getPasses() {
        return passes;
    }

    public int getAppliedFixes() {
        return appliedFixes;
    }

    /** The check of the final text. */
    public CheckResult getRemaining() {
        return remaining;
    }
}
