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

import java.util.Collections;
import java.util.List;

import com.tomaszrup.groovystyle.parser.SourceParseException;
import com.tomaszrup.groovystyle.rules.Violation;

/**
 * Violations found in one file, or the reason it could not be checked.
 */
public final class CheckResult {

    private final String name;
    private final List<Violation> violations;
    private final SourceParseException failure;

    private CheckResult(String name, List<Violation> violations, SourceParseException failure) {
        this.name = name;
        this.violations = violations;
        this.failure = failure;
    }

    public static CheckResult checked(String name, List<Violation> violations) {
        return new CheckResult(name, Collections.unmodifiableList(violations), null);
    }

    public static CheckResult failed(String name, SourceParseException failure) {
        return new CheckResult(name, Collections.emptyList(), failure);
    }

    public String getName() {
        return name;
    }

    public boolean isParsed() {
        return failure == null;
    }

    /** Parse failure, or {@code null} when the file was checked. */
    public SourceParseException getFailure() {
        return failure;
    }

    public List<Violation> getViolations() {
        return violations;
    }

    public boolean hasViolations() {
        return !violations.isEmpty();
    }

    public boolean hasFixableViolations() {
        for (Violation violation : violations) {
            if (violation.isFixable()) {
                return true;
            }
        }
        return false;
    }
}
