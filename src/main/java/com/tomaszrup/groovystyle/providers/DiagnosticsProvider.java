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
package com.tomaszrup.groovystyle.providers;

import java.util.ArrayList;
import java.util.List;

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Range;

import com.tomaszrup.groovystyle.engine.CheckResult;
import com.tomaszrup.groovystyle.rules.Violation;

/**
 * Converts check results into LSP diagnostics.
 */
public class DiagnosticsProvider {

    public static final String SOURCE = "groovy-style";

    /**
     * @return one warning per violation; empty when the file did not parse
     */
    public List<Diagnostic> provideDiagnostics(CheckResult result) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        if (!result.isParsed()) {
            return diagnostics;
        }
        for (Violation violation : result.getViolations()) {
            diagnostics.add(toDiagnostic(violation));
        }
        return diagnostics;
    }

    static Diagnostic toDiagnostic(Violation violation) {
        Range range = new Range(LspPositions.toPosition(violation.getStart()),
                LspPositions.toPosition(violation.getEnd()));
        Diagnostic diagnostic = new Diagnostic(range, violation.getMessage(), DiagnosticSeverity.Warning, SOURCE,
                violation.getRuleId());
        return diagnostic;
    }
}
