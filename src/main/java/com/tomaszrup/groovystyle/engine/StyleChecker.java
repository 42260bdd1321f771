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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.groovystyle.parser.GroovySourceParser;
import com.tomaszrup.groovystyle.parser.SourceParseException;
import com.tomaszrup.groovystyle.tree.ParsedSource;

/**
 * Parses, checks and fixes single files.
 *
 * <p>{@link #fix} repeats check-and-fix passes until no fixable violation
 * remains, a pass changes nothing, or {@link #MAX_FIX_PASSES} passes have
 * run. A pass whose result no longer parses is discarded.</p>
 */
public class StyleChecker {

    private static final Logger logger = LoggerFactory.getLogger(StyleChecker.class);

    public static final int MAX_FIX_PASSES = 10;

    private final GroovySourceParser parser;
    private final StyleEngine engine;

    public StyleChecker(GroovySourceParser parser, StyleEngine engine) {
        this.parser = parser;
        this.engine = engine;
    }

    public StyleEngine getEngine() {
        return engine;
    }

    public CheckResult check(String name, String text) {
        ParsedSource source;
        try {
            source = parser.parse(name, text);
        } catch (SourceParseException e) {
            logger.debug("Skipping style check of {}: {} (line {}, column {})", name, e.getMessage(),
                    e.getLine(), e.getColumn());
            return CheckResult.failed(name, e);
        }
        return CheckResult.checked(name, engine.lint(source));
    }

    public FixOutcome fix(String name, String text) {
        String current = text;
        CheckResult result = check(name, current);
        int passes = 0;
        int appliedFixes = 0;
        while (result.isParsed() && result.hasFixableViolations() && passes < MAX_FIX_PASSES) {
            FixApplier.FixApplication application = FixApplier.apply(current, result.getViolations());
            passes++;
            if (application.getAppliedCount() == 0 || application.getText().equals(current)) {
                break;
            }
            CheckResult next = check(name, application.getText());
            if (!next.isParsed()) {
                logger.warn("Fix pass {} made {} unparseable ({}), keeping the previous text", passes, name,
                        next.getFailure().getMessage());
                break;
            }
            current = application.getText();
            appliedFixes += application.getAppliedCount();
            result = next;
        }
        if (passes == MAX_FIX_PASSES && result.hasFixableViolations()) {
            logger.warn("{} still has fixable violations after {} fix passes", name, MAX_FIX_PASSES);
        }
        return new FixOutcome(text, current, passes, appliedFixes, result);
    }
}
