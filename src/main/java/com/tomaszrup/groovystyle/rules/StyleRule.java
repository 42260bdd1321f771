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

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.tomaszrup.groovystyle.tree.SyntaxKind;

/**
 * A style rule plugin.
 *
 * <p>For every file checked the engine calls {@link #createHandlers} once
 * with a fresh {@link RuleContext}, then invokes the returned handlers for
 * each node of a matching kind in document order. Handlers report through
 * {@link RuleContext#report}. Rules keep no state between files.</p>
 */
public interface StyleRule {

    /** Stable identifier used in configuration and diagnostics. */
    String getId();

    String getDescription();

    default boolean isFixable() {
        return true;
    }

    default List<RuleOptionSpec> getOptionSpecs() {
        return Collections.emptyList();
    }

    Map<SyntaxKind, NodeHandler> createHandlers(RuleContext context);
}
