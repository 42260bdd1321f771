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

import java.util.EnumMap;
import java.util.Map;

import com.tomaszrup.groovystyle.source.TextRange;
import com.tomaszrup.groovystyle.source.Token;
import com.tomaszrup.groovystyle.source.TokenStream;
import com.tomaszrup.groovystyle.tree.SyntaxKind;

/**
 * A closing parenthesis stays on the line of the last thing it encloses.
 *
 * <pre>
 * service.update(id,
 *     payload)
 * </pre>
 *
 * <p>Applies to argument and parameter lists, conditions and parenthesized
 * expressions alike; empty {@code ()} pairs are ignored. When a trailing
 * comma or a comment precedes the parenthesis the violation has no fix.</p>
 */
public class ClosingParenSameLineRule implements StyleRule {

    public static final String ID = "closing-paren-same-line";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Keep ')' on the same line as the last argument or expression";
    }

    @Override
    public Map<SyntaxKind, NodeHandler> createHandlers(RuleContext context) {
        Map<SyntaxKind, NodeHandler> handlers = new EnumMap<>(SyntaxKind.class);
        handlers.put(SyntaxKind.PROGRAM, node -> checkAll(context));
        return handlers;
    }

    private void checkAll(RuleContext context) {
        TokenStream tokens = context.getTokens();
        for (int i = 1; i < tokens.size(); i++) {
            Token paren = tokens.get(i);
            if (!paren.is(")")) {
                continue;
            }
            Token previous = tokens.get(i - 1);
            if (previous.is("(") || previous.getEndLine() >= paren.getStartLine()) {
                continue;
            }
            boolean fixable = !previous.is(",")
                    && !tokens.hasCommentBetween(previous.getEnd(), paren.getStart());
            context.report(paren, "Closing ')' should be on the same line as the last content", fixable
                    ? fixer -> fixer.replaceRange(new TextRange(previous.getEnd(), paren.getStart()), "")
                    : null);
        }
    }
}
