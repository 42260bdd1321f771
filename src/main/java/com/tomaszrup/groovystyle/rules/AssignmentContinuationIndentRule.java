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

import com.tomaszrup.groovystyle.source.Token;
import com.tomaszrup.groovystyle.tree.SyntaxKind;
import com.tomaszrup.groovystyle.tree.SyntaxNode;

/**
 * A value placed on the line after its {@code =} is indented exactly one
 * unit past the assignment line.
 */
public class AssignmentContinuationIndentRule implements StyleRule {

    public static final String ID = "assignment-continuation-indent";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Indent a value that starts on the line after '=' one unit past the assignment line";
    }

    @Override
    public Map<SyntaxKind, NodeHandler> createHandlers(RuleContext context) {
        Map<SyntaxKind, NodeHandler> handlers = new EnumMap<>(SyntaxKind.class);
        for (SyntaxKind kind : AssignmentSupport.ASSIGNMENT_KINDS) {
            handlers.put(kind, node -> check(context, node));
        }
        return handlers;
    }

    private void check(RuleContext context, SyntaxNode node) {
        AssignmentSupport.Assignment assignment = AssignmentSupport.locate(context, node);
        if (assignment == null) {
            return;
        }
        Token operator = assignment.operator;
        Token next = context.getTokens().tokenAfter(operator.getEnd());
        if (next == null || !context.getSourceText().containsNewline(operator.getEnd(), next.getStart())) {
            return;
        }
        String expected = context.lineIndent(operator.getStartLine()) + context.getIndentation().unit();
        int line = next.getStartLine();
        if (context.lineIndent(line).equals(expected)) {
            return;
        }
        context.report(next, "Value after '=' should be indented one level past the assignment",
                fixer -> fixer.replaceLineIndent(line, expected));
    }
}
