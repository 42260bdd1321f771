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
import com.tomaszrup.groovystyle.tree.SyntaxKind;
import com.tomaszrup.groovystyle.tree.SyntaxNode;

/**
 * Requires a line break after {@code =} unless the value is simple.
 *
 * <pre>
 * def user =
 *     repo.getById(id)
 * def name = 'short'
 * </pre>
 *
 * <p>Scalar literals, identifiers shorter than 20 characters, empty
 * list/map literals, GStrings without placeholders and unary operators
 * applied to any of those may stay on the {@code =} line. Compound
 * assignments such as {@code +=} are not checked.</p>
 */
public class AssignmentNewlineRule implements StyleRule {

    public static final String ID = "assignment-newline";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Break the line after '=' when the assigned value is not a simple value";
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
        if (assignment == null || AssignmentSupport.isSimpleValue(context.getTree(), assignment.value)) {
            return;
        }
        Token operator = assignment.operator;
        Token next = context.getTokens().tokenAfter(operator.getEnd());
        if (next == null || context.getSourceText().containsNewline(operator.getEnd(), next.getStart())) {
            return;
        }
        // the fix would swallow a comment sitting between '=' and the value
        boolean commented = context.getTokens().hasCommentBetween(operator.getEnd(), next.getStart());
        context.report(assignment.value, "Expected newline after '='", commented ? null
                : fixer -> fixer.replaceRange(new TextRange(operator.getEnd(), next.getStart()),
                        "\n" + context.lineIndent(operator.getStartLine()) + context.getIndentation().unit()));
    }
}
