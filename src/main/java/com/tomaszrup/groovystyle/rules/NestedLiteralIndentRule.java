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
import java.util.List;
import java.util.Map;

import com.tomaszrup.groovystyle.source.Indentation;
import com.tomaszrup.groovystyle.source.SourceText;
import com.tomaszrup.groovystyle.source.Token;
import com.tomaszrup.groovystyle.source.TokenStream;
import com.tomaszrup.groovystyle.tree.ChildRole;
import com.tomaszrup.groovystyle.tree.SyntaxKind;
import com.tomaszrup.groovystyle.tree.SyntaxNode;
import com.tomaszrup.groovystyle.tree.SyntaxTree;

/**
 * Re-indents multi-line map and list literals assigned on the line after
 * their {@code =}.
 *
 * <pre>
 * def config =
 *     [
 *         name: 'app',
 *         limits: [
 *             cpu: 2
 *         ]
 *     ]
 * </pre>
 *
 * <p>Members sit {@code depth + 1} units past the assignment line's
 * indentation and the closing bracket {@code depth} units past it, with
 * {@code depth} starting at 1 and growing by one per nested literal.</p>
 */
public class NestedLiteralIndentRule implements StyleRule {

    public static final String ID = "nested-literal-indent";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Indent the members and closing bracket of multi-line literals relative to the assignment line";
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
        if (assignment == null || !assignment.value.getKind().isCollectionLiteral()) {
            return;
        }
        if (AssignmentSupport.items(context.getTree(), assignment.value).isEmpty()) {
            return;
        }
        Token open = context.firstTokenOf(assignment.value);
        if (open == null || !context.getSourceText().containsNewline(assignment.operator.getEnd(), open.getStart())) {
            return;
        }
        String baseIndent = context.lineIndent(assignment.operator.getStartLine());
        checkLiteral(context, assignment.value, baseIndent, 1);
    }

    private void checkLiteral(RuleContext context, SyntaxNode literal, String baseIndent, int depthFromAssignment) {
        SyntaxTree tree = context.getTree();
        TokenStream tokens = context.getTokens();
        List<SyntaxNode> items = AssignmentSupport.items(tree, literal);
        if (items.isEmpty()) {
            return;
        }
        Token open = context.firstTokenOf(literal);
        Token close = context.lastTokenOf(literal);
        if (open == null || close == null || open.getStartLine() == close.getEndLine()) {
            return;
        }
        Indentation indentation = context.getIndentation();
        String contentIndent = indentation.indentFrom(baseIndent, depthFromAssignment + 1);
        String closeIndent = indentation.indentFrom(baseIndent, depthFromAssignment);

        for (SyntaxNode item : items) {
            Token first = context.firstTokenOf(item);
            if (first == null) {
                continue;
            }
            Token previous = tokens.tokenBefore(first.getStart());
            if (previous != null && first.getStartLine() != previous.getEndLine()) {
                checkLineIndent(context, first, contentIndent,
                        "Content should be indented " + (depthFromAssignment + 1) + " level(s) from assignment");
            }
            if (item.is(SyntaxKind.PROPERTY)) {
                checkPropertyValue(context, item, baseIndent, depthFromAssignment);
            } else if (item.getKind().isCollectionLiteral()) {
                checkLiteral(context, item, baseIndent, depthFromAssignment + 1);
            }
        }

        Token beforeClose = tokens.tokenBefore(close.getStart());
        if (beforeClose != null && close.getStartLine() != beforeClose.getEndLine()) {
            checkLineIndent(context, close, closeIndent, "Closing bracket should align with opening bracket");
        }
    }

    private void checkPropertyValue(RuleContext context, SyntaxNode property, String baseIndent,
            int depthFromAssignment) {
        SyntaxTree tree = context.getTree();
        SyntaxNode value = tree.child(property, ChildRole.VALUE);
        if (value == null || !value.getKind().isCollectionLiteral()) {
            return;
        }
        SyntaxNode key = tree.child(property, ChildRole.KEY);
        int keyEnd = key != null ? key.getEnd() : property.getStart();
        Token colon = context.getTokens().findAfter(keyEnd, value.getStart(), t -> t.is(":"));
        Token valueFirst = context.firstTokenOf(value);
        if (colon == null || valueFirst == null) {
            return;
        }
        SourceText text = context.getSourceText();
        if (text.containsNewline(colon.getEnd(), valueFirst.getStart())) {
            checkLiteral(context, value, baseIndent, depthFromAssignment + 1);
        } else if (!AssignmentSupport.items(tree, value).isEmpty()) {
            Token valueLast = context.lastTokenOf(value);
            if (valueLast != null && valueFirst.getStartLine() != valueLast.getEndLine()) {
                checkLiteral(context, value, baseIndent, depthFromAssignment + 1);
            }
        }
    }

    private void checkLineIndent(RuleContext context, Token token, String expected, String message) {
        int line = token.getStartLine();
        String actual = context.lineIndent(line);
        if (actual.equals(expected)) {
            return;
        }
        context.report(token, message, fixer -> fixer.replaceLineIndent(line, expected));
    }
}
