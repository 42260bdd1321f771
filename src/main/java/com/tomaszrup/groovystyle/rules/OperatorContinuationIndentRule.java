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

import com.tomaszrup.groovystyle.source.Indentation;
import com.tomaszrup.groovystyle.source.Token;
import com.tomaszrup.groovystyle.tree.ChainAnalyzer;
import com.tomaszrup.groovystyle.tree.ChildRole;
import com.tomaszrup.groovystyle.tree.SyntaxKind;
import com.tomaszrup.groovystyle.tree.SyntaxNode;
import com.tomaszrup.groovystyle.tree.SyntaxTree;

/**
 * Indents an operator that starts a continuation line exactly one unit
 * deeper than the line holding the first operand of its chain.
 *
 * <pre>
 * def valid = first
 *     || second
 *     || third
 * </pre>
 *
 * <p>All operators of one left-associative chain share the same reference
 * line. For a conditional, {@code ?} and {@code :} both align against the
 * first operand of the test.</p>
 */
public class OperatorContinuationIndentRule implements StyleRule {

    public static final String ID = "operator-continuation-indent";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Indent operators at the start of a continuation line one unit past the chain's first operand";
    }

    @Override
    public Map<SyntaxKind, NodeHandler> createHandlers(RuleContext context) {
        Map<SyntaxKind, NodeHandler> handlers = new EnumMap<>(SyntaxKind.class);
        handlers.put(SyntaxKind.BINARY, node -> checkBinary(context, node));
        handlers.put(SyntaxKind.CONDITIONAL, node -> checkConditional(context, node));
        return handlers;
    }

    private void checkBinary(RuleContext context, SyntaxNode node) {
        SyntaxTree tree = context.getTree();
        SyntaxNode left = tree.child(node, ChildRole.LEFT);
        SyntaxNode right = tree.child(node, ChildRole.RIGHT);
        String operator = node.getOperator();
        if (left == null || right == null || operator == null) {
            return;
        }
        Token operatorToken = context.getTokens().findAfter(left.getEnd(), right.getStart(), t -> t.is(operator));
        if (operatorToken == null || !startsLine(context, operatorToken)) {
            return;
        }
        ChainAnalyzer chains = context.getChains();
        SyntaxNode reference = chains.leftmostOperand(chains.chainRoot(node));
        if (reference != null) {
            checkOperatorIndent(context, operatorToken, reference);
        }
    }

    private void checkConditional(RuleContext context, SyntaxNode node) {
        SyntaxTree tree = context.getTree();
        SyntaxNode test = tree.child(node, ChildRole.TEST);
        SyntaxNode consequent = tree.child(node, ChildRole.CONSEQUENT);
        SyntaxNode alternate = tree.child(node, ChildRole.ALTERNATE);
        SyntaxNode reference = context.getChains().conditionalReference(node);
        if (test == null || consequent == null || alternate == null || reference == null) {
            return;
        }
        Token question = context.getTokens().findAfter(test.getEnd(), consequent.getStart(), t -> t.is("?"));
        if (question != null && startsLine(context, question)) {
            checkOperatorIndent(context, question, reference);
        }
        Token colon = context.getTokens().findAfter(consequent.getEnd(), alternate.getStart(), t -> t.is(":"));
        if (colon != null && startsLine(context, colon)) {
            checkOperatorIndent(context, colon, reference);
        }
    }

    /** The token is the first code token on its line. */
    private static boolean startsLine(RuleContext context, Token token) {
        Token previous = context.getTokens().tokenBefore(token.getStart());
        return previous != null && previous.getEndLine() < token.getStartLine();
    }

    private void checkOperatorIndent(RuleContext context, Token operator, SyntaxNode reference) {
        Indentation indentation = context.getIndentation();
        int referenceLine = context.lineOf(reference.getStart());
        int expected = indentation.depth(context.lineIndent(referenceLine)) + 1;
        int line = operator.getStartLine();
        int actual = indentation.depth(context.lineIndent(line));
        if (actual == expected) {
            return;
        }
        String message = "Operator '" + operator.getText() + "' should be indented " + expected
                + " level(s), found " + actual;
        context.report(operator, message,
                fixer -> fixer.replaceLineIndent(line, indentation.expectedIndentString(expected)));
    }
}
