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

import java.util.List;

import com.tomaszrup.groovystyle.source.Token;
import com.tomaszrup.groovystyle.tree.ChildRole;
import com.tomaszrup.groovystyle.tree.SyntaxKind;
import com.tomaszrup.groovystyle.tree.SyntaxNode;
import com.tomaszrup.groovystyle.tree.SyntaxTree;

/**
 * Shared lookups for the rules that inspect variable bindings, plain
 * assignments and field initializers.
 */
final class AssignmentSupport {

    static final SyntaxKind[] ASSIGNMENT_KINDS = {
        SyntaxKind.VARIABLE_BINDING, SyntaxKind.ASSIGNMENT, SyntaxKind.FIELD_INITIALIZER
    };

    private static final int SHORT_IDENTIFIER_LENGTH = 20;

    /** The right-hand side of an assignment and the {@code =} token before it. */
    static final class Assignment {
        final SyntaxNode value;
        final Token operator;

        Assignment(SyntaxNode value, Token operator) {
            this.value = value;
            this.operator = operator;
        }
    }

    private AssignmentSupport() {
    }

    /**
     * Finds the value and its {@code =} token, or {@code null} when the node
     * has no value, uses a compound operator, or the token cannot be found.
     */
    static Assignment locate(RuleContext context, SyntaxNode node) {
        if (node.is(SyntaxKind.ASSIGNMENT) && !"=".equals(node.getOperator())) {
            return null;
        }
        SyntaxNode value = context.getTree().child(node, ChildRole.VALUE);
        if (value == null) {
            return null;
        }
        Token operator = context.getTokens().findBefore(value.getStart(), node.getStart(), t -> t.is("="));
        if (operator == null) {
            return null;
        }
        return new Assignment(value, operator);
    }

    /**
     * Values that may stay on the line of their {@code =}. The checks are
     * ordered and the first one that applies decides.
     */
    static boolean isSimpleValue(SyntaxTree tree, SyntaxNode node) {
        switch (node.getKind()) {
            case LITERAL:
                return node.isScalar();
            case IDENTIFIER:
                return node.getName() != null && node.getName().length() < SHORT_IDENTIFIER_LENGTH;
            case ARRAY_LITERAL:
                return tree.children(node, ChildRole.ELEMENT).isEmpty();
            case OBJECT_LITERAL:
                return tree.children(node, ChildRole.MEMBER).isEmpty();
            case TEMPLATE:
                return node.getTemplateExpressionCount() == 0 && node.getTemplateQuasiCount() == 1;
            case UNARY:
                SyntaxNode operand = tree.child(node, ChildRole.OPERAND);
                return operand != null && isSimpleValue(tree, operand);
            default:
                return false;
        }
    }

    /** Elements of an array literal or members of an object literal. */
    static List<SyntaxNode> items(SyntaxTree tree, SyntaxNode literal) {
        return tree.children(literal, literal.is(SyntaxKind.OBJECT_LITERAL) ? ChildRole.MEMBER : ChildRole.ELEMENT);
    }
}
