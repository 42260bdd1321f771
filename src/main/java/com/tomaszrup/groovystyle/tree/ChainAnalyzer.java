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
package com.tomaszrup.groovystyle.tree;

import java.util.Objects;

/**
 * Finds the root and first operand of left-associative operator chains.
 *
 * <p>{@code a || b || c} parses as {@code ((a || b) || c)}: the chain root
 * is the outermost {@code ||} and its leftmost operand is {@code a}. Every
 * continuation operator of the chain is aligned against the line of that
 * operand.</p>
 */
public final class ChainAnalyzer {

    private final SyntaxTree tree;

    public ChainAnalyzer(SyntaxTree tree) {
        this.tree = tree;
    }

    /**
     * Walks up while the parent is a binary node with the same operator and
     * {@code node} is its left operand.
     */
    public SyntaxNode chainRoot(SyntaxNode node) {
        SyntaxNode current = node;
        while (current.is(SyntaxKind.BINARY) && current.getRole() == ChildRole.LEFT) {
            SyntaxNode parent = tree.parent(current);
            if (parent == null || !sameOperator(parent, current)) {
                break;
            }
            current = parent;
        }
        return current;
    }

    /**
     * Descends through left operands sharing the node's operator and returns
     * the first operand of the innermost one. A non-binary node is its own
     * leftmost operand. Returns {@code null} if a binary node lacks a left
     * operand.
     */
    public SyntaxNode leftmostOperand(SyntaxNode node) {
        if (!node.is(SyntaxKind.BINARY)) {
            return node;
        }
        SyntaxNode current = node;
        while (true) {
            SyntaxNode left = tree.child(current, ChildRole.LEFT);
            if (left == null) {
                return null;
            }
            if (!sameOperator(left, current)) {
                return left;
            }
            current = left;
        }
    }

    /**
     * Reference operand for the {@code ?} and {@code :} of a conditional:
     * the test expression unwrapped to its leftmost operand.
     */
    public SyntaxNode conditionalReference(SyntaxNode conditional) {
        SyntaxNode test = tree.child(conditional, ChildRole.TEST);
        return test == null ? null : leftmostOperand(test);
    }

    private static boolean sameOperator(SyntaxNode a, SyntaxNode b) {
        return a.is(SyntaxKind.BINARY) && b.is(SyntaxKind.BINARY)
                && Objects.equals(a.getOperator(), b.getOperator());
    }
}
