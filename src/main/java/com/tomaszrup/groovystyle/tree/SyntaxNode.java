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

import com.tomaszrup.groovystyle.source.TextRange;

/**
 * One node in a {@link SyntaxTree} arena.
 *
 * <p>The parent and children are stored as indexes into the owning tree's
 * node list, never as object references. Kind-specific attributes
 * (operator, name, literal value, template counts) are {@code null} or zero
 * when they do not apply. Instances are only created through
 * {@link SyntaxTreeBuilder} and are read-only once the tree is built.</p>
 */
public final class SyntaxNode {

    static final int[] NO_CHILDREN = new int[0];

    private final int index;
    private final SyntaxKind kind;
    private final int start;
    private final int end;
    private final int parent;
    private final ChildRole role;

    private int[] children = NO_CHILDREN;
    private String operator;
    private String name;
    private String literalValue;
    private boolean scalar;
    private int templateExpressionCount;
    private int templateQuasiCount;

    SyntaxNode(int index, SyntaxKind kind, int start, int end, int parent, ChildRole role) {
        this.index = index;
        this.kind = kind;
        this.start = start;
        this.end = end;
        this.parent = parent;
        this.role = role;
    }

    public int getIndex() {
        return index;
    }

    public SyntaxKind getKind() {
        return kind;
    }

    public boolean is(SyntaxKind other) {
        return kind == other;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int length() {
        return end - start;
    }

    public TextRange getRange() {
        return new TextRange(start, end);
    }

    /** Index of the parent node, or {@code -1} for the root. */
    public int getParentIndex() {
        return parent;
    }

    public ChildRole getRole() {
        return role;
    }

    int[] getChildIndexes() {
        return children;
    }

    public int getChildCount() {
        return children.length;
    }

    /** Operator text of a binary, assignment or unary node. */
    public String getOperator() {
        return operator;
    }

    /** Name of an identifier node. */
    public String getName() {
        return name;
    }

    /** Source-independent rendering of a literal's value. */
    public String getLiteralValue() {
        return literalValue;
    }

    /** {@code true} for string, number, boolean, character and null literals. */
    public boolean isScalar() {
        return scalar;
    }

    public int getTemplateExpressionCount() {
        return templateExpressionCount;
    }

    public int getTemplateQuasiCount() {
        return templateQuasiCount;
    }

    void setChildIndexes(int[] children) {
        this.children = children;
    }

    void setOperator(String operator) {
        this.operator = operator;
    }

    void setName(String name) {
        this.name = name;
    }

    void setLiteral(String value, boolean scalar) {
        this.literalValue = value;
        this.scalar = scalar;
    }

    void setTemplate(int expressionCount, int quasiCount) {
        this.templateExpressionCount = expressionCount;
        this.templateQuasiCount = quasiCount;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(kind).append('#').append(index).append('[').append(start).append(", ").append(end).append(')');
        if (operator != null) {
            builder.append(" op=").append(operator);
        }
        if (name != null) {
            builder.append(" name=").append(name);
        }
        return builder.toString();
    }
}
