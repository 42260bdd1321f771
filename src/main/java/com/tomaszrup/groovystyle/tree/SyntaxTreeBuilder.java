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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Accumulates nodes for a {@link SyntaxTree}. The root {@link SyntaxKind#PROGRAM}
 * node spanning the whole text is created up front at index 0.
 *
 * <p>Children may be added in any order; {@link #build()} sorts every
 * child list by start offset so that traversal follows document order.</p>
 */
public final class SyntaxTreeBuilder {

    private final List<SyntaxNode> nodes = new ArrayList<>();
    private final List<List<Integer>> children = new ArrayList<>();
    private final int textLength;
    private boolean built;

    public SyntaxTreeBuilder(int textLength) {
        this.textLength = textLength;
        nodes.add(new SyntaxNode(0, SyntaxKind.PROGRAM, 0, textLength, -1, ChildRole.NONE));
        children.add(new ArrayList<>());
    }

    public int getRootIndex() {
        return 0;
    }

    /**
     * Adds a node under {@code parent} and returns its index.
     */
    public int addNode(SyntaxKind kind, int start, int end, int parent, ChildRole role) {
        checkNotBuilt();
        if (start < 0 || end < start || end > textLength) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ") for " + kind);
        }
        if (parent < 0 || parent >= nodes.size()) {
            throw new IllegalArgumentException("Unknown parent index " + parent);
        }
        int index = nodes.size();
        nodes.add(new SyntaxNode(index, kind, start, end, parent, role == null ? ChildRole.CHILD : role));
        children.add(new ArrayList<>());
        children.get(parent).add(index);
        return index;
    }

    public void setOperator(int index, String operator) {
        node(index).setOperator(operator);
    }

    public void setName(int index, String name) {
        node(index).setName(name);
    }

    public void setLiteral(int index, String value, boolean scalar) {
        node(index).setLiteral(value, scalar);
    }

    public void setTemplate(int index, int expressionCount, int quasiCount) {
        node(index).setTemplate(expressionCount, quasiCount);
    }

    public SyntaxTree build() {
        checkNotBuilt();
        built = true;
        Comparator<Integer> documentOrder = Comparator
                .<Integer>comparingInt(i -> nodes.get(i).getStart())
                .thenComparingInt(i -> i);
        for (int i = 0; i < nodes.size(); i++) {
            List<Integer> childList = children.get(i);
            if (childList.isEmpty()) {
                continue;
            }
            childList.sort(documentOrder);
            int[] indexes = new int[childList.size()];
            for (int j = 0; j < indexes.length; j++) {
                indexes[j] = childList.get(j);
            }
            nodes.get(i).setChildIndexes(indexes);
        }
        return new SyntaxTree(nodes);
    }

    private SyntaxNode node(int index) {
        checkNotBuilt();
        return nodes.get(index);
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("Tree has already been built");
        }
    }
}
