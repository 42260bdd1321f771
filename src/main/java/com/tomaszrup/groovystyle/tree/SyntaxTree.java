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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Flat arena of {@link SyntaxNode}s. Parent and child links are indexes into
 * this arena, so the whole tree is released as one list.
 */
public final class SyntaxTree {

    private final List<SyntaxNode> nodes;

    SyntaxTree(List<SyntaxNode> nodes) {
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
    }

    public SyntaxNode getRoot() {
        return nodes.get(0);
    }

    public int size() {
        return nodes.size();
    }

    public SyntaxNode node(int index) {
        return nodes.get(index);
    }

    public SyntaxNode parent(SyntaxNode node) {
        int parent = node.getParentIndex();
        return parent >= 0 ? nodes.get(parent) : null;
    }

    public List<SyntaxNode> children(SyntaxNode node) {
        int[] indexes = node.getChildIndexes();
        List<SyntaxNode> result = new ArrayList<>(indexes.length);
        for (int index : indexes) {
            result.add(nodes.get(index));
        }
        return result;
    }

    /** Children with the given role, in document order. */
    public List<SyntaxNode> children(SyntaxNode node, ChildRole role) {
        List<SyntaxNode> result = new ArrayList<>();
        for (int index : node.getChildIndexes()) {
            SyntaxNode child = nodes.get(index);
            if (child.getRole() == role) {
                result.add(child);
            }
        }
        return result;
    }

    /** First child with the given role, or {@code null}. */
    public SyntaxNode child(SyntaxNode node, ChildRole role) {
        for (int index : node.getChildIndexes()) {
            SyntaxNode child = nodes.get(index);
            if (child.getRole() == role) {
                return child;
            }
        }
        return null;
    }

    /** All nodes in pre-order (document order), starting with the root. */
    public List<SyntaxNode> preOrder() {
        List<SyntaxNode> result = new ArrayList<>(nodes.size());
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(getRoot());
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            result.add(node);
            int[] indexes = node.getChildIndexes();
            for (int i = indexes.length - 1; i >= 0; i--) {
                stack.push(nodes.get(indexes[i]));
            }
        }
        return result;
    }
}
