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

/**
 * Kind tag of a {@link SyntaxNode}. Rules register their handlers per kind.
 */
public enum SyntaxKind {
    PROGRAM,
    CLASS,
    METHOD,
    BLOCK,
    STATEMENT,
    LAMBDA,
    CLOSURE,
    BINARY,
    CONDITIONAL,
    VARIABLE_BINDING,
    ASSIGNMENT,
    FIELD_INITIALIZER,
    OBJECT_LITERAL,
    ARRAY_LITERAL,
    PROPERTY,
    LITERAL,
    IDENTIFIER,
    TEMPLATE,
    UNARY,
    CALL,
    MEMBER_ACCESS,
    OTHER;

    /** Object or array literal. */
    public boolean isCollectionLiteral() {
        return this == OBJECT_LITERAL || this == ARRAY_LITERAL;
    }

    /** Variable binding, assignment or field initializer. */
    public boolean isAssignmentLike() {
        return this == VARIABLE_BINDING || this == ASSIGNMENT || this == FIELD_INITIALIZER;
    }
}
