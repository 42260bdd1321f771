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
package com.tomaszrup.groovystyle.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Ordered, read-only token sequence for one file.
 *
 * <p>Comments are kept in a separate list so that "previous" and "next"
 * queries only ever see code tokens. All lookups are binary searches over
 * the token offsets; methods return {@code null} when no token matches.</p>
 */
public final class TokenStream {

    private final List<Token> tokens;
    private final List<Token> comments;

    public TokenStream(List<Token> allTokens) {
        List<Token> code = new ArrayList<>();
        List<Token> commentTokens = new ArrayList<>();
        for (Token token : allTokens) {
            if (token.isComment()) {
                commentTokens.add(token);
            } else {
                code.add(token);
            }
        }
        this.tokens = Collections.unmodifiableList(code);
        this.comments = Collections.unmodifiableList(commentTokens);
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public List<Token> getComments() {
        return comments;
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    /**
     * Index of the first token starting at or after {@code offset}, or
     * {@link #size()} when there is none.
     */
    public int indexAtOrAfter(int offset) {
        return firstIndexStartingAtOrAfter(tokens, offset);
    }

    /**
     * Index of the last token ending at or before {@code offset}, or
     * {@code -1} when there is none.
     */
    public int indexEndingAtOrBefore(int offset) {
        int low = 0;
        int high = tokens.size() - 1;
        int result = -1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (tokens.get(mid).getEnd() <= offset) {
                result = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return result;
    }

    public Token tokenAfter(int offset) {
        int index = indexAtOrAfter(offset);
        return index < tokens.size() ? tokens.get(index) : null;
    }

    public Token tokenBefore(int offset) {
        int index = indexEndingAtOrBefore(offset);
        return index >= 0 ? tokens.get(index) : null;
    }

    /** First token that starts inside {@code [start, end)}. */
    public Token firstTokenIn(int start, int end) {
        Token token = tokenAfter(start);
        return token != null && token.getStart() < end ? token : null;
    }

    /** Last token lying entirely inside {@code [start, end)}. */
    public Token lastTokenIn(int start, int end) {
        Token token = tokenBefore(end);
        return token != null && token.getStart() >= start ? token : null;
    }

    /**
     * Closest token ending at or before {@code offset} that matches, not
     * looking further back than {@code lowerBound}.
     */
    public Token findBefore(int offset, int lowerBound, Predicate<Token> predicate) {
        for (int i = indexEndingAtOrBefore(offset); i >= 0; i--) {
            Token token = tokens.get(i);
            if (token.getStart() < lowerBound) {
                return null;
            }
            if (predicate.test(token)) {
                return token;
            }
        }
        return null;
    }

    /**
     * First token starting at or after {@code offset} that matches and ends
     * at or before {@code upperBound}.
     */
    public Token findAfter(int offset, int upperBound, Predicate<Token> predicate) {
        for (int i = indexAtOrAfter(offset); i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.getEnd() > upperBound) {
                return null;
            }
            if (predicate.test(token)) {
                return token;
            }
        }
        return null;
    }

    /**
     * {@code true} if any comment overlaps {@code [start, end)}.
     */
    public boolean hasCommentBetween(int start, int end) {
        int index = firstIndexStartingAtOrAfter(comments, start);
        if (index > 0 && comments.get(index - 1).getEnd() > start) {
            return true;
        }
        return index < comments.size() && comments.get(index).getStart() < end;
    }

    private static int firstIndexStartingAtOrAfter(List<Token> list, int offset) {
        int low = 0;
        int high = list.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (list.get(mid).getStart() < offset) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }
}
