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
package com.tomaszrup.groovystyle.providers;

import java.util.ArrayList;
import java.util.List;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;

import com.tomaszrup.groovystyle.engine.FixOutcome;
import com.tomaszrup.groovystyle.engine.StyleChecker;

/**
 * Provides textDocument/formatting by running the style fix loop.
 *
 * <p>Line endings are normalized to {@code \n} before fixing, so a document
 * with {@code \r\n} endings gets them rewritten by the first formatting
 * request that changes anything.</p>
 */
public class FormattingProvider {

	private final StyleChecker checker;

	public FormattingProvider(StyleChecker checker) {
		this.checker = checker;
	}

	/**
	 * @return a single line-level edit covering the changed lines, or an
	 *         empty list when the document is already clean or does not parse
	 */
	public List<TextEdit> provideFormatting(String name, String sourceText) {
		if (sourceText == null || sourceText.isEmpty()) {
			return new ArrayList<>();
		}
		String normalizedSource = normalizeLineEndings(sourceText);
		FixOutcome outcome = checker.fix(name, normalizedSource);
		if (!outcome.isChanged()) {
			return new ArrayList<>();
		}
		return computeMinimalEdits(normalizedSource, outcome.getText());
	}

	static String normalizeLineEndings(String text) {
		return text.replace("\r\n", "\n").replace("\r", "\n");
	}

	/**
	 * Compute minimal line-level TextEdits between the original and fixed text.
	 */
	public static List<TextEdit> computeMinimalEdits(String original, String fixed) {
		String[] origLines = original.split("\\n", -1);
		String[] fixedLines = fixed.split("\\n", -1);
		List<TextEdit> edits = new ArrayList<>();

		int top = findFirstDifferentLine(origLines, fixedLines);
		if (top == origLines.length && top == fixedLines.length) {
			return edits;
		}

		int[] bottoms = findLastDifferentLine(origLines, fixedLines, top);
		int origBottom = bottoms[0];
		int fixedBottom = bottoms[1];

		String replacement = joinLines(fixedLines, top, fixedBottom);
		edits.add(createEdit(origLines, top, origBottom, fixedBottom, replacement));
		return edits;
	}

	private static int findFirstDifferentLine(String[] origLines, String[] fixedLines) {
		int top = 0;
		int minLen = Math.min(origLines.length, fixedLines.length);
		while (top < minLen && origLines[top].equals(fixedLines[top])) {
			top++;
		}
		return top;
	}

	private static int[] findLastDifferentLine(String[] origLines, String[] fixedLines, int top) {
		int origBottom = origLines.length - 1;
		int fixedBottom = fixedLines.length - 1;
		while (origBottom >= top && fixedBottom >= top && origLines[origBottom].equals(fixedLines[fixedBottom])) {
			origBottom--;
			fixedBottom--;
		}
		return new int[] {origBottom, fixedBottom};
	}

	private static String joinLines(String[] lines, int from, int to) {
		StringBuilder joined = new StringBuilder();
		for (int j = from; j <= to; j++) {
			if (j > from) {
				joined.append("\n");
			}
			joined.append(lines[j]);
		}
		return joined.toString();
	}

	private static TextEdit createEdit(String[] origLines, int top, int origBottom, int fixedBottom,
			String replacementText) {
		String replacement = replacementText;
		Position start;
		Position end;

		if (top > origBottom) {
			// pure insertion of whole lines
			if (top == 0) {
				start = new Position(0, 0);
				end = new Position(0, 0);
				if (fixedBottom >= top) {
					replacement = replacement + "\n";
				}
			} else {
				start = new Position(top - 1, origLines[top - 1].length());
				end = new Position(top - 1, origLines[top - 1].length());
				if (fixedBottom >= top) {
					replacement = "\n" + replacement;
				}
			}
		} else if (fixedBottom < top) {
			// pure deletion of whole lines, including the line break before them
			if (top == 0) {
				start = new Position(0, 0);
				end = origBottom + 1 < origLines.length ? new Position(origBottom + 1, 0)
						: new Position(origBottom, origLines[origBottom].length());
			} else {
				start = new Position(top - 1, origLines[top - 1].length());
				end = new Position(origBottom, origLines[origBottom].length());
			}
		} else {
			start = new Position(top, 0);
			end = new Position(origBottom, origLines[origBottom].length());
		}

		return new TextEdit(new Range(start, end), replacement);
	}
}
