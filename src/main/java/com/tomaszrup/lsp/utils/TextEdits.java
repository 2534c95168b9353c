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
package com.tomaszrup.lsp.utils;

import java.util.ArrayList;
import java.util.List;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;

/**
 * Minimal line-level edits between two versions of a text.
 */
public class TextEdits {
	private TextEdits() {
	}

	/**
	 * Computes at most one {@link TextEdit} that turns {@code original} into
	 * {@code updated}: the unchanged leading and trailing lines are kept and
	 * the lines in between are replaced. Line breaks are compared exactly, so
	 * a changed line ending counts as a change.
	 */
	public static List<TextEdit> diff(String original, String updated) {
		List<TextEdit> edits = new ArrayList<>();
		if (original.equals(updated)) {
			return edits;
		}
		List<int[]> origLines = splitLines(original);
		List<int[]> newLines = splitLines(updated);
		int origLen = origLines.size();
		int newLen = newLines.size();

		int top = 0;
		while (top < origLen && top < newLen
				&& lineText(original, origLines.get(top)).equals(lineText(updated, newLines.get(top)))) {
			top++;
		}
		int origBottom = origLen - 1;
		int newBottom = newLen - 1;
		while (origBottom >= top && newBottom >= top
				&& lineText(original, origLines.get(origBottom)).equals(lineText(updated, newLines.get(newBottom)))) {
			origBottom--;
			newBottom--;
		}

		String replacement = newBottom >= top
				? updated.substring(newLines.get(top)[0], newLines.get(newBottom)[2])
				: "";
		Position start = new Position(top, 0);
		Position end;
		if (origBottom < top) {
			end = start;
		} else {
			int[] last = origLines.get(origBottom);
			end = last[2] > last[1]
					? new Position(origBottom + 1, 0)
					: new Position(origBottom, last[1] - last[0]);
		}
		edits.add(new TextEdit(new Range(start, end), replacement));
		return edits;
	}

	/**
	 * Applies non-overlapping edits to {@code text}.
	 */
	public static String apply(String text, List<TextEdit> edits) {
		List<TextEdit> sorted = new ArrayList<>(edits);
		sorted.sort((a, b) -> Positions.COMPARATOR.compare(b.getRange().getStart(), a.getRange().getStart()));
		String result = text;
		for (TextEdit edit : sorted) {
			int start = Positions.getOffset(result, edit.getRange().getStart());
			int end = Positions.getOffset(result, edit.getRange().getEnd());
			if (start < 0 || end < start) {
				throw new IllegalArgumentException("edit range " + edit.getRange() + " lies outside the text");
			}
			result = result.substring(0, start) + edit.getNewText() + result.substring(end);
		}
		return result;
	}

	/** Lines as {start, contentEnd, end} offsets; the last line may be empty. */
	private static List<int[]> splitLines(String text) {
		List<int[]> lines = new ArrayList<>();
		int start = 0;
		int i = 0;
		while (i < text.length()) {
			char c = text.charAt(i);
			if (c == '\n' || c == '\r') {
				int contentEnd = i;
				i += (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') ? 2 : 1;
				lines.add(new int[] {start, contentEnd, i});
				start = i;
			} else {
				i++;
			}
		}
		lines.add(new int[] {start, text.length(), text.length()});
		return lines;
	}

	private static String lineText(String text, int[] line) {
		return text.substring(line[0], line[2]);
	}
}
