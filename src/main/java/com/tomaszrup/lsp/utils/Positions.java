////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
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
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lsp.utils;

import java.util.Comparator;

import org.eclipse.lsp4j.Position;

/**
 * Conversions between character offsets and LSP positions. A line break is
 * {@code \n}, {@code \r\n} or a lone {@code \r}.
 */
public class Positions {
	private Positions() {
	}

	public static final Comparator<Position> COMPARATOR = (Position p1, Position p2) -> {
		if (p1.getLine() != p2.getLine()) {
			return p1.getLine() - p2.getLine();
		}
		return p1.getCharacter() - p2.getCharacter();
	};

	public static boolean valid(Position p) {
		return p.getLine() >= 0 && p.getCharacter() >= 0;
	}

	/**
	 * @return the offset of {@code position} in {@code string}, or -1 if the
	 *         position lies outside the text
	 */
	public static int getOffset(String string, Position position) {
		if (string == null || position == null || !valid(position)) {
			return -1;
		}
		int lineStartOffset = findLineStartOffset(string, position.getLine());
		if (lineStartOffset < 0) {
			return -1;
		}
		int lineEndOffset = findLineEndOffset(string, lineStartOffset);
		int character = position.getCharacter();
		int lineLength = lineEndOffset - lineStartOffset;
		if (character > lineLength) {
			return -1;
		}

		return lineStartOffset + character;
	}

	/**
	 * Position of {@code offset}; an offset inside a {@code \r\n} pair maps
	 * to the end of its line.
	 */
	public static Position getPosition(String string, int offset) {
		if (offset < 0 || offset > string.length()) {
			throw new IndexOutOfBoundsException("offset " + offset + " outside text of length " + string.length());
		}
		int line = 0;
		int lineStart = 0;
		for (int i = 0; i < offset; i++) {
			char c = string.charAt(i);
			if (c == '\n' || (c == '\r' && (i + 1 >= string.length() || string.charAt(i + 1) != '\n'))) {
				line++;
				lineStart = i + 1;
			}
		}
		int character = offset - lineStart;
		if (offset > lineStart && string.charAt(offset - 1) == '\r') {
			character--;
		}
		return new Position(line, character);
	}

	private static int findLineStartOffset(String string, int line) {
		if (line == 0) {
			return 0;
		}
		int currentLine = 0;
		for (int i = 0; i < string.length(); i++) {
			char c = string.charAt(i);
			if (c == '\n' || (c == '\r' && (i + 1 >= string.length() || string.charAt(i + 1) != '\n'))) {
				currentLine++;
				if (currentLine == line) {
					return i + 1;
				}
			}
		}
		return -1;
	}

	private static int findLineEndOffset(String string, int lineStartOffset) {
		for (int i = lineStartOffset; i < string.length(); i++) {
			char c = string.charAt(i);
			if (c == '\n' || c == '\r') {
				return i;
			}
		}
		return string.length();
	}
}
