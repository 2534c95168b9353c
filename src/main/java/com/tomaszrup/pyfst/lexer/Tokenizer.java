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
package com.tomaszrup.pyfst.lexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lossless tokenizer for the supported Python 3 subset.
 *
 * <p>The concatenated text of the returned tokens is always the input text.
 * Indentation is tracked with CPython's width rule: a space counts one
 * column, a tab advances to the next multiple of 8 and a form feed resets
 * the width. Comment-only and blank lines never change the indentation
 * level; when a dedent closes blocks, each {@link TokenKind#DEDENT} is placed
 * after the last pending comment line that is still indented at least as
 * deep as the closed block, so such comments stay inside the block.</p>
 */
public class Tokenizer {
	public static final int TAB_SIZE = 8;

	private static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList(
			"False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
			"continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
			"if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
			"return", "try", "while", "with", "yield"));

	private static final String[] OPERATORS = {
			"**=", "//=", ">>=", "<<=", "...",
			"**", "//", ">>", "<<", "<=", ">=", "==", "!=", "->", "+=", "-=", "*=", "/=", "%=",
			"&=", "|=", "^=", "@=", ":=",
			"+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">", "(", ")", "[", "]",
			"{", "}", ",", ":", ".", ";", "="
	};

	private static final Set<String> STRING_PREFIXES = new HashSet<>(Arrays.asList(
			"r", "u", "b", "f", "br", "rb", "fr", "rf"));

	private static final Pattern NUMBER = Pattern.compile(
			"0[xX](?:_?[0-9a-fA-F])+"
					+ "|0[oO](?:_?[0-7])+"
					+ "|0[bB](?:_?[01])+"
					+ "|(?:(?:\\d(?:_?\\d)*)?\\.\\d(?:_?\\d)*|\\d(?:_?\\d)*\\.?)"
					+ "(?:[eE][+-]?\\d(?:_?\\d)*)?[jJ]?");

	private final String text;
	private final int length;
	private final List<Token> tokens = new ArrayList<>();
	private final Deque<Integer> indentStack = new ArrayDeque<>();
	private final List<PendingLine> pendingLines = new ArrayList<>();

	private int pos;
	private int bracketDepth;
	private boolean atLineStart = true;

	private final int[] lineStarts;

	private static final class PendingLine {
		private final List<Token> lineTokens = new ArrayList<>();
		private boolean comment;
		private int width;
	}

	private Tokenizer(String text) {
		this.text = text;
		this.length = text.length();
		this.lineStarts = computeLineStarts(text);
		indentStack.push(0);
	}

	public static List<Token> tokenize(String text) {
		if (text == null) {
			throw new IllegalArgumentException("text must not be null");
		}
		Tokenizer tokenizer = new Tokenizer(text);
		tokenizer.run();
		return tokenizer.tokens;
	}

	/**
	 * Indentation width of a run of leading whitespace.
	 */
	public static int indentationWidth(CharSequence whitespace) {
		int width = 0;
		for (int i = 0; i < whitespace.length(); i++) {
			char c = whitespace.charAt(i);
			if (c == '\t') {
				width = (width / TAB_SIZE + 1) * TAB_SIZE;
			} else if (c == '\f') {
				width = 0;
			} else {
				width++;
			}
		}
		return width;
	}

	public static boolean isKeyword(String word) {
		return KEYWORDS.contains(word);
	}

	/**
	 * Whether {@code word} scans as exactly one name or keyword token.
	 */
	public static boolean isIdentifier(String word) {
		if (word == null || word.isEmpty() || !isNameStart(word.codePointAt(0))) {
			return false;
		}
		int at = Character.charCount(word.codePointAt(0));
		while (at < word.length()) {
			int part = word.codePointAt(at);
			if (!isNamePart(part)) {
				return false;
			}
			at += Character.charCount(part);
		}
		return true;
	}

	private static boolean isNameStart(int codePoint) {
		return codePoint == '_' || Character.isUnicodeIdentifierStart(codePoint);
	}

	private static boolean isNamePart(int codePoint) {
		return codePoint == '_' || Character.isUnicodeIdentifierPart(codePoint);
	}

	private void run() {
		while (pos < length) {
			if (atLineStart && bracketDepth == 0) {
				scanLineStart();
			} else {
				scanToken();
			}
		}
		closeAllBlocks();
		tokens.add(token(TokenKind.END, pos, pos));
	}

	// ----------------------------------------------------------------
	// Line starts and indentation
	// ----------------------------------------------------------------

	private void scanLineStart() {
		int start = pos;
		int end = skipInlineWhitespace(pos);
		if (end >= length) {
			PendingLine blank = new PendingLine();
			blank.lineTokens.add(token(TokenKind.WHITESPACE, start, end));
			pendingLines.add(blank);
			pos = end;
			return;
		}
		char c = text.charAt(end);
		if (c == '\n' || c == '\r') {
			PendingLine blank = new PendingLine();
			if (end > start) {
				blank.lineTokens.add(token(TokenKind.WHITESPACE, start, end));
			}
			int newlineEnd = newlineEnd(end);
			blank.lineTokens.add(token(TokenKind.NEWLINE, end, newlineEnd));
			pendingLines.add(blank);
			pos = newlineEnd;
			return;
		}
		if (c == '#') {
			PendingLine commentLine = new PendingLine();
			commentLine.comment = true;
			commentLine.width = indentationWidth(text.substring(start, end));
			if (end > start) {
				commentLine.lineTokens.add(token(TokenKind.INDENTATION, start, end));
			}
			int commentEnd = commentEnd(end);
			commentLine.lineTokens.add(token(TokenKind.COMMENT, end, commentEnd));
			pos = commentEnd;
			if (pos < length) {
				int newlineEnd = newlineEnd(pos);
				commentLine.lineTokens.add(token(TokenKind.NEWLINE, pos, newlineEnd));
				pos = newlineEnd;
			}
			pendingLines.add(commentLine);
			return;
		}

		int width = indentationWidth(text.substring(start, end));
		int current = indentStack.peek();
		if (width > current) {
			flushPending();
			indentStack.push(width);
			tokens.add(token(TokenKind.INDENT, start, start));
		} else if (width < current) {
			dedentTo(width, start);
		} else {
			flushPending();
		}
		if (end > start) {
			tokens.add(token(TokenKind.INDENTATION, start, end));
		}
		pos = end;
		atLineStart = false;
	}

	private void dedentTo(int width, int offset) {
		List<Integer> closed = new ArrayList<>();
		while (indentStack.peek() > width) {
			closed.add(indentStack.pop());
		}
		if (indentStack.peek() != width) {
			throw lexError("unindent does not match any outer indentation level", offset);
		}
		emitPendingWithDedents(closed, offset);
	}

	private void closeAllBlocks() {
		List<Integer> closed = new ArrayList<>();
		while (indentStack.peek() > 0) {
			closed.add(indentStack.pop());
		}
		emitPendingWithDedents(closed, pos);
	}

	/**
	 * Emits pending comment/blank lines interleaved with one DEDENT per closed
	 * block. Innermost blocks come first in {@code closedWidths}.
	 */
	private void emitPendingWithDedents(List<Integer> closedWidths, int fallbackOffset) {
		int[] dedentPositions = new int[closedWidths.size()];
		for (int level = 0; level < closedWidths.size(); level++) {
			int blockWidth = closedWidths.get(level);
			int position = 0;
			for (int i = 0; i < pendingLines.size(); i++) {
				PendingLine line = pendingLines.get(i);
				if (line.comment && line.width >= blockWidth) {
					position = i + 1;
				}
			}
			dedentPositions[level] = position;
		}
		int level = 0;
		for (int i = 0; i <= pendingLines.size(); i++) {
			int markerOffset = i < pendingLines.size()
					? pendingLines.get(i).lineTokens.get(0).getOffset()
					: fallbackOffset;
			while (level < dedentPositions.length && dedentPositions[level] == i) {
				tokens.add(markerToken(TokenKind.DEDENT, markerOffset));
				level++;
			}
			if (i < pendingLines.size()) {
				tokens.addAll(pendingLines.get(i).lineTokens);
			}
		}
		pendingLines.clear();
	}

	private void flushPending() {
		for (PendingLine line : pendingLines) {
			tokens.addAll(line.lineTokens);
		}
		pendingLines.clear();
	}

	// ----------------------------------------------------------------
	// Tokens inside a logical line
	// ----------------------------------------------------------------

	private void scanToken() {
		int start = pos;
		char c = text.charAt(pos);

		if (c == ' ' || c == '\t' || c == '\f' || c == '\\'
				|| (bracketDepth > 0 && (c == '\n' || c == '\r'))) {
			scanWhitespace(start);
			return;
		}
		if (c == '\n' || c == '\r') {
			int end = newlineEnd(pos);
			tokens.add(token(TokenKind.NEWLINE, start, end));
			pos = end;
			atLineStart = true;
			return;
		}
		if (c == '#') {
			int end = commentEnd(pos);
			tokens.add(token(TokenKind.COMMENT, start, end));
			pos = end;
			return;
		}
		int stringStart = stringQuoteIndex(pos);
		if (stringStart >= 0) {
			int end = scanString(start, stringStart);
			tokens.add(token(TokenKind.STRING, start, end));
			pos = end;
			return;
		}
		if (Character.isDigit(c) || (c == '.' && pos + 1 < length && Character.isDigit(text.charAt(pos + 1)))) {
			Matcher matcher = NUMBER.matcher(text);
			matcher.region(pos, length);
			if (matcher.lookingAt() && matcher.end() > pos) {
				tokens.add(token(TokenKind.NUMBER, start, matcher.end()));
				pos = matcher.end();
				return;
			}
		}
		int codePoint = text.codePointAt(pos);
		if (isNameStart(codePoint)) {
			int end = pos + Character.charCount(codePoint);
			while (end < length) {
				int part = text.codePointAt(end);
				if (!isNamePart(part)) {
					break;
				}
				end += Character.charCount(part);
			}
			String word = text.substring(start, end);
			tokens.add(token(KEYWORDS.contains(word) ? TokenKind.KEYWORD : TokenKind.NAME, start, end));
			pos = end;
			return;
		}
		for (String operator : OPERATORS) {
			if (text.startsWith(operator, pos)) {
				trackBrackets(operator);
				tokens.add(token(TokenKind.OPERATOR, start, start + operator.length()));
				pos = start + operator.length();
				return;
			}
		}
		throw lexError("unexpected character '" + new String(Character.toChars(codePoint)) + "'", pos);
	}

	private void scanWhitespace(int start) {
		int end = start;
		while (end < length) {
			char c = text.charAt(end);
			if (c == ' ' || c == '\t' || c == '\f') {
				end++;
			} else if (c == '\\') {
				if (end + 1 >= length || (text.charAt(end + 1) != '\n' && text.charAt(end + 1) != '\r')) {
					throw lexError("unexpected character after line continuation character", end);
				}
				end = newlineEnd(end + 1);
			} else if (bracketDepth > 0 && (c == '\n' || c == '\r')) {
				end = newlineEnd(end);
			} else {
				break;
			}
		}
		tokens.add(token(TokenKind.WHITESPACE, start, end));
		pos = end;
	}

	private void trackBrackets(String operator) {
		if ("(".equals(operator) || "[".equals(operator) || "{".equals(operator)) {
			bracketDepth++;
		} else if ((")".equals(operator) || "]".equals(operator) || "}".equals(operator)) && bracketDepth > 0) {
			bracketDepth--;
		}
	}

	/**
	 * Returns the index of the opening quote when a string literal (with an
	 * optional prefix) starts at {@code start}, or -1.
	 */
	private int stringQuoteIndex(int start) {
		int i = start;
		while (i < length && i - start < 2 && Character.isLetter(text.charAt(i))) {
			i++;
		}
		for (int quote = start; quote <= i && quote < length; quote++) {
			char c = text.charAt(quote);
			if (c == '\'' || c == '"') {
				String prefix = text.substring(start, quote).toLowerCase();
				if (prefix.isEmpty() || STRING_PREFIXES.contains(prefix)) {
					return quote;
				}
				return -1;
			}
			if (!Character.isLetter(c)) {
				return -1;
			}
		}
		return -1;
	}

	private int scanString(int start, int quoteIndex) {
		char quote = text.charAt(quoteIndex);
		boolean triple = quoteIndex + 2 < length
				&& text.charAt(quoteIndex + 1) == quote
				&& text.charAt(quoteIndex + 2) == quote;
		int i = quoteIndex + (triple ? 3 : 1);
		while (i < length) {
			char c = text.charAt(i);
			if (c == '\\') {
				i = i + 1 < length ? escapedEnd(i + 1) : i + 1;
				continue;
			}
			if (triple) {
				if (c == quote && i + 2 < length
						&& text.charAt(i + 1) == quote && text.charAt(i + 2) == quote) {
					return i + 3;
				}
			} else {
				if (c == quote) {
					return i + 1;
				}
				if (c == '\n' || c == '\r') {
					throw lexError("unterminated string literal", start);
				}
			}
			i++;
		}
		throw lexError(triple ? "unterminated triple-quoted string literal" : "unterminated string literal", start);
	}

	private int escapedEnd(int escaped) {
		if (text.charAt(escaped) == '\r' && escaped + 1 < length && text.charAt(escaped + 1) == '\n') {
			return escaped + 2;
		}
		return escaped + 1;
	}

	private int skipInlineWhitespace(int from) {
		int i = from;
		while (i < length) {
			char c = text.charAt(i);
			if (c != ' ' && c != '\t' && c != '\f') {
				break;
			}
			i++;
		}
		return i;
	}

	private int commentEnd(int from) {
		int i = from;
		while (i < length && text.charAt(i) != '\n' && text.charAt(i) != '\r') {
			i++;
		}
		return i;
	}

	private int newlineEnd(int at) {
		if (text.charAt(at) == '\r' && at + 1 < length && text.charAt(at + 1) == '\n') {
			return at + 2;
		}
		return at + 1;
	}

	// ----------------------------------------------------------------
	// Token construction
	// ----------------------------------------------------------------

	private Token token(TokenKind kind, int start, int end) {
		int line = lineOf(start);
		return new Token(kind, text.substring(start, end), start, line, start - lineStarts[line]);
	}

	private Token markerToken(TokenKind kind, int offset) {
		return token(kind, offset, offset);
	}

	private static int[] computeLineStarts(String text) {
		List<Integer> starts = new ArrayList<>();
		starts.add(0);
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '\n' || (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n'))) {
				starts.add(i + 1);
			}
		}
		int[] result = new int[starts.size()];
		for (int i = 0; i < result.length; i++) {
			result[i] = starts.get(i);
		}
		return result;
	}

	private int lineOf(int offset) {
		int index = Arrays.binarySearch(lineStarts, offset);
		return index >= 0 ? index : -index - 2;
	}

	private LexError lexError(String message, int offset) {
		int line = lineOf(offset);
		return new LexError(message, offset, line, offset - lineStarts[line]);
	}
}
