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

/**
 * One unit of source text. Whitespace, comments and newlines are ordinary
 * tokens; nothing is discarded.
 */
public final class Token {
	private final TokenKind kind;
	private final String text;
	private final int offset;
	private final int line;
	private final int column;

	public Token(TokenKind kind, String text, int offset, int line, int column) {
		this.kind = kind;
		this.text = text;
		this.offset = offset;
		this.line = line;
		this.column = column;
	}

	public TokenKind getKind() {
		return kind;
	}

	public String getText() {
		return text;
	}

	/** Zero-based char offset of the first character. */
	public int getOffset() {
		return offset;
	}

	/** Zero-based line. */
	public int getLine() {
		return line;
	}

	/** Zero-based column. */
	public int getColumn() {
		return column;
	}

	public boolean is(TokenKind expectedKind, String expectedText) {
		return kind == expectedKind && text.equals(expectedText);
	}

	public boolean isOperator(String operator) {
		return is(TokenKind.OPERATOR, operator);
	}

	public boolean isKeyword(String keyword) {
		return is(TokenKind.KEYWORD, keyword);
	}

	/**
	 * Short description used in error messages.
	 */
	public String describe() {
		switch (kind) {
			case INDENT:
				return "indent";
			case DEDENT:
				return "dedent";
			case END:
				return "end of input";
			case NEWLINE:
				return "newline";
			case INDENTATION:
			case WHITESPACE:
				return "whitespace";
			default:
				return "'" + text + "'";
		}
	}

	@Override
	public String toString() {
		return kind + "[" + text.replace("\n", "\\n").replace("\r", "\\r") + "]@" + line + ":" + column;
	}
}
