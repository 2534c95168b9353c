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

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class TokenizerTests {

	private static List<TokenKind> kinds(String source) {
		List<TokenKind> kinds = new ArrayList<>();
		for (Token token : Tokenizer.tokenize(source)) {
			kinds.add(token.getKind());
		}
		return kinds;
	}

	private static String concat(List<Token> tokens) {
		StringBuilder builder = new StringBuilder();
		for (Token token : tokens) {
			builder.append(token.getText());
		}
		return builder.toString();
	}

	// ------------------------------------------------------------------
	// Losslessness
	// ------------------------------------------------------------------

	@Test
	void testTokensConcatenateToSource() {
		String source = "def f(a,  b = 1):  # doc\n\tif a :\n\t\treturn [a ,\n  b]\n\n# tail\n";
		Assertions.assertEquals(source, concat(Tokenizer.tokenize(source)));
	}

	@Test
	void testCrlfAndContinuationArePreserved() {
		String source = "x = 1 + \\\r\n    2\r\ny = 'a'\r\n";
		Assertions.assertEquals(source, concat(Tokenizer.tokenize(source)));
	}

	@Test
	void testEmptySourceYieldsOnlyEnd() {
		List<Token> tokens = Tokenizer.tokenize("");
		Assertions.assertEquals(1, tokens.size());
		Assertions.assertEquals(TokenKind.END, tokens.get(0).getKind());
	}

	@Test
	void testNullSourceIsRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> Tokenizer.tokenize(null));
	}

	// ------------------------------------------------------------------
	// Classification
	// ------------------------------------------------------------------

	@Test
	void testSimpleAssignment() {
		List<Token> tokens = Tokenizer.tokenize("x = 1\n");
		Assertions.assertEquals(TokenKind.NAME, tokens.get(0).getKind());
		Assertions.assertEquals(TokenKind.WHITESPACE, tokens.get(1).getKind());
		Assertions.assertTrue(tokens.get(2).isOperator("="));
		Assertions.assertEquals(TokenKind.NUMBER, tokens.get(4).getKind());
		Assertions.assertEquals(TokenKind.NEWLINE, tokens.get(5).getKind());
		Assertions.assertEquals(TokenKind.END, tokens.get(tokens.size() - 1).getKind());
	}

	@Test
	void testKeywordsAreDistinguishedFromNames() {
		List<Token> tokens = Tokenizer.tokenize("lambda_ = lambda: None");
		Assertions.assertEquals(TokenKind.NAME, tokens.get(0).getKind());
		Assertions.assertTrue(tokens.get(4).isKeyword("lambda"));
		Assertions.assertTrue(tokens.get(7).isKeyword("None"));
	}

	@Test
	void testLongestOperatorWins() {
		List<Token> tokens = Tokenizer.tokenize("a **= b // c");
		Assertions.assertTrue(tokens.get(2).isOperator("**="));
		Assertions.assertTrue(tokens.get(6).isOperator("//"));
	}

	@Test
	void testNumberForms() {
		for (String number : new String[] { "0x_ff", "0o17", "0b1010", "1_000", "3.14", ".5", "1e-3", "2j", "7." }) {
			List<Token> tokens = Tokenizer.tokenize(number);
			Assertions.assertEquals(TokenKind.NUMBER, tokens.get(0).getKind(), number);
			Assertions.assertEquals(number, tokens.get(0).getText());
		}
	}

	@Test
	void testStringPrefixesAndTripleQuotes() {
		List<Token> tokens = Tokenizer.tokenize("rb'\\d' + f\"{x}\" + '''a\n'b'\n'''");
		Assertions.assertEquals("rb'\\d'", tokens.get(0).getText());
		Assertions.assertEquals(TokenKind.STRING, tokens.get(0).getKind());
		Assertions.assertEquals("f\"{x}\"", tokens.get(4).getText());
		Assertions.assertEquals("'''a\n'b'\n'''", tokens.get(8).getText());
	}

	@Test
	void testNameThatLooksLikePrefixIsNotAString() {
		List<Token> tokens = Tokenizer.tokenize("bar'x'");
		Assertions.assertEquals(TokenKind.NAME, tokens.get(0).getKind());
		Assertions.assertEquals("bar", tokens.get(0).getText());
	}

	@Test
	void testNewlinesInsideBracketsAreWhitespace() {
		List<TokenKind> kinds = kinds("f(a,\n  b)\n");
		Assertions.assertEquals(1, java.util.Collections.frequency(kinds, TokenKind.NEWLINE));
		Assertions.assertFalse(kinds.contains(TokenKind.INDENT));
	}

	@Test
	void testTokenPositions() {
		List<Token> tokens = Tokenizer.tokenize("a\n  b = c\n");
		Token c = null;
		for (Token token : tokens) {
			if ("c".equals(token.getText())) {
				c = token;
			}
		}
		Assertions.assertNotNull(c);
		Assertions.assertEquals(8, c.getOffset());
		Assertions.assertEquals(1, c.getLine());
		Assertions.assertEquals(6, c.getColumn());
	}

	// ------------------------------------------------------------------
	// Indentation
	// ------------------------------------------------------------------

	@Test
	void testIndentAndDedentMarkers() {
		List<TokenKind> kinds = kinds("if a:\n    b\nc\n");
		int indent = kinds.indexOf(TokenKind.INDENT);
		int dedent = kinds.indexOf(TokenKind.DEDENT);
		Assertions.assertTrue(indent > 0);
		Assertions.assertTrue(dedent > indent);
		Assertions.assertEquals(TokenKind.INDENTATION, kinds.get(indent + 1));
	}

	@Test
	void testBlocksClosedAtEndOfInput() {
		List<TokenKind> kinds = kinds("def f():\n    if a:\n        b\n");
		Assertions.assertEquals(2, java.util.Collections.frequency(kinds, TokenKind.DEDENT));
		Assertions.assertEquals(TokenKind.END, kinds.get(kinds.size() - 1));
	}

	@Test
	void testIndentedCommentStaysInsideBlock() {
		List<Token> tokens = Tokenizer.tokenize("if a:\n    b\n    # inner\nc\n");
		int comment = -1;
		int dedent = -1;
		for (int i = 0; i < tokens.size(); i++) {
			if (tokens.get(i).getKind() == TokenKind.COMMENT) {
				comment = i;
			} else if (tokens.get(i).getKind() == TokenKind.DEDENT) {
				dedent = i;
			}
		}
		Assertions.assertTrue(comment < dedent);
	}

	@Test
	void testOutdentedCommentLeavesBlock() {
		List<Token> tokens = Tokenizer.tokenize("if a:\n    b\n# outer\nc\n");
		int comment = -1;
		int dedent = -1;
		for (int i = 0; i < tokens.size(); i++) {
			if (tokens.get(i).getKind() == TokenKind.COMMENT) {
				comment = i;
			} else if (tokens.get(i).getKind() == TokenKind.DEDENT) {
				dedent = i;
			}
		}
		Assertions.assertTrue(dedent < comment);
	}

	@Test
	void testTabsCountToNextMultipleOfEight() {
		Assertions.assertEquals(8, Tokenizer.indentationWidth("\t"));
		Assertions.assertEquals(8, Tokenizer.indentationWidth("   \t"));
		Assertions.assertEquals(12, Tokenizer.indentationWidth("\t    "));
	}

	// ------------------------------------------------------------------
	// Errors
	// ------------------------------------------------------------------

	@Test
	void testUnterminatedString() {
		LexError error = Assertions.assertThrows(LexError.class, () -> Tokenizer.tokenize("x = 'abc\n"));
		Assertions.assertEquals(4, error.getOffset());
		Assertions.assertEquals(0, error.getLine());
	}

	@Test
	void testUnterminatedTripleQuotedString() {
		Assertions.assertThrows(LexError.class, () -> Tokenizer.tokenize("x = \"\"\"abc\n"));
	}

	@Test
	void testInconsistentDedent() {
		Assertions.assertThrows(LexError.class, () -> Tokenizer.tokenize("if a:\n    b\n  c\n"));
	}

	@Test
	void testUnexpectedCharacter() {
		LexError error = Assertions.assertThrows(LexError.class, () -> Tokenizer.tokenize("a = $b"));
		Assertions.assertEquals(4, error.getColumn());
	}

	@Test
	void testStrayBackslash() {
		Assertions.assertThrows(LexError.class, () -> Tokenizer.tokenize("a = \\ b"));
	}

	@Test
	void testIsIdentifier() {
		Assertions.assertTrue(Tokenizer.isIdentifier("_y2"));
		Assertions.assertTrue(Tokenizer.isIdentifier("größe"));
		Assertions.assertFalse(Tokenizer.isIdentifier("a b"));
		Assertions.assertFalse(Tokenizer.isIdentifier("2x"));
		Assertions.assertFalse(Tokenizer.isIdentifier(""));
	}
}
