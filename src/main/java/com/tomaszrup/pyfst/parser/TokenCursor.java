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
package com.tomaszrup.pyfst.parser;

import java.util.List;

import com.tomaszrup.pyfst.lexer.Token;
import com.tomaszrup.pyfst.lexer.TokenKind;

/**
 * Forward-only position in a token list. "Significant" lookahead skips
 * whitespace and comments without consuming them, so the parser can decide
 * who owns a run of formatting before taking it.
 */
final class TokenCursor {
	private final List<Token> tokens;
	private int index;

	TokenCursor(List<Token> tokens) {
		if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getKind() != TokenKind.END) {
			throw new IllegalArgumentException("token list must be terminated by an END token");
		}
		this.tokens = tokens;
	}

	Token peek() {
		return tokens.get(index);
	}

	/** Token {@code distance} positions ahead, clamped to the END token. */
	Token peek(int distance) {
		return tokens.get(Math.min(index + distance, tokens.size() - 1));
	}

	Token next() {
		Token token = tokens.get(index);
		if (token.getKind() != TokenKind.END) {
			index++;
		}
		return token;
	}

	/** First token that is neither whitespace nor a comment. */
	Token peekSignificant() {
		return peekSignificant(1);
	}

	/** The {@code n}-th (1-based) token that is neither whitespace nor a comment. */
	Token peekSignificant(int n) {
		int i = index;
		int found = 0;
		while (true) {
			Token token = tokens.get(Math.min(i, tokens.size() - 1));
			if (token.getKind() == TokenKind.END) {
				return token;
			}
			if (token.getKind() != TokenKind.WHITESPACE && token.getKind() != TokenKind.COMMENT) {
				found++;
				if (found == n) {
					return token;
				}
			}
			i++;
		}
	}

	int position() {
		return index;
	}
}
