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
 * Classification of a {@link Token}.
 *
 * <p>{@link #INDENT}, {@link #DEDENT} and {@link #END} are zero-width markers;
 * every other kind carries the exact source text it was read from.</p>
 */
public enum TokenKind {
	NAME,
	KEYWORD,
	NUMBER,
	STRING,
	OPERATOR,
	WHITESPACE,
	NEWLINE,
	COMMENT,
	INDENTATION,
	INDENT,
	DEDENT,
	END;

	public boolean isMarker() {
		return this == INDENT || this == DEDENT || this == END;
	}
}
