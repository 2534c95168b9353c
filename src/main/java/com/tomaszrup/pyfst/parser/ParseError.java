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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import com.tomaszrup.pyfst.FstException;
import com.tomaszrup.pyfst.lexer.Token;

/**
 * The token sequence matches no grammar rule at a position. Carries the
 * position of the offending token and what would have been accepted there.
 */
public class ParseError extends FstException {
	private static final long serialVersionUID = 1L;

	private final int offset;
	private final int line;
	private final int column;
	private final List<String> expected;

	public ParseError(Token found, Collection<String> expected) {
		this(found, expected, null);
	}

	public ParseError(Token found, Collection<String> expected, String detail) {
		super(message(found, expected, detail));
		this.offset = found.getOffset();
		this.line = found.getLine();
		this.column = found.getColumn();
		this.expected = Collections.unmodifiableList(new ArrayList<>(expected));
	}

	private static String message(Token found, Collection<String> expected, String detail) {
		StringBuilder builder = new StringBuilder();
		if (detail != null) {
			builder.append(detail);
		} else {
			builder.append("expected ");
			builder.append(expected.isEmpty() ? "nothing" : String.join(" or ", expected));
			builder.append(" but found ").append(found.describe());
		}
		builder.append(" at line ").append(found.getLine() + 1)
				.append(", column ").append(found.getColumn() + 1);
		return builder.toString();
	}

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

	/** Descriptions of the constructs that would have been accepted. */
	public List<String> getExpected() {
		return expected;
	}
}
