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

import com.tomaszrup.pyfst.FstException;

/**
 * The tokenizer cannot classify the remaining input.
 */
public class LexError extends FstException {
	private static final long serialVersionUID = 1L;

	private final int offset;
	private final int line;
	private final int column;

	public LexError(String message, int offset, int line, int column) {
		super(message + " at line " + (line + 1) + ", column " + (column + 1));
		this.offset = offset;
		this.line = line;
		this.column = column;
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
}
