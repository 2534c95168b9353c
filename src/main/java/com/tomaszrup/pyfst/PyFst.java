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
package com.tomaszrup.pyfst;

import java.util.List;

import com.tomaszrup.pyfst.fst.FstNode;
import com.tomaszrup.pyfst.lexer.Token;
import com.tomaszrup.pyfst.lexer.Tokenizer;
import com.tomaszrup.pyfst.parser.Parser;
import com.tomaszrup.pyfst.render.Renderer;
import com.tomaszrup.pyfst.render.SchemaValidator;

/**
 * Entry points for working with raw FSTs. For queries and edits wrap the
 * source in a {@link com.tomaszrup.pyfst.proxy.Tree}.
 */
public final class PyFst {

	private PyFst() {
	}

	public static List<Token> tokenize(String source) {
		return Tokenizer.tokenize(source);
	}

	public static FstNode parse(String source) {
		return Parser.parse(source);
	}

	public static String dumps(FstNode node) {
		return Renderer.render(node);
	}

	/**
	 * Renders {@code node}, validating the whole subtree against the
	 * rendering schema first when {@code strict} is set.
	 */
	public static String dumps(FstNode node, boolean strict) {
		if (strict) {
			SchemaValidator.validate(node);
		}
		return Renderer.render(node);
	}
}
