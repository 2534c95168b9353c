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
package com.tomaszrup.pyfst.fst;

/**
 * Leaf node holding the exact source text of a name, number, string,
 * keyword statement or run of whitespace.
 */
public final class AtomNode extends FstNode {
	private String value;

	public AtomNode(String type, String value) {
		super(type);
		setValue(value);
	}

	public String getValue() {
		return value;
	}

	public void setValue(String value) {
		if (value == null) {
			throw new IllegalArgumentException("atom value must not be null");
		}
		this.value = value;
	}

	@Override
	public boolean isAtom() {
		return true;
	}

	@Override
	public AtomNode deepCopy() {
		return new AtomNode(getType(), value);
	}

	@Override
	public String toString() {
		return getType() + "(" + value + ")";
	}
}
