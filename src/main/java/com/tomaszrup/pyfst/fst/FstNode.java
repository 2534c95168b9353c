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
 * A node of the full syntax tree. There are exactly two shapes:
 * {@link AtomNode} (type + literal text) and {@link CompositeNode} (type +
 * attributes laid out by the rendering schema).
 *
 * <p>Nodes form a strict tree. A node must never be stored in two places;
 * use {@link #deepCopy()} to reuse a subtree elsewhere.</p>
 */
public abstract class FstNode {
	private final String type;

	protected FstNode(String type) {
		if (type == null) {
			throw new IllegalArgumentException("type must not be null");
		}
		this.type = type;
	}

	public String getType() {
		return type;
	}

	public boolean is(String expectedType) {
		return type.equals(expectedType);
	}

	public abstract boolean isAtom();

	public abstract FstNode deepCopy();
}
