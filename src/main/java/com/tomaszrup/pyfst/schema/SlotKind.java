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
package com.tomaszrup.pyfst.schema;

/**
 * Kind of one rendering step of a {@link SchemaEntry}.
 */
public enum SlotKind {
	/** A single child node; nullable when the slot is optional. */
	NODE,
	/** An ordered list of child nodes, interpreted according to a {@link ListPolicy}. */
	NODE_LIST,
	/** Alternating content and separator nodes. */
	SEPARATED_LIST,
	/** A literal string stored on the node. */
	STRING,
	/** A boolean stored on the node; renders nothing by itself. */
	FLAG,
	/** Fixed text rendered from the schema; not stored on the node. */
	CONSTANT;

	public boolean isAttribute() {
		return this != CONSTANT;
	}

	public boolean isList() {
		return this == NODE_LIST || this == SEPARATED_LIST;
	}
}
