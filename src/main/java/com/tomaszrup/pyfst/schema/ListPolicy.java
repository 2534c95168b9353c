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
 * How the entries of a {@link SlotKind#NODE_LIST} attribute are organised.
 */
public enum ListPolicy {
	/** Whitespace and comments between two tokens. */
	FORMATTING,
	/** Statement lines of a module or block: indentation, items, trailing comments, newlines. */
	LINES,
	/** Continuation clauses of a compound statement ({@code elif}, {@code else}, {@code except}, ...). */
	CLAUSES,
	/** Decorator lines preceding a {@code def} or {@code class}. */
	DECORATORS,
	/** Any other sequence; every entry is an item. */
	PLAIN
}
