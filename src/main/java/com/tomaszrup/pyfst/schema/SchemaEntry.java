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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rendering order of one node type. Atom types have no slots; their text is
 * rendered verbatim.
 */
public final class SchemaEntry {
	private final String type;
	private final boolean atom;
	private final List<Slot> slots;
	private final Map<String, Slot> attributes;

	SchemaEntry(String type, boolean atom, List<Slot> slots) {
		this.type = type;
		this.atom = atom;
		this.slots = Collections.unmodifiableList(new ArrayList<>(slots));
		Map<String, Slot> byName = new LinkedHashMap<>();
		for (Slot slot : slots) {
			if (slot.getKind().isAttribute()) {
				if (byName.put(slot.getName(), slot) != null) {
					throw new IllegalStateException("duplicate attribute " + slot.getName() + " in " + type);
				}
			}
		}
		this.attributes = Collections.unmodifiableMap(byName);
	}

	public String getType() {
		return type;
	}

	public boolean isAtom() {
		return atom;
	}

	/** All rendering steps in order, constants included. */
	public List<Slot> getSlots() {
		return slots;
	}

	/** Stored attributes in rendering order. */
	public Map<String, Slot> getAttributes() {
		return attributes;
	}

	public Slot getAttribute(String name) {
		return attributes.get(name);
	}

	public boolean hasAttribute(String name) {
		return attributes.containsKey(name);
	}

	@Override
	public String toString() {
		return type + (atom ? " (atom)" : " " + slots);
	}
}
