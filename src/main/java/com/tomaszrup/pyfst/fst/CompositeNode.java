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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.tomaszrup.pyfst.schema.RenderingSchema;
import com.tomaszrup.pyfst.schema.SchemaEntry;
import com.tomaszrup.pyfst.schema.Slot;
import com.tomaszrup.pyfst.schema.ValidationError;

/**
 * Node whose attributes are fixed by its {@link SchemaEntry}. Attribute
 * values are {@link FstNode} (or {@code null} for an absent optional node),
 * {@code List<FstNode>}, {@link String} or {@link Boolean}.
 *
 * <p>A freshly created node has every attribute of its type set to the empty
 * value of its kind: {@code null}, an empty list, {@code ""} or
 * {@code false}.</p>
 */
public final class CompositeNode extends FstNode {
	private final Map<String, Object> attributes = new LinkedHashMap<>();

	public CompositeNode(String type) {
		super(type);
		SchemaEntry entry = RenderingSchema.entry(type);
		if (entry.isAtom()) {
			throw new ValidationError("'" + type + "' is an atom type");
		}
		for (Slot slot : entry.getAttributes().values()) {
			attributes.put(slot.getName(), emptyValue(slot));
		}
	}

	private static Object emptyValue(Slot slot) {
		switch (slot.getKind()) {
			case NODE_LIST:
			case SEPARATED_LIST:
				return new ArrayList<FstNode>();
			case STRING:
				return "";
			case FLAG:
				return Boolean.FALSE;
			default:
				return null;
		}
	}

	public SchemaEntry getEntry() {
		return RenderingSchema.entry(getType());
	}

	/** Live, ordered view of the attribute map. */
	public Map<String, Object> getAttributes() {
		return Collections.unmodifiableMap(attributes);
	}

	public boolean hasAttribute(String name) {
		return attributes.containsKey(name);
	}

	public Object get(String name) {
		requireAttribute(name);
		return attributes.get(name);
	}

	public FstNode getNode(String name) {
		Object value = get(name);
		if (value != null && !(value instanceof FstNode)) {
			throw new ValidationError("attribute '" + name + "' of " + getType() + " is not a node");
		}
		return (FstNode) value;
	}

	@SuppressWarnings("unchecked")
	public List<FstNode> getList(String name) {
		Object value = get(name);
		if (!(value instanceof List)) {
			throw new ValidationError("attribute '" + name + "' of " + getType() + " is not a list");
		}
		return (List<FstNode>) value;
	}

	public String getString(String name) {
		Object value = get(name);
		if (!(value instanceof String)) {
			throw new ValidationError("attribute '" + name + "' of " + getType() + " is not a string");
		}
		return (String) value;
	}

	public boolean getFlag(String name) {
		Object value = get(name);
		if (!(value instanceof Boolean)) {
			throw new ValidationError("attribute '" + name + "' of " + getType() + " is not a flag");
		}
		return (Boolean) value;
	}

	/**
	 * Stores {@code value} under {@code name}. Lists are stored as given, so
	 * the caller hands over ownership of the list instance.
	 */
	public CompositeNode set(String name, Object value) {
		requireAttribute(name);
		attributes.put(name, value);
		return this;
	}

	/** Appends nodes to a list attribute; convenience for tree builders. */
	public CompositeNode add(String name, FstNode... nodes) {
		List<FstNode> list = getList(name);
		Collections.addAll(list, nodes);
		return this;
	}

	private void requireAttribute(String name) {
		if (!attributes.containsKey(name)) {
			throw new ValidationError("node type " + getType() + " has no attribute '" + name + "'");
		}
	}

	/**
	 * Copy sharing every child with this node; lists are new list instances.
	 * Used to validate a prospective change before committing it.
	 */
	public CompositeNode shallowCopy() {
		CompositeNode copy = new CompositeNode(getType());
		for (Map.Entry<String, Object> attribute : attributes.entrySet()) {
			Object value = attribute.getValue();
			if (value instanceof List) {
				value = new ArrayList<>((List<?>) value);
			}
			copy.attributes.put(attribute.getKey(), value);
		}
		return copy;
	}

	@Override
	public boolean isAtom() {
		return false;
	}

	@Override
	public CompositeNode deepCopy() {
		CompositeNode copy = new CompositeNode(getType());
		for (Map.Entry<String, Object> attribute : attributes.entrySet()) {
			copy.attributes.put(attribute.getKey(), copyValue(attribute.getValue()));
		}
		return copy;
	}

	private static Object copyValue(Object value) {
		if (value instanceof FstNode) {
			return ((FstNode) value).deepCopy();
		}
		if (value instanceof List) {
			List<FstNode> copy = new ArrayList<>();
			for (Object item : (List<?>) value) {
				copy.add(((FstNode) item).deepCopy());
			}
			return copy;
		}
		return value;
	}

	@Override
	public String toString() {
		return getType() + attributes.keySet();
	}
}
