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
package com.tomaszrup.pyfst.render;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.tomaszrup.pyfst.fst.AtomNode;
import com.tomaszrup.pyfst.fst.CompositeNode;
import com.tomaszrup.pyfst.fst.FstNode;
import com.tomaszrup.pyfst.schema.ListPolicy;
import com.tomaszrup.pyfst.schema.RenderingSchema;
import com.tomaszrup.pyfst.schema.SchemaEntry;
import com.tomaszrup.pyfst.schema.Slot;
import com.tomaszrup.pyfst.schema.ValidationError;

/**
 * Checks nodes against the {@link RenderingSchema}: attribute set and order,
 * value kinds, required nodes, formatting list contents, separator
 * alternation, and (for whole trees) single ownership.
 */
public final class SchemaValidator {

	private SchemaValidator() {
	}

	/**
	 * Validates {@code node} and every node below it.
	 *
	 * @throws ValidationError on the first divergence found
	 */
	public static void validate(FstNode node) {
		Set<FstNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		validateDeep(node, seen);
	}

	/**
	 * Validates the shape of {@code node} itself: its own attributes, but not
	 * the children's attributes.
	 */
	public static void validateShallow(FstNode node) {
		if (node == null) {
			throw new ValidationError("node must not be null");
		}
		SchemaEntry entry = RenderingSchema.entry(node.getType());
		if (node instanceof AtomNode) {
			if (!entry.isAtom()) {
				throw new ValidationError(node.getType() + " is a composite type but the node is an atom");
			}
			return;
		}
		if (entry.isAtom()) {
			throw new ValidationError(node.getType() + " is an atom type but the node is a composite");
		}
		CompositeNode composite = (CompositeNode) node;
		Map<String, Object> attributes = composite.getAttributes();
		if (!attributes.keySet().equals(entry.getAttributes().keySet())) {
			throw new ValidationError(node.getType() + " has attributes " + attributes.keySet()
					+ " but its schema declares " + entry.getAttributes().keySet());
		}
		for (Slot slot : entry.getAttributes().values()) {
			checkAttribute(composite, slot, attributes.get(slot.getName()));
		}
	}

	private static void validateDeep(FstNode node, Set<FstNode> seen) {
		if (!seen.add(node)) {
			throw new ValidationError("node " + node.getType() + " is owned by more than one parent");
		}
		validateShallow(node);
		if (node instanceof CompositeNode) {
			for (Object value : ((CompositeNode) node).getAttributes().values()) {
				if (value instanceof FstNode) {
					validateDeep((FstNode) value, seen);
				} else if (value instanceof List) {
					for (Object child : (List<?>) value) {
						validateDeep((FstNode) child, seen);
					}
				}
			}
		}
	}

	private static void checkAttribute(CompositeNode node, Slot slot, Object value) {
		String where = node.getType() + "." + slot.getName();
		switch (slot.getKind()) {
			case NODE:
				if (value == null) {
					if (!slot.isOptional()) {
						throw new ValidationError(where + " is required");
					}
				} else if (!(value instanceof FstNode)) {
					throw new ValidationError(where + " must hold a node");
				} else if (RenderingSchema.isFormattingType(((FstNode) value).getType())) {
					throw new ValidationError(where + " cannot hold formatting node " + ((FstNode) value).getType());
				}
				break;
			case NODE_LIST:
				checkNodeList(where, slot, value);
				break;
			case SEPARATED_LIST:
				checkSeparatedList(where, slot, value);
				break;
			case STRING:
				if (!(value instanceof String)) {
					throw new ValidationError(where + " must hold a string");
				}
				break;
			case FLAG:
				if (!(value instanceof Boolean)) {
					throw new ValidationError(where + " must hold a boolean");
				}
				break;
			default:
				throw new IllegalStateException("constant slot used as attribute: " + where);
		}
	}

	private static List<?> requireNodes(String where, Object value) {
		if (!(value instanceof List)) {
			throw new ValidationError(where + " must hold a list");
		}
		List<?> list = (List<?>) value;
		for (Object item : list) {
			if (!(item instanceof FstNode)) {
				throw new ValidationError(where + " contains a non-node entry");
			}
		}
		return list;
	}

	private static void checkNodeList(String where, Slot slot, Object value) {
		List<?> list = requireNodes(where, value);
		if (slot.getPolicy() == ListPolicy.FORMATTING) {
			for (Object item : list) {
				String type = ((FstNode) item).getType();
				if (!"space".equals(type) && !"comment".equals(type)) {
					throw new ValidationError(where + " may only hold whitespace and comments, found " + type);
				}
			}
		}
	}

	private static void checkSeparatedList(String where, Slot slot, Object value) {
		List<?> list = requireNodes(where, value);
		for (int i = 0; i < list.size(); i++) {
			String type = ((FstNode) list.get(i)).getType();
			if (i % 2 == 0) {
				if (RenderingSchema.isFormattingType(type)) {
					throw new ValidationError(where + "[" + i + "] must be an item, found " + type);
				}
			} else if (!slot.getSeparatorType().equals(type)) {
				throw new ValidationError(where + "[" + i + "] must be a " + slot.getSeparatorType()
						+ " separator, found " + type);
			}
		}
	}
}
