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
package com.tomaszrup.pyfst.proxy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.tomaszrup.pyfst.fst.AtomNode;
import com.tomaszrup.pyfst.fst.CompositeNode;
import com.tomaszrup.pyfst.fst.FstNode;
import com.tomaszrup.pyfst.render.Renderer;
import com.tomaszrup.pyfst.schema.ListPolicy;
import com.tomaszrup.pyfst.schema.RenderingSchema;
import com.tomaszrup.pyfst.schema.Slot;
import com.tomaszrup.pyfst.schema.SlotKind;

/**
 * Pre-order traversal of a subtree in rendering order, with attribute
 * filters.
 */
final class Query {

	/**
	 * One node of a document-order walk.
	 */
	static final class Visit {
		final FstNode node;
		/** Index of the parent visit, -1 for the walk root. */
		final int parent;
		/** Policy key of the collection the node is an item of, or {@code null}. */
		final String collection;
		/** Index of the first visit after this node's subtree. */
		int end;

		Visit(FstNode node, int parent, String collection) {
			this.node = node;
			this.parent = parent;
			this.collection = collection;
		}
	}

	private Query() {
	}

	static List<Proxy> find(Proxy start, NodeMatcher matcher, Map<String, ?> filters, boolean firstOnly) {
		checkFilters(filters);
		List<Proxy> found = new ArrayList<>();
		visit(start, matcher, filters, firstOnly, found);
		return found;
	}

	private static boolean visit(Proxy proxy, NodeMatcher matcher, Map<String, ?> filters, boolean firstOnly,
			List<Proxy> found) {
		if (matcher.matches(proxy) && filtersMatch(proxy, filters)) {
			found.add(proxy);
			if (firstOnly) {
				return true;
			}
		}
		Tree tree = proxy.getTree();
		for (FstNode child : children(proxy.node())) {
			if (visit(tree.proxy(child, proxy), matcher, filters, firstOnly, found)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Direct children of {@code node} in rendering order, formatting included.
	 */
	static List<FstNode> children(FstNode node) {
		if (node.isAtom()) {
			return Collections.emptyList();
		}
		CompositeNode composite = (CompositeNode) node;
		List<FstNode> children = new ArrayList<>();
		for (Slot slot : composite.getEntry().getSlots()) {
			if (slot.getKind() == SlotKind.NODE) {
				FstNode child = composite.getNode(slot.getName());
				if (child != null) {
					children.add(child);
				}
			} else if (slot.getKind().isList()) {
				children.addAll(composite.getList(slot.getName()));
			}
		}
		return children;
	}

	/**
	 * Every node below {@code root} in rendering order, root included.
	 */
	static List<Visit> walk(FstNode root) {
		List<Visit> visits = new ArrayList<>();
		walk(root, -1, null, visits);
		return visits;
	}

	private static void walk(FstNode node, int parent, String collection, List<Visit> visits) {
		Visit visit = new Visit(node, parent, collection);
		int index = visits.size();
		visits.add(visit);
		if (!node.isAtom()) {
			CompositeNode composite = (CompositeNode) node;
			for (Slot slot : composite.getEntry().getSlots()) {
				if (slot.getKind() == SlotKind.NODE) {
					FstNode child = composite.getNode(slot.getName());
					if (child != null) {
						walk(child, index, null, visits);
					}
				} else if (slot.getKind().isList()) {
					String key = collectionKey(slot);
					for (FstNode child : composite.getList(slot.getName())) {
						boolean item = key != null && !RenderingSchema.isFormattingType(child.getType());
						walk(child, index, item ? key : null, visits);
					}
				}
			}
		}
		visit.end = visits.size();
	}

	/**
	 * Collections with the same key share a list policy; formatting lists
	 * have none.
	 */
	static String collectionKey(Slot slot) {
		if (slot.getKind() == SlotKind.SEPARATED_LIST) {
			return "SEPARATED";
		}
		if (slot.getKind() == SlotKind.NODE_LIST && slot.getPolicy() != ListPolicy.FORMATTING) {
			return slot.getPolicy().name();
		}
		return null;
	}

	// ----------------------------------------------------------------
	// Filters
	// ----------------------------------------------------------------

	private static void checkFilters(Map<String, ?> filters) {
		if (filters == null) {
			return;
		}
		for (Map.Entry<String, ?> filter : filters.entrySet()) {
			Object expected = filter.getValue();
			if (expected != null && !(expected instanceof String) && !(expected instanceof Boolean)
					&& !(expected instanceof Pattern) && !(expected instanceof NodeMatcher)) {
				throw new QueryError("unsupported filter value for '" + filter.getKey() + "': "
						+ expected.getClass().getName());
			}
		}
	}

	static boolean filtersMatch(Proxy proxy, Map<String, ?> filters) {
		if (filters == null || filters.isEmpty()) {
			return true;
		}
		FstNode node = proxy.node();
		for (Map.Entry<String, ?> filter : filters.entrySet()) {
			Object actual;
			if (node.isAtom()) {
				if (!"value".equals(filter.getKey())) {
					return false;
				}
				actual = ((AtomNode) node).getValue();
			} else {
				CompositeNode composite = (CompositeNode) node;
				if (!composite.hasAttribute(filter.getKey())) {
					return false;
				}
				actual = composite.get(filter.getKey());
			}
			if (!valueMatches(proxy, actual, filter.getValue())) {
				return false;
			}
		}
		return true;
	}

	private static boolean valueMatches(Proxy proxy, Object actual, Object expected) {
		if (expected == null) {
			return actual == null;
		}
		if (expected instanceof Boolean) {
			return expected.equals(actual);
		}
		if (expected instanceof NodeMatcher) {
			return actual instanceof FstNode
					&& ((NodeMatcher) expected).matches(proxy.getTree().proxy((FstNode) actual, proxy));
		}
		String text = text(actual);
		if (text == null) {
			return false;
		}
		if (expected instanceof Pattern) {
			return ((Pattern) expected).matcher(text).find();
		}
		return expected.equals(text);
	}

	@SuppressWarnings("unchecked")
	private static String text(Object value) {
		if (value instanceof String) {
			return (String) value;
		}
		if (value instanceof FstNode) {
			return Renderer.render((FstNode) value);
		}
		if (value instanceof List) {
			return Renderer.render((List<FstNode>) value);
		}
		return null;
	}
}
