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
import java.util.List;
import java.util.Map;

import com.tomaszrup.pyfst.fst.AtomNode;
import com.tomaszrup.pyfst.fst.CompositeNode;
import com.tomaszrup.pyfst.fst.FstNode;
import com.tomaszrup.pyfst.schema.RenderingSchema;
import com.tomaszrup.pyfst.schema.Slot;
import com.tomaszrup.pyfst.schema.ValidationError;

/**
 * Items alternating with comma or dot separators: call arguments,
 * parameters, display elements, import names, dotted names.
 *
 * <p>The raw list is {@code item (sep item)* sep?}. A new separator copies
 * the style of an existing one between two items; removing an item takes
 * the separator that only existed for it along.</p>
 */
public class SeparatedProxyList extends ProxyList {

	SeparatedProxyList(Proxy owner, String attribute) {
		super(owner, attribute);
	}

	private String separatorType() {
		return ownerNode().getEntry().getAttribute(attribute).getSeparatorType();
	}

	/** Formatting slot rendered right before the list, or {@code null}. */
	private String leadingSlot() {
		return adjacentFormatting(-1);
	}

	/** Formatting slot rendered right after the list, or {@code null}. */
	private String closingSlot() {
		return adjacentFormatting(1);
	}

	private String adjacentFormatting(int direction) {
		List<Slot> slots = ownerNode().getEntry().getSlots();
		for (int i = 0; i < slots.size(); i++) {
			if (attribute.equals(slots.get(i).getName())) {
				int neighbour = i + direction;
				if (neighbour >= 0 && neighbour < slots.size() && slots.get(neighbour).isFormatting()) {
					return slots.get(neighbour).getName();
				}
				return null;
			}
		}
		return null;
	}

	@Override
	void spliceInsert(Change change, int index, Item item) {
		List<FstNode> entries = change.entries;
		List<Integer> items = Splice.itemIndices(entries);
		int size = items.size();
		if (size == 0) {
			entries.add(0, item.node);
			adjustOwner(change, true);
			return;
		}
		FstNode separator = newSeparator(entries);
		if (index < size) {
			int at = items.get(index);
			entries.add(at, separator);
			entries.add(at, item.node);
		} else {
			int at = items.get(size - 1) + 1;
			entries.add(at, item.node);
			entries.add(at, separator);
		}
	}

	/**
	 * Repairs the owner around a list that became non-empty or empty: the
	 * parentheses of a class base list and the space after a keyword such
	 * as {@code lambda}. A tuple left with one item keeps a trailing comma.
	 */
	private void adjustOwner(Change change, boolean wasEmpty) {
		List<FstNode> entries = change.entries;
		int size = Splice.itemIndices(entries).size();
		if (owner.getType().equals("tuple") && size == 1 && Splice.isItem(entries.get(entries.size() - 1))) {
			entries.add(Splice.comma(","));
		}
		if (wasEmpty == (size == 0)) {
			return;
		}
		CompositeNode current = ownerNode();
		CompositeNode changed = current.shallowCopy();
		for (Map.Entry<String, Object> other : change.ownerAttributes.entrySet()) {
			changed.set(other.getKey(), other.getValue());
		}
		Splice.adjustOptionalSpacing(changed, attribute, size > 0);
		if (owner.getType().equals("class") && size > 0) {
			changed.set("parenthesis", Boolean.TRUE);
		}
		for (Map.Entry<String, Object> other : changed.getAttributes().entrySet()) {
			String name = other.getKey();
			if (!name.equals(attribute) && other.getValue() != current.get(name)) {
				change.ownerAttributes.put(name, other.getValue());
			}
		}
	}

	/**
	 * Lists the grammar does not allow to be empty.
	 */
	private boolean requiresItems() {
		CompositeNode node = ownerNode();
		switch (node.getType() + "." + attribute) {
			case "import.value":
			case "global.value":
			case "nonlocal.value":
			case "with.contexts":
			case "from_import.targets":
			case "dotted_as_name.value":
			case "set.value":
				return true;
			case "from_import.value":
				return node.getString("dots").isEmpty();
			case "tuple.value":
				return !node.getFlag("with_parenthesis");
			default:
				return false;
		}
	}

	@Override
	void validate(Change change) {
		if (Splice.itemIndices(change.entries).isEmpty() && requiresItems()) {
			throw new ValidationError(owner.getType() + "." + attribute + " needs at least one item");
		}
	}

	/**
	 * A copy of the first separator between two items without its comments,
	 * a comma followed by the leading line break of a multi-line list, or
	 * the canonical style.
	 */
	private FstNode newSeparator(List<FstNode> entries) {
		List<Integer> items = Splice.itemIndices(entries);
		for (int i = 0; i + 1 < items.size(); i++) {
			int at = items.get(i) + 1;
			if (at < items.get(i + 1)) {
				CompositeNode separator = (CompositeNode) entries.get(at).deepCopy();
				stripComments(separator.getList("first_formatting"));
				stripComments(separator.getList("second_formatting"));
				return separator;
			}
		}
		String type = separatorType();
		if (RenderingSchema.DOT.equals(type)) {
			return Splice.dot();
		}
		String leading = leadingSlot();
		if (leading != null) {
			List<FstNode> formatting = ownerNode().getList(leading);
			if (Splice.containsNewline(formatting) && !Splice.containsComment(formatting)) {
				CompositeNode comma = new CompositeNode(RenderingSchema.COMMA);
				for (FstNode node : formatting) {
					comma.add("second_formatting", node.deepCopy());
				}
				return comma;
			}
		}
		return Splice.comma(tree().getOptions().getSeparator());
	}

	/**
	 * Drops comments and the inline whitespace in front of them.
	 */
	private static void stripComments(List<FstNode> formatting) {
		for (int i = formatting.size() - 1; i >= 0; i--) {
			if (formatting.get(i).is("comment")) {
				formatting.remove(i);
				if (i > 0 && isInlineSpace(formatting.get(i - 1))) {
					formatting.remove(i - 1);
					i--;
				}
			}
		}
	}

	private static boolean isInlineSpace(FstNode node) {
		if (!node.is("space")) {
			return false;
		}
		String value = ((AtomNode) node).getValue();
		return value.indexOf('\n') < 0 && value.indexOf('\r') < 0;
	}

	@Override
	void spliceRemove(Change change, int index) {
		List<FstNode> entries = change.entries;
		List<Integer> items = Splice.itemIndices(entries);
		int size = items.size();
		int at = items.get(index);
		if (index < size - 1) {
			CompositeNode separator = (CompositeNode) entries.get(at + 1);
			entries.remove(at + 1);
			entries.remove(at);
			rehomeBeforeItem(change, at, comments(separator, false));
		} else if (size == 1) {
			entries.remove(at);
			if (at < entries.size()) {
				CompositeNode trailing = (CompositeNode) entries.remove(at);
				rehomeAtEnd(change, comments(trailing, true));
			}
		} else {
			CompositeNode separator = (CompositeNode) entries.get(at - 1);
			entries.remove(at);
			entries.remove(at - 1);
			rehomeAtEnd(change, comments(separator, true));
		}
		adjustOwner(change, false);
	}

	/**
	 * Comments of a separator, from the first comment on. Without
	 * {@code keepInline} the inline whitespace in front of each comment is
	 * dropped.
	 */
	private static List<FstNode> comments(CompositeNode separator, boolean keepInline) {
		List<FstNode> all = new ArrayList<>(separator.getList("first_formatting"));
		all.addAll(separator.getList("second_formatting"));
		int first = -1;
		for (int i = 0; i < all.size(); i++) {
			if (all.get(i).is("comment")) {
				first = i;
				break;
			}
		}
		List<FstNode> comments = new ArrayList<>();
		if (first < 0) {
			return comments;
		}
		if (keepInline && first > 0 && all.get(first - 1).is("space")) {
			first--;
		}
		for (int i = first; i < all.size(); i++) {
			FstNode node = all.get(i);
			if (!keepInline && isInlineSpace(node) && i + 1 < all.size() && all.get(i + 1).is("comment")) {
				continue;
			}
			comments.add(node);
		}
		return comments;
	}

	/**
	 * Places comments in front of the item now at raw index {@code at}: at
	 * the end of the separator before it, or of the list's leading
	 * formatting.
	 */
	private void rehomeBeforeItem(Change change, int at, List<FstNode> comments) {
		if (comments.isEmpty()) {
			return;
		}
		if (at > 0) {
			CompositeNode previous = (CompositeNode) change.entries.get(at - 1).deepCopy();
			previous.getList("second_formatting").addAll(comments);
			change.entries.set(at - 1, previous);
			return;
		}
		String leading = leadingSlot();
		if (leading != null) {
			List<FstNode> formatting = new ArrayList<>(ownerNode().getList(leading));
			formatting.addAll(comments);
			change.ownerAttributes.put(leading, formatting);
		}
	}

	/** Places comments in front of the list's closing formatting. */
	private void rehomeAtEnd(Change change, List<FstNode> comments) {
		if (comments.isEmpty()) {
			return;
		}
		String closing = closingSlot();
		if (closing != null) {
			List<FstNode> rest = new ArrayList<>(ownerNode().getList(closing));
			if (endsOnNewLine(comments)) {
				while (!rest.isEmpty() && isInlineSpace(rest.get(0))) {
					rest.remove(0);
				}
			}
			List<FstNode> formatting = new ArrayList<>(comments);
			formatting.addAll(rest);
			change.ownerAttributes.put(closing, formatting);
		}
	}

	/** Whether the last line break of {@code nodes} follows their last comment. */
	private static boolean endsOnNewLine(List<FstNode> nodes) {
		for (int i = nodes.size() - 1; i >= 0; i--) {
			FstNode node = nodes.get(i);
			if (!node.is("space")) {
				return false;
			}
			if (!isInlineSpace(node)) {
				return true;
			}
		}
		return false;
	}
}
