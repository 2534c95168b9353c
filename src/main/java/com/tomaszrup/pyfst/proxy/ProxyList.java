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
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.pyfst.fst.CompositeNode;
import com.tomaszrup.pyfst.fst.FstNode;
import com.tomaszrup.pyfst.parser.FragmentParser;
import com.tomaszrup.pyfst.render.Renderer;
import com.tomaszrup.pyfst.render.SchemaValidator;
import com.tomaszrup.pyfst.schema.ValidationError;

/**
 * Ordered view of the items of one list attribute. Formatting entries of
 * the underlying list (separators, whitespace, newlines, comments) are
 * hidden; mutations add and remove them as needed.
 *
 * <p>Every mutation builds the new list aside, validates the owner with it,
 * and only then stores it, so a failed mutation leaves the tree unchanged.
 * Subclasses implement the layout rules of their list policy.</p>
 */
public abstract class ProxyList implements Iterable<Proxy> {
	private static final Logger logger = LoggerFactory.getLogger(ProxyList.class);

	protected final Proxy owner;
	protected final String attribute;

	ProxyList(Proxy owner, String attribute) {
		this.owner = owner;
		this.attribute = attribute;
	}

	/**
	 * A prospective list content together with its side effects.
	 */
	static final class Change {
		final List<FstNode> entries;
		final Map<String, Object> ownerAttributes = new LinkedHashMap<>();
		final List<FstNode> removed = new ArrayList<>();
		final List<FstNode> inserted = new ArrayList<>();
		final List<Runnable> afterCommit = new ArrayList<>();
		/** Indentation of the line the removed item started on. */
		String removedIndentation = "";

		Change(List<FstNode> current) {
			this.entries = new ArrayList<>(current);
		}
	}

	/**
	 * A new item with the comments written around it in source text.
	 */
	static final class Item {
		final FstNode node;
		final FragmentParser.Fragment fragment;

		Item(FstNode node, FragmentParser.Fragment fragment) {
			this.node = node;
			this.fragment = fragment;
		}
	}

	public Proxy getOwner() {
		return owner;
	}

	public String getAttribute() {
		return attribute;
	}

	CompositeNode ownerNode() {
		return (CompositeNode) owner.node();
	}

	List<FstNode> entries() {
		return ownerNode().getList(attribute);
	}

	Tree tree() {
		return owner.getTree();
	}

	FragmentParser.Kind kind() {
		return Splice.listKind(owner.getType(), attribute);
	}

	// ----------------------------------------------------------------
	// Reading
	// ----------------------------------------------------------------

	public int size() {
		return Splice.itemIndices(entries()).size();
	}

	public boolean isEmpty() {
		return size() == 0;
	}

	public Proxy get(int index) {
		List<Integer> items = Splice.itemIndices(entries());
		if (index < 0 || index >= items.size()) {
			throw new IndexOutOfBoundsException("index " + index + " out of " + items.size() + " items");
		}
		return tree().proxy(entries().get(items.get(index)), owner);
	}

	public List<Proxy> toList() {
		List<Proxy> proxies = new ArrayList<>();
		Tree tree = tree();
		for (FstNode entry : entries()) {
			if (Splice.isItem(entry)) {
				proxies.add(tree.proxy(entry, owner));
			}
		}
		return proxies;
	}

	@Override
	public Iterator<Proxy> iterator() {
		return toList().iterator();
	}

	/** Item index of {@code proxy}, or -1. */
	public int indexOf(Proxy proxy) {
		int index = 0;
		for (FstNode entry : entries()) {
			if (!Splice.isItem(entry)) {
				continue;
			}
			if (entry == proxy.node()) {
				return index;
			}
			index++;
		}
		return -1;
	}

	/** Rendering of the whole list, formatting included. */
	public String dumps() {
		return Renderer.render(entries());
	}

	// ----------------------------------------------------------------
	// Mutations
	// ----------------------------------------------------------------

	/**
	 * Inserts an item before item {@code index}; {@code index == size()}
	 * appends.
	 *
	 * @return the proxy of the inserted node
	 * @throws ValidationError if the item cannot be placed here
	 */
	public Proxy insert(int index, Object item) {
		requireMutable();
		int size = size();
		if (index < 0 || index > size) {
			throw new IndexOutOfBoundsException("insert index " + index + " out of 0.." + size);
		}
		Item prepared = prepare(item);
		Change change = new Change(entries());
		spliceInsert(change, index, prepared);
		change.inserted.add(prepared.node);
		commit(change, "insert", index);
		return tree().proxy(prepared.node, owner);
	}

	public Proxy append(Object item) {
		return insert(size(), item);
	}

	/**
	 * Removes item {@code index} and the layout that only existed for it.
	 *
	 * @return the detached proxy of the removed node
	 */
	public Proxy remove(int index) {
		requireMutable();
		Proxy removed = get(index);
		Change change = new Change(entries());
		spliceRemove(change, index);
		change.removed.add(removed.node());
		commit(change, "remove", index);
		afterRemove(removed.node(), change);
		return removed;
	}

	public Proxy remove(Proxy item) {
		int index = indexOf(item);
		if (index < 0) {
			throw new ValidationError(item.getType() + " node is not an item of " + owner.getType() + "." + attribute);
		}
		return remove(index);
	}

	/**
	 * Replaces item {@code index}.
	 *
	 * @return the proxy of the new node
	 */
	public Proxy replace(int index, Object item) {
		requireMutable();
		Proxy old = get(index);
		Item prepared = prepare(item);
		Change change = new Change(entries());
		spliceReplace(change, index, prepared);
		change.removed.add(old.node());
		change.inserted.add(prepared.node);
		commit(change, "replace", index);
		afterRemove(old.node(), change);
		return tree().proxy(prepared.node, owner);
	}

	public void increaseIndentation(int levels) {
		for (Proxy item : toList()) {
			item.increaseIndentation(levels);
		}
	}

	public void decreaseIndentation(int levels) {
		if (levels < 0) {
			throw new IllegalArgumentException("levels must not be negative: " + levels);
		}
		List<Proxy> items = toList();
		for (Proxy item : items) {
			item.checkDecrease(levels * tree().getIndentUnit().length());
		}
		for (Proxy item : items) {
			item.decreaseIndentation(levels);
		}
	}

	private void requireMutable() {
		if (owner.isDetached()) {
			throw new DetachedNodeError("the " + owner.getType() + " owning this list was removed from its tree");
		}
	}

	Item prepare(Object item) {
		return new Item(tree().prepare(item, kind()), null);
	}

	abstract void spliceInsert(Change change, int index, Item item);

	abstract void spliceRemove(Change change, int index);

	void spliceReplace(Change change, int index, Item item) {
		List<Integer> items = Splice.itemIndices(change.entries);
		change.entries.set(items.get(index), item.node);
	}

	/** Hook run on a removed or replaced node once it is detached. */
	void afterRemove(FstNode removed, Change change) {
	}

	/** Checks that go beyond the owner's schema shape. */
	void validate(Change change) {
	}

	private void commit(Change change, String operation, int index) {
		CompositeNode node = ownerNode();
		CompositeNode changed = node.shallowCopy();
		changed.set(attribute, change.entries);
		for (Map.Entry<String, Object> other : change.ownerAttributes.entrySet()) {
			changed.set(other.getKey(), other.getValue());
		}
		SchemaValidator.validateShallow(changed);
		validate(change);

		node.set(attribute, change.entries);
		for (Map.Entry<String, Object> other : change.ownerAttributes.entrySet()) {
			node.set(other.getKey(), other.getValue());
		}
		for (Runnable action : change.afterCommit) {
			action.run();
		}
		Tree tree = tree();
		for (FstNode removed : change.removed) {
			tree.detach(removed);
		}
		for (FstNode inserted : change.inserted) {
			tree.attach(inserted, owner);
		}
		if (logger.isDebugEnabled()) {
			logger.debug("{} at {} of {}.{}: {} removed, {} inserted", operation, index, owner.getType(), attribute,
					change.removed.size(), change.inserted.size());
		}
	}
}
