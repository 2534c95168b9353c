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

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import org.eclipse.lsp4j.Range;

import com.tomaszrup.lsp.utils.Ranges;
import com.tomaszrup.pyfst.fst.AtomNode;
import com.tomaszrup.pyfst.fst.CompositeNode;
import com.tomaszrup.pyfst.fst.FstInterchange;
import com.tomaszrup.pyfst.fst.FstNode;
import com.tomaszrup.pyfst.fst.NodePath;
import com.tomaszrup.pyfst.lexer.Tokenizer;
import com.tomaszrup.pyfst.render.RenderedSpans;
import com.tomaszrup.pyfst.render.Renderer;
import com.tomaszrup.pyfst.render.SchemaValidator;
import com.tomaszrup.pyfst.schema.ListPolicy;
import com.tomaszrup.pyfst.schema.Slot;
import com.tomaszrup.pyfst.schema.SlotKind;
import com.tomaszrup.pyfst.schema.ValidationError;

/**
 * Mutable, navigable handle on one FST node.
 *
 * <p>Proxies are created by their {@link Tree} and never by callers. The
 * parent and tree links are weak: a tree keeps its proxies alive, a proxy
 * does not keep its tree alive. A proxy whose node was removed from the
 * tree is detached; it can be inserted elsewhere, but navigating upwards
 * from it fails with {@link DetachedNodeError}.</p>
 */
public class Proxy {
	private final FstNode node;
	private WeakReference<Tree> tree;
	private WeakReference<Proxy> parent;
	private boolean detached;

	Proxy(Tree tree, FstNode node, Proxy parent) {
		this.node = node;
		this.tree = new WeakReference<>(tree);
		this.parent = parent == null ? null : new WeakReference<>(parent);
		this.detached = false;
	}

	/** The wrapped node. Changing it directly bypasses validation. */
	public FstNode node() {
		return node;
	}

	public String getType() {
		return node.getType();
	}

	public boolean isAtom() {
		return node.isAtom();
	}

	public Tree getTree() {
		Tree owner = tree.get();
		if (owner == null) {
			throw new DetachedNodeError("the tree of this " + getType() + " node is no longer reachable");
		}
		return owner;
	}

	// ----------------------------------------------------------------
	// Attachment
	// ----------------------------------------------------------------

	Proxy parentOrNull() {
		return parent == null ? null : parent.get();
	}

	void attachTo(Tree owner, Proxy newParent) {
		this.tree = new WeakReference<>(owner);
		this.parent = newParent == null ? null : new WeakReference<>(newParent);
		this.detached = false;
	}

	void markDetached() {
		this.parent = null;
		this.detached = true;
	}

	/** Whether this proxy itself was removed from its tree. */
	public boolean isDetached() {
		return detached;
	}

	/**
	 * Whether the node is reachable from the root of its tree through
	 * attached proxies.
	 */
	public boolean isAttached() {
		Tree owner = tree.get();
		if (owner == null) {
			return false;
		}
		Proxy current = this;
		while (current != null) {
			if (current.detached) {
				return false;
			}
			Proxy up = current.parentOrNull();
			if (up == null) {
				return current.node == owner.module();
			}
			current = up;
		}
		return false;
	}

	private void requireNotDetached() {
		if (detached) {
			throw new DetachedNodeError("this " + getType() + " node was removed from its tree");
		}
	}

	private CompositeNode composite() {
		if (node.isAtom()) {
			throw new IdentifierError("atom " + getType() + " has no attributes");
		}
		return (CompositeNode) node;
	}

	private Slot slot(String attribute) {
		Slot slot = composite().getEntry().getAttribute(attribute);
		if (slot == null) {
			throw new IdentifierError("node type " + getType() + " has no attribute '" + attribute + "'");
		}
		return slot;
	}

	// ----------------------------------------------------------------
	// Attributes
	// ----------------------------------------------------------------

	/**
	 * Resolves a single-node attribute by attribute name, or by the type of
	 * the node it holds when exactly one attribute currently holds a node of
	 * that type.
	 *
	 * @return the child proxy, or {@code null} for an absent optional node
	 * @throws IdentifierError if the identifier is not a node attribute and
	 *                         does not name exactly one child by type
	 */
	public Proxy get(String identifier) {
		CompositeNode composite = composite();
		Slot slot = composite.getEntry().getAttribute(identifier);
		if (slot != null) {
			if (slot.getKind() != SlotKind.NODE) {
				throw new IdentifierError("attribute '" + identifier + "' of " + getType() + " is a "
						+ slot.getKind().name().toLowerCase() + "; use " + accessorFor(slot));
			}
			FstNode child = composite.getNode(identifier);
			return child == null ? null : getTree().proxy(child, this);
		}
		FstNode match = null;
		for (Slot candidate : composite.getEntry().getAttributes().values()) {
			if (candidate.getKind() != SlotKind.NODE) {
				continue;
			}
			FstNode child = composite.getNode(candidate.getName());
			if (child != null && child.is(identifier)) {
				if (match != null) {
					throw new IdentifierError("'" + identifier + "' is ambiguous on " + getType());
				}
				match = child;
			}
		}
		if (match == null) {
			throw new IdentifierError("'" + identifier + "' is neither an attribute of " + getType()
					+ " nor the type of one of its children");
		}
		return getTree().proxy(match, this);
	}

	private static String accessorFor(Slot slot) {
		switch (slot.getKind()) {
			case STRING:
				return "getString()";
			case FLAG:
				return "getFlag()";
			default:
				return "list()";
		}
	}

	/**
	 * Replaces a single-node attribute. The item is a detached proxy, a node
	 * that is not part of the tree, source text parsed in the attribute's
	 * context, or {@code null} to drop an optional node.
	 *
	 * @return the proxy of the new child, or {@code null}
	 * @throws ValidationError if the item cannot be placed there
	 */
	public Proxy set(String attribute, Object item) {
		requireNotDetached();
		CompositeNode composite = composite();
		Slot slot = slot(attribute);
		if (slot.getKind() != SlotKind.NODE) {
			throw new IdentifierError("attribute '" + attribute + "' of " + getType() + " is not a node; use "
					+ accessorFor(slot));
		}
		Tree owner = getTree();
		FstNode old = composite.getNode(attribute);
		FstNode value = item == null ? null
				: owner.prepare(item, Splice.attributeKind(getType(), attribute));
		if (value == null && !slot.isOptional()) {
			throw new ValidationError("attribute '" + attribute + "' of " + getType() + " is required");
		}
		CompositeNode changed = composite.shallowCopy();
		changed.set(attribute, value);
		if (slot.isOptional() && (old == null) != (value == null)) {
			Splice.adjustOptionalSpacing(changed, attribute, value != null);
		}
		if (changed.is("slice") && "step".equals(attribute)) {
			Splice.adjustSliceStep(changed, value != null);
		}
		SchemaValidator.validateShallow(changed);
		commit(composite, changed);
		if (old != null) {
			owner.detach(old);
		}
		if (value == null) {
			return null;
		}
		owner.attach(value, this);
		return owner.proxy(value, this);
	}

	/**
	 * Puts {@code item} in this node's place, in the collection or the
	 * single-node attribute holding it. This proxy ends up detached.
	 *
	 * @return the proxy of the new node
	 * @throws ValidationError if this is the root or the item cannot be placed
	 *                         there
	 */
	public Proxy replace(Object item) {
		requireNotDetached();
		Proxy up = parentOrNull();
		if (up == null) {
			throw new ValidationError("the root " + getType() + " cannot be replaced");
		}
		ProxyList list = owningList();
		if (list != null) {
			return list.replace(list.indexOf(this), item);
		}
		NodePath.Step step = location();
		if (step == null || step.getIndex() >= 0) {
			throw new ValidationError(getType() + " node is not an item or an attribute of " + up.getType());
		}
		return up.set(step.getAttribute(), item);
	}

	public String getString(String attribute) {
		Slot slot = slot(attribute);
		if (slot.getKind() != SlotKind.STRING) {
			throw new IdentifierError("attribute '" + attribute + "' of " + getType() + " is not a string");
		}
		return composite().getString(attribute);
	}

	public void setString(String attribute, String value) {
		requireNotDetached();
		Slot slot = slot(attribute);
		if (slot.getKind() != SlotKind.STRING) {
			throw new IdentifierError("attribute '" + attribute + "' of " + getType() + " is not a string");
		}
		if (value == null) {
			throw new ValidationError("attribute '" + attribute + "' of " + getType() + " cannot be null");
		}
		if ("name".equals(attribute) && (!Tokenizer.isIdentifier(value) || Tokenizer.isKeyword(value))) {
			throw new ValidationError("'" + value + "' is not a valid " + getType() + " name");
		}
		composite().set(attribute, value);
	}

	public boolean getFlag(String attribute) {
		Slot slot = slot(attribute);
		if (slot.getKind() != SlotKind.FLAG) {
			throw new IdentifierError("attribute '" + attribute + "' of " + getType() + " is not a flag");
		}
		return composite().getFlag(attribute);
	}

	public void setFlag(String attribute, boolean value) {
		requireNotDetached();
		Slot slot = slot(attribute);
		if (slot.getKind() != SlotKind.FLAG) {
			throw new IdentifierError("attribute '" + attribute + "' of " + getType() + " is not a flag");
		}
		CompositeNode composite = composite();
		if (composite.getFlag(attribute) == value) {
			return;
		}
		CompositeNode changed = composite.shallowCopy();
		changed.set(attribute, value);
		Splice.adjustFlagSpacing(changed, attribute, value);
		SchemaValidator.validateShallow(changed);
		commit(composite, changed);
	}

	private static void commit(CompositeNode target, CompositeNode changed) {
		for (Map.Entry<String, Object> attribute : changed.getAttributes().entrySet()) {
			target.set(attribute.getKey(), attribute.getValue());
		}
	}

	/** Literal text of an atom. */
	public String getValue() {
		if (!node.isAtom()) {
			throw new IdentifierError(getType() + " is not an atom; use get(\"value\")");
		}
		return ((AtomNode) node).getValue();
	}

	/**
	 * Replaces the literal text of an atom, e.g. to rename a name.
	 */
	public void setValue(String value) {
		requireNotDetached();
		if (!node.isAtom()) {
			throw new IdentifierError(getType() + " is not an atom; use set(\"value\", ...)");
		}
		if (value == null || value.isEmpty()) {
			throw new ValidationError("atom " + getType() + " needs a non-empty value");
		}
		if (node.is("name") && !isNameValue(value)) {
			throw new ValidationError("'" + value + "' is not a valid name");
		}
		((AtomNode) node).setValue(value);
	}

	/** Identifiers, and the keyword constants that are stored as names. */
	private static boolean isNameValue(String value) {
		if ("True".equals(value) || "False".equals(value) || "None".equals(value)) {
			return true;
		}
		return Tokenizer.isIdentifier(value) && !Tokenizer.isKeyword(value);
	}

	/**
	 * Collection view of list attribute {@code attribute}.
	 *
	 * @throws IdentifierError if the attribute is not a list of items
	 */
	public ProxyList list(String attribute) {
		Slot slot = slot(attribute);
		if (slot.getKind() == SlotKind.SEPARATED_LIST) {
			return new SeparatedProxyList(this, attribute);
		}
		if (slot.getKind() != SlotKind.NODE_LIST || slot.getPolicy() == ListPolicy.FORMATTING) {
			throw new IdentifierError("attribute '" + attribute + "' of " + getType() + " is not a collection");
		}
		switch (slot.getPolicy()) {
			case LINES:
				return new LineProxyList(this, attribute);
			case CLAUSES:
				return new ClauseProxyList(this, attribute);
			case DECORATORS:
				return new DecoratorProxyList(this, attribute);
			default:
				return new PlainProxyList(this, attribute);
		}
	}

	// ----------------------------------------------------------------
	// Queries
	// ----------------------------------------------------------------

	/**
	 * First node of this subtree, this node included, in rendering order
	 * that matches, or {@code null}.
	 */
	public Proxy find(Object matcher) {
		return find(matcher, Collections.<String, Object>emptyMap());
	}

	public Proxy find(Object matcher, Map<String, ?> filters) {
		List<Proxy> found = Query.find(this, NodeMatcher.of(matcher), filters, true);
		return found.isEmpty() ? null : found.get(0);
	}

	public List<Proxy> findAll(Object matcher) {
		return findAll(matcher, Collections.<String, Object>emptyMap());
	}

	public List<Proxy> findAll(Object matcher, Map<String, ?> filters) {
		return Query.find(this, NodeMatcher.of(matcher), filters, false);
	}

	// ----------------------------------------------------------------
	// Navigation
	// ----------------------------------------------------------------

	/**
	 * @return the parent, or {@code null} for the root
	 * @throws DetachedNodeError if this node was removed from its tree
	 */
	public Proxy parent() {
		requireNotDetached();
		return parentOrNull();
	}

	public Proxy root() {
		Proxy current = this;
		while (true) {
			current.requireNotDetached();
			Proxy up = current.parentOrNull();
			if (up == null) {
				return current;
			}
			current = up;
		}
	}

	/** Attribute and raw list index of this node in its parent. */
	private NodePath.Step location() {
		Proxy up = parentOrNull();
		if (up == null || up.node.isAtom()) {
			return null;
		}
		CompositeNode owner = (CompositeNode) up.node;
		for (Map.Entry<String, Object> attribute : owner.getAttributes().entrySet()) {
			Object value = attribute.getValue();
			if (value == node) {
				return new NodePath.Step(attribute.getKey(), -1);
			}
			if (value instanceof List) {
				List<?> list = (List<?>) value;
				for (int i = 0; i < list.size(); i++) {
					if (list.get(i) == node) {
						return new NodePath.Step(attribute.getKey(), i);
					}
				}
			}
		}
		return null;
	}

	/** The collection this node is an item of, or {@code null}. */
	private ProxyList owningList() {
		if (detached || !Splice.isItem(node)) {
			return null;
		}
		NodePath.Step step = location();
		if (step == null || step.getIndex() < 0) {
			return null;
		}
		Proxy up = parentOrNull();
		Slot slot = ((CompositeNode) up.node).getEntry().getAttribute(step.getAttribute());
		if (Query.collectionKey(slot) == null) {
			return null;
		}
		return up.list(step.getAttribute());
	}

	/**
	 * Position among the items of the owning collection; empty when this node
	 * is not a collection item.
	 */
	public OptionalInt indexOnParent() {
		ProxyList list = owningList();
		if (list == null) {
			return OptionalInt.empty();
		}
		return OptionalInt.of(list.indexOf(this));
	}

	/** Next item of the owning collection, or {@code null}. */
	public Proxy next() {
		requireNotDetached();
		ProxyList list = owningList();
		if (list == null) {
			return null;
		}
		int index = list.indexOf(this);
		return index + 1 < list.size() ? list.get(index + 1) : null;
	}

	/** Previous item of the owning collection, or {@code null}. */
	public Proxy previous() {
		requireNotDetached();
		ProxyList list = owningList();
		if (list == null) {
			return null;
		}
		int index = list.indexOf(this);
		return index > 0 ? list.get(index - 1) : null;
	}

	/**
	 * The nearest following item, in document order and outside this
	 * subtree, of a collection with the same policy as this node's one.
	 */
	public Proxy nextRecursive() {
		Tree owner = requireAttached();
		List<Query.Visit> visits = Query.walk(owner.module());
		int index = indexIn(visits);
		String key = collectionKey(visits.get(index));
		for (int i = visits.get(index).end; i < visits.size(); i++) {
			if (key.equals(visits.get(i).collection)) {
				return owner.proxyAt(visits, i);
			}
		}
		return null;
	}

	/**
	 * The nearest preceding item, in document order and excluding
	 * ancestors, of a collection with the same policy as this node's one.
	 */
	public Proxy previousRecursive() {
		Tree owner = requireAttached();
		List<Query.Visit> visits = Query.walk(owner.module());
		int index = indexIn(visits);
		String key = collectionKey(visits.get(index));
		for (int i = index - 1; i >= 0; i--) {
			Query.Visit visit = visits.get(i);
			if (visit.end > index) {
				continue;
			}
			if (key.equals(visit.collection)) {
				return owner.proxyAt(visits, i);
			}
		}
		return null;
	}

	private static String collectionKey(Query.Visit visit) {
		return visit.collection != null ? visit.collection : ListPolicy.LINES.name();
	}

	private int indexIn(List<Query.Visit> visits) {
		for (int i = 0; i < visits.size(); i++) {
			if (visits.get(i).node == node) {
				return i;
			}
		}
		throw new DetachedNodeError("this " + getType() + " node is not part of its tree");
	}

	private Tree requireAttached() {
		if (!isAttached()) {
			throw new DetachedNodeError("this " + getType() + " node is not attached to a tree");
		}
		return getTree();
	}

	/**
	 * Steps from the root to this node.
	 *
	 * @throws DetachedNodeError if the node is not attached
	 */
	public NodePath path() {
		requireAttached();
		List<NodePath.Step> steps = new ArrayList<>();
		Proxy current = this;
		while (current.parentOrNull() != null) {
			steps.add(0, current.location());
			current = current.parentOrNull();
		}
		return new NodePath(steps);
	}

	// ----------------------------------------------------------------
	// Copies and conversions
	// ----------------------------------------------------------------

	/**
	 * Detached deep copy, with its lines moved to column 0, ready to be
	 * inserted elsewhere.
	 */
	public Proxy copy() {
		FstNode copy = node.deepCopy();
		Indentation.shift(copy, Indentation.lineIndentation(this).length(), "");
		Proxy proxy = new Proxy(getTree(), copy, null);
		proxy.detached = true;
		return proxy;
	}

	/** Plain map/list structure of the subtree. */
	public Map<String, Object> fst() {
		return FstInterchange.toMap(node);
	}

	public String toJson() {
		return FstInterchange.toJson(node);
	}

	/**
	 * Java value of a literal subtree.
	 *
	 * @throws LiteralError if the subtree is not a plain literal
	 */
	public Object evaluateLiteral() {
		return LiteralEvaluator.evaluate(node);
	}

	/**
	 * Indented dump of the subtree: one line per node with its type, the
	 * attribute or index it sits in, and atom text, string attributes and
	 * set flags. Formatting is omitted.
	 */
	public String describe() {
		StringBuilder builder = new StringBuilder();
		describe(node, "", 0, builder);
		return builder.toString();
	}

	private static void describe(FstNode node, String label, int depth, StringBuilder builder) {
		for (int i = 0; i < depth; i++) {
			builder.append("  ");
		}
		if (!label.isEmpty()) {
			builder.append(label).append(": ");
		}
		builder.append(node.getType());
		if (node.isAtom()) {
			builder.append(" '").append(((AtomNode) node).getValue()).append("'\n");
			return;
		}
		CompositeNode composite = (CompositeNode) node;
		for (Slot slot : composite.getEntry().getAttributes().values()) {
			if (slot.getKind() == SlotKind.STRING && !slot.getName().endsWith("formatting")) {
				builder.append(' ').append(slot.getName()).append("='")
						.append(composite.getString(slot.getName())).append('\'');
			} else if (slot.getKind() == SlotKind.FLAG && composite.getFlag(slot.getName())) {
				builder.append(' ').append(slot.getName());
			}
		}
		builder.append('\n');
		for (Slot slot : composite.getEntry().getAttributes().values()) {
			if (slot.getKind() == SlotKind.NODE) {
				FstNode child = composite.getNode(slot.getName());
				if (child != null) {
					describe(child, slot.getName(), depth + 1, builder);
				}
			} else if (slot.getKind().isList() && !slot.isFormatting()) {
				int index = 0;
				for (FstNode child : composite.getList(slot.getName())) {
					if (Splice.isItem(child)) {
						describe(child, slot.getName() + "[" + index++ + "]", depth + 1, builder);
					}
				}
			}
		}
	}

	public String dumps() {
		return Renderer.render(node);
	}

	/**
	 * Source range of the node in the current rendering of its tree.
	 *
	 * @throws DetachedNodeError if the node is not attached
	 */
	public Range range() {
		Tree owner = requireAttached();
		RenderedSpans spans = Renderer.renderWithSpans(owner.module());
		return Ranges.fromOffsets(spans.getText(), spans.getStart(node), spans.getEnd(node));
	}

	// ----------------------------------------------------------------
	// Indentation
	// ----------------------------------------------------------------

	public void increaseIndentation(int levels) {
		if (levels < 0) {
			throw new IllegalArgumentException("levels must not be negative: " + levels);
		}
		StringBuilder prefix = new StringBuilder();
		for (int i = 0; i < levels; i++) {
			prefix.append(getTree().getIndentUnit());
		}
		reindent(0, prefix.toString());
	}

	/**
	 * @throws ValidationError if a block statement would end up at or left of
	 *                         the statement owning its block
	 */
	public void decreaseIndentation(int levels) {
		if (levels < 0) {
			throw new IllegalArgumentException("levels must not be negative: " + levels);
		}
		int removeCount = levels * getTree().getIndentUnit().length();
		checkDecrease(removeCount);
		reindent(removeCount, "");
	}

	void checkDecrease(int removeCount) {
		requireNotDetached();
		Proxy up = parentOrNull();
		NodePath.Step step = location();
		if (removeCount == 0 || up == null || up.node.is("module") || step == null || step.getIndex() < 0) {
			return;
		}
		Slot slot = ((CompositeNode) up.node).getEntry().getAttribute(step.getAttribute());
		if (slot.getKind() != SlotKind.NODE_LIST || slot.getPolicy() != ListPolicy.LINES
				|| !Indentation.startsLine(this)) {
			return;
		}
		int own = Indentation.lineIndentation(this).length();
		int floor = Indentation.lineIndentation(up).length();
		if (own - Math.min(removeCount, own) <= floor) {
			throw new ValidationError("cannot dedent this " + getType() + " by " + removeCount
					+ " columns: its block would no longer be indented under " + up.getType());
		}
	}

	/**
	 * Shifts the lines this node owns and, when the node starts a line, the
	 * indentation in front of it.
	 */
	private void reindent(int removeCount, String addPrefix) {
		requireNotDetached();
		Indentation.shift(node, removeCount, addPrefix);
		NodePath.Step step = location();
		if (step == null || step.getIndex() < 0) {
			return;
		}
		CompositeNode owner = (CompositeNode) parentOrNull().node;
		Slot slot = owner.getEntry().getAttribute(step.getAttribute());
		if (slot.getKind() != SlotKind.NODE_LIST || slot.getPolicy() == ListPolicy.FORMATTING
				|| slot.getPolicy() == ListPolicy.PLAIN) {
			return;
		}
		List<FstNode> list = owner.getList(step.getAttribute());
		int index = step.getIndex();
		int before = index > 0 && list.get(index - 1).is("space") ? index - 1 : index;
		boolean lineStart = before == 0 ? (owner.is("module") || slot.getPolicy() == ListPolicy.CLAUSES)
				: Indentation.endsWithNewline(list.get(before - 1));
		if (!lineStart) {
			return;
		}
		if (before < index) {
			AtomNode space = (AtomNode) list.get(before);
			String value = Indentation.adjust(space.getValue(), removeCount, addPrefix);
			if (value.isEmpty()) {
				list.remove(before);
			} else {
				space.setValue(value);
			}
		} else if (!addPrefix.isEmpty()) {
			list.add(index, Splice.space(addPrefix));
		}
	}

	@Override
	public String toString() {
		String text = dumps();
		if (text.length() > 40) {
			text = text.substring(0, 37) + "...";
		}
		return getType() + "(" + text.replace("\n", "\\n") + ")";
	}
}
