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

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.TextEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lsp.utils.Positions;
import com.tomaszrup.lsp.utils.TextEdits;
import com.tomaszrup.pyfst.cache.FstDiskCache;
import com.tomaszrup.pyfst.config.FstOptions;
import com.tomaszrup.pyfst.fst.AtomNode;
import com.tomaszrup.pyfst.fst.CompositeNode;
import com.tomaszrup.pyfst.fst.FstNode;
import com.tomaszrup.pyfst.parser.FragmentParser;
import com.tomaszrup.pyfst.parser.Parser;
import com.tomaszrup.pyfst.render.RenderedSpans;
import com.tomaszrup.pyfst.render.Renderer;
import com.tomaszrup.pyfst.render.SchemaValidator;
import com.tomaszrup.pyfst.schema.RenderingSchema;
import com.tomaszrup.pyfst.schema.ValidationError;

/**
 * A parsed module together with the proxies handed out for its nodes.
 *
 * <p>The tree owns the FST; proxies only refer to it. Each node has at most
 * one proxy, created on first access and kept for the lifetime of the tree,
 * so the same node always yields the same proxy object.</p>
 */
public class Tree {
	private static final Logger logger = LoggerFactory.getLogger(Tree.class);

	private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");

	private final String source;
	private final FstOptions options;
	private final CompositeNode module;
	private final String newline;
	private final String indentUnit;
	private final Map<FstNode, Proxy> proxies = new IdentityHashMap<>();
	private final Proxy root;

	public Tree(String source) {
		this(source, FstOptions.defaults());
	}

	public Tree(String source, FstOptions options) {
		this(source, Parser.parse(source), options);
	}

	/**
	 * Wraps an already parsed module of {@code source}.
	 */
	public Tree(String source, CompositeNode module, FstOptions options) {
		if (!module.is("module")) {
			throw new ValidationError("a tree must be rooted at a module, not " + module.getType());
		}
		this.source = source;
		this.options = options;
		this.module = module;
		this.newline = detectNewline(source, options);
		this.indentUnit = detectIndentUnit(module, options);
		this.root = new Proxy(this, module, null);
		proxies.put(module, root);
		if (logger.isDebugEnabled()) {
			logger.debug("Created tree: newline={}, indent unit='{}'",
					newline.replace("\r", "\\r").replace("\n", "\\n"), indentUnit);
		}
	}

	public static Tree parse(String source) {
		return parse(source, FstOptions.defaults());
	}

	/**
	 * Parses {@code source}; when the options enable caching and name a cache
	 * directory, the tree is loaded from and saved to the on-disk cache.
	 */
	public static Tree parse(String source, FstOptions options) {
		if (options.isCacheEnabled() && options.getCacheDirectory() != null) {
			CompositeNode module = FstDiskCache.fromOptions(options).loadOrParse(source);
			return new Tree(source, module, options);
		}
		return new Tree(source, options);
	}

	public Proxy root() {
		return root;
	}

	/** The source text this tree was parsed from. */
	public String getSource() {
		return source;
	}

	public FstOptions getOptions() {
		return options;
	}

	/** First line break of the source, or the configured default. */
	public String getNewline() {
		return newline;
	}

	/** Indentation of one block level. */
	public String getIndentUnit() {
		return indentUnit;
	}

	public String dumps() {
		return Renderer.render(module);
	}

	/**
	 * Renders the tree, first validating every node against the rendering
	 * schema when {@code strict} is set.
	 *
	 * @throws ValidationError if {@code strict} and a node is malformed
	 */
	public String dumps(boolean strict) {
		if (strict) {
			SchemaValidator.validate(module);
		}
		return dumps();
	}

	/**
	 * Edits that turn the original source into the current rendering.
	 */
	public List<TextEdit> edits() {
		return TextEdits.diff(source, dumps());
	}

	/**
	 * Innermost non-formatting node whose rendered span contains
	 * {@code position}, or {@code null} if the position lies outside the
	 * text.
	 */
	public Proxy nodeAt(Position position) {
		RenderedSpans spans = Renderer.renderWithSpans(module);
		int offset = Positions.getOffset(spans.getText(), position);
		if (offset < 0) {
			return null;
		}
		Proxy current = root;
		boolean descended = true;
		while (descended) {
			descended = false;
			for (FstNode child : Query.children(current.node())) {
				if (RenderingSchema.isFormattingType(child.getType())) {
					continue;
				}
				if (spans.getStart(child) <= offset && offset < spans.getEnd(child)) {
					current = proxy(child, current);
					descended = true;
					break;
				}
			}
		}
		return current;
	}

	// ----------------------------------------------------------------
	// Proxy bookkeeping
	// ----------------------------------------------------------------

	/**
	 * The proxy of {@code node}, which is a child of {@code parent}.
	 */
	Proxy proxy(FstNode node, Proxy parent) {
		Proxy proxy = proxies.get(node);
		if (proxy == null) {
			proxy = new Proxy(this, node, parent);
			proxies.put(node, proxy);
		} else if (parent != null && proxy.parentOrNull() != parent) {
			proxy.attachTo(this, parent);
		}
		return proxy;
	}

	/**
	 * The proxy of an attached node anywhere in the tree, with its whole
	 * parent chain.
	 */
	Proxy proxyOf(FstNode node) {
		List<Query.Visit> visits = Query.walk(module);
		for (int i = 0; i < visits.size(); i++) {
			if (visits.get(i).node == node) {
				return proxyAt(visits, i);
			}
		}
		return null;
	}

	Proxy proxyAt(List<Query.Visit> visits, int index) {
		Query.Visit visit = visits.get(index);
		if (visit.parent < 0) {
			return root;
		}
		return proxy(visit.node, proxyAt(visits, visit.parent));
	}

	CompositeNode module() {
		return module;
	}

	boolean contains(FstNode node) {
		for (Query.Visit visit : Query.walk(module)) {
			if (visit.node == node) {
				return true;
			}
		}
		return false;
	}

	void attach(FstNode node, Proxy parent) {
		Proxy proxy = proxies.get(node);
		if (proxy == null) {
			proxies.put(node, new Proxy(this, node, parent));
		} else {
			proxy.attachTo(this, parent);
		}
	}

	void detach(FstNode node) {
		Proxy proxy = proxies.get(node);
		if (proxy != null) {
			proxy.markDetached();
		}
	}

	/**
	 * Turns a mutation argument into a detached node: a detached proxy, a
	 * node that is not part of this tree, or source text parsed as
	 * {@code kind}.
	 *
	 * @throws ValidationError if the item is attached, of a formatting type or
	 *                         of an unsupported kind
	 */
	FstNode prepare(Object item, FragmentParser.Kind kind) {
		FstNode node;
		if (item instanceof Proxy) {
			Proxy proxy = (Proxy) item;
			if (proxy.isAttached()) {
				throw new ValidationError("node " + proxy.getType()
						+ " is still attached to a tree; use copy() or remove it first");
			}
			node = proxy.node();
			proxies.put(node, proxy);
		} else if (item instanceof FstNode) {
			node = (FstNode) item;
			if (contains(node)) {
				throw new ValidationError("node " + node.getType() + " is already part of this tree");
			}
		} else if (item instanceof String) {
			node = FragmentParser.parse((String) item, kind, newline);
		} else {
			throw new ValidationError("cannot insert " + (item == null ? "null" : item.getClass().getName())
					+ "; expected a proxy, a node or source text");
		}
		if (RenderingSchema.isFormattingType(node.getType())) {
			throw new ValidationError("formatting node " + node.getType() + " cannot be inserted as an item");
		}
		return node;
	}

	// ----------------------------------------------------------------
	// Detection
	// ----------------------------------------------------------------

	static String detectNewline(String source, FstOptions options) {
		Matcher matcher = LINE_BREAK.matcher(source);
		return matcher.find() ? matcher.group() : options.getNewline();
	}

	/**
	 * The indentation of the first statement in the block of the first
	 * module-level compound statement, or the configured default.
	 */
	static String detectIndentUnit(CompositeNode module, FstOptions options) {
		for (FstNode entry : module.getList("value")) {
			if (!Splice.isCompound(entry)) {
				continue;
			}
			List<FstNode> body = ((CompositeNode) entry).getList("value");
			boolean block = false;
			for (int i = 0; i < body.size(); i++) {
				FstNode line = body.get(i);
				if (line.is("endl")) {
					block = true;
				} else if (!block) {
					if (!line.is("comment")) {
						break;
					}
				} else if (line.is("space") && i + 1 < body.size() && !body.get(i + 1).is("endl")
						&& !body.get(i + 1).is("comment")) {
					return ((AtomNode) line).getValue();
				} else if (!RenderingSchema.isFormattingType(line.getType())) {
					break;
				}
			}
		}
		return options.getIndentUnit();
	}
}
