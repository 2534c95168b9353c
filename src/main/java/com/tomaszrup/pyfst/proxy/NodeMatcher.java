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
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.tomaszrup.pyfst.schema.RenderingSchema;

/**
 * Decides whether a node takes part in a query result.
 *
 * <p>String specifications are read as follows: {@code "re:<regex>"} is a
 * regular expression, {@code "g:<glob>"} or any string containing {@code *}
 * or {@code ?} is a glob, anything else is an exact node type. Patterns and
 * globs must match the whole type name.</p>
 */
public abstract class NodeMatcher {
	private static final String REGEX_PREFIX = "re:";
	private static final String GLOB_PREFIX = "g:";
	private static final Pattern GLOB_CHARACTERS = Pattern.compile("[A-Za-z0-9_*?]+");

	public abstract boolean matches(Proxy proxy);

	/**
	 * Converts a matcher argument: a {@link NodeMatcher}, a string, a
	 * {@link Pattern} or a {@code Predicate<Proxy>}.
	 *
	 * @throws QueryError if the matcher argument is invalid
	 */
	@SuppressWarnings("unchecked")
	public static NodeMatcher of(Object spec) {
		if (spec instanceof NodeMatcher) {
			return (NodeMatcher) spec;
		}
		if (spec instanceof String) {
			return parse((String) spec);
		}
		if (spec instanceof Pattern) {
			return regex((Pattern) spec);
		}
		if (spec instanceof Predicate) {
			return predicate((Predicate<Proxy>) spec);
		}
		throw new QueryError("unsupported node matcher " + spec);
	}

	private static NodeMatcher parse(String spec) {
		if (spec.startsWith(REGEX_PREFIX)) {
			try {
				return regex(Pattern.compile(spec.substring(REGEX_PREFIX.length())));
			} catch (PatternSyntaxException e) {
				throw new QueryError("invalid regular expression '" + spec + "': " + e.getDescription(), e);
			}
		}
		if (spec.startsWith(GLOB_PREFIX)) {
			return glob(spec.substring(GLOB_PREFIX.length()));
		}
		if (spec.indexOf('*') >= 0 || spec.indexOf('?') >= 0) {
			return glob(spec);
		}
		return type(spec);
	}

	/**
	 * @throws QueryError if no node type is called {@code type}
	 */
	public static NodeMatcher type(final String type) {
		if (!RenderingSchema.isKnownType(type)) {
			throw new QueryError("unknown node type '" + type + "'");
		}
		return new NodeMatcher() {
			@Override
			public boolean matches(Proxy proxy) {
				return proxy.getType().equals(type);
			}

			@Override
			public String toString() {
				return type;
			}
		};
	}

	public static NodeMatcher regex(final Pattern pattern) {
		return new NodeMatcher() {
			@Override
			public boolean matches(Proxy proxy) {
				return pattern.matcher(proxy.getType()).matches();
			}

			@Override
			public String toString() {
				return REGEX_PREFIX + pattern.pattern();
			}
		};
	}

	/**
	 * Glob over type names: {@code *} matches any run of characters and
	 * {@code ?} a single character.
	 *
	 * @throws QueryError if the glob contains other special characters
	 */
	public static NodeMatcher glob(String glob) {
		if (!GLOB_CHARACTERS.matcher(glob).matches()) {
			throw new QueryError("invalid glob '" + glob + "': only letters, digits, '_', '*' and '?' are allowed");
		}
		StringBuilder regex = new StringBuilder();
		for (char c : glob.toCharArray()) {
			if (c == '*') {
				regex.append(".*");
			} else if (c == '?') {
				regex.append('.');
			} else {
				regex.append(c);
			}
		}
		final Pattern pattern = Pattern.compile(regex.toString());
		final String text = glob;
		return new NodeMatcher() {
			@Override
			public boolean matches(Proxy proxy) {
				return pattern.matcher(proxy.getType()).matches();
			}

			@Override
			public String toString() {
				return GLOB_PREFIX + text;
			}
		};
	}

	public static NodeMatcher predicate(final Predicate<Proxy> predicate) {
		return new NodeMatcher() {
			@Override
			public boolean matches(Proxy proxy) {
				return predicate.test(proxy);
			}

			@Override
			public String toString() {
				return "predicate";
			}
		};
	}

	/**
	 * Matches nodes accepted by every given matcher, tested in order.
	 */
	public static NodeMatcher allOf(Object... specs) {
		List<NodeMatcher> matchers = new ArrayList<>();
		for (Object spec : specs) {
			matchers.add(of(spec));
		}
		final List<NodeMatcher> all = Collections.unmodifiableList(matchers);
		return new NodeMatcher() {
			@Override
			public boolean matches(Proxy proxy) {
				for (NodeMatcher matcher : all) {
					if (!matcher.matches(proxy)) {
						return false;
					}
				}
				return true;
			}

			@Override
			public String toString() {
				return "allOf" + all;
			}
		};
	}
}
