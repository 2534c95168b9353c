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
package com.tomaszrup.pyfst.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.tomaszrup.pyfst.fst.CompositeNode;
import com.tomaszrup.pyfst.fst.FstNode;
import com.tomaszrup.pyfst.lexer.Token;
import com.tomaszrup.pyfst.lexer.TokenKind;
import com.tomaszrup.pyfst.lexer.Tokenizer;
import com.tomaszrup.pyfst.schema.ValidationError;

/**
 * Parses source snippets that are spliced into an existing tree, in the
 * grammatical context of the destination (a statement for a block, a call
 * argument for a call, a clause for a clause list and so on).
 */
public final class FragmentParser {

	/** Grammatical context of a snippet. */
	public enum Kind {
		/** One simple or compound statement, with comment lines around it. */
		STATEMENT,
		/** Expression list; a top-level comma makes a tuple. */
		EXPRESSION,
		/** A single expression, possibly starred, as found in displays. */
		ELEMENT,
		CALL_ARGUMENT,
		DEF_ARGUMENT,
		LAMBDA_ARGUMENT,
		DECORATOR,
		CLAUSE,
		IMPORT_NAME,
		IMPORT_TARGET,
		DICT_ITEM,
		WITH_ITEM,
		COMPREHENSION_LOOP,
		COMPREHENSION_IF,
		NAME,
		/** Attribute access, call or subscription following an atom. */
		TRAILER,
		STRING
	}

	/**
	 * A parsed statement together with the comments written around it.
	 */
	public static final class Fragment {
		private final FstNode node;
		private final List<CompositeNode> leadingComments;
		private final CompositeNode trailingComment;
		private final List<CompositeNode> followingComments;

		Fragment(FstNode node, List<CompositeNode> leadingComments, CompositeNode trailingComment,
				List<CompositeNode> followingComments) {
			this.node = node;
			this.leadingComments = Collections.unmodifiableList(leadingComments);
			this.trailingComment = trailingComment;
			this.followingComments = Collections.unmodifiableList(followingComments);
		}

		public FstNode getNode() {
			return node;
		}

		/** Comment-only lines before the statement. */
		public List<CompositeNode> getLeadingComments() {
			return leadingComments;
		}

		/** Comment on the statement's own line with the whitespace before it, or {@code null}. */
		public CompositeNode getTrailingComment() {
			return trailingComment;
		}

		/** Comment-only lines after the statement. */
		public List<CompositeNode> getFollowingComments() {
			return followingComments;
		}
	}

	private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");

	private FragmentParser() {
	}

	/**
	 * Parses a statement snippet. The text is dedented to column 0 and its
	 * line breaks are converted to {@code newline}.
	 *
	 * @throws ValidationError if the text holds no statement or more than one
	 * @throws ParseError      if the text is not a valid statement
	 */
	public static Fragment parseStatement(String text, String newline) {
		String source = dedent(normalizeNewlines(text, newline));
		if (!source.endsWith(newline)) {
			source = source + newline;
		}
		CompositeNode module = Parser.parse(source);
		FstNode statement = null;
		boolean sameLine = false;
		List<CompositeNode> leading = new ArrayList<>();
		List<CompositeNode> following = new ArrayList<>();
		CompositeNode trailing = null;
		for (FstNode entry : module.getList("value")) {
			if (entry.is("comment")) {
				CompositeNode comment = (CompositeNode) entry;
				if (statement == null) {
					leading.add(comment);
				} else if (sameLine) {
					trailing = comment;
				} else {
					following.add(comment);
				}
			} else if (entry.is("endl")) {
				sameLine = false;
			} else if (entry.is("semicolon")) {
				throw new ValidationError("text must hold exactly one statement: " + text.trim());
			} else if (!entry.is("space")) {
				if (statement != null) {
					throw new ValidationError("text must hold exactly one statement: " + text.trim());
				}
				statement = entry;
				sameLine = true;
			}
		}
		if (statement == null) {
			throw new ValidationError("text holds no statement: " + text.trim());
		}
		return new Fragment(statement, leading, trailing, following);
	}

	/**
	 * Parses a snippet that is not a statement.
	 *
	 * @throws ParseError if the text is not exactly one construct of the kind
	 */
	public static FstNode parse(String text, Kind kind, String newline) {
		if (kind == Kind.STATEMENT) {
			return parseStatement(text, newline).getNode();
		}
		if (kind == Kind.CLAUSE) {
			return parseClause(text, newline);
		}
		String source = normalizeNewlines(text, newline).trim();
		if (kind == Kind.DECORATOR && !source.startsWith("@")) {
			source = "@" + source;
		}
		List<Token> tokens = Tokenizer.tokenize(source);
		rejectOpenComments(tokens, kind);
		Parser parser = new Parser(tokens);
		FstNode node;
		switch (kind) {
			case EXPRESSION:
				node = parser.parseAssignedValue();
				break;
			case ELEMENT:
				node = parser.parseStarOrTest();
				break;
			case CALL_ARGUMENT:
				node = parser.parseCallArgument();
				break;
			case DEF_ARGUMENT:
				node = parser.parseParameter(true);
				break;
			case LAMBDA_ARGUMENT:
				node = parser.parseParameter(false);
				break;
			case DECORATOR:
				node = parser.parseDecorator();
				break;
			case IMPORT_NAME:
				node = parser.parseDottedAsName();
				break;
			case IMPORT_TARGET:
				node = parser.parseNameAsName();
				break;
			case DICT_ITEM:
				node = parser.parseDictElement();
				break;
			case WITH_ITEM:
				node = parser.parseWithItem();
				break;
			case COMPREHENSION_LOOP:
				node = parser.parseComprehensionLoop();
				break;
			case COMPREHENSION_IF:
				node = parser.parseComprehensionIf();
				break;
			case NAME:
				node = parser.parseName();
				break;
			case TRAILER:
				node = parseTrailer(parser, source);
				break;
			case STRING:
				node = parser.parseStarOrTest();
				if (!node.is("string")) {
					throw new ValidationError("expected a single string literal but got " + node.getType());
				}
				break;
			default:
				throw new IllegalArgumentException("unsupported fragment kind " + kind);
		}
		parser.expectEnd();
		return node;
	}

	/**
	 * Only statements and clauses own the line they are written on, so a
	 * comment outside brackets has nowhere to go in any other kind.
	 */
	private static void rejectOpenComments(List<Token> tokens, Kind kind) {
		int depth = 0;
		for (Token token : tokens) {
			if (token.getKind() == TokenKind.OPERATOR) {
				String text = token.getText();
				if ("(".equals(text) || "[".equals(text) || "{".equals(text)) {
					depth++;
				} else if (")".equals(text) || "]".equals(text) || "}".equals(text)) {
					depth--;
				}
			} else if (token.getKind() == TokenKind.COMMENT && depth <= 0) {
				throw new ValidationError("comments outside brackets are only accepted in statement and clause "
						+ "snippets, not in " + kind.name().toLowerCase() + ": " + token.getText());
			}
		}
	}

	private static FstNode parseTrailer(Parser parser, String source) {
		if (source.startsWith("(")) {
			return parser.parseCall();
		}
		if (source.startsWith("[")) {
			return parser.parseGetitem();
		}
		return parser.parseName();
	}

	private static FstNode parseClause(String text, String newline) {
		String source = dedent(normalizeNewlines(text, newline));
		if (!source.endsWith(newline)) {
			source = source + newline;
		}
		List<Token> tokens = Tokenizer.tokenize(source);
		Token first = tokens.get(0);
		if (first.getKind() != TokenKind.KEYWORD || !isClauseKeyword(first.getText())) {
			throw new ParseError(first, Arrays.asList("'elif'", "'else'", "'except'", "'finally'"));
		}
		Parser parser = new Parser(tokens);
		FstNode clause = parser.parseClause(first.getText());
		parser.expectEnd();
		return clause;
	}

	private static boolean isClauseKeyword(String keyword) {
		return "elif".equals(keyword) || "else".equals(keyword) || "except".equals(keyword)
				|| "finally".equals(keyword);
	}

	static String normalizeNewlines(String text, String newline) {
		return LINE_BREAK.matcher(text).replaceAll(Matcher.quoteReplacement(newline));
	}

	/**
	 * Removes the indentation common to all non-blank lines and any leading
	 * blank lines.
	 */
	static String dedent(String text) {
		String[] lines = text.split("(?<=\n)|(?<=\r)(?!\n)", -1);
		String common = null;
		for (String line : lines) {
			String content = stripLineBreak(line);
			if (content.trim().isEmpty()) {
				continue;
			}
			String indent = leadingWhitespace(content);
			if (common == null) {
				common = indent;
			} else {
				int i = 0;
				while (i < common.length() && i < indent.length() && common.charAt(i) == indent.charAt(i)) {
					i++;
				}
				common = common.substring(0, i);
			}
		}
		StringBuilder builder = new StringBuilder();
		boolean started = false;
		for (String line : lines) {
			String content = stripLineBreak(line);
			if (!started && content.trim().isEmpty()) {
				continue;
			}
			started = true;
			if (common != null && line.startsWith(common)) {
				builder.append(line.substring(common.length()));
			} else {
				builder.append(line);
			}
		}
		return builder.toString();
	}

	private static String stripLineBreak(String line) {
		int end = line.length();
		while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
			end--;
		}
		return line.substring(0, end);
	}

	private static String leadingWhitespace(String line) {
		int i = 0;
		while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t' || line.charAt(i) == '\f')) {
			i++;
		}
		return line.substring(0, i);
	}
}
