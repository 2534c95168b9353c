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
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.pyfst.fst.AtomNode;
import com.tomaszrup.pyfst.fst.CompositeNode;
import com.tomaszrup.pyfst.fst.FstNode;
import com.tomaszrup.pyfst.lexer.Token;
import com.tomaszrup.pyfst.lexer.TokenKind;
import com.tomaszrup.pyfst.lexer.Tokenizer;
import com.tomaszrup.pyfst.render.SchemaValidator;
import com.tomaszrup.pyfst.schema.ValidationError;

/**
 * Recursive descent parser from tokens to a full syntax tree.
 *
 * <p>Formatting tokens are attached to the construct that owns the next
 * significant token: before consuming a run of whitespace or comments the
 * parser looks past it, and leaves it in place when what follows belongs to
 * an enclosing construct. Ambiguous displays (tuple vs. parenthesised
 * expression, set vs. dict, comprehension vs. literal) are resolved after
 * the first element with one token of significant lookahead. Every
 * composite is validated against the rendering schema as soon as it is
 * built. The first error aborts the whole parse.</p>
 */
public class Parser {
	private static final Logger logger = LoggerFactory.getLogger(Parser.class);

	private static final Set<String> COMPOUND_KEYWORDS = new HashSet<>(Arrays.asList(
			"if", "while", "for", "try", "with", "def", "class", "async"));

	private static final Set<String> AUGMENTED_ASSIGNMENTS = new HashSet<>(Arrays.asList(
			"+=", "-=", "*=", "/=", "//=", "%=", "@=", "&=", "|=", "^=", ">>=", "<<=", "**="));

	private static final Set<String> COMPARISON_OPERATORS = new HashSet<>(Arrays.asList(
			"<", ">", "==", ">=", "<=", "!="));

	private static final Set<String> EXPRESSION_KEYWORDS = new HashSet<>(Arrays.asList(
			"True", "False", "None", "not", "lambda", "await"));

	private static final Set<String> EXPRESSION_OPERATORS = new HashSet<>(Arrays.asList(
			"(", "[", "{", "-", "+", "~", "*", "**", "..."));

	private static final String[][] BINARY_LEVELS = {
			{"|"}, {"^"}, {"&"}, {"<<", ">>"}, {"+", "-"}, {"*", "/", "%", "//", "@"}
	};

	private final TokenCursor cursor;

	Parser(List<Token> tokens) {
		this.cursor = new TokenCursor(tokens);
	}

	/**
	 * Parses a whole module.
	 *
	 * @throws ParseError if the tokens do not form a module of the supported
	 *                    grammar
	 */
	public static CompositeNode parse(List<Token> tokens) {
		return new Parser(tokens).parseModule();
	}

	/**
	 * Tokenizes and parses {@code source}.
	 */
	public static CompositeNode parse(String source) {
		long start = System.nanoTime();
		List<Token> tokens = Tokenizer.tokenize(source);
		CompositeNode module = parse(tokens);
		if (logger.isDebugEnabled()) {
			logger.debug("Parsed {} chars ({} tokens) in {} ms", source.length(), tokens.size(),
					(System.nanoTime() - start) / 1_000_000);
		}
		return module;
	}

	CompositeNode parseModule() {
		CompositeNode module = new CompositeNode("module");
		parseLines(module.getList("value"), false);
		expectEnd();
		return built(module);
	}

	// ----------------------------------------------------------------
	// Lines and blocks
	// ----------------------------------------------------------------

	private void parseLines(List<FstNode> lines, boolean block) {
		while (true) {
			Token token = peek();
			switch (token.getKind()) {
				case END:
					if (block) {
						throw error(token, "dedent");
					}
					return;
				case DEDENT:
					if (!block) {
						throw new ParseError(token, Collections.emptyList(), "unexpected dedent");
					}
					cursor.next();
					return;
				case INDENT:
					throw new ParseError(token, Collections.emptyList(), "unexpected indent");
				case INDENTATION:
				case WHITESPACE:
				case COMMENT:
				case NEWLINE:
					consumeLineFormatting(lines);
					break;
				default:
					parseStatement(lines);
					break;
			}
		}
	}

	private static boolean isLineFormatting(Token token) {
		switch (token.getKind()) {
			case INDENTATION:
			case WHITESPACE:
			case COMMENT:
			case NEWLINE:
				return true;
			default:
				return false;
		}
	}

	/**
	 * Consumes one token of a comment-only or blank line (or the indentation
	 * of the next line) into {@code entries}.
	 */
	private void consumeLineFormatting(List<FstNode> entries) {
		Token token = cursor.next();
		switch (token.getKind()) {
			case INDENTATION:
				entries.add(space(token));
				break;
			case WHITESPACE:
				if (peek().getKind() == TokenKind.NEWLINE) {
					List<FstNode> formatting = new ArrayList<>();
					formatting.add(space(token));
					entries.add(endl(formatting, cursor.next()));
				} else {
					entries.add(space(token));
				}
				break;
			case COMMENT:
				entries.add(comment(new ArrayList<>(), token));
				break;
			case NEWLINE:
				entries.add(endl(new ArrayList<>(), token));
				break;
			default:
				throw new IllegalStateException("not a line formatting token: " + token);
		}
	}

	private Token peekPastLineFormatting() {
		int distance = 0;
		while (isLineFormatting(cursor.peek(distance))) {
			distance++;
		}
		return cursor.peek(distance);
	}

	private void parseStatement(List<FstNode> lines) {
		Token token = peek();
		if (token.isOperator("@")
				|| (token.getKind() == TokenKind.KEYWORD && COMPOUND_KEYWORDS.contains(token.getText()))) {
			lines.add(parseCompound());
		} else {
			parseSimpleLine(lines);
		}
	}

	/**
	 * Simple statements of one logical line, separated by semicolons, plus
	 * the line end.
	 */
	private void parseSimpleLine(List<FstNode> lines) {
		lines.add(parseSimpleStatement());
		while (sig().isOperator(";")) {
			CompositeNode semicolon = separator("semicolon", ";");
			lines.add(semicolon);
			if (lineEndsAfterWhitespace()) {
				built(semicolon);
				break;
			}
			semicolon.set("second_formatting", formatting());
			built(semicolon);
			lines.add(parseSimpleStatement());
		}
		parseLineEnd(lines);
	}

	private boolean lineEndsAfterWhitespace() {
		int distance = 0;
		while (cursor.peek(distance).getKind() == TokenKind.WHITESPACE) {
			distance++;
		}
		switch (cursor.peek(distance).getKind()) {
			case COMMENT:
			case NEWLINE:
			case END:
			case DEDENT:
				return true;
			default:
				return false;
		}
	}

	private void parseLineEnd(List<FstNode> lines) {
		List<FstNode> whitespace = whitespaceOnly();
		Token token = peek();
		if (token.getKind() == TokenKind.COMMENT) {
			cursor.next();
			lines.add(comment(whitespace, token));
			whitespace = new ArrayList<>();
			token = peek();
		}
		if (token.getKind() == TokenKind.NEWLINE) {
			lines.add(endl(whitespace, cursor.next()));
		} else if (token.getKind() == TokenKind.END || token.getKind() == TokenKind.DEDENT) {
			lines.addAll(whitespace);
		} else {
			throw error(token, "newline");
		}
	}

	/**
	 * Body of a compound statement, positioned right after its colon. A
	 * comment or newline after the colon starts an indented block; anything
	 * else is an inline body whose leading whitespace goes to
	 * {@code formattingAttribute}.
	 */
	private void parseSuite(CompositeNode statement, String formattingAttribute) {
		List<FstNode> body = statement.getList("value");
		List<FstNode> whitespace = whitespaceOnly();
		Token token = peek();
		if (token.getKind() == TokenKind.COMMENT || token.getKind() == TokenKind.NEWLINE) {
			if (token.getKind() == TokenKind.COMMENT) {
				cursor.next();
				body.add(comment(whitespace, token));
				whitespace = new ArrayList<>();
			}
			Token newline = cursor.next();
			if (newline.getKind() != TokenKind.NEWLINE) {
				throw error(newline, "newline");
			}
			body.add(endl(whitespace, newline));
			while (isLineFormatting(peek())) {
				consumeLineFormatting(body);
			}
			Token indent = cursor.next();
			if (indent.getKind() != TokenKind.INDENT) {
				throw error(indent, "indented block");
			}
			parseLines(body, true);
		} else {
			statement.set(formattingAttribute, whitespace);
			if (token.getKind() == TokenKind.END || token.getKind() == TokenKind.DEDENT) {
				throw error(token, "statement");
			}
			parseSimpleLine(body);
		}
	}

	// ----------------------------------------------------------------
	// Compound statements
	// ----------------------------------------------------------------

	private FstNode parseCompound() {
		Token token = peek();
		if (token.isOperator("@")) {
			return parseDecorated();
		}
		switch (token.getText()) {
			case "if":
				return parseIf();
			case "while":
				return parseWhile();
			case "for":
				return parseFor();
			case "try":
				return parseTry();
			case "with":
				return parseWith();
			case "class":
				return parseClass(new ArrayList<>());
			default:
				return parseDef(new ArrayList<>());
		}
	}

	private FstNode parseIf() {
		CompositeNode node = new CompositeNode("if");
		parseConditionHeader(node, "if");
		parseSuite(node, "third_formatting");
		parseClauses(node);
		return built(node);
	}

	private FstNode parseWhile() {
		CompositeNode node = new CompositeNode("while");
		parseConditionHeader(node, "while");
		parseSuite(node, "third_formatting");
		parseClauses(node);
		return built(node);
	}

	private void parseConditionHeader(CompositeNode node, String keyword) {
		expectKeyword(keyword);
		node.set("first_formatting", formatting());
		node.set("test", parseTest());
		node.set("second_formatting", formatting());
		expectOperator(":");
	}

	private FstNode parseFor() {
		CompositeNode node = new CompositeNode("for");
		expectKeyword("for");
		node.set("first_formatting", formatting());
		node.set("target", parseTargetList());
		node.set("second_formatting", formatting());
		expectKeyword("in");
		node.set("third_formatting", formatting());
		node.set("iterable", parseTestListStarExpr());
		node.set("fourth_formatting", formatting());
		expectOperator(":");
		parseSuite(node, "fifth_formatting");
		parseClauses(node);
		return built(node);
	}

	private FstNode parseTry() {
		CompositeNode node = new CompositeNode("try");
		expectKeyword("try");
		node.set("first_formatting", formatting());
		expectOperator(":");
		parseSuite(node, "second_formatting");
		parseClauses(node);
		return built(node);
	}

	private FstNode parseWith() {
		CompositeNode node = new CompositeNode("with");
		expectKeyword("with");
		node.set("first_formatting", formatting());
		parseSeparated(node.getList("contexts"), this::parseWithItem, this::startsExpression);
		if (node.getList("contexts").isEmpty()) {
			throw error(peek(), "expression");
		}
		node.set("second_formatting", formatting());
		expectOperator(":");
		parseSuite(node, "third_formatting");
		return built(node);
	}

	FstNode parseWithItem() {
		CompositeNode node = new CompositeNode("with_context_item");
		node.set("value", parseTest());
		if (sig().isKeyword("as")) {
			node.set("first_formatting", formatting());
			expectKeyword("as");
			node.set("second_formatting", formatting());
			node.set("target", parseExpr());
		}
		return built(node);
	}

	FstNode parseDecorated() {
		List<FstNode> decorators = new ArrayList<>();
		while (true) {
			decorators.add(parseDecorator());
			parseLineEnd(decorators);
			while (isLineFormatting(peek())) {
				consumeLineFormatting(decorators);
			}
			if (!peek().isOperator("@")) {
				break;
			}
		}
		Token token = peek();
		if (token.isKeyword("def") || token.isKeyword("async")) {
			return parseDef(decorators);
		}
		if (token.isKeyword("class")) {
			return parseClass(decorators);
		}
		throw error(token, "'def'", "'class'", "'@'");
	}

	FstNode parseDecorator() {
		CompositeNode decorator = new CompositeNode("decorator");
		expectOperator("@");
		decorator.set("formatting", formatting());
		decorator.set("value", parseTest());
		return built(decorator);
	}

	private FstNode parseDef(List<FstNode> decorators) {
		CompositeNode node = new CompositeNode("def");
		node.set("decorators", decorators);
		if (peek().isKeyword("async")) {
			cursor.next();
			node.set("async", Boolean.TRUE);
			node.set("async_formatting", formatting());
		}
		expectKeyword("def");
		node.set("first_formatting", formatting());
		node.set("name", expectName().getText());
		node.set("second_formatting", formatting());
		expectOperator("(");
		node.set("third_formatting", formatting());
		parseSeparated(node.getList("arguments"), () -> parseParameter(true), this::startsParameter);
		node.set("fourth_formatting", formatting());
		expectOperator(")");
		List<FstNode> afterParenthesis = formatting();
		if (peek().isOperator("->")) {
			node.set("fifth_formatting", afterParenthesis);
			cursor.next();
			node.set("sixth_formatting", formatting());
			node.set("return_annotation", parseTest());
			node.set("seventh_formatting", formatting());
		} else {
			node.set("seventh_formatting", afterParenthesis);
		}
		expectOperator(":");
		parseSuite(node, "eighth_formatting");
		return built(node);
	}

	private FstNode parseClass(List<FstNode> decorators) {
		CompositeNode node = new CompositeNode("class");
		node.set("decorators", decorators);
		expectKeyword("class");
		node.set("first_formatting", formatting());
		node.set("name", expectName().getText());
		List<FstNode> afterName = formatting();
		if (peek().isOperator("(")) {
			node.set("second_formatting", afterName);
			cursor.next();
			node.set("parenthesis", Boolean.TRUE);
			node.set("third_formatting", formatting());
			parseSeparated(node.getList("inherit_from"), this::parseCallArgument, this::startsExpression);
			node.set("fourth_formatting", formatting());
			expectOperator(")");
			node.set("fifth_formatting", formatting());
		} else {
			node.set("fifth_formatting", afterName);
		}
		expectOperator(":");
		parseSuite(node, "sixth_formatting");
		return built(node);
	}

	// ----------------------------------------------------------------
	// Clauses
	// ----------------------------------------------------------------

	private void parseClauses(CompositeNode statement) {
		List<FstNode> clauses = statement.getList("clauses");
		boolean sawElse = false;
		boolean sawExcept = false;
		boolean sawFinally = false;
		while (true) {
			Token next = peekPastLineFormatting();
			if (next.getKind() != TokenKind.KEYWORD
					|| !clauseAllowed(statement.getType(), next.getText(), sawElse, sawExcept, sawFinally)) {
				break;
			}
			while (isLineFormatting(peek())) {
				consumeLineFormatting(clauses);
			}
			clauses.add(parseClause(next.getText()));
			switch (next.getText()) {
				case "else":
					sawElse = true;
					break;
				case "except":
					sawExcept = true;
					break;
				case "finally":
					sawFinally = true;
					break;
				default:
					break;
			}
		}
		if ("try".equals(statement.getType()) && !sawExcept && !sawFinally) {
			throw error(peekPastLineFormatting(), "'except'", "'finally'");
		}
	}

	public static boolean clauseAllowed(String statementType, String keyword, boolean sawElse, boolean sawExcept,
			boolean sawFinally) {
		switch (statementType) {
			case "if":
				return !sawElse && ("elif".equals(keyword) || "else".equals(keyword));
			case "while":
			case "for":
				return !sawElse && "else".equals(keyword);
			case "try":
				if ("except".equals(keyword)) {
					return !sawElse && !sawFinally;
				}
				if ("else".equals(keyword)) {
					return sawExcept && !sawElse && !sawFinally;
				}
				return "finally".equals(keyword) && !sawFinally;
			default:
				return false;
		}
	}

	FstNode parseClause(String keyword) {
		switch (keyword) {
			case "elif": {
				CompositeNode node = new CompositeNode("elif");
				parseConditionHeader(node, "elif");
				parseSuite(node, "third_formatting");
				return built(node);
			}
			case "except":
				return parseExcept();
			case "else":
			case "finally": {
				CompositeNode node = new CompositeNode(keyword);
				expectKeyword(keyword);
				node.set("first_formatting", formatting());
				expectOperator(":");
				parseSuite(node, "second_formatting");
				return built(node);
			}
			default:
				throw error(peek(), "'elif'", "'else'", "'except'", "'finally'");
		}
	}

	private FstNode parseExcept() {
		CompositeNode node = new CompositeNode("except");
		expectKeyword("except");
		if (startsExpression(sig())) {
			node.set("first_formatting", formatting());
			node.set("exception", parseTest());
			if (sig().isKeyword("as")) {
				node.set("second_formatting", formatting());
				expectKeyword("as");
				node.set("third_formatting", formatting());
				node.set("target", name(expectName()));
			}
		}
		node.set("fourth_formatting", formatting());
		expectOperator(":");
		parseSuite(node, "fifth_formatting");
		return built(node);
	}

	// ----------------------------------------------------------------
	// Simple statements
	// ----------------------------------------------------------------

	FstNode parseSimpleStatement() {
		Token token = peek();
		if (token.getKind() == TokenKind.KEYWORD) {
			switch (token.getText()) {
				case "pass":
				case "break":
				case "continue":
					cursor.next();
					return new AtomNode(token.getText(), token.getText());
				case "return":
					return parseReturn();
				case "raise":
					return parseRaise();
				case "del":
					return parseDel();
				case "assert":
					return parseAssert();
				case "global":
				case "nonlocal":
					return parseNameDeclaration(token.getText());
				case "import":
					return parseImport();
				case "from":
					return parseFromImport();
				default:
					break;
			}
		}
		return parseExpressionStatement();
	}

	private FstNode parseReturn() {
		CompositeNode node = new CompositeNode("return");
		expectKeyword("return");
		if (startsExpression(sig())) {
			node.set("formatting", formatting());
			node.set("value", parseTestListStarExpr());
		}
		return built(node);
	}

	private FstNode parseRaise() {
		CompositeNode node = new CompositeNode("raise");
		expectKeyword("raise");
		if (startsExpression(sig())) {
			node.set("first_formatting", formatting());
			node.set("value", parseTest());
			if (sig().isKeyword("from")) {
				node.set("second_formatting", formatting());
				expectKeyword("from");
				node.set("third_formatting", formatting());
				node.set("cause", parseTest());
			}
		}
		return built(node);
	}

	private FstNode parseDel() {
		CompositeNode node = new CompositeNode("del");
		expectKeyword("del");
		node.set("formatting", formatting());
		node.set("value", parseTargetList());
		return built(node);
	}

	private FstNode parseAssert() {
		CompositeNode node = new CompositeNode("assert");
		expectKeyword("assert");
		node.set("first_formatting", formatting());
		node.set("value", parseTest());
		if (sig().isOperator(",")) {
			node.set("second_formatting", formatting());
			expectOperator(",");
			node.set("third_formatting", formatting());
			node.set("message", parseTest());
		}
		return built(node);
	}

	private FstNode parseNameDeclaration(String keyword) {
		CompositeNode node = new CompositeNode(keyword);
		expectKeyword(keyword);
		node.set("formatting", formatting());
		parseSeparated(node.getList("value"), this::parseName, Parser::isName);
		if (node.getList("value").isEmpty()) {
			throw error(peek(), "name");
		}
		return built(node);
	}

	private FstNode parseImport() {
		CompositeNode node = new CompositeNode("import");
		expectKeyword("import");
		node.set("formatting", formatting());
		parseSeparated(node.getList("value"), this::parseDottedAsName, Parser::isName);
		if (node.getList("value").isEmpty()) {
			throw error(peek(), "module name");
		}
		return built(node);
	}

	FstNode parseDottedAsName() {
		CompositeNode node = new CompositeNode("dotted_as_name");
		parseDottedName(node.getList("value"));
		if (sig().isKeyword("as")) {
			node.set("first_formatting", formatting());
			expectKeyword("as");
			node.set("second_formatting", formatting());
			node.set("target", name(expectName()));
		}
		return built(node);
	}

	private void parseDottedName(List<FstNode> names) {
		names.add(name(expectName()));
		while (sig().isOperator(".")) {
			CompositeNode dot = separator("dot", ".");
			dot.set("second_formatting", formatting());
			names.add(built(dot));
			names.add(name(expectName()));
		}
	}

	private FstNode parseFromImport() {
		CompositeNode node = new CompositeNode("from_import");
		expectKeyword("from");
		node.set("first_formatting", formatting());
		StringBuilder dots = new StringBuilder();
		while (peek().isOperator(".") || peek().isOperator("...")) {
			dots.append(cursor.next().getText());
		}
		node.set("dots", dots.toString());
		if (isName(peek())) {
			parseDottedName(node.getList("value"));
		} else if (dots.length() == 0) {
			throw error(peek(), "module name");
		} else if (peek().getKind() == TokenKind.WHITESPACE && isName(sig())) {
			throw new ParseError(peek(), Collections.singletonList("module name"),
					"whitespace between relative import dots and the module name is not supported");
		}
		node.set("second_formatting", formatting());
		expectKeyword("import");
		node.set("third_formatting", formatting());
		List<FstNode> targets = node.getList("targets");
		if (peek().isOperator("(")) {
			cursor.next();
			node.set("with_parenthesis", Boolean.TRUE);
			node.set("fourth_formatting", formatting());
			parseSeparated(targets, this::parseNameAsName, Parser::isName);
			node.set("fifth_formatting", formatting());
			expectOperator(")");
		} else if (peek().isOperator("*")) {
			targets.add(new AtomNode("star", cursor.next().getText()));
		} else {
			parseSeparated(targets, this::parseNameAsName, Parser::isName);
		}
		if (targets.isEmpty()) {
			throw error(peek(), "name", "'*'", "'('");
		}
		return built(node);
	}

	FstNode parseNameAsName() {
		CompositeNode node = new CompositeNode("name_as_name");
		node.set("value", name(expectName()));
		if (sig().isKeyword("as")) {
			node.set("first_formatting", formatting());
			expectKeyword("as");
			node.set("second_formatting", formatting());
			node.set("target", name(expectName()));
		}
		return built(node);
	}

	private FstNode parseExpressionStatement() {
		FstNode first = parseAssignedValue();
		Token token = sig();
		if (token.isOperator(":")) {
			CompositeNode node = new CompositeNode("annotated_assignment");
			node.set("target", first);
			node.set("first_formatting", formatting());
			expectOperator(":");
			node.set("second_formatting", formatting());
			node.set("annotation", parseTest());
			if (sig().isOperator("=")) {
				node.set("third_formatting", formatting());
				expectOperator("=");
				node.set("fourth_formatting", formatting());
				node.set("value", parseAssignedValue());
			}
			return built(node);
		}
		if (token.getKind() == TokenKind.OPERATOR && AUGMENTED_ASSIGNMENTS.contains(token.getText())) {
			CompositeNode node = new CompositeNode("assignment");
			node.set("target", first);
			node.set("first_formatting", formatting());
			String operator = cursor.next().getText();
			node.set("operator", operator.substring(0, operator.length() - 1));
			node.set("second_formatting", formatting());
			node.set("value", parseAssignedValue());
			return built(node);
		}
		if (token.isOperator("=")) {
			return parseAssignment(first);
		}
		return first;
	}

	private FstNode parseAssignment(FstNode target) {
		CompositeNode node = new CompositeNode("assignment");
		node.set("target", target);
		node.set("first_formatting", formatting());
		expectOperator("=");
		node.set("second_formatting", formatting());
		FstNode value = parseAssignedValue();
		if (sig().isOperator("=")) {
			value = parseAssignment(value);
		}
		node.set("value", value);
		return built(node);
	}

	FstNode parseAssignedValue() {
		return peek().isKeyword("yield") ? parseYield() : parseTestListStarExpr();
	}

	private FstNode parseYield() {
		expectKeyword("yield");
		if (sig().isKeyword("from")) {
			CompositeNode node = new CompositeNode("yield_from");
			node.set("first_formatting", formatting());
			expectKeyword("from");
			node.set("second_formatting", formatting());
			node.set("value", parseTest());
			return built(node);
		}
		CompositeNode node = new CompositeNode("yield");
		if (startsExpression(sig())) {
			node.set("formatting", formatting());
			node.set("value", parseTestListStarExpr());
		}
		return built(node);
	}

	// ----------------------------------------------------------------
	// Parameters and arguments
	// ----------------------------------------------------------------

	boolean startsParameter(Token token) {
		return isName(token) || token.isOperator("*") || token.isOperator("**") || token.isOperator("/");
	}

	FstNode parseParameter(boolean annotations) {
		Token token = peek();
		if (token.isOperator("/")) {
			cursor.next();
			return new AtomNode("positional_only_marker", token.getText());
		}
		if (token.isOperator("*")) {
			cursor.next();
			CompositeNode node = new CompositeNode("list_argument");
			if (isName(sig())) {
				node.set("formatting", formatting());
				node.set("value", parseDefArgument(annotations, false));
			}
			return built(node);
		}
		if (token.isOperator("**")) {
			cursor.next();
			CompositeNode node = new CompositeNode("dict_argument");
			node.set("formatting", formatting());
			node.set("value", parseDefArgument(annotations, false));
			return built(node);
		}
		return parseDefArgument(annotations, true);
	}

	private FstNode parseDefArgument(boolean annotations, boolean defaults) {
		CompositeNode node = new CompositeNode("def_argument");
		node.set("target", name(expectName()));
		if (annotations && sig().isOperator(":")) {
			node.set("first_formatting", formatting());
			expectOperator(":");
			node.set("second_formatting", formatting());
			node.set("annotation", parseTest());
		}
		if (defaults && sig().isOperator("=")) {
			node.set("third_formatting", formatting());
			expectOperator("=");
			node.set("fourth_formatting", formatting());
			node.set("value", parseTest());
		}
		return built(node);
	}

	FstNode parseCallArgument() {
		Token token = peek();
		if (token.isOperator("*") || token.isOperator("**")) {
			cursor.next();
			CompositeNode node = new CompositeNode(token.isOperator("*") ? "list_argument" : "dict_argument");
			node.set("formatting", formatting());
			node.set("value", parseTest());
			return built(node);
		}
		FstNode first = parseTest();
		if (first.is("name") && sig().isOperator("=")) {
			CompositeNode node = new CompositeNode("call_argument");
			node.set("target", first);
			node.set("first_formatting", formatting());
			expectOperator("=");
			node.set("second_formatting", formatting());
			node.set("value", parseTest());
			return built(node);
		}
		if (sig().isKeyword("for")) {
			CompositeNode node = new CompositeNode("generator_comprehension");
			node.set("result", first);
			parseComprehension(node.getList("generators"));
			return built(node);
		}
		return first;
	}

	// ----------------------------------------------------------------
	// Expressions
	// ----------------------------------------------------------------

	boolean startsExpression(Token token) {
		switch (token.getKind()) {
			case NAME:
			case NUMBER:
			case STRING:
				return true;
			case KEYWORD:
				return EXPRESSION_KEYWORDS.contains(token.getText());
			case OPERATOR:
				return EXPRESSION_OPERATORS.contains(token.getText());
			default:
				return false;
		}
	}

	/** Expression list with optional starred items; a comma makes a tuple. */
	FstNode parseTestListStarExpr() {
		return parseTupleOrSingle(this::parseStarOrTest, this::startsExpression);
	}

	private FstNode parseTargetList() {
		return parseTupleOrSingle(this::parseStarOrExpr, this::startsExpression);
	}

	private FstNode parseTupleOrSingle(Supplier<FstNode> element, Predicate<Token> canStart) {
		FstNode first = element.get();
		if (!sig().isOperator(",")) {
			return first;
		}
		CompositeNode tuple = new CompositeNode("tuple");
		List<FstNode> items = tuple.getList("value");
		items.add(first);
		continueSeparated(items, element, canStart);
		return built(tuple);
	}

	FstNode parseStarOrTest() {
		if (peek().isOperator("*")) {
			return parseStarred(this::parseExpr);
		}
		return parseTest();
	}

	private FstNode parseStarOrExpr() {
		if (peek().isOperator("*")) {
			return parseStarred(this::parseExpr);
		}
		return parseExpr();
	}

	private FstNode parseStarred(Supplier<FstNode> value) {
		CompositeNode node = new CompositeNode("list_argument");
		expectOperator("*");
		node.set("formatting", formatting());
		node.set("value", value.get());
		return built(node);
	}

	FstNode parseTest() {
		if (peek().isKeyword("lambda")) {
			return parseLambda();
		}
		FstNode condition = parseOrTest();
		if (!sig().isKeyword("if")) {
			return condition;
		}
		CompositeNode node = new CompositeNode("ternary_operator");
		node.set("first", condition);
		node.set("first_formatting", formatting());
		expectKeyword("if");
		node.set("second_formatting", formatting());
		node.set("value", parseOrTest());
		node.set("third_formatting", formatting());
		expectKeyword("else");
		node.set("fourth_formatting", formatting());
		node.set("second", parseTest());
		return built(node);
	}

	private FstNode parseLambda() {
		CompositeNode node = new CompositeNode("lambda");
		expectKeyword("lambda");
		node.set("first_formatting", formatting());
		parseSeparated(node.getList("arguments"), () -> parseParameter(false), this::startsParameter);
		node.set("second_formatting", formatting());
		expectOperator(":");
		node.set("third_formatting", formatting());
		node.set("value", parseTest());
		return built(node);
	}

	private FstNode parseOrTest() {
		FstNode left = parseAndTest();
		while (sig().isKeyword("or")) {
			left = booleanOperator(left, "or", this::parseAndTest);
		}
		return left;
	}

	private FstNode parseAndTest() {
		FstNode left = parseNotTest();
		while (sig().isKeyword("and")) {
			left = booleanOperator(left, "and", this::parseNotTest);
		}
		return left;
	}

	private FstNode booleanOperator(FstNode left, String keyword, Supplier<FstNode> right) {
		CompositeNode node = new CompositeNode("boolean_operator");
		node.set("first", left);
		node.set("first_formatting", formatting());
		expectKeyword(keyword);
		node.set("value", keyword);
		node.set("second_formatting", formatting());
		node.set("second", right.get());
		return built(node);
	}

	private FstNode parseNotTest() {
		if (peek().isKeyword("not")) {
			CompositeNode node = new CompositeNode("unitary_operator");
			node.set("value", cursor.next().getText());
			node.set("formatting", formatting());
			node.set("target", parseNotTest());
			return built(node);
		}
		return parseComparison();
	}

	private FstNode parseComparison() {
		FstNode left = parseExpr();
		while (true) {
			Token token = sig();
			boolean symbolic = token.getKind() == TokenKind.OPERATOR && COMPARISON_OPERATORS.contains(token.getText());
			boolean notIn = token.isKeyword("not") && cursor.peekSignificant(2).isKeyword("in");
			if (!symbolic && !notIn && !token.isKeyword("in") && !token.isKeyword("is")) {
				return left;
			}
			CompositeNode node = new CompositeNode("comparison");
			node.set("first", left);
			node.set("first_formatting", formatting());
			CompositeNode operator = new CompositeNode("comparison_operator");
			operator.set("first", cursor.next().getText());
			if (notIn) {
				operator.set("formatting", formatting());
				operator.set("second", cursor.next().getText());
			} else if (token.isKeyword("is") && sig().isKeyword("not")) {
				operator.set("formatting", formatting());
				operator.set("second", cursor.next().getText());
			}
			node.set("value", built(operator));
			node.set("second_formatting", formatting());
			node.set("second", parseExpr());
			left = built(node);
		}
	}

	FstNode parseExpr() {
		return parseBinary(0);
	}

	private FstNode parseBinary(int level) {
		if (level == BINARY_LEVELS.length) {
			return parseFactor();
		}
		FstNode left = parseBinary(level + 1);
		while (true) {
			Token token = sig();
			if (token.getKind() != TokenKind.OPERATOR || !Arrays.asList(BINARY_LEVELS[level]).contains(token.getText())) {
				return left;
			}
			CompositeNode node = new CompositeNode("binary_operator");
			node.set("first", left);
			node.set("first_formatting", formatting());
			node.set("value", cursor.next().getText());
			node.set("second_formatting", formatting());
			node.set("second", parseBinary(level + 1));
			left = built(node);
		}
	}

	private FstNode parseFactor() {
		Token token = peek();
		if (token.isOperator("+") || token.isOperator("-") || token.isOperator("~")) {
			CompositeNode node = new CompositeNode("unitary_operator");
			node.set("value", cursor.next().getText());
			node.set("formatting", formatting());
			node.set("target", parseFactor());
			return built(node);
		}
		return parsePower();
	}

	private FstNode parsePower() {
		FstNode base;
		if (peek().isKeyword("await")) {
			CompositeNode node = new CompositeNode("unitary_operator");
			node.set("value", cursor.next().getText());
			node.set("formatting", formatting());
			node.set("target", parsePrimary());
			base = built(node);
		} else {
			base = parsePrimary();
		}
		if (!sig().isOperator("**")) {
			return base;
		}
		CompositeNode node = new CompositeNode("binary_operator");
		node.set("first", base);
		node.set("first_formatting", formatting());
		node.set("value", cursor.next().getText());
		node.set("second_formatting", formatting());
		node.set("second", parseFactor());
		return built(node);
	}

	private FstNode parsePrimary() {
		FstNode atom = parseAtom();
		List<FstNode> trailers = new ArrayList<>();
		while (true) {
			Token token = sig();
			if (token.isOperator(".")) {
				CompositeNode dot = separator("dot", ".");
				dot.set("second_formatting", formatting());
				trailers.add(built(dot));
				trailers.add(name(expectName()));
			} else if (token.isOperator("(")) {
				trailers.add(parseCall());
			} else if (token.isOperator("[")) {
				trailers.add(parseGetitem());
			} else {
				break;
			}
		}
		if (trailers.isEmpty()) {
			return atom;
		}
		CompositeNode node = new CompositeNode("atomtrailers");
		node.add("value", atom);
		node.getList("value").addAll(trailers);
		return built(node);
	}

	FstNode parseCall() {
		CompositeNode node = new CompositeNode("call");
		node.set("first_formatting", formatting());
		expectOperator("(");
		node.set("second_formatting", formatting());
		parseSeparated(node.getList("value"), this::parseCallArgument, this::startsExpression);
		node.set("third_formatting", formatting());
		expectOperator(")");
		return built(node);
	}

	FstNode parseGetitem() {
		CompositeNode node = new CompositeNode("getitem");
		node.set("first_formatting", formatting());
		expectOperator("[");
		node.set("second_formatting", formatting());
		node.set("value", parseTupleOrSingle(this::parseSubscript, this::startsSubscript));
		node.set("third_formatting", formatting());
		expectOperator("]");
		return built(node);
	}

	private boolean startsSubscript(Token token) {
		return startsExpression(token) || token.isOperator(":");
	}

	private FstNode parseSubscript() {
		FstNode lower = null;
		if (!peek().isOperator(":")) {
			lower = parseStarOrTest();
			if (!sig().isOperator(":")) {
				return lower;
			}
		}
		CompositeNode slice = new CompositeNode("slice");
		slice.set("lower", lower);
		slice.set("first_formatting", formatting());
		expectOperator(":");
		if (startsExpression(sig())) {
			slice.set("second_formatting", formatting());
			slice.set("upper", parseTest());
		}
		if (sig().isOperator(":")) {
			slice.set("third_formatting", formatting());
			expectOperator(":");
			slice.set("has_two_colons", Boolean.TRUE);
			if (startsExpression(sig())) {
				slice.set("fourth_formatting", formatting());
				slice.set("step", parseTest());
			}
		}
		return built(slice);
	}

	private FstNode parseAtom() {
		Token token = peek();
		switch (token.getKind()) {
			case NAME:
				return name(cursor.next());
			case NUMBER:
				cursor.next();
				return new AtomNode(numberType(token.getText()), token.getText());
			case STRING:
				return parseStrings();
			case KEYWORD:
				if ("True".equals(token.getText()) || "False".equals(token.getText())
						|| "None".equals(token.getText())) {
					return name(cursor.next());
				}
				break;
			case OPERATOR:
				switch (token.getText()) {
					case "(":
						return parseParenthesised();
					case "[":
						return parseListDisplay();
					case "{":
						return parseBraceDisplay();
					case "...":
						cursor.next();
						return new AtomNode("ellipsis", token.getText());
					default:
						break;
				}
				break;
			default:
				break;
		}
		throw error(token, "expression");
	}

	static String numberType(String text) {
		String lower = text.toLowerCase(Locale.ROOT);
		if (lower.startsWith("0x")) {
			return "hexa";
		}
		if (lower.startsWith("0o")) {
			return "octa";
		}
		if (lower.startsWith("0b")) {
			return "binary";
		}
		if (lower.endsWith("j")) {
			return "complex";
		}
		if (lower.contains(".") || lower.contains("e")) {
			return "float";
		}
		return "int";
	}

	private FstNode parseStrings() {
		AtomNode first = new AtomNode("string", cursor.next().getText());
		if (sig().getKind() != TokenKind.STRING) {
			return first;
		}
		CompositeNode chain = new CompositeNode("string_chain");
		List<FstNode> parts = chain.getList("value");
		parts.add(first);
		while (sig().getKind() == TokenKind.STRING) {
			parts.addAll(formatting());
			parts.add(new AtomNode("string", cursor.next().getText()));
		}
		return built(chain);
	}

	private FstNode parseParenthesised() {
		expectOperator("(");
		List<FstNode> leading = formatting();
		if (peek().isOperator(")")) {
			cursor.next();
			CompositeNode tuple = new CompositeNode("tuple");
			tuple.set("with_parenthesis", Boolean.TRUE);
			tuple.set("first_formatting", leading);
			return built(tuple);
		}
		if (peek().isKeyword("yield")) {
			CompositeNode node = new CompositeNode("associative_parenthesis");
			node.set("first_formatting", leading);
			node.set("value", parseYield());
			node.set("second_formatting", formatting());
			expectOperator(")");
			return built(node);
		}
		FstNode first = parseStarOrTest();
		Token token = sig();
		CompositeNode node;
		if (token.isKeyword("for")) {
			node = new CompositeNode("generator_comprehension");
			node.set("with_parenthesis", Boolean.TRUE);
			node.set("result", first);
			parseComprehension(node.getList("generators"));
		} else if (token.isOperator(",")) {
			node = new CompositeNode("tuple");
			node.set("with_parenthesis", Boolean.TRUE);
			node.add("value", first);
			continueSeparated(node.getList("value"), this::parseStarOrTest, this::startsExpression);
		} else {
			node = new CompositeNode("associative_parenthesis");
			node.set("value", first);
		}
		node.set("first_formatting", leading);
		node.set("second_formatting", formatting());
		expectOperator(")");
		return built(node);
	}

	private FstNode parseListDisplay() {
		expectOperator("[");
		List<FstNode> leading = formatting();
		CompositeNode node;
		if (peek().isOperator("]")) {
			node = new CompositeNode("list");
		} else {
			FstNode first = parseStarOrTest();
			if (sig().isKeyword("for")) {
				node = new CompositeNode("list_comprehension");
				node.set("result", first);
				parseComprehension(node.getList("generators"));
			} else {
				node = new CompositeNode("list");
				node.add("value", first);
				continueSeparated(node.getList("value"), this::parseStarOrTest, this::startsExpression);
			}
		}
		node.set("first_formatting", leading);
		node.set("second_formatting", formatting());
		expectOperator("]");
		return built(node);
	}

	private FstNode parseBraceDisplay() {
		expectOperator("{");
		List<FstNode> leading = formatting();
		CompositeNode node;
		if (peek().isOperator("}")) {
			node = new CompositeNode("dict");
		} else if (peek().isOperator("**")) {
			node = new CompositeNode("dict");
			node.add("value", parseDictElement());
			continueSeparated(node.getList("value"), this::parseDictElement, this::startsExpression);
		} else {
			FstNode first = parseStarOrTest();
			if (sig().isOperator(":")) {
				FstNode item = dictItem(first);
				if (sig().isKeyword("for")) {
					node = new CompositeNode("dict_comprehension");
					node.set("result", item);
					parseComprehension(node.getList("generators"));
				} else {
					node = new CompositeNode("dict");
					node.add("value", item);
					continueSeparated(node.getList("value"), this::parseDictElement, this::startsExpression);
				}
			} else if (sig().isKeyword("for")) {
				node = new CompositeNode("set_comprehension");
				node.set("result", first);
				parseComprehension(node.getList("generators"));
			} else {
				node = new CompositeNode("set");
				node.add("value", first);
				continueSeparated(node.getList("value"), this::parseStarOrTest, this::startsExpression);
			}
		}
		node.set("first_formatting", leading);
		node.set("second_formatting", formatting());
		expectOperator("}");
		return built(node);
	}

	FstNode parseDictElement() {
		if (peek().isOperator("**")) {
			CompositeNode node = new CompositeNode("dict_argument");
			expectOperator("**");
			node.set("formatting", formatting());
			node.set("value", parseExpr());
			return built(node);
		}
		return dictItem(parseTest());
	}

	private FstNode dictItem(FstNode key) {
		CompositeNode node = new CompositeNode("dict_item");
		node.set("key", key);
		node.set("first_formatting", formatting());
		expectOperator(":");
		node.set("second_formatting", formatting());
		node.set("value", parseTest());
		return built(node);
	}

	private void parseComprehension(List<FstNode> generators) {
		while (sig().isKeyword("for")) {
			generators.add(parseComprehensionLoop());
		}
	}

	FstNode parseComprehensionLoop() {
		CompositeNode loop = new CompositeNode("comprehension_loop");
		loop.set("first_formatting", formatting());
		expectKeyword("for");
		loop.set("second_formatting", formatting());
		loop.set("target", parseTargetList());
		loop.set("third_formatting", formatting());
		expectKeyword("in");
		loop.set("fourth_formatting", formatting());
		loop.set("iterable", parseOrTest());
		while (sig().isKeyword("if")) {
			loop.add("ifs", parseComprehensionIf());
		}
		return built(loop);
	}

	FstNode parseComprehensionIf() {
		CompositeNode condition = new CompositeNode("comprehension_if");
		condition.set("first_formatting", formatting());
		expectKeyword("if");
		condition.set("second_formatting", formatting());
		condition.set("value", parseOrTest());
		return built(condition);
	}

	// ----------------------------------------------------------------
	// Separated lists
	// ----------------------------------------------------------------

	/**
	 * Parses {@code element (, element)* [,]} into {@code items}, alternating
	 * items and comma nodes. Whitespace after a trailing comma is left for the
	 * enclosing construct.
	 */
	private void parseSeparated(List<FstNode> items, Supplier<FstNode> element, Predicate<Token> canStart) {
		if (!canStart.test(peek())) {
			return;
		}
		items.add(element.get());
		continueSeparated(items, element, canStart);
	}

	private void continueSeparated(List<FstNode> items, Supplier<FstNode> element, Predicate<Token> canStart) {
		while (sig().isOperator(",")) {
			CompositeNode comma = separator("comma", ",");
			items.add(comma);
			if (!canStart.test(sig())) {
				built(comma);
				return;
			}
			comma.set("second_formatting", formatting());
			built(comma);
			items.add(element.get());
		}
	}

	/** Separator node with its leading formatting; the caller fills the rest. */
	private CompositeNode separator(String type, String text) {
		CompositeNode separator = new CompositeNode(type);
		separator.set("first_formatting", formatting());
		expectOperator(text);
		return separator;
	}

	// ----------------------------------------------------------------
	// Tokens and nodes
	// ----------------------------------------------------------------

	private Token peek() {
		return cursor.peek();
	}

	private Token sig() {
		return cursor.peekSignificant();
	}

	private static boolean isName(Token token) {
		return token.getKind() == TokenKind.NAME;
	}

	/** Whitespace and (inside brackets) comments before the next significant token. */
	private List<FstNode> formatting() {
		List<FstNode> nodes = new ArrayList<>();
		while (true) {
			Token token = peek();
			if (token.getKind() == TokenKind.WHITESPACE) {
				nodes.add(space(cursor.next()));
			} else if (token.getKind() == TokenKind.COMMENT) {
				nodes.add(comment(new ArrayList<>(), cursor.next()));
			} else {
				return nodes;
			}
		}
	}

	private List<FstNode> whitespaceOnly() {
		List<FstNode> nodes = new ArrayList<>();
		while (peek().getKind() == TokenKind.WHITESPACE) {
			nodes.add(space(cursor.next()));
		}
		return nodes;
	}

	private Token expectOperator(String operator) {
		Token token = cursor.next();
		if (!token.isOperator(operator)) {
			throw error(token, "'" + operator + "'");
		}
		return token;
	}

	private Token expectKeyword(String keyword) {
		Token token = cursor.next();
		if (!token.isKeyword(keyword)) {
			throw error(token, "'" + keyword + "'");
		}
		return token;
	}

	private Token expectName() {
		Token token = cursor.next();
		if (!isName(token)) {
			throw error(token, "name");
		}
		return token;
	}

	FstNode parseName() {
		return name(expectName());
	}

	void expectEnd() {
		Token token = peek();
		if (token.getKind() != TokenKind.END) {
			throw error(token, "end of input");
		}
	}

	private static AtomNode name(Token token) {
		return new AtomNode("name", token.getText());
	}

	private static AtomNode space(Token token) {
		return new AtomNode("space", token.getText());
	}

	private CompositeNode comment(List<FstNode> formatting, Token token) {
		CompositeNode comment = new CompositeNode("comment");
		comment.set("formatting", formatting);
		comment.set("value", token.getText());
		return built(comment);
	}

	private CompositeNode endl(List<FstNode> formatting, Token newline) {
		CompositeNode endl = new CompositeNode("endl");
		endl.set("formatting", formatting);
		endl.set("value", newline.getText());
		return built(endl);
	}

	private <T extends FstNode> T built(T node) {
		try {
			SchemaValidator.validateShallow(node);
		} catch (ValidationError e) {
			throw new ParseError(peek(), Collections.emptyList(), "invalid " + node.getType() + ": " + e.getMessage());
		}
		return node;
	}

	private static ParseError error(Token found, String... expected) {
		return new ParseError(found, Arrays.asList(expected));
	}
}
