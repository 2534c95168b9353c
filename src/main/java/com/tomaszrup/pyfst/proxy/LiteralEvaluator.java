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

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.tomaszrup.pyfst.fst.AtomNode;
import com.tomaszrup.pyfst.fst.CompositeNode;
import com.tomaszrup.pyfst.fst.FstNode;

/**
 * Computes the Java value of a literal subtree: numbers, strings, bytes,
 * {@code True}/{@code False}/{@code None} and displays built from them.
 */
public final class LiteralEvaluator {

	private LiteralEvaluator() {
	}

	/**
	 * @throws LiteralError if the subtree contains anything but literals
	 */
	public static Object evaluate(FstNode node) {
		switch (node.getType()) {
			case "int":
				return integer(((AtomNode) node).getValue(), 0, 10);
			case "hexa":
				return integer(((AtomNode) node).getValue(), 2, 16);
			case "octa":
				return integer(((AtomNode) node).getValue(), 2, 8);
			case "binary":
				return integer(((AtomNode) node).getValue(), 2, 2);
			case "float":
				return Double.valueOf(((AtomNode) node).getValue().replace("_", ""));
			case "complex":
				throw new LiteralError("imaginary literal " + ((AtomNode) node).getValue() + " has no Java value");
			case "string":
				return string(((AtomNode) node).getValue());
			case "string_chain":
				return chain((CompositeNode) node);
			case "name":
				return constant(((AtomNode) node).getValue());
			case "unitary_operator":
				return signed((CompositeNode) node);
			case "associative_parenthesis":
				return evaluate(((CompositeNode) node).getNode("value"));
			case "tuple":
			case "list":
				return elements((CompositeNode) node, new ArrayList<Object>());
			case "set":
				return elements((CompositeNode) node, new LinkedHashSet<Object>());
			case "dict":
				return dict((CompositeNode) node);
			default:
				throw new LiteralError(node.getType() + " is not a literal");
		}
	}

	private static Object integer(String text, int prefix, int radix) {
		String digits = text.substring(prefix).replace("_", "");
		if (radix == 10 && digits.length() > 1 && digits.charAt(0) == '0' && !digits.matches("0+")) {
			// legacy octal, e.g. 0777
			radix = 8;
		}
		BigInteger value = new BigInteger(digits, radix);
		if (value.bitLength() < 64) {
			return value.longValue();
		}
		return value;
	}

	private static Object constant(String name) {
		switch (name) {
			case "True":
				return Boolean.TRUE;
			case "False":
				return Boolean.FALSE;
			case "None":
				return null;
			default:
				throw new LiteralError("name " + name + " is not a literal");
		}
	}

	private static Object signed(CompositeNode node) {
		String operator = node.getString("value");
		Object operand = evaluate(node.getNode("target"));
		if ("+".equals(operator) && operand instanceof Number) {
			return operand;
		}
		if ("-".equals(operator)) {
			if (operand instanceof Long) {
				long value = (Long) operand;
				return value == Long.MIN_VALUE ? BigInteger.valueOf(value).negate() : (Object) (-value);
			}
			if (operand instanceof BigInteger) {
				BigInteger negated = ((BigInteger) operand).negate();
				return negated.bitLength() < 64 ? (Object) negated.longValue() : negated;
			}
			if (operand instanceof Double) {
				return -(Double) operand;
			}
		}
		throw new LiteralError("operator " + operator + " is not allowed in a literal");
	}

	private static Object chain(CompositeNode node) {
		StringBuilder text = null;
		ByteArrayOutputStream bytes = null;
		for (FstNode part : node.getList("value")) {
			if (!part.is("string")) {
				continue;
			}
			Object value = string(((AtomNode) part).getValue());
			if (value instanceof String) {
				if (bytes != null) {
					throw new LiteralError("cannot mix bytes and str literals");
				}
				text = text == null ? new StringBuilder() : text;
				text.append((String) value);
			} else {
				if (text != null) {
					throw new LiteralError("cannot mix bytes and str literals");
				}
				bytes = bytes == null ? new ByteArrayOutputStream() : bytes;
				byte[] chunk = (byte[]) value;
				bytes.write(chunk, 0, chunk.length);
			}
		}
		if (bytes != null) {
			return bytes.toByteArray();
		}
		return text == null ? "" : text.toString();
	}

	private static <C extends Collection<Object>> C elements(CompositeNode node, C target) {
		for (FstNode element : node.getList("value")) {
			if (Splice.isItem(element)) {
				target.add(evaluate(element));
			}
		}
		return target;
	}

	private static Map<Object, Object> dict(CompositeNode node) {
		Map<Object, Object> map = new LinkedHashMap<>();
		for (FstNode item : node.getList("value")) {
			if (!Splice.isItem(item)) {
				continue;
			}
			if (!item.is("dict_item")) {
				throw new LiteralError(item.getType() + " is not a literal dictionary entry");
			}
			CompositeNode entry = (CompositeNode) item;
			Object key = evaluate(entry.getNode("key"));
			if (key instanceof byte[] || key instanceof List || key instanceof Set || key instanceof Map) {
				throw new LiteralError("unhashable dictionary key " + key);
			}
			map.put(key, evaluate(entry.getNode("value")));
		}
		return map;
	}

	// ----------------------------------------------------------------
	// Strings
	// ----------------------------------------------------------------

	static Object string(String literal) {
		int quote = 0;
		while (quote < literal.length() && literal.charAt(quote) != '\'' && literal.charAt(quote) != '"') {
			quote++;
		}
		String prefix = literal.substring(0, quote).toLowerCase(Locale.ROOT);
		if (prefix.indexOf('f') >= 0) {
			throw new LiteralError("f-string " + literal + " is not a literal");
		}
		boolean raw = prefix.indexOf('r') >= 0;
		boolean isBytes = prefix.indexOf('b') >= 0;
		String body = literal.substring(quote);
		int delimiter = body.startsWith("'''") || body.startsWith("\"\"\"") ? 3 : 1;
		body = body.substring(delimiter, body.length() - delimiter).replace("\r\n", "\n").replace('\r', '\n');
		String value = raw ? body : unescape(body, isBytes);
		if (!isBytes) {
			return value;
		}
		byte[] result = new byte[value.length()];
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			if (c > 0xff) {
				throw new LiteralError("bytes literal " + literal + " contains a non-ASCII character");
			}
			result[i] = (byte) c;
		}
		return result;
	}

	private static String unescape(String body, boolean isBytes) {
		StringBuilder builder = new StringBuilder(body.length());
		int i = 0;
		while (i < body.length()) {
			char c = body.charAt(i);
			if (c != '\\' || i + 1 >= body.length()) {
				builder.append(c);
				i++;
				continue;
			}
			char next = body.charAt(i + 1);
			i += 2;
			switch (next) {
				case '\n':
					break;
				case '\\':
				case '\'':
				case '"':
					builder.append(next);
					break;
				case 'a':
					builder.append('\u0007');
					break;
				case 'b':
					builder.append('\b');
					break;
				case 'f':
					builder.append('\f');
					break;
				case 'n':
					builder.append('\n');
					break;
				case 'r':
					builder.append('\r');
					break;
				case 't':
					builder.append('\t');
					break;
				case 'v':
					builder.append('\u000b');
					break;
				case 'x':
					builder.append((char) hex(body, i, 2));
					i += 2;
					break;
				case 'u':
				case 'U':
					if (isBytes) {
						builder.append('\\').append(next);
						break;
					}
					int length = next == 'u' ? 4 : 8;
					builder.appendCodePoint(hex(body, i, length));
					i += length;
					break;
				default:
					if (next >= '0' && next <= '7') {
						int end = i - 1;
						while (end < body.length() && end < i + 2 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
							end++;
						}
						builder.append((char) Integer.parseInt(body.substring(i - 1, end), 8));
						i = end;
					} else {
						builder.append('\\').append(next);
					}
					break;
			}
		}
		return builder.toString();
	}

	private static int hex(String body, int start, int length) {
		if (start + length > body.length()) {
			throw new LiteralError("truncated escape sequence in string literal");
		}
		try {
			return Integer.parseInt(body.substring(start, start + length), 16);
		} catch (NumberFormatException e) {
			throw new LiteralError("invalid escape sequence \\x" + body.substring(start, start + length), e);
		}
	}
}
