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

import java.math.BigInteger;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link LiteralEvaluator}.
 */
class LiteralEvaluatorTests {

	private static Object evaluate(String expression) {
		return Tree.parse("x = " + expression + "\n").root().find("assignment").get("value").evaluateLiteral();
	}

	// ------------------------------------------------------------------
	// Numbers
	// ------------------------------------------------------------------

	@Test
	void testIntegers() {
		Assertions.assertEquals(42L, evaluate("42"));
		Assertions.assertEquals(1000L, evaluate("1_000"));
		Assertions.assertEquals(31L, evaluate("0x1F"));
		Assertions.assertEquals(15L, evaluate("0o17"));
		Assertions.assertEquals(5L, evaluate("0b101"));
	}

	@Test
	void testLargeIntegers() {
		Assertions.assertEquals(new BigInteger("123456789012345678901234567890"),
				evaluate("123456789012345678901234567890"));
		Assertions.assertEquals(Long.MIN_VALUE, evaluate("-9223372036854775808"));
	}

	@Test
	void testSignsAndFloats() {
		Assertions.assertEquals(-5L, evaluate("-5"));
		Assertions.assertEquals(5L, evaluate("+5"));
		Assertions.assertEquals(-2.5, evaluate("-2.5"));
		Assertions.assertEquals(1000.0, evaluate("1e3"));
		Assertions.assertEquals(1L, evaluate("(1)"));
	}

	@Test
	void testImaginaryFails() {
		Assertions.assertThrows(LiteralError.class, () -> evaluate("3j"));
	}

	// ------------------------------------------------------------------
	// Strings
	// ------------------------------------------------------------------

	@Test
	void testEscapes() {
		Assertions.assertEquals("a\tb", evaluate("'a\\tb'"));
		Assertions.assertEquals("Aé", evaluate("'\\x41\\u00e9'"));
		Assertions.assertEquals("it's", evaluate("\"it\\'s\""));
		Assertions.assertEquals("\u0001", evaluate("'\\1'"));
	}

	@Test
	void testRawAndTripleQuoted() {
		Assertions.assertEquals("a\\tb", evaluate("r'a\\tb'"));
		Assertions.assertEquals("a\nb", evaluate("'''a\nb'''"));
	}

	@Test
	void testBytes() {
		Assertions.assertArrayEquals(new byte[] {97, 98}, (byte[]) evaluate("b'ab'"));
	}

	@Test
	void testImplicitConcatenation() {
		Assertions.assertEquals("ab", evaluate("'a' \"b\""));
		Assertions.assertThrows(LiteralError.class, () -> evaluate("'a' b'b'"));
	}

	@Test
	void testFormattedStringFails() {
		Assertions.assertThrows(LiteralError.class, () -> evaluate("f'{a}'"));
	}

	// ------------------------------------------------------------------
	// Constants and displays
	// ------------------------------------------------------------------

	@Test
	void testConstants() {
		Assertions.assertEquals(Boolean.TRUE, evaluate("True"));
		Assertions.assertEquals(Boolean.FALSE, evaluate("False"));
		Assertions.assertNull(evaluate("None"));
		Assertions.assertThrows(LiteralError.class, () -> evaluate("foo"));
	}

	@Test
	void testNestedDisplays() {
		List<Object> expected = Arrays.<Object>asList(1L, Arrays.<Object>asList(2L, 3L));
		Assertions.assertEquals(expected, evaluate("(1, [2, 3])"));
		Assertions.assertEquals(2, ((Set<?>) evaluate("{1, 1, 2}")).size());
	}

	@Test
	void testDict() {
		Map<Object, Object> expected = new LinkedHashMap<>();
		expected.put("a", 1L);
		expected.put("b", Arrays.asList((Object) null));
		Assertions.assertEquals(expected, evaluate("{'a': 1, 'b': [None]}"));
	}

	@Test
	void testNonLiteralsFail() {
		Assertions.assertThrows(LiteralError.class, () -> evaluate("f(1)"));
		Assertions.assertThrows(LiteralError.class, () -> evaluate("1 + 2"));
		Assertions.assertThrows(LiteralError.class, () -> evaluate("-'a'"));
		Assertions.assertThrows(LiteralError.class, () -> evaluate("{**a}"));
		Assertions.assertThrows(LiteralError.class, () -> evaluate("{[1]: 2}"));
	}
}
