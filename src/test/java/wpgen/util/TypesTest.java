// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package wpgen.util;

import static org.junit.jupiter.api.Assertions.*;
import static wpgen.core.Logic.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import wpgen.core.Logic.Expr;
import wpgen.core.Logic.Type;
import wpgen.core.WpException;

public class TypesTest {

	@ParameterizedTest
	@CsvSource({ "bool, BOOL", "i8, I8", "i16, I16", "i32, I32", "i64, I64", "u8, U8", "u16, U16", "u32, U32",
			"u64, U64", "&u8, U8", "&mut i64, I64", "'&&bool', BOOL" })
	public void test_fromText_01(String text, Type expected) {
		assertEquals(expected, Types.fromText(text));
	}

	@ParameterizedTest
	@ValueSource(strings = { "i128", "usize", "String", "(i32, bool)", "[u8; 4]", "()" })
	public void test_fromText_02(String text) {
		WpException.TypeResolution e = assertThrows(WpException.TypeResolution.class, () -> Types.fromText(text));
		assertEquals(text, e.getType());
	}

	@ParameterizedTest
	@ValueSource(strings = { "i128", "u128", "isize", "bool", "f32" })
	public void test_fromKind_01(String kind) {
		assertThrows(WpException.UnsupportedConstruct.class, () -> Types.fromKind(kind));
	}

	@Test
	public void test_ofWidth_01() {
		assertEquals(Type.I16, Types.ofWidth(16, true));
		assertEquals(Type.U64, Types.ofWidth(64, false));
		assertThrows(WpException.UnsupportedConstruct.class, () -> Types.ofWidth(128, true));
		assertThrows(WpException.UnsupportedConstruct.class, () -> Types.ofWidth(12, false));
	}

	@Test
	public void test_tupleElement_01() {
		assertEquals("i32", Types.tupleElement("(i32, bool)", 0));
		assertEquals("bool", Types.tupleElement("(i32, bool)", 1));
		assertEquals("(u8, bool)", Types.tupleElement("(i32, (u8, bool))", 1));
		assertEquals("u8", Types.tupleElement("(u8,)", 0));
	}

	@Test
	public void test_tupleElement_02() {
		assertThrows(WpException.UnsupportedConstruct.class, () -> Types.tupleElement("(i32, bool)", 2));
		assertThrows(WpException.TypeResolution.class, () -> Types.tupleElement("i32", 0));
		assertFalse(Types.isTuple("()"));
	}

	@Test
	public void test_evaluationType_01() {
		Expr x = VAR("x", Type.U16);
		assertEquals(Type.U16, Types.evaluationType(x));
		assertEquals(Type.U16, Types.evaluationType(ADD(x, UNSIGNED(16, 1))));
		assertEquals(Type.U16, Types.evaluationType(BITNOT(x)));
		assertEquals(Type.I8, Types.evaluationType(NEG(SIGNED(8, 1))));
		assertEquals(Type.BOOL, Types.evaluationType(LT(x, x)));
		assertEquals(Type.BOOL, Types.evaluationType(NOT(CONST(true))));
		assertEquals(Type.BOOL, Types.evaluationType(IMPLIES(CONST(true), CONST(false))));
	}
}
