// This file is part of the MIR Borrow Checker (mirborrowck).
//
// The MIR Borrow Checker is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The MIR Borrow Checker is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the MIR Borrow Checker. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2026, the MIR Borrow Checker authors.
package mirborrowck.testing;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.jupiter.api.Test;

import mirborrowck.core.BorrowKind;
import mirborrowck.core.Syntax.Function;
import mirborrowck.core.Syntax.Module;
import mirborrowck.core.Syntax.Operand;
import mirborrowck.core.Syntax.Parameter;
import mirborrowck.core.Syntax.Place;
import mirborrowck.core.Syntax.Place.Global;
import mirborrowck.core.Syntax.Place.Local;
import mirborrowck.core.Syntax.Place.Memory;
import mirborrowck.core.Syntax.Place.Memory.Base;
import mirborrowck.core.Syntax.ProgramPoint;
import mirborrowck.core.Syntax.Rvalue;
import mirborrowck.core.Syntax.Signature;
import mirborrowck.core.Syntax.Stmt;
import mirborrowck.core.Syntax.Terminator;
import mirborrowck.io.Parser;
import mirborrowck.util.SyntaxError;

public class ParserTests {

	// ==============================================================
	// Places
	// ==============================================================

	@Test
	public void test_01() {
		Function f = parseFunction("fn f(x) { bb0: { y = &*x.0[1]; return; } }");
		Stmt.Assign s = (Stmt.Assign) f.instruction(new ProgramPoint(0));
		Rvalue.Ref r = (Rvalue.Ref) s.rightOperand();
		assertEquals(new Local(1), s.leftOperand());
		assertEquals(BorrowKind.SHARED, r.kind());
		// The dereference applies to everything after it
		assertEquals(new Local(0).field(0).index(1).deref(), r.place());
	}

	@Test
	public void test_02() {
		Function f = parseFunction("fn f(x) { bb0: { z = x.len; w = x.data[i]; return; } }");
		Stmt.Assign s1 = (Stmt.Assign) f.instruction(new ProgramPoint(0));
		Stmt.Assign s2 = (Stmt.Assign) f.instruction(new ProgramPoint(1));
		Place x = new Local(0);
		assertEquals(x.length(), ((Rvalue.Use) s1.rightOperand()).operand().place());
		assertEquals(new Local(2), s2.leftOperand());
		assertEquals(x.data().index(new Local(3)), ((Rvalue.Use) s2.rightOperand()).operand().place());
	}

	@Test
	public void test_03() {
		Function f = parseFunction("fn f() { bb0: { mem[0..4] = 1; heap2[8..16] = copy stack[0..8]; return; } }");
		Stmt.Assign s1 = (Stmt.Assign) f.instruction(new ProgramPoint(0));
		Stmt.Assign s2 = (Stmt.Assign) f.instruction(new ProgramPoint(1));
		assertEquals(new Memory(Base.LINEAR, 0, 4), s1.leftOperand());
		assertEquals(new Memory(Base.heap(2), 8, 8), s2.leftOperand());
		Operand rhs = ((Rvalue.Use) s2.rightOperand()).operand();
		assertTrue(rhs instanceof Operand.Copy);
		assertEquals(new Memory(Base.STACK, 0, 8), rhs.place());
	}

	@Test
	public void test_04() {
		// A local which happens to be called mem is not a region
		Function f = parseFunction("fn f(mem) { bb0: { x = mem[0]; return; } }");
		Stmt.Assign s = (Stmt.Assign) f.instruction(new ProgramPoint(0));
		assertEquals(new Local(0).index(0), ((Rvalue.Use) s.rightOperand()).operand().place());
	}

	@Test
	public void test_05() {
		Module m = Parser.parse("fn f() { bb0: { @g = 1; return; } }\n" //
				+ "fn h() { bb0: { @k = 1; @g = 2; return; } }");
		Stmt.Assign s1 = (Stmt.Assign) m.function("f").instruction(new ProgramPoint(0));
		Stmt.Assign s2 = (Stmt.Assign) m.function("h").instruction(new ProgramPoint(0));
		Stmt.Assign s3 = (Stmt.Assign) m.function("h").instruction(new ProgramPoint(1));
		// Globals are shared between functions, locals are not
		assertEquals(new Global(0), s1.leftOperand());
		assertEquals(new Global(1), s2.leftOperand());
		assertEquals(s1.leftOperand(), s3.leftOperand());
	}

	// ==============================================================
	// Statements & Terminators
	// ==============================================================

	@Test
	public void test_10() {
		Function f = parseFunction("fn f(x, y) { bb0: { call g(move x, copy y, -3) -> z; call k(); return z; } }");
		Stmt.Call c1 = (Stmt.Call) f.instruction(new ProgramPoint(0));
		Stmt.Call c2 = (Stmt.Call) f.instruction(new ProgramPoint(1));
		assertEquals("g", c1.callee());
		assertEquals(3, c1.arguments().length);
		assertTrue(c1.arguments()[0] instanceof Operand.Move);
		assertTrue(c1.arguments()[1] instanceof Operand.Copy);
		assertEquals(-3, ((Operand.Constant) c1.arguments()[2]).value());
		assertEquals(new Local(2), c1.destination());
		assertEquals(0, c2.arguments().length);
		assertNull(c2.destination());
		Terminator.Return r = (Terminator.Return) f.instruction(new ProgramPoint(2));
		assertTrue(r.operand() instanceof Operand.Consume);
	}

	@Test
	public void test_11() {
		Function f = parseFunction(
				"fn f(x) { bb0: { a = &mut x.0; b = &uniq x.1; c = x + 1; use a; drop b; nop; unreachable; } }");
		assertEquals(BorrowKind.MUTABLE, ((Rvalue.Ref) ((Stmt.Assign) f.instruction(new ProgramPoint(0))).rightOperand()).kind());
		assertEquals(BorrowKind.UNIQUE, ((Rvalue.Ref) ((Stmt.Assign) f.instruction(new ProgramPoint(1))).rightOperand()).kind());
		Rvalue.BinaryOp op = (Rvalue.BinaryOp) ((Stmt.Assign) f.instruction(new ProgramPoint(2))).rightOperand();
		assertEquals("+", op.operator());
		assertTrue(f.instruction(new ProgramPoint(3)) instanceof Stmt.Use);
		assertTrue(f.instruction(new ProgramPoint(4)) instanceof Stmt.Drop);
		assertTrue(f.instruction(new ProgramPoint(5)) instanceof Stmt.Nop);
		assertTrue(f.instruction(new ProgramPoint(6)) instanceof Terminator.Unreachable);
	}

	@Test
	public void test_12() {
		Function f = parseFunction("fn f(x) {\n" //
				+ "  bb0: { switch x [0: bb1, 2: bb2] otherwise bb3; }\n" //
				+ "  bb1: { return; }\n" //
				+ "  bb2: { return; }\n" //
				+ "  bb3: { switch x [] otherwise bb1; }\n" //
				+ "}");
		Terminator t1 = (Terminator) f.instruction(new ProgramPoint(0));
		Terminator t2 = (Terminator) f.instruction(new ProgramPoint(3));
		assertArrayEquals(new String[] { "bb1", "bb2", "bb3" }, t1.targets());
		assertArrayEquals(new String[] { "bb1" }, t2.targets());
	}

	@Test
	public void test_13() {
		Function f = parseFunction("// leading comment\nfn f(x) { /* block */ bb0: { if x goto bb1 else bb1; } bb1: { return; } }");
		assertArrayEquals(new String[] { "bb1", "bb1" }, ((Terminator) f.instruction(new ProgramPoint(0))).targets());
		assertEquals(2, f.points().size());
	}

	// ==============================================================
	// Signatures
	// ==============================================================

	@Test
	public void test_20() {
		Module m = Parser.parse("extern fn ext(a: &, b: &mut, c);\nfn main(p: &mut) { bb0: { return; } }");
		Signature s = m.signature("ext");
		assertEquals(3, s.parameters().length);
		assertEquals(Parameter.Mode.SHARED, s.modeOf(0));
		assertEquals(Parameter.Mode.MUTABLE, s.modeOf(1));
		assertEquals(Parameter.Mode.OWNED, s.modeOf(2));
		assertEquals(Parameter.Mode.OWNED, s.modeOf(5));
		assertNull(m.function("ext"));
		Function f = m.function("main");
		assertEquals(Parameter.Mode.MUTABLE, m.signature("main").modeOf(0));
		assertTrue(f.isParameter(new Local(0)));
		assertEquals(1, m.functions().size());
	}

	// ==============================================================
	// Syntax Errors
	// ==============================================================

	@Test
	public void test_30() {
		SyntaxError e = checkSyntaxError("fn f() { bb0: { x = 1 return; } }");
		assertEquals("expecting ';', found 'return'", e.getMessage());
	}

	@Test
	public void test_31() {
		SyntaxError e = checkSyntaxError("fn f() { bb0: { x = 1;");
		assertEquals("unexpected end-of-file", e.getMessage());
	}

	@Test
	public void test_32() {
		checkSyntaxError("fn f() { bb0: { return; } }\nfn f() { bb0: { return; } }");
	}

	@Test
	public void test_33() {
		checkSyntaxError("fn f(x, x) { bb0: { return; } }");
	}

	@Test
	public void test_34() {
		checkSyntaxError("fn f(x) { bb0: { y = x.foo; return; } }");
	}

	@Test
	public void test_35() {
		checkSyntaxError("fn f() { bb0: { mem[4..2] = 1; return; } }");
	}

	@Test
	public void test_36() {
		checkSyntaxError("fn f(x) { bb0: { switch x [1: bb0, 1: bb0] otherwise bb0; } }");
	}

	@Test
	public void test_37() {
		SyntaxError e = checkSyntaxError("fn f() { bb0: { x = 1; } }");
		assertTrue(e.start() > 0);
	}

	@Test
	public void test_38() {
		SyntaxError e = checkSyntaxError("fn f() { bb0: { x = 1 # 2; return; } }");
		assertEquals("unexpected character '#'", e.getMessage());
		assertEquals(22, e.start());
	}

	@Test
	public void test_39() {
		checkSyntaxError("fn f() { /* never closed");
		checkSyntaxError("fn f() { bb0: { x = 99999999999999999999; return; } }");
	}

	@Test
	public void test_40() {
		// Empty regions and regions beyond the address range
		checkSyntaxError("fn f() { bb0: { mem[4..4] = 1; return; } }");
		checkSyntaxError("fn f() { bb0: { mem[0..4294967296] = 1; return; } }");
		Function f = parseFunction("fn f() { bb0: { mem[0..2147483647] = 1; return; } }");
		assertNotNull(f);
	}

	private static Function parseFunction(String input) {
		return Parser.parse(input).functions().get(0);
	}

	private static SyntaxError checkSyntaxError(String input) {
		try {
			Parser.parse(input);
			fail("syntax error not detected");
			return null;
		} catch (SyntaxError e) {
			return e;
		}
	}
}
