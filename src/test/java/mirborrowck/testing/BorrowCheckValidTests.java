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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.jupiter.api.Test;

import mirborrowck.core.BorrowChecker;
import mirborrowck.core.BorrowError;
import mirborrowck.core.Options;
import mirborrowck.core.Report;
import mirborrowck.core.Syntax.Function;
import mirborrowck.core.Syntax.Module;
import mirborrowck.io.Parser;

/**
 * Borrow checking tests for functions which should be accepted. Every program
 * is checked with both strategies, which must agree.
 */
public class BorrowCheckValidTests {

	// ==============================================================
	// Shared Borrows
	// ==============================================================

	@Test
	public void test_01() {
		String input = "fn main() { bb0: { x = 1; y = &x; use x; use y; return; } }";
		checkValid(input);
	}

	@Test
	public void test_02() {
		String input = "fn main() { bb0: { x = 1; a = &x; b = &x; use a; use b; return; } }";
		checkValid(input);
	}

	@Test
	public void test_03() {
		// Reading a shared borrowed place
		String input = "fn main() { bb0: { x = 1; a = &x; z = copy x; use a; use z; return; } }";
		checkValid(input);
	}

	@Test
	public void test_04() {
		// Overwriting a place once its borrower is dead
		String input = "fn main() { bb0: { x = 1; y = &x; use y; x = 2; use x; return; } }";
		checkValid(input);
	}

	// ==============================================================
	// Mutable Borrows
	// ==============================================================

	@Test
	public void test_10() {
		String input = "fn main() { bb0: { x = 1; a = &mut x; use a; b = &mut x; use b; return; } }";
		checkValid(input);
	}

	@Test
	public void test_11() {
		// Disjoint fields
		String input = "fn main() { bb0: { a = &mut x.0; b = &mut x.1; use a; use b; return; } }";
		checkValid(input);
	}

	@Test
	public void test_12() {
		// Distinct constant indices
		String input = "fn main() { bb0: { a = &mut v[0]; b = &mut v[1]; use a; use b; return; } }";
		checkValid(input);
	}

	@Test
	public void test_13() {
		// Disjoint byte regions
		String input = "fn main() { bb0: { a = &mut mem[0..4]; b = &mut mem[4..8]; use a; use b; return; } }";
		checkValid(input);
	}

	@Test
	public void test_14() {
		// Same range of different allocations
		String input = "fn main() { bb0: { a = &mut heap1[0..4]; b = &mut heap2[0..4]; use a; use b; return; } }";
		checkValid(input);
	}

	@Test
	public void test_15() {
		String input = "fn main() { bb0: { a = &mut @g; b = &mut @h; use a; use b; return; } }";
		checkValid(input);
	}

	// ==============================================================
	// Moves
	// ==============================================================

	@Test
	public void test_20() {
		// Reassigning a moved place makes it usable again
		String input = "fn main() { bb0: { x = 1; y = move x; x = 2; use x; use y; return; } }";
		checkValid(input);
	}

	@Test
	public void test_21() {
		// Moving one field leaves the others usable
		String input = "fn main() { bb0: { x = 1; y = move x.0; use x.1; use y; return; } }";
		checkValid(input);
	}

	@Test
	public void test_22() {
		// Copies never move
		String input = "fn main() { bb0: { x = 1; y = copy x; z = copy x; use y; use z; return; } }";
		checkValid(input);
	}

	@Test
	public void test_23() {
		// A consumed place which is used again is only borrowed
		String input = "fn main() { bb0: { x = 1; y = x; use x; return; } }";
		checkValid(input);
	}

	// ==============================================================
	// Calls
	// ==============================================================

	@Test
	public void test_30() {
		String input = "extern fn f(a: &, b: &); fn main() { bb0: { x = 1; call f(x, x); return; } }";
		checkValid(input);
	}

	@Test
	public void test_31() {
		String input = "extern fn f(a: &mut, b: &mut); fn main() { bb0: { x = 1; y = 2; call f(x, y) -> z; use z; return; } }";
		checkValid(input);
	}

	@Test
	public void test_32() {
		// Call arguments are only borrowed for the duration of the call
		String input = "extern fn f(a: &mut); fn main() { bb0: { x = 1; call f(x); call f(x); use x; return; } }";
		checkValid(input);
	}

	@Test
	public void test_33() {
		// Unknown callees take ownership
		String input = "fn main() { bb0: { x = 1; call g(x) -> y; use y; return; } }";
		checkValid(input);
	}

	@Test
	public void test_34() {
		// Owned arguments still live afterwards are only borrowed
		String input = "extern fn f(a: &, b); fn main() { bb0: { x = 1; call f(x, x) -> y; use x; use y; return; } }";
		checkValid(input);
	}

	@Test
	public void test_35() {
		// Moving disjoint fields in one call
		String input = "extern fn g(a, b); fn main() { bb0: { x = 1; call g(move x.0, move x.1) -> y; use y; return; } }";
		checkValid(input);
	}

	// ==============================================================
	// Control Flow
	// ==============================================================

	@Test
	public void test_40() {
		String input = "fn main(c) {\n" //
				+ "  bb0: { x = 1; if c goto bb1 else bb2; }\n" //
				+ "  bb1: { r = &mut x; use r; goto bb3; }\n" //
				+ "  bb2: { r = &x; use r; goto bb3; }\n" //
				+ "  bb3: { x = 2; return; }\n" //
				+ "}";
		checkValid(input);
	}

	@Test
	public void test_41() {
		// Borrow created and finished within each iteration
		String input = "fn main(n) {\n" //
				+ "  bb0: { x = 1; goto bb1; }\n" //
				+ "  bb1: { r = &x; use r; if n goto bb1 else bb2; }\n" //
				+ "  bb2: { x = 2; return; }\n" //
				+ "}";
		checkValid(input);
	}

	@Test
	public void test_42() {
		String input = "fn main(c) {\n" //
				+ "  bb0: { x = 1; switch c [0: bb1, 1: bb2] otherwise bb3; }\n" //
				+ "  bb1: { y = move x; use y; return; }\n" //
				+ "  bb2: { use x; return; }\n" //
				+ "  bb3: { unreachable; }\n" //
				+ "}";
		checkValid(input);
	}

	@Test
	public void test_43() {
		// Moved on one path, reassigned before the join
		String input = "fn main(c) {\n" //
				+ "  bb0: { x = 1; if c goto bb1 else bb2; }\n" //
				+ "  bb1: { y = move x; use y; x = 2; goto bb2; }\n" //
				+ "  bb2: { use x; return; }\n" //
				+ "}";
		checkValid(input);
	}

	@Test
	public void test_44() {
		// Parameters are assigned on entry
		String input = "fn main(p: &mut, q: &) { bb0: { use p; use q; x = copy p; use x; return; } }";
		checkValid(input);
	}

	public static Report check(String input, Options options) {
		Module module = Parser.parse(input);
		List<Function> functions = module.functions();
		Function f = functions.get(functions.size() - 1);
		return BorrowChecker.create(options, module).check(f);
	}

	/**
	 * Check a function with both strategies, returning the report of the first
	 * once their errors and warnings are confirmed to agree.
	 */
	public static Report check(String input) {
		Report multi = check(input, new Options().setStrategy(Options.Strategy.MULTI_PASS).setValidateFixpoint(true));
		Report unified = check(input, new Options().setStrategy(Options.Strategy.UNIFIED).setValidateFixpoint(true));
		assertEquals(multi.errors(), unified.errors());
		assertEquals(multi.warnings(), unified.warnings());
		assertEquals(multi.loans(), unified.loans());
		return multi;
	}

	public static void checkValid(String input) {
		Report report = check(input);
		if (!report.isValid()) {
			report.print(System.err, input);
			fail("unexpected errors: " + report.errors());
		}
		assertTrue(report.warnings().isEmpty());
	}

	public static List<BorrowError> checkInvalid(String input, BorrowError.Type... expected) {
		Report report = check(input);
		List<BorrowError> errors = report.errors();
		if (errors.size() != expected.length) {
			report.print(System.err, input);
			fail("expected " + expected.length + " errors, found " + errors);
		}
		for (int i = 0; i != expected.length; ++i) {
			assertEquals(expected[i], errors.get(i).type());
		}
		return errors;
	}
}
