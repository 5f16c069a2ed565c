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

import static mirborrowck.testing.BorrowCheckValidTests.check;
import static mirborrowck.testing.BorrowCheckValidTests.checkInvalid;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import mirborrowck.core.BorrowChecker;
import mirborrowck.core.BorrowError;
import mirborrowck.core.BorrowError.Invalidation;
import mirborrowck.core.BorrowError.Type;
import mirborrowck.core.BorrowKind;
import mirborrowck.core.Options;
import mirborrowck.core.Report;
import mirborrowck.core.Syntax.Place;
import mirborrowck.core.Syntax.ProgramPoint;

/**
 * Borrow checking tests for functions which should be rejected. Each test
 * states the errors expected, ordered by program point.
 */
public class BorrowCheckInvalidTests {

	// ==============================================================
	// Conflicting Borrows
	// ==============================================================

	@Test
	public void test_01() {
		String input = "fn main() { bb0: { x = 1; a = &mut x; b = &x; use a; use b; return; } }";
		List<BorrowError> errors = checkInvalid(input, Type.CONFLICTING_BORROWS);
		BorrowError e = errors.get(0);
		assertEquals(new ProgramPoint(2), e.point());
		assertEquals(0, e.existingLoan().id());
		assertEquals(1, e.newLoan().id());
		assertEquals(new Place.Local(0), e.place());
	}

	@Test
	public void test_02() {
		String input = "fn main() { bb0: { x = 1; a = &x; b = &mut x; use a; use b; return; } }";
		checkInvalid(input, Type.CONFLICTING_BORROWS);
	}

	@Test
	public void test_03() {
		String input = "fn main() { bb0: { x = 1; a = &mut x; b = &mut x; use a; use b; return; } }";
		checkInvalid(input, Type.CONFLICTING_BORROWS);
	}

	@Test
	public void test_04() {
		// Whole place against one of its fields
		String input = "fn main() { bb0: { a = &mut x; b = &mut x.1; use a; use b; return; } }";
		checkInvalid(input, Type.CONFLICTING_BORROWS);
	}

	@Test
	public void test_05() {
		// Overlapping byte regions
		String input = "fn main() { bb0: { a = &mut mem[0..4]; b = &mem[2..6]; use a; use b; return; } }";
		checkInvalid(input, Type.CONFLICTING_BORROWS);
	}

	@Test
	public void test_06() {
		String input = "extern fn f(a: &mut, b: &mut); fn main() { bb0: { x = 1; call f(x, x); return; } }";
		List<BorrowError> errors = checkInvalid(input, Type.CONFLICTING_BORROWS);
		assertEquals(new ProgramPoint(1), errors.get(0).point());
		assertTrue(errors.get(0).existingLoan().isTemporary());
		assertTrue(errors.get(0).newLoan().isTemporary());
	}

	@Test
	public void test_07() {
		// Mutable argument whilst a shared borrow is live
		String input = "extern fn f(a: &mut); fn main() { bb0: { x = 1; r = &x; call f(x); use r; return; } }";
		checkInvalid(input, Type.CONFLICTING_BORROWS);
	}

	@Test
	public void test_08() {
		// Reading a mutably borrowed place which remains live
		String input = "fn main() { bb0: { x = 1; a = &mut x; y = x; use y; use a; use x; return; } }";
		checkInvalid(input, Type.CONFLICTING_BORROWS);
	}

	@Test
	public void test_09() {
		// Only one path holds a conflicting borrow
		String input = "fn main(c) {\n" //
				+ "  bb0: { x = 1; if c goto bb1 else bb2; }\n" //
				+ "  bb1: { r = &mut x; goto bb3; }\n" //
				+ "  bb2: { r = &mut y; goto bb3; }\n" //
				+ "  bb3: { s = &x; use s; use r; return; }\n" //
				+ "}";
		List<BorrowError> errors = checkInvalid(input, Type.CONFLICTING_BORROWS);
		assertEquals(new ProgramPoint(6), errors.get(0).point());
	}

	// ==============================================================
	// Owner Invalidation
	// ==============================================================

	@Test
	public void test_20() {
		String input = "fn main() { bb0: { x = 1; y = &x; use x; x = 2; use y; return; } }";
		List<BorrowError> errors = checkInvalid(input, Type.BORROW_ACROSS_OWNER_INVALIDATION);
		BorrowError e = errors.get(0);
		assertEquals(new ProgramPoint(3), e.point());
		assertEquals(Invalidation.REASSIGN, e.invalidation());
		assertEquals(new Place.Local(0), e.place());
		assertEquals(new Place.Local(0), e.borrowedPlace());
	}

	@Test
	public void test_21() {
		String input = "fn main() { bb0: { x = 1; r = &x; y = move x; use r; use y; return; } }";
		List<BorrowError> errors = checkInvalid(input, Type.BORROW_ACROSS_OWNER_INVALIDATION);
		assertEquals(Invalidation.MOVE, errors.get(0).invalidation());
		assertEquals(new ProgramPoint(2), errors.get(0).point());
	}

	@Test
	public void test_22() {
		// Overwriting part of a borrowed place
		String input = "fn main() { bb0: { x = 1; r = &mut x; x.0 = 2; use r; return; } }";
		checkInvalid(input, Type.BORROW_ACROSS_OWNER_INVALIDATION);
	}

	@Test
	public void test_23() {
		// Loan kept alive by a copy of its borrower
		String input = "fn main() { bb0: { x = 1; r = &x; s = copy r; x = 2; use s; return; } }";
		checkInvalid(input, Type.BORROW_ACROSS_OWNER_INVALIDATION);
	}

	@Test
	public void test_24() {
		// Borrow live around a loop
		String input = "fn main(n) {\n" //
				+ "  bb0: { x = 1; r = &mut x; goto bb1; }\n" //
				+ "  bb1: { use r; x = 2; if n goto bb1 else bb2; }\n" //
				+ "  bb2: { return; }\n" //
				+ "}";
		List<BorrowError> errors = checkInvalid(input, Type.BORROW_ACROSS_OWNER_INVALIDATION);
		assertEquals(new ProgramPoint(4), errors.get(0).point());
	}

	@Test
	public void test_25() {
		// Borrower reassigned on one path only
		String input = "fn main(c) {\n" //
				+ "  bb0: { x = 1; y = 5; r = &y; if c goto bb1 else bb2; }\n" //
				+ "  bb1: { r = &x; goto bb3; }\n" //
				+ "  bb2: { x = 2; goto bb3; }\n" //
				+ "  bb3: { x = 3; use r; return; }\n" //
				+ "}";
		List<BorrowError> errors = checkInvalid(input, Type.BORROW_ACROSS_OWNER_INVALIDATION);
		assertEquals(new ProgramPoint(8), errors.get(0).point());
		assertEquals(2, errors.get(0).existingLoan().id());
	}

	@Test
	public void test_26() {
		// Moving an argument which is mutably borrowed by the same call
		String input = "extern fn f(a: &mut, b); fn main() { bb0: { x = 1; call f(x, move x) -> y; return; } }";
		List<BorrowError> errors = checkInvalid(input, Type.BORROW_ACROSS_OWNER_INVALIDATION);
		BorrowError e = errors.get(0);
		assertEquals(new ProgramPoint(1), e.point());
		assertEquals(Invalidation.MOVE, e.invalidation());
		assertTrue(e.existingLoan().isTemporary());
		assertEquals(new Place.Local(0), e.place());
	}

	@Test
	public void test_27() {
		// An owned argument which is dead afterwards is moved
		String input = "extern fn f(a: &mut, b); fn main() { bb0: { x = 1; call f(x, x) -> y; return; } }";
		List<BorrowError> errors = checkInvalid(input, Type.BORROW_ACROSS_OWNER_INVALIDATION);
		assertEquals(new ProgramPoint(1), errors.get(0).point());
		assertEquals(Invalidation.MOVE, errors.get(0).invalidation());
	}

	@Test
	public void test_28() {
		// The move may come before the borrow
		String input = "extern fn f(a, b: &); fn main() { bb0: { x = 1; call f(move x, x.0) -> y; return; } }";
		List<BorrowError> errors = checkInvalid(input, Type.BORROW_ACROSS_OWNER_INVALIDATION);
		assertEquals(BorrowKind.SHARED, errors.get(0).existingLoan().kind());
	}

	// ==============================================================
	// Use After Move
	// ==============================================================

	@Test
	public void test_40() {
		String input = "fn main() { bb0: { x = 1; y = move x; use x; return; } }";
		List<BorrowError> errors = checkInvalid(input, Type.USE_AFTER_MOVE);
		assertEquals(new ProgramPoint(2), errors.get(0).point());
		assertEquals(new ProgramPoint(1), errors.get(0).movePoint());
	}

	@Test
	public void test_41() {
		// Using the whole after moving a part
		String input = "fn main() { bb0: { x = 1; y = move x.0; use x; return; } }";
		checkInvalid(input, Type.USE_AFTER_MOVE);
	}

	@Test
	public void test_42() {
		// Moving out of a place which received a consumed value
		String input = "fn main() { bb0: { x = 1; y = x; use y; z = move y; use y; return; } }";
		checkInvalid(input, Type.USE_AFTER_MOVE);
	}

	@Test
	public void test_43() {
		// Moved on one path only
		String input = "fn main(c) {\n" //
				+ "  bb0: { x = 1; if c goto bb1 else bb2; }\n" //
				+ "  bb1: { y = move x; use y; goto bb2; }\n" //
				+ "  bb2: { use x; return; }\n" //
				+ "}";
		List<BorrowError> errors = checkInvalid(input, Type.USE_AFTER_MOVE);
		assertEquals(new ProgramPoint(2), errors.get(0).movePoint());
	}

	@Test
	public void test_44() {
		// Moved in a previous iteration
		String input = "fn main(n) {\n" //
				+ "  bb0: { x = 1; goto bb1; }\n" //
				+ "  bb1: { y = move x; use y; if n goto bb1 else bb2; }\n" //
				+ "  bb2: { return; }\n" //
				+ "}";
		List<BorrowError> errors = checkInvalid(input, Type.USE_AFTER_MOVE);
		assertEquals(new ProgramPoint(2), errors.get(0).point());
		assertEquals(new ProgramPoint(2), errors.get(0).movePoint());
	}

	@Test
	public void test_45() {
		// Passing a moved value to a call
		String input = "extern fn f(a: &); fn main() { bb0: { x = 1; y = move x; call f(x); use y; return; } }";
		checkInvalid(input, Type.USE_AFTER_MOVE);
	}

	@Test
	public void test_46() {
		// Moving the same place twice in one call
		String input = "extern fn g(a, b); fn main() { bb0: { x = 1; call g(move x, move x) -> y; return; } }";
		List<BorrowError> errors = checkInvalid(input, Type.USE_AFTER_MOVE);
		assertEquals(new ProgramPoint(1), errors.get(0).point());
		assertEquals(new ProgramPoint(1), errors.get(0).movePoint());
	}

	@Test
	public void test_47() {
		// Both owned arguments are dead afterwards, so both are moves
		String input = "extern fn g(a, b); fn main() { bb0: { x = 1; call g(x, x) -> y; use y; return; } }";
		checkInvalid(input, Type.USE_AFTER_MOVE);
	}

	@Test
	public void test_48() {
		// Moving part of a place along with the whole of it
		String input = "extern fn g(a, b); fn main() { bb0: { x = 1; call g(move x, move x.1) -> y; return; } }";
		checkInvalid(input, Type.USE_AFTER_MOVE);
	}

	@Test
	public void test_49() {
		// Moving a place into itself leaves it moved
		String input = "fn main() { bb0: { x = 1; x = move x; use x; return; } }";
		List<BorrowError> errors = checkInvalid(input, Type.USE_AFTER_MOVE);
		assertEquals(new ProgramPoint(2), errors.get(0).point());
		assertEquals(new ProgramPoint(1), errors.get(0).movePoint());
	}

	// ==============================================================
	// Several Errors
	// ==============================================================

	@Test
	public void test_60() {
		String input = "fn main() { bb0: { x = 1; a = &mut x; b = &mut x; x = 2; use a; use b; return; } }";
		List<BorrowError> errors = checkInvalid(input, Type.CONFLICTING_BORROWS,
				Type.BORROW_ACROSS_OWNER_INVALIDATION, Type.BORROW_ACROSS_OWNER_INVALIDATION);
		assertEquals(new ProgramPoint(2), errors.get(0).point());
		assertEquals(new ProgramPoint(3), errors.get(1).point());
		assertEquals(new ProgramPoint(3), errors.get(2).point());
	}

	@Test
	public void test_61() {
		String input = "fn main() { bb0: { x = 1; y = move x; use x; use x; return; } }";
		checkInvalid(input, Type.USE_AFTER_MOVE, Type.USE_AFTER_MOVE);
	}

	// ==============================================================
	// Dynamic Indices
	// ==============================================================

	@Test
	public void test_80() {
		String input = "fn main(i, j) { bb0: { a = &mut v[i]; b = &mut v[j]; use a; use b; return; } }";
		checkInvalid(input, Type.CONFLICTING_BORROWS);
	}

	@Test
	public void test_81() {
		String input = "fn main(i, j) { bb0: { a = &mut v[i]; b = &mut v[j]; use a; use b; return; } }";
		Options options = new Options().setDynamicIndexWarnings(true);
		Report report = BorrowCheckValidTests.check(input, options);
		assertTrue(report.isValid());
		assertEquals(1, report.warnings().size());
		assertEquals(Type.CONFLICTING_BORROWS, report.warnings().get(0).type());
	}

	@Test
	public void test_82() {
		// Constant and dynamic indices are not known to be distinct
		String input = "fn main(i) { bb0: { a = &mut v[0]; b = &v[i]; use a; use b; return; } }";
		checkInvalid(input, Type.CONFLICTING_BORROWS);
	}

	// ==============================================================
	// Reports
	// ==============================================================

	@Test
	public void test_90() {
		String input = "fn main() { bb0: { x = 1; y = &x; x = 2; use y; return; } }";
		Report report = check(input);
		assertEquals(1, report.statistics().functionsAnalyzed());
		assertEquals(5, report.statistics().programPoints());
		assertEquals(1, report.statistics().loans());
		assertEquals(1, report.statistics().count(Type.BORROW_ACROSS_OWNER_INVALIDATION));
		assertEquals(1, report.statistics().conflicts());
		assertTrue(report.statistics().iterations() > 0);
		assertEquals(1, report.loans().size());
		assertEquals(BorrowKind.SHARED, report.loans().get(0).kind());
	}

	@Test
	public void test_91() {
		// Errors carry the location of the offending statement
		String input = "fn main() { bb0: { x = 1; y = &x; x = 2; use y; return; } }";
		Report report = check(input);
		BorrowError e = report.errors().get(0);
		assertEquals("x = 2", input.substring(e.location().start, e.location().end + 1));
		assertTrue(e.message().contains(String.format(BorrowChecker.ASSIGN_WHILE_BORROWED, "x", 0, "p1")));
		assertNull(e.newLoan());
	}
}
