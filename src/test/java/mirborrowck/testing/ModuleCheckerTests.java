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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import mirborrowck.Main;
import mirborrowck.core.BorrowError;
import mirborrowck.core.ModuleChecker;
import mirborrowck.core.ModuleChecker.Outcome;
import mirborrowck.core.Options;
import mirborrowck.core.Report;
import mirborrowck.core.Syntax.Module;
import mirborrowck.io.Parser;
import mirborrowck.util.AnalysisException;

/**
 * Tests for checking whole modules, possibly in parallel, and for the
 * command-line options which configure this.
 */
public class ModuleCheckerTests {
	private static final String MODULE = "fn ok() { bb0: { x = 1; y = &x; use y; return; } }\n" //
			+ "fn bad() { bb0: { x = 1; a = &mut x; b = &x; use a; use b; return; } }\n" //
			+ "fn broken() { bb0: { goto bb9; } }\n";

	@Test
	public void test_01() throws InterruptedException {
		List<Outcome> outcomes = check(MODULE, new Options().setThreads(1));
		assertEquals(3, outcomes.size());
		assertEquals("ok", outcomes.get(0).function());
		assertEquals("bad", outcomes.get(1).function());
		assertEquals("broken", outcomes.get(2).function());
		assertTrue(outcomes.get(0).isValid());
		assertFalse(outcomes.get(1).isValid());
		assertEquals(BorrowError.Type.CONFLICTING_BORROWS, outcomes.get(1).errors().get(0).type());
	}

	@Test
	public void test_02() throws InterruptedException {
		// A function which cannot be checked does not stop the others
		Outcome o = check(MODULE, new Options().setThreads(1)).get(2);
		assertNull(o.report());
		assertFalse(o.isValid());
		assertTrue(o.errors().isEmpty());
		assertTrue(o.failure() instanceof AnalysisException);
		assertEquals(AnalysisException.Kind.MALFORMED_INPUT, ((AnalysisException) o.failure()).kind());
	}

	@Test
	public void test_03() throws InterruptedException {
		Report.Statistics stats = ModuleChecker.summarise(check(MODULE, new Options()));
		assertEquals(2, stats.functionsAnalyzed());
		assertEquals(10, stats.programPoints());
		assertEquals(1, stats.count(BorrowError.Type.CONFLICTING_BORROWS));
		assertEquals(1, stats.conflicts());
	}

	@Test
	public void test_04() throws InterruptedException {
		// The outcome is independent of the number of threads and strategy
		StringBuilder input = new StringBuilder();
		for (int i = 0; i != 12; ++i) {
			input.append("fn f" + i + "(p: &mut) { bb0: { x = " + i + "; a = &mut x; b = &x; use "
					+ (i % 2 == 0 ? "a" : "b") + "; return; } }\n");
		}
		List<Outcome> sequential = check(input.toString(), new Options().setThreads(1));
		List<Outcome> parallel = check(input.toString(),
				new Options().setThreads(4).setStrategy(Options.Strategy.UNIFIED));
		assertEquals(12, parallel.size());
		for (int i = 0; i != 12; ++i) {
			assertEquals("f" + i, parallel.get(i).function());
			assertEquals(sequential.get(i).errors(), parallel.get(i).errors());
			assertEquals(i % 2 != 0, parallel.get(i).isValid());
		}
	}

	@Test
	public void test_05() throws InterruptedException {
		assertTrue(check("", new Options()).isEmpty());
	}

	@Test
	public void test_06() throws InterruptedException {
		Report report = check(MODULE, new Options()).get(1).report();
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		report.print(new PrintStream(bytes, true), MODULE);
		String output = bytes.toString();
		assertTrue(output, output.startsWith("line 2: error in bad: cannot have"));
		assertTrue(output, output.contains("^"));
	}

	// ==============================================================
	// Command-line Options
	// ==============================================================

	@Test
	public void test_10() {
		Options options = new Options();
		List<String> args = new ArrayList<>(Arrays.asList("-unified", "-threads", "3", "-validate", "-warn", "a.mir"));
		Main.parseOptions(args, options);
		assertEquals(Arrays.asList("a.mir"), args);
		assertEquals(Options.Strategy.UNIFIED, options.getStrategy());
		assertEquals(3, options.getThreads());
		assertTrue(options.getValidateFixpoint());
		assertTrue(options.getDynamicIndexWarnings());
	}

	@Test
	public void test_11() {
		Options options = new Options();
		List<String> args = new ArrayList<>(Arrays.asList("a.mir", "-unified"));
		Main.parseOptions(args, options);
		// Options are only recognised before the first file
		assertEquals(2, args.size());
		assertEquals(Options.Strategy.MULTI_PASS, options.getStrategy());
	}

	@Test
	public void test_12() {
		for (List<String> bad : Arrays.asList(Arrays.asList("-threads"), Arrays.asList("-threads", "many"),
				Arrays.asList("-fast", "a.mir"))) {
			try {
				Main.parseOptions(new ArrayList<>(bad), new Options());
				fail("invalid options accepted: " + bad);
			} catch (IllegalArgumentException e) {
				assertNotNull(e.getMessage());
			}
		}
	}

	private static List<Outcome> check(String input, Options options) throws InterruptedException {
		Module module = Parser.parse(input);
		return new ModuleChecker(options, module).check();
	}
}
