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
package mirborrowck.core;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import mirborrowck.util.SyntacticElement.Attribute;
import mirborrowck.util.SyntaxError;

/**
 * The outcome of borrow checking one function: the errors and warnings found,
 * the final loan table and some statistics. A function passes borrow checking
 * exactly when there are no errors.
 */
public class Report {
	private static final Comparator<BorrowError> ORDER = new Comparator<BorrowError>() {
		@Override
		public int compare(BorrowError a, BorrowError b) {
			int c = a.point().compareTo(b.point());
			return c != 0 ? c : a.type().compareTo(b.type());
		}
	};

	private final String function;
	private final LinkedHashSet<BorrowError> errors = new LinkedHashSet<>();
	private final LinkedHashSet<BorrowError> warnings = new LinkedHashSet<>();
	private final List<Loan> loans = new ArrayList<>();
	private final Statistics statistics = new Statistics();

	public Report(String function) {
		this.function = function;
	}

	public String function() {
		return function;
	}

	public boolean isValid() {
		return errors.isEmpty();
	}

	/**
	 * Errors found, ordered by program point and then type.
	 */
	public List<BorrowError> errors() {
		return sorted(errors);
	}

	public List<BorrowError> warnings() {
		return sorted(warnings);
	}

	public List<BorrowError> errors(BorrowError.Type type) {
		ArrayList<BorrowError> r = new ArrayList<>();
		for (BorrowError e : errors()) {
			if (e.type() == type) {
				r.add(e);
			}
		}
		return r;
	}

	/**
	 * The final loan table, with candidate moves refined and last uses
	 * attached.
	 */
	public List<Loan> loans() {
		return Collections.unmodifiableList(loans);
	}

	public Statistics statistics() {
		return statistics;
	}

	void error(BorrowError e) {
		if (errors.add(e)) {
			statistics.increment(e.type());
		}
	}

	void warning(BorrowError e) {
		if (warnings.add(e)) {
			statistics.increment(e.type());
		}
	}

	void setLoans(List<Loan> loans) {
		this.loans.clear();
		this.loans.addAll(loans);
	}

	/**
	 * Print every error and warning, highlighting the responsible input where
	 * the source text is available.
	 *
	 * @param out
	 * @param source Text the function was read from, or <code>null</code>.
	 */
	public void print(PrintStream out, String source) {
		for (BorrowError e : errors()) {
			print(out, "error", e, source);
		}
		for (BorrowError e : warnings()) {
			print(out, "warning", e, source);
		}
	}

	private void print(PrintStream out, String severity, BorrowError e, String source) {
		String message = severity + " in " + function + ": " + e.message();
		Attribute.Source loc = e.location();
		if (loc == null) {
			out.println(message);
		} else {
			SyntaxError.highlight(out, message, source, loc.start, loc.end);
		}
	}

	private static List<BorrowError> sorted(Iterable<BorrowError> items) {
		ArrayList<BorrowError> r = new ArrayList<>();
		for (BorrowError e : items) {
			r.add(e);
		}
		Collections.sort(r, ORDER);
		return r;
	}

	@Override
	public String toString() {
		return function + ": " + errors() + " " + statistics;
	}

	/**
	 * Counters describing the work done, which can be summed over many
	 * functions.
	 */
	public static class Statistics {
		private int functions;
		private int points;
		private int loans;
		private int refinements;
		private long iterations;
		private final EnumMap<BorrowError.Type, Integer> counts = new EnumMap<>(BorrowError.Type.class);
		private final Map<String, Long> phases = new LinkedHashMap<>();

		public int functionsAnalyzed() {
			return functions;
		}

		public int programPoints() {
			return points;
		}

		public int loans() {
			return loans;
		}

		/**
		 * Number of candidate moves classified as moves or borrows.
		 */
		public int refinements() {
			return refinements;
		}

		/**
		 * Total number of worklist steps taken by dataflow computations.
		 */
		public long iterations() {
			return iterations;
		}

		/**
		 * Total number of errors and warnings.
		 */
		public int conflicts() {
			int total = 0;
			for (int c : counts.values()) {
				total += c;
			}
			return total;
		}

		public int count(BorrowError.Type type) {
			Integer c = counts.get(type);
			return c == null ? 0 : c;
		}

		/**
		 * Elapsed time of each phase in nanoseconds.
		 */
		public Map<String, Long> phases() {
			return Collections.unmodifiableMap(phases);
		}

		public long elapsed() {
			long total = 0;
			for (long t : phases.values()) {
				total += t;
			}
			return total;
		}

		void analysed(int points, int loans, int refinements) {
			this.functions++;
			this.points += points;
			this.loans += loans;
			this.refinements += refinements;
		}

		void iterated(long iterations) {
			this.iterations += iterations;
		}

		void phase(String name, long nanos) {
			Long t = phases.get(name);
			phases.put(name, t == null ? nanos : t + nanos);
		}

		void increment(BorrowError.Type type) {
			counts.put(type, count(type) + 1);
		}

		/**
		 * Add the counters of another report to this one.
		 */
		public void merge(Statistics other) {
			functions += other.functions;
			points += other.points;
			loans += other.loans;
			refinements += other.refinements;
			iterations += other.iterations;
			for (Map.Entry<BorrowError.Type, Integer> e : other.counts.entrySet()) {
				counts.put(e.getKey(), count(e.getKey()) + e.getValue());
			}
			for (Map.Entry<String, Long> e : other.phases.entrySet()) {
				phase(e.getKey(), e.getValue());
			}
		}

		@Override
		public String toString() {
			return "{functions=" + functions + ", points=" + points + ", loans=" + loans + ", conflicts="
					+ conflicts() + ", " + counts + ", refinements=" + refinements + ", iterations=" + iterations
					+ ", elapsed=" + (elapsed() / 1000) + "us}";
		}
	}
}
