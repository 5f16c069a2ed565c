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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import mirborrowck.cfg.ControlFlowGraph;
import mirborrowck.core.Syntax.Function;
import mirborrowck.core.Syntax.Module;
import mirborrowck.core.Syntax.Place;
import mirborrowck.core.Syntax.ProgramPoint;
import mirborrowck.dataflow.DataflowResult;
import mirborrowck.dataflow.LiveVariables;
import mirborrowck.dataflow.WorkListSolver;
import mirborrowck.util.Pair;

/**
 * Turns the events of a function into the per-point gen and kill sets of the
 * loan liveness problem. Along the way it refines consuming uses into moves or
 * borrows, and works out when each loan expires:
 *
 * <ul>
 * <li><b>gen[p]</b> holds the borrows created at <code>p</code> which are still
 * needed after it.</li>
 * <li><b>kill[p]</b> holds the loans whose owner may alias a place moved out of
 * or overwritten at <code>p</code>, plus those which are no longer needed after
 * <code>p</code>.</li>
 * </ul>
 *
 * A loan is needed for as long as one of its <i>holders</i> is live. Its
 * holders are its borrower together with every place which receives a value
 * derived from a holder. A temporary loan has no holders and so expires at the
 * point which created it.
 */
public class FactExtractor {
	private static final Logger LOGGER = LoggerFactory.getLogger(FactExtractor.class);

	private final Options options;
	private final Module module;

	public FactExtractor(Options options, Module module) {
		this.options = options;
		this.module = module;
	}

	public Facts extract(Function function, ControlFlowGraph cfg) {
		EventCollector collector = new EventCollector(function, module);
		Map<ProgramPoint, Events> raw = collector.collect();
		// Every node must belong to the function's point table
		for (ProgramPoint p : cfg) {
			function.instruction(p);
		}
		WorkListSolver<Set<Place>> solver = new WorkListSolver<>(new LiveVariables(raw),
				options.getIterationFactor());
		DataflowResult<Set<Place>> live = solver.solve(cfg);
		if (options.getValidateFixpoint()) {
			solver.validate(cfg, live);
		}
		// Refine consuming uses now that liveness is known
		ArrayList<Loan> loans = new ArrayList<>();
		int refinements = 0;
		for (Loan l : collector.loans()) {
			Loan r = refine(l, live.getOutFact(l.origin()), options);
			if (r != l) {
				refinements++;
			}
			loans.add(r);
		}
		LinkedHashMap<ProgramPoint, Events> events = new LinkedHashMap<>();
		for (Map.Entry<ProgramPoint, Events> e : raw.entrySet()) {
			events.put(e.getKey(), e.getValue().refine(refined(e.getValue(), loans)));
		}
		List<Set<Place>> holders = holders(loans, events.values());
		Map<Place, BitSet> index = index(loans);
		// Construct gen & kill sets
		HashMap<ProgramPoint, BitSet> gen = new HashMap<>();
		HashMap<ProgramPoint, BitSet> kill = new HashMap<>();
		HashMap<ProgramPoint, BitSet> starts = new HashMap<>();
		for (ProgramPoint p : cfg) {
			Events e = events.get(p);
			Set<Place> liveOut = live.getOutFact(p);
			BitSet g = new BitSet();
			BitSet k = new BitSet();
			BitSet s = new BitSet();
			for (Loan l : e.loans()) {
				if (l.kind().isBorrow()) {
					s.set(l.id());
					if (!isExpired(holders.get(l.id()), liveOut)) {
						g.set(l.id());
					}
				}
			}
			for (Place m : e.moves()) {
				k.or(aliasing(index, m));
			}
			for (Place r : e.reassigns()) {
				k.or(aliasing(index, r));
			}
			for (Loan l : loans) {
				if (l.kind().isBorrow() && isExpired(holders.get(l.id()), liveOut)) {
					k.set(l.id());
				}
			}
			gen.put(p, g);
			kill.put(p, k);
			starts.put(p, s);
		}
		LOGGER.debug("extracted {} loans from {} ({} refined)", loans.size(), function.name(), refinements);
		return new Facts(loans, events, gen, kill, starts, live, refinements);
	}

	/**
	 * Index loans by the place they borrow.
	 */
	private static Map<Place, BitSet> index(List<Loan> loans) {
		HashMap<Place, BitSet> index = new HashMap<>();
		for (Loan l : loans) {
			BitSet ids = index.get(l.owner());
			if (ids == null) {
				ids = new BitSet();
				index.put(l.owner(), ids);
			}
			ids.set(l.id());
		}
		return index;
	}

	private static BitSet aliasing(Map<Place, BitSet> index, Place place) {
		BitSet r = new BitSet();
		for (Map.Entry<Place, BitSet> e : index.entrySet()) {
			if (Aliasing.mayAlias(e.getKey(), place)) {
				r.or(e.getValue());
			}
		}
		return r;
	}

	/**
	 * Refine a consuming use into a move, when the consumed place is dead
	 * afterwards, or into a shared borrow otherwise. Other loans are returned
	 * unchanged.
	 */
	public static Loan refine(Loan loan, Set<Place> liveOut, Options options) {
		if (loan.kind() != BorrowKind.CANDIDATE_MOVE || !options.getRefineCandidateMoves()) {
			return loan;
		} else if (LiveVariables.isLive(loan.owner(), liveOut)) {
			return loan.refine(BorrowKind.SHARED);
		} else {
			return loan.refine(BorrowKind.MOVE);
		}
	}

	/**
	 * Select the refined versions of the loans created by a given point.
	 */
	public static List<Loan> refined(Events events, List<Loan> loans) {
		ArrayList<Loan> r = new ArrayList<>();
		for (Loan l : events.loans()) {
			r.add(loans.get(l.id()));
		}
		return r;
	}

	/**
	 * Compute the holders of each loan, indexed by loan identifier. The flows of
	 * every point are considered together, regardless of order.
	 */
	public static List<Set<Place>> holders(List<Loan> loans, Collection<Events> events) {
		ArrayList<Pair<Place, Place>> flows = new ArrayList<>();
		for (Events e : events) {
			flows.addAll(e.flows());
		}
		ArrayList<Set<Place>> holders = new ArrayList<>();
		for (Loan l : loans) {
			HashSet<Place> hs = new HashSet<>();
			if (l.borrower() != null) {
				hs.add(l.borrower());
				boolean changed = true;
				while (changed) {
					changed = false;
					for (Pair<Place, Place> f : flows) {
						if (!hs.contains(f.first()) && Aliasing.mayAliasAny(f.second(), hs)) {
							hs.add(f.first());
							changed = true;
						}
					}
				}
			}
			holders.add(Collections.unmodifiableSet(hs));
		}
		return holders;
	}

	/**
	 * Check whether a loan is no longer needed, because none of its holders is
	 * live.
	 */
	public static boolean isExpired(Set<Place> holders, Set<Place> liveOut) {
		for (Place h : holders) {
			if (LiveVariables.isLive(h, liveOut)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Check whether a point moves out of or overwrites a place which may alias
	 * the owner of a loan.
	 */
	public static boolean isInvalidated(Loan loan, Events events) {
		return Aliasing.mayAliasAny(loan.owner(), events.moves())
				|| Aliasing.mayAliasAny(loan.owner(), events.reassigns());
	}

	/**
	 * The facts extracted from one function.
	 */
	public static class Facts {
		private final List<Loan> loans;
		private final Map<ProgramPoint, Events> events;
		private final Map<ProgramPoint, BitSet> gen;
		private final Map<ProgramPoint, BitSet> kill;
		private final Map<ProgramPoint, BitSet> starts;
		private final DataflowResult<Set<Place>> liveVariables;
		private final int refinements;

		public Facts(List<Loan> loans, Map<ProgramPoint, Events> events,
				Map<ProgramPoint, BitSet> gen, Map<ProgramPoint, BitSet> kill, Map<ProgramPoint, BitSet> starts,
				DataflowResult<Set<Place>> liveVariables, int refinements) {
			this.loans = Collections.unmodifiableList(loans);
			this.events = events;
			this.gen = gen;
			this.kill = kill;
			this.starts = starts;
			this.liveVariables = liveVariables;
			this.refinements = refinements;
		}

		/**
		 * The loan table, indexed by identifier, with candidate moves refined.
		 */
		public List<Loan> loans() {
			return loans;
		}

		public Loan loan(int id) {
			return loans.get(id);
		}

		public Map<ProgramPoint, Events> events() {
			return events;
		}

		public Events events(ProgramPoint p) {
			return events.get(p);
		}

		public Map<ProgramPoint, BitSet> gen() {
			return gen;
		}

		public Map<ProgramPoint, BitSet> kill() {
			return kill;
		}

		/**
		 * The borrows created at a given point, including temporaries which
		 * expire there.
		 */
		public List<Loan> startedAt(ProgramPoint p) {
			BitSet s = starts.get(p);
			ArrayList<Loan> r = new ArrayList<>();
			for (int i = s.nextSetBit(0); i >= 0; i = s.nextSetBit(i + 1)) {
				r.add(loans.get(i));
			}
			return r;
		}

		public DataflowResult<Set<Place>> liveVariables() {
			return liveVariables;
		}

		/**
		 * Number of candidate moves classified as moves or borrows.
		 */
		public int refinements() {
			return refinements;
		}
	}
}
