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
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import mirborrowck.cfg.ControlFlowGraph;
import mirborrowck.cfg.DominanceInfo;
import mirborrowck.core.Syntax.Function;
import mirborrowck.core.Syntax.Module;
import mirborrowck.core.Syntax.Place;
import mirborrowck.core.Syntax.ProgramPoint;
import mirborrowck.dataflow.DataflowAnalysis;
import mirborrowck.dataflow.DataflowResult;
import mirborrowck.dataflow.LiveVariables;
import mirborrowck.dataflow.MovedPlaces;
import mirborrowck.dataflow.WorkListSolver;

/**
 * Borrow checker which propagates live loans and moved places together, as a
 * single product fact, and then applies every check in one sweep. The events
 * of each point are only refined when the solver first reaches it. Its results
 * agree with those of the {@link MultiPassChecker}.
 */
public class UnifiedChecker extends BorrowChecker {

	public UnifiedChecker(Options options, Module module) {
		super(options, module);
	}

	@Override
	protected void analyse(Function function, ControlFlowGraph cfg, DominanceInfo info, Report report) {
		Report.Statistics stats = report.statistics();
		long start = System.nanoTime();
		EventCollector collector = new EventCollector(function, module);
		Map<ProgramPoint, Events> raw = collector.collect();
		WorkListSolver<Set<Place>> liveSolver = new WorkListSolver<>(new LiveVariables(raw),
				options.getIterationFactor());
		DataflowResult<Set<Place>> liveVariables = liveSolver.solve(cfg);
		if (options.getValidateFixpoint()) {
			liveSolver.validate(cfg, liveVariables);
		}
		ArrayList<Loan> refined = new ArrayList<>();
		int refinements = 0;
		for (Loan l : collector.loans()) {
			Loan r = FactExtractor.refine(l, liveVariables.getOutFact(l.origin()), options);
			if (r != l) {
				refinements++;
			}
			refined.add(r);
		}
		Steps steps = new Steps(raw, refined, FactExtractor.holders(refined, raw.values()), liveVariables);
		stats.phase("facts", System.nanoTime() - start);
		// Dataflow
		start = System.nanoTime();
		WorkListSolver<State> solver = new WorkListSolver<>(new Analysis(steps), options.getIterationFactor());
		DataflowResult<State> result = solver.solve(cfg);
		if (options.getValidateFixpoint()) {
			solver.validate(cfg, result);
		}
		stats.iterated(liveVariables.iterations() + result.iterations());
		stats.phase("dataflow", System.nanoTime() - start);
		// Lifetimes
		start = System.nanoTime();
		LinkedHashMap<ProgramPoint, Events> events = new LinkedHashMap<>();
		HashMap<ProgramPoint, BitSet> gen = new HashMap<>();
		HashMap<ProgramPoint, BitSet> kill = new HashMap<>();
		HashMap<ProgramPoint, BitSet> liveIn = new HashMap<>();
		for (ProgramPoint p : cfg) {
			Step s = steps.get(p);
			events.put(p, s.events);
			gen.put(p, s.gen);
			kill.put(p, s.kill);
			liveIn.put(p, result.getInFact(p).loans);
		}
		List<Loan> loans = inferLifetimes(function, cfg, info, refined, events, gen, kill, liveIn);
		report.setLoans(loans);
		stats.phase("lifetimes", System.nanoTime() - start);
		// Checks
		start = System.nanoTime();
		for (ProgramPoint p : sortedPoints(cfg)) {
			Step s = steps.get(p);
			BitSet in = liveIn.get(p);
			checkConflictingBorrows(function, p, in, lookup(s.started, loans), loans, report);
			checkOwnerInvalidation(function, p, s.events, in, loans, report);
			checkMovesAtPoint(function, p, s.events, lookup(s.started, loans), report);
			checkUseAfterMove(function, cfg, p, s.events, result.getInFact(p).moved, events, report);
		}
		stats.phase("checks", System.nanoTime() - start);
		stats.analysed(cfg.size(), loans.size(), refinements);
	}

	/**
	 * The product of the loans live at a point and the places moved out of.
	 */
	private static final class State {
		private final BitSet loans = new BitSet();
		private final Set<Place> moved = new HashSet<>();

		@Override
		public boolean equals(Object o) {
			if (o instanceof State) {
				State s = (State) o;
				return loans.equals(s.loans) && moved.equals(s.moved);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Objects.hash(loans, moved);
		}

		@Override
		public String toString() {
			return loans + " " + moved;
		}
	}

	/**
	 * The effect of one program point.
	 */
	private static final class Step {
		private final Events events;
		private final BitSet gen = new BitSet();
		private final BitSet kill = new BitSet();
		private final List<Loan> started = new ArrayList<>();

		private Step(Events events) {
			this.events = events;
		}
	}

	/**
	 * Computes the step of each point on demand, remembering the result.
	 */
	private static final class Steps {
		private final Map<ProgramPoint, Events> raw;
		private final List<Loan> loans;
		private final List<Set<Place>> holders;
		private final DataflowResult<Set<Place>> liveVariables;
		private final HashMap<ProgramPoint, Step> cache = new HashMap<>();

		private Steps(Map<ProgramPoint, Events> raw, List<Loan> loans, List<Set<Place>> holders,
				DataflowResult<Set<Place>> liveVariables) {
			this.raw = raw;
			this.loans = loans;
			this.holders = holders;
			this.liveVariables = liveVariables;
		}

		public Step get(ProgramPoint p) {
			Step s = cache.get(p);
			if (s == null) {
				s = compute(p);
				cache.put(p, s);
			}
			return s;
		}

		private Step compute(ProgramPoint p) {
			Events original = raw.get(p);
			Step step = new Step(original.refine(FactExtractor.refined(original, loans)));
			Set<Place> liveOut = liveVariables.getOutFact(p);
			for (Loan l : step.events.loans()) {
				if (l.kind().isBorrow()) {
					step.started.add(l);
					if (!FactExtractor.isExpired(holders.get(l.id()), liveOut)) {
						step.gen.set(l.id());
					}
				}
			}
			for (Loan l : loans) {
				if (FactExtractor.isInvalidated(l, step.events)
						|| (l.kind().isBorrow() && FactExtractor.isExpired(holders.get(l.id()), liveOut))) {
					step.kill.set(l.id());
				}
			}
			return step;
		}
	}

	private static final class Analysis implements DataflowAnalysis<State> {
		private final Steps steps;

		private Analysis(Steps steps) {
			this.steps = steps;
		}

		@Override
		public boolean isForward() {
			return true;
		}

		@Override
		public State newBoundaryFact(ControlFlowGraph cfg) {
			return new State();
		}

		@Override
		public State newInitialFact() {
			return new State();
		}

		@Override
		public void meetInto(State fact, State target) {
			target.loans.or(fact.loans);
			target.moved.addAll(fact.moved);
		}

		@Override
		public boolean transferNode(ProgramPoint node, State in, State out) {
			Step step = steps.get(node);
			BitSet loans = (BitSet) in.loans.clone();
			loans.andNot(step.kill);
			loans.or(step.gen);
			Set<Place> moved = MovedPlaces.apply(step.events, in.moved);
			if (loans.equals(out.loans) && moved.equals(out.moved)) {
				return false;
			}
			out.loans.clear();
			out.loans.or(loans);
			out.moved.clear();
			out.moved.addAll(moved);
			return true;
		}
	}
}
