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

import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import mirborrowck.cfg.ControlFlowGraph;
import mirborrowck.cfg.DominanceInfo;
import mirborrowck.core.Syntax.Function;
import mirborrowck.core.Syntax.Module;
import mirborrowck.core.Syntax.Place;
import mirborrowck.core.Syntax.ProgramPoint;
import mirborrowck.dataflow.DataflowResult;
import mirborrowck.dataflow.LoanLiveness;
import mirborrowck.dataflow.MovedPlaces;
import mirborrowck.dataflow.WorkListSolver;

/**
 * Borrow checker which computes each fact in its own pass: first the events
 * with their gen and kill sets, then loan liveness, then moved places, and
 * finally each check in turn over every program point.
 */
public class MultiPassChecker extends BorrowChecker {

	public MultiPassChecker(Options options, Module module) {
		super(options, module);
	}

	@Override
	protected void analyse(Function function, ControlFlowGraph cfg, DominanceInfo info, Report report) {
		Report.Statistics stats = report.statistics();
		long start = System.nanoTime();
		FactExtractor.Facts facts = new FactExtractor(options, module).extract(function, cfg);
		stats.iterated(facts.liveVariables().iterations());
		stats.phase("facts", System.nanoTime() - start);
		// Loan liveness
		start = System.nanoTime();
		WorkListSolver<BitSet> loanSolver = new WorkListSolver<>(new LoanLiveness(facts.gen(), facts.kill()),
				options.getIterationFactor());
		DataflowResult<BitSet> live = loanSolver.solve(cfg);
		WorkListSolver<Set<Place>> moveSolver = new WorkListSolver<>(new MovedPlaces(facts.events()),
				options.getIterationFactor());
		DataflowResult<Set<Place>> moved = moveSolver.solve(cfg);
		if (options.getValidateFixpoint()) {
			loanSolver.validate(cfg, live);
			moveSolver.validate(cfg, moved);
		}
		stats.iterated(live.iterations() + moved.iterations());
		stats.phase("dataflow", System.nanoTime() - start);
		// Lifetimes
		start = System.nanoTime();
		Map<ProgramPoint, BitSet> liveIn = new HashMap<>();
		for (ProgramPoint p : cfg) {
			liveIn.put(p, live.getInFact(p));
		}
		List<Loan> loans = inferLifetimes(function, cfg, info, facts.loans(), facts.events(), facts.gen(),
				facts.kill(), liveIn);
		report.setLoans(loans);
		stats.phase("lifetimes", System.nanoTime() - start);
		// Checks
		start = System.nanoTime();
		List<ProgramPoint> points = sortedPoints(cfg);
		for (ProgramPoint p : points) {
			checkConflictingBorrows(function, p, liveIn.get(p), lookup(facts.startedAt(p), loans), loans, report);
		}
		for (ProgramPoint p : points) {
			checkOwnerInvalidation(function, p, facts.events(p), liveIn.get(p), loans, report);
			checkMovesAtPoint(function, p, facts.events(p), lookup(facts.startedAt(p), loans), report);
		}
		for (ProgramPoint p : points) {
			checkUseAfterMove(function, cfg, p, facts.events(p), moved.getInFact(p), facts.events(), report);
		}
		stats.phase("checks", System.nanoTime() - start);
		stats.analysed(cfg.size(), loans.size(), facts.refinements());
	}
}
