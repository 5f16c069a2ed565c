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
package mirborrowck.dataflow;

import java.util.BitSet;
import java.util.List;
import java.util.Map;

import mirborrowck.cfg.BorrowState;
import mirborrowck.cfg.ControlFlowGraph;
import mirborrowck.core.Events;
import mirborrowck.core.Loan;
import mirborrowck.core.Syntax.Place;
import mirborrowck.core.Syntax.ProgramPoint;

/**
 * Computes the borrow state after each program point: the loans active on
 * every path reaching it, and the most recent uses of each place along any of
 * those paths.
 */
public class BorrowStates implements DataflowAnalysis<BorrowState> {
	private static final BitSet EMPTY = new BitSet();

	private final List<Loan> loans;
	private final Map<ProgramPoint, BitSet> gen;
	private final Map<ProgramPoint, BitSet> kill;
	private final Map<ProgramPoint, Events> events;

	public BorrowStates(List<Loan> loans, Map<ProgramPoint, BitSet> gen, Map<ProgramPoint, BitSet> kill,
			Map<ProgramPoint, Events> events) {
		this.loans = loans;
		this.gen = gen;
		this.kill = kill;
		this.events = events;
	}

	/**
	 * Solve and store each node's resulting state in the graph.
	 */
	public static void populate(ControlFlowGraph cfg, WorkListSolver<BorrowState> solver) {
		DataflowResult<BorrowState> result = solver.solve(cfg);
		for (ProgramPoint p : cfg) {
			cfg.stateOf(p).setTo(result.getOutFact(p));
		}
	}

	@Override
	public boolean isForward() {
		return true;
	}

	@Override
	public BorrowState newBoundaryFact(ControlFlowGraph cfg) {
		return new BorrowState();
	}

	@Override
	public BorrowState newInitialFact() {
		return BorrowState.top(loans);
	}

	@Override
	public void meetInto(BorrowState fact, BorrowState target) {
		target.merge(fact);
	}

	@Override
	public boolean transferNode(ProgramPoint node, BorrowState in, BorrowState out) {
		BorrowState result = in.copy();
		result.kill(kill.getOrDefault(node, EMPTY));
		BitSet g = gen.getOrDefault(node, EMPTY);
		for (int i = g.nextSetBit(0); i >= 0; i = g.nextSetBit(i + 1)) {
			result.activate(loans.get(i));
		}
		Events e = events.get(node);
		if (e != null) {
			for (Place p : e.accesses()) {
				result.recordUse(p, node);
			}
		}
		if (result.equals(out)) {
			return false;
		}
		out.setTo(result);
		return true;
	}
}
