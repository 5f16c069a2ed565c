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
import java.util.Map;

import mirborrowck.cfg.ControlFlowGraph;
import mirborrowck.core.Syntax.ProgramPoint;

/**
 * Computes the loans which may be live at each program point. A loan becomes
 * live where it is generated and stays live along every path until killed.
 *
 * <pre>
 * in[p]  = U out[q] for q in pred(p)
 * out[p] = (in[p] - kill[p]) U gen[p]
 * </pre>
 */
public class LoanLiveness implements DataflowAnalysis<BitSet> {
	private static final BitSet EMPTY = new BitSet();

	private final Map<ProgramPoint, BitSet> gen;
	private final Map<ProgramPoint, BitSet> kill;

	public LoanLiveness(Map<ProgramPoint, BitSet> gen, Map<ProgramPoint, BitSet> kill) {
		this.gen = gen;
		this.kill = kill;
	}

	@Override
	public boolean isForward() {
		return true;
	}

	@Override
	public BitSet newBoundaryFact(ControlFlowGraph cfg) {
		return new BitSet();
	}

	@Override
	public BitSet newInitialFact() {
		return new BitSet();
	}

	@Override
	public void meetInto(BitSet fact, BitSet target) {
		target.or(fact);
	}

	@Override
	public boolean transferNode(ProgramPoint node, BitSet in, BitSet out) {
		BitSet result = (BitSet) in.clone();
		result.andNot(kill.getOrDefault(node, EMPTY));
		result.or(gen.getOrDefault(node, EMPTY));
		if (result.equals(out)) {
			return false;
		}
		out.clear();
		out.or(result);
		return true;
	}
}
