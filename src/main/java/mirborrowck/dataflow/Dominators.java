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

import java.util.HashSet;
import java.util.Set;

import mirborrowck.cfg.ControlFlowGraph;
import mirborrowck.core.Syntax.ProgramPoint;

/**
 * Computes the dominators of each node, or its post-dominators when run
 * backwards. Boundary nodes start from themselves alone and every other node
 * from the set of all nodes:
 *
 * <pre>
 * dom[n] = {n} U (^ dom[p] for p in pred(n))
 * </pre>
 */
public class Dominators implements DataflowAnalysis<Set<ProgramPoint>> {
	private final boolean forward;
	private final Set<ProgramPoint> universe;

	/**
	 * @param cfg     Graph whose nodes make up the universe.
	 * @param forward true for dominators, false for post-dominators.
	 */
	public Dominators(ControlFlowGraph cfg, boolean forward) {
		this.forward = forward;
		this.universe = new HashSet<>();
		for (ProgramPoint p : cfg) {
			universe.add(p);
		}
	}

	@Override
	public boolean isForward() {
		return forward;
	}

	@Override
	public Set<ProgramPoint> newBoundaryFact(ControlFlowGraph cfg) {
		return new HashSet<>();
	}

	@Override
	public Set<ProgramPoint> newInitialFact() {
		return new HashSet<>(universe);
	}

	@Override
	public void meetInto(Set<ProgramPoint> fact, Set<ProgramPoint> target) {
		target.retainAll(fact);
	}

	@Override
	public boolean transferNode(ProgramPoint node, Set<ProgramPoint> in, Set<ProgramPoint> out) {
		Set<ProgramPoint> source = forward ? in : out;
		Set<ProgramPoint> target = forward ? out : in;
		HashSet<ProgramPoint> result = new HashSet<>(source);
		result.add(node);
		if (result.equals(target)) {
			return false;
		}
		target.clear();
		target.addAll(result);
		return true;
	}
}
