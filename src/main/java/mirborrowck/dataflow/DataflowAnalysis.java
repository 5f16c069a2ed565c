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

import mirborrowck.cfg.ControlFlowGraph;
import mirborrowck.core.Syntax.ProgramPoint;

/**
 * A monotone dataflow analysis over the program points of a control-flow
 * graph.
 *
 * @param <Fact> The lattice of facts computed for each point.
 */
public interface DataflowAnalysis<Fact> {

	/**
	 * @return true if this analysis propagates facts along edges, false if it
	 *         propagates them against edges.
	 */
	boolean isForward();

	/**
	 * @return the fact flowing into an entry point (forward) or out of an exit
	 *         point (backward).
	 */
	Fact newBoundaryFact(ControlFlowGraph cfg);

	/**
	 * @return the fact every other point starts from. This is also the identity
	 *         of {@link #meetInto(Object, Object)}, i.e. bottom for a may
	 *         analysis and top for a must analysis.
	 */
	Fact newInitialFact();

	/**
	 * Meet a fact into another fact, modifying the latter.
	 */
	void meetInto(Fact fact, Fact target);

	/**
	 * Apply the transfer function of a node. A forward analysis updates
	 * <code>out</code> from <code>in</code>, whilst a backward analysis updates
	 * <code>in</code> from <code>out</code>.
	 *
	 * @return true if the updated fact changed.
	 */
	boolean transferNode(ProgramPoint node, Fact in, Fact out);
}
