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
import java.util.Map;
import java.util.Set;

import mirborrowck.cfg.ControlFlowGraph;
import mirborrowck.core.Aliasing;
import mirborrowck.core.Events;
import mirborrowck.core.Syntax.Place;
import mirborrowck.core.Syntax.ProgramPoint;

/**
 * Computes the places whose current value may still be read. This runs
 * backwards:
 *
 * <pre>
 * out[p] = U in[s] for s in succ(p)
 * in[p]  = uses[p] U (out[p] - reassigned[p])
 * </pre>
 *
 * Moves count as uses, since moving out of a place reads it.
 */
public class LiveVariables implements DataflowAnalysis<Set<Place>> {
	private final Map<ProgramPoint, Events> events;

	public LiveVariables(Map<ProgramPoint, Events> events) {
		this.events = events;
	}

	/**
	 * Check whether any live place may alias a given place.
	 */
	public static boolean isLive(Place place, Set<Place> live) {
		return Aliasing.mayAliasAny(place, live);
	}

	@Override
	public boolean isForward() {
		return false;
	}

	@Override
	public Set<Place> newBoundaryFact(ControlFlowGraph cfg) {
		return new HashSet<>();
	}

	@Override
	public Set<Place> newInitialFact() {
		return new HashSet<>();
	}

	@Override
	public void meetInto(Set<Place> fact, Set<Place> target) {
		target.addAll(fact);
	}

	@Override
	public boolean transferNode(ProgramPoint node, Set<Place> in, Set<Place> out) {
		HashSet<Place> result = new HashSet<>(out);
		Events e = events.get(node);
		if (e != null) {
			MovedPlaces.removeCovered(result, e);
			result.addAll(e.accesses());
		}
		if (result.equals(in)) {
			return false;
		}
		in.clear();
		in.addAll(result);
		return true;
	}
}
