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
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

import mirborrowck.cfg.ControlFlowGraph;
import mirborrowck.core.Aliasing;
import mirborrowck.core.Events;
import mirborrowck.core.Syntax.Place;
import mirborrowck.core.Syntax.ProgramPoint;

/**
 * Computes the places which may have been moved out of on some path reaching
 * each program point. Overwriting a place re-initialises it along with every
 * part of it.
 *
 * <pre>
 * out[p] = (in[p] - reassigned[p]) U moved[p]
 * </pre>
 */
public class MovedPlaces implements DataflowAnalysis<Set<Place>> {
	private final Map<ProgramPoint, Events> events;

	public MovedPlaces(Map<ProgramPoint, Events> events) {
		this.events = events;
	}

	@Override
	public boolean isForward() {
		return true;
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
		Set<Place> result = apply(events.get(node), in);
		if (result.equals(out)) {
			return false;
		}
		out.clear();
		out.addAll(result);
		return true;
	}

	/**
	 * Apply the effect of a single point's events to a set of moved places.
	 * Reassignments are applied before moves, so a place which is both moved
	 * out of and overwritten at the same point (as in <code>x = move x</code>)
	 * remains moved afterwards.
	 */
	public static Set<Place> apply(Events events, Set<Place> in) {
		HashSet<Place> result = new HashSet<>(in);
		if (events != null) {
			removeCovered(result, events);
			result.addAll(events.moves());
		}
		return result;
	}

	static void removeCovered(Set<Place> places, Events events) {
		Iterator<Place> it = places.iterator();
		while (it.hasNext()) {
			Place p = it.next();
			for (Place r : events.reassigns()) {
				if (Aliasing.covers(r, p)) {
					it.remove();
					break;
				}
			}
		}
	}
}
