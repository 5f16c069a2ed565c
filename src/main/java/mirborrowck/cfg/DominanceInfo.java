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
package mirborrowck.cfg;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

import mirborrowck.core.Syntax.ProgramPoint;
import mirborrowck.util.AnalysisException;

/**
 * Dominance and reachability facts about a control-flow graph. Once computed
 * they are never modified, so the same instance can answer queries for every
 * pass over the function.
 */
public class DominanceInfo {
	private final ControlFlowGraph cfg;
	private final Map<ProgramPoint, Set<ProgramPoint>> dominators;
	private final Map<ProgramPoint, Set<ProgramPoint>> postDominators;
	private final Map<ProgramPoint, ProgramPoint> immediateDominators;
	private final Map<ProgramPoint, Set<ProgramPoint>> reachable;

	DominanceInfo(ControlFlowGraph cfg, Map<ProgramPoint, Set<ProgramPoint>> dominators,
			Map<ProgramPoint, Set<ProgramPoint>> postDominators,
			Map<ProgramPoint, ProgramPoint> immediateDominators, Map<ProgramPoint, Set<ProgramPoint>> reachable) {
		this.cfg = cfg;
		this.dominators = dominators;
		this.postDominators = postDominators;
		this.immediateDominators = immediateDominators;
		this.reachable = reachable;
	}

	/**
	 * Check whether every path from an entry to <code>b</code> passes through
	 * <code>a</code>. Every node dominates itself.
	 */
	public boolean dominates(ProgramPoint a, ProgramPoint b) {
		check(a);
		return lookup(dominators, b).contains(a);
	}

	/**
	 * Check whether every path from <code>b</code> to an exit passes through
	 * <code>a</code>.
	 */
	public boolean postDominates(ProgramPoint a, ProgramPoint b) {
		check(a);
		return lookup(postDominators, b).contains(a);
	}

	/**
	 * Check whether there is a path from <code>a</code> to <code>b</code>.
	 * Every node reaches itself.
	 */
	public boolean canReach(ProgramPoint a, ProgramPoint b) {
		check(b);
		return lookup(reachable, a).contains(b);
	}

	/**
	 * Get the closest strict dominator of a node, or <code>null</code> for a
	 * node which has none (e.g. an entry point).
	 */
	public ProgramPoint immediateDominator(ProgramPoint p) {
		check(p);
		return immediateDominators.get(p);
	}

	public Set<ProgramPoint> dominatorsOf(ProgramPoint p) {
		return Collections.unmodifiableSet(lookup(dominators, p));
	}

	public Set<ProgramPoint> entryPoints() {
		return cfg.entryPoints();
	}

	public Set<ProgramPoint> exitPoints() {
		return cfg.exitPoints();
	}

	/**
	 * Check whether every path from an entry to <code>target</code> passes
	 * through at least one of a given set of points. For a single point this is
	 * exactly dominance.
	 */
	public boolean dominates(Collection<ProgramPoint> points, ProgramPoint target) {
		check(target);
		if (points.contains(target)) {
			return true;
		} else if (points.size() == 1) {
			return dominates(points.iterator().next(), target);
		}
		HashSet<ProgramPoint> visited = new HashSet<>();
		Queue<ProgramPoint> worklist = new ArrayDeque<>();
		for (ProgramPoint e : cfg.entryPoints()) {
			if (!points.contains(e) && visited.add(e)) {
				worklist.add(e);
			}
		}
		while (!worklist.isEmpty()) {
			ProgramPoint p = worklist.poll();
			if (p.equals(target)) {
				return false;
			}
			for (ProgramPoint s : cfg.getSuccsOf(p)) {
				if (!points.contains(s) && visited.add(s)) {
					worklist.add(s);
				}
			}
		}
		return true;
	}

	/**
	 * Select the last uses from a set of use points of some place: those from
	 * which no other use in the set can be reached. Uses within a loop reach one
	 * another, so none of them is last unless the loop contains only one use.
	 */
	public Set<ProgramPoint> lastUses(Collection<ProgramPoint> uses) {
		LinkedHashSet<ProgramPoint> r = new LinkedHashSet<>();
		for (ProgramPoint u : uses) {
			boolean last = true;
			for (ProgramPoint v : uses) {
				if (!u.equals(v) && canReach(u, v)) {
					last = false;
					break;
				}
			}
			if (last) {
				r.add(u);
			}
		}
		return r;
	}

	private void check(ProgramPoint p) {
		if (!cfg.contains(p)) {
			throw new AnalysisException(AnalysisException.Kind.INCONSISTENT_PROGRAM_POINTS,
					"program point " + p + " is not in the control-flow graph");
		}
	}

	private static Set<ProgramPoint> lookup(Map<ProgramPoint, Set<ProgramPoint>> facts, ProgramPoint p) {
		Set<ProgramPoint> r = facts.get(p);
		if (r == null) {
			throw new AnalysisException(AnalysisException.Kind.INCONSISTENT_PROGRAM_POINTS,
					"program point " + p + " is not in the control-flow graph");
		}
		return r;
	}
}
