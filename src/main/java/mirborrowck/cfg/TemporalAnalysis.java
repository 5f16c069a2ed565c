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

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import mirborrowck.core.Syntax.ProgramPoint;
import mirborrowck.dataflow.DataflowResult;
import mirborrowck.dataflow.Dominators;
import mirborrowck.dataflow.WorkListSolver;
import mirborrowck.util.AnalysisException;

/**
 * Computes the temporal structure of a control-flow graph: which points
 * dominate or post-dominate others, and which can reach others. Questions of
 * the form "does this happen before that" are answered from these facts alone,
 * never from program-point identifiers.
 */
public class TemporalAnalysis {
	private static final Logger LOGGER = LoggerFactory.getLogger(TemporalAnalysis.class);

	public final static String EMPTY_CFG = "Cannot perform temporal analysis on empty CFG";

	private final int iterationFactor;

	public TemporalAnalysis() {
		this(WorkListSolver.DEFAULT_ITERATION_FACTOR);
	}

	public TemporalAnalysis(int iterationFactor) {
		this.iterationFactor = iterationFactor;
	}

	public DominanceInfo analyze(ControlFlowGraph cfg) {
		if (cfg.isEmpty()) {
			throw new AnalysisException(AnalysisException.Kind.MALFORMED_INPUT, EMPTY_CFG);
		}
		Map<ProgramPoint, Set<ProgramPoint>> dominators = solve(cfg, true);
		Map<ProgramPoint, Set<ProgramPoint>> postDominators = solve(cfg, false);
		Map<ProgramPoint, ProgramPoint> idoms = immediateDominators(cfg, dominators);
		Map<ProgramPoint, Set<ProgramPoint>> reachable = reachability(cfg);
		LOGGER.debug("computed dominance for {} nodes ({} entries, {} exits)", cfg.size(), cfg.entryPoints().size(),
				cfg.exitPoints().size());
		return new DominanceInfo(cfg, dominators, postDominators, idoms, reachable);
	}

	private Map<ProgramPoint, Set<ProgramPoint>> solve(ControlFlowGraph cfg, boolean forward) {
		WorkListSolver<Set<ProgramPoint>> solver = new WorkListSolver<>(new Dominators(cfg, forward), iterationFactor);
		DataflowResult<Set<ProgramPoint>> result = solver.solve(cfg);
		HashMap<ProgramPoint, Set<ProgramPoint>> r = new HashMap<>();
		for (ProgramPoint p : cfg) {
			r.put(p, forward ? result.getOutFact(p) : result.getInFact(p));
		}
		return r;
	}

	/**
	 * The immediate dominator of a node is its strict dominator which every
	 * other strict dominator also dominates.
	 */
	private static Map<ProgramPoint, ProgramPoint> immediateDominators(ControlFlowGraph cfg,
			Map<ProgramPoint, Set<ProgramPoint>> dominators) {
		HashMap<ProgramPoint, ProgramPoint> idoms = new HashMap<>();
		for (ProgramPoint n : cfg) {
			for (ProgramPoint d : dominators.get(n)) {
				if (d.equals(n)) {
					continue;
				}
				boolean closest = true;
				for (ProgramPoint s : dominators.get(n)) {
					if (!s.equals(n) && !dominators.get(d).contains(s)) {
						closest = false;
						break;
					}
				}
				if (closest) {
					idoms.put(n, d);
					break;
				}
			}
		}
		return idoms;
	}

	/**
	 * Compute the transitive closure of the successor relation, seeded so that
	 * every node reaches itself.
	 */
	private Map<ProgramPoint, Set<ProgramPoint>> reachability(ControlFlowGraph cfg) {
		HashMap<ProgramPoint, Set<ProgramPoint>> reach = new HashMap<>();
		for (ProgramPoint n : cfg) {
			HashSet<ProgramPoint> r = new HashSet<>(cfg.getSuccsOf(n));
			r.add(n);
			reach.put(n, r);
		}
		final long ceiling = (long) iterationFactor * cfg.size();
		long iterations = 0;
		boolean changed = true;
		while (changed) {
			if (++iterations > ceiling) {
				throw new AnalysisException(AnalysisException.Kind.NON_CONVERGENCE,
						"reachability failed to converge within " + ceiling + " iterations");
			}
			changed = false;
			for (ProgramPoint n : cfg) {
				Set<ProgramPoint> r = reach.get(n);
				for (ProgramPoint k : new HashSet<>(r)) {
					changed |= r.addAll(reach.get(k));
				}
			}
		}
		return reach;
	}
}
