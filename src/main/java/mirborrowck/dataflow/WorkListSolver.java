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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import mirborrowck.cfg.ControlFlowGraph;
import mirborrowck.core.Syntax.ProgramPoint;
import mirborrowck.util.AnalysisException;

/**
 * Solves a dataflow analysis by iterating to a fixpoint. All nodes start on the
 * worklist; whenever a node's fact changes its neighbours are queued again. The
 * number of steps is bounded by a multiple of the graph size, beyond which the
 * analysis is deemed not to converge.
 *
 * @param <Fact>
 */
public class WorkListSolver<Fact> {
	private static final Logger LOGGER = LoggerFactory.getLogger(WorkListSolver.class);

	public static final int DEFAULT_ITERATION_FACTOR = 1000;

	private final DataflowAnalysis<Fact> analysis;
	private final int iterationFactor;

	public WorkListSolver(DataflowAnalysis<Fact> analysis) {
		this(analysis, DEFAULT_ITERATION_FACTOR);
	}

	public WorkListSolver(DataflowAnalysis<Fact> analysis, int iterationFactor) {
		if (iterationFactor <= 0) {
			throw new IllegalArgumentException("invalid iteration factor: " + iterationFactor);
		}
		this.analysis = analysis;
		this.iterationFactor = iterationFactor;
	}

	/**
	 * Solve the analysis over a given graph from its initial facts.
	 *
	 * @param cfg
	 * @return
	 */
	public DataflowResult<Fact> solve(ControlFlowGraph cfg) {
		DataflowResult<Fact> result = new DataflowResult<>();
		for (ProgramPoint node : cfg) {
			result.setInFact(node, analysis.newInitialFact());
			result.setOutFact(node, analysis.newInitialFact());
		}
		return solve(cfg, result);
	}

	/**
	 * Continue solving from the facts in an existing result, which is updated in
	 * place. Starting from a fixpoint performs no updates.
	 *
	 * @param cfg
	 * @param result
	 * @return
	 */
	public DataflowResult<Fact> solve(ControlFlowGraph cfg, DataflowResult<Fact> result) {
		result.reset();
		final long ceiling = (long) iterationFactor * Math.max(1, cfg.size());
		List<ProgramPoint> order = cfg.reversePostOrder();
		if (!analysis.isForward()) {
			order = new ArrayList<>(order);
			Collections.reverse(order);
		}
		Queue<ProgramPoint> workList = new ArrayDeque<>(order);
		Set<ProgramPoint> queued = new HashSet<>(order);
		while (!workList.isEmpty()) {
			if (result.iterations() >= ceiling) {
				throw new AnalysisException(AnalysisException.Kind.NON_CONVERGENCE, analysis.getClass().getSimpleName()
						+ " failed to converge within " + ceiling + " iterations");
			}
			result.iterated();
			ProgramPoint node = workList.poll();
			queued.remove(node);
			boolean changed;
			List<ProgramPoint> affected;
			if (analysis.isForward()) {
				Fact in = meet(cfg, result, node);
				result.setInFact(node, in);
				changed = analysis.transferNode(node, in, result.getOutFact(node));
				affected = cfg.getSuccsOf(node);
			} else {
				Fact out = meet(cfg, result, node);
				result.setOutFact(node, out);
				changed = analysis.transferNode(node, result.getInFact(node), out);
				affected = cfg.getPredsOf(node);
			}
			if (changed) {
				result.updated();
				for (ProgramPoint n : affected) {
					if (queued.add(n)) {
						workList.add(n);
					}
				}
			}
		}
		LOGGER.debug("{} converged after {} iterations ({} updates)", analysis.getClass().getSimpleName(),
				result.iterations(), result.updates());
		return result;
	}

	/**
	 * Check that a result is a fixpoint, by recomputing the fact of every node
	 * from its neighbours and comparing it against the stored one.
	 *
	 * @param cfg
	 * @param result
	 */
	public void validate(ControlFlowGraph cfg, DataflowResult<Fact> result) {
		for (ProgramPoint node : cfg) {
			Fact joined = meet(cfg, result, node);
			Fact stored = analysis.isForward() ? result.getInFact(node) : result.getOutFact(node);
			if (!joined.equals(stored)) {
				throw mismatch(node);
			}
			// Transfer into a copy of the stored value, which must not change
			if (analysis.isForward()) {
				if (analysis.transferNode(node, joined, copyOf(result.getOutFact(node)))) {
					throw mismatch(node);
				}
			} else if (analysis.transferNode(node, copyOf(result.getInFact(node)), joined)) {
				throw mismatch(node);
			}
		}
	}

	/**
	 * Copy a fact by meeting it into the identity of the meet.
	 */
	private Fact copyOf(Fact fact) {
		Fact copy = analysis.newInitialFact();
		analysis.meetInto(fact, copy);
		return copy;
	}

	private Fact meet(ControlFlowGraph cfg, DataflowResult<Fact> result, ProgramPoint node) {
		boolean boundary = analysis.isForward() ? cfg.isEntry(node) : cfg.isExit(node);
		Fact fact = boundary ? analysis.newBoundaryFact(cfg) : analysis.newInitialFact();
		if (analysis.isForward()) {
			for (ProgramPoint pred : cfg.getPredsOf(node)) {
				analysis.meetInto(result.getOutFact(pred), fact);
			}
		} else {
			for (ProgramPoint succ : cfg.getSuccsOf(node)) {
				analysis.meetInto(result.getInFact(succ), fact);
			}
		}
		return fact;
	}

	private AnalysisException mismatch(ProgramPoint node) {
		return new AnalysisException(AnalysisException.Kind.FIXPOINT_MISMATCH,
				analysis.getClass().getSimpleName() + " is not at a fixpoint at " + node);
	}
}
