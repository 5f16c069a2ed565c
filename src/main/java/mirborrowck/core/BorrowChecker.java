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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import mirborrowck.cfg.ControlFlowGraph;
import mirborrowck.cfg.DominanceInfo;
import mirborrowck.cfg.TemporalAnalysis;
import mirborrowck.core.Syntax.Function;
import mirborrowck.core.Syntax.Module;
import mirborrowck.core.Syntax.Place;
import mirborrowck.core.Syntax.ProgramPoint;
import mirborrowck.dataflow.BorrowStates;
import mirborrowck.dataflow.WorkListSolver;
import mirborrowck.util.AnalysisException;
import mirborrowck.util.SyntacticElement.Attribute;

/**
 * Responsible for borrow checking the functions of a module. Subclasses differ
 * in how they compute the loans live at each program point and the places
 * moved out of on entry to it, but share the checks applied once these are
 * known:
 *
 * <ul>
 * <li><b>Conflicting borrows.</b> A loan created at a point must not conflict
 * with any loan live on entry, nor with a loan created earlier at the same
 * point.</li>
 * <li><b>Owner invalidation.</b> A place with a live loan must not be moved out
 * of or overwritten.</li>
 * <li><b>Use after move.</b> A place must not be used after it (or a place it
 * overlaps) was moved out of on some path.</li>
 * </ul>
 */
public abstract class BorrowChecker {
	private static final Logger LOGGER = LoggerFactory.getLogger(BorrowChecker.class);

	// Error messages
	public final static String CONFLICTING_BORROWS = "cannot have %s and %s borrows of aliasing places `%s` and `%s` at the same time";
	public final static String MOVE_WHILE_BORROWED = "cannot move out of `%s` because it is borrowed (loan %d at %s)";
	public final static String ASSIGN_WHILE_BORROWED = "cannot assign to `%s` because it is borrowed (loan %d at %s)";
	public final static String USE_AFTER_MOVE = "use of moved value `%s` (moved at %s)";
	public final static String EMPTY_FUNCTION = "function %s has no program points";

	protected final Options options;
	protected final Module module;

	public BorrowChecker(Options options, Module module) {
		this.options = options;
		this.module = module;
	}

	/**
	 * Construct the checker selected by a given set of options.
	 *
	 * @param options
	 * @param module  Module supplying the signatures of called functions.
	 * @return
	 */
	public static BorrowChecker create(Options options, Module module) {
		switch (options.getStrategy()) {
		case UNIFIED:
			return new UnifiedChecker(options, module);
		case MULTI_PASS:
		default:
			return new MultiPassChecker(options, module);
		}
	}

	/**
	 * Borrow check a single function. Violations of the borrowing rules are
	 * reported, whilst inputs which cannot be analysed at all raise an
	 * <code>AnalysisException</code>.
	 *
	 * @param function
	 * @return
	 */
	public Report check(Function function) {
		Report report = new Report(function.name());
		long start = System.nanoTime();
		ControlFlowGraph cfg = ControlFlowGraph.of(function);
		if (cfg.isEmpty()) {
			throw new AnalysisException(AnalysisException.Kind.MALFORMED_INPUT,
					String.format(EMPTY_FUNCTION, function.name()));
		}
		DominanceInfo info = new TemporalAnalysis(options.getIterationFactor()).analyze(cfg);
		report.statistics().phase("temporal", System.nanoTime() - start);
		analyse(function, cfg, info, report);
		LOGGER.debug("checked {}: {} errors, {} warnings", function.name(), report.errors().size(),
				report.warnings().size());
		return report;
	}

	/**
	 * Perform the analysis proper, recording errors, warnings, loans and
	 * statistics in the given report.
	 */
	protected abstract void analyse(Function function, ControlFlowGraph cfg, DominanceInfo info, Report report);

	/**
	 * Validate the loans against the graph, attach their last uses and populate
	 * the borrow state of every node.
	 *
	 * @return The loans with their last uses attached.
	 */
	protected List<Loan> inferLifetimes(Function function, ControlFlowGraph cfg, DominanceInfo info, List<Loan> loans,
			Map<ProgramPoint, Events> events, Map<ProgramPoint, BitSet> gen, Map<ProgramPoint, BitSet> kill,
			Map<ProgramPoint, BitSet> liveIn) {
		LifetimeInference lifetimes = new LifetimeInference(info, events, liveIn);
		if (options.getValidateLoans()) {
			lifetimes.validate(function, loans);
		}
		List<Loan> inferred = lifetimes.inferLastUses(loans);
		BorrowStates.populate(cfg,
				new WorkListSolver<>(new BorrowStates(inferred, gen, kill, events), options.getIterationFactor()));
		return inferred;
	}

	/**
	 * Check the loans started at a point against those live on entry to it, and
	 * against each other in order of creation.
	 */
	protected void checkConflictingBorrows(Function function, ProgramPoint point, BitSet liveIn, List<Loan> started,
			List<Loan> loans, Report report) {
		for (int i = 0; i != started.size(); ++i) {
			Loan incoming = started.get(i);
			for (int l = liveIn.nextSetBit(0); l >= 0; l = liveIn.nextSetBit(l + 1)) {
				if (l != incoming.id()) {
					checkConflict(function, point, loans.get(l), incoming, report);
				}
			}
			for (int j = 0; j < i; ++j) {
				checkConflict(function, point, started.get(j), incoming, report);
			}
		}
	}

	private void checkConflict(Function function, ProgramPoint point, Loan existing, Loan incoming, Report report) {
		if (!existing.kind().conflictsWith(incoming.kind())) {
			return;
		}
		Aliasing.Relation relation = Aliasing.relation(existing.owner(), incoming.owner());
		if (relation != Aliasing.Relation.DISJOINT) {
			String msg = String.format(CONFLICTING_BORROWS, existing.kind().describe(), incoming.kind().describe(),
					existing.owner(), incoming.owner());
			report(relation, BorrowError.conflictingBorrows(point, msg, existing, incoming, sourceOf(function, point)),
					report);
		}
	}

	/**
	 * Check that no place moved out of or overwritten at a point may alias the
	 * owner of a loan live on entry to it.
	 */
	protected void checkOwnerInvalidation(Function function, ProgramPoint point, Events events, BitSet liveIn,
			List<Loan> loans, Report report) {
		for (int l = liveIn.nextSetBit(0); l >= 0; l = liveIn.nextSetBit(l + 1)) {
			Loan loan = loans.get(l);
			for (Place m : events.moves()) {
				checkInvalidation(function, point, loan, m, BorrowError.Invalidation.MOVE, MOVE_WHILE_BORROWED,
						report);
			}
			for (Place r : events.reassigns()) {
				checkInvalidation(function, point, loan, r, BorrowError.Invalidation.REASSIGN, ASSIGN_WHILE_BORROWED,
						report);
			}
		}
	}

	/**
	 * Check each place moved out of at a point against the loans started at that
	 * same point, and against the places moved out of there before it. Argument
	 * order does not matter for the former.
	 */
	protected void checkMovesAtPoint(Function function, ProgramPoint point, Events events, List<Loan> started,
			Report report) {
		List<Place> moves = events.moves();
		for (int i = 0; i != moves.size(); ++i) {
			Place moved = moves.get(i);
			for (Loan loan : started) {
				checkInvalidation(function, point, loan, moved, BorrowError.Invalidation.MOVE, MOVE_WHILE_BORROWED,
						report);
			}
			for (int j = 0; j < i; ++j) {
				Aliasing.Relation relation = Aliasing.relation(moves.get(j), moved);
				if (relation != Aliasing.Relation.DISJOINT) {
					String msg = String.format(USE_AFTER_MOVE, moved, point);
					report(relation, BorrowError.useAfterMove(point, msg, moved, point, sourceOf(function, point)),
							report);
				}
			}
		}
	}

	private void checkInvalidation(Function function, ProgramPoint point, Loan loan, Place place,
			BorrowError.Invalidation invalidation, String format, Report report) {
		Aliasing.Relation relation = Aliasing.relation(loan.owner(), place);
		if (relation != Aliasing.Relation.DISJOINT) {
			String msg = String.format(format, place, loan.id(), loan.origin());
			report(relation,
					BorrowError.ownerInvalidation(point, msg, loan, place, invalidation, sourceOf(function, point)),
					report);
		}
	}

	/**
	 * Check that nothing accessed at a point may alias a place moved out of on
	 * some path reaching it.
	 */
	protected void checkUseAfterMove(Function function, ControlFlowGraph cfg, ProgramPoint point, Events events,
			Set<Place> movedIn, Map<ProgramPoint, Events> allEvents, Report report) {
		for (Place access : events.accesses()) {
			for (Place moved : movedIn) {
				Aliasing.Relation relation = Aliasing.relation(access, moved);
				if (relation != Aliasing.Relation.DISJOINT) {
					ProgramPoint origin = findMovePoint(cfg, allEvents, point, moved);
					String msg = String.format(USE_AFTER_MOVE, access, origin);
					report(relation, BorrowError.useAfterMove(point, msg, access, origin, sourceOf(function, point)),
							report);
				}
			}
		}
	}

	/**
	 * Find the nearest point moving out of a given place, searching backwards
	 * from a use. Falls back to the use itself when none is found.
	 */
	protected static ProgramPoint findMovePoint(ControlFlowGraph cfg, Map<ProgramPoint, Events> events,
			ProgramPoint use, Place moved) {
		ArrayDeque<ProgramPoint> worklist = new ArrayDeque<>(cfg.getPredsOf(use));
		HashSet<ProgramPoint> visited = new HashSet<>(worklist);
		while (!worklist.isEmpty()) {
			ProgramPoint p = worklist.poll();
			Events e = events.get(p);
			if (e != null && e.moves().contains(moved)) {
				return p;
			}
			for (ProgramPoint pred : cfg.getPredsOf(p)) {
				if (visited.add(pred)) {
					worklist.add(pred);
				}
			}
		}
		return use;
	}

	/**
	 * Violations involving places which only alias through dynamic indices or
	 * pointers are demoted to warnings when so configured.
	 */
	private void report(Aliasing.Relation relation, BorrowError error, Report report) {
		if (relation == Aliasing.Relation.UNKNOWN && options.getDynamicIndexWarnings()) {
			report.warning(error);
		} else {
			report.error(error);
		}
	}

	/**
	 * Select the current versions of a list of loans from a loan table.
	 */
	protected static List<Loan> lookup(List<Loan> started, List<Loan> loans) {
		ArrayList<Loan> r = new ArrayList<>();
		for (Loan l : started) {
			r.add(loans.get(l.id()));
		}
		return r;
	}

	protected static List<ProgramPoint> sortedPoints(ControlFlowGraph cfg) {
		ArrayList<ProgramPoint> points = new ArrayList<>();
		for (ProgramPoint p : cfg) {
			points.add(p);
		}
		Collections.sort(points);
		return points;
	}

	private static Attribute[] sourceOf(Function function, ProgramPoint point) {
		Attribute.Source source = function.instruction(point).attribute(Attribute.Source.class);
		return source == null ? new Attribute[0] : new Attribute[] { source };
	}
}
