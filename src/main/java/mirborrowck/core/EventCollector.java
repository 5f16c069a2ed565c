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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import mirborrowck.core.Syntax.Function;
import mirborrowck.core.Syntax.Module;
import mirborrowck.core.Syntax.Operand;
import mirborrowck.core.Syntax.Parameter;
import mirborrowck.core.Syntax.Place;
import mirborrowck.core.Syntax.ProgramPoint;
import mirborrowck.core.Syntax.Rvalue;
import mirborrowck.core.Syntax.Signature;
import mirborrowck.core.Syntax.Stmt;
import mirborrowck.core.Syntax.Terminator;
import mirborrowck.util.AbstractVisitor;
import mirborrowck.util.AnalysisException;

/**
 * Determines the events of every program point in a function. Unless the
 * function already carries a loan table, loans are synthesised from the
 * borrow-creating operations encountered, numbered in program-point order so
 * that collecting twice yields identical loans.
 */
public class EventCollector extends AbstractVisitor<Events> {
	private final Function function;
	private final Module module;
	private final List<Loan> loans = new ArrayList<>();
	private boolean synthesise;

	/**
	 * @param function The function being analysed.
	 * @param module   Enclosing module used to resolve callees, or
	 *                 <code>null</code>.
	 */
	public EventCollector(Function function, Module module) {
		this.function = function;
		this.module = module;
	}

	/**
	 * Collect the events for every program point, in allocation order.
	 *
	 * @return
	 */
	public Map<ProgramPoint, Events> collect() {
		loans.clear();
		synthesise = function.loans() == null;
		LinkedHashMap<ProgramPoint, Events> events = new LinkedHashMap<>();
		for (ProgramPoint p : function.points()) {
			events.put(p, apply(new Events(p), function.instruction(p)));
		}
		if (!synthesise) {
			for (int i = 0; i != function.loans().size(); ++i) {
				Loan l = function.loans().get(i);
				if (l.id() != i) {
					throw new AnalysisException(AnalysisException.Kind.MALFORMED_INPUT,
							"loan " + l + " out of sequence in " + function.name());
				}
				Events e = events.get(l.origin());
				if (e == null) {
					throw new AnalysisException(AnalysisException.Kind.INCONSISTENT_PROGRAM_POINTS,
							"loan " + l + " created at unknown point in " + function.name());
				}
				e.loan(l);
				loans.add(l);
			}
		}
		return events;
	}

	/**
	 * The loan table, indexed by identifier. Only valid after
	 * {@link #collect()}.
	 */
	public List<Loan> loans() {
		return loans;
	}

	@Override
	protected Events apply(Events events, Stmt.Assign stmt) {
		Place lhs = stmt.leftOperand();
		Rvalue rhs = stmt.rightOperand();
		if (rhs instanceof Rvalue.Use) {
			read(events, ((Rvalue.Use) rhs).operand(), lhs);
		} else if (rhs instanceof Rvalue.Ref) {
			Rvalue.Ref ref = (Rvalue.Ref) rhs;
			access(events, ref.place());
			events.use(ref.place());
			events.flow(lhs, ref.place());
			borrow(events, ref.place(), ref.kind(), lhs);
		} else {
			Rvalue.BinaryOp op = (Rvalue.BinaryOp) rhs;
			read(events, op.lhs(), lhs);
			read(events, op.rhs(), lhs);
		}
		write(events, lhs);
		return events;
	}

	@Override
	protected Events apply(Events events, Stmt.Call stmt) {
		Signature signature = module == null ? null : module.signature(stmt.callee());
		Place destination = stmt.destination();
		Operand[] arguments = stmt.arguments();
		for (int i = 0; i != arguments.length; ++i) {
			Operand arg = arguments[i];
			Parameter.Mode mode = signature == null ? Parameter.Mode.OWNED : signature.modeOf(i);
			Place place = arg.place();
			if (place == null || mode == Parameter.Mode.OWNED) {
				// Temporaries have no borrower, so consuming arguments are only
				// held by the call itself.
				read(events, arg, null);
			} else {
				access(events, place);
				events.use(place);
				borrow(events, place, mode == Parameter.Mode.MUTABLE ? BorrowKind.MUTABLE : BorrowKind.SHARED, null);
			}
			if (destination != null && place != null) {
				events.flow(destination, place);
			}
		}
		if (destination != null) {
			write(events, destination);
		}
		return events;
	}

	@Override
	protected Events apply(Events events, Stmt.Drop stmt) {
		access(events, stmt.place());
		events.use(stmt.place());
		return events;
	}

	@Override
	protected Events apply(Events events, Stmt.Use stmt) {
		access(events, stmt.place());
		events.use(stmt.place());
		return events;
	}

	@Override
	protected Events apply(Events events, Terminator.If term) {
		read(events, term.condition(), null);
		return events;
	}

	@Override
	protected Events apply(Events events, Terminator.Switch term) {
		read(events, term.discriminant(), null);
		return events;
	}

	@Override
	protected Events apply(Events events, Terminator.Return term) {
		if (term.operand() != null) {
			read(events, term.operand(), null);
		}
		return events;
	}

	/**
	 * Record the events of evaluating an operand whose value is written into a
	 * given destination (or discarded, when <code>null</code>).
	 */
	private void read(Events events, Operand operand, Place destination) {
		Place place = operand.place();
		if (place == null) {
			return;
		}
		access(events, place);
		if (operand instanceof Operand.Move) {
			events.move(place);
		} else {
			events.use(place);
			if (operand instanceof Operand.Consume) {
				borrow(events, place, BorrowKind.CANDIDATE_MOVE, destination);
			}
		}
		if (destination != null) {
			events.flow(destination, place);
		}
	}

	/**
	 * Record the overwriting of a place.
	 */
	private void write(Events events, Place place) {
		access(events, place);
		events.reassign(place);
	}

	/**
	 * Record the reads needed to locate a place, namely its dynamic indices and
	 * any pointers dereferenced along the way.
	 */
	private void access(Events events, Place place) {
		for (Place index : place.dynamicIndices()) {
			events.use(index);
		}
		for (Place pointer : place.dereferencedPointers()) {
			events.use(pointer);
		}
	}

	private void borrow(Events events, Place owner, BorrowKind kind, Place borrower) {
		if (synthesise) {
			Loan l = new Loan(loans.size(), owner, kind, events.point(), borrower);
			loans.add(l);
			events.loan(l);
		}
	}
}
