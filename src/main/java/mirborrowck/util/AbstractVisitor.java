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
package mirborrowck.util;

import mirborrowck.core.Syntax;
import mirborrowck.core.Syntax.Instruction;
import mirborrowck.core.Syntax.Stmt;
import mirborrowck.core.Syntax.Terminator;

/**
 * Dispatches over the statements and terminators of a function, threading a
 * state value through each case.
 *
 * @param <T> The state being threaded (e.g. the events of a program point)
 */
public abstract class AbstractVisitor<T> {

	public T apply(T state, Instruction insn) {
		switch (insn.getOpcode()) {
		case Syntax.STMT_assign:
			return apply(state, (Stmt.Assign) insn);
		case Syntax.STMT_call:
			return apply(state, (Stmt.Call) insn);
		case Syntax.STMT_drop:
			return apply(state, (Stmt.Drop) insn);
		case Syntax.STMT_use:
			return apply(state, (Stmt.Use) insn);
		case Syntax.STMT_nop:
			return state;
		case Syntax.TERM_goto:
		case Syntax.TERM_unreachable:
			return state;
		case Syntax.TERM_if:
			return apply(state, (Terminator.If) insn);
		case Syntax.TERM_switch:
			return apply(state, (Terminator.Switch) insn);
		case Syntax.TERM_return:
			return apply(state, (Terminator.Return) insn);
		}
		throw new IllegalArgumentException("Invalid instruction encountered: " + insn);
	}

	/**
	 * Apply this visitor to a given assignment statement.
	 *
	 * @param state The current state
	 * @param stmt  The statement being visited.
	 * @return
	 */
	protected abstract T apply(T state, Stmt.Assign stmt);

	/**
	 * Apply this visitor to a given call statement.
	 *
	 * @param state The current state
	 * @param stmt  The statement being visited.
	 * @return
	 */
	protected abstract T apply(T state, Stmt.Call stmt);

	protected abstract T apply(T state, Stmt.Drop stmt);

	protected abstract T apply(T state, Stmt.Use stmt);

	/**
	 * Apply this visitor to a conditional branch. Only the condition is of
	 * interest, since edges are handled by the control-flow graph.
	 *
	 * @param state The current state
	 * @param term  The terminator being visited.
	 * @return
	 */
	protected abstract T apply(T state, Terminator.If term);

	protected abstract T apply(T state, Terminator.Switch term);

	protected abstract T apply(T state, Terminator.Return term);
}
