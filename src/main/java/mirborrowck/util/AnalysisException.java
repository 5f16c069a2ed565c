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

/**
 * Signals that the borrow checker could not analyse a function. This covers
 * both input which violates the engine's contract (e.g. an empty control-flow
 * graph) and internal invariant violations (e.g. a dataflow computation which
 * fails to converge). It never represents a borrow violation in the function
 * itself; those are reported as diagnostics.
 */
public class AnalysisException extends RuntimeException {
	public static final long serialVersionUID = 1l;

	public enum Kind {
		/**
		 * The function given cannot be analysed (e.g. empty body, jump to an
		 * undeclared block).
		 */
		MALFORMED_INPUT,
		/**
		 * A loan, edge or query refers to a program point which is not part of the
		 * function.
		 */
		INCONSISTENT_PROGRAM_POINTS,
		/**
		 * A dataflow computation exceeded its iteration ceiling.
		 */
		NON_CONVERGENCE,
		/**
		 * A dataflow result failed re-validation.
		 */
		FIXPOINT_MISMATCH,
		/**
		 * A loan is used on a path which does not pass through its creation.
		 */
		UNSOUND_LOAN
	}

	private final Kind kind;

	public AnalysisException(Kind kind, String msg) {
		super(msg);
		this.kind = kind;
	}

	public AnalysisException(Kind kind, String msg, Throwable cause) {
		super(msg, cause);
		this.kind = kind;
	}

	public Kind kind() {
		return kind;
	}

	@Override
	public String toString() {
		return kind + ": " + getMessage();
	}
}
