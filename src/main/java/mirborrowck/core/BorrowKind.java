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

/**
 * The ways in which a place can be borrowed or consumed. Each kind states
 * whether it is a borrow at all, and how it interacts with every other kind.
 * Adding a kind therefore forces its conflict rules to be written down.
 */
public enum BorrowKind {
	/**
	 * A read-only reference. Any number may coexist.
	 */
	SHARED {
		@Override
		public boolean isBorrow() {
			return true;
		}

		@Override
		public boolean conflictsWith(BorrowKind other) {
			return other != SHARED;
		}

		@Override
		public String prefix() {
			return "&";
		}
	},
	/**
	 * A read-write reference.
	 */
	MUTABLE {
		@Override
		public boolean isBorrow() {
			return true;
		}

		@Override
		public boolean conflictsWith(BorrowKind other) {
			return true;
		}

		@Override
		public String prefix() {
			return "&mut ";
		}
	},
	/**
	 * An exclusive reference which cannot be used to write (e.g. a closure
	 * capture).
	 */
	UNIQUE {
		@Override
		public boolean isBorrow() {
			return true;
		}

		@Override
		public boolean conflictsWith(BorrowKind other) {
			return true;
		}

		@Override
		public String prefix() {
			return "&uniq ";
		}
	},
	/**
	 * A consuming use which has not yet been classified. Until refined it is
	 * treated as a borrow.
	 */
	CANDIDATE_MOVE {
		@Override
		public boolean isBorrow() {
			return true;
		}

		@Override
		public boolean conflictsWith(BorrowKind other) {
			return true;
		}

		@Override
		public String prefix() {
			return "";
		}
	},
	/**
	 * Ownership transfer. Never live as a borrow.
	 */
	MOVE {
		@Override
		public boolean isBorrow() {
			return false;
		}

		@Override
		public boolean conflictsWith(BorrowKind other) {
			return true;
		}

		@Override
		public String prefix() {
			return "move ";
		}
	};

	/**
	 * Check whether loans of this kind remain live after their creation point.
	 */
	public abstract boolean isBorrow();

	/**
	 * Check whether a loan of this kind conflicts with a loan of another kind
	 * over aliasing places. This relation is symmetric.
	 */
	public abstract boolean conflictsWith(BorrowKind other);

	/**
	 * Textual prefix used when printing an rvalue of this kind.
	 */
	public abstract String prefix();

	/**
	 * Human-readable name used in diagnostics.
	 */
	public String describe() {
		switch (this) {
		case SHARED:
			return "shared";
		case MUTABLE:
			return "mutable";
		case UNIQUE:
			return "unique";
		case CANDIDATE_MOVE:
			return "candidate move";
		default:
			return "move";
		}
	}
}
