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

import java.util.Objects;

import mirborrowck.core.Syntax.Place;
import mirborrowck.core.Syntax.ProgramPoint;

/**
 * A loan records that a place (its <i>owner</i>) was borrowed or consumed at a
 * given program point. Loans are immutable: refining a candidate move or
 * attaching a last use produces a new loan with the same identifier.
 */
public final class Loan {
	private final int id;
	private final Place owner;
	private final BorrowKind kind;
	private final ProgramPoint origin;
	private final Place borrower;
	private final ProgramPoint lastUse;

	public Loan(int id, Place owner, BorrowKind kind, ProgramPoint origin, Place borrower) {
		this(id, owner, kind, origin, borrower, null);
	}

	public Loan(int id, Place owner, BorrowKind kind, ProgramPoint origin, Place borrower, ProgramPoint lastUse) {
		this.id = id;
		this.owner = Objects.requireNonNull(owner);
		this.kind = Objects.requireNonNull(kind);
		this.origin = Objects.requireNonNull(origin);
		this.borrower = borrower;
		this.lastUse = lastUse;
	}

	public int id() {
		return id;
	}

	/**
	 * The place being borrowed.
	 */
	public Place owner() {
		return owner;
	}

	public BorrowKind kind() {
		return kind;
	}

	/**
	 * The point at which this loan is created.
	 */
	public ProgramPoint origin() {
		return origin;
	}

	/**
	 * The place the resulting reference is written to, or <code>null</code> for
	 * a temporary (e.g. a call argument).
	 */
	public Place borrower() {
		return borrower;
	}

	public boolean isTemporary() {
		return borrower == null;
	}

	/**
	 * The unique last use of this loan's borrower, or <code>null</code> if it is
	 * not known.
	 */
	public ProgramPoint lastUse() {
		return lastUse;
	}

	public Loan refine(BorrowKind kind) {
		return new Loan(id, owner, kind, origin, borrower, lastUse);
	}

	public Loan withLastUse(ProgramPoint lastUse) {
		return new Loan(id, owner, kind, origin, borrower, lastUse);
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Loan) {
			Loan l = (Loan) o;
			return id == l.id && owner.equals(l.owner) && kind == l.kind && origin.equals(l.origin)
					&& Objects.equals(borrower, l.borrower) && Objects.equals(lastUse, l.lastUse);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return id * 31 + owner.hashCode();
	}

	@Override
	public String toString() {
		String r = "L" + id + "(" + kind.describe() + " " + owner + " @" + origin;
		if (borrower != null) {
			r += " -> " + borrower;
		}
		return r + ")";
	}
}
