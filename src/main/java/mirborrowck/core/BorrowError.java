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
import mirborrowck.util.SyntacticElement;
import mirborrowck.util.SyntacticElement.Attribute;

/**
 * A borrow violation found in a function. Every error carries a stable type,
 * the program point at which it was detected and (where known) the region of
 * input responsible, along with details specific to its type.
 */
public class BorrowError extends SyntacticElement.Impl {

	public enum Type {
		/**
		 * Two loans which cannot coexist are live at the same time.
		 */
		CONFLICTING_BORROWS,
		/**
		 * A borrowed place is moved out of or overwritten.
		 */
		BORROW_ACROSS_OWNER_INVALIDATION,
		/**
		 * A place is used after its value was moved out.
		 */
		USE_AFTER_MOVE
	}

	public enum Invalidation {
		MOVE, REASSIGN
	}

	private final Type type;
	private final ProgramPoint point;
	private final String message;
	private final Place place;
	private final Loan existing;
	private final Loan incoming;
	private final Invalidation invalidation;
	private final ProgramPoint movePoint;

	private BorrowError(Type type, ProgramPoint point, String message, Place place, Loan existing, Loan incoming,
			Invalidation invalidation, ProgramPoint movePoint, Attribute... attributes) {
		super(attributes);
		this.type = type;
		this.point = point;
		this.message = message;
		this.place = place;
		this.existing = existing;
		this.incoming = incoming;
		this.invalidation = invalidation;
		this.movePoint = movePoint;
	}

	/**
	 * A new loan conflicts with one which is already live.
	 */
	public static BorrowError conflictingBorrows(ProgramPoint point, String message, Loan existing, Loan incoming,
			Attribute... attributes) {
		return new BorrowError(Type.CONFLICTING_BORROWS, point, message, incoming.owner(), existing, incoming, null,
				null, attributes);
	}

	/**
	 * The owner of a live loan is moved out of or overwritten.
	 */
	public static BorrowError ownerInvalidation(ProgramPoint point, String message, Loan loan, Place owner,
			Invalidation invalidation, Attribute... attributes) {
		return new BorrowError(Type.BORROW_ACROSS_OWNER_INVALIDATION, point, message, owner, loan, null,
				invalidation, null, attributes);
	}

	/**
	 * A place is used after it was moved out of, either at another point or by
	 * an earlier operand at the same point.
	 */
	public static BorrowError useAfterMove(ProgramPoint point, String message, Place place, ProgramPoint movePoint,
			Attribute... attributes) {
		return new BorrowError(Type.USE_AFTER_MOVE, point, message, place, null, null, null, movePoint, attributes);
	}

	public Type type() {
		return type;
	}

	public ProgramPoint point() {
		return point;
	}

	public String message() {
		return message;
	}

	/**
	 * The place involved: the place borrowed by the new loan, the owner being
	 * invalidated, or the place used after a move.
	 */
	public Place place() {
		return place;
	}

	/**
	 * The live loan which is violated, or <code>null</code> for a use after
	 * move.
	 */
	public Loan existingLoan() {
		return existing;
	}

	/**
	 * The newly created loan, for conflicting borrows only.
	 */
	public Loan newLoan() {
		return incoming;
	}

	/**
	 * The borrowed place, for owner invalidations only.
	 */
	public Place borrowedPlace() {
		return existing == null ? null : existing.owner();
	}

	public Invalidation invalidation() {
		return invalidation;
	}

	/**
	 * For a use after move, a point at which the place was moved out.
	 */
	public ProgramPoint movePoint() {
		return movePoint;
	}

	public Attribute.Source location() {
		return attribute(Attribute.Source.class);
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof BorrowError) {
			BorrowError e = (BorrowError) o;
			return type == e.type && point.equals(e.point) && place.equals(e.place) && id(existing) == id(e.existing)
					&& id(incoming) == id(e.incoming) && invalidation == e.invalidation
					&& Objects.equals(movePoint, e.movePoint);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, point, place, id(existing), id(incoming), invalidation, movePoint);
	}

	private static int id(Loan l) {
		return l == null ? -1 : l.id();
	}

	@Override
	public String toString() {
		return point + ": " + message;
	}
}
