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
import java.util.Collections;
import java.util.List;

import mirborrowck.core.Syntax.Place;
import mirborrowck.core.Syntax.ProgramPoint;
import mirborrowck.util.Pair;

/**
 * The borrow-relevant effects of a single program point: which places it reads,
 * moves out of and overwrites, which loans it creates, and which places receive
 * values derived from other places.
 */
public class Events {
	private final ProgramPoint point;
	private final List<Place> uses = new ArrayList<>();
	private final List<Place> moves = new ArrayList<>();
	private final List<Place> reassigns = new ArrayList<>();
	private final List<Loan> loans = new ArrayList<>();
	private final List<Pair<Place, Place>> flows = new ArrayList<>();

	public Events(ProgramPoint point) {
		this.point = point;
	}

	public ProgramPoint point() {
		return point;
	}

	/**
	 * Places read at this point. A consuming use is a read, whatever it is later
	 * refined to.
	 */
	public List<Place> uses() {
		return Collections.unmodifiableList(uses);
	}

	public List<Place> moves() {
		return Collections.unmodifiableList(moves);
	}

	public List<Place> reassigns() {
		return Collections.unmodifiableList(reassigns);
	}

	/**
	 * Loans created at this point, in creation order.
	 */
	public List<Loan> loans() {
		return Collections.unmodifiableList(loans);
	}

	/**
	 * Pairs <code>(destination, source)</code> where a value derived from
	 * <code>source</code> is written into <code>destination</code>.
	 */
	public List<Pair<Place, Place>> flows() {
		return Collections.unmodifiableList(flows);
	}

	/**
	 * Places read or moved at this point. Both require the place to still hold
	 * a value.
	 */
	public List<Place> accesses() {
		ArrayList<Place> r = new ArrayList<>(uses);
		r.addAll(moves);
		return r;
	}

	void use(Place p) {
		uses.add(p);
	}

	void move(Place p) {
		moves.add(p);
	}

	void reassign(Place p) {
		reassigns.add(p);
	}

	void loan(Loan l) {
		loans.add(l);
	}

	void flow(Place destination, Place source) {
		flows.add(new Pair<>(destination, source));
	}

	/**
	 * Produce the events of this point once its loans have been refined. Every
	 * loan refined to a move contributes a move of its owner, even when that
	 * owner is already moved out of here.
	 */
	public Events refine(List<Loan> refined) {
		Events r = new Events(point);
		r.uses.addAll(uses);
		r.moves.addAll(moves);
		r.reassigns.addAll(reassigns);
		r.flows.addAll(flows);
		for (Loan l : refined) {
			r.loans.add(l);
			if (l.kind() == BorrowKind.MOVE) {
				r.moves.add(l.owner());
			}
		}
		return r;
	}

	@Override
	public String toString() {
		return point + "{uses=" + uses + ", moves=" + moves + ", reassigns=" + reassigns + ", loans=" + loans + "}";
	}
}
