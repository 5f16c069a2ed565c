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

import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import mirborrowck.core.Loan;
import mirborrowck.core.Syntax.Place;
import mirborrowck.core.Syntax.ProgramPoint;

/**
 * The borrows definitely active at a node, indexed by the place they borrow,
 * together with the points at which each place was most recently used. Drop
 * insertion consults this to decide which values are still borrowed.
 */
public class BorrowState {
	private final BitSet active;
	private final Map<Place, BitSet> index;
	private final Map<Place, Set<ProgramPoint>> lastUses;

	public BorrowState() {
		this.active = new BitSet();
		this.index = new HashMap<>();
		this.lastUses = new HashMap<>();
	}

	/**
	 * Construct the top state, in which every loan of a function is active. It
	 * is the identity of {@link #merge(BorrowState)}.
	 *
	 * @param loans
	 * @return
	 */
	public static BorrowState top(List<Loan> loans) {
		BorrowState s = new BorrowState();
		for (Loan l : loans) {
			s.activate(l);
		}
		return s;
	}

	public void activate(Loan loan) {
		active.set(loan.id());
		BitSet ids = index.get(loan.owner());
		if (ids == null) {
			ids = new BitSet();
			index.put(loan.owner(), ids);
		}
		ids.set(loan.id());
	}

	/**
	 * Deactivate every loan in a given set.
	 */
	public void kill(BitSet loans) {
		active.andNot(loans);
		Iterator<BitSet> it = index.values().iterator();
		while (it.hasNext()) {
			BitSet ids = it.next();
			ids.andNot(loans);
			if (ids.isEmpty()) {
				it.remove();
			}
		}
	}

	/**
	 * Record a use of a place, replacing any earlier uses of it.
	 */
	public void recordUse(Place place, ProgramPoint point) {
		HashSet<ProgramPoint> points = new HashSet<>();
		points.add(point);
		lastUses.put(place, points);
	}

	/**
	 * Merge the state flowing along another edge into this one. Only loans
	 * active on both edges survive, whilst the recorded uses of both are kept.
	 *
	 * @param other
	 * @return true if this state changed.
	 */
	public boolean merge(BorrowState other) {
		BitSet before = (BitSet) active.clone();
		active.and(other.active);
		boolean changed = !before.equals(active);
		BitSet removed = before;
		removed.andNot(active);
		if (!removed.isEmpty()) {
			kill(removed);
		}
		for (Map.Entry<Place, Set<ProgramPoint>> e : other.lastUses.entrySet()) {
			Set<ProgramPoint> mine = lastUses.get(e.getKey());
			if (mine == null) {
				lastUses.put(e.getKey(), new HashSet<>(e.getValue()));
				changed = true;
			} else {
				changed |= mine.addAll(e.getValue());
			}
		}
		return changed;
	}

	/**
	 * Overwrite this state with a copy of another.
	 */
	public void setTo(BorrowState other) {
		active.clear();
		active.or(other.active);
		index.clear();
		for (Map.Entry<Place, BitSet> e : other.index.entrySet()) {
			index.put(e.getKey(), (BitSet) e.getValue().clone());
		}
		lastUses.clear();
		for (Map.Entry<Place, Set<ProgramPoint>> e : other.lastUses.entrySet()) {
			lastUses.put(e.getKey(), new HashSet<>(e.getValue()));
		}
	}

	public BorrowState copy() {
		BorrowState s = new BorrowState();
		s.setTo(this);
		return s;
	}

	public boolean isActive(int loan) {
		return active.get(loan);
	}

	public BitSet activeLoans() {
		return (BitSet) active.clone();
	}

	/**
	 * Get the active loans whose owner is exactly a given place.
	 */
	public BitSet loansOf(Place place) {
		BitSet ids = index.get(place);
		return ids == null ? new BitSet() : (BitSet) ids.clone();
	}

	/**
	 * Get the most recent uses of a place. Where the uses recorded along
	 * different paths are ordered, only the later one is returned.
	 *
	 * @param place
	 * @param info  Reachability used to order the recorded points.
	 * @return
	 */
	public Set<ProgramPoint> lastUses(Place place, DominanceInfo info) {
		Set<ProgramPoint> points = lastUses.get(place);
		if (points == null) {
			return Collections.emptySet();
		}
		return info.lastUses(points);
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof BorrowState) {
			BorrowState s = (BorrowState) o;
			return active.equals(s.active) && lastUses.equals(s.lastUses);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return active.hashCode();
	}

	@Override
	public String toString() {
		return "{active=" + active + ", uses=" + lastUses + "}";
	}
}
