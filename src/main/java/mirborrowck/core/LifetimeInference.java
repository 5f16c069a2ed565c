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
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import mirborrowck.cfg.DominanceInfo;
import mirborrowck.core.Syntax.Function;
import mirborrowck.core.Syntax.Place;
import mirborrowck.core.Syntax.ProgramPoint;
import mirborrowck.util.AnalysisException;

/**
 * Relates loans to the uses of their borrowers, using dominance and
 * reachability rather than program-point order.
 */
public class LifetimeInference {
	public final static String UNSOUND_LOAN = "loan %s is used at %s on a path which does not create it";

	private final DominanceInfo info;
	private final Map<ProgramPoint, Events> events;
	private final Map<ProgramPoint, BitSet> liveIn;

	/**
	 * @param info   Dominance facts of the function's graph.
	 * @param events Events of every program point.
	 * @param liveIn Loans live on entry to each program point.
	 */
	public LifetimeInference(DominanceInfo info, Map<ProgramPoint, Events> events, Map<ProgramPoint, BitSet> liveIn) {
		this.info = info;
		this.events = events;
		this.liveIn = liveIn;
	}

	/**
	 * Check that every use of a loan is preceded by its creation. The uses of a
	 * loan are the points which read its borrower whilst the loan is live. Each
	 * must be dominated by the loan's origin or, when the borrower is assigned in
	 * several places, by the set of those assignments. Parameters and places
	 * outside the function's locals are assigned on entry and so are exempt.
	 *
	 * @param function
	 * @param loans
	 */
	public void validate(Function function, List<Loan> loans) {
		for (Loan l : loans) {
			Place borrower = l.borrower();
			if (borrower == null || !(borrower.root() instanceof Place.Local)
					|| function.isParameter(borrower.root())) {
				continue;
			}
			Set<ProgramPoint> definitions = definitionsOf(borrower);
			definitions.add(l.origin());
			for (ProgramPoint u : usesOf(l)) {
				if (!info.dominates(definitions, u)) {
					throw new AnalysisException(AnalysisException.Kind.UNSOUND_LOAN,
							String.format(UNSOUND_LOAN, l, u));
				}
			}
		}
	}

	/**
	 * Attach to each loan the last use of its borrower, where that is unique.
	 *
	 * @param loans
	 * @return
	 */
	public List<Loan> inferLastUses(List<Loan> loans) {
		ArrayList<Loan> r = new ArrayList<>();
		for (Loan l : loans) {
			if (l.borrower() != null && l.kind().isBorrow()) {
				Set<ProgramPoint> last = info.lastUses(usesOf(l));
				if (last.size() == 1) {
					l = l.withLastUse(last.iterator().next());
				}
			}
			r.add(l);
		}
		return r;
	}

	/**
	 * Get the points which read the borrower of a loan whilst it is live.
	 */
	public List<ProgramPoint> usesOf(Loan loan) {
		ArrayList<ProgramPoint> uses = new ArrayList<>();
		if (loan.borrower() == null) {
			return uses;
		}
		for (Map.Entry<ProgramPoint, Events> e : events.entrySet()) {
			BitSet live = liveIn.get(e.getKey());
			if (live != null && live.get(loan.id())
					&& Aliasing.mayAliasAny(loan.borrower(), e.getValue().accesses())) {
				uses.add(e.getKey());
			}
		}
		return uses;
	}

	private Set<ProgramPoint> definitionsOf(Place place) {
		HashSet<ProgramPoint> r = new HashSet<>();
		for (Map.Entry<ProgramPoint, Events> e : events.entrySet()) {
			for (Place p : e.getValue().reassigns()) {
				if (Aliasing.covers(p, place)) {
					r.add(e.getKey());
				}
			}
		}
		return r;
	}
}
