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
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import mirborrowck.core.Syntax.Place;
import mirborrowck.core.Syntax.Place.Data;
import mirborrowck.core.Syntax.Place.Deref;
import mirborrowck.core.Syntax.Place.Field;
import mirborrowck.core.Syntax.Place.Global;
import mirborrowck.core.Syntax.Place.Index;
import mirborrowck.core.Syntax.Place.Length;
import mirborrowck.core.Syntax.Place.Local;
import mirborrowck.core.Syntax.Place.Memory;
import mirborrowck.core.Syntax.Place.Projection;

/**
 * Decides whether two places may refer to overlapping memory. The analysis is
 * purely structural: it knows nothing about which place a reference points to,
 * so a dereference is assumed to reach anything its base reaches. Every query
 * is pure and symmetric.
 */
public class Aliasing {

	public enum Relation {
		/**
		 * The two places never share memory.
		 */
		DISJOINT,
		/**
		 * The two places are known to share memory.
		 */
		OVERLAP,
		/**
		 * The two places are assumed to share memory only because of a dynamic
		 * index or a dereference.
		 */
		UNKNOWN;

		/**
		 * Combine the relation of two bases with the relation of the elements
		 * projected from them.
		 */
		public Relation and(Relation other) {
			if (this == DISJOINT || other == DISJOINT) {
				return DISJOINT;
			} else if (this == UNKNOWN || other == UNKNOWN) {
				return UNKNOWN;
			} else {
				return OVERLAP;
			}
		}
	}

	/**
	 * Determine whether two places may alias.
	 */
	public static boolean mayAlias(Place a, Place b) {
		return relation(a, b) != Relation.DISJOINT;
	}

	/**
	 * Determine whether a place may alias any of a collection of places.
	 */
	public static boolean mayAliasAny(Place a, Collection<? extends Place> bs) {
		for (Place b : bs) {
			if (mayAlias(a, b)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Determine how two places are related. Both are viewed as a root followed by
	 * a path of elements. Elements at the same depth are compared pairwise and,
	 * when one path is longer, its extra elements select part of the shorter
	 * place (unless they pass through a dereference, in which case only aliasing
	 * can be assumed).
	 */
	public static Relation relation(Place a, Place b) {
		if (a.equals(b)) {
			return Relation.OVERLAP;
		}
		Relation r = rootRelation(a.root(), b.root());
		if (r == Relation.DISJOINT) {
			return r;
		}
		List<Place.Element> pa = path(a);
		List<Place.Element> pb = path(b);
		int n = Math.min(pa.size(), pb.size());
		for (int i = 0; i != n; ++i) {
			r = r.and(relation(pa.get(i), pb.get(i)));
			if (r == Relation.DISJOINT) {
				return r;
			}
		}
		List<Place.Element> rest = pa.size() > n ? pa.subList(n, pa.size()) : pb.subList(n, pb.size());
		for (Place.Element e : rest) {
			if (e instanceof Deref) {
				return r.and(Relation.UNKNOWN);
			}
		}
		return r;
	}

	/**
	 * Check whether one place is a prefix of another. That is, whether writing
	 * <code>outer</code> overwrites the whole of <code>inner</code>. For example,
	 * <code>x</code> covers <code>x.0[i]</code> but not the other way around.
	 */
	public static boolean covers(Place outer, Place inner) {
		if (outer instanceof Memory && inner instanceof Memory) {
			Memory o = (Memory) outer;
			Memory i = (Memory) inner;
			return o.base().equals(i.base()) && o.offset() <= i.offset() && i.end() <= o.end();
		}
		Place p = inner;
		while (true) {
			if (p.equals(outer)) {
				return true;
			} else if (p instanceof Projection) {
				p = ((Projection) p).base();
			} else {
				return false;
			}
		}
	}

	private static Relation rootRelation(Place a, Place b) {
		if (a instanceof Local && b instanceof Local) {
			return ((Local) a).index() == ((Local) b).index() ? Relation.OVERLAP : Relation.DISJOINT;
		} else if (a instanceof Global && b instanceof Global) {
			return ((Global) a).index() == ((Global) b).index() ? Relation.OVERLAP : Relation.DISJOINT;
		} else if (a instanceof Memory && b instanceof Memory) {
			Memory ma = (Memory) a;
			Memory mb = (Memory) b;
			if (ma.base().equals(mb.base()) && ma.offset() < mb.end() && mb.offset() < ma.end()) {
				return Relation.OVERLAP;
			}
			return Relation.DISJOINT;
		} else {
			return Relation.DISJOINT;
		}
	}

	private static Relation relation(Place.Element a, Place.Element b) {
		if (a instanceof Field && b instanceof Field) {
			return ((Field) a).index() == ((Field) b).index() ? Relation.OVERLAP : Relation.DISJOINT;
		} else if (a instanceof Index && b instanceof Index) {
			Index ia = (Index) a;
			Index ib = (Index) b;
			if (ia.isConstant() && ib.isConstant()) {
				return ia.constant() == ib.constant() ? Relation.OVERLAP : Relation.DISJOINT;
			}
			return Relation.UNKNOWN;
		} else if (a instanceof Deref && b instanceof Deref) {
			return Relation.OVERLAP;
		} else if (a instanceof Length && b instanceof Length) {
			return Relation.OVERLAP;
		} else if (a instanceof Data && b instanceof Data) {
			return Relation.OVERLAP;
		} else {
			return Relation.UNKNOWN;
		}
	}

	/**
	 * Get the projection elements of a place, from the root outwards.
	 */
	private static List<Place.Element> path(Place p) {
		ArrayList<Place.Element> elements = new ArrayList<>();
		while (p instanceof Projection) {
			Projection proj = (Projection) p;
			elements.add(proj.element());
			p = proj.base();
		}
		Collections.reverse(elements);
		return elements;
	}
}
