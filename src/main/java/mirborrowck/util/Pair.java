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
// Copyright 2018, David James Pearce.
// Copyright 2026, the MIR Borrow Checker authors.
package mirborrowck.util;

import java.util.Objects;

/**
 * An immutable pair of items, such as the <code>(destination, source)</code>
 * flows recorded against each program point.
 *
 * @param <FIRST>  Type of first item
 * @param <SECOND> Type of second item
 */
public class Pair<FIRST, SECOND> {
	protected final FIRST first;
	protected final SECOND second;

	public Pair(FIRST f, SECOND s) {
		first = f;
		second = s;
	}

	public FIRST first() {
		return first;
	}

	public SECOND second() {
		return second;
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(first) * 31 + Objects.hashCode(second);
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Pair) {
			Pair<?, ?> p = (Pair<?, ?>) o;
			return Objects.equals(first, p.first) && Objects.equals(second, p.second);
		}
		return false;
	}

	@Override
	public String toString() {
		return "(" + first + ", " + second + ")";
	}
}
