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
package mirborrowck.testing;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import org.junit.jupiter.api.Test;

import mirborrowck.core.Aliasing;
import mirborrowck.core.Aliasing.Relation;
import mirborrowck.core.Syntax.Place;
import mirborrowck.core.Syntax.Place.Global;
import mirborrowck.core.Syntax.Place.Index;
import mirborrowck.core.Syntax.Place.Local;
import mirborrowck.core.Syntax.Place.Memory;
import mirborrowck.core.Syntax.Place.Memory.Base;
import mirborrowck.core.Syntax.Place.Projection;

public class AliasingTests {
	private static final Local x = new Local(0, "x");
	private static final Local y = new Local(1, "y");
	private static final Local i = new Local(2, "i");
	private static final Local j = new Local(3, "j");
	private static final Global g = new Global(0, "g");

	@Test
	public void test_01() {
		assertEquals(Relation.OVERLAP, Aliasing.relation(x, x));
		assertEquals(Relation.DISJOINT, Aliasing.relation(x, y));
		assertEquals(Relation.DISJOINT, Aliasing.relation(x, g));
	}

	@Test
	public void test_02() {
		// Distinct fields of the same local never overlap
		assertEquals(Relation.DISJOINT, Aliasing.relation(x.field(0), x.field(1)));
		assertEquals(Relation.OVERLAP, Aliasing.relation(x.field(0), x.field(0)));
		assertEquals(Relation.OVERLAP, Aliasing.relation(x, x.field(0).field(1)));
		assertEquals(Relation.DISJOINT, Aliasing.relation(x.field(1), x.field(0).field(1)));
	}

	@Test
	public void test_03() {
		assertEquals(Relation.DISJOINT, Aliasing.relation(x.index(0), x.index(1)));
		assertEquals(Relation.OVERLAP, Aliasing.relation(x.index(1), x.index(1)));
		assertEquals(Relation.UNKNOWN, Aliasing.relation(x.index(i), x.index(j)));
		assertEquals(Relation.UNKNOWN, Aliasing.relation(x.index(0), x.index(i)));
		// A field mismatch outweighs a dynamic index
		assertEquals(Relation.DISJOINT, Aliasing.relation(x.field(0).index(i), x.field(1).index(j)));
		assertEquals(Relation.DISJOINT, Aliasing.relation(x.index(i), y.index(i)));
	}

	@Test
	public void test_04() {
		// Reaching through a pointer could land anywhere the pointer does
		assertEquals(Relation.UNKNOWN, Aliasing.relation(x, x.deref().field(0)));
		assertEquals(Relation.UNKNOWN, Aliasing.relation(x.field(0), x.field(0).deref()));
		assertEquals(Relation.OVERLAP, Aliasing.relation(x.deref(), x.deref()));
		assertEquals(Relation.DISJOINT, Aliasing.relation(x.field(1), x.field(0).deref()));
	}

	@Test
	public void test_05() {
		Memory m1 = new Memory(Base.LINEAR, 0, 4);
		Memory m2 = new Memory(Base.LINEAR, 2, 4);
		Memory m3 = new Memory(Base.LINEAR, 4, 4);
		assertEquals(Relation.OVERLAP, Aliasing.relation(m1, m2));
		assertEquals(Relation.OVERLAP, Aliasing.relation(m2, m3));
		assertEquals(Relation.DISJOINT, Aliasing.relation(m1, m3));
		assertEquals(Relation.DISJOINT, Aliasing.relation(m1, new Memory(Base.STACK, 0, 4)));
		assertEquals(Relation.DISJOINT, Aliasing.relation(new Memory(Base.heap(1), 0, 8), new Memory(Base.heap(2), 0, 8)));
		assertEquals(Relation.OVERLAP, Aliasing.relation(new Memory(Base.heap(1), 0, 8), new Memory(Base.heap(1), 7, 1)));
		assertEquals(Relation.DISJOINT, Aliasing.relation(m1, x));
	}

	@Test
	public void test_06() {
		try {
			new Memory(Base.LINEAR, 0, 0);
			fail("empty region accepted");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

	@Test
	public void test_12() {
		// Regions must lie within the addressable range
		try {
			new Memory(Base.LINEAR, -4, 4);
			fail("negative offset accepted");
		} catch (IllegalArgumentException e) {
			// expected
		}
		try {
			new Memory(Base.LINEAR, Integer.MAX_VALUE - 2, 4);
			fail("region past end of address range accepted");
		} catch (IllegalArgumentException e) {
			// expected
		}
		Memory m = new Memory(Base.LINEAR, Integer.MAX_VALUE - 4, 4);
		assertEquals(Integer.MAX_VALUE, m.end());
		assertEquals(Relation.OVERLAP, Aliasing.relation(m, new Memory(Base.LINEAR, Integer.MAX_VALUE - 1, 1)));
	}

	@Test
	public void test_13() {
		// Element sizes describe layout only
		Projection e2 = new Projection(x, new Index(2, 4));
		assertEquals(4, ((Index) e2.element()).elementSize());
		assertEquals(-1, ((Index) x.index(2).element()).elementSize());
		assertEquals(x.index(2), e2);
		assertEquals(Relation.DISJOINT, Aliasing.relation(e2, new Projection(x, new Index(3, 4))));
		assertEquals(Relation.UNKNOWN, Aliasing.relation(e2, new Projection(x, new Index(i, 4))));
		assertEquals(8, ((Index) new Projection(x, new Index(j, 8)).element()).elementSize());
	}

	@Test
	public void test_07() {
		assertEquals(Relation.OVERLAP, Aliasing.relation(g, g.field(1)));
		assertEquals(Relation.DISJOINT, Aliasing.relation(g, new Global(1)));
		assertEquals(Relation.DISJOINT, Aliasing.relation(g.field(0), new Local(0).field(0)));
	}

	@Test
	public void test_08() {
		List<Place> places = Arrays.asList(x, y, g, x.field(0), x.field(1), x.field(0).field(1), x.index(0),
				x.index(i), x.deref(), x.deref().field(2), x.length(), x.data(), new Memory(Base.LINEAR, 0, 4),
				new Memory(Base.LINEAR, 2, 8), new Memory(Base.heap(3), 0, 4));
		for (Place a : places) {
			for (Place b : places) {
				assertEquals(a + " vs " + b, Aliasing.relation(a, b), Aliasing.relation(b, a));
			}
			assertEquals(Relation.OVERLAP, Aliasing.relation(a, a));
		}
	}

	@Test
	public void test_09() {
		assertTrue(Aliasing.mayAlias(x.index(i), x.index(j)));
		assertFalse(Aliasing.mayAlias(x.field(0), x.field(1)));
		assertTrue(Aliasing.mayAliasAny(x.field(0), Arrays.asList(y, x)));
		assertFalse(Aliasing.mayAliasAny(x.field(0), Arrays.asList(y, x.field(1))));
		assertFalse(Aliasing.mayAliasAny(x, Collections.<Place>emptyList()));
	}

	@Test
	public void test_10() {
		assertTrue(Aliasing.covers(x, x.field(0).index(i)));
		assertTrue(Aliasing.covers(x.field(0), x.field(0)));
		assertFalse(Aliasing.covers(x.field(0).index(i), x));
		assertFalse(Aliasing.covers(x.field(0), x.field(1)));
		assertTrue(Aliasing.covers(new Memory(Base.LINEAR, 0, 8), new Memory(Base.LINEAR, 2, 2)));
		assertFalse(Aliasing.covers(new Memory(Base.LINEAR, 2, 2), new Memory(Base.LINEAR, 0, 8)));
		assertFalse(Aliasing.covers(new Memory(Base.LINEAR, 0, 8), new Memory(Base.STACK, 2, 2)));
	}

	@Test
	public void test_11() {
		Place p = x.index(i).field(0).index(j);
		assertEquals(new HashSet<>(Arrays.asList(i, j)), new HashSet<>(p.dynamicIndices()));
		assertEquals(Arrays.asList(x.field(0)), x.field(0).deref().field(1).dereferencedPointers());
		assertTrue(x.field(0).dynamicIndices().isEmpty());
		assertEquals(x, p.root());
	}
}
