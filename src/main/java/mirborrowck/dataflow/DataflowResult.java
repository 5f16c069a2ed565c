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
package mirborrowck.dataflow;

import java.util.HashMap;
import java.util.Map;

import mirborrowck.core.Syntax.ProgramPoint;
import mirborrowck.util.AnalysisException;

/**
 * The facts holding immediately before and after each program point, along
 * with some counters describing how they were obtained.
 *
 * @param <Fact>
 */
public class DataflowResult<Fact> {
	private final Map<ProgramPoint, Fact> inFacts = new HashMap<>();
	private final Map<ProgramPoint, Fact> outFacts = new HashMap<>();
	private int iterations;
	private int updates;

	public Fact getInFact(ProgramPoint node) {
		return lookup(inFacts, node);
	}

	public Fact getOutFact(ProgramPoint node) {
		return lookup(outFacts, node);
	}

	public void setInFact(ProgramPoint node, Fact fact) {
		inFacts.put(node, fact);
	}

	public void setOutFact(ProgramPoint node, Fact fact) {
		outFacts.put(node, fact);
	}

	/**
	 * Number of nodes taken from the worklist during the most recent solve.
	 */
	public int iterations() {
		return iterations;
	}

	/**
	 * Number of times a node's fact changed during the most recent solve. This
	 * is zero when solving started from a fixpoint.
	 */
	public int updates() {
		return updates;
	}

	void reset() {
		iterations = 0;
		updates = 0;
	}

	void iterated() {
		iterations++;
	}

	void updated() {
		updates++;
	}

	private Fact lookup(Map<ProgramPoint, Fact> facts, ProgramPoint node) {
		Fact f = facts.get(node);
		if (f == null) {
			throw new AnalysisException(AnalysisException.Kind.INCONSISTENT_PROGRAM_POINTS,
					"no dataflow fact for program point " + node);
		}
		return f;
	}

	@Override
	public String toString() {
		return "in=" + inFacts + ", out=" + outFacts;
	}
}
