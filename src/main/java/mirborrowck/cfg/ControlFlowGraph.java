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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import mirborrowck.core.Syntax.Block;
import mirborrowck.core.Syntax.Function;
import mirborrowck.core.Syntax.ProgramPoint;
import mirborrowck.util.AnalysisException;

/**
 * A control-flow graph whose nodes are program points. Each node also carries
 * the borrow state computed for it, which later passes (e.g. drop insertion)
 * consume. The entry points are the designated entries plus every node without
 * predecessors; the exit points are the nodes without successors.
 */
public class ControlFlowGraph implements Iterable<ProgramPoint> {
	private final List<ProgramPoint> nodes;
	private final Map<ProgramPoint, List<ProgramPoint>> successors;
	private final Map<ProgramPoint, List<ProgramPoint>> predecessors;
	private final Set<ProgramPoint> entries;
	private final Set<ProgramPoint> exits;
	private final Map<ProgramPoint, BorrowState> states = new HashMap<>();

	private ControlFlowGraph(Builder builder) {
		this.nodes = Collections.unmodifiableList(new ArrayList<>(builder.successors.keySet()));
		this.successors = builder.successors;
		this.predecessors = builder.predecessors;
		this.entries = new LinkedHashSet<>();
		this.exits = new LinkedHashSet<>();
		for (ProgramPoint p : builder.entries) {
			entries.add(p);
		}
		for (ProgramPoint p : nodes) {
			if (predecessors.get(p).isEmpty()) {
				entries.add(p);
			}
			if (successors.get(p).isEmpty()) {
				exits.add(p);
			}
			states.put(p, new BorrowState());
		}
	}

	/**
	 * Reconstruct the control-flow graph of a function from its block
	 * terminators. Within a block each statement flows to the next, and the
	 * terminator flows to the first point of each target block.
	 *
	 * @param function
	 * @return
	 */
	public static ControlFlowGraph of(Function function) {
		Builder builder = new Builder();
		for (ProgramPoint p : function.points()) {
			builder.addNode(p);
		}
		for (Block b : function.blocks()) {
			ProgramPoint last = null;
			for (int i = 0; i <= b.statements().length; ++i) {
				ProgramPoint p = last == null ? function.entryOf(b.label()) : function.next(last);
				if (last != null) {
					builder.addEdge(last, p);
				}
				last = p;
			}
			for (String target : b.terminator().targets()) {
				if (function.block(target) == null) {
					throw new AnalysisException(AnalysisException.Kind.MALFORMED_INPUT,
							"jump to unknown block " + target + " in " + function.name());
				}
				builder.addEdge(last, function.entryOf(target));
			}
		}
		if (function.entry() != null) {
			builder.addEntry(function.entry());
		}
		return builder.build();
	}

	public boolean isEmpty() {
		return nodes.isEmpty();
	}

	public int size() {
		return nodes.size();
	}

	public boolean contains(ProgramPoint p) {
		return successors.containsKey(p);
	}

	@Override
	public Iterator<ProgramPoint> iterator() {
		return nodes.iterator();
	}

	public List<ProgramPoint> getSuccsOf(ProgramPoint p) {
		return Collections.unmodifiableList(lookup(successors, p));
	}

	public List<ProgramPoint> getPredsOf(ProgramPoint p) {
		return Collections.unmodifiableList(lookup(predecessors, p));
	}

	public Set<ProgramPoint> entryPoints() {
		return Collections.unmodifiableSet(entries);
	}

	public Set<ProgramPoint> exitPoints() {
		return Collections.unmodifiableSet(exits);
	}

	public boolean isEntry(ProgramPoint p) {
		return entries.contains(p);
	}

	public boolean isExit(ProgramPoint p) {
		return exits.contains(p);
	}

	/**
	 * Get the borrow state attached to a node. It is updated in place as
	 * analysis results are merged into it.
	 */
	public BorrowState stateOf(ProgramPoint p) {
		lookup(successors, p);
		return states.get(p);
	}

	/**
	 * Order the nodes so that, ignoring back edges, every node comes after its
	 * predecessors. Nodes not reachable from an entry come last.
	 *
	 * @return
	 */
	public List<ProgramPoint> reversePostOrder() {
		ArrayList<ProgramPoint> postorder = new ArrayList<>();
		HashSet<ProgramPoint> visited = new HashSet<>();
		for (ProgramPoint e : entries) {
			depthFirst(e, visited, postorder);
		}
		for (ProgramPoint p : nodes) {
			depthFirst(p, visited, postorder);
		}
		Collections.reverse(postorder);
		return postorder;
	}

	private void depthFirst(ProgramPoint root, Set<ProgramPoint> visited, List<ProgramPoint> postorder) {
		if (!visited.add(root)) {
			return;
		}
		// Each frame holds a node and the index of its next successor to visit.
		Deque<Object[]> stack = new ArrayDeque<>();
		stack.push(new Object[] { root, 0 });
		while (!stack.isEmpty()) {
			Object[] frame = stack.peek();
			ProgramPoint node = (ProgramPoint) frame[0];
			int next = (Integer) frame[1];
			List<ProgramPoint> succs = successors.get(node);
			if (next < succs.size()) {
				frame[1] = next + 1;
				ProgramPoint s = succs.get(next);
				if (visited.add(s)) {
					stack.push(new Object[] { s, 0 });
				}
			} else {
				stack.pop();
				postorder.add(node);
			}
		}
	}

	private List<ProgramPoint> lookup(Map<ProgramPoint, List<ProgramPoint>> edges, ProgramPoint p) {
		List<ProgramPoint> r = edges.get(p);
		if (r == null) {
			throw new AnalysisException(AnalysisException.Kind.INCONSISTENT_PROGRAM_POINTS,
					"program point " + p + " is not in the control-flow graph");
		}
		return r;
	}

	@Override
	public String toString() {
		String r = "";
		for (ProgramPoint p : nodes) {
			r += p + " -> " + successors.get(p) + "\n";
		}
		return r;
	}

	/**
	 * Constructs a control-flow graph directly from nodes and edges, for
	 * producers which already know the graph.
	 */
	public static class Builder {
		private final Map<ProgramPoint, List<ProgramPoint>> successors = new LinkedHashMap<>();
		private final Map<ProgramPoint, List<ProgramPoint>> predecessors = new HashMap<>();
		private final List<ProgramPoint> entries = new ArrayList<>();

		public Builder addNode(ProgramPoint p) {
			if (!successors.containsKey(p)) {
				successors.put(p, new ArrayList<>());
				predecessors.put(p, new ArrayList<>());
			}
			return this;
		}

		public Builder addEdge(ProgramPoint from, ProgramPoint to) {
			check(from);
			check(to);
			List<ProgramPoint> succs = successors.get(from);
			if (!succs.contains(to)) {
				succs.add(to);
				predecessors.get(to).add(from);
			}
			return this;
		}

		/**
		 * Mark a node as an entry point even if it has predecessors (e.g. a
		 * function whose first block is a loop header).
		 */
		public Builder addEntry(ProgramPoint p) {
			check(p);
			entries.add(p);
			return this;
		}

		public ControlFlowGraph build() {
			return new ControlFlowGraph(this);
		}

		private void check(ProgramPoint p) {
			if (!successors.containsKey(p)) {
				throw new AnalysisException(AnalysisException.Kind.INCONSISTENT_PROGRAM_POINTS,
						"edge refers to unknown program point " + p);
			}
		}
	}
}
