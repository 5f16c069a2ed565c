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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import mirborrowck.util.AnalysisException;
import mirborrowck.util.SyntacticElement;
import mirborrowck.util.SyntacticElement.Attribute;

/**
 * The mid-level intermediate representation (MIR) analysed by the borrow
 * checker. A function is a list of basic blocks, each holding zero or more
 * statements and exactly one terminator. Every statement and terminator owns a
 * distinct program point.
 */
public class Syntax {
	// Statements
	public final static int STMT_assign = 0;
	public final static int STMT_call = 1;
	public final static int STMT_drop = 2;
	public final static int STMT_use = 3;
	public final static int STMT_nop = 4;
	// Terminators
	public final static int TERM_goto = 10;
	public final static int TERM_if = 11;
	public final static int TERM_switch = 12;
	public final static int TERM_return = 13;
	public final static int TERM_unreachable = 14;

	/**
	 * Identifies one statement or terminator within a function. The identifier
	 * is opaque: its numeric order says nothing about execution order and must
	 * never be used as a stand-in for it.
	 */
	public static final class ProgramPoint implements Comparable<ProgramPoint> {
		private final int id;

		public ProgramPoint(int id) {
			this.id = id;
		}

		public int id() {
			return id;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof ProgramPoint && ((ProgramPoint) o).id == id;
		}

		@Override
		public int hashCode() {
			return id;
		}

		/**
		 * Ordering used only to produce deterministic output.
		 */
		@Override
		public int compareTo(ProgramPoint o) {
			return Integer.compare(id, o.id);
		}

		@Override
		public String toString() {
			return "p" + id;
		}
	}

	// ======================================================================
	// Places
	// ======================================================================

	/**
	 * A memory location which can be read, written, moved or borrowed. Every
	 * place has a root (a local slot, a global slot or a region of bytes) wrapped
	 * in zero or more projections. Places are immutable and compared
	 * structurally.
	 */
	public static abstract class Place {

		/**
		 * Get the root of this place, i.e. the place with all projections
		 * stripped.
		 */
		public abstract Place root();

		public boolean isRoot() {
			return root() == this;
		}

		/**
		 * Get the places used as dynamic indices anywhere within this place. For
		 * example, <code>x[i].0[j]</code> gives <code>i</code> and <code>j</code>.
		 */
		public List<Place> dynamicIndices() {
			ArrayList<Place> indices = new ArrayList<>();
			Place p = this;
			while (p instanceof Projection) {
				Projection proj = (Projection) p;
				if (proj.element instanceof Index && !((Index) proj.element).isConstant()) {
					Place index = ((Index) proj.element).place();
					indices.add(index);
					indices.addAll(index.dynamicIndices());
				}
				p = proj.base;
			}
			return indices;
		}

		/**
		 * Get the pointers which must be read in order to locate this place. For
		 * example, <code>*x.0</code> requires reading <code>x.0</code>.
		 */
		public List<Place> dereferencedPointers() {
			ArrayList<Place> pointers = new ArrayList<>();
			Place p = this;
			while (p instanceof Projection) {
				Projection proj = (Projection) p;
				if (proj.element instanceof Deref) {
					pointers.add(proj.base);
				}
				p = proj.base;
			}
			return pointers;
		}

		public Projection field(int index) {
			return new Projection(this, new Field(index));
		}

		public Projection index(Place index) {
			return new Projection(this, new Index(index));
		}

		public Projection index(int index) {
			return new Projection(this, new Index(index));
		}

		public Projection deref() {
			return new Projection(this, Deref.INSTANCE);
		}

		public Projection length() {
			return new Projection(this, Length.INSTANCE);
		}

		public Projection data() {
			return new Projection(this, Data.INSTANCE);
		}

		/**
		 * A local variable slot. Function parameters occupy the first slots.
		 */
		public static class Local extends Place {
			private final int index;
			private final String name;

			public Local(int index) {
				this(index, null);
			}

			public Local(int index, String name) {
				this.index = index;
				this.name = name;
			}

			public int index() {
				return index;
			}

			public String name() {
				return name;
			}

			@Override
			public Place root() {
				return this;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Local && ((Local) o).index == index;
			}

			@Override
			public int hashCode() {
				return index;
			}

			@Override
			public String toString() {
				return name != null ? name : ("_" + index);
			}
		}

		/**
		 * A global variable slot.
		 */
		public static class Global extends Place {
			private final int index;
			private final String name;

			public Global(int index) {
				this(index, null);
			}

			public Global(int index, String name) {
				this.index = index;
				this.name = name;
			}

			public int index() {
				return index;
			}

			@Override
			public Place root() {
				return this;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Global && ((Global) o).index == index;
			}

			@Override
			public int hashCode() {
				return 101 + index;
			}

			@Override
			public String toString() {
				return "@" + (name != null ? name : Integer.toString(index));
			}
		}

		/**
		 * A region of <code>size</code> bytes starting at <code>offset</code> from
		 * a given base.
		 */
		public static class Memory extends Place {
			private final Base base;
			private final int offset;
			private final int size;

			public Memory(Base base, int offset, int size) {
				if (size <= 0) {
					throw new IllegalArgumentException("invalid memory size: " + size);
				} else if (offset < 0 || (long) offset + size > Integer.MAX_VALUE) {
					throw new IllegalArgumentException("invalid memory region: " + offset + "+" + size);
				}
				this.base = base;
				this.offset = offset;
				this.size = size;
			}

			public Base base() {
				return base;
			}

			public int offset() {
				return offset;
			}

			public int size() {
				return size;
			}

			/**
			 * Offset one past the last byte of this region.
			 */
			public int end() {
				return offset + size;
			}

			@Override
			public Place root() {
				return this;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Memory) {
					Memory m = (Memory) o;
					return base.equals(m.base) && offset == m.offset && size == m.size;
				}
				return false;
			}

			@Override
			public int hashCode() {
				return base.hashCode() ^ (offset * 31 + size);
			}

			@Override
			public String toString() {
				return base + "[" + offset + ".." + end() + "]";
			}

			public static final class Base {
				public enum Kind {
					LINEAR, STACK, HEAP
				}

				public static final Base LINEAR = new Base(Kind.LINEAR, 0);
				public static final Base STACK = new Base(Kind.STACK, 0);

				private final Kind kind;
				private final int allocation;

				private Base(Kind kind, int allocation) {
					this.kind = kind;
					this.allocation = allocation;
				}

				public static Base heap(int allocation) {
					return new Base(Kind.HEAP, allocation);
				}

				public Kind kind() {
					return kind;
				}

				@Override
				public boolean equals(Object o) {
					if (o instanceof Base) {
						Base b = (Base) o;
						return kind == b.kind && allocation == b.allocation;
					}
					return false;
				}

				@Override
				public int hashCode() {
					return kind.hashCode() + allocation;
				}

				@Override
				public String toString() {
					switch (kind) {
					case LINEAR:
						return "mem";
					case STACK:
						return "stack";
					default:
						return "heap" + allocation;
					}
				}
			}
		}

		/**
		 * A place reached from another place through one projection element.
		 */
		public static class Projection extends Place {
			private final Place base;
			private final Element element;

			public Projection(Place base, Element element) {
				this.base = Objects.requireNonNull(base);
				this.element = Objects.requireNonNull(element);
			}

			public Place base() {
				return base;
			}

			public Element element() {
				return element;
			}

			@Override
			public Place root() {
				return base.root();
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Projection) {
					Projection p = (Projection) o;
					return base.equals(p.base) && element.equals(p.element);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return base.hashCode() * 31 + element.hashCode();
			}

			@Override
			public String toString() {
				if (element instanceof Deref) {
					return base.isRoot() ? "*" + base : "*(" + base + ")";
				}
				return base.toString() + element;
			}
		}

		public static abstract class Element {
		}

		/**
		 * A field of a struct or tuple, optionally with its byte layout.
		 */
		public static class Field extends Element {
			private final int index;
			private final int offset;
			private final int size;

			public Field(int index) {
				this(index, -1, -1);
			}

			public Field(int index, int offset, int size) {
				this.index = index;
				this.offset = offset;
				this.size = size;
			}

			public int index() {
				return index;
			}

			public int offset() {
				return offset;
			}

			public int size() {
				return size;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Field && ((Field) o).index == index;
			}

			@Override
			public int hashCode() {
				return index;
			}

			@Override
			public String toString() {
				return "." + index;
			}
		}

		/**
		 * An array element, selected either by a constant or by the value held in
		 * another place, optionally with the size in bytes of each element.
		 */
		public static class Index extends Element {
			private final Place place;
			private final int constant;
			private final int elementSize;

			public Index(Place place) {
				this(place, -1);
			}

			public Index(Place place, int elementSize) {
				this.place = Objects.requireNonNull(place);
				this.constant = -1;
				this.elementSize = elementSize;
			}

			public Index(int constant) {
				this(constant, -1);
			}

			public Index(int constant, int elementSize) {
				this.place = null;
				this.constant = constant;
				this.elementSize = elementSize;
			}

			public boolean isConstant() {
				return place == null;
			}

			public Place place() {
				return place;
			}

			public int constant() {
				return constant;
			}

			/**
			 * Size in bytes of each element, or <code>-1</code> when unknown.
			 */
			public int elementSize() {
				return elementSize;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Index) {
					Index i = (Index) o;
					return Objects.equals(place, i.place) && constant == i.constant;
				}
				return false;
			}

			@Override
			public int hashCode() {
				return place != null ? place.hashCode() : constant;
			}

			@Override
			public String toString() {
				return "[" + (place != null ? place.toString() : Integer.toString(constant)) + "]";
			}
		}

		public static class Deref extends Element {
			public static final Deref INSTANCE = new Deref();

			@Override
			public boolean equals(Object o) {
				return o instanceof Deref;
			}

			@Override
			public int hashCode() {
				return 1;
			}

			@Override
			public String toString() {
				return "*";
			}
		}

		public static class Length extends Element {
			public static final Length INSTANCE = new Length();

			@Override
			public boolean equals(Object o) {
				return o instanceof Length;
			}

			@Override
			public int hashCode() {
				return 2;
			}

			@Override
			public String toString() {
				return ".len";
			}
		}

		public static class Data extends Element {
			public static final Data INSTANCE = new Data();

			@Override
			public boolean equals(Object o) {
				return o instanceof Data;
			}

			@Override
			public int hashCode() {
				return 3;
			}

			@Override
			public String toString() {
				return ".data";
			}
		}
	}

	// ======================================================================
	// Operands & Rvalues
	// ======================================================================

	public static abstract class Operand {

		/**
		 * Get the place read by this operand, or <code>null</code> for a constant.
		 */
		public abstract Place place();

		/**
		 * Read a copy of the value held in a place.
		 */
		public static class Copy extends Operand {
			private final Place place;

			public Copy(Place place) {
				this.place = place;
			}

			@Override
			public Place place() {
				return place;
			}

			@Override
			public String toString() {
				return "copy " + place;
			}
		}

		/**
		 * Move the value out of a place, leaving it uninitialised.
		 */
		public static class Move extends Operand {
			private final Place place;

			public Move(Place place) {
				this.place = place;
			}

			@Override
			public Place place() {
				return place;
			}

			@Override
			public String toString() {
				return "move " + place;
			}
		}

		/**
		 * A consuming use whose final mode is not yet known. It becomes a move
		 * when the source is dead afterwards, and otherwise a shared borrow.
		 */
		public static class Consume extends Operand {
			private final Place place;

			public Consume(Place place) {
				this.place = place;
			}

			@Override
			public Place place() {
				return place;
			}

			@Override
			public String toString() {
				return place.toString();
			}
		}

		public static class Constant extends Operand {
			private final long value;

			public Constant(long value) {
				this.value = value;
			}

			public long value() {
				return value;
			}

			@Override
			public Place place() {
				return null;
			}

			@Override
			public String toString() {
				return Long.toString(value);
			}
		}
	}

	public static abstract class Rvalue {

		public static class Use extends Rvalue {
			private final Operand operand;

			public Use(Operand operand) {
				this.operand = operand;
			}

			public Operand operand() {
				return operand;
			}

			@Override
			public String toString() {
				return operand.toString();
			}
		}

		/**
		 * Create a reference to a place.
		 */
		public static class Ref extends Rvalue {
			private final BorrowKind kind;
			private final Place place;

			public Ref(BorrowKind kind, Place place) {
				if (!kind.isBorrow()) {
					throw new IllegalArgumentException("invalid reference kind: " + kind);
				}
				this.kind = kind;
				this.place = place;
			}

			public BorrowKind kind() {
				return kind;
			}

			public Place place() {
				return place;
			}

			@Override
			public String toString() {
				return kind.prefix() + place;
			}
		}

		public static class BinaryOp extends Rvalue {
			private final String operator;
			private final Operand lhs;
			private final Operand rhs;

			public BinaryOp(String operator, Operand lhs, Operand rhs) {
				this.operator = operator;
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public String operator() {
				return operator;
			}

			public Operand lhs() {
				return lhs;
			}

			public Operand rhs() {
				return rhs;
			}

			@Override
			public String toString() {
				return lhs + " " + operator + " " + rhs;
			}
		}
	}

	// ======================================================================
	// Statements & Terminators
	// ======================================================================

	/**
	 * Anything which occupies a program point.
	 */
	public static abstract class Instruction extends SyntacticElement.Impl {
		public Instruction(Attribute... attributes) {
			super(attributes);
		}

		public abstract int getOpcode();
	}

	public static abstract class Stmt extends Instruction {
		public Stmt(Attribute... attributes) {
			super(attributes);
		}

		public static class Assign extends Stmt {
			private final Place lhs;
			private final Rvalue rhs;

			public Assign(Place lhs, Rvalue rhs, Attribute... attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public int getOpcode() {
				return STMT_assign;
			}

			public Place leftOperand() {
				return lhs;
			}

			public Rvalue rightOperand() {
				return rhs;
			}

			@Override
			public String toString() {
				return lhs + " = " + rhs + ";";
			}
		}

		/**
		 * Call a named function. The callee's signature decides how each argument
		 * is accessed.
		 */
		public static class Call extends Stmt {
			private final String callee;
			private final Operand[] arguments;
			private final Place destination;

			public Call(String callee, Operand[] arguments, Place destination, Attribute... attributes) {
				super(attributes);
				this.callee = callee;
				this.arguments = arguments;
				this.destination = destination;
			}

			@Override
			public int getOpcode() {
				return STMT_call;
			}

			public String callee() {
				return callee;
			}

			public Operand[] arguments() {
				return arguments;
			}

			/**
			 * Place receiving the result, or <code>null</code> if discarded.
			 */
			public Place destination() {
				return destination;
			}

			@Override
			public String toString() {
				String r = "call " + callee + "(";
				for (int i = 0; i != arguments.length; ++i) {
					r += (i == 0 ? "" : ", ") + arguments[i];
				}
				r += ")";
				return destination == null ? r + ";" : r + " -> " + destination + ";";
			}
		}

		public static class Drop extends Stmt {
			private final Place place;

			public Drop(Place place, Attribute... attributes) {
				super(attributes);
				this.place = place;
			}

			@Override
			public int getOpcode() {
				return STMT_drop;
			}

			public Place place() {
				return place;
			}

			@Override
			public String toString() {
				return "drop " + place + ";";
			}
		}

		/**
		 * Read a place without consuming it (e.g. an inspection by an operation the
		 * lowering does not model further).
		 */
		public static class Use extends Stmt {
			private final Place place;

			public Use(Place place, Attribute... attributes) {
				super(attributes);
				this.place = place;
			}

			@Override
			public int getOpcode() {
				return STMT_use;
			}

			public Place place() {
				return place;
			}

			@Override
			public String toString() {
				return "use " + place + ";";
			}
		}

		public static class Nop extends Stmt {
			public Nop(Attribute... attributes) {
				super(attributes);
			}

			@Override
			public int getOpcode() {
				return STMT_nop;
			}

			@Override
			public String toString() {
				return "nop;";
			}
		}
	}

	public static abstract class Terminator extends Instruction {
		private static final String[] NO_TARGETS = new String[0];

		public Terminator(Attribute... attributes) {
			super(attributes);
		}

		/**
		 * Labels of the blocks control may transfer to.
		 */
		public String[] targets() {
			return NO_TARGETS;
		}

		public static class Goto extends Terminator {
			private final String target;

			public Goto(String target, Attribute... attributes) {
				super(attributes);
				this.target = target;
			}

			@Override
			public int getOpcode() {
				return TERM_goto;
			}

			@Override
			public String[] targets() {
				return new String[] { target };
			}

			@Override
			public String toString() {
				return "goto " + target + ";";
			}
		}

		public static class If extends Terminator {
			private final Operand condition;
			private final String trueTarget;
			private final String falseTarget;

			public If(Operand condition, String trueTarget, String falseTarget, Attribute... attributes) {
				super(attributes);
				this.condition = condition;
				this.trueTarget = trueTarget;
				this.falseTarget = falseTarget;
			}

			@Override
			public int getOpcode() {
				return TERM_if;
			}

			public Operand condition() {
				return condition;
			}

			@Override
			public String[] targets() {
				return new String[] { trueTarget, falseTarget };
			}

			@Override
			public String toString() {
				return "if " + condition + " goto " + trueTarget + " else " + falseTarget + ";";
			}
		}

		public static class Switch extends Terminator {
			private final Operand discriminant;
			private final long[] values;
			private final String[] cases;
			private final String otherwise;

			public Switch(Operand discriminant, long[] values, String[] cases, String otherwise,
					Attribute... attributes) {
				super(attributes);
				if (values.length != cases.length) {
					throw new IllegalArgumentException("switch values and cases differ in length");
				}
				this.discriminant = discriminant;
				this.values = values;
				this.cases = cases;
				this.otherwise = otherwise;
			}

			@Override
			public int getOpcode() {
				return TERM_switch;
			}

			public Operand discriminant() {
				return discriminant;
			}

			@Override
			public String[] targets() {
				String[] ts = Arrays.copyOf(cases, cases.length + 1);
				ts[cases.length] = otherwise;
				return ts;
			}

			@Override
			public String toString() {
				String r = "switch " + discriminant + " [";
				for (int i = 0; i != values.length; ++i) {
					r += (i == 0 ? "" : ", ") + values[i] + ": " + cases[i];
				}
				return r + "] otherwise " + otherwise + ";";
			}
		}

		public static class Return extends Terminator {
			private final Operand operand;

			public Return(Operand operand, Attribute... attributes) {
				super(attributes);
				this.operand = operand;
			}

			@Override
			public int getOpcode() {
				return TERM_return;
			}

			/**
			 * The returned value, or <code>null</code>.
			 */
			public Operand operand() {
				return operand;
			}

			@Override
			public String toString() {
				return operand == null ? "return;" : "return " + operand + ";";
			}
		}

		public static class Unreachable extends Terminator {
			public Unreachable(Attribute... attributes) {
				super(attributes);
			}

			@Override
			public int getOpcode() {
				return TERM_unreachable;
			}

			@Override
			public String toString() {
				return "unreachable;";
			}
		}
	}

	// ======================================================================
	// Blocks, Functions & Modules
	// ======================================================================

	public static class Block {
		private final String label;
		private final Stmt[] statements;
		private final Terminator terminator;

		public Block(String label, Stmt[] statements, Terminator terminator) {
			this.label = label;
			this.statements = statements;
			this.terminator = Objects.requireNonNull(terminator);
		}

		public String label() {
			return label;
		}

		public Stmt[] statements() {
			return statements;
		}

		public Terminator terminator() {
			return terminator;
		}

		@Override
		public String toString() {
			String r = label + ": {";
			for (Stmt s : statements) {
				r += " " + s;
			}
			return r + " " + terminator + " }";
		}
	}

	/**
	 * A function parameter. Reference parameters determine the borrow a caller
	 * performs on the corresponding argument.
	 */
	public static class Parameter {
		public enum Mode {
			OWNED, SHARED, MUTABLE
		}

		private final String name;
		private final Mode mode;

		public Parameter(String name, Mode mode) {
			this.name = name;
			this.mode = mode;
		}

		public String name() {
			return name;
		}

		public Mode mode() {
			return mode;
		}

		@Override
		public String toString() {
			switch (mode) {
			case SHARED:
				return name + ": &";
			case MUTABLE:
				return name + ": &mut";
			default:
				return name;
			}
		}
	}

	public static class Signature {
		private final String name;
		private final Parameter[] parameters;

		public Signature(String name, Parameter... parameters) {
			this.name = name;
			this.parameters = parameters;
		}

		public String name() {
			return name;
		}

		public Parameter[] parameters() {
			return parameters;
		}

		/**
		 * Determine how the argument in a given position is passed. Arguments
		 * beyond the declared parameters are owned.
		 */
		public Parameter.Mode modeOf(int argument) {
			return argument < parameters.length ? parameters[argument].mode() : Parameter.Mode.OWNED;
		}

		@Override
		public String toString() {
			String r = "fn " + name + "(";
			for (int i = 0; i != parameters.length; ++i) {
				r += (i == 0 ? "" : ", ") + parameters[i];
			}
			return r + ")";
		}
	}

	/**
	 * A function body together with its program-point table. Points are
	 * allocated in block order when the function is constructed: each statement
	 * receives one, followed by the block's terminator.
	 */
	public static class Function extends SyntacticElement.Impl {
		private final Signature signature;
		private final Block[] blocks;
		private final List<Loan> loans;
		private final List<ProgramPoint> points = new ArrayList<>();
		private final Map<ProgramPoint, Instruction> instructions = new HashMap<>();
		private final Map<String, Block> labels = new LinkedHashMap<>();
		private final Map<String, ProgramPoint> firstPoints = new HashMap<>();

		public Function(Signature signature, Block[] blocks, Attribute... attributes) {
			this(signature, blocks, null, attributes);
		}

		/**
		 * Construct a function whose loans have already been materialised by an
		 * earlier pass.
		 *
		 * @param loans Loan table indexed by loan identifier, or <code>null</code>
		 *              if loans should be derived from the function body.
		 */
		public Function(Signature signature, Block[] blocks, List<Loan> loans, Attribute... attributes) {
			super(attributes);
			this.signature = signature;
			this.blocks = blocks;
			this.loans = loans == null ? null : Collections.unmodifiableList(new ArrayList<>(loans));
			int id = 0;
			for (Block b : blocks) {
				if (labels.containsKey(b.label())) {
					throw new AnalysisException(AnalysisException.Kind.MALFORMED_INPUT,
							"duplicate block " + b.label() + " in " + signature.name());
				}
				labels.put(b.label(), b);
				for (Stmt s : b.statements()) {
					id = allocate(id, b, s);
				}
				id = allocate(id, b, b.terminator());
			}
		}

		private int allocate(int id, Block block, Instruction insn) {
			ProgramPoint p = new ProgramPoint(id);
			points.add(p);
			instructions.put(p, insn);
			if (!firstPoints.containsKey(block.label())) {
				firstPoints.put(block.label(), p);
			}
			return id + 1;
		}

		public String name() {
			return signature.name();
		}

		public Signature signature() {
			return signature;
		}

		public Block[] blocks() {
			return blocks;
		}

		/**
		 * Check whether a given local slot holds a parameter.
		 */
		public boolean isParameter(Place place) {
			return place instanceof Place.Local && ((Place.Local) place).index() < signature.parameters().length;
		}

		/**
		 * The loans supplied with this function, or <code>null</code> if there
		 * are none.
		 */
		public List<Loan> loans() {
			return loans;
		}

		/**
		 * All program points of this function, in allocation order.
		 */
		public List<ProgramPoint> points() {
			return Collections.unmodifiableList(points);
		}

		public boolean contains(ProgramPoint p) {
			return instructions.containsKey(p);
		}

		/**
		 * Get the statement or terminator at a given point.
		 */
		public Instruction instruction(ProgramPoint p) {
			Instruction insn = instructions.get(p);
			if (insn == null) {
				throw new AnalysisException(AnalysisException.Kind.INCONSISTENT_PROGRAM_POINTS,
						"unknown program point " + p + " in " + name());
			}
			return insn;
		}

		/**
		 * Get the block with a given label, or <code>null</code>.
		 */
		public Block block(String label) {
			return labels.get(label);
		}

		/**
		 * Get the first program point of a given block.
		 */
		public ProgramPoint entryOf(String label) {
			ProgramPoint p = firstPoints.get(label);
			if (p == null) {
				throw new AnalysisException(AnalysisException.Kind.MALFORMED_INPUT,
						"unknown block " + label + " in " + name());
			}
			return p;
		}

		/**
		 * The point at which execution begins, or <code>null</code> for an empty
		 * function.
		 */
		public ProgramPoint entry() {
			return points.isEmpty() ? null : points.get(0);
		}

		/**
		 * Get the point following a given point within the same block, or
		 * <code>null</code> if it is the block's terminator.
		 */
		public ProgramPoint next(ProgramPoint p) {
			if (instruction(p) instanceof Terminator) {
				return null;
			}
			return points.get(points.indexOf(p) + 1);
		}

		@Override
		public String toString() {
			String r = signature + " {";
			for (Block b : blocks) {
				r += "\n  " + b;
			}
			return r + "\n}";
		}
	}

	/**
	 * A collection of functions and external signatures which may call one
	 * another.
	 */
	public static class Module {
		private final Map<String, Signature> signatures = new LinkedHashMap<>();
		private final List<Function> functions = new ArrayList<>();

		public Module() {
		}

		public Module(Collection<Function> functions, Collection<Signature> externs) {
			for (Signature s : externs) {
				declare(s);
			}
			for (Function f : functions) {
				add(f);
			}
		}

		public void declare(Signature signature) {
			signatures.put(signature.name(), signature);
		}

		public void add(Function function) {
			declare(function.signature());
			functions.add(function);
		}

		public List<Function> functions() {
			return Collections.unmodifiableList(functions);
		}

		/**
		 * Find the function of a given name, or <code>null</code>.
		 */
		public Function function(String name) {
			for (Function f : functions) {
				if (f.name().equals(name)) {
					return f;
				}
			}
			return null;
		}

		/**
		 * Find the signature of a named callee, or <code>null</code> if unknown.
		 */
		public Signature signature(String name) {
			return signatures.get(name);
		}
	}
}
