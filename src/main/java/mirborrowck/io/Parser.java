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
package mirborrowck.io;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import mirborrowck.core.BorrowKind;
import mirborrowck.core.Syntax.Block;
import mirborrowck.core.Syntax.Function;
import mirborrowck.core.Syntax.Module;
import mirborrowck.core.Syntax.Operand;
import mirborrowck.core.Syntax.Parameter;
import mirborrowck.core.Syntax.Place;
import mirborrowck.core.Syntax.Rvalue;
import mirborrowck.core.Syntax.Signature;
import mirborrowck.core.Syntax.Stmt;
import mirborrowck.core.Syntax.Terminator;
import mirborrowck.io.Lexer.*;
import mirborrowck.util.SyntacticElement.Attribute;
import mirborrowck.util.SyntaxError;

/**
 * Parses the textual form of MIR into a module. For example:
 *
 * <pre>
 * extern fn f(a: &amp;mut, b: &amp;mut);
 *
 * fn g(p: &amp;) {
 *   bb0: {
 *     x = 1;
 *     y = &amp;mut x;
 *     call f(y, @counter) -&gt; z;
 *     return;
 *   }
 * }
 * </pre>
 *
 * Locals are introduced by their first mention, with parameters numbered
 * first. Globals (prefixed with <code>@</code>) are shared by all functions of
 * the module.
 */
public class Parser {
	private final String sourcefile;
	private final String source;
	private final ArrayList<Token> tokens;
	private final Map<String, Place.Global> globals = new HashMap<>();
	private int index;

	public Parser(String sourcefile, String source, List<Token> tokens) {
		this.sourcefile = sourcefile;
		this.source = source;
		this.tokens = new ArrayList<>(tokens);
	}

	/**
	 * Parse some text held in memory.
	 */
	public static Module parse(String text) {
		Lexer lexer = Lexer.of(text);
		return new Parser(null, lexer.source(), lexer.scan()).parseModule();
	}

	/**
	 * Parse a module of zero or more functions and external declarations, of
	 * the form:
	 *
	 * <pre>
	 * Module ::= (Function | 'extern' Signature ';')*
	 * </pre>
	 *
	 * @return
	 */
	public Module parseModule() {
		Module module = new Module();
		while (index < tokens.size()) {
			if (tokens.get(index).text.equals("extern")) {
				matchKeyword("extern");
				module.declare(parseSignature(new Context()));
				match(";");
			} else {
				Function f = parseFunction();
				if (module.function(f.name()) != null) {
					syntaxError("function " + f.name() + " already declared", f);
				}
				module.add(f);
			}
		}
		return module;
	}

	/**
	 * Parse a function definition, of the form:
	 *
	 * <pre>
	 * Function ::= Signature '{' Block* '}'
	 * </pre>
	 *
	 * @return
	 */
	public Function parseFunction() {
		int start = index;
		Context context = new Context();
		Signature signature = parseSignature(context);
		match("{");
		ArrayList<Block> blocks = new ArrayList<>();
		while (index < tokens.size() && !(tokens.get(index) instanceof RightCurly)) {
			blocks.add(parseBlock(context));
		}
		match("}");
		return new Function(signature, blocks.toArray(new Block[blocks.size()]), sourceAttr(start, index - 1));
	}

	/**
	 * Parse a function signature, declaring its parameters in the given
	 * context:
	 *
	 * <pre>
	 * Signature ::= 'fn' Ident '(' [Param (',' Param)*] ')'
	 * Param ::= Ident [':' '&amp;' ['mut']]
	 * </pre>
	 *
	 * @return
	 */
	public Signature parseSignature(Context context) {
		matchKeyword("fn");
		Identifier name = matchIdentifier();
		match("(");
		ArrayList<Parameter> parameters = new ArrayList<>();
		boolean firstTime = true;
		while (index < tokens.size() && !(tokens.get(index) instanceof RightBrace)) {
			if (!firstTime) {
				match(",");
			}
			firstTime = false;
			Identifier p = matchIdentifier();
			if (context.isDeclared(p.text)) {
				syntaxError("parameter " + p.text + " already declared", p);
			}
			Parameter.Mode mode = Parameter.Mode.OWNED;
			if (tryMatch(Colon.class)) {
				match("&");
				mode = tryMatch("mut") ? Parameter.Mode.MUTABLE : Parameter.Mode.SHARED;
			}
			context.declare(p.text);
			parameters.add(new Parameter(p.text, mode));
		}
		match(")");
		return new Signature(name.text, parameters.toArray(new Parameter[parameters.size()]));
	}

	/**
	 * Parse a basic block, of the form:
	 *
	 * <pre>
	 * Block ::= Ident ':' '{' Stmt* Terminator '}'
	 * </pre>
	 *
	 * @return
	 */
	public Block parseBlock(Context context) {
		Identifier label = matchIdentifier();
		match(":");
		match("{");
		ArrayList<Stmt> stmts = new ArrayList<>();
		Terminator terminator = null;
		while (terminator == null) {
			checkNotEof();
			if (isTerminatorStart(tokens.get(index))) {
				terminator = parseTerminator(context);
			} else {
				stmts.add(parseStatement(context));
			}
		}
		match("}");
		return new Block(label.text, stmts.toArray(new Stmt[stmts.size()]), terminator);
	}

	private static boolean isTerminatorStart(Token t) {
		if (t instanceof Keyword) {
			switch (t.text) {
			case "goto":
			case "if":
			case "switch":
			case "return":
			case "unreachable":
				return true;
			}
		}
		return false;
	}

	/**
	 * Parse a statement, of the form:
	 *
	 * <pre>
	 * Stmt ::= Place '=' Rvalue ';'
	 *        | 'use' Place ';'
	 *        | 'drop' Place ';'
	 *        | 'nop' ';'
	 *        | 'call' Ident '(' [Operand (',' Operand)*] ')' ['-&gt;' Place] ';'
	 * </pre>
	 *
	 * @return
	 */
	public Stmt parseStatement(Context context) {
		int start = index;
		Token lookahead = tokens.get(index);
		Stmt s;
		if (lookahead.text.equals("use")) {
			matchKeyword("use");
			Place p = parsePlace(context);
			s = new Stmt.Use(p, sourceAttr(start, index - 1));
		} else if (lookahead.text.equals("drop")) {
			matchKeyword("drop");
			Place p = parsePlace(context);
			s = new Stmt.Drop(p, sourceAttr(start, index - 1));
		} else if (lookahead.text.equals("nop")) {
			matchKeyword("nop");
			s = new Stmt.Nop(sourceAttr(start, index - 1));
		} else if (lookahead.text.equals("call")) {
			s = parseCall(context);
		} else {
			Place lhs = parsePlace(context);
			match("=");
			Rvalue rhs = parseRvalue(context);
			s = new Stmt.Assign(lhs, rhs, sourceAttr(start, index - 1));
		}
		match(";");
		return s;
	}

	public Stmt.Call parseCall(Context context) {
		int start = index;
		matchKeyword("call");
		Identifier callee = matchIdentifier();
		match("(");
		ArrayList<Operand> arguments = new ArrayList<>();
		boolean firstTime = true;
		while (index < tokens.size() && !(tokens.get(index) instanceof RightBrace)) {
			if (!firstTime) {
				match(",");
			}
			firstTime = false;
			arguments.add(parseOperand(context));
		}
		match(")");
		Place destination = null;
		if (tryMatch(Arrow.class)) {
			destination = parsePlace(context);
		}
		return new Stmt.Call(callee.text, arguments.toArray(new Operand[arguments.size()]), destination,
				sourceAttr(start, index - 1));
	}

	/**
	 * Parse a terminator, of the form:
	 *
	 * <pre>
	 * Terminator ::= 'goto' Ident ';'
	 *              | 'if' Operand 'goto' Ident 'else' Ident ';'
	 *              | 'switch' Operand '[' [Int ':' Ident (',' Int ':' Ident)*] ']' 'otherwise' Ident ';'
	 *              | 'return' [Operand] ';'
	 *              | 'unreachable' ';'
	 * </pre>
	 *
	 * @return
	 */
	public Terminator parseTerminator(Context context) {
		int start = index;
		Token lookahead = tokens.get(index);
		Terminator t;
		switch (lookahead.text) {
		case "goto": {
			matchKeyword("goto");
			Identifier target = matchIdentifier();
			t = new Terminator.Goto(target.text, sourceAttr(start, index - 1));
			break;
		}
		case "if": {
			matchKeyword("if");
			Operand condition = parseOperand(context);
			matchKeyword("goto");
			Identifier trueTarget = matchIdentifier();
			matchKeyword("else");
			Identifier falseTarget = matchIdentifier();
			t = new Terminator.If(condition, trueTarget.text, falseTarget.text, sourceAttr(start, index - 1));
			break;
		}
		case "switch":
			t = parseSwitch(context);
			break;
		case "return": {
			matchKeyword("return");
			Operand operand = null;
			if (index < tokens.size() && !(tokens.get(index) instanceof SemiColon)) {
				operand = parseOperand(context);
			}
			t = new Terminator.Return(operand, sourceAttr(start, index - 1));
			break;
		}
		default:
			matchKeyword("unreachable");
			t = new Terminator.Unreachable(sourceAttr(start, index - 1));
		}
		match(";");
		return t;
	}

	private Terminator.Switch parseSwitch(Context context) {
		int start = index;
		matchKeyword("switch");
		Operand discriminant = parseOperand(context);
		match("[");
		ArrayList<Long> values = new ArrayList<>();
		ArrayList<String> cases = new ArrayList<>();
		boolean firstTime = true;
		while (index < tokens.size() && !(tokens.get(index) instanceof RightSquare)) {
			if (!firstTime) {
				match(",");
			}
			firstTime = false;
			Int value = match(Int.class, "an integer");
			if (values.contains(value.value)) {
				syntaxError("duplicate case " + value.value, value);
			}
			match(":");
			values.add(value.value);
			cases.add(matchIdentifier().text);
		}
		match("]");
		matchKeyword("otherwise");
		Identifier otherwise = matchIdentifier();
		long[] vs = new long[values.size()];
		for (int i = 0; i != vs.length; ++i) {
			vs[i] = values.get(i);
		}
		return new Terminator.Switch(discriminant, vs, cases.toArray(new String[cases.size()]), otherwise.text,
				sourceAttr(start, index - 1));
	}

	/**
	 * Parse the right-hand side of an assignment, of the form:
	 *
	 * <pre>
	 * Rvalue ::= '&amp;' ['mut' | 'uniq'] Place
	 *          | Operand [BinOp Operand]
	 * </pre>
	 *
	 * @return
	 */
	public Rvalue parseRvalue(Context context) {
		if (tryMatch(Ampersand.class)) {
			BorrowKind kind = BorrowKind.SHARED;
			if (tryMatch("mut")) {
				kind = BorrowKind.MUTABLE;
			} else if (tryMatch("uniq")) {
				kind = BorrowKind.UNIQUE;
			}
			return new Rvalue.Ref(kind, parsePlace(context));
		}
		Operand lhs = parseOperand(context);
		checkNotEof();
		Token t = tokens.get(index);
		if (t instanceof Operator || t instanceof Star || t instanceof Ampersand) {
			index = index + 1;
			Operand rhs = parseOperand(context);
			return new Rvalue.BinaryOp(t.text, lhs, rhs);
		}
		return new Rvalue.Use(lhs);
	}

	/**
	 * Parse an operand, of the form:
	 *
	 * <pre>
	 * Operand ::= ['-'] Int | 'move' Place | 'copy' Place | Place
	 * </pre>
	 *
	 * @return
	 */
	public Operand parseOperand(Context context) {
		checkNotEof();
		Token lookahead = tokens.get(index);
		if (lookahead instanceof Int) {
			index = index + 1;
			return new Operand.Constant(((Int) lookahead).value);
		} else if (lookahead.text.equals("-") && index + 1 < tokens.size() && tokens.get(index + 1) instanceof Int) {
			index = index + 2;
			return new Operand.Constant(-((Int) tokens.get(index - 1)).value);
		} else if (tryMatch("move")) {
			return new Operand.Move(parsePlace(context));
		} else if (tryMatch("copy")) {
			return new Operand.Copy(parsePlace(context));
		} else {
			return new Operand.Consume(parsePlace(context));
		}
	}

	/**
	 * Parse a place, of the form:
	 *
	 * <pre>
	 * Place ::= '*' Place
	 *         | Root ('.' Int | '.' 'len' | '.' 'data' | '[' (Int | Place) ']')*
	 * Root ::= Ident | '@' Ident | Region '[' Int '..' Int ']'
	 * Region ::= 'mem' | 'stack' | 'heap' Int
	 * </pre>
	 *
	 * Note that a dereference applies to the whole of the place which follows
	 * it.
	 *
	 * @return
	 */
	public Place parsePlace(Context context) {
		if (tryMatch(Star.class)) {
			return parsePlace(context).deref();
		}
		Place place = parseRoot(context);
		while (index < tokens.size()) {
			Token t = tokens.get(index);
			if (t instanceof Dot) {
				match(".");
				checkNotEof();
				Token e = tokens.get(index);
				if (e instanceof Int) {
					index = index + 1;
					place = place.field((int) ((Int) e).value);
				} else if (e.text.equals("len")) {
					index = index + 1;
					place = place.length();
				} else if (e.text.equals("data")) {
					index = index + 1;
					place = place.data();
				} else {
					syntaxError("expecting field index, 'len' or 'data', found '" + e.text + "'", e);
				}
			} else if (t instanceof LeftSquare && !isCaseList()) {
				match("[");
				checkNotEof();
				if (tokens.get(index) instanceof Int) {
					place = place.index((int) match(Int.class, "an integer").value);
				} else {
					place = place.index(parsePlace(context));
				}
				match("]");
			} else {
				break;
			}
		}
		return place;
	}

	private Place parseRoot(Context context) {
		if (tryMatch(At.class)) {
			Identifier name = matchIdentifier();
			Place.Global g = globals.get(name.text);
			if (g == null) {
				g = new Place.Global(globals.size(), name.text);
				globals.put(name.text, g);
			}
			return g;
		}
		Identifier name = matchIdentifier();
		Place.Memory.Base base = regionOf(name.text);
		if (base != null && isRegionBounds()) {
			match("[");
			Int from = match(Int.class, "an integer");
			match("..");
			Int to = match(Int.class, "an integer");
			if (to.value <= from.value || to.value > Integer.MAX_VALUE) {
				syntaxError("invalid region " + from.value + ".." + to.value, to);
			}
			match("]");
			return new Place.Memory(base, (int) from.value, (int) (to.value - from.value));
		}
		return context.local(name.text);
	}

	/**
	 * Check whether the upcoming tokens are the bounds of a region, rather than
	 * an index.
	 */
	private boolean isRegionBounds() {
		return index + 2 < tokens.size() && tokens.get(index) instanceof LeftSquare
				&& tokens.get(index + 1) instanceof Int && tokens.get(index + 2) instanceof DotDot;
	}

	/**
	 * Check whether the upcoming tokens are the cases of a switch, rather than
	 * an index.
	 */
	private boolean isCaseList() {
		if (index + 1 < tokens.size() && tokens.get(index + 1) instanceof RightSquare) {
			return true;
		}
		return index + 2 < tokens.size() && tokens.get(index + 1) instanceof Int
				&& tokens.get(index + 2) instanceof Colon;
	}

	private static Place.Memory.Base regionOf(String name) {
		if (name.equals("mem")) {
			return Place.Memory.Base.LINEAR;
		} else if (name.equals("stack")) {
			return Place.Memory.Base.STACK;
		} else if (name.matches("heap[0-9]+")) {
			return Place.Memory.Base.heap(Integer.parseInt(name.substring(4)));
		}
		return null;
	}

	private void checkNotEof() {
		if (index >= tokens.size()) {
			int end = source.length() - 1;
			throw new SyntaxError("unexpected end-of-file", sourcefile, source, end, end);
		}
		return;
	}

	private boolean tryMatch(String text) {
		if (index < tokens.size() && tokens.get(index).text.equals(text)) {
			index = index + 1;
			return true;
		}
		return false;
	}

	private boolean tryMatch(Class<? extends Token> c) {
		if (index < tokens.size() && c.isInstance(tokens.get(index))) {
			index = index + 1;
			return true;
		}
		return false;
	}

	private Token match(String op) {
		checkNotEof();
		Token t = tokens.get(index);
		if (!t.text.equals(op)) {
			syntaxError("expecting '" + op + "', found '" + t.text + "'", t);
		}
		index = index + 1;
		return t;
	}

	@SuppressWarnings("unchecked")
	private <T extends Token> T match(Class<T> c, String name) {
		checkNotEof();
		Token t = tokens.get(index);
		if (!c.isInstance(t)) {
			syntaxError("expecting " + name + ", found '" + t.text + "'", t);
		}
		index = index + 1;
		return (T) t;
	}

	private Identifier matchIdentifier() {
		checkNotEof();
		Token t = tokens.get(index);
		if (t instanceof Identifier) {
			Identifier i = (Identifier) t;
			index = index + 1;
			return i;
		}
		syntaxError("identifier expected", t);
		return null; // unreachable.
	}

	private Keyword matchKeyword(String keyword) {
		checkNotEof();
		Token t = tokens.get(index);
		if (t instanceof Keyword) {
			if (t.text.equals(keyword)) {
				index = index + 1;
				return (Keyword) t;
			}
		}
		syntaxError("keyword " + keyword + " expected.", t);
		return null;
	}

	private Attribute.Source sourceAttr(int start, int end) {
		Token t1 = tokens.get(start);
		Token t2 = tokens.get(end);
		return new Attribute.Source(t1.start, t2.end());
	}

	private void syntaxError(String msg, Function f) {
		Attribute.Source loc = f.attribute(Attribute.Source.class);
		throw new SyntaxError(msg, sourcefile, source, loc.start, loc.end);
	}

	private void syntaxError(String msg, Token t) {
		throw new SyntaxError(msg, sourcefile, source, t.start, t.end());
	}

	/**
	 * Maps the names of locals within the function being parsed to their slot.
	 */
	public static class Context {
		private final Map<String, Place.Local> environment = new HashMap<>();

		/**
		 * Check whether a given local is declared in this context or not.
		 *
		 * @param variable
		 * @return
		 */
		public boolean isDeclared(String variable) {
			return environment.containsKey(variable);
		}

		public Place.Local declare(String variable) {
			Place.Local l = new Place.Local(environment.size(), variable);
			environment.put(variable, l);
			return l;
		}

		/**
		 * Get the local of a given name, declaring it on first use.
		 */
		public Place.Local local(String variable) {
			Place.Local l = environment.get(variable);
			return l != null ? l : declare(variable);
		}
	}
}
