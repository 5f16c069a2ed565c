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

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntFunction;

import mirborrowck.util.SyntaxError;

/**
 * Splits textual MIR into tokens. Whitespace, line comments and block
 * comments are dropped. Every token records the offset of its first character
 * so that errors can be reported against the source.
 */
public class Lexer {
	/**
	 * Words which can never be used as identifiers.
	 */
	public static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList("fn", "extern", "move", "copy", "mut",
			"uniq", "use", "drop", "nop", "call", "goto", "if", "else", "switch", "otherwise", "return",
			"unreachable"));

	private static final Map<Character, IntFunction<Token>> PUNCTUATION = new HashMap<>();

	static {
		PUNCTUATION.put('&', Ampersand::new);
		PUNCTUATION.put(',', Comma::new);
		PUNCTUATION.put(';', SemiColon::new);
		PUNCTUATION.put(':', Colon::new);
		PUNCTUATION.put('@', At::new);
		PUNCTUATION.put('(', LeftBrace::new);
		PUNCTUATION.put(')', RightBrace::new);
		PUNCTUATION.put('{', LeftCurly::new);
		PUNCTUATION.put('}', RightCurly::new);
		PUNCTUATION.put('[', LeftSquare::new);
		PUNCTUATION.put(']', RightSquare::new);
		PUNCTUATION.put('*', Star::new);
	}

	private static final String OPERATORS = "+-/%<>!|^";

	private String filename;
	private final String input;
	private int pos;

	public Lexer(String filename) throws IOException {
		this(new FileInputStream(filename));
		this.filename = filename;
	}

	public Lexer(InputStream in) throws IOException {
		this(new InputStreamReader(in, StandardCharsets.UTF_8));
	}

	public Lexer(Reader reader) throws IOException {
		StringBuilder text = new StringBuilder();
		char[] buffer = new char[4096];
		try (Reader r = reader) {
			int n;
			while ((n = r.read(buffer)) != -1) {
				text.append(buffer, 0, n);
			}
		}
		this.input = text.toString();
	}

	/**
	 * Construct a lexer for some text held in memory.
	 */
	public static Lexer of(String text) {
		try {
			return new Lexer(new StringReader(text));
		} catch (IOException e) {
			// StringReader does not throw
			throw new IllegalStateException(e);
		}
	}

	public String filename() {
		return filename;
	}

	/**
	 * The complete text being scanned, needed to report errors against it.
	 */
	public String source() {
		return input;
	}

	/**
	 * Turn the whole input into tokens.
	 *
	 * @return
	 */
	public List<Token> scan() {
		ArrayList<Token> tokens = new ArrayList<>();
		pos = 0;
		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (Character.isWhitespace(c)) {
				pos++;
			} else if (startsWith("//")) {
				skipLine();
			} else if (startsWith("/*")) {
				skipBlockComment();
			} else if (Character.isDigit(c)) {
				tokens.add(scanInt());
			} else if (Character.isJavaIdentifierStart(c)) {
				tokens.add(scanWord());
			} else {
				tokens.add(scanSymbol(c));
			}
		}
		return tokens;
	}

	private Int scanInt() {
		int start = pos;
		while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
			pos++;
		}
		String digits = input.substring(start, pos);
		try {
			return new Int(Long.parseLong(digits), digits, start);
		} catch (NumberFormatException e) {
			throw new SyntaxError("integer constant too large", filename, input, start, pos - 1);
		}
	}

	private Token scanWord() {
		int start = pos;
		while (pos < input.length() && Character.isJavaIdentifierPart(input.charAt(pos))) {
			pos++;
		}
		String word = input.substring(start, pos);
		return KEYWORDS.contains(word) ? new Keyword(word, start) : new Identifier(word, start);
	}

	private Token scanSymbol(char c) {
		int start = pos;
		// Two-character symbols take priority over their one-character prefixes
		if (startsWith("..")) {
			pos += 2;
			return new DotDot(start);
		} else if (startsWith("->")) {
			pos += 2;
			return new Arrow(start);
		} else if (startsWith("==") || startsWith("!=") || startsWith("<=") || startsWith(">=")) {
			pos += 2;
			return new Operator(input.substring(start, pos), start);
		}
		pos++;
		IntFunction<Token> punctuation = PUNCTUATION.get(c);
		if (punctuation != null) {
			return punctuation.apply(start);
		} else if (c == '.') {
			return new Dot(start);
		} else if (c == '=') {
			return new Equals(start);
		} else if (c != '!' && OPERATORS.indexOf(c) >= 0) {
			return new Operator(Character.toString(c), start);
		}
		throw new SyntaxError("unexpected character '" + c + "'", filename, input, start, start);
	}

	private boolean startsWith(String prefix) {
		return input.startsWith(prefix, pos);
	}

	private void skipLine() {
		int end = input.indexOf('\n', pos);
		pos = end < 0 ? input.length() : end + 1;
	}

	private void skipBlockComment() {
		int end = input.indexOf("*/", pos + 2);
		if (end < 0) {
			throw new SyntaxError("unterminated comment", filename, input, pos, input.length() - 1);
		}
		pos = end + 2;
	}

	/**
	 * A token is a piece of text at a given offset.
	 */
	public static abstract class Token {
		public final String text;
		public final int start;

		public Token(String text, int start) {
			this.text = text;
			this.start = start;
		}

		/**
		 * Offset of the last character of this token.
		 */
		public int end() {
			return start + text.length() - 1;
		}

		@Override
		public String toString() {
			return text;
		}
	}

	/**
	 * A non-negative integer literal. Negation is handled by the parser.
	 */
	public static class Int extends Token {
		public final long value;

		public Int(long value, String text, int start) {
			super(text, start);
			this.value = value;
		}
	}

	/**
	 * The name of a local, global, block or function.
	 */
	public static class Identifier extends Token {
		public Identifier(String text, int start) {
			super(text, start);
		}
	}

	public static class Keyword extends Token {
		public Keyword(String text, int start) {
			super(text, start);
		}
	}

	/**
	 * A binary operator other than those with a token of their own.
	 */
	public static class Operator extends Token {
		public Operator(String text, int start) {
			super(text, start);
		}
	}

	/**
	 * Fixed symbols, which are distinguished by their class.
	 */
	public static abstract class Symbol extends Token {
		Symbol(String text, int start) {
			super(text, start);
		}
	}

	public static class Ampersand extends Symbol {
		public Ampersand(int start) {
			super("&", start);
		}
	}

	public static class Comma extends Symbol {
		public Comma(int start) {
			super(",", start);
		}
	}

	public static class SemiColon extends Symbol {
		public SemiColon(int start) {
			super(";", start);
		}
	}

	public static class Colon extends Symbol {
		public Colon(int start) {
			super(":", start);
		}
	}

	public static class At extends Symbol {
		public At(int start) {
			super("@", start);
		}
	}

	public static class Dot extends Symbol {
		public Dot(int start) {
			super(".", start);
		}
	}

	public static class DotDot extends Symbol {
		public DotDot(int start) {
			super("..", start);
		}
	}

	public static class Arrow extends Symbol {
		public Arrow(int start) {
			super("->", start);
		}
	}

	public static class LeftBrace extends Symbol {
		public LeftBrace(int start) {
			super("(", start);
		}
	}

	public static class RightBrace extends Symbol {
		public RightBrace(int start) {
			super(")", start);
		}
	}

	public static class LeftCurly extends Symbol {
		public LeftCurly(int start) {
			super("{", start);
		}
	}

	public static class RightCurly extends Symbol {
		public RightCurly(int start) {
			super("}", start);
		}
	}

	public static class LeftSquare extends Symbol {
		public LeftSquare(int start) {
			super("[", start);
		}
	}

	public static class RightSquare extends Symbol {
		public RightSquare(int start) {
			super("]", start);
		}
	}

	public static class Equals extends Symbol {
		public Equals(int start) {
			super("=", start);
		}
	}

	public static class Star extends Symbol {
		public Star(int start) {
			super("*", start);
		}
	}
}
