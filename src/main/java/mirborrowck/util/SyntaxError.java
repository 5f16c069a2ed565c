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

import java.io.PrintStream;

import mirborrowck.util.SyntacticElement.Attribute;

/**
 * This exception is thrown when the textual MIR given to the parser is
 * malformed.
 */
public class SyntaxError extends RuntimeException {
	public static final long serialVersionUID = 1l;

	private final String msg;
	private final String filename;
	private final String source;
	private final int start;
	private final int end;

	/**
	 * Identify a syntax error at a particular region of the input.
	 *
	 * @param msg
	 *            Message detailing the problem.
	 * @param filename
	 *            The file being read (may be <code>null</code>).
	 * @param source
	 *            The text being read, used for highlighting.
	 * @param start
	 *            Offset of first offending character.
	 * @param end
	 *            Offset of last offending character.
	 */
	public SyntaxError(String msg, String filename, String source, int start, int end) {
		this.msg = msg;
		this.filename = filename;
		this.source = source;
		this.start = start;
		this.end = end;
	}

	@Override
	public String getMessage() {
		return msg != null ? msg : "";
	}

	public String filename() {
		return filename;
	}

	public int start() {
		return start;
	}

	public int end() {
		return end;
	}

	/**
	 * Output the syntax error to a given output stream.
	 */
	public void outputSourceError(PrintStream output) {
		highlight(output, "syntax error: " + getMessage(), source, start, end);
	}

	/**
	 * Print a message followed by the line of <code>source</code> containing the
	 * region <code>start..end</code>, with that region underlined. When no source
	 * is available only the message is printed.
	 *
	 * @param output
	 * @param message
	 * @param source
	 * @param start
	 * @param end
	 */
	public static void highlight(PrintStream output, String message, String source, int start, int end) {
		if (source == null || start < 0 || start >= source.length()) {
			output.println(message);
			return;
		}
		int line = 0;
		int lineStart = 0;
		int lineEnd = 0;
		while (lineEnd < source.length() && lineEnd <= start) {
			lineStart = lineEnd;
			lineEnd = parseLine(source, lineEnd);
			line = line + 1;
		}
		lineEnd = Math.min(lineEnd, source.length());
		output.println("line " + line + ": " + message);
		String text = source.substring(lineStart, lineEnd);
		if (text.endsWith("\n")) {
			output.print(text);
		} else {
			// last line of input has no trailing new-line
			output.println(text);
		}
		StringBuilder marker = new StringBuilder();
		for (int i = lineStart; i < start; ++i) {
			marker.append(source.charAt(i) == '\t' ? '\t' : ' ');
		}
		for (int i = start; i <= Math.min(end, lineEnd - 1); ++i) {
			marker.append('^');
		}
		output.println(marker);
	}

	private static int parseLine(String text, int index) {
		while (index < text.length() && text.charAt(index) != '\n') {
			index++;
		}
		return index + 1;
	}

	/**
	 * Raise a syntax error covering a given syntactic element.
	 */
	public static void syntaxError(String msg, String filename, String source, SyntacticElement elem) {
		Attribute.Source attr = elem.attribute(Attribute.Source.class);
		int start = attr == null ? -1 : attr.start;
		int end = attr == null ? -1 : attr.end;
		throw new SyntaxError(msg, filename, source, start, end);
	}
}
