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

/**
 * A Syntactic Element represents any part of a MIR function which may carry
 * extra information, most importantly the region of the textual input it was
 * read from. Diagnostics produced by the borrow checker use this to point back
 * at the offending statement.
 */
public interface SyntacticElement {

	/**
	 * Get the list of attributes associated with this syntactic element.
	 *
	 * @return
	 */
	public Attribute[] attributes();

	/**
	 * Get the first attribute of the given class type, or <code>null</code> if
	 * there is none.
	 *
	 * @param c
	 * @return
	 */
	public <T extends Attribute> T attribute(Class<T> c);

	public class Impl implements SyntacticElement {
		private static final Attribute[] NONE = new Attribute[0];

		private final Attribute[] attributes;

		public Impl(Attribute... attributes) {
			this.attributes = attributes == null ? NONE : attributes;
		}

		@Override
		public Attribute[] attributes() {
			return attributes;
		}

		@Override
		@SuppressWarnings("unchecked")
		public <T extends Attribute> T attribute(Class<T> c) {
			for (Attribute a : attributes) {
				if (c.isInstance(a)) {
					return (T) a;
				}
			}
			return null;
		}
	}

	/**
	 * Represents an attribute that can be associated with a syntactic element.
	 */
	public interface Attribute {

		/**
		 * Character offsets (inclusive) within the textual input.
		 */
		public static class Source implements Attribute {
			public final int start;
			public final int end;

			public Source(int start, int end) {
				this.start = start;
				this.end = end;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Source) {
					Source s = (Source) o;
					return start == s.start && end == s.end;
				}
				return false;
			}

			@Override
			public int hashCode() {
				return start * 31 + end;
			}

			@Override
			public String toString() {
				return "@" + start + ":" + end;
			}
		}
	}
}
