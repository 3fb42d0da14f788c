// This file is part of the Julia the Viper Interpreter (jtv).
//
// The Julia the Viper Interpreter is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The Julia the Viper Interpreter is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the Julia the Viper Interpreter. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.

package juliatheviper.util;

/**
 * A Syntactic Element represents any part of a program which originates from
 * the source text, and to which we may wish to attach information (e.g. source
 * spans for error reporting).
 *
 * @author David J. Pearce
 */
public interface SyntacticElement {

	/**
	 * Get the list of attributes associated with this syntactic element.
	 *
	 * @return
	 */
	public Attribute[] attributes();

	/**
	 * Get the first attribute of the given class type. This is useful short-hand.
	 *
	 * @param c
	 * @return
	 */
	public <T extends Attribute> T attribute(Class<T> c);

	/**
	 * Get the source line on which this element starts, or <code>-1</code> if
	 * the element was constructed programmatically.
	 *
	 * @return
	 */
	public default int line() {
		Attribute.Source src = attribute(Attribute.Source.class);
		return src == null ? -1 : src.line;
	}

	public class Impl implements SyntacticElement {

		private final Attribute[] attributes;

		public Impl(Attribute... attributes) {
			this.attributes = attributes;
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
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Attribute {

		/**
		 * Identifies the span of source text (inclusive offsets) from which an
		 * element was parsed, along with the (one-based) line it begins on.
		 */
		public static class Source implements Attribute {

			public final int start;
			public final int end;
			public final int line;

			public Source(int start, int end, int line) {
				this.start = start;
				this.end = end;
				this.line = line;
			}

			@Override
			public String toString() {
				return "@" + line + ":" + start + ":" + end;
			}
		}
	}
}
