// This file is part of the FeatherweightQuil Compiler (fqc).
//
// The FeatherweightQuil Compiler is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The FeatherweightQuil Compiler is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the FeatherweightQuil Compiler. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package featherweightquil.latex;

/**
 * Signals that a program cannot be drawn because it is malformed. At present,
 * the only such case is a multi-qubit gate in which the same qubit appears
 * more than once, such as <code>CNOT 0 0</code>.
 *
 * @author David J. Pearce
 *
 */
public class LatexGenError extends Exception {

	public enum Kind {
		FOUND_CNOT_WITH_NO_TARGET("Tried to parse CNOT and found a control qubit without a target.");

		private final String message;

		private Kind(String message) {
			this.message = message;
		}
	}

	private final Kind kind;
	private final long qubit;
	private final int column;

	public LatexGenError(Kind kind, long qubit, int column) {
		super(kind.message + " (qubit " + qubit + ", column " + column + ")");
		this.kind = kind;
		this.qubit = qubit;
		this.column = column;
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * The offending qubit.
	 *
	 * @return
	 */
	public long qubit() {
		return qubit;
	}

	/**
	 * The column of the offending instruction.
	 *
	 * @return
	 */
	public int column() {
		return column;
	}

	public static final long serialVersionUID = 1l;
}
