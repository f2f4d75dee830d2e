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
 * The Quantikz commands from which a circuit diagram is assembled. Each command
 * renders to exactly one fragment of LaTeX, and the names follow those of the
 * Quantikz documentation for easy reference.
 *
 * @author David J. Pearce
 *
 */
public abstract class Command {
	public static final Command QW = new Qw();
	public static final Command NR = new Nr();
	public static final Command TARG = new Targ();

	/**
	 * Render this command as LaTeX.
	 *
	 * @return
	 */
	public abstract String toLatex();

	@Override
	public String toString() {
		return toLatex();
	}

	/**
	 * <code>\lstick{\ket{q_{n}}}</code>: labels a qubit line on the left.
	 */
	public static class Lstick extends Command {
		private final long wire;

		public Lstick(long wire) {
			this.wire = wire;
		}

		@Override
		public String toLatex() {
			return "\\lstick{\\ket{q_{" + wire + "}}}";
		}
	}

	/**
	 * <code>\gate{name}</code>: a boxed gate on the wire.
	 */
	public static class Gate extends Command {
		private final String name;

		public Gate(String name) {
			this.name = name;
		}

		@Override
		public String toLatex() {
			return "\\gate{" + name + "}";
		}
	}

	/**
	 * <code>\phase{symbol}</code>: a phase rotation on the wire.
	 */
	public static class Phase extends Command {
		private final String symbol;

		public Phase(String symbol) {
			this.symbol = symbol;
		}

		@Override
		public String toLatex() {
			return "\\phase{" + symbol + "}";
		}
	}

	/**
	 * <code>^{\script}</code>: a superscript attached to a gate name.
	 */
	public static class Super extends Command {
		private final String script;

		public Super(String script) {
			this.script = script;
		}

		@Override
		public String toLatex() {
			return "^{\\" + script + "}";
		}
	}

	/**
	 * <code>\qw</code>: connect this cell to the previous one, i.e. do nothing.
	 */
	public static class Qw extends Command {
		@Override
		public String toLatex() {
			return "\\qw";
		}
	}

	/**
	 * <code>\\</code>: start a new row.
	 */
	public static class Nr extends Command {
		@Override
		public String toLatex() {
			return "\\\\";
		}
	}

	/**
	 * <code>\ctrl{distance}</code>: a control whose connector spans the given
	 * number of rows. A negative distance points upwards.
	 */
	public static class Ctrl extends Command {
		private final long distance;

		public Ctrl(long distance) {
			this.distance = distance;
		}

		@Override
		public String toLatex() {
			return "\\ctrl{" + distance + "}";
		}
	}

	/**
	 * <code>\targ{}</code>: the target of a controlled-not.
	 */
	public static class Targ extends Command {
		@Override
		public String toLatex() {
			return "\\targ{}";
		}
	}
}
