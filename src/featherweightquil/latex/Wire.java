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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;

import featherweightquil.core.Syntax;
import featherweightquil.core.Syntax.Expression;

/**
 * A wire represents a single qubit line of the circuit. It records what is
 * placed at each column of the line, but knows nothing of its own row or of
 * the other wires. When a {@link Diagram} determines that a wire participates
 * in a multi-qubit gate, it marks the wire as a target at that column, or as a
 * control together with the (signed) number of rows separating it from its
 * target.
 *
 * @author David J. Pearce
 *
 */
public class Wire {
	/**
	 * The index of the qubit this wire represents.
	 */
	private final long name;
	/**
	 * Gate names (with any control prefixes) placed at each column.
	 */
	private final HashMap<Integer, String> gates = new HashMap<>();
	/**
	 * Rendering family of the gate at each column.
	 */
	private final HashMap<Integer, GateFamily> families = new HashMap<>();
	/**
	 * Superscripts (e.g. "dagger") attached to the gate at each column, in
	 * declaration order.
	 */
	private final HashMap<Integer, List<String>> modifiers = new HashMap<>();
	/**
	 * Rendered parameters of phase gates at each column.
	 */
	private final HashMap<Integer, List<String>> parameters = new HashMap<>();
	/**
	 * Signed row distance to the target, for columns where this wire is a
	 * control.
	 */
	private final HashMap<Integer, Long> ctrl = new HashMap<>();
	/**
	 * Columns at which this wire is a target.
	 */
	private final HashMap<Integer, Boolean> targ = new HashMap<>();
	/**
	 * Columns at which nothing is placed on this wire.
	 */
	private final HashMap<Integer, Command> empty = new HashMap<>();

	/**
	 * Set for a wire which has nothing placed on it at any column, such as the
	 * line of an imputed qubit.
	 */
	private final boolean filler;

	public Wire(long name) {
		this(name, false);
	}

	private Wire(long name, boolean filler) {
		this.name = name;
		this.filler = filler;
	}

	/**
	 * Construct a wire which is empty at every column.
	 *
	 * @param name
	 * @return
	 */
	public static Wire filler(long name) {
		return new Wire(name, true);
	}

	public long name() {
		return name;
	}

	/**
	 * Get the gate at a given column, or <code>null</code> if there is none.
	 *
	 * @param column
	 * @return
	 */
	public String gateAt(int column) {
		return gates.get(column);
	}

	public GateFamily familyAt(int column) {
		return families.get(column);
	}

	public List<String> modifiersAt(int column) {
		List<String> ms = modifiers.get(column);
		return ms == null ? Collections.emptyList() : Collections.unmodifiableList(ms);
	}

	public List<String> parametersAt(int column) {
		List<String> ps = parameters.get(column);
		return ps == null ? Collections.emptyList() : Collections.unmodifiableList(ps);
	}

	/**
	 * Get the distance to the target if this wire is a control at the given
	 * column, or <code>null</code> otherwise.
	 *
	 * @param column
	 * @return
	 */
	public Long ctrlAt(int column) {
		return ctrl.get(column);
	}

	public boolean isTargetAt(int column) {
		return targ.containsKey(column);
	}

	public boolean isEmptyAt(int column) {
		return filler || empty.containsKey(column);
	}

	void setGate(int column, String gate) {
		gates.put(column, gate);
		families.put(column, GateFamily.classify(gate));
	}

	void addModifier(int column, String modifier) {
		modifiers.computeIfAbsent(column, c -> new ArrayList<>()).add(modifier);
	}

	void setEmpty(int column) {
		empty.put(column, Command.QW);
	}

	void setCtrl(int column, long distance) {
		ctrl.put(column, distance);
	}

	void setTarg(int column) {
		targ.put(column, true);
	}

	/**
	 * Record the parameters of a phase gate at a given column. Each expression
	 * is reduced to a name (where it has one) and then rendered as a symbol.
	 *
	 * @param expressions The gate's parameter expressions.
	 * @param column      The column of the gate.
	 * @param texify      Whether recognised names become LaTeX symbols.
	 */
	void setParameters(List<Expression> expressions, int column, boolean texify) {
		ArrayList<String> ps = new ArrayList<>();
		for (Expression e : expressions) {
			ps.add(Symbol.render(parameterText(e), texify));
		}
		parameters.put(column, ps);
	}

	/**
	 * Merge the gate placed on another (freshly constructed) wire at the given
	 * column into this one.
	 *
	 * @param update
	 * @param column
	 */
	void merge(Wire update, int column) {
		String gate = update.gates.get(column);
		if (gate == null) {
			return;
		}
		setGate(column, gate);
		List<String> ms = update.modifiers.get(column);
		if (ms != null) {
			modifiers.put(column, new ArrayList<>(ms));
		}
		List<String> ps = update.parameters.get(column);
		if (ps != null) {
			parameters.put(column, new ArrayList<>(ps));
		}
	}

	/**
	 * Extract the text which names a parameter expression. Memory references
	 * are named by their region, numbers by their real part, and anything else
	 * by its Quil form.
	 *
	 * @param e
	 * @return
	 */
	static String parameterText(Expression e) {
		switch (e.getOpcode()) {
		case Syntax.EXPR_address:
			return ((Expression.Address) e).reference().name();
		case Syntax.EXPR_number:
			return Syntax.format(((Expression.Number) e).real());
		default:
			return e.toString();
		}
	}

	@Override
	public String toString() {
		return "q" + name + ":" + gates;
	}
}
