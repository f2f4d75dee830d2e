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
import java.util.HashMap;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

import featherweightquil.core.Program;
import featherweightquil.core.Syntax;
import featherweightquil.core.Syntax.GateModifier;
import featherweightquil.core.Syntax.Instruction;
import featherweightquil.core.Syntax.Qubit;

/**
 * A Diagram is a collection of wires laid out as rows (ordered by qubit index)
 * and columns (one per gate instruction). Besides the wires themselves, the
 * diagram tracks which qubits take part in a multi-qubit gate at each column,
 * so that the relationship between controls and targets can be drawn.
 *
 * A diagram is built in a fixed sequence of passes, each of which completes
 * before the next begins:
 *
 * <ol>
 * <li><b>Populate.</b> Walk the program once from left to right, placing each
 * gate into its column on every wire it touches, and filling the other wires
 * with empty cells.</li>
 * <li><b>Impute</b> (optional). Add empty wires for qubits lying between
 * those referenced by the program.</li>
 * <li><b>Resolve</b> (only needed for multi-qubit gates). Mark each target and
 * compute the signed row distance from each control to its target.</li>
 * <li><b>Serialise.</b> Produce the body of the LaTeX document via
 * {@link #toString()}.</li>
 * </ol>
 *
 * The distance computation must follow imputation because imputed rows change
 * how far apart two wires are, even though qubit indices are unchanged.
 *
 * @author David J. Pearce
 *
 */
public class Diagram {
	/**
	 * Gate names beginning with this prefix denote a multi-qubit relationship.
	 */
	public static final char CONTROL_PREFIX = 'C';

	private final RenderSettings settings;
	/**
	 * The current column, which is also the number of columns populated so
	 * far. Shared by every wire.
	 */
	private int column;
	/**
	 * Qubits, in declaration order, taking part in the multi-qubit gate at each
	 * column. The last qubit of each group is the target.
	 */
	private final HashMap<Integer, List<Long>> relationships = new HashMap<>();
	/**
	 * Wires keyed by qubit index, whose iteration order determines the rows.
	 */
	private final TreeMap<Long, Wire> circuit = new TreeMap<>();
	/**
	 * Set once relationships are resolved, after which the layout is frozen.
	 */
	private boolean frozen;
	/**
	 * Set once missing qubits are imputed. Every qubit between the first and
	 * last wires then has a row, but only referenced qubits have a wire.
	 */
	private boolean imputed;

	public Diagram(RenderSettings settings) {
		this.settings = settings;
	}

	public RenderSettings settings() {
		return settings;
	}

	/**
	 * Get the number of columns in this diagram.
	 *
	 * @return
	 */
	public int columns() {
		return column;
	}

	/**
	 * Get the qubit indices of each row, in order.
	 *
	 * @return
	 */
	public List<Long> rows() {
		if (!imputed) {
			return new ArrayList<>(circuit.keySet());
		}
		ArrayList<Long> rows = new ArrayList<>();
		for (long qubit = circuit.firstKey(); qubit <= circuit.lastKey(); ++qubit) {
			rows.add(qubit);
		}
		return rows;
	}

	/**
	 * Get the wire for a given qubit, or <code>null</code> if there is none.
	 *
	 * @param qubit
	 * @return
	 */
	public Wire wire(long qubit) {
		Wire wire = circuit.get(qubit);
		if (wire == null && imputed && qubit > circuit.firstKey() && qubit < circuit.lastKey()) {
			return Wire.filler(qubit);
		}
		return wire;
	}

	/**
	 * Check whether any multi-qubit gate was encountered during population.
	 *
	 * @return
	 */
	public boolean hasRelationships() {
		return !relationships.isEmpty();
	}

	public void populate(Program program) throws LatexGenError {
		populate(program.instructions(), program.usedQubits());
	}

	/**
	 * Populate the diagram from a sequence of instructions. A wire is created
	 * up front for every fixed qubit used by the program, so that empty cells
	 * can be placed on wires whose first gate comes later. Instructions other
	 * than gate applications do not occupy a column.
	 *
	 * @param instructions The program's instructions, in order.
	 * @param qubits       Every qubit used anywhere in the program.
	 * @throws LatexGenError if a multi-qubit gate names the same qubit twice.
	 */
	public void populate(List<Instruction> instructions, Set<Qubit> qubits) throws LatexGenError {
		checkNotFrozen();
		for (Qubit qubit : qubits) {
			if (qubit instanceof Qubit.Fixed) {
				long index = ((Qubit.Fixed) qubit).index();
				circuit.computeIfAbsent(index, Wire::new);
			}
		}
		for (Instruction instruction : instructions) {
			if (instruction.getOpcode() != Syntax.INSTR_gate) {
				continue;
			}
			Instruction.Gate gate = (Instruction.Gate) instruction;
			setQw(qubits, gate);
			for (Qubit qubit : gate.qubits()) {
				if (qubit instanceof Qubit.Fixed) {
					Wire wire = new Wire(((Qubit.Fixed) qubit).index());
					if (GateFamily.classify(gate.name()) == GateFamily.PHASE) {
						wire.setParameters(gate.parameters(), column, settings.texifyNumericalConstants());
					}
					wire.setGate(column, setModifiers(gate, wire));
					pushWire(wire);
				}
			}
			column = column + 1;
		}
	}

	/**
	 * Place an empty cell at the current column on every existing wire whose
	 * qubit is not used by the given gate.
	 *
	 * @param qubits
	 * @param gate
	 */
	private void setQw(Set<Qubit> qubits, Instruction.Gate gate) {
		List<Qubit> used = gate.qubits();
		for (Qubit qubit : qubits) {
			if (qubit instanceof Qubit.Fixed && !used.contains(qubit)) {
				Wire wire = circuit.get(((Qubit.Fixed) qubit).index());
				if (wire != null) {
					wire.setEmpty(column);
				}
			}
		}
	}

	/**
	 * Compose the displayed name of a gate from its modifiers. Each
	 * <code>CONTROLLED</code> prepends a <code>C</code> to the name, whilst each
	 * <code>DAGGER</code> adds a superscript to the wire at the current column.
	 * Other modifiers are not drawn.
	 *
	 * @param gate
	 * @param wire
	 * @return
	 */
	private String setModifiers(Instruction.Gate gate, Wire wire) {
		StringBuilder name = new StringBuilder(gate.name());
		for (GateModifier modifier : gate.modifiers()) {
			switch (modifier) {
			case CONTROLLED:
				name.insert(0, CONTROL_PREFIX);
				break;
			case DAGGER:
				wire.addModifier(column, "dagger");
				break;
			default:
				break;
			}
		}
		return name.toString();
	}

	/**
	 * Merge a freshly constructed wire into the circuit at the current column,
	 * creating the wire if this is its first appearance. If the gate denotes a
	 * multi-qubit relationship then the qubit joins the relationship for this
	 * column.
	 *
	 * @param wire
	 * @throws LatexGenError if the qubit already belongs to this column's
	 *                       relationship.
	 */
	private void pushWire(Wire wire) throws LatexGenError {
		long qubit = wire.name();
		Wire existing = circuit.computeIfAbsent(qubit, Wire::new);
		existing.merge(wire, column);

		String gate = existing.gateAt(column);
		if (gate != null && isRelationship(gate)) {
			List<Long> group = relationships.computeIfAbsent(column, c -> new ArrayList<>());
			// a qubit cannot control and target itself
			if (group.contains(qubit)) {
				throw new LatexGenError(LatexGenError.Kind.FOUND_CNOT_WITH_NO_TARGET, qubit, column);
			}
			group.add(qubit);
		}
	}

	/**
	 * Add rows for any qubits missing between the first and last wires of the
	 * circuit. Each new row is empty at every column, and so is not stored as a
	 * wire. This has no effect unless the circuit already contains at least two
	 * wires.
	 */
	public void imputeMissingQubits() {
		checkNotFrozen();
		if (circuit.size() >= 2) {
			imputed = true;
		}
	}

	/**
	 * Identify the target and controls of every multi-qubit gate. The target is
	 * the last qubit of a relationship and every other qubit is a control. Each
	 * control records the number of rows to its target, which is positive when
	 * the target lies below it (i.e. has a larger index) and negative otherwise.
	 *
	 * This must be run only once all rows are known, since the number of rows
	 * between two wires depends on every row in the circuit. The cost is
	 * quadratic in the worst case, where every column relates every qubit.
	 */
	public void resolveRelationships() {
		checkNotFrozen();
		frozen = true;
		for (int c = 0; c < column; ++c) {
			List<Long> group = relationships.get(c);
			if (group == null || group.size() < 2) {
				continue;
			}
			long targ = group.get(group.size() - 1);
			circuit.get(targ).setTarg(c);
			for (int i = 0; i != group.size() - 1; ++i) {
				long ctrl = group.get(i);
				circuit.get(ctrl).setCtrl(c, distance(ctrl, targ));
			}
		}
	}

	/**
	 * Determine the signed number of rows from a control to its target.
	 *
	 * @param ctrl
	 * @param targ
	 * @return
	 */
	private long distance(long ctrl, long targ) {
		if (imputed) {
			// every qubit between the two has a row
			return targ - ctrl;
		}
		// find the rows which open and close the range between them
		int open = -1;
		int close = -1;
		int row = 0;
		for (long qubit : circuit.keySet()) {
			if (qubit == ctrl || qubit == targ) {
				if (open < 0) {
					open = row;
				} else {
					close = row;
					break;
				}
			}
			row = row + 1;
		}
		long gap = close - open;
		return ctrl < targ ? gap : -gap;
	}

	private void checkNotFrozen() {
		if (frozen) {
			throw new IllegalStateException("diagram layout is frozen");
		}
	}

	/**
	 * Determine whether a gate name denotes a multi-qubit relationship.
	 *
	 * @param gate
	 * @return
	 */
	public static boolean isRelationship(String gate) {
		return !gate.isEmpty() && gate.charAt(0) == CONTROL_PREFIX;
	}

	/**
	 * Serialise the circuit as the body of a LaTeX document. Each qubit becomes
	 * one row, beginning with its label and ending with an open wire. Every row
	 * except the last is terminated by a new row command.
	 */
	@Override
	public String toString() {
		StringBuilder body = new StringBuilder();
		if (circuit.isEmpty()) {
			return "";
		}
		long last = circuit.lastKey();
		if (imputed) {
			for (long qubit = circuit.firstKey(); qubit <= last; ++qubit) {
				row(body, qubit, circuit.get(qubit), qubit == last);
			}
		} else {
			for (Wire wire : circuit.values()) {
				row(body, wire.name(), wire, wire.name() == last);
			}
		}
		return body.toString();
	}

	/**
	 * Serialise a single row, where a <code>null</code> wire denotes an imputed
	 * qubit which is empty at every column.
	 *
	 * @param body
	 * @param qubit
	 * @param wire
	 * @param last
	 */
	private void row(StringBuilder body, long qubit, Wire wire, boolean last) {
		body.append(settings.label(qubit));
		for (int c = 0; c < column; ++c) {
			String cell = wire == null ? Command.QW.toLatex() : cell(wire, c);
			if (cell != null) {
				body.append(" & ").append(cell);
			}
		}
		body.append(" & ").append(Command.QW);
		if (!last) {
			body.append(' ').append(Command.NR);
		}
		body.append('\n');
	}

	/**
	 * Render the cell of a given wire at a given column, or <code>null</code>
	 * if the wire has nothing there.
	 *
	 * @param wire
	 * @param c
	 * @return
	 */
	private static String cell(Wire wire, int c) {
		String gate = wire.gateAt(c);
		if (gate == null) {
			return wire.isEmptyAt(c) ? Command.QW.toLatex() : null;
		}
		GateFamily family = wire.familyAt(c);
		String superscript = superscript(wire, c);
		Long ctrl = wire.ctrlAt(c);
		if (isRelationship(gate) && ctrl != null) {
			return new Command.Ctrl(ctrl).toLatex();
		} else if (wire.isTargetAt(c)) {
			switch (family) {
			case PHASE:
				return phase(wire, c);
			case BITFLIP:
				return Command.TARG.toLatex();
			default:
				// the target shows the gate which is being controlled
				return new Command.Gate(gate.charAt(gate.length() - 1) + superscript).toLatex();
			}
		} else if (family == GateFamily.PHASE) {
			return phase(wire, c);
		} else {
			return new Command.Gate(gate + superscript).toLatex();
		}
	}

	private static String superscript(Wire wire, int c) {
		StringBuilder r = new StringBuilder();
		for (String modifier : wire.modifiersAt(c)) {
			r.append(new Command.Super(modifier));
		}
		return r.toString();
	}

	private static String phase(Wire wire, int c) {
		List<String> parameters = wire.parametersAt(c);
		if (parameters.isEmpty()) {
			return new Command.Phase("").toLatex();
		}
		StringBuilder r = new StringBuilder();
		for (String parameter : parameters) {
			r.append(new Command.Phase(parameter));
		}
		return r.toString();
	}
}
