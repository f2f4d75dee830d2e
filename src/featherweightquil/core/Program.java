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
package featherweightquil.core;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import featherweightquil.core.Syntax.Instruction;
import featherweightquil.core.Syntax.Qubit;
import featherweightquil.io.Lexer;
import featherweightquil.io.Parser;

/**
 * A Quil program is an ordered sequence of instructions.
 *
 * @author David J. Pearce
 *
 */
public class Program {
	private final List<Instruction> instructions;

	public Program(List<Instruction> instructions) {
		this.instructions = new ArrayList<>(instructions);
	}

	/**
	 * Parse a program from its source text.
	 *
	 * @param source
	 * @return
	 * @throws featherweightquil.util.SyntaxError if the source is malformed.
	 */
	public static Program parse(String source) {
		try {
			List<Lexer.Token> tokens = new Lexer(new StringReader(source)).scan();
			return new Parser(source, tokens).parseProgram();
		} catch (IOException e) {
			// reading from a string cannot fail
			throw new IllegalStateException(e);
		}
	}

	public List<Instruction> instructions() {
		return Collections.unmodifiableList(instructions);
	}

	public int size() {
		return instructions.size();
	}

	/**
	 * Get the user-defined gates declared in this program, in declaration
	 * order.
	 *
	 * @return
	 */
	public List<Instruction.GateDefinition> gateDefinitions() {
		ArrayList<Instruction.GateDefinition> defs = new ArrayList<>();
		for (Instruction i : instructions) {
			if (i.getOpcode() == Syntax.INSTR_defgate) {
				defs.add((Instruction.GateDefinition) i);
			}
		}
		return defs;
	}

	/**
	 * Determine every qubit referenced by a gate, measurement or reset in this
	 * program. The resulting set is ordered by first appearance.
	 *
	 * @return
	 */
	public Set<Qubit> usedQubits() {
		LinkedHashSet<Qubit> qubits = new LinkedHashSet<>();
		for (Instruction i : instructions) {
			switch (i.getOpcode()) {
			case Syntax.INSTR_gate:
				qubits.addAll(((Instruction.Gate) i).qubits());
				break;
			case Syntax.INSTR_measure:
				qubits.add(((Instruction.Measurement) i).qubit());
				break;
			case Syntax.INSTR_reset: {
				Qubit q = ((Instruction.Reset) i).qubit();
				if (q != null) {
					qubits.add(q);
				}
				break;
			}
			default:
				// no qubits
			}
		}
		return qubits;
	}

	@Override
	public String toString() {
		StringBuilder r = new StringBuilder();
		for (Instruction i : instructions) {
			r.append(i).append('\n');
		}
		return r.toString();
	}
}
