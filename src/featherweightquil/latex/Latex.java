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

import featherweightquil.core.Program;

/**
 * Generates quantum circuit diagrams from Quil programs, using the TikZ library
 * <a href="https://arxiv.org/pdf/1809.03842.pdf">Quantikz</a>. The result is a
 * complete LaTeX document which can be rendered by any LaTeX distribution with
 * Quantikz installed.
 *
 * Not every program can be drawn faithfully. The following are supported:
 *
 * <ul>
 * <li>Pauli gates: <code>I</code>, <code>X</code>, <code>Y</code>,
 * <code>Z</code></li>
 * <li>Hadamard gate: <code>H</code></li>
 * <li>Phase gates: <code>PHASE</code>, <code>S</code>, <code>T</code></li>
 * <li>Controlled phase gates: <code>CZ</code>, <code>CPHASE</code></li>
 * <li>Controlled X gates: <code>CNOT</code>, <code>CCNOT</code></li>
 * <li>User-defined gates: <code>DEFGATE</code></li>
 * <li>Modifiers: <code>CONTROLLED</code>, <code>DAGGER</code></li>
 * </ul>
 *
 * Anything else is drawn on a best-effort basis. For example, an unknown gate
 * is drawn as a plain box and unknown modifiers are ignored.
 *
 * @author David J. Pearce
 *
 */
public class Latex {

	private Latex() {
	}

	/**
	 * Generate the LaTeX for a program using the default settings.
	 *
	 * @param program
	 * @return
	 * @throws LatexGenError
	 */
	public static String toLatex(Program program) throws LatexGenError {
		return toLatex(program, RenderSettings.DEFAULT);
	}

	/**
	 * Generate the LaTeX for a program.
	 *
	 * <pre>
	 * Program bell = Program.parse("H 0\nCNOT 0 1");
	 * String latex = Latex.toLatex(bell, RenderSettings.DEFAULT);
	 * </pre>
	 *
	 * @param program  The program to draw.
	 * @param settings Determines how the circuit is rendered.
	 * @return A complete LaTeX document.
	 * @throws LatexGenError if the program contains a malformed multi-qubit gate.
	 */
	public static String toLatex(Program program, RenderSettings settings) throws LatexGenError {
		Diagram diagram = new Diagram(settings);
		diagram.populate(program);
		if (settings.imputeMissingQubits()) {
			diagram.imputeMissingQubits();
		}
		// Only multi-qubit gates need their controls and targets resolved
		if (diagram.hasRelationships()) {
			diagram.resolveRelationships();
		}
		return new Document(diagram.toString()).toString();
	}
}
