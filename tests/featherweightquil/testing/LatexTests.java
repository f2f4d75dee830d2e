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
package featherweightquil.testing;

import static org.junit.Assert.fail;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import org.junit.jupiter.api.Test;

import featherweightquil.core.Program;
import featherweightquil.io.Lexer;
import featherweightquil.io.Parser;
import featherweightquil.latex.Document;
import featherweightquil.latex.Latex;
import featherweightquil.latex.LatexGenError;
import featherweightquil.latex.RenderSettings;
import featherweightquil.util.SyntaxError;

/**
 * Tests for the LaTeX generated from complete Quil programs. Expected output is
 * given row by row; the row separators, header and footer are added by the
 * helpers.
 *
 * @author David J. Pearce
 *
 */
public class LatexTests {
	private static final RenderSettings DEFAULT = RenderSettings.DEFAULT;
	private static final RenderSettings NO_TEXIFY = DEFAULT.toBuilder().texifyNumericalConstants(false).build();
	private static final RenderSettings NO_LABELS = DEFAULT.toBuilder().labelQubitLines(false).build();
	private static final RenderSettings IMPUTE = DEFAULT.toBuilder().imputeMissingQubits(true).build();

	// ==============================================================
	// Document
	// ==============================================================

	@Test
	public void test_01() throws IOException {
		// Empty program has an empty body
		String output = latex("", DEFAULT);
		check(Document.HEADER + Document.FOOTER, output);
	}

	@Test
	public void test_02() throws IOException {
		String output = latex("DECLARE ro BIT[2]\nHALT", DEFAULT);
		check(Document.HEADER + Document.FOOTER, output);
	}

	@Test
	public void test_03() throws IOException {
		String output = latex("# nothing but a comment\n\n", DEFAULT);
		check(Document.HEADER + Document.FOOTER, output);
	}

	@Test
	public void test_04() throws IOException {
		String output = latex("X 0", DEFAULT);
		if (!output.startsWith("\\documentclass[convert={density=300,outext=.png}]{standalone}\n"
				+ "\\usepackage[margin=1in]{geometry}\n" + "\\usepackage{tikz}\n" + "\\usetikzlibrary{quantikz}\n"
				+ "\\begin{document}\n" + "\\begin{tikzcd}\n")) {
			fail("unexpected header: " + output);
		}
		if (!output.endsWith("\\end{tikzcd}\n\\end{document}")) {
			fail("unexpected footer: " + output);
		}
	}

	// ==============================================================
	// Gates
	// ==============================================================

	@Test
	public void test_10() throws IOException {
		check("X 0", DEFAULT, q(0) + " & \\gate{X} & \\qw");
	}

	@Test
	public void test_11() throws IOException {
		check("Y 1", DEFAULT, q(1) + " & \\gate{Y} & \\qw");
	}

	@Test
	public void test_12() throws IOException {
		check("X 0\nY 0", DEFAULT, q(0) + " & \\gate{X} & \\gate{Y} & \\qw");
	}

	@Test
	public void test_13() throws IOException {
		check("X 0\nY 1", DEFAULT,
				q(0) + " & \\gate{X} & \\qw & \\qw",
				q(1) + " & \\qw & \\gate{Y} & \\qw");
	}

	@Test
	public void test_14() throws IOException {
		check("PHASE(pi) 0", DEFAULT, q(0) + " & \\phase{\\pi} & \\qw");
	}

	@Test
	public void test_15() throws IOException {
		check("CNOT 0 1", DEFAULT,
				q(0) + " & \\ctrl{1} & \\qw",
				q(1) + " & \\targ{} & \\qw");
	}

	@Test
	public void test_16() throws IOException {
		// Control below target points upwards
		check("CNOT 1 0", DEFAULT,
				q(0) + " & \\targ{} & \\qw",
				q(1) + " & \\ctrl{-1} & \\qw");
	}

	@Test
	public void test_17() throws IOException {
		check("H 0\nCNOT 0 1", DEFAULT,
				q(0) + " & \\gate{H} & \\ctrl{1} & \\qw",
				q(1) + " & \\qw & \\targ{} & \\qw");
	}

	@Test
	public void test_18() throws IOException {
		check("H 1\nCNOT 1 0", DEFAULT,
				q(0) + " & \\qw & \\targ{} & \\qw",
				q(1) + " & \\gate{H} & \\ctrl{-1} & \\qw");
	}

	@Test
	public void test_19() throws IOException {
		check("CCNOT 1 2 0", DEFAULT,
				q(0) + " & \\targ{} & \\qw",
				q(1) + " & \\ctrl{-1} & \\qw",
				q(2) + " & \\ctrl{-2} & \\qw");
	}

	@Test
	public void test_20() throws IOException {
		check("CPHASE(pi) 0 1", DEFAULT,
				q(0) + " & \\ctrl{1} & \\qw",
				q(1) + " & \\phase{\\pi} & \\qw");
	}

	@Test
	public void test_21() throws IOException {
		check("CZ 0 1", DEFAULT,
				q(0) + " & \\ctrl{1} & \\qw",
				q(1) + " & \\gate{Z} & \\qw");
	}

	@Test
	public void test_22() throws IOException {
		// Unknown gates are drawn as plain boxes
		check("FOO 0 1", DEFAULT,
				q(0) + " & \\gate{FOO} & \\qw",
				q(1) + " & \\gate{FOO} & \\qw");
	}

	@Test
	public void test_23() throws IOException {
		// A controlled name without a target degrades to a plain box
		check("CZ 0", DEFAULT, q(0) + " & \\gate{CZ} & \\qw");
	}

	@Test
	public void test_24() throws IOException {
		check("CPHASE(pi) 0", DEFAULT, q(0) + " & \\phase{\\pi} & \\qw");
	}

	@Test
	public void test_25() throws IOException {
		check("PHASE 0", DEFAULT, q(0) + " & \\phase{} & \\qw");
	}

	@Test
	public void test_26() throws IOException {
		check("CONTROLLED CONTROLLED CONTROLLED Y 0 1 2 3", DEFAULT,
				q(0) + " & \\ctrl{3} & \\qw",
				q(1) + " & \\ctrl{2} & \\qw",
				q(2) + " & \\ctrl{1} & \\qw",
				q(3) + " & \\gate{Y} & \\qw");
	}

	@Test
	public void test_27() throws IOException {
		// Controls may lie on either side of the target
		check("CCNOT 0 2 1", DEFAULT,
				q(0) + " & \\ctrl{1} & \\qw",
				q(1) + " & \\targ{} & \\qw",
				q(2) + " & \\ctrl{-1} & \\qw");
	}

	// ==============================================================
	// Modifiers
	// ==============================================================

	@Test
	public void test_30() throws IOException {
		check("CONTROLLED CNOT 2 1 0", DEFAULT,
				q(0) + " & \\targ{} & \\qw",
				q(1) + " & \\ctrl{-1} & \\qw",
				q(2) + " & \\ctrl{-2} & \\qw");
	}

	@Test
	public void test_31() throws IOException {
		checkSame("CONTROLLED CNOT 2 1 0", "CCNOT 2 1 0", DEFAULT);
	}

	@Test
	public void test_32() throws IOException {
		checkSame("CONTROLLED CNOT 1 2 0", "CCNOT 1 2 0", DEFAULT);
	}

	@Test
	public void test_33() throws IOException {
		check("DAGGER X 0", DEFAULT, q(0) + " & \\gate{X^{\\dagger}} & \\qw");
	}

	@Test
	public void test_34() throws IOException {
		check("DAGGER DAGGER Y 0", DEFAULT, q(0) + " & \\gate{Y^{\\dagger}^{\\dagger}} & \\qw");
	}

	@Test
	public void test_35() throws IOException {
		checkDifferent("DAGGER DAGGER Y 0", "DAGGER Y 0", DEFAULT);
	}

	@Test
	public void test_36() throws IOException {
		check("DAGGER CZ 0 1", DEFAULT,
				q(0) + " & \\ctrl{1} & \\qw",
				q(1) + " & \\gate{Z^{\\dagger}} & \\qw");
	}

	@Test
	public void test_37() throws IOException {
		check("CONTROLLED H 3 2", DEFAULT,
				q(2) + " & \\gate{H} & \\qw",
				q(3) + " & \\ctrl{-1} & \\qw");
	}

	@Test
	public void test_38() throws IOException {
		// Forked gates are not drawn specially
		check("FORKED RX(pi, pi) 0 1", DEFAULT,
				q(0) + " & \\gate{RX} & \\qw",
				q(1) + " & \\gate{RX} & \\qw");
	}

	@Test
	public void test_39() throws IOException {
		check("CONTROLLED DAGGER CONTROLLED DAGGER Y 0 1 2", DEFAULT,
				q(0) + " & \\ctrl{2} & \\qw",
				q(1) + " & \\ctrl{1} & \\qw",
				q(2) + " & \\gate{Y^{\\dagger}^{\\dagger}} & \\qw");
	}

	@Test
	public void test_40() throws IOException {
		check("CONTROLLED PHASE(alpha) 1 0", DEFAULT,
				q(0) + " & \\phase{\\alpha} & \\qw",
				q(1) + " & \\ctrl{-1} & \\qw");
	}

	// ==============================================================
	// Render Settings
	// ==============================================================

	@Test
	public void test_50() throws IOException {
		check("CPHASE(alpha) 0 1", DEFAULT,
				q(0) + " & \\ctrl{1} & \\qw",
				q(1) + " & \\phase{\\alpha} & \\qw");
	}

	@Test
	public void test_51() throws IOException {
		check("CPHASE(alpha) 0 1", NO_TEXIFY,
				q(0) + " & \\ctrl{1} & \\qw",
				q(1) + " & \\phase{\\text{alpha}} & \\qw");
	}

	@Test
	public void test_52() throws IOException {
		checkDifferent("CPHASE(pi) 0 1", DEFAULT, NO_TEXIFY);
		check("CPHASE(pi) 0 1", NO_TEXIFY,
				q(0) + " & \\ctrl{1} & \\qw",
				q(1) + " & \\phase{\\text{pi}} & \\qw");
	}

	@Test
	public void test_53() throws IOException {
		// Unsupported symbols are text regardless of setting
		checkSame("CPHASE(chi) 0 1", DEFAULT, NO_TEXIFY);
		check("CPHASE(chi) 0 1", DEFAULT,
				q(0) + " & \\ctrl{1} & \\qw",
				q(1) + " & \\phase{\\text{chi}} & \\qw");
	}

	@Test
	public void test_54() throws IOException {
		check("H 0\nCNOT 0 1", NO_LABELS,
				"\\qw & \\gate{H} & \\ctrl{1} & \\qw",
				"\\qw & \\qw & \\targ{} & \\qw");
	}

	@Test
	public void test_55() throws IOException {
		check("H 0\nCNOT 0 3", IMPUTE,
				q(0) + " & \\gate{H} & \\ctrl{3} & \\qw",
				q(1) + " & \\qw & \\qw & \\qw",
				q(2) + " & \\qw & \\qw & \\qw",
				q(3) + " & \\qw & \\targ{} & \\qw");
	}

	@Test
	public void test_56() throws IOException {
		check("H 5\nCNOT 5 2", IMPUTE,
				q(2) + " & \\qw & \\targ{} & \\qw",
				q(3) + " & \\qw & \\qw & \\qw",
				q(4) + " & \\qw & \\qw & \\qw",
				q(5) + " & \\gate{H} & \\ctrl{-3} & \\qw");
	}

	@Test
	public void test_57() throws IOException {
		// Without imputation the distance counts only rows present
		check("H 0\nCNOT 0 3", DEFAULT,
				q(0) + " & \\gate{H} & \\ctrl{1} & \\qw",
				q(3) + " & \\qw & \\targ{} & \\qw");
	}

	@Test
	public void test_58() throws IOException {
		// Imputation requires at least two qubits
		check("X 4", IMPUTE, q(4) + " & \\gate{X} & \\qw");
	}

	@Test
	public void test_59() throws IOException {
		check("X 0\nY 2\nZ 4", IMPUTE,
				q(0) + " & \\gate{X} & \\qw & \\qw & \\qw",
				q(1) + " & \\qw & \\qw & \\qw & \\qw",
				q(2) + " & \\qw & \\gate{Y} & \\qw & \\qw",
				q(3) + " & \\qw & \\qw & \\qw & \\qw",
				q(4) + " & \\qw & \\qw & \\gate{Z} & \\qw");
	}

	@Test
	public void test_60() throws IOException {
		// Reserved settings do not change the output
		RenderSettings reserved = DEFAULT.toBuilder().abbreviateControlledRotations(true).qubitLineOpenWireLength(0)
				.rightAlignTerminalMeasurements(false).build();
		checkSame("H 0\nCNOT 0 1\nMEASURE 0", DEFAULT, reserved);
	}

	// ==============================================================
	// Programs
	// ==============================================================

	@Test
	public void test_70() throws IOException {
		check("H 0\nCNOT 0 1\nX 1\nCNOT 1 2", DEFAULT,
				q(0) + " & \\gate{H} & \\ctrl{1} & \\qw & \\qw & \\qw",
				q(1) + " & \\qw & \\targ{} & \\gate{X} & \\ctrl{1} & \\qw",
				q(2) + " & \\qw & \\qw & \\qw & \\targ{} & \\qw");
	}

	@Test
	public void test_71() throws IOException {
		check("H 5\nCNOT 5 2\nY 2\nCNOT 2 3", DEFAULT,
				q(2) + " & \\qw & \\targ{} & \\gate{Y} & \\ctrl{1} & \\qw",
				q(3) + " & \\qw & \\qw & \\qw & \\targ{} & \\qw",
				q(5) + " & \\gate{H} & \\ctrl{-2} & \\qw & \\qw & \\qw");
	}

	@Test
	public void test_72() throws IOException {
		String input = "DEFGATE G:\n" +
				"    1, 0\n" +
				"    0, 1\n" +
				"\n" +
				"CONTROLLED G 0 1\n" +
				"DAGGER G 0";
		check(input, DEFAULT,
				q(0) + " & \\ctrl{1} & \\gate{G^{\\dagger}} & \\qw",
				q(1) + " & \\gate{G} & \\qw & \\qw");
	}

	@Test
	public void test_73() throws IOException {
		String input = "DEFGATE ____ugly-python-convention____:\n" +
				"    1, 0\n" +
				"    0, 1\n" +
				"    \n" +
				"____ugly-python-convention____ 0\n" +
				"____ugly-python-convention____ 1";
		check(input, DEFAULT,
				q(0) + " & \\gate{____ugly-python-convention____} & \\qw & \\qw",
				q(1) + " & \\qw & \\gate{____ugly-python-convention____} & \\qw");
	}

	@Test
	public void test_74() throws IOException {
		check("CPHASE(1.0) 0 1\nCPHASE(1.0-2.0i) 1 0", DEFAULT,
				q(0) + " & \\ctrl{1} & \\phase{\\text{1-2i}} & \\qw",
				q(1) + " & \\phase{\\text{1}} & \\ctrl{-1} & \\qw");
	}

	@Test
	public void test_75() throws IOException {
		check("CPHASE(pi/2) 1 0", DEFAULT,
				q(0) + " & \\phase{\\text{pi/2}} & \\qw",
				q(1) + " & \\ctrl{-1} & \\qw");
	}

	@Test
	public void test_76() throws IOException {
		check("DECLARE theta REAL\nCPHASE(theta[0]) 0 1", NO_TEXIFY,
				q(0) + " & \\ctrl{1} & \\qw",
				q(1) + " & \\phase{\\text{theta}} & \\qw");
	}

	@Test
	public void test_77() throws IOException {
		// Named qubits do not appear in the diagram
		check("H q\nX 0", DEFAULT, q(0) + " & \\qw & \\gate{X} & \\qw");
	}

	@Test
	public void test_78() throws IOException {
		// Measured qubits have lines, but measurements take no column
		check("DECLARE ro BIT\nX 0\nMEASURE 1 ro[0]", DEFAULT,
				q(0) + " & \\gate{X} & \\qw",
				q(1) + " & \\qw & \\qw");
	}

	@Test
	public void test_79() throws IOException {
		check("PRAGMA INITIAL_REWIRING \"PARTIAL\"\nRESET\nH 0; CZ 0 1\nNOP", DEFAULT,
				q(0) + " & \\gate{H} & \\ctrl{1} & \\qw",
				q(1) + " & \\qw & \\gate{Z} & \\qw");
	}

	// ==============================================================
	// Invalid Programs
	// ==============================================================

	@Test
	public void test_90() throws IOException {
		checkInvalid("CNOT 0 0");
	}

	@Test
	public void test_91() throws IOException {
		checkInvalid("H 0\nCCNOT 0 1 0");
	}

	@Test
	public void test_92() throws IOException {
		checkInvalid("CONTROLLED X 2 2");
	}

	@Test
	public void test_93() throws IOException {
		// Repeated qubits are only an error within a relationship
		check("SWAP 0 0", DEFAULT, q(0) + " & \\gate{SWAP} & \\qw");
	}

	// =================================================================
	// Helpers
	// =================================================================

	/**
	 * Return the label of a given qubit line.
	 *
	 * @param qubit
	 * @return
	 */
	public static String q(long qubit) {
		return "\\lstick{\\ket{q_{" + qubit + "}}}";
	}

	public static String latex(String input, RenderSettings settings) throws IOException {
		try {
			List<Lexer.Token> tokens = new Lexer(new StringReader(input)).scan();
			Program program = new Parser(input, tokens).parseProgram();
			return Latex.toLatex(program, settings);
		} catch (SyntaxError e) {
			e.outputSourceError(System.err);
			e.printStackTrace();
			fail();
		} catch (LatexGenError e) {
			fail("unexpected error: " + e.getMessage());
		}
		return null; // unreachable
	}

	public static void check(String input, RenderSettings settings, String... rows) throws IOException {
		StringBuilder body = new StringBuilder();
		for (int i = 0; i != rows.length; ++i) {
			body.append(rows[i]);
			if (i + 1 < rows.length) {
				body.append(" \\\\");
			}
			body.append('\n');
		}
		check(Document.HEADER + body + Document.FOOTER, latex(input, settings));
	}

	public static void check(String expected, String actual) {
		if (!expected.equals(actual)) {
			fail("expected:\n" + expected + "\ngot:\n" + actual);
		}
	}

	public static void checkSame(String first, String second, RenderSettings settings) throws IOException {
		check(latex(first, settings), latex(second, settings));
	}

	public static void checkSame(String input, RenderSettings first, RenderSettings second) throws IOException {
		check(latex(input, first), latex(input, second));
	}

	public static void checkDifferent(String first, String second, RenderSettings settings) throws IOException {
		if (latex(first, settings).equals(latex(second, settings))) {
			fail("expected different output for: " + first + " and " + second);
		}
	}

	public static void checkDifferent(String input, RenderSettings first, RenderSettings second)
			throws IOException {
		if (latex(input, first).equals(latex(input, second))) {
			fail("expected different output for: " + input);
		}
	}

	public static void checkInvalid(String input) throws IOException {
		try {
			List<Lexer.Token> tokens = new Lexer(new StringReader(input)).scan();
			Program program = new Parser(input, tokens).parseProgram();
			Latex.toLatex(program, DEFAULT);
			fail("test shouldn't have generated LaTeX");
		} catch (LatexGenError e) {
			// If we get here, then the generator raised an exception
			if (e.kind() != LatexGenError.Kind.FOUND_CNOT_WITH_NO_TARGET) {
				fail("unexpected error kind: " + e.kind());
			}
		}
	}
}
