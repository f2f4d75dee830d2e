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

import org.junit.jupiter.api.Test;

import featherweightquil.latex.Command;
import featherweightquil.latex.Document;
import featherweightquil.latex.GateFamily;
import featherweightquil.latex.LatexGenError;
import featherweightquil.latex.RenderSettings;
import featherweightquil.latex.Symbol;

/**
 * Tests for the individual LaTeX commands, symbols and settings from which
 * diagrams are built.
 *
 * @author David J. Pearce
 *
 */
public class CommandTests {

	// ==============================================================
	// Commands
	// ==============================================================

	@Test
	public void test_01() {
		check("\\lstick{\\ket{q_{0}}}", new Command.Lstick(0));
		check("\\lstick{\\ket{q_{12}}}", new Command.Lstick(12));
	}

	@Test
	public void test_02() {
		check("\\gate{X}", new Command.Gate("X"));
		check("\\gate{Y^{\\dagger}}", new Command.Gate("Y" + new Command.Super("dagger")));
	}

	@Test
	public void test_03() {
		check("\\phase{\\pi}", new Command.Phase("\\pi"));
		check("\\phase{}", new Command.Phase(""));
	}

	@Test
	public void test_04() {
		check("^{\\dagger}", new Command.Super("dagger"));
	}

	@Test
	public void test_05() {
		check("\\qw", Command.QW);
		check("\\\\", Command.NR);
		check("\\targ{}", Command.TARG);
	}

	@Test
	public void test_06() {
		check("\\ctrl{2}", new Command.Ctrl(2));
		check("\\ctrl{-1}", new Command.Ctrl(-1));
	}

	@Test
	public void test_07() {
		// commands print as their LaTeX
		Command c = new Command.Ctrl(3);
		check(c.toLatex(), c.toString());
	}

	// ==============================================================
	// Symbols
	// ==============================================================

	@Test
	public void test_10() {
		check("\\alpha", Symbol.ALPHA.toLatex());
		check("\\beta", Symbol.BETA.toLatex());
		check("\\gamma", Symbol.GAMMA.toLatex());
		check("\\phi", Symbol.PHI.toLatex());
		check("\\pi", Symbol.PI.toLatex());
	}

	@Test
	public void test_11() {
		checkEquals(Symbol.PI, Symbol.match("pi"));
		checkEquals(null, Symbol.match("PI"));
		checkEquals(null, Symbol.match("chi"));
	}

	@Test
	public void test_12() {
		check("\\alpha", Symbol.render("alpha", true));
		check("\\text{alpha}", Symbol.render("alpha", false));
		check("\\text{chi}", Symbol.render("chi", true));
		check("\\text{chi}", Symbol.render("chi", false));
		check("\\text{pi/2}", Symbol.render("pi/2", true));
	}

	// ==============================================================
	// Gate Families
	// ==============================================================

	@Test
	public void test_20() {
		checkEquals(GateFamily.PHASE, GateFamily.classify("PHASE"));
		checkEquals(GateFamily.PHASE, GateFamily.classify("CPHASE"));
		checkEquals(GateFamily.PHASE, GateFamily.classify("CPHASE00"));
	}

	@Test
	public void test_21() {
		checkEquals(GateFamily.BITFLIP, GateFamily.classify("NOT"));
		checkEquals(GateFamily.BITFLIP, GateFamily.classify("CNOT"));
		checkEquals(GateFamily.BITFLIP, GateFamily.classify("CCNOT"));
	}

	@Test
	public void test_22() {
		checkEquals(GateFamily.GENERIC, GateFamily.classify("H"));
		checkEquals(GateFamily.GENERIC, GateFamily.classify("CZ"));
		checkEquals(GateFamily.GENERIC, GateFamily.classify("not"));
	}

	// ==============================================================
	// Settings and Documents
	// ==============================================================

	@Test
	public void test_30() {
		RenderSettings s = RenderSettings.DEFAULT;
		checkEquals(true, s.texifyNumericalConstants());
		checkEquals(false, s.imputeMissingQubits());
		checkEquals(true, s.labelQubitLines());
		checkEquals(false, s.abbreviateControlledRotations());
		checkEquals(1, s.qubitLineOpenWireLength());
		checkEquals(true, s.rightAlignTerminalMeasurements());
	}

	@Test
	public void test_31() {
		RenderSettings s = RenderSettings.DEFAULT.toBuilder().labelQubitLines(false).build();
		check("\\qw", s.label(4));
		check("\\lstick{\\ket{q_{4}}}", RenderSettings.DEFAULT.label(4));
		// the original is unaffected
		checkEquals(true, RenderSettings.DEFAULT.labelQubitLines());
	}

	@Test
	public void test_32() {
		try {
			new RenderSettings.Builder().qubitLineOpenWireLength(-1);
			fail("negative open wire length accepted");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

	@Test
	public void test_33() {
		Document d = new Document("");
		checkEquals(Document.HEADER + Document.FOOTER, d.toString());
		checkEquals("", d.body());
		checkEquals(Document.HEADER, d.header());
		checkEquals(Document.FOOTER, d.footer());
	}

	@Test
	public void test_34() {
		LatexGenError e = new LatexGenError(LatexGenError.Kind.FOUND_CNOT_WITH_NO_TARGET, 3, 7);
		checkEquals("Tried to parse CNOT and found a control qubit without a target. (qubit 3, column 7)",
				e.getMessage());
	}

	// =================================================================
	// Helpers
	// =================================================================

	public static void check(String expected, Command actual) {
		check(expected, actual.toLatex());
	}

	public static void check(String expected, String actual) {
		if (!expected.equals(actual)) {
			fail("expected: " + expected + ", got: " + actual);
		}
	}

	public static void checkEquals(Object expected, Object actual) {
		if (expected == null ? actual != null : !expected.equals(actual)) {
			fail("expected: " + expected + ", got: " + actual);
		}
	}
}
