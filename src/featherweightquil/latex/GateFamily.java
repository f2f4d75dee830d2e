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
 * Gates are rendered differently depending upon the family they belong to,
 * which is determined from the gate name.
 *
 * @author David J. Pearce
 *
 */
public enum GateFamily {
	/**
	 * Phase rotations (e.g. <code>PHASE</code>, <code>CPHASE</code>) which are
	 * drawn as <code>\phase{}</code> with their parameters.
	 */
	PHASE,
	/**
	 * Bit flips (e.g. <code>CNOT</code>, <code>CCNOT</code>) whose target is
	 * drawn as <code>\targ{}</code>.
	 */
	BITFLIP,
	/**
	 * Everything else, drawn as a boxed gate.
	 */
	GENERIC;

	public static GateFamily classify(String name) {
		if (name.contains("PHASE")) {
			return PHASE;
		} else if (name.contains("NOT")) {
			return BITFLIP;
		} else {
			return GENERIC;
		}
	}
}
