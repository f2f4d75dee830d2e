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
 * The Greek symbols which can appear as gate parameters. Any other parameter is
 * rendered as plain text.
 *
 * @author David J. Pearce
 *
 */
public enum Symbol {
	ALPHA("alpha"), BETA("beta"), GAMMA("gamma"), PHI("phi"), PI("pi");

	private final String text;

	private Symbol(String text) {
		this.text = text;
	}

	public String toLatex() {
		return "\\" + text;
	}

	/**
	 * Find the symbol with the given textual name, or <code>null</code> if it
	 * is not supported.
	 *
	 * @param text
	 * @return
	 */
	public static Symbol match(String text) {
		for (Symbol s : values()) {
			if (s.text.equals(text)) {
				return s;
			}
		}
		return null;
	}

	/**
	 * Render the given parameter text. When texifying, supported symbols are
	 * converted to their LaTeX form; everything else is wrapped as text.
	 *
	 * @param text
	 * @param texify
	 * @return
	 */
	public static String render(String text, boolean texify) {
		Symbol s = texify ? match(text) : null;
		return s != null ? s.toLatex() : "\\text{" + text + "}";
	}
}
