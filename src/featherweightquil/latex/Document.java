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
 * A LaTeX document consists of a fixed header (document class, packages and
 * the opening of the <code>tikzcd</code> environment), a body holding the
 * circuit, and a fixed footer.
 *
 * @author David J. Pearce
 *
 */
public class Document {
	public static final String HEADER = "\\documentclass[convert={density=300,outext=.png}]{standalone}\n"
			+ "\\usepackage[margin=1in]{geometry}\n"
			+ "\\usepackage{tikz}\n"
			+ "\\usetikzlibrary{quantikz}\n"
			+ "\\begin{document}\n"
			+ "\\begin{tikzcd}\n";

	public static final String FOOTER = "\\end{tikzcd}\n"
			+ "\\end{document}";

	private final String body;

	public Document(String body) {
		this.body = body;
	}

	public String header() {
		return HEADER;
	}

	public String body() {
		return body;
	}

	public String footer() {
		return FOOTER;
	}

	@Override
	public String toString() {
		return HEADER + body + FOOTER;
	}
}
