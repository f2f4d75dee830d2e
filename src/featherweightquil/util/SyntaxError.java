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
package featherweightquil.util;

import java.io.PrintStream;

import featherweightquil.util.SyntacticElement.Attribute;

/**
 * This exception is thrown when the lexer or parser encounters Quil source
 * which it cannot make sense of. The error records the offending region of the
 * source text so that a caret diagnostic can be printed.
 *
 * @author David Pearce
 */
public class SyntaxError extends RuntimeException {

	private final String msg;
	private final String src;
	private final int start;
	private final int end;

	/**
	 * Identify a syntax error over a region of the program source.
	 *
	 * @param msg
	 *            Message detailing the problem.
	 * @param src
	 *            The program source this error is referring to (may be null).
	 * @param start
	 *            Index of first character of the offending region.
	 * @param end
	 *            Index of last character of the offending region.
	 */
	public SyntaxError(String msg, String src, int start, int end) {
		this.msg = msg;
		this.src = src;
		this.start = start;
		this.end = end;
	}

	public SyntaxError(String msg, String src, int start, int end, Throwable ex) {
		super(ex);
		this.msg = msg;
		this.src = src;
		this.start = start;
		this.end = end;
	}

	@Override
	public String getMessage() {
		return msg != null ? msg : "";
	}

	public String msg() {
		return msg;
	}

	/**
	 * The program source in which the error arose.
	 *
	 * @return
	 */
	public String source() {
		return src;
	}

	/**
	 * Get index of first character of offending location.
	 *
	 * @return
	 */
	public int start() {
		return start;
	}

	/**
	 * Get index of last character of offending location.
	 *
	 * @return
	 */
	public int end() {
		return end;
	}

	/**
	 * Determine the (one-based) line on which the offending region begins.
	 *
	 * @return
	 */
	public int line() {
		if (src == null) {
			return 0;
		}
		int line = 1;
		for (int i = 0; i < start && i < src.length(); ++i) {
			if (src.charAt(i) == '\n') {
				line = line + 1;
			}
		}
		return line;
	}

	/**
	 * Output the syntax error to a given output stream, highlighting the
	 * offending region of the line with carets.
	 */
	public void outputSourceError(PrintStream output) {
		if (src == null || start < 0) {
			output.println("syntax error: " + getMessage());
			return;
		}
		int lineStart = Math.min(start, src.length());
		while (lineStart > 0 && src.charAt(lineStart - 1) != '\n') {
			lineStart--;
		}
		int lineEnd = lineStart;
		while (lineEnd < src.length() && src.charAt(lineEnd) != '\n') {
			lineEnd++;
		}
		output.println("line " + line() + ": " + getMessage());
		output.println(src.substring(lineStart, lineEnd));
		StringBuilder carets = new StringBuilder();
		for (int i = lineStart; i < start; ++i) {
			carets.append(src.charAt(i) == '\t' ? '\t' : ' ');
		}
		// always show at least one caret, even for an empty region
		int last = Math.max(start, Math.min(end, lineEnd - 1));
		for (int i = start; i <= last; ++i) {
			carets.append('^');
		}
		output.println(carets);
	}

	public static final long serialVersionUID = 1l;

	public static void syntaxError(String msg, String src, SyntacticElement elem) {
		int start = -1;
		int end = -1;

		Attribute.Source attr = elem.attribute(Attribute.Source.class);
		if (attr != null) {
			start = attr.start;
			end = attr.end;
		}

		throw new SyntaxError(msg, src, start, end);
	}
}
