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
package featherweightquil.io;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import featherweightquil.util.SyntaxError;

/**
 * Responsible for turning a stream of characters into a sequence of Quil
 * tokens. Unlike free-form languages, Quil is line oriented: line breaks are
 * significant and are retained as {@link NewLine} tokens, whilst leading
 * whitespace on a non-empty line is retained as an {@link Indent} token (used
 * for the matrix rows of a <code>DEFGATE</code>). Comments begin with
 * <code>#</code> and run to the end of the line.
 *
 * @author Daivd J. Pearce
 *
 */
public class Lexer {

	private final String input;
	private int pos;

	public Lexer(String filename) throws IOException {
		this(new InputStreamReader(new FileInputStream(filename), StandardCharsets.UTF_8));
	}

	public Lexer(InputStream instream) throws IOException {
		this(new InputStreamReader(instream, StandardCharsets.UTF_8));
	}

	public Lexer(Reader reader) throws IOException {
		BufferedReader in = new BufferedReader(reader);

		StringBuilder text = new StringBuilder();
		String tmp;
		while ((tmp = in.readLine()) != null) {
			text.append(tmp);
			text.append("\n");
		}

		input = text.toString();
	}

	/**
	 * Get the complete text being scanned. This is used when reporting syntax
	 * errors.
	 *
	 * @return
	 */
	public String input() {
		return input;
	}

	/**
	 * Scan all characters from the input stream and generate a corresponding
	 * list of tokens, whilst discarding comments and insignificant whitespace.
	 *
	 * @return
	 */
	public List<Token> scan() {
		ArrayList<Token> tokens = new ArrayList<>();
		pos = 0;

		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (isLineStart() && (c == ' ' || c == '\t')) {
				scanIndent(tokens);
			} else if (c == '\n' || c == ';') {
				tokens.add(new NewLine(String.valueOf(c), pos++));
			} else if (Character.isDigit(c) || (c == '.' && isDigitAt(pos + 1))) {
				tokens.add(scanNumericConstant());
			} else if (c == '#') {
				scanLineComment();
			} else if (c == '%') {
				tokens.add(scanVariable());
			} else if (c == '"') {
				tokens.add(scanString());
			} else if (isOperatorStart(c)) {
				tokens.add(scanOperator());
			} else if (isIdentifierStart(c)) {
				tokens.add(scanIdentifier());
			} else if (Character.isWhitespace(c)) {
				skipWhitespace();
			} else {
				syntaxError("unexpected character '" + c + "'");
			}
		}

		return tokens;
	}

	/**
	 * Scan a numeric constant. This is either an integer (a sequence of digits),
	 * a real (digits with a fractional part and/or exponent) or an imaginary
	 * literal (an integer or real immediately followed by <code>i</code>).
	 *
	 * @return
	 */
	public Token scanNumericConstant() {
		int start = pos;
		boolean real = false;
		while (isDigitAt(pos)) {
			pos = pos + 1;
		}
		if (pos < input.length() && input.charAt(pos) == '.') {
			real = true;
			pos = pos + 1;
			while (isDigitAt(pos)) {
				pos = pos + 1;
			}
		}
		if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
			int sign = (pos + 1 < input.length() && (input.charAt(pos + 1) == '+' || input.charAt(pos + 1) == '-'))
					? 1
					: 0;
			if (isDigitAt(pos + 1 + sign)) {
				real = true;
				pos = pos + 1 + sign;
				while (isDigitAt(pos)) {
					pos = pos + 1;
				}
			}
		}
		String text = input.substring(start, pos);
		if (pos < input.length() && input.charAt(pos) == 'i'
				&& !(pos + 1 < input.length() && isIdentifierPart(input.charAt(pos + 1)))) {
			pos = pos + 1;
			return new Imaginary(Double.parseDouble(text), text + "i", start);
		} else if (real) {
			return new Real(Double.parseDouble(text), text, start);
		}
		BigInteger value = new BigInteger(text);
		if (value.bitLength() > 63) {
			throw new SyntaxError("integer constant too large", input, start, pos - 1);
		}
		return new Int(value.longValue(), text, start);
	}

	static final char[] opStarts = { '(', ')', '[', ']', ',', ':', '+', '-', '*', '/', '^' };

	public boolean isOperatorStart(char c) {
		for (char o : opStarts) {
			if (c == o) {
				return true;
			}
		}
		return false;
	}

	public Token scanOperator() {
		char c = input.charAt(pos);

		switch (c) {
		case '(':
			return new LeftBrace(pos++);
		case ')':
			return new RightBrace(pos++);
		case '[':
			return new LeftSquare(pos++);
		case ']':
			return new RightSquare(pos++);
		case ',':
			return new Comma(pos++);
		case ':':
			return new Colon(pos++);
		case '+':
			return new Plus(pos++);
		case '-':
			return new Minus(pos++);
		case '*':
			return new Star(pos++);
		case '/':
			return new RightSlash(pos++);
		case '^':
			return new Caret(pos++);
		}

		syntaxError("unknown operator encountered: " + c);
		return null;
	}

	public static final String[] keywords = { "DEFGATE", "AS", "MATRIX", "PERMUTATION", "DECLARE", "MEASURE",
			"RESET", "HALT", "NOP", "PRAGMA", "CONTROLLED", "DAGGER", "FORKED" };

	/**
	 * Scan an identifier or keyword. A Quil identifier may contain dashes, but
	 * may not end with one.
	 *
	 * @return
	 */
	public Token scanIdentifier() {
		int start = pos;
		pos = endOfIdentifier(pos);
		String text = input.substring(start, pos);

		// now, check for keywords
		for (String keyword : keywords) {
			if (keyword.equals(text)) {
				return new Keyword(text, start);
			}
		}

		// otherwise, must be identifier
		return new Identifier(text, start);
	}

	public Token scanVariable() {
		int start = pos;
		pos = pos + 1;
		if (pos >= input.length() || !isIdentifierStart(input.charAt(pos))) {
			syntaxError("expecting variable name after '%'");
		}
		pos = endOfIdentifier(pos);
		return new Variable(input.substring(start, pos), start);
	}

	public Token scanString() {
		int start = pos;
		pos = pos + 1;
		while (pos < input.length() && input.charAt(pos) != '"') {
			if (input.charAt(pos) == '\n') {
				throw new SyntaxError("unterminated string", input, start, pos - 1);
			} else if (input.charAt(pos) == '\\') {
				pos = pos + 1;
			}
			pos = pos + 1;
		}
		if (pos >= input.length()) {
			throw new SyntaxError("unterminated string", input, start, pos - 1);
		}
		pos = pos + 1;
		return new StringLiteral(input.substring(start, pos), start);
	}

	public void scanLineComment() {
		while (pos < input.length() && input.charAt(pos) != '\n') {
			pos++;
		}
	}

	/**
	 * Scan the leading whitespace of a line. An indentation token is produced
	 * only if the line has some content, since blank (or comment-only) lines are
	 * insignificant.
	 *
	 * @param tokens
	 */
	private void scanIndent(List<Token> tokens) {
		int start = pos;
		while (pos < input.length() && (input.charAt(pos) == ' ' || input.charAt(pos) == '\t')) {
			pos++;
		}
		if (pos < input.length() && input.charAt(pos) != '\n' && input.charAt(pos) != '#') {
			tokens.add(new Indent(input.substring(start, pos), start));
		}
	}

	/**
	 * Skip over any whitespace at the current index position in the input
	 * string, stopping at line breaks since these are significant.
	 */
	public void skipWhitespace() {
		while (pos < input.length() && input.charAt(pos) != '\n' && Character.isWhitespace(input.charAt(pos))) {
			pos++;
		}
	}

	private int endOfIdentifier(int index) {
		while (index < input.length()) {
			char c = input.charAt(index);
			if (isIdentifierPart(c)) {
				index++;
			} else if (c == '-') {
				// dashes are permitted only when followed by more identifier
				int j = index;
				while (j < input.length() && input.charAt(j) == '-') {
					j++;
				}
				if (j < input.length() && isIdentifierPart(input.charAt(j))) {
					index = j;
				} else {
					break;
				}
			} else {
				break;
			}
		}
		return index;
	}

	private boolean isLineStart() {
		return pos == 0 || input.charAt(pos - 1) == '\n';
	}

	private boolean isDigitAt(int index) {
		return index < input.length() && Character.isDigit(input.charAt(index));
	}

	private static boolean isIdentifierStart(char c) {
		return Character.isLetter(c) || c == '_';
	}

	private static boolean isIdentifierPart(char c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}

	/**
	 * Raise a syntax error with a given message at the current index.
	 *
	 * @param msg
	 */
	private void syntaxError(String msg) {
		throw new SyntaxError(msg, input, pos, pos);
	}

	/**
	 * The base class for all tokens.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static abstract class Token {

		public final String text;
		public final int start;

		public Token(String text, int pos) {
			this.text = text;
			this.start = pos;
		}

		public int end() {
			return start + text.length() - 1;
		}

		@Override
		public String toString() {
			return text;
		}
	}

	/**
	 * Represents an integer constant. That is, a sequence of 1 or more digits.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Int extends Token {

		public final long value;

		public Int(long r, String text, int pos) {
			super(text, pos);
			value = r;
		}
	}

	/**
	 * Represents a real constant, such as <code>0.5</code> or
	 * <code>1e-3</code>.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Real extends Token {

		public final double value;

		public Real(double r, String text, int pos) {
			super(text, pos);
			value = r;
		}
	}

	/**
	 * Represents an imaginary constant, such as <code>2.0i</code>. The value
	 * holds the coefficient of <code>i</code>.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Imaginary extends Token {

		public final double value;

		public Imaginary(double r, String text, int pos) {
			super(text, pos);
			value = r;
		}
	}

	/**
	 * Represents a gate, memory region or function name.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Identifier extends Token {

		public Identifier(String text, int pos) {
			super(text, pos);
		}
	}

	/**
	 * Represents a known keyword. Quil keywords are written in upper case.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Keyword extends Token {

		public Keyword(String text, int pos) {
			super(text, pos);
		}
	}

	/**
	 * Represents a formal parameter, such as <code>%theta</code>.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Variable extends Token {

		public Variable(String text, int pos) {
			super(text, pos);
		}

		/**
		 * The variable name without its leading '%'.
		 *
		 * @return
		 */
		public String name() {
			return text.substring(1);
		}
	}

	public static class StringLiteral extends Token {

		public StringLiteral(String text, int pos) {
			super(text, pos);
		}
	}

	public static class NewLine extends Token {
		public NewLine(String text, int pos) {
			super(text, pos);
		}
	}

	public static class Indent extends Token {
		public Indent(String text, int pos) {
			super(text, pos);
		}
	}

	public static class LeftBrace extends Token {
		public LeftBrace(int pos) {
			super("(", pos);
		}
	}

	public static class RightBrace extends Token {
		public RightBrace(int pos) {
			super(")", pos);
		}
	}

	public static class LeftSquare extends Token {
		public LeftSquare(int pos) {
			super("[", pos);
		}
	}

	public static class RightSquare extends Token {
		public RightSquare(int pos) {
			super("]", pos);
		}
	}

	public static class Comma extends Token {
		public Comma(int pos) {
			super(",", pos);
		}
	}

	public static class Colon extends Token {
		public Colon(int pos) {
			super(":", pos);
		}
	}

	public static class Plus extends Token {
		public Plus(int pos) {
			super("+", pos);
		}
	}

	public static class Minus extends Token {
		public Minus(int pos) {
			super("-", pos);
		}
	}

	public static class Star extends Token {
		public Star(int pos) {
			super("*", pos);
		}
	}

	public static class RightSlash extends Token {
		public RightSlash(int pos) {
			super("/", pos);
		}
	}

	public static class Caret extends Token {
		public Caret(int pos) {
			super("^", pos);
		}
	}
}
