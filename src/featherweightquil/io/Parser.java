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

import java.util.ArrayList;
import java.util.List;

import featherweightquil.core.Program;
import featherweightquil.core.Syntax.Expression;
import featherweightquil.core.Syntax.GateModifier;
import featherweightquil.core.Syntax.Instruction;
import featherweightquil.core.Syntax.MemoryReference;
import featherweightquil.core.Syntax.Qubit;
import featherweightquil.io.Lexer.*;
import featherweightquil.util.SyntacticElement.Attribute;
import featherweightquil.util.SyntaxError;

/**
 * A recursive-descent parser for the subset of Quil supported by this toolkit.
 * The parser consumes the tokens produced by the {@link Lexer} and produces a
 * {@link Program}.
 *
 * @author David J. Pearce
 *
 */
public class Parser {
	private final String source;
	private final ArrayList<Token> tokens;
	private int index;

	/**
	 * Construct a parser for a given token sequence.
	 *
	 * @param source The original program text, used for error reporting.
	 * @param tokens The tokens produced from the program text.
	 */
	public Parser(String source, List<Token> tokens) {
		this.source = source;
		this.tokens = new ArrayList<>(tokens);
	}

	/**
	 * Parse a complete program, of the form:
	 *
	 * <pre>
	 * Program ::= (Instruction? NewLine)* Instruction?
	 * </pre>
	 *
	 * @return
	 */
	public Program parseProgram() {
		ArrayList<Instruction> instructions = new ArrayList<>();
		skipNewLines();
		while (index < tokens.size()) {
			instructions.add(parseInstruction());
			if (index < tokens.size()) {
				match(NewLine.class, "end of line");
			}
			skipNewLines();
		}
		return new Program(instructions);
	}

	/**
	 * Parse a single instruction.
	 *
	 * @return
	 */
	public Instruction parseInstruction() {
		checkNotEof();
		Token lookahead = tokens.get(index);
		switch (lookahead.text) {
		case "DEFGATE":
			return parseGateDefinition();
		case "DECLARE":
			return parseDeclaration();
		case "MEASURE":
			return parseMeasurement();
		case "RESET":
			return parseReset();
		case "HALT":
			matchKeyword("HALT");
			return new Instruction.Halt(sourceAttr(index - 1, index - 1));
		case "NOP":
			matchKeyword("NOP");
			return new Instruction.Nop(sourceAttr(index - 1, index - 1));
		case "PRAGMA":
			return parsePragma();
		default:
			return parseGate();
		}
	}

	/**
	 * Parse a gate application, of the form:
	 *
	 * <pre>
	 * Gate ::= Modifier* Ident [ '(' Expr (',' Expr)* ')' ] Qubit+
	 * </pre>
	 *
	 * @return
	 */
	public Instruction.Gate parseGate() {
		int start = index;
		ArrayList<GateModifier> modifiers = new ArrayList<>();
		while (index < tokens.size() && tokens.get(index) instanceof Keyword) {
			Token t = tokens.get(index);
			switch (t.text) {
			case "CONTROLLED":
				modifiers.add(GateModifier.CONTROLLED);
				break;
			case "DAGGER":
				modifiers.add(GateModifier.DAGGER);
				break;
			case "FORKED":
				modifiers.add(GateModifier.FORKED);
				break;
			default:
				syntaxError("unexpected keyword " + t.text, t);
			}
			index = index + 1;
		}
		String name = matchIdentifier().text;
		ArrayList<Expression> parameters = new ArrayList<>();
		if (index < tokens.size() && tokens.get(index) instanceof LeftBrace) {
			match("(");
			parameters.add(parseExpression());
			while (index < tokens.size() && tokens.get(index) instanceof Comma) {
				match(",");
				parameters.add(parseExpression());
			}
			match(")");
		}
		ArrayList<Qubit> qubits = new ArrayList<>();
		while (index < tokens.size() && !(tokens.get(index) instanceof NewLine)) {
			qubits.add(parseQubit());
		}
		if (qubits.isEmpty()) {
			syntaxError("gate " + name + " requires at least one qubit", tokens.get(index - 1));
		}
		return new Instruction.Gate(name, parameters.toArray(new Expression[parameters.size()]),
				qubits.toArray(new Qubit[qubits.size()]), modifiers.toArray(new GateModifier[modifiers.size()]),
				sourceAttr(start, index - 1));
	}

	/**
	 * Parse a gate definition, of the form:
	 *
	 * <pre>
	 * GateDef ::= 'DEFGATE' Ident [ '(' Var (',' Var)* ')' ] [ 'AS' ('MATRIX' | 'PERMUTATION') ] ':'
	 *             (NewLine Indent Expr (',' Expr)*)+
	 * </pre>
	 *
	 * @return
	 */
	public Instruction.GateDefinition parseGateDefinition() {
		int start = index;
		matchKeyword("DEFGATE");
		String name = matchIdentifier().text;
		ArrayList<String> parameters = new ArrayList<>();
		if (index < tokens.size() && tokens.get(index) instanceof LeftBrace) {
			match("(");
			parameters.add(match(Variable.class, "a parameter").name());
			while (index < tokens.size() && tokens.get(index) instanceof Comma) {
				match(",");
				parameters.add(match(Variable.class, "a parameter").name());
			}
			match(")");
		}
		Instruction.GateDefinition.Kind kind = Instruction.GateDefinition.Kind.MATRIX;
		if (index < tokens.size() && tokens.get(index).text.equals("AS")) {
			matchKeyword("AS");
			Token t = match("MATRIX", "PERMUTATION");
			kind = Instruction.GateDefinition.Kind.valueOf(t.text);
		}
		match(":");
		ArrayList<Expression[]> rows = new ArrayList<>();
		// Each row occupies its own indented line
		while (index + 1 < tokens.size() && tokens.get(index) instanceof NewLine
				&& tokens.get(index + 1) instanceof Indent) {
			index = index + 2;
			ArrayList<Expression> row = new ArrayList<>();
			row.add(parseExpression());
			while (index < tokens.size() && tokens.get(index) instanceof Comma) {
				match(",");
				row.add(parseExpression());
			}
			rows.add(row.toArray(new Expression[row.size()]));
		}
		if (rows.isEmpty()) {
			syntaxError("gate definition " + name + " has no body", tokens.get(index - 1));
		}
		return new Instruction.GateDefinition(name, parameters.toArray(new String[parameters.size()]), kind,
				rows.toArray(new Expression[rows.size()][]), sourceAttr(start, index - 1));
	}

	/**
	 * Parse a memory declaration, of the form:
	 *
	 * <pre>
	 * Declare ::= 'DECLARE' Ident Type [ '[' Int ']' ]
	 * </pre>
	 *
	 * @return
	 */
	public Instruction.Declaration parseDeclaration() {
		int start = index;
		matchKeyword("DECLARE");
		String name = matchIdentifier().text;
		Identifier type = matchIdentifier();
		Instruction.Declaration.Type t;
		try {
			t = Instruction.Declaration.Type.valueOf(type.text);
		} catch (IllegalArgumentException e) {
			throw new SyntaxError("unknown memory type " + type.text, source, type.start, type.end(), e);
		}
		long length = 1;
		if (index < tokens.size() && tokens.get(index) instanceof LeftSquare) {
			match("[");
			length = match(Int.class, "an integer").value;
			match("]");
		}
		return new Instruction.Declaration(name, t, length, sourceAttr(start, index - 1));
	}

	public Instruction.Measurement parseMeasurement() {
		int start = index;
		matchKeyword("MEASURE");
		Qubit qubit = parseQubit();
		MemoryReference target = null;
		if (index < tokens.size() && !(tokens.get(index) instanceof NewLine)) {
			target = parseMemoryReference();
		}
		return new Instruction.Measurement(qubit, target, sourceAttr(start, index - 1));
	}

	public Instruction.Reset parseReset() {
		int start = index;
		matchKeyword("RESET");
		Qubit qubit = null;
		if (index < tokens.size() && !(tokens.get(index) instanceof NewLine)) {
			qubit = parseQubit();
		}
		return new Instruction.Reset(qubit, sourceAttr(start, index - 1));
	}

	/**
	 * Parse a pragma. Everything following the pragma name on the line is
	 * retained verbatim.
	 *
	 * @return
	 */
	public Instruction.Pragma parsePragma() {
		int start = index;
		matchKeyword("PRAGMA");
		String name = matchIdentifier().text;
		StringBuilder arguments = new StringBuilder();
		while (index < tokens.size() && !(tokens.get(index) instanceof NewLine)) {
			if (arguments.length() > 0) {
				arguments.append(' ');
			}
			arguments.append(tokens.get(index).text);
			index = index + 1;
		}
		return new Instruction.Pragma(name, arguments.toString(), sourceAttr(start, index - 1));
	}

	/**
	 * Parse a qubit, which is either a fixed index or a named qubit.
	 *
	 * @return
	 */
	public Qubit parseQubit() {
		checkNotEof();
		Token t = tokens.get(index);
		if (t instanceof Int) {
			index = index + 1;
			return new Qubit.Fixed(((Int) t).value);
		} else if (t instanceof Identifier) {
			index = index + 1;
			return new Qubit.Variable(t.text);
		}
		syntaxError("expecting qubit, found '" + t.text + "'", t);
		return null; // unreachable
	}

	public MemoryReference parseMemoryReference() {
		String name = matchIdentifier().text;
		long offset = 0;
		if (index < tokens.size() && tokens.get(index) instanceof LeftSquare) {
			match("[");
			offset = match(Int.class, "an integer").value;
			match("]");
		}
		return new MemoryReference(name, offset);
	}

	/**
	 * Parse an arithmetic expression, of the form:
	 *
	 * <pre>
	 * Expr   ::= Term (('+' | '-') Term)*
	 * Term   ::= Unary (('*' | '/') Unary)*
	 * Unary  ::= '-' Unary | Power
	 * Power  ::= Atom [ '^' Unary ]
	 * </pre>
	 *
	 * @return
	 */
	public Expression parseExpression() {
		int start = index;
		Expression lhs = parseMultiplicativeExpression();
		while (index < tokens.size() && (tokens.get(index) instanceof Plus || tokens.get(index) instanceof Minus)) {
			Expression.Operator op = tokens.get(index) instanceof Plus ? Expression.Operator.PLUS
					: Expression.Operator.MINUS;
			index = index + 1;
			Expression rhs = parseMultiplicativeExpression();
			lhs = new Expression.Infix(lhs, op, rhs, sourceAttr(start, index - 1));
		}
		return lhs;
	}

	private Expression parseMultiplicativeExpression() {
		int start = index;
		Expression lhs = parseUnaryExpression();
		while (index < tokens.size()
				&& (tokens.get(index) instanceof Star || tokens.get(index) instanceof RightSlash)) {
			Expression.Operator op = tokens.get(index) instanceof Star ? Expression.Operator.STAR
					: Expression.Operator.SLASH;
			index = index + 1;
			Expression rhs = parseUnaryExpression();
			lhs = new Expression.Infix(lhs, op, rhs, sourceAttr(start, index - 1));
		}
		return lhs;
	}

	private Expression parseUnaryExpression() {
		int start = index;
		checkNotEof();
		if (tokens.get(index) instanceof Minus) {
			match("-");
			Expression operand = parseUnaryExpression();
			return new Expression.Prefix(operand, sourceAttr(start, index - 1));
		}
		Expression base = parseAtom();
		if (index < tokens.size() && tokens.get(index) instanceof Caret) {
			match("^");
			Expression exponent = parseUnaryExpression();
			return new Expression.Infix(base, Expression.Operator.CARET, exponent, sourceAttr(start, index - 1));
		}
		return base;
	}

	private Expression parseAtom() {
		int start = index;
		checkNotEof();
		Token lookahead = tokens.get(index);
		if (lookahead instanceof Int) {
			index = index + 1;
			return new Expression.Number(((Int) lookahead).value, sourceAttr(start, start));
		} else if (lookahead instanceof Real) {
			index = index + 1;
			return new Expression.Number(((Real) lookahead).value, sourceAttr(start, start));
		} else if (lookahead instanceof Imaginary) {
			index = index + 1;
			return new Expression.Number(0, ((Imaginary) lookahead).value, sourceAttr(start, start));
		} else if (lookahead instanceof Variable) {
			index = index + 1;
			return new Expression.Variable(((Variable) lookahead).name(), sourceAttr(start, start));
		} else if (lookahead instanceof LeftBrace) {
			match("(");
			Expression e = parseExpression();
			match(")");
			return e;
		} else if (lookahead instanceof Identifier) {
			if (lookahead.text.equals("pi")) {
				index = index + 1;
				return new Expression.PiConstant(sourceAttr(start, start));
			} else if (lookahead.text.equals("i")) {
				index = index + 1;
				return new Expression.Number(0, 1, sourceAttr(start, start));
			}
			Expression.Function function = Expression.Function.lookup(lookahead.text);
			if (function != null && index + 1 < tokens.size() && tokens.get(index + 1) instanceof LeftBrace) {
				index = index + 1;
				match("(");
				Expression argument = parseExpression();
				match(")");
				return new Expression.FunctionCall(function, argument, sourceAttr(start, index - 1));
			}
			MemoryReference reference = parseMemoryReference();
			return new Expression.Address(reference, sourceAttr(start, index - 1));
		}
		syntaxError("expecting expression, found '" + lookahead.text + "'", lookahead);
		return null; // unreachable
	}

	/**
	 * Skip blank lines. Indentation outside of a gate definition carries no
	 * meaning and is skipped as well.
	 */
	private void skipNewLines() {
		while (index < tokens.size() && (tokens.get(index) instanceof NewLine || tokens.get(index) instanceof Indent)) {
			index = index + 1;
		}
	}

	private void checkNotEof() {
		if (index >= tokens.size()) {
			int end = source.length() - 1;
			throw new SyntaxError("unexpected end-of-file", source, end, end);
		}
	}

	private Token match(String op) {
		checkNotEof();
		Token t = tokens.get(index);
		if (!t.text.equals(op)) {
			syntaxError("expecting '" + op + "', found '" + t.text + "'", t);
		}
		index = index + 1;
		return t;
	}

	private Token match(String... options) {
		checkNotEof();
		Token t = tokens.get(index);
		for (int i = 0; i != options.length; ++i) {
			if (t.text.equals(options[i])) {
				index = index + 1;
				return t;
			}
		}
		StringBuilder s = new StringBuilder();
		for (int i = 0; i != options.length; ++i) {
			if (i != 0) {
				s.append(" or ");
			}
			s.append("'").append(options[i]).append("'");
		}
		syntaxError("expecting " + s + ", found '" + t.text + "'", t);
		return null;
	}

	@SuppressWarnings("unchecked")
	private <T extends Token> T match(Class<T> c, String name) {
		checkNotEof();
		Token t = tokens.get(index);
		if (!c.isInstance(t)) {
			syntaxError("expecting " + name + ", found '" + describe(t) + "'", t);
		}
		index = index + 1;
		return (T) t;
	}

	private Identifier matchIdentifier() {
		checkNotEof();
		Token t = tokens.get(index);
		if (t instanceof Identifier) {
			index = index + 1;
			return (Identifier) t;
		}
		syntaxError("identifier expected, found '" + describe(t) + "'", t);
		return null; // unreachable.
	}

	private Keyword matchKeyword(String keyword) {
		checkNotEof();
		Token t = tokens.get(index);
		if (t instanceof Keyword && t.text.equals(keyword)) {
			index = index + 1;
			return (Keyword) t;
		}
		syntaxError("keyword " + keyword + " expected.", t);
		return null;
	}

	private static String describe(Token t) {
		return t instanceof NewLine ? "end of line" : t.text;
	}

	private Attribute.Source sourceAttr(int start, int end) {
		Token t1 = tokens.get(start);
		Token t2 = tokens.get(end);
		return new Attribute.Source(t1.start, t2.end());
	}

	private void syntaxError(String msg, Token t) {
		throw new SyntaxError(msg, source, t.start, t.end());
	}
}
