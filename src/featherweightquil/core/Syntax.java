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

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import featherweightquil.util.SyntacticElement;

/**
 * The abstract syntax of Quil programs. Instructions and expressions each carry
 * an opcode identifying their syntactic form, which allows clients to dispatch
 * without chains of <code>instanceof</code> tests. Every node prints back as
 * valid Quil via <code>toString()</code>.
 *
 * @author David J. Pearce
 *
 */
public class Syntax {
	public final static int INSTR_gate = 0;
	public final static int INSTR_defgate = 1;
	public final static int INSTR_declare = 2;
	public final static int INSTR_measure = 3;
	public final static int INSTR_reset = 4;
	public final static int INSTR_halt = 5;
	public final static int INSTR_nop = 6;
	public final static int INSTR_pragma = 7;

	public final static int EXPR_number = 20;
	public final static int EXPR_pi = 21;
	public final static int EXPR_address = 22;
	public final static int EXPR_variable = 23;
	public final static int EXPR_prefix = 24;
	public final static int EXPR_infix = 25;
	public final static int EXPR_call = 26;

	public interface Instruction extends SyntacticElement {

		/**
		 * Get the opcode associated with the syntactic form of this instruction.
		 *
		 * @return
		 */
		public int getOpcode();

		/**
		 * An abstract instruction to be implemented by all other instructions.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static abstract class AbstractInstruction extends SyntacticElement.Impl implements Instruction {
			private final int opcode;

			public AbstractInstruction(int opcode, Attribute... attributes) {
				super(attributes);
				this.opcode = opcode;
			}

			@Override
			public int getOpcode() {
				return opcode;
			}
		}

		/**
		 * Represents the application of a (possibly modified) gate to one or more
		 * qubits, such as the following:
		 *
		 * <pre>
		 * H 0
		 * CPHASE(pi/2) 0 1
		 * CONTROLLED DAGGER Y 0 1
		 * </pre>
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Gate extends AbstractInstruction {
			private final String name;
			private final Expression[] parameters;
			private final Qubit[] qubits;
			private final GateModifier[] modifiers;

			public Gate(String name, Expression[] parameters, Qubit[] qubits, GateModifier[] modifiers,
					Attribute... attributes) {
				super(INSTR_gate, attributes);
				this.name = name;
				this.parameters = parameters;
				this.qubits = qubits;
				this.modifiers = modifiers;
			}

			public Gate(String name, Qubit... qubits) {
				this(name, new Expression[0], qubits, new GateModifier[0]);
			}

			/**
			 * The base name of the gate, without any modifiers applied.
			 *
			 * @return
			 */
			public String name() {
				return name;
			}

			public List<Expression> parameters() {
				return Arrays.asList(parameters);
			}

			/**
			 * The qubits this gate acts upon, in declaration order.
			 *
			 * @return
			 */
			public List<Qubit> qubits() {
				return Arrays.asList(qubits);
			}

			/**
			 * The modifiers applied to this gate, in declaration order.
			 *
			 * @return
			 */
			public List<GateModifier> modifiers() {
				return Arrays.asList(modifiers);
			}

			@Override
			public String toString() {
				StringBuilder r = new StringBuilder();
				for (GateModifier m : modifiers) {
					r.append(m).append(' ');
				}
				r.append(name);
				if (parameters.length > 0) {
					r.append('(').append(join(parameters, ", ")).append(')');
				}
				for (Qubit q : qubits) {
					r.append(' ').append(q);
				}
				return r.toString();
			}
		}

		/**
		 * Represents a user-defined gate, given either as a matrix or as a
		 * permutation:
		 *
		 * <pre>
		 * DEFGATE G:
		 *     1, 0
		 *     0, 1
		 * </pre>
		 *
		 * @author David J. Pearce
		 *
		 */
		public class GateDefinition extends AbstractInstruction {
			public enum Kind {
				MATRIX, PERMUTATION
			}

			private final String name;
			private final String[] parameters;
			private final Kind kind;
			private final Expression[][] rows;

			public GateDefinition(String name, String[] parameters, Kind kind, Expression[][] rows,
					Attribute... attributes) {
				super(INSTR_defgate, attributes);
				this.name = name;
				this.parameters = parameters;
				this.kind = kind;
				this.rows = rows;
			}

			public String name() {
				return name;
			}

			/**
			 * The names of the formal parameters (without the leading '%').
			 *
			 * @return
			 */
			public List<String> parameters() {
				return Arrays.asList(parameters);
			}

			public Kind kind() {
				return kind;
			}

			public int size() {
				return rows.length;
			}

			public List<Expression> row(int i) {
				return Arrays.asList(rows[i]);
			}

			@Override
			public String toString() {
				StringBuilder r = new StringBuilder("DEFGATE ").append(name);
				if (parameters.length > 0) {
					r.append('(');
					for (int i = 0; i != parameters.length; ++i) {
						if (i != 0) {
							r.append(", ");
						}
						r.append('%').append(parameters[i]);
					}
					r.append(')');
				}
				if (kind == Kind.PERMUTATION) {
					r.append(" AS PERMUTATION");
				}
				r.append(':');
				for (Expression[] row : rows) {
					r.append("\n    ").append(join(row, ", "));
				}
				return r.toString();
			}
		}

		/**
		 * Represents a classical memory declaration, such as
		 * <code>DECLARE ro BIT[2]</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Declaration extends AbstractInstruction {
			public enum Type {
				BIT, OCTET, INTEGER, REAL
			}

			private final String name;
			private final Type type;
			private final long length;

			public Declaration(String name, Type type, long length, Attribute... attributes) {
				super(INSTR_declare, attributes);
				this.name = name;
				this.type = type;
				this.length = length;
			}

			public String name() {
				return name;
			}

			public Type type() {
				return type;
			}

			public long length() {
				return length;
			}

			@Override
			public String toString() {
				String r = "DECLARE " + name + " " + type;
				return length == 1 ? r : r + "[" + length + "]";
			}
		}

		/**
		 * Represents a measurement of a qubit, optionally storing the result in
		 * classical memory.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Measurement extends AbstractInstruction {
			private final Qubit qubit;
			private final MemoryReference target;

			public Measurement(Qubit qubit, MemoryReference target, Attribute... attributes) {
				super(INSTR_measure, attributes);
				this.qubit = qubit;
				this.target = target;
			}

			public Qubit qubit() {
				return qubit;
			}

			/**
			 * The memory location receiving the result, or <code>null</code> if
			 * the result is discarded.
			 *
			 * @return
			 */
			public MemoryReference target() {
				return target;
			}

			@Override
			public String toString() {
				return "MEASURE " + qubit + (target == null ? "" : " " + target);
			}
		}

		/**
		 * Represents a reset of either a single qubit or, when no qubit is given,
		 * of every qubit.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Reset extends AbstractInstruction {
			private final Qubit qubit;

			public Reset(Qubit qubit, Attribute... attributes) {
				super(INSTR_reset, attributes);
				this.qubit = qubit;
			}

			public Qubit qubit() {
				return qubit;
			}

			@Override
			public String toString() {
				return qubit == null ? "RESET" : "RESET " + qubit;
			}
		}

		public class Halt extends AbstractInstruction {
			public Halt(Attribute... attributes) {
				super(INSTR_halt, attributes);
			}

			@Override
			public String toString() {
				return "HALT";
			}
		}

		public class Nop extends AbstractInstruction {
			public Nop(Attribute... attributes) {
				super(INSTR_nop, attributes);
			}

			@Override
			public String toString() {
				return "NOP";
			}
		}

		/**
		 * A compiler directive. The arguments are retained verbatim and have no
		 * meaning to this toolkit.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Pragma extends AbstractInstruction {
			private final String name;
			private final String arguments;

			public Pragma(String name, String arguments, Attribute... attributes) {
				super(INSTR_pragma, attributes);
				this.name = name;
				this.arguments = arguments;
			}

			public String name() {
				return name;
			}

			public String arguments() {
				return arguments;
			}

			@Override
			public String toString() {
				return arguments.isEmpty() ? "PRAGMA " + name : "PRAGMA " + name + " " + arguments;
			}
		}
	}

	/**
	 * A modifier transforms the gate it is applied to.
	 *
	 * @author David J. Pearce
	 *
	 */
	public enum GateModifier {
		CONTROLLED, DAGGER, FORKED
	}

	/**
	 * Identifies a qubit, either by a fixed index or (within gate bodies) by a
	 * symbolic name.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Qubit {

		public static Fixed of(long index) {
			return new Fixed(index);
		}

		public final class Fixed implements Qubit {
			private final long index;

			public Fixed(long index) {
				if (index < 0) {
					throw new IllegalArgumentException("negative qubit index " + index);
				}
				this.index = index;
			}

			public long index() {
				return index;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Fixed && ((Fixed) o).index == index;
			}

			@Override
			public int hashCode() {
				return Long.hashCode(index);
			}

			@Override
			public String toString() {
				return Long.toString(index);
			}
		}

		public final class Variable implements Qubit {
			private final String name;

			public Variable(String name) {
				this.name = name;
			}

			public String name() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Variable && ((Variable) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public String toString() {
				return name;
			}
		}
	}

	/**
	 * A reference into classical memory, such as <code>ro[1]</code>.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class MemoryReference {
		private final String name;
		private final long index;

		public MemoryReference(String name, long index) {
			this.name = name;
			this.index = index;
		}

		public String name() {
			return name;
		}

		public long index() {
			return index;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof MemoryReference) {
				MemoryReference r = (MemoryReference) o;
				return r.name.equals(name) && r.index == index;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return name.hashCode() ^ Long.hashCode(index);
		}

		@Override
		public String toString() {
			return name + "[" + index + "]";
		}
	}

	public interface Expression extends SyntacticElement {

		public int getOpcode();

		/**
		 * Determine the binding strength of this expression when printed. Atoms
		 * bind tightest.
		 *
		 * @return
		 */
		public default int precedence() {
			return Integer.MAX_VALUE;
		}

		public static abstract class AbstractExpression extends SyntacticElement.Impl implements Expression {
			private final int opcode;

			public AbstractExpression(int opcode, Attribute... attributes) {
				super(attributes);
				this.opcode = opcode;
			}

			@Override
			public int getOpcode() {
				return opcode;
			}
		}

		/**
		 * A complex numeric literal. Purely real literals have a zero imaginary
		 * part.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Number extends AbstractExpression {
			private final double real;
			private final double imaginary;

			public Number(double real, double imaginary, Attribute... attributes) {
				super(EXPR_number, attributes);
				this.real = real;
				this.imaginary = imaginary;
			}

			public Number(double real, Attribute... attributes) {
				this(real, 0, attributes);
			}

			public double real() {
				return real;
			}

			public double imaginary() {
				return imaginary;
			}

			@Override
			public int precedence() {
				// complex literals print as a sum
				return real != 0 && imaginary != 0 ? Operator.PLUS.precedence : Integer.MAX_VALUE;
			}

			@Override
			public String toString() {
				if (imaginary == 0) {
					return format(real);
				} else if (real == 0) {
					return format(imaginary) + "i";
				} else if (imaginary < 0) {
					return format(real) + "-" + format(-imaginary) + "i";
				} else {
					return format(real) + "+" + format(imaginary) + "i";
				}
			}
		}

		public class PiConstant extends AbstractExpression {
			public PiConstant(Attribute... attributes) {
				super(EXPR_pi, attributes);
			}

			@Override
			public String toString() {
				return "pi";
			}
		}

		/**
		 * An expression which reads a location in classical memory.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Address extends AbstractExpression {
			private final MemoryReference reference;

			public Address(MemoryReference reference, Attribute... attributes) {
				super(EXPR_address, attributes);
				this.reference = reference;
			}

			public MemoryReference reference() {
				return reference;
			}

			@Override
			public String toString() {
				return reference.toString();
			}
		}

		/**
		 * A formal parameter of a gate definition, such as <code>%theta</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Variable extends AbstractExpression {
			private final String name;

			public Variable(String name, Attribute... attributes) {
				super(EXPR_variable, attributes);
				this.name = name;
			}

			public String name() {
				return name;
			}

			@Override
			public String toString() {
				return "%" + name;
			}
		}

		public class Prefix extends AbstractExpression {
			private final Expression operand;

			public Prefix(Expression operand, Attribute... attributes) {
				super(EXPR_prefix, attributes);
				this.operand = operand;
			}

			public Expression operand() {
				return operand;
			}

			@Override
			public int precedence() {
				return Operator.PREFIX_PRECEDENCE;
			}

			@Override
			public String toString() {
				return "-" + bracket(operand, operand.precedence() < Integer.MAX_VALUE);
			}
		}

		public class Infix extends AbstractExpression {
			private final Expression lhs;
			private final Operator operator;
			private final Expression rhs;

			public Infix(Expression lhs, Operator operator, Expression rhs, Attribute... attributes) {
				super(EXPR_infix, attributes);
				this.lhs = lhs;
				this.operator = operator;
				this.rhs = rhs;
			}

			public Expression leftOperand() {
				return lhs;
			}

			public Operator operator() {
				return operator;
			}

			public Expression rightOperand() {
				return rhs;
			}

			@Override
			public int precedence() {
				return operator.precedence;
			}

			@Override
			public String toString() {
				int p = operator.precedence;
				// '^' is right associative, all others are left associative
				boolean l = lhs.precedence() < p || (operator == Operator.CARET && lhs.precedence() == p);
				boolean r = rhs.precedence() < p || (operator != Operator.CARET && rhs.precedence() == p);
				return bracket(lhs, l) + operator + bracket(rhs, r);
			}
		}

		public class FunctionCall extends AbstractExpression {
			private final Function function;
			private final Expression argument;

			public FunctionCall(Function function, Expression argument, Attribute... attributes) {
				super(EXPR_call, attributes);
				this.function = function;
				this.argument = argument;
			}

			public Function function() {
				return function;
			}

			public Expression argument() {
				return argument;
			}

			@Override
			public String toString() {
				return function + "(" + argument + ")";
			}
		}

		public enum Operator {
			PLUS("+", 1), MINUS("-", 1), STAR("*", 2), SLASH("/", 2), CARET("^", 4);

			public static final int PREFIX_PRECEDENCE = 3;

			public final String symbol;
			public final int precedence;

			private Operator(String symbol, int precedence) {
				this.symbol = symbol;
				this.precedence = precedence;
			}

			@Override
			public String toString() {
				return symbol;
			}
		}

		public enum Function {
			SIN, COS, SQRT, EXP, CIS;

			/**
			 * Look up a function by its (lower case) Quil name, returning
			 * <code>null</code> if there is none.
			 *
			 * @param name
			 * @return
			 */
			public static Function lookup(String name) {
				for (Function f : values()) {
					if (f.toString().equals(name)) {
						return f;
					}
				}
				return null;
			}

			@Override
			public String toString() {
				return name().toLowerCase();
			}
		}
	}

	/**
	 * Print a real number in its shortest exact decimal form. For example,
	 * <code>1.0</code> prints as <code>1</code> and <code>0.5</code> as
	 * <code>0.5</code>.
	 *
	 * @param value
	 * @return
	 */
	public static String format(double value) {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			return Double.toString(value);
		} else if (value == 0) {
			return "0";
		}
		return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
	}

	private static String bracket(Expression e, boolean required) {
		return required ? "(" + e + ")" : e.toString();
	}

	private static String join(Object[] items, String separator) {
		StringBuilder r = new StringBuilder();
		for (int i = 0; i != items.length; ++i) {
			if (i != 0) {
				r.append(separator);
			}
			r.append(items[i]);
		}
		return r.toString();
	}
}
