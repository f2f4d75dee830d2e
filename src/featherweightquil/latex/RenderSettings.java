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
 * Determines how a circuit is rendered. Settings are immutable, and are
 * constructed either from {@link #DEFAULT} or via a {@link Builder}.
 *
 * @author David J. Pearce
 *
 */
public final class RenderSettings {
	public static final RenderSettings DEFAULT = new Builder().build();

	/**
	 * Convert numerical constants, such as pi, to LaTeX form.
	 */
	private final boolean texifyNumericalConstants;
	/**
	 * Include qubits with indices between those explicitly referenced. For
	 * example, <code>CNOT 0 2</code> then has three qubit lines: 0, 1 and 2.
	 */
	private final boolean imputeMissingQubits;
	/**
	 * Label qubit lines with their kets.
	 */
	private final boolean labelQubitLines;
	// The following are accepted but do not (yet) affect rendering.
	private final boolean abbreviateControlledRotations;
	private final int qubitLineOpenWireLength;
	private final boolean rightAlignTerminalMeasurements;

	private RenderSettings(Builder builder) {
		this.texifyNumericalConstants = builder.texifyNumericalConstants;
		this.imputeMissingQubits = builder.imputeMissingQubits;
		this.labelQubitLines = builder.labelQubitLines;
		this.abbreviateControlledRotations = builder.abbreviateControlledRotations;
		this.qubitLineOpenWireLength = builder.qubitLineOpenWireLength;
		this.rightAlignTerminalMeasurements = builder.rightAlignTerminalMeasurements;
	}

	public boolean texifyNumericalConstants() {
		return texifyNumericalConstants;
	}

	public boolean imputeMissingQubits() {
		return imputeMissingQubits;
	}

	public boolean labelQubitLines() {
		return labelQubitLines;
	}

	/**
	 * Write controlled rotations in compact form, e.g. <code>RX(pi)</code> as
	 * <code>X_{\pi}</code> rather than <code>R_X(\pi)</code>.
	 *
	 * @return
	 */
	public boolean abbreviateControlledRotations() {
		return abbreviateControlledRotations;
	}

	/**
	 * The length by which qubit lines are extended with open wires at the right
	 * of the diagram.
	 *
	 * @return
	 */
	public int qubitLineOpenWireLength() {
		return qubitLineOpenWireLength;
	}

	/**
	 * Align measurements which end the program at the right of the diagram.
	 *
	 * @return
	 */
	public boolean rightAlignTerminalMeasurements() {
		return rightAlignTerminalMeasurements;
	}

	/**
	 * Produce the label for the qubit line of a given qubit.
	 *
	 * @param qubit
	 * @return
	 */
	public Command label(long qubit) {
		return labelQubitLines ? new Command.Lstick(qubit) : Command.QW;
	}

	public Builder toBuilder() {
		return new Builder(this);
	}

	@Override
	public String toString() {
		return "{texify=" + texifyNumericalConstants + ", impute=" + imputeMissingQubits + ", labels="
				+ labelQubitLines + ", abbreviate=" + abbreviateControlledRotations + ", openwire="
				+ qubitLineOpenWireLength + ", rightalign=" + rightAlignTerminalMeasurements + "}";
	}

	public static final class Builder {
		private boolean texifyNumericalConstants = true;
		private boolean imputeMissingQubits = false;
		private boolean labelQubitLines = true;
		private boolean abbreviateControlledRotations = false;
		private int qubitLineOpenWireLength = 1;
		private boolean rightAlignTerminalMeasurements = true;

		public Builder() {
		}

		private Builder(RenderSettings settings) {
			this.texifyNumericalConstants = settings.texifyNumericalConstants;
			this.imputeMissingQubits = settings.imputeMissingQubits;
			this.labelQubitLines = settings.labelQubitLines;
			this.abbreviateControlledRotations = settings.abbreviateControlledRotations;
			this.qubitLineOpenWireLength = settings.qubitLineOpenWireLength;
			this.rightAlignTerminalMeasurements = settings.rightAlignTerminalMeasurements;
		}

		public Builder texifyNumericalConstants(boolean flag) {
			this.texifyNumericalConstants = flag;
			return this;
		}

		public Builder imputeMissingQubits(boolean flag) {
			this.imputeMissingQubits = flag;
			return this;
		}

		public Builder labelQubitLines(boolean flag) {
			this.labelQubitLines = flag;
			return this;
		}

		public Builder abbreviateControlledRotations(boolean flag) {
			this.abbreviateControlledRotations = flag;
			return this;
		}

		public Builder qubitLineOpenWireLength(int length) {
			if (length < 0) {
				throw new IllegalArgumentException("negative open wire length " + length);
			}
			this.qubitLineOpenWireLength = length;
			return this;
		}

		public Builder rightAlignTerminalMeasurements(boolean flag) {
			this.rightAlignTerminalMeasurements = flag;
			return this;
		}

		public RenderSettings build() {
			return new RenderSettings(this);
		}
	}
}
