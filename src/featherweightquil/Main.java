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
package featherweightquil;

import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import featherweightquil.core.Program;
import featherweightquil.io.Lexer;
import featherweightquil.io.Parser;
import featherweightquil.latex.Latex;
import featherweightquil.latex.LatexGenError;
import featherweightquil.latex.RenderSettings;
import featherweightquil.util.OptArg;
import featherweightquil.util.SyntaxError;

/**
 * Command-line entry point which draws the circuit of a Quil file as a LaTeX
 * document, written to standard output.
 *
 * @author David J. Pearce
 *
 */
public class Main {
	public static final int SUCCESS = 0;
	public static final int SYNTAX_ERROR = 1;
	public static final int GENERATION_ERROR = 2;
	public static final int USAGE_ERROR = 3;
	public static final int IO_ERROR = 4;

	/**
	 * Command-line options
	 */
	public static final OptArg[] OPTIONS = {
			new OptArg("help", "h", "print this help information"),
			new OptArg("texify", "t", OptArg.BOOL, "render pi, alpha, etc as LaTeX symbols", true),
			new OptArg("impute", "i", "include qubits between those referenced"),
			new OptArg("nolabels", "n", "omit the ket labels of qubit lines"),
			new OptArg("abbreviate", "a", "abbreviate controlled rotations"),
			new OptArg("openwire", "w", OptArg.INT, "length of open wires at the right", 1),
			new OptArg("noalign", "do not right align terminal measurements"),
	};

	public static void main(String[] _args) {
		System.exit(run(_args, System.out, System.err));
	}

	/**
	 * Run the command line with the given arguments, returning the exit code.
	 *
	 * @param _args
	 * @param out
	 * @param err
	 * @return
	 */
	public static int run(String[] _args, PrintStream out, PrintStream err) {
		List<String> args = new ArrayList<>(Arrays.asList(_args));
		Map<String, Object> options;
		RenderSettings settings;
		try {
			options = OptArg.parseOptions(args, OPTIONS);
			settings = toSettings(options);
		} catch (IllegalArgumentException e) {
			err.println(e.getMessage());
			usage(err);
			return USAGE_ERROR;
		}
		if (options.containsKey("help")) {
			usage(out);
			return SUCCESS;
		} else if (args.size() != 1) {
			usage(err);
			return USAGE_ERROR;
		}
		try {
			Lexer lexer = new Lexer(args.get(0));
			List<Lexer.Token> tokens = lexer.scan();
			Program program = new Parser(lexer.input(), tokens).parseProgram();
			out.println(Latex.toLatex(program, settings));
			return SUCCESS;
		} catch (SyntaxError e) {
			e.outputSourceError(err);
			return SYNTAX_ERROR;
		} catch (LatexGenError e) {
			err.println("error: " + e.getMessage());
			return GENERATION_ERROR;
		} catch (IOException e) {
			err.println("error: " + e.getMessage());
			return IO_ERROR;
		}
	}

	/**
	 * Construct the render settings determined by a set of parsed options.
	 *
	 * @param options
	 * @return
	 */
	public static RenderSettings toSettings(Map<String, Object> options) {
		return new RenderSettings.Builder()
				.texifyNumericalConstants((Boolean) options.get("texify"))
				.imputeMissingQubits(options.containsKey("impute"))
				.labelQubitLines(!options.containsKey("nolabels"))
				.abbreviateControlledRotations(options.containsKey("abbreviate"))
				.qubitLineOpenWireLength((Integer) options.get("openwire"))
				.rightAlignTerminalMeasurements(!options.containsKey("noalign"))
				.build();
	}

	private static void usage(PrintStream output) {
		output.println("usage: fqc [options] file.quil");
		OptArg.usage(output, OPTIONS);
	}
}
