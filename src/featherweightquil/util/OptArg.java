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
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Describes a single command-line option, and provides the machinery for
 * extracting options from a list of command-line arguments. An option is either
 * a flag (which takes no argument) or carries a value of a given
 * {@link Kind}. Options are written <code>--name value</code>,
 * <code>--name=value</code> or <code>-n value</code>.
 *
 * @author David J. Pearce
 *
 */
public class OptArg {
	/**
	 * The long name of the option (e.g. "impute").
	 */
	public final String name;
	/**
	 * The short name of the option (e.g. "i").
	 */
	public final String shortName;
	/**
	 * The kind of argument accepted, or <code>null</code> for a flag.
	 */
	public final Kind argument;
	/**
	 * A human-readable description used for usage information.
	 */
	public final String description;
	/**
	 * The value used when the option is not given (may be null).
	 */
	public final Object defaultValue;

	/**
	 * Construct a flag with no argument and no default.
	 */
	public OptArg(String name, String shortName, String description) {
		this(name, shortName, null, description, null);
	}

	/**
	 * Construct a long-only flag with no argument and no default.
	 */
	public OptArg(String name, String description) {
		this(name, null, null, description, null);
	}

	public OptArg(String name, String shortName, Kind argument, String description) {
		this(name, shortName, argument, description, null);
	}

	public OptArg(String name, String shortName, Kind argument, String description, Object defaultValue) {
		this.name = name;
		this.shortName = shortName;
		this.argument = argument;
		this.description = description;
		this.defaultValue = defaultValue;
	}

	/**
	 * Responsible for converting the textual form of an argument into its
	 * value.
	 */
	public interface Kind {
		public Object process(String arg);
	}

	public static final Kind STRING = (arg) -> arg;

	public static final Kind INT = (arg) -> {
		try {
			return Integer.parseInt(arg);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("invalid integer \"" + arg + "\"", e);
		}
	};

	public static final Kind LONG = (arg) -> {
		try {
			return Long.parseLong(arg);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("invalid long \"" + arg + "\"", e);
		}
	};

	public static final Kind BOOL = (arg) -> {
		if (arg.equalsIgnoreCase("true") || arg.equals("1")) {
			return Boolean.TRUE;
		} else if (arg.equalsIgnoreCase("false") || arg.equals("0")) {
			return Boolean.FALSE;
		}
		throw new IllegalArgumentException("invalid boolean \"" + arg + "\"");
	};

	private boolean matches(String text) {
		return text.equals("--" + name) || (shortName != null && text.equals("-" + shortName));
	}

	/**
	 * Extract all recognised options from the given argument list. Recognised
	 * options (and their arguments) are removed from the list, leaving only the
	 * positional arguments behind. Options which are not given but have a default
	 * value are included in the resulting map with that value.
	 *
	 * @param args    The mutable list of command-line arguments.
	 * @param options The set of permitted options.
	 * @return
	 */
	public static Map<String, Object> parseOptions(List<String> args, OptArg... options) {
		HashMap<String, Object> result = new HashMap<>();
		Iterator<String> iter = args.iterator();
		while (iter.hasNext()) {
			String arg = iter.next();
			if (!arg.startsWith("-") || arg.equals("-")) {
				continue;
			}
			String value = null;
			int eq = arg.indexOf('=');
			if (arg.startsWith("--") && eq > 0) {
				value = arg.substring(eq + 1);
				arg = arg.substring(0, eq);
			}
			OptArg option = find(arg, options);
			if (option == null) {
				throw new IllegalArgumentException("unrecognised option \"" + arg + "\"");
			}
			iter.remove();
			if (option.argument == null) {
				if (value != null) {
					throw new IllegalArgumentException("option \"" + arg + "\" does not take an argument");
				}
				result.put(option.name, Boolean.TRUE);
			} else {
				if (value == null) {
					if (!iter.hasNext()) {
						throw new IllegalArgumentException("missing argument for option \"" + arg + "\"");
					}
					value = iter.next();
					iter.remove();
				}
				result.put(option.name, option.argument.process(value));
			}
		}
		// Fill in defaults
		for (OptArg option : options) {
			if (!result.containsKey(option.name) && option.defaultValue != null) {
				result.put(option.name, option.defaultValue);
			}
		}
		return result;
	}

	private static OptArg find(String text, OptArg[] options) {
		for (OptArg option : options) {
			if (option.matches(text)) {
				return option;
			}
		}
		return null;
	}

	/**
	 * Print a usage summary for the given options.
	 *
	 * @param output
	 * @param options
	 */
	public static void usage(PrintStream output, OptArg... options) {
		int width = 0;
		for (OptArg option : options) {
			width = Math.max(width, option.name.length());
		}
		for (OptArg option : options) {
			StringBuilder line = new StringBuilder(" ");
			line.append(option.shortName != null ? "-" + option.shortName + ", " : "    ");
			line.append("--").append(option.name);
			for (int i = option.name.length(); i < width + 2; ++i) {
				line.append(' ');
			}
			line.append(option.description);
			if (option.defaultValue != null) {
				line.append(" (default ").append(option.defaultValue).append(")");
			}
			output.println(line);
		}
	}
}
