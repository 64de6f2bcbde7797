package org.metricshub.jformula;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jformula
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.jformula.address.CellAddress;
import org.metricshub.jformula.ast.AstGraph;
import org.metricshub.jformula.ast.AstNode;
import org.metricshub.jformula.context.EvaluationContext;
import org.metricshub.jformula.context.FormulaContext;
import org.metricshub.jformula.frontend.ParserException;
import org.metricshub.jformula.frontend.Token;
import org.metricshub.jformula.util.CompilerSettings;

/**
 * Command-line interface for Jformula: compiles the formulas given as
 * arguments, or read from the standard input, and prints their code.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "Jformula.jar";
		}
		JAR_NAME = myName;
	}

	private static final Pattern FUNCTION_NAME_PATTERN = Pattern.compile("([_a-zA-Z][_.0-9a-zA-Z]*)=([_a-zA-Z][_.0-9a-zA-Z]*)");

	private final CompilerSettings settings = new CompilerSettings();
	private final InputStream in;
	private final PrintStream out;
	private final PrintStream err;

	private final List<String> formulas = new ArrayList<String>();
	private boolean readStandardInput;
	private String currentCell;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param in stream from which formulas are read when none is given as argument
	 * @param out stream where the code is written
	 * @param err stream where {@link #execute(String[])} reports failures
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, PrintStream err) {
		this.in = in;
		this.out = out;
		this.err = err;
	}

	/**
	 * Returns the mutable {@link CompilerSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public CompilerSettings getSettings() {
		return settings;
	}

	/**
	 * @return the formulas specified on the command line
	 */
	public List<String> getFormulas() {
		return new ArrayList<String>(formulas);
	}

	public String getCurrentCell() {
		return currentCell;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("Empty argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-' || !arg.startsWith("--") && arg.length() > 1 && !isShortOption(arg)) {
				// end of options: a formula like -A1 starts with a dash too
				break;
			} else if (arg.equals("-")) {
				// single dash: read formulas from stdin
				readStandardInput = true;
				++argIdx;
				break;
			} else if (arg.equals("-c") || arg.equals("--cell")) {
				// -c cell : qualify references with the sheet of this cell
				checkParameterHasArgument(args, argIdx);
				currentCell = args[++argIdx];
			} else if (arg.equals("-m") || arg.equals("--map")) {
				// -m name=emitted : emit a function under another name
				checkParameterHasArgument(args, argIdx);
				addFunctionName(settings, args[++argIdx]);
			} else if (arg.equals("--cell-lookup")) {
				checkParameterHasArgument(args, argIdx);
				settings.setCellLookupName(args[++argIdx]);
			} else if (arg.equals("--range-lookup")) {
				checkParameterHasArgument(args, argIdx);
				settings.setRangeLookupName(args[++argIdx]);
			} else if (arg.equals("--dump-tokens")) {
				settings.setDumpTokens(true);
			} else if (arg.equals("--dump-postfix")) {
				settings.setDumpPostfix(true);
			} else if (arg.equals("--dump-syntax")) {
				settings.setDumpSyntaxTree(true);
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("-h cannot be combined with other arguments");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown option: " + arg);
			}
			++argIdx;
		}

		while (argIdx < args.length) {
			formulas.add(args[argIdx++]);
		}
		if (formulas.isEmpty()) {
			readStandardInput = true;
		}
	}

	private static boolean isShortOption(String arg) {
		return arg.equals("-c") || arg.equals("-m") || arg.equals("-h") || arg.equals("-?");
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for option " + args[argIdx]);
		}
	}

	/**
	 * Parses a function name mapping passed via <code>-m</code> and stores it
	 * in the provided settings instance.
	 *
	 * @param settings settings to mutate
	 * @param mapping string of the form {@code name=emitted}
	 */
	private static void addFunctionName(CompilerSettings settings, String mapping) {
		Matcher m = FUNCTION_NAME_PATTERN.matcher(mapping);
		if (!m.matches()) {
			throw new IllegalArgumentException("mapping \"" + mapping + "\" must be of the form \"name=emitted\"");
		}
		settings.putFunctionName(m.group(1), m.group(2));
	}

	/**
	 * Compiles the formulas and prints their code, one line each.
	 *
	 * @throws IOException if the formulas cannot be read from the input stream
	 * @throws ParserException if a formula cannot be compiled
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}

		FormulaCompiler compiler = new FormulaCompiler(settings);
		EvaluationContext context = createContext();

		List<String> all = new ArrayList<String>(formulas);
		if (readStandardInput) {
			BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
			String line;
			while ((line = reader.readLine()) != null) {
				if (!line.trim().isEmpty()) {
					all.add(line);
				}
			}
		}

		for (String formula : all) {
			compile(compiler, formula, context);
		}
	}

	private void compile(FormulaCompiler compiler, String formula, EvaluationContext context) {
		if (settings.isDumpTokens()) {
			for (Token token : compiler.tokenize(formula)) {
				out.println(token);
			}
		}
		if (settings.isDumpPostfix()) {
			StringBuilder postfix = new StringBuilder();
			for (AstNode node : compiler.parseToPostfix(formula)) {
				if (postfix.length() > 0) {
					postfix.append(' ');
				}
				postfix.append(node);
			}
			out.println(postfix);
		}
		CompiledFormula compiled = compiler.compile(formula, context);
		if (settings.isDumpSyntaxTree()) {
			AstGraph ast = compiled.getAst();
			ast.dump(out);
		}
		out.println(compiled.getCode());
	}

	private EvaluationContext createContext() {
		if (currentCell == null) {
			return null;
		}
		CellAddress cell = settings.getAddressSyntax().splitAddress(currentCell);
		if (!cell.hasSheet()) {
			throw new IllegalArgumentException("Current cell must include its sheet, like Sheet1!A1: " + currentCell);
		}
		return FormulaContext.of(cell.getSheet(), currentCell);
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-c sheet!cell]" +
								" [-m name=emitted]..." +
								" [--cell-lookup name]" +
								" [--range-lookup name]" +
								" [--dump-tokens]" +
								" [--dump-postfix]" +
								" [--dump-syntax]" +
								" [formula... | -]");
		dest.println();
		dest.println(" -c, --cell sheet!cell = Compile in the context of this cell: unqualified references use its sheet.");
		dest.println(" -m, --map name=emitted = Emit the spreadsheet function 'name' as 'emitted'.");
		dest.println(" --cell-lookup name = Name of the runtime function returning a cell value (default: eval_cell).");
		dest.println(" --range-lookup name = Name of the runtime function returning range values (default: eval_range).");
		dest.println(" --dump-tokens = Print the tokens of each formula.");
		dest.println(" --dump-postfix = Print the postfix form of each formula.");
		dest.println(" --dump-syntax = Print the syntax tree of each formula.");
		dest.println(" - = Read formulas from the standard input, one per line (default when no formula is given).");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param is input stream for formulas
	 * @param os output stream for the code
	 * @param es error stream for diagnostic messages
	 * @return configured and executed CLI instance
	 * @throws IOException if the formulas cannot be read
	 */
	public static Cli create(String[] args, InputStream is, PrintStream os, PrintStream es) throws IOException {
		Cli cli = new Cli(is, os, es);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Parses the arguments and compiles the formulas, reporting failures on the
	 * error stream instead of throwing.
	 *
	 * @param args command line arguments
	 * @return the exit status: 0 on success, 1 on failure
	 */
	public int execute(String[] args) {
		try {
			parse(args);
			run();
			return 0;
		} catch (IllegalArgumentException e) {
			err.println("Invalid arguments: " + e.getMessage() + " (see -h for usage)");
			return 1;
		} catch (ParserException | IOException e) {
			err.printf("%s: %s%n", e.getClass().getSimpleName(), e.getMessage());
			return 1;
		}
	}

	/**
	 * Command line entry point.
	 *
	 * @param args command line arguments
	 */
	public static void main(String[] args) {
		int status = new Cli().execute(args);
		if (status != 0) {
			System.exit(status);
		}
	}
}
