// This file is part of the MIR Borrow Checker (mirborrowck).
//
// The MIR Borrow Checker is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The MIR Borrow Checker is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the MIR Borrow Checker. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2026, the MIR Borrow Checker authors.
package mirborrowck;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import mirborrowck.core.ModuleChecker;
import mirborrowck.core.Options;
import mirborrowck.core.Report;
import mirborrowck.core.Syntax.Module;
import mirborrowck.io.Lexer;
import mirborrowck.io.Parser;
import mirborrowck.util.AnalysisException;
import mirborrowck.util.SyntaxError;

/**
 * Command-line driver which borrow checks one or more files of textual MIR.
 * For example:
 *
 * <pre>
 * java mirborrowck.Main -unified -threads 4 examples/*.mir
 * </pre>
 *
 * The exit code is non-zero if any function has errors or could not be
 * checked.
 */
public class Main {
	private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

	public static final String USAGE = "usage: java mirborrowck.Main [-unified] [-threads n] [-validate] [-warn] file...";

	public static void main(String[] _args) throws Exception {
		List<String> args = new ArrayList<>(Arrays.asList(_args));
		Options options = new Options();
		try {
			parseOptions(args, options);
		} catch (IllegalArgumentException e) {
			System.err.println(e.getMessage());
			System.err.println(USAGE);
			System.exit(2);
		}
		if (args.isEmpty()) {
			System.err.println(USAGE);
			System.exit(2);
		}
		boolean ok = true;
		Report.Statistics total = new Report.Statistics();
		for (String file : args) {
			ok &= check(file, options, total);
		}
		System.out.println("checked " + total.functionsAnalyzed() + " functions: " + total);
		System.exit(ok ? 0 : 1);
	}

	/**
	 * Extract the options from a list of command-line arguments, leaving only
	 * the files to check.
	 *
	 * @param args
	 * @param options
	 */
	public static void parseOptions(List<String> args, Options options) {
		while (!args.isEmpty() && args.get(0).startsWith("-")) {
			String arg = args.remove(0);
			switch (arg) {
			case "-unified":
				options.setStrategy(Options.Strategy.UNIFIED);
				break;
			case "-validate":
				options.setValidateFixpoint(true);
				break;
			case "-warn":
				options.setDynamicIndexWarnings(true);
				break;
			case "-threads":
				if (args.isEmpty()) {
					throw new IllegalArgumentException("missing thread count");
				}
				try {
					options.setThreads(Integer.parseInt(args.remove(0)));
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException("invalid thread count", e);
				}
				break;
			default:
				throw new IllegalArgumentException("unknown option " + arg);
			}
		}
	}

	private static boolean check(String file, Options options, Report.Statistics total)
			throws InterruptedException {
		Lexer lexer;
		try {
			lexer = new Lexer(file);
		} catch (IOException e) {
			LOGGER.error("unable to read {}: {}", file, e.getMessage());
			return false;
		}
		Module module;
		try {
			module = new Parser(file, lexer.source(), lexer.scan()).parseModule();
		} catch (SyntaxError e) {
			e.outputSourceError(System.err);
			return false;
		} catch (AnalysisException e) {
			LOGGER.error("{}: {}", file, e.getMessage());
			return false;
		}
		boolean ok = true;
		List<ModuleChecker.Outcome> outcomes = new ModuleChecker(options, module).check();
		for (ModuleChecker.Outcome o : outcomes) {
			if (o.report() != null) {
				o.report().print(System.err, lexer.source());
			}
			ok &= o.isValid();
		}
		total.merge(ModuleChecker.summarise(outcomes));
		return ok;
	}
}
