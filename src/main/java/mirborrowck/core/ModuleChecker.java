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
package mirborrowck.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import mirborrowck.core.Syntax.Function;
import mirborrowck.core.Syntax.Module;

/**
 * Borrow checks every function of a module in parallel. Functions are checked
 * independently, so the failure of one (e.g. because its graph is malformed)
 * does not prevent the others from being checked.
 */
public class ModuleChecker {
	private static final Logger LOGGER = LoggerFactory.getLogger(ModuleChecker.class);

	private final Options options;
	private final Module module;

	public ModuleChecker(Options options, Module module) {
		this.options = options;
		this.module = module;
	}

	/**
	 * Check all functions, returning one outcome per function in declaration
	 * order.
	 *
	 * @return
	 * @throws InterruptedException
	 */
	public List<Outcome> check() throws InterruptedException {
		List<Function> functions = new ArrayList<>(module.functions());
		ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(options.getThreads(),
				Math.max(1, functions.size()))));
		try {
			List<Future<Report>> futures = new ArrayList<>();
			for (Function f : functions) {
				futures.add(executor.submit(() -> BorrowChecker.create(options, module).check(f)));
			}
			ArrayList<Outcome> outcomes = new ArrayList<>();
			for (int i = 0; i != functions.size(); ++i) {
				Function f = functions.get(i);
				try {
					outcomes.add(new Outcome(f.name(), futures.get(i).get(), null));
				} catch (ExecutionException e) {
					LOGGER.error("unable to check function {}: {}", f.name(), e.getCause().getMessage());
					outcomes.add(new Outcome(f.name(), null, e.getCause()));
				}
			}
			return outcomes;
		} finally {
			executor.shutdownNow();
		}
	}

	/**
	 * Combine the statistics of all successfully checked functions.
	 */
	public static Report.Statistics summarise(List<Outcome> outcomes) {
		Report.Statistics total = new Report.Statistics();
		for (Outcome o : outcomes) {
			if (o.report() != null) {
				total.merge(o.report().statistics());
			}
		}
		return total;
	}

	/**
	 * The result of checking one function: either a report or the failure which
	 * prevented it from being checked.
	 */
	public static class Outcome {
		private final String function;
		private final Report report;
		private final Throwable failure;

		public Outcome(String function, Report report, Throwable failure) {
			this.function = function;
			this.report = report;
			this.failure = failure;
		}

		public String function() {
			return function;
		}

		public Report report() {
			return report;
		}

		public Throwable failure() {
			return failure;
		}

		/**
		 * Check whether the function was checked and no errors were found.
		 */
		public boolean isValid() {
			return failure == null && report.isValid();
		}

		public List<BorrowError> errors() {
			return report == null ? Collections.<BorrowError>emptyList() : report.errors();
		}

		@Override
		public String toString() {
			return failure != null ? function + ": " + failure.getMessage() : report.toString();
		}
	}
}
