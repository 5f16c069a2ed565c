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

import mirborrowck.dataflow.WorkListSolver;

/**
 * Configures how functions are borrow checked.
 */
public class Options {
	public enum Strategy {
		/**
		 * Separate passes for facts, each dataflow problem and each check.
		 */
		MULTI_PASS,
		/**
		 * One combined dataflow problem followed by a single checking sweep.
		 */
		UNIFIED
	}

	/**
	 * Which conflict detector to use.
	 */
	private Strategy strategy = Strategy.MULTI_PASS;

	/**
	 * Each dataflow computation may take at most this many steps per node.
	 */
	private int iterationFactor = WorkListSolver.DEFAULT_ITERATION_FACTOR;

	/**
	 * Re-check every dataflow result is a fixpoint. Expensive.
	 */
	private boolean validateFixpoint = false;

	/**
	 * Check every loan's creation dominates its uses.
	 */
	private boolean validateLoans = true;

	/**
	 * Classify consuming uses as moves or borrows using liveness.
	 */
	private boolean refineCandidateMoves = true;

	/**
	 * Report conflicts which only arise from dynamic indices or dereferences as
	 * warnings rather than errors.
	 */
	private boolean dynamicIndexWarnings = false;

	/**
	 * Configure number of threads to use when checking a module.
	 */
	private int threads = Runtime.getRuntime().availableProcessors();

	public Strategy getStrategy() {
		return strategy;
	}

	public Options setStrategy(Strategy strategy) {
		this.strategy = strategy;
		return this;
	}

	public int getIterationFactor() {
		return iterationFactor;
	}

	public Options setIterationFactor(int iterationFactor) {
		if (iterationFactor <= 0) {
			throw new IllegalArgumentException("invalid iteration factor: " + iterationFactor);
		}
		this.iterationFactor = iterationFactor;
		return this;
	}

	public boolean getValidateFixpoint() {
		return validateFixpoint;
	}

	public Options setValidateFixpoint(boolean flag) {
		this.validateFixpoint = flag;
		return this;
	}

	public boolean getValidateLoans() {
		return validateLoans;
	}

	public Options setValidateLoans(boolean flag) {
		this.validateLoans = flag;
		return this;
	}

	public boolean getRefineCandidateMoves() {
		return refineCandidateMoves;
	}

	public Options setRefineCandidateMoves(boolean flag) {
		this.refineCandidateMoves = flag;
		return this;
	}

	public boolean getDynamicIndexWarnings() {
		return dynamicIndexWarnings;
	}

	public Options setDynamicIndexWarnings(boolean flag) {
		this.dynamicIndexWarnings = flag;
		return this;
	}

	public int getThreads() {
		return threads;
	}

	public Options setThreads(int threads) {
		if (threads <= 0) {
			throw new IllegalArgumentException("invalid thread count: " + threads);
		}
		this.threads = threads;
		return this;
	}

	@Override
	public String toString() {
		return "{strategy=" + strategy + ", iterationFactor=" + iterationFactor + ", validateFixpoint="
				+ validateFixpoint + ", validateLoans=" + validateLoans + ", refine=" + refineCandidateMoves
				+ ", dynamicIndexWarnings=" + dynamicIndexWarnings + ", threads=" + threads + "}";
	}
}
