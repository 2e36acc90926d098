// Copyright (c) 2001-2014 Genome Research Ltd.
//
// Authors: David Harper
//          Ed Zuiderwijk
//          Kate Taylor
//
// This file is part of Arcturus.
//
// Arcturus is free software: you can redistribute it and/or modify it under
// the terms of the GNU General Public License as published by the Free Software
// Foundation; either version 3 of the License, or (at your option) any later
// version.
//
// This program is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// this program. If not, see <http://www.gnu.org/licenses/>.

package uk.ac.sanger.hmmgraph.fees;

/**
 * The costs of a profile HMM of length M, for columns 0 to M inclusive.
 * Costs are negated log-probabilities, so lower is better. Column 0 has no
 * match state; its match emissions are never read.
 * <p>
 * Instances are immutable. Use {@link FeesBuilder} to make one.
 */

public class Fees {
	protected final int length;
	protected final Alphabet alphabet;
	protected final double[][] transitions;
	protected final double[][] matchEmissions;
	protected final double[][] insertEmissions;

	Fees(int length, Alphabet alphabet, double[][] transitions,
			double[][] matchEmissions, double[][] insertEmissions) {
		this.length = length;
		this.alphabet = alphabet;
		this.transitions = transitions;
		this.matchEmissions = matchEmissions;
		this.insertEmissions = insertEmissions;
	}

	/**
	 * Returns the number of match columns, M.
	 */

	public int getLength() {
		return length;
	}

	public Alphabet getAlphabet() {
		return alphabet;
	}

	public int code(char symbol) {
		return alphabet.code(symbol);
	}

	public double getTransition(int column, Transition transition) {
		checkColumn(column);
		return transitions[column][transition.ordinal()];
	}

	public double getMatchEmission(int column, char symbol) {
		checkColumn(column);
		return matchEmissions[column][alphabet.code(symbol)];
	}

	public double getInsertEmission(int column, char symbol) {
		checkColumn(column);
		return insertEmissions[column][alphabet.code(symbol)];
	}

	/**
	 * Returns a copy of the match emission costs of a column, indexed by
	 * {@link #code(char)}.
	 */

	public double[] getMatchEmissions(int column) {
		checkColumn(column);
		return matchEmissions[column].clone();
	}

	public double[] getInsertEmissions(int column) {
		checkColumn(column);
		return insertEmissions[column].clone();
	}

	/**
	 * Returns true if a single turn of the insertion self-loop at this column
	 * cannot decrease the score, whatever symbol it consumes.
	 */

	public boolean checkILoop(int column) {
		checkColumn(column);

		double cheapest = Double.POSITIVE_INFINITY;

		for (double fee : insertEmissions[column])
			cheapest = Math.min(cheapest, fee);

		return transitions[column][Transition.II.ordinal()] + cheapest >= 0;
	}

	public boolean isILoopNonNegative(int column) {
		return checkILoop(column);
	}

	public boolean checkINegativeLoops() {
		for (int column = 0; column <= length; column++)
			if (!checkILoop(column))
				return false;

		return true;
	}

	private void checkColumn(int column) {
		if (column < 0 || column > length)
			throw new IllegalArgumentException("Column " + column
					+ " is outside a profile of length " + length);
	}

	public String toString() {
		return "Fees[M=" + length + ", " + alphabet + "]";
	}
}
