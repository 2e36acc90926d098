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

import java.util.Arrays;

/**
 * Collects the costs of a profile column by column. All costs start at zero.
 * Probabilities may be given instead of costs; they are stored as their
 * negated natural logarithm.
 */

public class FeesBuilder {
	protected final int length;
	protected final Alphabet alphabet;
	protected final double[][] transitions;
	protected final double[][] matchEmissions;
	protected final double[][] insertEmissions;

	public FeesBuilder(int length, Alphabet alphabet) {
		if (length < 0)
			throw new IllegalArgumentException("Profile length must not be negative");

		this.length = length;
		this.alphabet = alphabet;

		int width = alphabet.getEmissionVectorLength();

		transitions = new double[length + 1][Transition.values().length];
		matchEmissions = new double[length + 1][width];
		insertEmissions = new double[length + 1][width];
	}

	public int getLength() {
		return length;
	}

	public Alphabet getAlphabet() {
		return alphabet;
	}

	public FeesBuilder setTransition(int column, Transition transition, double cost) {
		checkColumn(column);
		transitions[column][transition.ordinal()] = cost;
		return this;
	}

	public FeesBuilder setTransitionProbability(int column, Transition transition, double probability) {
		return setTransition(column, transition, toCost(probability));
	}

	/**
	 * Sets the same transition cost at every column.
	 */

	public FeesBuilder setTransitionAllColumns(Transition transition, double cost) {
		for (int column = 0; column <= length; column++)
			transitions[column][transition.ordinal()] = cost;

		return this;
	}

	public FeesBuilder setMatchEmission(int column, char symbol, double cost) {
		checkColumn(column);
		matchEmissions[column][alphabet.code(symbol)] = cost;
		return this;
	}

	public FeesBuilder setMatchEmissions(int column, double[] costs) {
		checkColumn(column);
		checkWidth(costs);
		System.arraycopy(costs, 0, matchEmissions[column], 0, costs.length);
		return this;
	}

	public FeesBuilder setInsertEmission(int column, char symbol, double cost) {
		checkColumn(column);
		insertEmissions[column][alphabet.code(symbol)] = cost;
		return this;
	}

	public FeesBuilder setInsertEmissions(int column, double[] costs) {
		checkColumn(column);
		checkWidth(costs);
		System.arraycopy(costs, 0, insertEmissions[column], 0, costs.length);
		return this;
	}

	/**
	 * Sets the cost of symbols outside the alphabet, for match and insert
	 * states alike, at every column.
	 */

	public FeesBuilder setUnknownSymbolCost(double cost) {
		int unknown = alphabet.getUnknownCode();

		for (int column = 0; column <= length; column++) {
			matchEmissions[column][unknown] = cost;
			insertEmissions[column][unknown] = cost;
		}

		return this;
	}

	public Fees build() {
		return new Fees(length, alphabet, deepCopy(transitions),
				deepCopy(matchEmissions), deepCopy(insertEmissions));
	}

	public static double toCost(double probability) {
		if (probability < 0.0 || probability > 1.0 || Double.isNaN(probability))
			throw new IllegalArgumentException("Not a probability: " + probability);

		return -Math.log(probability);
	}

	private static double[][] deepCopy(double[][] array) {
		double[][] copy = new double[array.length][];

		for (int i = 0; i < array.length; i++)
			copy[i] = Arrays.copyOf(array[i], array[i].length);

		return copy;
	}

	private void checkColumn(int column) {
		if (column < 0 || column > length)
			throw new IllegalArgumentException("Column " + column
					+ " is outside a profile of length " + length);
	}

	private void checkWidth(double[] costs) {
		if (costs.length != alphabet.getEmissionVectorLength())
			throw new IllegalArgumentException("Expected " + alphabet.getEmissionVectorLength()
					+ " emission costs but got " + costs.length);
	}
}
