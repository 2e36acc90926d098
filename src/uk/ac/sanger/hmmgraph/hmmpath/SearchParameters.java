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

package uk.ac.sanger.hmmgraph.hmmpath;

import uk.ac.sanger.hmmgraph.HMMGraph;
import uk.ac.sanger.hmmgraph.depth.DepthAtLeast;

/**
 * The pruning policy of a search. The defaults may be overridden in the
 * property files read by {@link HMMGraph}.
 */

public class SearchParameters {
	public static final double DEFAULT_ABSOLUTE_THRESHOLD = 250.0;
	public static final int[] DEFAULT_TOPN_COLUMNS = { 25, 100, 500 };
	public static final int[] DEFAULT_TOPN_LIMITS = { 1000000, 50000, 10000 };
	public static final int DEFAULT_MAX_INSERTIONS = 30;
	public static final double DEFAULT_DEPTH_COEFFICIENT = 1.0 / 3.0;
	public static final int DEFAULT_DEPTH_SLACK = 10;
	public static final double DEFAULT_CLIP_MARGIN = 20.0;

	private double absoluteThreshold = DEFAULT_ABSOLUTE_THRESHOLD;
	private int[] topNColumns = DEFAULT_TOPN_COLUMNS.clone();
	private int[] topNLimits = DEFAULT_TOPN_LIMITS.clone();
	private int maxInsertions = DEFAULT_MAX_INSERTIONS;
	private double depthCoefficient = DEFAULT_DEPTH_COEFFICIENT;
	private int depthSlack = DEFAULT_DEPTH_SLACK;
	private int depthStackLimit = DepthAtLeast.DEFAULT_STACK_LIMIT;
	private String stopSymbols = DepthAtLeast.DEFAULT_STOP_SYMBOLS;
	private double clipMargin = DEFAULT_CLIP_MARGIN;

	public SearchParameters() {
	}

	public static SearchParameters fromProperties() {
		SearchParameters parameters = new SearchParameters();

		parameters.absoluteThreshold = getDouble("hmmgraph.threshold.absolute",
				parameters.absoluteThreshold);

		int[] columns = getIntArray("hmmgraph.topn.columns", parameters.topNColumns);
		int[] limits = getIntArray("hmmgraph.topn.limits", parameters.topNLimits);

		if (columns.length == limits.length) {
			parameters.topNColumns = columns;
			parameters.topNLimits = limits;
		} else
			HMMGraph.logWarning("hmmgraph.topn.columns and hmmgraph.topn.limits differ in length,"
					+ " using the default state caps");

		parameters.maxInsertions = getInt("hmmgraph.insertions.max", parameters.maxInsertions);
		parameters.depthCoefficient = getDouble("hmmgraph.depth.coefficient",
				parameters.depthCoefficient);
		parameters.depthSlack = getInt("hmmgraph.depth.slack", parameters.depthSlack);
		parameters.depthStackLimit = getInt("hmmgraph.depth.stacklimit", parameters.depthStackLimit);

		String symbols = HMMGraph.getProperty("hmmgraph.depth.stopsymbols");

		if (symbols != null)
			parameters.stopSymbols = symbols.trim();

		parameters.clipMargin = getDouble("hmmgraph.clip.margin", parameters.clipMargin);

		return parameters;
	}

	private static double getDouble(String key, double defaultValue) {
		String value = HMMGraph.getProperty(key);

		if (value == null)
			return defaultValue;

		try {
			return Double.parseDouble(value.trim());
		} catch (NumberFormatException nfe) {
			HMMGraph.logWarning("Invalid value \"" + value + "\" for " + key + ", using "
					+ defaultValue);
			return defaultValue;
		}
	}

	private static int getInt(String key, int defaultValue) {
		String value = HMMGraph.getProperty(key);

		if (value == null)
			return defaultValue;

		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException nfe) {
			HMMGraph.logWarning("Invalid value \"" + value + "\" for " + key + ", using "
					+ defaultValue);
			return defaultValue;
		}
	}

	private static int[] getIntArray(String key, int[] defaultValue) {
		String value = HMMGraph.getProperty(key);

		if (value == null)
			return defaultValue;

		String[] words = value.trim().split("\\s*,\\s*");

		int[] values = new int[words.length];

		try {
			for (int i = 0; i < words.length; i++)
				values[i] = Integer.parseInt(words[i]);
		} catch (NumberFormatException nfe) {
			HMMGraph.logWarning("Invalid value \"" + value + "\" for " + key
					+ ", using the default");
			return defaultValue;
		}

		return values;
	}

	/**
	 * Returns the cap on the number of states kept in one frontier after
	 * column <code>column</code>. The cap of the highest boundary passed
	 * applies; below the first boundary, every state is kept.
	 */

	public int getTopN(int column, int stateCount) {
		int top = stateCount;

		for (int i = 0; i < topNColumns.length; i++)
			if (column > topNColumns[i])
				top = topNLimits[i];

		return top;
	}

	/**
	 * Returns the walk length a cursor must be able to reach when
	 * <code>remaining</code> profile columns are left to align.
	 */

	public double getDepthRequirement(int remaining) {
		// Rounded so that a coefficient of 1/3 agrees with integer division.
		double scaled = Math.floor(remaining * depthCoefficient + 1.0e-6);

		return scaled - depthSlack;
	}

	public double getAbsoluteThreshold() {
		return absoluteThreshold;
	}

	public SearchParameters setAbsoluteThreshold(double absoluteThreshold) {
		this.absoluteThreshold = absoluteThreshold;
		return this;
	}

	public SearchParameters setTopN(int[] columns, int[] limits) {
		if (columns.length != limits.length)
			throw new IllegalArgumentException("Expected one limit per column boundary");

		this.topNColumns = columns.clone();
		this.topNLimits = limits.clone();
		return this;
	}

	public int getMaxInsertions() {
		return maxInsertions;
	}

	public SearchParameters setMaxInsertions(int maxInsertions) {
		if (maxInsertions < 0)
			throw new IllegalArgumentException("Insertion round count must not be negative");

		this.maxInsertions = maxInsertions;
		return this;
	}

	public double getDepthCoefficient() {
		return depthCoefficient;
	}

	public int getDepthSlack() {
		return depthSlack;
	}

	public SearchParameters setDepthFilter(double coefficient, int slack) {
		this.depthCoefficient = coefficient;
		this.depthSlack = slack;
		return this;
	}

	public int getDepthStackLimit() {
		return depthStackLimit;
	}

	public SearchParameters setDepthStackLimit(int depthStackLimit) {
		this.depthStackLimit = depthStackLimit;
		return this;
	}

	public String getStopSymbols() {
		return stopSymbols;
	}

	public SearchParameters setStopSymbols(String stopSymbols) {
		this.stopSymbols = stopSymbols;
		return this;
	}

	public double getClipMargin() {
		return clipMargin;
	}

	public SearchParameters setClipMargin(double clipMargin) {
		this.clipMargin = clipMargin;
		return this;
	}

	public String toString() {
		return "SearchParameters[threshold=" + absoluteThreshold + ", maxInsertions="
				+ maxInsertions + ", depthCoefficient=" + depthCoefficient + ", depthSlack="
				+ depthSlack + ", clipMargin=" + clipMargin + "]";
	}
}
