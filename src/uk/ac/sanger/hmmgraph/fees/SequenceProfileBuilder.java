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
 * Builds a profile from a single query sequence, one match column per
 * symbol, so that a plain sequence can be searched against a graph with
 * affine gap costs.
 */

public class SequenceProfileBuilder {
	protected final Alphabet alphabet;
	protected final ScoringMatrix smat;

	public SequenceProfileBuilder(Alphabet alphabet, ScoringMatrix smat) {
		this.alphabet = alphabet;
		this.smat = smat;
	}

	public SequenceProfileBuilder(Alphabet alphabet) {
		this(alphabet, new ScoringMatrix());
	}

	public Fees build(String query) {
		if (query == null || query.length() == 0)
			throw new IllegalArgumentException("The query sequence is empty");

		int length = query.length();

		FeesBuilder builder = new FeesBuilder(length, alphabet);

		double gapInit = smat.getGapInitCost();
		double gapExtend = smat.getGapExtendCost();

		builder.setTransitionAllColumns(Transition.MM, 0.0);
		builder.setTransitionAllColumns(Transition.MI, gapInit);
		builder.setTransitionAllColumns(Transition.MD, gapInit);
		builder.setTransitionAllColumns(Transition.IM, 0.0);
		builder.setTransitionAllColumns(Transition.II, gapExtend);
		builder.setTransitionAllColumns(Transition.DM, 0.0);
		builder.setTransitionAllColumns(Transition.DD, gapExtend);

		double[] emissions = new double[alphabet.getEmissionVectorLength()];

		for (int column = 1; column <= length; column++) {
			char symbol = query.charAt(column - 1);

			// An ambiguous query symbol matches anything at no cost.
			if (alphabet.contains(symbol)) {
				Arrays.fill(emissions, smat.getMismatchCost());
				emissions[alphabet.code(symbol)] = smat.getMatchCost();
			} else
				Arrays.fill(emissions, 0.0);

			builder.setMatchEmissions(column, emissions);
		}

		return builder.build();
	}
}
