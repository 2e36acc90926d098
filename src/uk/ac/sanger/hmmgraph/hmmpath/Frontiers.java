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

import java.util.List;

import uk.ac.sanger.hmmgraph.cursor.GraphCursor;

/**
 * Eviction operations shared by every kind of frontier.
 */

public class Frontiers {
	private Frontiers() {
	}

	public static <C extends GraphCursor<C>> double[] scores(ScoredFrontier<C> frontier) {
		List<State<C>> states = frontier.states();

		double[] scores = new double[states.size()];

		for (int i = 0; i < scores.length; i++)
			scores[i] = states.get(i).getScore();

		return scores;
	}

	/**
	 * Returns the k-th smallest value (counting from zero) without sorting
	 * the whole array. The array is reordered.
	 */

	public static double select(double[] values, int k) {
		if (k < 0 || k >= values.length)
			throw new IllegalArgumentException("Rank " + k + " is outside 0.." + (values.length - 1));

		int lo = 0;
		int hi = values.length - 1;

		while (lo < hi) {
			double pivot = values[(lo + hi) >>> 1];

			int i = lo;
			int j = hi;

			while (i <= j) {
				while (values[i] < pivot)
					i++;

				while (values[j] > pivot)
					j--;

				if (i <= j) {
					double tmp = values[i];
					values[i] = values[j];
					values[j] = tmp;
					i++;
					j--;
				}
			}

			if (k <= j)
				hi = j;
			else if (k >= i)
				lo = i;
			else
				return values[k];
		}

		return values[k];
	}

	/**
	 * Evicts every entry scoring worse than both the threshold and the n-th
	 * best score. Entries tied with the cutoff all survive, so more than n
	 * entries may remain.
	 *
	 * @return the number of entries evicted.
	 */

	public static <C extends GraphCursor<C>> int scoreFilter(ScoredFrontier<C> frontier, int n,
			double threshold) {
		n = Math.min(n, frontier.size());

		if (n <= 0) {
			int size = frontier.size();
			frontier.clear();
			return size;
		}

		double[] scores = scores(frontier);

		double cutoff = Math.min(threshold, select(scores, n - 1));

		int removed = 0;

		for (State<C> state : frontier.states()) {
			if (state.getScore() > cutoff) {
				frontier.remove(state.getCursor());
				removed++;
			}
		}

		return removed;
	}

	public static <C extends GraphCursor<C>> int filterKey(ScoredFrontier<C> frontier,
			CursorFilter<C> filter) {
		int removed = 0;

		for (C cursor : frontier.cursors()) {
			if (filter.reject(cursor)) {
				frontier.remove(cursor);
				removed++;
			}
		}

		return removed;
	}

	public static <C extends GraphCursor<C>> int filterKeyValue(ScoredFrontier<C> frontier,
			StateFilter<C> filter) {
		int removed = 0;

		for (State<C> state : frontier.states()) {
			if (filter.reject(state.getCursor(), state.getScore())) {
				frontier.remove(state.getCursor());
				removed++;
			}
		}

		return removed;
	}
}
