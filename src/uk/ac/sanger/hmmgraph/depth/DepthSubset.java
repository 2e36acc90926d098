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

package uk.ac.sanger.hmmgraph.depth;

import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

import uk.ac.sanger.hmmgraph.HMMGraph;
import uk.ac.sanger.hmmgraph.cursor.GraphCursor;

/**
 * Collects the neighbourhood of a set of seed cursors: every cursor that can
 * be reached from some seed in no more steps than that seed's depth.
 * Cursors with the most remaining depth are expanded first, so each cursor
 * is expanded once with the largest budget it can get.
 */

public class DepthSubset {
	protected static final long PROGRESS_INTERVAL = 1000000L;

	private static class CursorWithDepth<C> {
		private final C cursor;
		private final int depth;

		private CursorWithDepth(C cursor, int depth) {
			this.cursor = cursor;
			this.depth = depth;
		}
	}

	public static <C extends GraphCursor<C>> Set<C> depthSubset(Map<C, Integer> initial,
			boolean forward) {
		Set<C> visited = new HashSet<C>();

		PriorityQueue<CursorWithDepth<C>> queue = new PriorityQueue<CursorWithDepth<C>>(11,
				new Comparator<CursorWithDepth<C>>() {
					public int compare(CursorWithDepth<C> a, CursorWithDepth<C> b) {
						return Integer.compare(b.depth, a.depth);
					}
				});

		for (Map.Entry<C, Integer> entry : initial.entrySet())
			queue.add(new CursorWithDepth<C>(entry.getKey(), entry.getValue().intValue()));

		HMMGraph.logFine("Initial queue size: " + queue.size());

		long step = 0;

		while (!queue.isEmpty()) {
			CursorWithDepth<C> current = queue.poll();

			if (step % PROGRESS_INTERVAL == 0)
				HMMGraph.logFine("Step " + step + ", queue size: " + queue.size()
						+ " depth: " + current.depth + " visited size: " + visited.size());

			step++;

			if (!visited.add(current.cursor))
				continue;

			if (current.depth > 0) {
				List<C> neighbours = forward ? current.cursor.next() : current.cursor.prev();

				for (C neighbour : neighbours)
					if (!visited.contains(neighbour))
						queue.add(new CursorWithDepth<C>(neighbour, current.depth - 1));
			}
		}

		return visited;
	}

	/**
	 * Seeds given as a list may repeat; each keeps its largest depth.
	 */

	public static <C extends GraphCursor<C>> Set<C> depthSubset(List<C> cursors, List<Integer> depths,
			boolean forward) {
		if (cursors.size() != depths.size())
			throw new IllegalArgumentException("Expected one depth per cursor");

		Map<C, Integer> initial = new HashMap<C, Integer>();

		for (int i = 0; i < cursors.size(); i++) {
			Integer previous = initial.get(cursors.get(i));
			int d = depths.get(i).intValue();

			if (previous == null || previous.intValue() < d)
				initial.put(cursors.get(i), Integer.valueOf(d));
		}

		return depthSubset(initial, forward);
	}

	public static <C extends GraphCursor<C>> Set<C> depthSubset(C cursor, int depth, boolean forward) {
		Map<C, Integer> initial = new HashMap<C, Integer>();
		initial.put(cursor, Integer.valueOf(depth));
		return depthSubset(initial, forward);
	}
}
