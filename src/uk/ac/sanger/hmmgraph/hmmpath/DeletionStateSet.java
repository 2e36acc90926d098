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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import uk.ac.sanger.hmmgraph.SearchInvariantException;
import uk.ac.sanger.hmmgraph.cursor.GraphCursor;
import uk.ac.sanger.hmmgraph.pathtree.PathLink;

/**
 * A deletion frontier. Deletions do not move along the graph, so an entry
 * keeps its own score together with the link of the last state which did,
 * and never owns that link.
 */

public class DeletionStateSet<C extends GraphCursor<C>> implements ScoredFrontier<C> {
	protected static class ScoredLink<C extends GraphCursor<C>> {
		protected final double score;
		protected final PathLink<C> link;

		protected ScoredLink(double score, PathLink<C> link) {
			this.score = score;
			this.link = link;
		}
	}

	protected final Map<C, ScoredLink<C>> entries = new HashMap<C, ScoredLink<C>>();

	public DeletionStateSet() {
	}

	public DeletionStateSet(DeletionStateSet<C> other) {
		entries.putAll(other.entries);
	}

	/**
	 * @return true if the entry was created or its score improved.
	 */

	public boolean update(C cursor, double score, PathLink<C> link) {
		ScoredLink<C> existing = entries.get(cursor);

		if (existing != null && existing.score <= score)
			return false;

		entries.put(cursor, new ScoredLink<C>(score, link));

		return true;
	}

	/**
	 * Relaxes this frontier with every entry of <code>other</code>, charging
	 * <code>fee</code> for the step between the layers.
	 */

	public void merge(ScoredFrontier<C> other, double fee) {
		if (other == this)
			throw new SearchInvariantException("Cannot merge a deletion frontier into itself");

		for (State<C> state : other.states())
			update(state.getCursor(), state.getScore() + fee, state.getLink());
	}

	public void increment(double fee) {
		for (Map.Entry<C, ScoredLink<C>> entry : entries.entrySet()) {
			ScoredLink<C> sl = entry.getValue();
			entry.setValue(new ScoredLink<C>(sl.score + fee, sl.link));
		}
	}

	public PathLink<C> getLink(C cursor) {
		ScoredLink<C> sl = entries.get(cursor);

		return sl == null ? null : sl.link;
	}

	public List<State<C>> states() {
		List<State<C>> states = new ArrayList<State<C>>(entries.size());

		for (Map.Entry<C, ScoredLink<C>> entry : entries.entrySet())
			states.add(new State<C>(entry.getKey(), entry.getValue().score, entry.getValue().link));

		return states;
	}

	public Set<C> cursors() {
		return new HashSet<C>(entries.keySet());
	}

	public boolean contains(C cursor) {
		return entries.containsKey(cursor);
	}

	public double getScore(C cursor) {
		ScoredLink<C> sl = entries.get(cursor);

		return sl == null ? Double.POSITIVE_INFINITY : sl.score;
	}

	public boolean remove(C cursor) {
		return entries.remove(cursor) != null;
	}

	public int size() {
		return entries.size();
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	public void clear() {
		entries.clear();
	}

	public String toString() {
		return "DeletionStateSet[size=" + entries.size() + "]";
	}
}
