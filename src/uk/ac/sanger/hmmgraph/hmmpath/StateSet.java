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
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import uk.ac.sanger.hmmgraph.cursor.GraphCursor;
import uk.ac.sanger.hmmgraph.pathtree.EventType;
import uk.ac.sanger.hmmgraph.pathtree.PathLink;

/**
 * A match or insertion frontier. Each cursor owns a live link which later
 * relaxations in the same column update in place. The score of an entry is
 * the score of its link.
 */

public class StateSet<C extends GraphCursor<C>> implements ScoredFrontier<C> {
	protected final Map<C, PathLink<C>> links;

	public StateSet() {
		links = new HashMap<C, PathLink<C>>();
	}

	protected StateSet(Map<C, PathLink<C>> links) {
		this.links = links;
	}

	/**
	 * Relaxes the entry at <code>cursor</code> with a step from
	 * <code>from</code>, whose link is <code>fromLink</code>. An entry is
	 * created if there is none.
	 *
	 * @return true if the score of the entry improved.
	 */

	public boolean update(C cursor, double score, C from, PathLink<C> fromLink) {
		PathLink<C> link = links.get(cursor);

		if (link == null) {
			link = PathLink.create();
			links.put(cursor, link);
		}

		double previous = link.score();

		link.update(from, score, fromLink);

		return previous > score;
	}

	public PathLink<C> get(C cursor) {
		return links.get(cursor);
	}

	public void put(C cursor, PathLink<C> link) {
		links.put(cursor, link);
	}

	/**
	 * Tags every link except the one at the empty cursor.
	 */

	public void setEvent(int column, EventType type) {
		for (Map.Entry<C, PathLink<C>> entry : links.entrySet())
			if (!entry.getKey().isEmpty())
				entry.getValue().setEvent(column, type);
	}

	/**
	 * Returns a frontier holding copies of the links of this one, so that
	 * each can be relaxed without affecting the other.
	 */

	public StateSet<C> copy() {
		Map<C, PathLink<C>> copies = new HashMap<C, PathLink<C>>(links.size() * 2);

		for (Map.Entry<C, PathLink<C>> entry : links.entrySet())
			copies.put(entry.getKey(), entry.getValue().copy());

		return new StateSet<C>(copies);
	}

	public List<State<C>> states() {
		List<State<C>> states = new ArrayList<State<C>>(links.size());

		for (Map.Entry<C, PathLink<C>> entry : links.entrySet())
			states.add(new State<C>(entry.getKey(), entry.getValue().score(), entry.getValue()));

		return states;
	}

	/**
	 * Returns the entries for those of <code>keys</code> which are present.
	 */

	public List<State<C>> states(Collection<C> keys) {
		List<State<C>> states = new ArrayList<State<C>>(keys.size());

		for (C cursor : keys) {
			PathLink<C> link = links.get(cursor);

			if (link != null)
				states.add(new State<C>(cursor, link.score(), link));
		}

		return states;
	}

	public Set<C> cursors() {
		return new HashSet<C>(links.keySet());
	}

	public boolean contains(C cursor) {
		return links.containsKey(cursor);
	}

	public double getScore(C cursor) {
		PathLink<C> link = links.get(cursor);

		return link == null ? Double.POSITIVE_INFINITY : link.score();
	}

	public boolean remove(C cursor) {
		return links.remove(cursor) != null;
	}

	public int size() {
		return links.size();
	}

	public boolean isEmpty() {
		return links.isEmpty();
	}

	public void clear() {
		links.clear();
	}

	public String toString() {
		return "StateSet[size=" + links.size() + "]";
	}
}
