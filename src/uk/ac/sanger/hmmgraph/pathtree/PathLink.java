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

package uk.ac.sanger.hmmgraph.pathtree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import uk.ac.sanger.hmmgraph.SearchInvariantException;
import uk.ac.sanger.hmmgraph.cursor.GraphCursor;

/**
 * A node of the traceback structure. For every predecessor cursor it keeps
 * the best score of arriving here from that cursor, and the link that was
 * current at the predecessor. The score of the link is the smallest of
 * these; lower is better.
 * <p>
 * Links are shared: one link may be the predecessor of many others and may be
 * held by a state set at the same time. A link must not be modified once
 * another state set can see it; take a {@link #copy()} instead.
 */

public class PathLink<C extends GraphCursor<C>> {
	public static class Ancestor<C extends GraphCursor<C>> {
		protected final C cursor;
		protected final double score;
		protected final PathLink<C> link;

		public Ancestor(C cursor, double score, PathLink<C> link) {
			this.cursor = cursor;
			this.score = score;
			this.link = link;
		}

		public C getCursor() {
			return cursor;
		}

		public double getScore() {
			return score;
		}

		public PathLink<C> getLink() {
			return link;
		}

		public String toString() {
			return "Ancestor[" + cursor + ", " + score + "]";
		}
	}

	private static final AtomicLong objectCountConstructed = new AtomicLong();

	protected final Map<C, Ancestor<C>> scores = new LinkedHashMap<C, Ancestor<C>>();
	protected final boolean source;
	protected Event event = Event.NONE;

	protected PathLink(boolean source) {
		this.source = source;

		objectCountConstructed.incrementAndGet();
	}

	public static <C extends GraphCursor<C>> PathLink<C> create() {
		return new PathLink<C>(false);
	}

	/**
	 * Returns a new root link: it has no predecessors and a score of zero.
	 * Every path traces back to the root of its search.
	 */

	public static <C extends GraphCursor<C>> PathLink<C> masterSource() {
		return new PathLink<C>(true);
	}

	public boolean isSource() {
		return source;
	}

	/**
	 * Returns the best score over all predecessors: zero for a root, positive
	 * infinity for a link that has no predecessor yet.
	 */

	public double score() {
		if (source)
			return 0.0;

		Ancestor<C> best = bestAncestor();

		return best == null ? Double.POSITIVE_INFINITY : best.score;
	}

	/**
	 * Returns the predecessor with the smallest score, the earliest one on a
	 * tie, or null if there is none.
	 */

	public Ancestor<C> bestAncestor() {
		Ancestor<C> best = null;

		for (Ancestor<C> ancestor : scores.values())
			if (best == null || ancestor.score < best.score)
				best = ancestor;

		return best;
	}

	/**
	 * Records that this link can be reached from <code>from</code>, whose own
	 * link was <code>link</code>, at the given score. The entry for that
	 * predecessor is replaced only by a strictly better score. A worse entry
	 * is still kept as an alternative for path enumeration.
	 *
	 * @return true if the score of this link improved.
	 */

	public boolean update(C from, double score, PathLink<C> link) {
		if (link == this)
			throw new SearchInvariantException("A path link cannot be its own predecessor");

		if (source)
			throw new SearchInvariantException("The root link cannot have predecessors");

		Ancestor<C> previous = scores.get(from);

		if (previous != null && previous.score <= score)
			return false;

		double best = score();

		scores.put(from, new Ancestor<C>(from, score, link));

		return score < best;
	}

	/**
	 * Returns a new link with the same predecessors and event. The two links
	 * can then be updated independently.
	 */

	public PathLink<C> copy() {
		PathLink<C> copy = new PathLink<C>(source);

		copy.scores.putAll(scores);
		copy.event = event;

		return copy;
	}

	public Collection<Ancestor<C>> getAncestors() {
		return Collections.unmodifiableCollection(scores.values());
	}

	public int getAncestorCount() {
		return scores.size();
	}

	boolean removeAncestor(C from) {
		return scores.remove(from) != null;
	}

	Collection<C> ancestorCursors() {
		return new ArrayList<C>(scores.keySet());
	}

	public void setEvent(int column, EventType type) {
		this.event = new Event(column, type);
	}

	public Event getEvent() {
		return event;
	}

	/**
	 * Returns the number of links constructed by all searches in this JVM.
	 */

	public static long objectCountConstructed() {
		return objectCountConstructed.get();
	}

	public String toString() {
		return "PathLink[" + event + ", score=" + score() + ", ancestors=" + scores.size() + "]";
	}
}
