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
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

import uk.ac.sanger.hmmgraph.HMMGraph;
import uk.ac.sanger.hmmgraph.cursor.GraphCursor;
import uk.ac.sanger.hmmgraph.hmmpath.SearchStatistics;

/**
 * The result of a search. The terminal link has one predecessor for every
 * graph position at which an alignment of the whole profile can end; walking
 * back through best predecessors recovers the alignments themselves.
 */

public class PathSet<C extends GraphCursor<C>> {
	public static final int MAX_EXPANSIONS = 1000000;

	protected final PathLink<C> terminal;
	protected final int profileLength;
	protected final SearchStatistics statistics;
	protected final double defaultClipMargin;

	public PathSet(PathLink<C> terminal, int profileLength, SearchStatistics statistics,
			double defaultClipMargin) {
		this.terminal = terminal;
		this.profileLength = profileLength;
		this.statistics = statistics;
		this.defaultClipMargin = defaultClipMargin;
	}

	public PathLink<C> getTerminal() {
		return terminal;
	}

	public int getProfileLength() {
		return profileLength;
	}

	public SearchStatistics getStatistics() {
		return statistics;
	}

	public double bestScore() {
		return terminal.score();
	}

	public boolean isEmpty() {
		return Double.isInfinite(terminal.score());
	}

	/**
	 * Follows best predecessors from the terminal link back to the root.
	 *
	 * @return the best alignment, or null if no alignment has a finite score.
	 */

	public AnnotatedPath<C> bestPath() throws TracebackException {
		if (isEmpty())
			return null;

		int limit = linkCount();

		List<C> cursors = new ArrayList<C>();
		List<Event> events = new ArrayList<Event>();

		PathLink<C> current = terminal;

		while (true) {
			PathLink.Ancestor<C> ancestor = current.bestAncestor();

			if (ancestor == null)
				throw new TracebackException("Link " + current + " has no predecessor");

			PathLink<C> link = ancestor.getLink();

			if (link.isSource())
				break;

			if (cursors.size() >= limit)
				throw new TracebackException("Traceback did not reach the root after "
						+ limit + " steps");

			cursors.add(ancestor.getCursor());
			events.add(link.getEvent());

			current = link;
		}

		Collections.reverse(cursors);
		Collections.reverse(events);

		return new AnnotatedPath<C>(cursors, events, terminal.score(), profileLength);
	}

	private static class Step<C> {
		protected final C cursor;
		protected final Event event;
		protected final Step<C> next;
		protected final int length;

		Step(C cursor, Event event, Step<C> next) {
			this.cursor = cursor;
			this.event = event;
			this.next = next;
			this.length = next == null ? 1 : next.length + 1;
		}
	}

	private static class Partial<C extends GraphCursor<C>> {
		protected final PathLink<C> link;
		protected final Step<C> steps;
		protected final double cost;
		protected final long serial;
		protected final boolean complete;

		Partial(PathLink<C> link, Step<C> steps, double cost, long serial, boolean complete) {
			this.link = link;
			this.steps = steps;
			this.cost = cost;
			this.serial = serial;
			this.complete = complete;
		}
	}

	/**
	 * Returns up to <code>k</code> distinct walks in order of non-decreasing
	 * score. Alternatives are explored best-first: taking a predecessor other
	 * than the best one at any link costs the difference between the two
	 * scores.
	 */

	public List<AnnotatedPath<C>> topK(int k) {
		List<AnnotatedPath<C>> paths = new ArrayList<AnnotatedPath<C>>();

		if (k <= 0 || isEmpty())
			return paths;

		int limit = linkCount();

		PriorityQueue<Partial<C>> queue = new PriorityQueue<Partial<C>>(11,
				new Comparator<Partial<C>>() {
					public int compare(Partial<C> p1, Partial<C> p2) {
						int rc = Double.compare(p1.cost, p2.cost);
						return rc != 0 ? rc : Long.compare(p1.serial, p2.serial);
					}
				});

		long serial = 0;

		queue.add(new Partial<C>(terminal, null, terminal.score(), serial++, false));

		Set<List<C>> seen = new HashSet<List<C>>();

		int expansions = 0;

		while (!queue.isEmpty() && paths.size() < k) {
			Partial<C> partial = queue.poll();

			if (Double.isInfinite(partial.cost))
				break;

			if (partial.complete) {
				List<C> cursors = new ArrayList<C>();
				List<Event> events = new ArrayList<Event>();

				for (Step<C> step = partial.steps; step != null; step = step.next) {
					cursors.add(step.cursor);
					events.add(step.event);
				}

				if (seen.add(cursors))
					paths.add(new AnnotatedPath<C>(cursors, events, partial.cost, profileLength));

				continue;
			}

			if (++expansions > MAX_EXPANSIONS) {
				HMMGraph.logWarning("Path enumeration stopped after " + MAX_EXPANSIONS
						+ " expansions with " + paths.size() + " paths found");
				break;
			}

			if (partial.steps != null && partial.steps.length > limit)
				continue;

			double base = partial.link.score();

			for (PathLink.Ancestor<C> ancestor : partial.link.getAncestors()) {
				if (Double.isInfinite(ancestor.getScore()))
					continue;

				double cost = partial.cost + (ancestor.getScore() - base);

				PathLink<C> link = ancestor.getLink();

				if (link.isSource())
					queue.add(new Partial<C>(link, partial.steps, cost, serial++, true));
				else
					queue.add(new Partial<C>(link,
							new Step<C>(ancestor.getCursor(), link.getEvent(), partial.steps),
							cost, serial++, false));
			}
		}

		return paths;
	}

	private static class Deviation<C extends GraphCursor<C>> {
		protected final PathLink<C> link;
		protected final double value;

		Deviation(PathLink<C> link, double value) {
			this.link = link;
			this.value = value;
		}
	}

	/**
	 * Removes every predecessor entry which lies on no path scoring within
	 * <code>margin</code> of the best one, and every entry with an infinite
	 * score.
	 *
	 * @return the number of entries removed.
	 */

	public int clipTails(double margin) {
		if (margin < 0.0)
			throw new IllegalArgumentException("Clipping margin must not be negative");

		Map<PathLink<C>, Double> deviations = new HashMap<PathLink<C>, Double>();

		PriorityQueue<Deviation<C>> queue = new PriorityQueue<Deviation<C>>(11,
				new Comparator<Deviation<C>>() {
					public int compare(Deviation<C> d1, Deviation<C> d2) {
						return Double.compare(d1.value, d2.value);
					}
				});

		queue.add(new Deviation<C>(terminal, 0.0));

		List<PathLink<C>> order = new ArrayList<PathLink<C>>();

		while (!queue.isEmpty()) {
			Deviation<C> d = queue.poll();

			if (deviations.containsKey(d.link))
				continue;

			deviations.put(d.link, d.value);
			order.add(d.link);

			double base = d.link.score();

			if (Double.isInfinite(base))
				continue;

			for (PathLink.Ancestor<C> ancestor : d.link.getAncestors()) {
				PathLink<C> link = ancestor.getLink();

				if (Double.isInfinite(ancestor.getScore()) || deviations.containsKey(link))
					continue;

				double value = d.value + (ancestor.getScore() - base);

				if (value <= margin)
					queue.add(new Deviation<C>(link, value));
			}
		}

		int removed = 0;

		for (PathLink<C> link : order) {
			double value = deviations.get(link);
			double base = link.score();

			for (C from : link.ancestorCursors()) {
				PathLink.Ancestor<C> ancestor = link.scores.get(from);

				if (Double.isInfinite(ancestor.getScore())
						|| value + (ancestor.getScore() - base) > margin) {
					link.removeAncestor(from);
					removed++;
				}
			}
		}

		HMMGraph.logFine("Clipped " + removed + " path link entries with margin " + margin);

		return removed;
	}

	public int clipTailsNonAggressive() {
		return clipTails(defaultClipMargin);
	}

	/**
	 * Returns the number of links reachable from the terminal link, the
	 * terminal and the root included.
	 */

	public int linkCount() {
		Set<PathLink<C>> visited = new HashSet<PathLink<C>>();
		List<PathLink<C>> stack = new ArrayList<PathLink<C>>();

		stack.add(terminal);
		visited.add(terminal);

		while (!stack.isEmpty()) {
			PathLink<C> link = stack.remove(stack.size() - 1);

			for (PathLink.Ancestor<C> ancestor : link.getAncestors())
				if (visited.add(ancestor.getLink()))
					stack.add(ancestor.getLink());
		}

		return visited.size();
	}

	public String toString() {
		return "PathSet[profileLength=" + profileLength + ", bestScore=" + bestScore() + "]";
	}
}
