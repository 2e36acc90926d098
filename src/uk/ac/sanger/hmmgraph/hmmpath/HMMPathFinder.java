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
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.logging.Level;

import uk.ac.sanger.hmmgraph.HMMGraph;
import uk.ac.sanger.hmmgraph.SearchInterruptedException;
import uk.ac.sanger.hmmgraph.SearchInvariantException;
import uk.ac.sanger.hmmgraph.cursor.GraphCursor;
import uk.ac.sanger.hmmgraph.depth.DepthAtLeast;
import uk.ac.sanger.hmmgraph.fees.Fees;
import uk.ac.sanger.hmmgraph.fees.Transition;
import uk.ac.sanger.hmmgraph.pathtree.EventType;
import uk.ac.sanger.hmmgraph.pathtree.PathLink;
import uk.ac.sanger.hmmgraph.pathtree.PathSet;

/**
 * Aligns a profile against a graph, one profile column at a time. For each
 * column three frontiers are kept: states which have just matched the column,
 * states inserting graph symbols after it, and states which skip it. Scores
 * are costs, so lower is better.
 * <p>
 * Frontiers are capped and pruned after every column, so the result is the
 * best alignment which survived pruning, which need not be the global
 * optimum.
 */

public class HMMPathFinder<C extends GraphCursor<C>> {
	public static final int TOP_SCORES_TO_LOG = 100;

	protected final C empty;
	protected final SearchParameters parameters;

	/**
	 * @param empty
	 *            the sentinel cursor of the target graph.
	 */

	public HMMPathFinder(C empty, SearchParameters parameters) {
		if (empty == null || !empty.isEmpty())
			throw new IllegalArgumentException("Expected the empty cursor of the graph, got " + empty);

		this.empty = empty;
		this.parameters = parameters;
	}

	public HMMPathFinder(C empty) {
		this(empty, SearchParameters.fromProperties());
	}

	public SearchParameters getParameters() {
		return parameters;
	}

	/**
	 * Searches for the best alignments of the profile starting at any of the
	 * given cursors. The search is single-threaded and owns all the state it
	 * builds, so separate searches may run concurrently.
	 * <p>
	 * The search checks for interruption before each column. An interrupted
	 * search throws {@link SearchInterruptedException} and leaves the
	 * interrupt status of the thread set.
	 */

	public PathSet<C> findBestPath(Fees fees, Collection<C> initialCursors) {
		return new Search(fees).run(initialCursors);
	}

	/**
	 * Decides which insertion solver handles a column. Shortest-path
	 * relaxation is exact only when no insertion step has a negative cost.
	 */

	protected boolean isInsertionLoopNonNegative(Fees fees, int column) {
		return fees.isILoopNonNegative(column);
	}

	private static class QueueElement<C extends GraphCursor<C>> {
		protected final C currentCursor;
		protected final double score;
		protected final C sourceCursor;
		protected final PathLink<C> sourceLink;

		QueueElement(C currentCursor, double score, C sourceCursor, PathLink<C> sourceLink) {
			this.currentCursor = currentCursor;
			this.score = score;
			this.sourceCursor = sourceCursor;
			this.sourceLink = sourceLink;
		}
	}

	private class Search {
		private final Fees fees;
		private final int length;
		private final double threshold;
		private final List<C> initial = new ArrayList<C>();
		private final DepthAtLeast<C> depth;
		private final SearchStatistics statistics = new SearchStatistics();

		private int positionsLeft;

		private final CursorFilter<C> depthFilter;

		Search(Fees fees) {
			this.fees = fees;
			this.length = fees.getLength();
			this.threshold = parameters.getAbsoluteThreshold();
			this.depth = new DepthAtLeast<C>(parameters.getStopSymbols(),
					parameters.getDepthStackLimit());

			this.depthFilter = new CursorFilter<C>() {
				public boolean reject(C cursor) {
					return !depth.depthAtLeast(cursor, parameters.getDepthRequirement(positionsLeft));
				}
			};
		}

		PathSet<C> run(Collection<C> initialCursors) {
			long constructed = PathLink.objectCountConstructed();

			HMMGraph.logInfo("pHMM size: " + length);

			checkModel();

			statistics.setProfileLength(length);

			selectSeeds(initialCursors);

			StateSet<C> insertions = new StateSet<C>();
			StateSet<C> matches = new StateSet<C>();
			DeletionStateSet<C> deletions = new DeletionStateSet<C>();

			PathLink<C> base = PathLink.masterSource();

			matches.put(empty, base);

			positionsLeft = length;

			transfer(insertions, matches, fees.getTransition(0, Transition.MI),
					fees.getInsertEmissions(0));
			insertions = insertionLoop(insertions, 0);
			insertions.setEvent(0, EventType.INSERTION);

			int nextReport = 1;

			for (int m = 1; m <= length; m++) {
				checkInterrupted(m);

				positionsLeft = length - m;

				deletionsAndMatches(deletions, matches, insertions, m);

				insertions.clear();
				transfer(insertions, matches, fees.getTransition(m, Transition.MI),
						fees.getInsertEmissions(m));
				insertions = insertionLoop(insertions, m);

				int stateCount = deletions.size() + insertions.size() + matches.size();

				int top = parameters.getTopN(m, stateCount);

				boolean report = m >= nextReport;

				if (report) {
					HMMGraph.logInfo("Step #: " + m);
					HMMGraph.logInfo("# states " + m + " => " + stateCount + ": I = "
							+ insertions.size() + " M = " + matches.size() + " D = "
							+ deletions.size());
				}

				insertions.setEvent(m, EventType.INSERTION);
				matches.setEvent(m, EventType.MATCH);

				Frontiers.scoreFilter(insertions, top, threshold);
				Frontiers.scoreFilter(matches, top, threshold);
				Frontiers.scoreFilter(deletions, top, threshold);

				int depthFiltered = 0;

				depthFiltered += Frontiers.filterKey(insertions, depthFilter);
				depthFiltered += Frontiers.filterKey(matches, depthFilter);
				depthFiltered += Frontiers.filterKey(deletions, depthFilter);

				statistics.addColumn(new SearchStatistics.ColumnCounts(m, insertions.size(),
						matches.size(), deletions.size(), depthFiltered));

				if (report) {
					HMMGraph.logInfo("depth-filtered " + depthFiltered + ", positions left = "
							+ positionsLeft + " states m = " + m);
					HMMGraph.logInfo("I = " + insertions.size() + " M = " + matches.size() + " D = "
							+ deletions.size());
					HMMGraph.logInfo("Top scores: " + topScores(matches));

					nextReport <<= 1;
				}
			}

			HMMGraph.logInfo("Max stack size in Depth: " + depth.getMaxStackSize());

			statistics.setDepthMaxStackSize(depth.getMaxStackSize());

			PathLink<C> terminal = PathLink.create();

			terminal.update(empty, Double.POSITIVE_INFINITY, base);

			mergeIntoTerminal(terminal, deletions, fees.getTransition(length, Transition.DM));
			// Insertions leave the model with the delete-to-match fee.
			mergeIntoTerminal(terminal, insertions, fees.getTransition(length, Transition.DM));
			mergeIntoTerminal(terminal, matches, fees.getTransition(length, Transition.MM));

			PathSet<C> result = new PathSet<C>(terminal, length, statistics,
					parameters.getClipMargin());

			int reachable = result.linkCount();

			result.clipTailsNonAggressive();

			int retained = result.linkCount();

			// Concurrent searches share the counter, so this is an upper bound.
			constructed = PathLink.objectCountConstructed() - constructed;

			HMMGraph.logInfo(constructed + " pathlink objects constructed");
			HMMGraph.logInfo(reachable + " pathlink objects reachable, " + retained
					+ " after clipping");

			statistics.setLinkCounts(constructed, reachable, retained);

			return result;
		}

		private void checkInterrupted(int m) {
			if (Thread.currentThread().isInterrupted()) {
				HMMGraph.logWarning("Search interrupted before column " + m + " of " + length);
				throw new SearchInterruptedException("Search interrupted before column " + m);
			}
		}

		private void checkModel() {
			if (!fees.checkILoop(0))
				HMMGraph.logWarning("Negative-cost insertion at the beginning");

			if (!fees.checkILoop(length))
				HMMGraph.logWarning("Negative-cost insertion at the end");

			for (int i = 0; i <= length; i++)
				if (!fees.checkILoop(i))
					HMMGraph.logWarning("Negative-cost insertion at position " + i);

			if (!fees.checkINegativeLoops())
				HMMGraph.logWarning("MODEL CONTAINS NEGATIVE I-LOOPS");
		}

		private void selectSeeds(Collection<C> initialCursors) {
			HMMGraph.logInfo("Original (before filtering) initial set size: "
					+ initialCursors.size());

			double requirement = parameters.getDepthRequirement(length);

			for (C cursor : initialCursors) {
				if (cursor.isEmpty())
					HMMGraph.logFine("Ignoring the empty cursor in the initial set");
				else if (depth.depthAtLeast(cursor, requirement))
					initial.add(cursor);
			}

			HMMGraph.logInfo("Initial set size: " + initial.size());

			statistics.setSeeds(initialCursors.size(), initial.size());
		}

		/**
		 * Moves every state of <code>from</code> one step along the graph into
		 * <code>to</code>. A state at the empty cursor steps onto the seeds.
		 */

		private void transfer(StateSet<C> to, ScoredFrontier<C> from, double fee,
				double[] emissions) {
			if (to == from)
				throw new SearchInvariantException("Cannot transfer states within one frontier");

			for (State<C> state : from.states()) {
				C cursor = state.getCursor();

				List<C> nexts = cursor.isEmpty() ? initial : cursor.next();

				for (C next : nexts) {
					double cost = state.getScore() + fee + emissions[fees.code(next.letter())];
					to.update(next, cost, cursor, state.getLink());
				}
			}
		}

		/**
		 * As {@link #transfer}, but only from the given cursors.
		 *
		 * @return the cursors whose score improved.
		 */

		private Set<C> transferUpdated(StateSet<C> to, StateSet<C> from, double fee,
				double[] emissions, Collection<C> keys) {
			if (to == from)
				throw new SearchInvariantException("Cannot transfer states within one frontier");

			Set<C> updated = new HashSet<C>();

			for (State<C> state : from.states(keys)) {
				C cursor = state.getCursor();

				for (C next : cursor.next()) {
					double cost = state.getScore() + fee + emissions[fees.code(next.letter())];

					if (to.update(next, cost, cursor, state.getLink()))
						updated.add(next);
				}
			}

			return updated;
		}

		private void deletionsAndMatches(DeletionStateSet<C> deletions, StateSet<C> matches,
				StateSet<C> insertions, int m) {
			DeletionStateSet<C> preMatches = new DeletionStateSet<C>(deletions);

			deletions.increment(fees.getTransition(m - 1, Transition.DD));
			deletions.merge(matches, fees.getTransition(m - 1, Transition.MD));

			preMatches.increment(fees.getTransition(m - 1, Transition.DM));
			preMatches.merge(matches, fees.getTransition(m - 1, Transition.MM));
			preMatches.merge(insertions, fees.getTransition(m - 1, Transition.IM));

			matches.clear();
			transfer(matches, preMatches, 0.0, fees.getMatchEmissions(m));
		}

		private StateSet<C> insertionLoop(StateSet<C> insertions, int m) {
			if (isInsertionLoopNonNegative(fees, m)) {
				insertionLoopNonNegative(insertions, m);
				return insertions;
			} else
				return insertionLoopNegative(insertions, m);
		}

		/**
		 * Solves the insertion self-loop as a shortest-path problem. Each cursor
		 * is settled once, at the lowest score it can be reached with.
		 */

		private void insertionLoopNonNegative(StateSet<C> insertions, int m) {
			double fee = fees.getTransition(m, Transition.II);
			double[] emissions = fees.getInsertEmissions(m);

			PriorityQueue<QueueElement<C>> queue = new PriorityQueue<QueueElement<C>>(11,
					new Comparator<QueueElement<C>>() {
						public int compare(QueueElement<C> e1, QueueElement<C> e2) {
							return Double.compare(e1.score, e2.score);
						}
					});

			for (State<C> state : insertions.states()) {
				PathLink.Ancestor<C> best = state.getLink().bestAncestor();

				if (best == null || best.getScore() > threshold)
					continue;

				if (!depthFilter.reject(state.getCursor()))
					queue.add(new QueueElement<C>(state.getCursor(), best.getScore(),
							best.getCursor(), best.getLink()));
			}

			if (HMMGraph.isLoggable(Level.FINE))
				HMMGraph.logFine(queue.size() + " I values in queue m = " + m);

			Set<C> processed = new HashSet<C>();

			int taken = 0;

			while (!queue.isEmpty()) {
				QueueElement<C> element = queue.poll();

				taken++;

				if (element.score > threshold)
					break;

				if (!processed.add(element.currentCursor))
					continue;

				insertions.update(element.currentCursor, element.score, element.sourceCursor,
						element.sourceLink);

				PathLink<C> link = insertions.get(element.currentCursor);

				for (C next : element.currentCursor.next()) {
					if (processed.contains(next))
						continue;

					double cost = element.score + fee + emissions[fees.code(next.letter())];

					if (!depthFilter.reject(next))
						queue.add(new QueueElement<C>(next, cost, element.currentCursor, link));
				}
			}

			if (HMMGraph.isLoggable(Level.FINE))
				HMMGraph.logFine(processed.size() + " states processed, " + taken
						+ " values extracted from queue in I-loop m = " + m);
		}

		/**
		 * Relaxes the insertion self-loop a bounded number of times. Each round
		 * relaxes only from the cursors improved by the previous one. With a
		 * negative cycle the result depends on the number of rounds.
		 */

		private StateSet<C> insertionLoopNegative(StateSet<C> insertions, int m) {
			double fee = fees.getTransition(m, Transition.II);
			double[] emissions = fees.getInsertEmissions(m);

			Set<C> updated = insertions.cursors();

			insertions.setEvent(m, EventType.INSERTION);

			StateSet<C> relaxed = insertions.copy();

			for (int i = 0; i < parameters.getMaxInsertions(); i++) {
				updated = transferUpdated(relaxed, insertions, fee, emissions, updated);

				relaxed.setEvent(m, EventType.INSERTION);

				for (C cursor : updated)
					insertions.put(cursor, relaxed.get(cursor).copy());

				if (updated.isEmpty())
					break;
			}

			return relaxed;
		}

		private void mergeIntoTerminal(PathLink<C> terminal, ScoredFrontier<C> frontier, double fee) {
			for (State<C> state : frontier.states()) {
				double score = state.getScore() + fee;

				if (score <= threshold)
					terminal.update(state.getCursor(), score, state.getLink());
			}
		}

		private String topScores(ScoredFrontier<C> frontier) {
			double[] scores = Frontiers.scores(frontier);

			Arrays.sort(scores);

			if (scores.length > TOP_SCORES_TO_LOG)
				scores = Arrays.copyOf(scores, TOP_SCORES_TO_LOG);

			return Arrays.toString(scores);
		}
	}
}
