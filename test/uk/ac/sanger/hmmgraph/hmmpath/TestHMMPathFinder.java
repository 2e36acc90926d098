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

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import uk.ac.sanger.hmmgraph.SearchInterruptedException;
import uk.ac.sanger.hmmgraph.cursor.GraphCursor;
import uk.ac.sanger.hmmgraph.cursor.LinearCursor;
import uk.ac.sanger.hmmgraph.fees.Alphabet;
import uk.ac.sanger.hmmgraph.fees.Fees;
import uk.ac.sanger.hmmgraph.fees.FeesBuilder;
import uk.ac.sanger.hmmgraph.fees.SequenceProfileBuilder;
import uk.ac.sanger.hmmgraph.fees.Transition;
import uk.ac.sanger.hmmgraph.graph.SequenceGraph;
import uk.ac.sanger.hmmgraph.graph.SequenceGraphCursor;
import uk.ac.sanger.hmmgraph.pathtree.AnnotatedPath;
import uk.ac.sanger.hmmgraph.pathtree.Event;
import uk.ac.sanger.hmmgraph.pathtree.EventType;
import uk.ac.sanger.hmmgraph.pathtree.PathSet;

public class TestHMMPathFinder {
	private static final double DELTA = 1.0e-9;

	private final SequenceProfileBuilder profiles = new SequenceProfileBuilder(Alphabet.DNA);

	private static class FixpointPathFinder<C extends GraphCursor<C>>
			extends HMMPathFinder<C> {
		FixpointPathFinder(C empty, SearchParameters parameters) {
			super(empty, parameters);
		}

		protected boolean isInsertionLoopNonNegative(Fees fees, int column) {
			return false;
		}
	}

	private Fees singleColumnFees() {
		return new FeesBuilder(1, Alphabet.DNA)
				.setTransition(0, Transition.MM, 1.0)
				.setTransition(1, Transition.MM, 2.0)
				.setTransition(0, Transition.MD, 50.0)
				.setTransitionAllColumns(Transition.MI, 100.0)
				.build();
	}

	private PathSet<LinearCursor> align(String query, String subject) {
		HMMPathFinder<LinearCursor> finder = new HMMPathFinder<LinearCursor>(
				LinearCursor.empty(subject), new SearchParameters());

		return finder.findBestPath(profiles.build(query), LinearCursor.allPositions(subject));
	}

	private List<LinearCursor> positions(String subject, int... positions) {
		List<LinearCursor> cursors = new ArrayList<LinearCursor>();

		for (int position : positions)
			cursors.add(LinearCursor.at(subject, position));

		return cursors;
	}

	@Test
	public void testSingleColumnScoresTransitionsOnly() throws Exception {
		String subject = "A";

		HMMPathFinder<LinearCursor> finder = new HMMPathFinder<LinearCursor>(
				LinearCursor.empty(subject), new SearchParameters());

		PathSet<LinearCursor> result = finder.findBestPath(singleColumnFees(),
				LinearCursor.allPositions(subject));

		assertFalse(result.isEmpty());
		assertEquals(3.0, result.bestScore(), DELTA);

		AnnotatedPath<LinearCursor> path = result.bestPath();

		assertEquals(positions(subject, 0), path.getCursors());
		assertEquals(Arrays.asList(new Event(1, EventType.MATCH)), path.getEvents());
		assertEquals("M", path.getAlignment());
	}

	@Test
	public void testThresholdBelowOptimumGivesEmptyResult() throws Exception {
		String subject = "A";

		HMMPathFinder<LinearCursor> finder = new HMMPathFinder<LinearCursor>(
				LinearCursor.empty(subject), new SearchParameters().setAbsoluteThreshold(2.0));

		PathSet<LinearCursor> result = finder.findBestPath(singleColumnFees(),
				LinearCursor.allPositions(subject));

		assertTrue(result.isEmpty());
		assertTrue(Double.isInfinite(result.bestScore()));
		assertNull(result.bestPath());
		assertTrue(result.topK(5).isEmpty());
	}

	@Test
	public void testCheapestBranchIsSelected() throws Exception {
		SequenceGraph graph = new SequenceGraph();

		graph.addSequence("P", "C");
		graph.addSequence("A", "A");
		graph.addSequence("B", "G");
		graph.addLink("P", "A");
		graph.addLink("P", "B");

		FeesBuilder builder = new FeesBuilder(2, Alphabet.DNA)
				.setTransitionAllColumns(Transition.MI, 100.0)
				.setTransitionAllColumns(Transition.MD, 100.0);

		for (char symbol : "CGT".toCharArray())
			builder.setMatchEmission(2, symbol, 100.0);

		builder.setUnknownSymbolCost(100.0);

		HMMPathFinder<SequenceGraphCursor> finder = new HMMPathFinder<SequenceGraphCursor>(
				graph.emptyCursor(), new SearchParameters());

		PathSet<SequenceGraphCursor> result = finder.findBestPath(builder.build(),
				Collections.singletonList(graph.cursorAt("P", 0)));

		assertEquals(0.0, result.bestScore(), DELTA);

		AnnotatedPath<SequenceGraphCursor> path = result.bestPath();

		assertEquals(Arrays.asList(graph.cursorAt("P", 0), graph.cursorAt("A", 0)),
				path.getCursors());
		assertEquals("CA", path.getSequence());
		assertEquals("MM", path.getAlignment());
	}

	@Test
	public void testExactMatchInLongerSubject() throws Exception {
		String subject = "TTACGTTT";

		PathSet<LinearCursor> result = align("ACGT", subject);

		assertEquals(-4.0, result.bestScore(), DELTA);

		AnnotatedPath<LinearCursor> path = result.bestPath();

		assertEquals(positions(subject, 2, 3, 4, 5), path.getCursors());
		assertEquals("ACGT", path.getSequence());
		assertEquals("MMMM", path.getAlignment());
		assertEquals("4M", path.getCigar());
	}

	@Test
	public void testDeletionFromQuery() throws Exception {
		String subject = "ACTA";

		PathSet<LinearCursor> result = align("ACGTA", subject);

		assertEquals(0.0, result.bestScore(), DELTA);

		AnnotatedPath<LinearCursor> path = result.bestPath();

		assertEquals(positions(subject, 0, 1, 2, 3), path.getCursors());
		assertEquals("MMDMM", path.getAlignment());
	}

	@Test
	public void testInsertionIntoQuery() throws Exception {
		String subject = "ACGTA";

		PathSet<LinearCursor> result = align("ACTA", subject);

		assertEquals(0.0, result.bestScore(), DELTA);

		AnnotatedPath<LinearCursor> path = result.bestPath();

		assertEquals(positions(subject, 0, 1, 2, 3, 4), path.getCursors());
		assertEquals(new Event(2, EventType.INSERTION), path.getEvents().get(2));
		assertEquals("MMIMM", path.getAlignment());
	}

	@Test
	public void testAlignmentAroundCycle() throws Exception {
		SequenceGraph graph = new SequenceGraph();

		graph.addSequence("loop", "ACG");
		graph.addLink("loop", "loop");

		HMMPathFinder<SequenceGraphCursor> finder = new HMMPathFinder<SequenceGraphCursor>(
				graph.emptyCursor(), new SearchParameters());

		PathSet<SequenceGraphCursor> result = finder.findBestPath(profiles.build("ACGACGA"),
				graph.allCursors());

		assertEquals(-7.0, result.bestScore(), DELTA);

		AnnotatedPath<SequenceGraphCursor> path = result.bestPath();

		List<SequenceGraphCursor> expected = new ArrayList<SequenceGraphCursor>();

		for (int i = 0; i < 7; i++)
			expected.add(graph.cursorAt("loop", i % 3));

		assertEquals(expected, path.getCursors());
		assertEquals("ACGACGA", path.getSequence());
		assertEquals("MMMMMMM", path.getAlignment());
	}

	@Test
	public void testInsertionSolversAgreeOnAcyclicGraph() throws Exception {
		String subject = "GGACGTTACGAT";
		String[] queries = { "ACGTACG", "ACGACG", "ACGTTTACG", "GATTACA" };

		for (String query : queries) {
			Fees fees = profiles.build(query);

			HMMPathFinder<LinearCursor> shortestPath = new HMMPathFinder<LinearCursor>(
					LinearCursor.empty(subject), new SearchParameters());

			HMMPathFinder<LinearCursor> fixpoint = new FixpointPathFinder<LinearCursor>(
					LinearCursor.empty(subject), new SearchParameters());

			PathSet<LinearCursor> expected = shortestPath.findBestPath(fees,
					LinearCursor.allPositions(subject));
			PathSet<LinearCursor> actual = fixpoint.findBestPath(fees,
					LinearCursor.allPositions(subject));

			assertFalse(expected.isEmpty());
			assertEquals(query, expected.bestScore(), actual.bestScore(), DELTA);
		}
	}

	@Test
	public void testNegativeInsertionLoopStillAligns() throws Exception {
		String subject = "ACGT";

		FeesBuilder builder = new FeesBuilder(1, Alphabet.DNA)
				.setTransitionAllColumns(Transition.MI, 1.0)
				.setTransitionAllColumns(Transition.II, -0.5)
				.setTransitionAllColumns(Transition.MD, 100.0)
				.setTransition(1, Transition.MM, 2.0);

		HMMPathFinder<LinearCursor> finder = new HMMPathFinder<LinearCursor>(
				LinearCursor.empty(subject), new SearchParameters());

		PathSet<LinearCursor> result = finder.findBestPath(builder.build(),
				LinearCursor.allPositions(subject));

		// Match the first symbol, then insert the remaining three.
		assertEquals(1.0 - 0.5 - 0.5, result.bestScore(), DELTA);

		AnnotatedPath<LinearCursor> path = result.bestPath();

		assertEquals(positions(subject, 0, 1, 2, 3), path.getCursors());
		assertEquals("MIII", path.getAlignment());
	}

	@Test
	public void testTopPathsAreOrdered() throws Exception {
		String subject = "TTACGTTTACGA";

		PathSet<LinearCursor> result = align("ACGT", subject);

		List<AnnotatedPath<LinearCursor>> paths = result.topK(10);

		assertTrue(paths.size() >= 2);

		assertEquals(-4.0, paths.get(0).getScore(), DELTA);
		assertEquals(positions(subject, 2, 3, 4, 5), paths.get(0).getCursors());

		assertEquals(-1.0, paths.get(1).getScore(), DELTA);
		assertEquals(positions(subject, 8, 9, 10, 11), paths.get(1).getCursors());

		for (int i = 1; i < paths.size(); i++) {
			assertTrue(paths.get(i - 1).getScore() <= paths.get(i).getScore());
			assertFalse(paths.get(i - 1).getCursors().equals(paths.get(i).getCursors()));
		}
	}

	@Test
	public void testStatisticsAreRecorded() {
		PathSet<LinearCursor> result = align("ACGT", "TTACGTTT");

		SearchStatistics statistics = result.getStatistics();

		assertEquals(4, statistics.getProfileLength());
		assertEquals(8, statistics.getInitialSeeds());
		assertEquals(8, statistics.getFilteredSeeds());
		assertEquals(4, statistics.getColumns().size());
		assertTrue(statistics.getLinksRetained() > 0);
		assertTrue(statistics.getLinksReachable() >= statistics.getLinksRetained());
		assertTrue(statistics.getLinksConstructed() >= statistics.getLinksReachable());
		assertEquals(result.linkCount(), statistics.getLinksRetained());
	}

	@Test
	public void testTopNCapLimitsEveryColumn() throws Exception {
		String subject = "ACGTACGT";
		Fees fees = profiles.build("ACGT");

		HMMPathFinder<LinearCursor> open = new HMMPathFinder<LinearCursor>(
				LinearCursor.empty(subject), new SearchParameters());

		HMMPathFinder<LinearCursor> capped = new HMMPathFinder<LinearCursor>(
				LinearCursor.empty(subject),
				new SearchParameters().setTopN(new int[] { 0 }, new int[] { 1 }));

		PathSet<LinearCursor> full = open.findBestPath(fees, LinearCursor.allPositions(subject));
		PathSet<LinearCursor> pruned = capped.findBestPath(fees, LinearCursor.allPositions(subject));

		List<SearchStatistics.ColumnCounts> fullColumns = full.getStatistics().getColumns();
		List<SearchStatistics.ColumnCounts> prunedColumns = pruned.getStatistics().getColumns();

		assertEquals(4, prunedColumns.size());

		for (int i = 0; i < prunedColumns.size(); i++) {
			SearchStatistics.ColumnCounts counts = prunedColumns.get(i);

			// Only the two exact copies of the query prefix tie for the best match.
			assertEquals(counts.toString(), 2, counts.getMatches());
			assertTrue(counts.toString(),
					counts.getStateCount() < fullColumns.get(i).getStateCount());
		}

		assertEquals(-4.0, pruned.bestScore(), DELTA);

		List<AnnotatedPath<LinearCursor>> top = pruned.topK(2);

		assertEquals(2, top.size());
		assertEquals(-4.0, top.get(1).getScore(), DELTA);
	}

	@Test
	public void testDepthFilterDropsShortBranches() throws Exception {
		SequenceGraph graph = new SequenceGraph();

		graph.addSequence("a", "ACG");
		graph.addSequence("long", "TTTTTT");
		graph.addSequence("short", "T");

		graph.addLink("a", "long");
		graph.addLink("a", "short");

		HMMPathFinder<SequenceGraphCursor> finder = new HMMPathFinder<SequenceGraphCursor>(
				graph.emptyCursor(), new SearchParameters().setDepthFilter(1.0, 0));

		PathSet<SequenceGraphCursor> result = finder.findBestPath(profiles.build("ACGT"),
				graph.allCursors());

		SearchStatistics statistics = result.getStatistics();

		// Only a:0 to a:2 and long:0 to long:2 can still read four symbols.
		assertEquals(10, statistics.getInitialSeeds());
		assertEquals(6, statistics.getFilteredSeeds());

		// An insertion onto short:0 after the first column cannot reach the end.
		assertTrue(statistics.getColumns().get(0).getDepthFiltered() > 0);
		assertTrue(statistics.getDepthFilteredTotal() > 0);

		assertEquals(-4.0, result.bestScore(), DELTA);
	}

	@Test
	public void testInterruptedSearchStopsBetweenColumns() {
		String subject = "ACGTACGT";

		HMMPathFinder<LinearCursor> finder = new HMMPathFinder<LinearCursor>(
				LinearCursor.empty(subject), new SearchParameters());

		Thread.currentThread().interrupt();

		try {
			finder.findBestPath(profiles.build("ACGT"), LinearCursor.allPositions(subject));
			fail("Expected a SearchInterruptedException");
		} catch (SearchInterruptedException sie) {
			assertTrue(Thread.currentThread().isInterrupted());
		} finally {
			Thread.interrupted();
		}
	}

	@Test
	public void testSeedsWhichCannotReachTheEndAreDropped() {
		String subject = "ACGTACGTACGT";

		StringBuilder query = new StringBuilder();

		for (int i = 0; i < 15; i++)
			query.append("ACGT");

		PathSet<LinearCursor> result = align(query.toString(), subject);

		assertEquals(12, result.getStatistics().getInitialSeeds());
		assertEquals(3, result.getStatistics().getFilteredSeeds());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRejectsRealCursorAsSentinel() {
		new HMMPathFinder<LinearCursor>(LinearCursor.at("ACGT", 0), new SearchParameters());
	}
}
