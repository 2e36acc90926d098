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

package uk.ac.sanger.hmmgraph.apps;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import uk.ac.sanger.hmmgraph.graph.SequenceGraph;
import uk.ac.sanger.hmmgraph.graph.SequenceGraphCursor;

public class TestAlignSequenceToGraph {
	private SequenceGraph graph;

	@Before
	public void setUp() {
		graph = new SequenceGraph();

		graph.addSequence("a", "ACGT");
		graph.addSequence("b", "TTGA");
		graph.addSequence("c", "CC");
	}

	@Test
	public void testLoadLinks() throws IOException {
		String text = "# from to\na\tb\n\n  b   c  \na b\n";

		AlignSequenceToGraph.loadLinks(
				new ByteArrayInputStream(text.getBytes(StandardCharsets.US_ASCII)), graph);

		assertEquals(2, graph.getLinkCount());
		assertEquals(2.0, graph.getLinkWeight("a", "b"), 0.0);
		assertEquals(1.0, graph.getLinkWeight("b", "c"), 0.0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testLoadLinksNeedsTwoNames() throws IOException {
		AlignSequenceToGraph.loadLinks(
				new ByteArrayInputStream("a\n".getBytes(StandardCharsets.US_ASCII)), graph);
	}

	@Test
	public void testWithoutSeedsStartAnywhere() {
		Collection<SequenceGraphCursor> initial = AlignSequenceToGraph.selectSeeds(graph,
				new ArrayList<String>());

		assertEquals(10, initial.size());
	}

	@Test
	public void testSeedNeighbourhood() {
		graph.addLink("a", "b");

		List<String> seeds = Arrays.asList("a:2:3");

		Collection<SequenceGraphCursor> initial = AlignSequenceToGraph.selectSeeds(graph, seeds);

		HashSet<SequenceGraphCursor> expected = new HashSet<SequenceGraphCursor>();
		expected.add(graph.cursorAt("a", 2));
		expected.add(graph.cursorAt("a", 3));
		expected.add(graph.cursorAt("b", 0));
		expected.add(graph.cursorAt("b", 1));

		assertEquals(expected, new HashSet<SequenceGraphCursor>(initial));
	}

	@Test
	public void testSeveralSeeds() {
		List<String> seeds = Arrays.asList("a:3:0", "c:0:5");

		Collection<SequenceGraphCursor> initial = AlignSequenceToGraph.selectSeeds(graph, seeds);

		assertEquals(3, initial.size());
		assertTrue(initial.contains(graph.cursorAt("a", 3)));
		assertTrue(initial.contains(graph.cursorAt("c", 1)));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMalformedSeed() {
		AlignSequenceToGraph.selectSeeds(graph, Arrays.asList("a:2"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNonNumericSeed() {
		AlignSequenceToGraph.selectSeeds(graph, Arrays.asList("a:x:3"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testSeedOutsideSequence() {
		AlignSequenceToGraph.selectSeeds(graph, Arrays.asList("c:2:3"));
	}
}
