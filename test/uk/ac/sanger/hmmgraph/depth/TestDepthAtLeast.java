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

import static org.junit.Assert.*;

import org.junit.Test;

import uk.ac.sanger.hmmgraph.cursor.LinearCursor;
import uk.ac.sanger.hmmgraph.graph.SequenceGraph;
import uk.ac.sanger.hmmgraph.graph.SequenceGraphCursor;

public class TestDepthAtLeast {
	private static final String LONG_SEQUENCE = "ACGTACGTACGTACGTACGT";

	@Test
	public void testZeroDepthIsAlwaysReachable() {
		DepthAtLeast<LinearCursor> depth = new DepthAtLeast<LinearCursor>();
		LinearCursor last = LinearCursor.at("ACGT", 3);

		assertTrue(depth.depthAtLeast(last, 0L));
		assertTrue(depth.depthAtLeast(last, -3.0));
		assertTrue(depth.depthAtLeast(last, 0.5));
	}

	@Test
	public void testEmptyCursor() {
		DepthAtLeast<LinearCursor> depth = new DepthAtLeast<LinearCursor>();

		assertTrue(depth.depthAtLeast(LinearCursor.empty("ACGT"), 1000L));
	}

	@Test
	public void testExactDepth() {
		DepthAtLeast<LinearCursor> depth = new DepthAtLeast<LinearCursor>();
		LinearCursor first = LinearCursor.at("ACGT", 0);

		assertTrue(depth.depthAtLeast(first, 4L));
		assertFalse(depth.depthAtLeast(first, 5L));
		assertTrue(depth.depthAtLeast(first, 4.9));

		// Answered from the cache.
		assertFalse(depth.depthAtLeast(first, 6L));
		assertEquals(4, depth.getCacheSize());
	}

	@Test
	public void testStopSymbols() {
		DepthAtLeast<LinearCursor> depth = new DepthAtLeast<LinearCursor>("*",
				DepthAtLeast.DEFAULT_STACK_LIMIT);
		LinearCursor first = LinearCursor.at("AC*G", 0);

		assertTrue(depth.depthAtLeast(first, 2L));
		assertFalse(depth.depthAtLeast(first, 3L));
		assertFalse(depth.depthAtLeast(LinearCursor.at("AC*G", 2), 1L));
	}

	@Test
	public void testCycle() {
		SequenceGraph graph = new SequenceGraph();

		graph.addSequence("loop", "ACG");
		graph.addLink("loop", "loop");

		DepthAtLeast<SequenceGraphCursor> depth = new DepthAtLeast<SequenceGraphCursor>();

		assertTrue(depth.depthAtLeast(graph.cursorAt("loop", 0), 1000000L));
		assertTrue(depth.depthAtLeast(graph.cursorAt("loop", 2), 1000000L));
	}

	@Test
	public void testFullExplorationRefutes() {
		DepthAtLeast<LinearCursor> depth = new DepthAtLeast<LinearCursor>();
		LinearCursor first = LinearCursor.at(LONG_SEQUENCE, 0);

		assertTrue(depth.depthAtLeast(first, 20L));
		assertFalse(depth.depthAtLeast(first, 25L));
	}

	@Test
	public void testStackLimitOnlyConfirms() {
		DepthAtLeast<LinearCursor> depth = new DepthAtLeast<LinearCursor>("", 3);
		LinearCursor first = LinearCursor.at(LONG_SEQUENCE, 0);

		// Exploration stops three levels down, so a depth beyond the true
		// one cannot be refuted.
		assertTrue(depth.depthAtLeast(first, 25L));
		assertEquals(3, depth.getMaxStackSize());

		// A short walk near the end of the sequence is explored fully.
		assertFalse(depth.depthAtLeast(LinearCursor.at(LONG_SEQUENCE, 18), 3L));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testStackLimitMustBePositive() {
		new DepthAtLeast<LinearCursor>("*", 0);
	}
}
