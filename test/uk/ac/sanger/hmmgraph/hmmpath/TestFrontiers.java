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

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import uk.ac.sanger.hmmgraph.cursor.LinearCursor;
import uk.ac.sanger.hmmgraph.pathtree.PathLink;

public class TestFrontiers {
	private static final String SEQUENCE = "ACGTACGTAC";

	private LinearCursor empty;
	private List<LinearCursor> cursors;
	private PathLink<LinearCursor> base;

	@Before
	public void setUp() {
		empty = LinearCursor.empty(SEQUENCE);
		cursors = LinearCursor.allPositions(SEQUENCE);
		base = PathLink.masterSource();
	}

	private StateSet<LinearCursor> frontier(double... scores) {
		StateSet<LinearCursor> states = new StateSet<LinearCursor>();

		for (int i = 0; i < scores.length; i++)
			states.update(cursors.get(i), scores[i], empty, base);

		return states;
	}

	@Test
	public void testSelect() {
		double[] values = { 5.0, 1.0, 4.0, 2.0, 3.0 };

		assertEquals(1.0, Frontiers.select(values.clone(), 0), 0.0);
		assertEquals(3.0, Frontiers.select(values.clone(), 2), 0.0);
		assertEquals(5.0, Frontiers.select(values.clone(), 4), 0.0);
	}

	@Test
	public void testSelectWithDuplicates() {
		double[] values = { 2.0, 2.0, 1.0, 2.0, 1.0, 7.0 };

		assertEquals(1.0, Frontiers.select(values.clone(), 1), 0.0);
		assertEquals(2.0, Frontiers.select(values.clone(), 2), 0.0);
		assertEquals(7.0, Frontiers.select(values.clone(), 5), 0.0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testSelectOutOfRange() {
		Frontiers.select(new double[] { 1.0 }, 1);
	}

	@Test
	public void testScoreFilterKeepsBestN() {
		StateSet<LinearCursor> states = frontier(7.0, 3.0, 9.0, 1.0, 5.0, 2.0);

		int removed = Frontiers.scoreFilter(states, 3, 250.0);

		assertEquals(3, removed);
		assertEquals(3, states.size());
		assertTrue(states.contains(cursors.get(1)));
		assertTrue(states.contains(cursors.get(3)));
		assertTrue(states.contains(cursors.get(5)));
	}

	@Test
	public void testScoreFilterKeepsTiesAtCutoff() {
		StateSet<LinearCursor> states = frontier(1.0, 2.0, 2.0, 2.0, 5.0);

		Frontiers.scoreFilter(states, 2, 250.0);

		assertEquals(4, states.size());
		assertFalse(states.contains(cursors.get(4)));
	}

	@Test
	public void testScoreFilterAppliesThreshold() {
		StateSet<LinearCursor> states = frontier(1.0, 2.0, 3.0, 4.0, 5.0, 6.0);

		Frontiers.scoreFilter(states, 10, 4.5);

		assertEquals(4, states.size());
		assertFalse(states.contains(cursors.get(4)));
		assertFalse(states.contains(cursors.get(5)));
	}

	@Test
	public void testScoreFilterWithZeroLimitClears() {
		StateSet<LinearCursor> states = frontier(1.0, 2.0);

		assertEquals(2, Frontiers.scoreFilter(states, 0, 250.0));
		assertTrue(states.isEmpty());
	}

	@Test
	public void testFilterKey() {
		StateSet<LinearCursor> states = frontier(1.0, 2.0, 3.0, 4.0);

		int removed = Frontiers.filterKey(states, new CursorFilter<LinearCursor>() {
			public boolean reject(LinearCursor cursor) {
				return cursor.letter() == 'A';
			}
		});

		assertEquals(1, removed);
		assertFalse(states.contains(cursors.get(0)));
		assertEquals(3, states.size());
	}

	@Test
	public void testFilterKeyValue() {
		StateSet<LinearCursor> states = frontier(1.0, 2.0, 3.0, 4.0);

		int removed = Frontiers.filterKeyValue(states, new StateFilter<LinearCursor>() {
			public boolean reject(LinearCursor cursor, double score) {
				return cursor.getPosition() > 0 && score < 3.5;
			}
		});

		assertEquals(2, removed);
		assertTrue(states.contains(cursors.get(0)));
		assertTrue(states.contains(cursors.get(3)));
	}

	@Test
	public void testScoreFilterOnDeletions() {
		DeletionStateSet<LinearCursor> deletions = new DeletionStateSet<LinearCursor>();

		for (int i = 0; i < 5; i++)
			deletions.update(cursors.get(i), 10.0 - i, base);

		Frontiers.scoreFilter(deletions, 2, 250.0);

		assertEquals(2, deletions.size());
		assertTrue(deletions.contains(cursors.get(3)));
		assertTrue(deletions.contains(cursors.get(4)));
	}
}
