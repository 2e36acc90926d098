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

import java.util.Properties;

import org.junit.Test;

import uk.ac.sanger.hmmgraph.HMMGraph;

public class TestSearchParameters {
	@Test
	public void testTopNSchedule() {
		SearchParameters parameters = new SearchParameters();

		assertEquals(123, parameters.getTopN(1, 123));
		assertEquals(123, parameters.getTopN(25, 123));
		assertEquals(1000000, parameters.getTopN(26, 123));
		assertEquals(50000, parameters.getTopN(101, 123));
		assertEquals(10000, parameters.getTopN(501, 123));
	}

	@Test
	public void testDepthRequirement() {
		SearchParameters parameters = new SearchParameters();

		assertEquals(-10.0, parameters.getDepthRequirement(0), 0.0);
		assertEquals(0.0, parameters.getDepthRequirement(30), 0.0);
		assertEquals(1.0, parameters.getDepthRequirement(33), 0.0);
		assertEquals(1.0, parameters.getDepthRequirement(35), 0.0);
		assertEquals(10.0, parameters.getDepthRequirement(60), 0.0);
	}

	@Test
	public void testDefaultsFromProperties() {
		SearchParameters parameters = SearchParameters.fromProperties();

		assertEquals(250.0, parameters.getAbsoluteThreshold(), 0.0);
		assertEquals(30, parameters.getMaxInsertions());
		assertEquals(10, parameters.getDepthSlack());
		assertEquals(50000, parameters.getDepthStackLimit());
		assertEquals("*X", parameters.getStopSymbols());
		assertEquals(20.0, parameters.getClipMargin(), 0.0);
		assertEquals(50000, parameters.getTopN(200, 1));
	}

	@Test
	public void testInvalidPropertyKeepsDefault() {
		Properties props = HMMGraph.getProperties();

		String saved = props.getProperty("hmmgraph.insertions.max");

		props.setProperty("hmmgraph.insertions.max", "many");

		try {
			assertEquals(SearchParameters.DEFAULT_MAX_INSERTIONS,
					SearchParameters.fromProperties().getMaxInsertions());
		} finally {
			if (saved == null)
				props.remove("hmmgraph.insertions.max");
			else
				props.setProperty("hmmgraph.insertions.max", saved);
		}
	}

	@Test
	public void testPropertyOverride() {
		Properties props = HMMGraph.getProperties();

		String saved = props.getProperty("hmmgraph.threshold.absolute");

		props.setProperty("hmmgraph.threshold.absolute", "42.5");

		try {
			assertEquals(42.5, SearchParameters.fromProperties().getAbsoluteThreshold(), 0.0);
		} finally {
			if (saved == null)
				props.remove("hmmgraph.threshold.absolute");
			else
				props.setProperty("hmmgraph.threshold.absolute", saved);
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMismatchedTopNArrays() {
		new SearchParameters().setTopN(new int[] { 1, 2 }, new int[] { 3 });
	}
}
