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

import uk.ac.sanger.hmmgraph.cursor.GraphCursor;
import uk.ac.sanger.hmmgraph.pathtree.PathLink;

/**
 * One entry of a frontier, as seen by code which walks the frontier.
 */

public class State<C extends GraphCursor<C>> {
	protected final C cursor;
	protected final double score;
	protected final PathLink<C> link;

	public State(C cursor, double score, PathLink<C> link) {
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
		return "State[" + cursor + ", " + score + "]";
	}
}
