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

import java.util.List;
import java.util.Set;

import uk.ac.sanger.hmmgraph.cursor.GraphCursor;

/**
 * A mapping from graph position to the best known score and traceback link
 * for one layer of the search. At most one entry is held per cursor.
 */

public interface ScoredFrontier<C extends GraphCursor<C>> {
	/**
	 * Returns a snapshot of the entries. The frontier may be modified while
	 * the snapshot is walked.
	 */
	public List<State<C>> states();

	/**
	 * Returns a copy of the set of cursors held.
	 */
	public Set<C> cursors();

	public boolean contains(C cursor);

	public double getScore(C cursor);

	public boolean remove(C cursor);

	public int size();

	public boolean isEmpty();

	public void clear();
}
