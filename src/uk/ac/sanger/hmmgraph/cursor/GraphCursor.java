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

package uk.ac.sanger.hmmgraph.cursor;

import java.util.List;

/**
 * A position in a labelled target graph.
 * <p>
 * Implementations must be cheap to copy and must implement
 * <code>equals</code> and <code>hashCode</code>, since cursors are used as
 * map keys throughout the search. Each graph has a single empty cursor which
 * stands both before the first and after the last position; it is distinct
 * from every real cursor.
 */

public interface GraphCursor<C extends GraphCursor<C>> {
	/**
	 * The symbol returned by the empty cursor.
	 */

	public static final char NO_LETTER = '\0';

	/**
	 * Returns true if this is the graph's empty (sentinel) cursor.
	 */

	public boolean isEmpty();

	/**
	 * Returns the symbol at this position, or NO_LETTER for the empty cursor.
	 */

	public char letter();

	/**
	 * Returns the positions that follow this one. An empty list means the
	 * walk ends here.
	 */

	public List<C> next();

	/**
	 * Returns the positions that precede this one.
	 */

	public List<C> prev();
}
