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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A cursor over a single sequence, which is the degenerate graph in which
 * every position has at most one successor.
 */

public class LinearCursor implements GraphCursor<LinearCursor> {
	protected static final int EMPTY_POSITION = -1;

	protected final String sequence;
	protected final int position;

	protected LinearCursor(String sequence, int position) {
		this.sequence = sequence;
		this.position = position;
	}

	public static LinearCursor empty(String sequence) {
		return new LinearCursor(sequence, EMPTY_POSITION);
	}

	public static LinearCursor at(String sequence, int position) {
		if (position < 0 || position >= sequence.length())
			throw new IllegalArgumentException("Position " + position
					+ " is outside a sequence of length " + sequence.length());

		return new LinearCursor(sequence, position);
	}

	/**
	 * Returns one cursor for every position of the sequence, in order.
	 */

	public static List<LinearCursor> allPositions(String sequence) {
		List<LinearCursor> cursors = new ArrayList<LinearCursor>(sequence.length());

		for (int i = 0; i < sequence.length(); i++)
			cursors.add(new LinearCursor(sequence, i));

		return cursors;
	}

	public String getSequence() {
		return sequence;
	}

	public int getPosition() {
		return position;
	}

	public boolean isEmpty() {
		return position == EMPTY_POSITION;
	}

	public char letter() {
		return isEmpty() ? NO_LETTER : sequence.charAt(position);
	}

	public List<LinearCursor> next() {
		if (isEmpty() || position + 1 >= sequence.length())
			return Collections.emptyList();

		return Collections.singletonList(new LinearCursor(sequence, position + 1));
	}

	public List<LinearCursor> prev() {
		if (isEmpty() || position == 0)
			return Collections.emptyList();

		return Collections.singletonList(new LinearCursor(sequence, position - 1));
	}

	public boolean equals(Object o) {
		if (this == o)
			return true;

		if (!(o instanceof LinearCursor))
			return false;

		LinearCursor that = (LinearCursor) o;

		return position == that.position && sequence.equals(that.sequence);
	}

	public int hashCode() {
		return 31 * sequence.hashCode() + position;
	}

	public String toString() {
		return isEmpty() ? "(empty)" : position + ":" + letter();
	}
}
