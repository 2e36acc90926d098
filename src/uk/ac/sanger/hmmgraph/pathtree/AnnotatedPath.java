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

package uk.ac.sanger.hmmgraph.pathtree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import uk.ac.sanger.hmmgraph.cursor.GraphCursor;

/**
 * A walk through the target graph together with the profile state that
 * consumed each position.
 */

public class AnnotatedPath<C extends GraphCursor<C>> {
	protected final List<C> cursors;
	protected final List<Event> events;
	protected final double score;
	protected final int profileLength;

	public AnnotatedPath(List<C> cursors, List<Event> events, double score, int profileLength) {
		if (cursors.size() != events.size())
			throw new IllegalArgumentException("Expected one event per cursor");

		this.cursors = Collections.unmodifiableList(new ArrayList<C>(cursors));
		this.events = Collections.unmodifiableList(new ArrayList<Event>(events));
		this.score = score;
		this.profileLength = profileLength;
	}

	public List<C> getCursors() {
		return cursors;
	}

	public List<Event> getEvents() {
		return events;
	}

	public double getScore() {
		return score;
	}

	public int size() {
		return cursors.size();
	}

	public boolean isEmpty() {
		return cursors.isEmpty();
	}

	/**
	 * Returns the symbols read along the walk.
	 */

	public String getSequence() {
		StringBuilder sb = new StringBuilder(cursors.size());

		for (C cursor : cursors)
			sb.append(cursor.letter());

		return sb.toString();
	}

	/**
	 * Returns one character per operation: M for a match column, I for an
	 * inserted graph symbol, D for a skipped match column. Deletions are not
	 * recorded in the walk; they are recovered from gaps between columns.
	 * Every profile column appears exactly once as M or D.
	 */

	public String getAlignment() {
		StringBuilder sb = new StringBuilder();

		int expected = 1;

		for (Event event : events) {
			int column = event.getColumn();

			switch (event.getType()) {
			case MATCH:
				appendDeletions(sb, column - expected);
				sb.append(EditEntry.MATCH);
				expected = column + 1;
				break;

			case INSERTION:
				appendDeletions(sb, column + 1 - expected);
				sb.append(EditEntry.INSERTION);
				expected = column + 1;
				break;

			default:
				break;
			}
		}

		appendDeletions(sb, profileLength + 1 - expected);

		return sb.toString();
	}

	public List<EditEntry> getEdits() {
		String alignment = getAlignment();

		List<EditEntry> edits = new ArrayList<EditEntry>();

		int i = 0;

		while (i < alignment.length()) {
			char type = alignment.charAt(i);
			int j = i;

			while (j < alignment.length() && alignment.charAt(j) == type)
				j++;

			edits.add(new EditEntry(type, j - i));

			i = j;
		}

		return edits;
	}

	public String getCigar() {
		StringBuilder sb = new StringBuilder();

		for (EditEntry edit : getEdits())
			sb.append(edit);

		return sb.toString();
	}

	private static void appendDeletions(StringBuilder sb, int count) {
		for (int i = 0; i < count; i++)
			sb.append(EditEntry.DELETION);
	}

	public String toString() {
		return "AnnotatedPath[score=" + score + ", length=" + cursors.size()
				+ ", sequence=" + getSequence() + ", cigar=" + getCigar() + "]";
	}
}
