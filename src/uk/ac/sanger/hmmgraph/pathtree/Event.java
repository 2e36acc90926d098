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

/**
 * The profile column and state kind at which a path link was created.
 */

public class Event {
	public static final Event NONE = new Event(0, EventType.NONE);

	protected final int column;
	protected final EventType type;

	public Event(int column, EventType type) {
		if (column < 0)
			throw new IllegalArgumentException("Column must not be negative");

		this.column = column;
		this.type = type;
	}

	public int getColumn() {
		return column;
	}

	public EventType getType() {
		return type;
	}

	public boolean equals(Object o) {
		if (this == o)
			return true;

		if (!(o instanceof Event))
			return false;

		Event that = (Event) o;

		return column == that.column && type == that.type;
	}

	public int hashCode() {
		return 31 * column + type.hashCode();
	}

	public String toString() {
		return type + "(" + column + ")";
	}
}
