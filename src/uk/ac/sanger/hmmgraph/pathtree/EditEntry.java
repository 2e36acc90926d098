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
 * A run of identical alignment operations against the profile.
 */

public class EditEntry {
	public static final char MATCH = 'M';
	public static final char INSERTION = 'I';
	public static final char DELETION = 'D';

	private final char type;
	private final int count;

	public EditEntry(char type, int count) {
		if (type != MATCH && type != INSERTION && type != DELETION)
			throw new IllegalArgumentException("Unknown edit type " + type);

		if (count < 1)
			throw new IllegalArgumentException("An edit must cover at least one position");

		this.type = type;
		this.count = count;
	}

	public char getType() {
		return type;
	}

	public int getCount() {
		return count;
	}

	public boolean equals(Object o) {
		if (!(o instanceof EditEntry))
			return false;

		EditEntry that = (EditEntry) o;

		return type == that.type && count == that.count;
	}

	public int hashCode() {
		return 31 * type + count;
	}

	public String toString() {
		return "" + count + type;
	}
}
