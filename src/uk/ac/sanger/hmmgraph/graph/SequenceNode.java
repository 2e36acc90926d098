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

package uk.ac.sanger.hmmgraph.graph;

public class SequenceNode {
	protected final String name;
	protected final String sequence;

	public SequenceNode(String name, String sequence) {
		if (name == null || sequence == null)
			throw new IllegalArgumentException("Name and sequence must both be given");

		if (sequence.length() == 0)
			throw new IllegalArgumentException("Sequence " + name + " is empty");

		this.name = name;
		this.sequence = sequence;
	}

	public String getName() {
		return name;
	}

	public String getSequence() {
		return sequence;
	}

	public int getLength() {
		return sequence.length();
	}

	public boolean equals(Object o) {
		if (this == o)
			return true;

		if (!(o instanceof SequenceNode))
			return false;

		return name.equals(((SequenceNode) o).name);
	}

	public int hashCode() {
		return name.hashCode();
	}

	public String toString() {
		return name;
	}
}
