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

import java.util.Collections;
import java.util.List;

import uk.ac.sanger.hmmgraph.cursor.GraphCursor;

public class SequenceGraphCursor implements GraphCursor<SequenceGraphCursor> {
	protected final SequenceGraph graph;
	protected final SequenceNode node;
	protected final int offset;

	SequenceGraphCursor(SequenceGraph graph, SequenceNode node, int offset) {
		this.graph = graph;
		this.node = node;
		this.offset = offset;
	}

	public SequenceNode getNode() {
		return node;
	}

	public int getOffset() {
		return offset;
	}

	public boolean isEmpty() {
		return node == null;
	}

	public char letter() {
		return node == null ? NO_LETTER : node.getSequence().charAt(offset);
	}

	public List<SequenceGraphCursor> next() {
		if (node == null)
			return Collections.emptyList();

		return graph.nextOf(node, offset);
	}

	public List<SequenceGraphCursor> prev() {
		if (node == null)
			return Collections.emptyList();

		return graph.prevOf(node, offset);
	}

	public boolean equals(Object o) {
		if (this == o)
			return true;

		if (!(o instanceof SequenceGraphCursor))
			return false;

		SequenceGraphCursor that = (SequenceGraphCursor) o;

		if (graph != that.graph || offset != that.offset)
			return false;

		return node == null ? that.node == null : node.equals(that.node);
	}

	public int hashCode() {
		return node == null ? -1 : 31 * node.hashCode() + offset;
	}

	public String toString() {
		return node == null ? "(empty)" : node.getName() + ":" + offset;
	}
}
