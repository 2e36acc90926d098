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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.jgrapht.Graphs;
import org.jgrapht.graph.DefaultDirectedWeightedGraph;
import org.jgrapht.graph.DefaultWeightedEdge;

/**
 * An assembly-style graph: every vertex carries a sequence, every edge says
 * that one sequence may be followed by another. Consecutive sequences share
 * <code>overlap</code> symbols, which is zero for a string graph and k-1 for
 * a de Bruijn graph of k-mers.
 * <p>
 * The graph is built first and then searched; it must not be modified while
 * cursors over it are in use.
 */

public class SequenceGraph {
	protected final DefaultDirectedWeightedGraph<SequenceNode, DefaultWeightedEdge> graph =
		new DefaultDirectedWeightedGraph<SequenceNode, DefaultWeightedEdge>(DefaultWeightedEdge.class);

	protected final Map<String, SequenceNode> nodesByName = new HashMap<String, SequenceNode>();

	protected final int overlap;

	protected final SequenceGraphCursor emptyCursor;

	public SequenceGraph(int overlap) {
		if (overlap < 0)
			throw new IllegalArgumentException("Overlap must not be negative");

		this.overlap = overlap;
		this.emptyCursor = new SequenceGraphCursor(this, null, 0);
	}

	public SequenceGraph() {
		this(0);
	}

	public int getOverlap() {
		return overlap;
	}

	public SequenceNode addSequence(String name, String sequence) {
		if (nodesByName.containsKey(name))
			throw new IllegalArgumentException("Duplicate sequence name: " + name);

		SequenceNode node = new SequenceNode(name, sequence);

		nodesByName.put(name, node);
		graph.addVertex(node);

		return node;
	}

	/**
	 * Adds a link from one sequence to another. Adding the same link again
	 * increments its weight, which records how many times it was seen.
	 */

	public void addLink(String fromName, String toName) {
		SequenceNode from = getNode(fromName);
		SequenceNode to = getNode(toName);

		DefaultWeightedEdge edge = graph.getEdge(from, to);

		if (edge != null) {
			double weight = graph.getEdgeWeight(edge);
			graph.setEdgeWeight(edge, weight + 1.0);
		} else {
			edge = graph.addEdge(from, to);
			graph.setEdgeWeight(edge, 1.0);
		}
	}

	public double getLinkWeight(String fromName, String toName) {
		DefaultWeightedEdge edge = graph.getEdge(getNode(fromName), getNode(toName));

		return edge == null ? 0.0 : graph.getEdgeWeight(edge);
	}

	public SequenceNode getNode(String name) {
		SequenceNode node = nodesByName.get(name);

		if (node == null)
			throw new IllegalArgumentException("No such sequence: " + name);

		return node;
	}

	public boolean containsSequence(String name) {
		return nodesByName.containsKey(name);
	}

	public int getSequenceCount() {
		return graph.vertexSet().size();
	}

	public int getLinkCount() {
		return graph.edgeSet().size();
	}

	public SequenceGraphCursor emptyCursor() {
		return emptyCursor;
	}

	public SequenceGraphCursor cursorAt(String name, int offset) {
		SequenceNode node = getNode(name);

		if (offset < 0 || offset >= node.getLength())
			throw new IllegalArgumentException("Offset " + offset + " is outside " + name);

		return new SequenceGraphCursor(this, node, offset);
	}

	/**
	 * Returns a cursor at every position of every sequence.
	 */

	public List<SequenceGraphCursor> allCursors() {
		List<SequenceGraphCursor> cursors = new ArrayList<SequenceGraphCursor>();

		for (SequenceNode node : graph.vertexSet())
			for (int offset = 0; offset < node.getLength(); offset++)
				cursors.add(new SequenceGraphCursor(this, node, offset));

		return cursors;
	}

	List<SequenceGraphCursor> nextOf(SequenceNode node, int offset) {
		if (offset + 1 < node.getLength()) {
			List<SequenceGraphCursor> result = new ArrayList<SequenceGraphCursor>(1);
			result.add(new SequenceGraphCursor(this, node, offset + 1));
			return result;
		}

		List<SequenceNode> successors = Graphs.successorListOf(graph, node);

		List<SequenceGraphCursor> result = new ArrayList<SequenceGraphCursor>(successors.size());

		// A successor no longer than the overlap contributes no new symbols.
		for (SequenceNode successor : successors)
			if (overlap < successor.getLength())
				result.add(new SequenceGraphCursor(this, successor, overlap));

		return result;
	}

	List<SequenceGraphCursor> prevOf(SequenceNode node, int offset) {
		List<SequenceGraphCursor> result = new ArrayList<SequenceGraphCursor>();

		if (offset > 0)
			result.add(new SequenceGraphCursor(this, node, offset - 1));

		if (offset == overlap) {
			for (SequenceNode predecessor : Graphs.predecessorListOf(graph, node))
				result.add(new SequenceGraphCursor(this, predecessor, predecessor.getLength() - 1));
		}

		return result;
	}
}
