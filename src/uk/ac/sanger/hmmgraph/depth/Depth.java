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

package uk.ac.sanger.hmmgraph.depth;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import uk.ac.sanger.hmmgraph.cursor.GraphCursor;

/**
 * Full memoized depth: the length of the longest walk from a cursor, or
 * infinity if a walk from it can reach a cycle. The empty cursor has
 * infinite depth and a stop symbol has depth zero.
 * <p>
 * Every reachable cursor is expanded once, so this is only practical on
 * small graphs. The search uses {@link DepthAtLeast} instead.
 */

public class Depth<C extends GraphCursor<C>> {
	protected final Map<C, Double> depth = new HashMap<C, Double>();
	protected final String stopSymbols;
	protected int maxStackSize = 0;

	public Depth(String stopSymbols) {
		this.stopSymbols = stopSymbols == null ? "" : stopSymbols;
	}

	public Depth() {
		this(DepthAtLeast.DEFAULT_STOP_SYMBOLS);
	}

	public boolean depthAtLeast(C cursor, double d) {
		return depth(cursor) >= d;
	}

	public double depth(C root) {
		Set<C> stack = new HashSet<C>();

		Double immediate = resolve(root, stack);

		if (immediate != null)
			return immediate.doubleValue();

		Deque<Frame> frames = new ArrayDeque<Frame>();

		enter(frames, stack, root);

		double result = 0.0;

		while (!frames.isEmpty()) {
			Frame top = frames.peek();

			if (top.index < top.children.size()) {
				C child = top.children.get(top.index++);

				Double known = resolve(child, stack);

				if (known == null)
					enter(frames, stack, child);
				else
					top.maxChild = Math.max(top.maxChild, known.doubleValue());

				continue;
			}

			frames.pop();
			stack.remove(top.cursor);

			double value = 1 + top.maxChild;

			depth.put(top.cursor, value);

			if (frames.isEmpty())
				result = value;
			else
				frames.peek().maxChild = Math.max(frames.peek().maxChild, value);
		}

		return result;
	}

	public int getMaxStackSize() {
		return maxStackSize;
	}

	private class Frame {
		private final C cursor;
		private final List<C> children;
		private int index = 0;
		private double maxChild = 0.0;

		private Frame(C cursor) {
			this.cursor = cursor;
			this.children = cursor.next();
		}
	}

	private void enter(Deque<Frame> frames, Set<C> stack, C cursor) {
		stack.add(cursor);
		maxStackSize = Math.max(maxStackSize, stack.size());
		frames.push(new Frame(cursor));
	}

	private Double resolve(C cursor, Set<C> stack) {
		Double cached = depth.get(cursor);

		if (cached != null)
			return cached;

		if (cursor.isEmpty())
			return store(cursor, Double.POSITIVE_INFINITY);

		if (stopSymbols.indexOf(cursor.letter()) >= 0)
			return store(cursor, 0.0);

		if (stack.contains(cursor))
			return store(cursor, Double.POSITIVE_INFINITY);

		return null;
	}

	private Double store(C cursor, double value) {
		Double boxed = Double.valueOf(value);
		depth.put(cursor, boxed);
		return boxed;
	}
}
