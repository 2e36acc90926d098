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
 * Answers "is there a walk of at least d positions starting here?" without
 * computing the full depth of the graph.
 * <p>
 * Each cursor caches a depth value and a flag saying whether the value is
 * exact. A query for depth d explores at most max(2d, 10) levels below the
 * cursor, capped at the stack limit. Where the exploration is cut short the
 * value is a lower bound: it can confirm a depth but never refute one.
 * A cursor met again while it is still being explored lies on a cycle and
 * has infinite depth.
 */

public class DepthAtLeast<C extends GraphCursor<C>> {
	public static final int DEFAULT_STACK_LIMIT = 50000;
	public static final String DEFAULT_STOP_SYMBOLS = "*X";
	public static final long INF = Long.MAX_VALUE;

	protected static final long MINIMUM_BUDGET = 10;
	protected static final long BUDGET_COEFFICIENT = 2;

	protected static class Estimation {
		protected final long value;
		protected final boolean exact;

		protected Estimation(long value, boolean exact) {
			this.value = value;
			this.exact = exact;
		}
	}

	protected class Frame {
		protected final C cursor;
		protected final long budget;
		protected final List<C> children;
		protected int index = 0;
		protected long maxChild = 0;
		protected boolean exact = true;

		protected Frame(C cursor, long budget) {
			this.cursor = cursor;
			this.budget = budget;
			this.children = cursor.next();
		}

		protected void absorb(Estimation child) {
			maxChild = Math.max(maxChild, child.value);
			exact = exact && child.exact;
		}

		protected boolean hasMoreChildren() {
			return maxChild != INF && index < children.size();
		}
	}

	protected final Map<C, Estimation> depth = new HashMap<C, Estimation>();
	protected final String stopSymbols;
	protected final int stackLimit;
	protected int maxStackSize = 0;

	public DepthAtLeast(String stopSymbols, int stackLimit) {
		if (stackLimit < 1)
			throw new IllegalArgumentException("Stack limit must be positive");

		this.stopSymbols = stopSymbols == null ? "" : stopSymbols;
		this.stackLimit = stackLimit;
	}

	public DepthAtLeast() {
		this(DEFAULT_STOP_SYMBOLS, DEFAULT_STACK_LIMIT);
	}

	/**
	 * Fractional depths are truncated; any depth of zero or less is always
	 * reachable.
	 */

	public boolean depthAtLeast(C cursor, double d) {
		if (d <= 0)
			return true;

		return depthAtLeast(cursor, (long) d);
	}

	public boolean depthAtLeast(C cursor, long d) {
		if (d <= 0)
			return true;

		Estimation cached = depth.get(cursor);

		if (cached != null) {
			if (cached.value >= d)
				return true;
			else if (cached.exact)
				return false;
		}

		long budget = Math.min(Math.max(BUDGET_COEFFICIENT * d, MINIMUM_BUDGET), stackLimit);

		Estimation estimation = estimate(cursor, budget);

		if (estimation.value >= d)
			return true;

		// The budget was capped below d; an inexact value proves nothing.
		return !estimation.exact;
	}

	public int getMaxStackSize() {
		return maxStackSize;
	}

	public int getCacheSize() {
		return depth.size();
	}

	protected Estimation estimate(C root, long budget) {
		Set<C> stack = new HashSet<C>();

		Estimation immediate = resolve(root, stack, budget);

		if (immediate != null)
			return immediate;

		Deque<Frame> frames = new ArrayDeque<Frame>();

		enter(frames, stack, root, budget);

		Estimation result = null;

		while (!frames.isEmpty()) {
			Frame top = frames.peek();

			if (top.hasMoreChildren()) {
				C child = top.children.get(top.index++);

				Estimation known = resolve(child, stack, top.budget - 1);

				if (known == null)
					enter(frames, stack, child, top.budget - 1);
				else
					top.absorb(known);

				continue;
			}

			frames.pop();
			stack.remove(top.cursor);

			// Infinity is always exact.
			Estimation done = top.maxChild == INF ? new Estimation(INF, true)
					: new Estimation(1 + top.maxChild, top.exact);

			depth.put(top.cursor, done);

			if (frames.isEmpty())
				result = done;
			else
				frames.peek().absorb(done);
		}

		return result;
	}

	private void enter(Deque<Frame> frames, Set<C> stack, C cursor, long budget) {
		stack.add(cursor);
		maxStackSize = Math.max(maxStackSize, stack.size());
		frames.push(new Frame(cursor, budget));
	}

	/**
	 * Returns the estimation for a cursor if it can be had without expanding
	 * its successors, otherwise null.
	 */

	private Estimation resolve(C cursor, Set<C> stack, long budget) {
		if (cursor.isEmpty())
			return store(cursor, INF, true);

		Estimation cached = depth.get(cursor);

		if (cached != null && (cached.exact || cached.value > budget))
			return cached;

		if (stopSymbols.indexOf(cursor.letter()) >= 0)
			return store(cursor, 0, true);

		if (stack.contains(cursor))
			return store(cursor, INF, true);

		if (budget <= 0)
			return store(cursor, 1, false);

		return null;
	}

	private Estimation store(C cursor, long value, boolean exact) {
		Estimation estimation = new Estimation(value, exact);
		depth.put(cursor, estimation);
		return estimation;
	}
}
