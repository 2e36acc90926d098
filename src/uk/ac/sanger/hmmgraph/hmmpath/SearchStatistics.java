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

package uk.ac.sanger.hmmgraph.hmmpath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Counters gathered during one search.
 */

public class SearchStatistics {
	public static class ColumnCounts {
		protected final int column;
		protected final int insertions;
		protected final int matches;
		protected final int deletions;
		protected final int depthFiltered;

		public ColumnCounts(int column, int insertions, int matches, int deletions,
				int depthFiltered) {
			this.column = column;
			this.insertions = insertions;
			this.matches = matches;
			this.deletions = deletions;
			this.depthFiltered = depthFiltered;
		}

		public int getColumn() {
			return column;
		}

		public int getInsertions() {
			return insertions;
		}

		public int getMatches() {
			return matches;
		}

		public int getDeletions() {
			return deletions;
		}

		public int getDepthFiltered() {
			return depthFiltered;
		}

		public int getStateCount() {
			return insertions + matches + deletions;
		}

		public String toString() {
			return "column " + column + ": I = " + insertions + " M = " + matches + " D = "
					+ deletions + ", depth-filtered " + depthFiltered;
		}
	}

	protected int profileLength;
	protected int initialSeeds;
	protected int filteredSeeds;
	protected final List<ColumnCounts> columns = new ArrayList<ColumnCounts>();
	protected long depthFilteredTotal;
	protected int depthMaxStackSize;
	protected long linksConstructed;
	protected long linksReachable;
	protected long linksRetained;

	public int getProfileLength() {
		return profileLength;
	}

	void setProfileLength(int profileLength) {
		this.profileLength = profileLength;
	}

	public int getInitialSeeds() {
		return initialSeeds;
	}

	/**
	 * Returns the number of seeds left after those which cannot reach the
	 * end of the profile were dropped.
	 */

	public int getFilteredSeeds() {
		return filteredSeeds;
	}

	void setSeeds(int initialSeeds, int filteredSeeds) {
		this.initialSeeds = initialSeeds;
		this.filteredSeeds = filteredSeeds;
	}

	void addColumn(ColumnCounts counts) {
		columns.add(counts);
		depthFilteredTotal += counts.getDepthFiltered();
	}

	public List<ColumnCounts> getColumns() {
		return Collections.unmodifiableList(columns);
	}

	public long getDepthFilteredTotal() {
		return depthFilteredTotal;
	}

	public int getDepthMaxStackSize() {
		return depthMaxStackSize;
	}

	void setDepthMaxStackSize(int depthMaxStackSize) {
		this.depthMaxStackSize = depthMaxStackSize;
	}

	void setLinkCounts(long constructed, long reachable, long retained) {
		this.linksConstructed = constructed;
		this.linksReachable = reachable;
		this.linksRetained = retained;
	}

	public long getLinksConstructed() {
		return linksConstructed;
	}

	/**
	 * Returns the number of links reachable from the result before tail
	 * clipping.
	 */

	public long getLinksReachable() {
		return linksReachable;
	}

	/**
	 * Returns the number of links reachable from the result after tail
	 * clipping.
	 */

	public long getLinksRetained() {
		return linksRetained;
	}

	public String toString() {
		return "SearchStatistics[profileLength=" + profileLength + ", seeds=" + filteredSeeds
				+ "/" + initialSeeds + ", depthFiltered=" + depthFilteredTotal
				+ ", depthMaxStackSize=" + depthMaxStackSize + ", links=" + linksConstructed
				+ " constructed, " + linksReachable + " reachable, " + linksRetained + " retained]";
	}
}
