/*******************************************************************************
 * SGLIB - sgRNA Library Builder
 * Copyright 2026 The SGLIB authors
 *
 * This file is part of SGLIB.
 *
 *     SGLIB is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     SGLIB is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with SGLIB.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package sglib.genome;

import java.util.Comparator;

/**
 * Orders regions of the same sequence by first position and then by last position.
 * Sequence names are not compared
 */
public class GenomicRegionPositionComparator implements Comparator<GenomicRegion> {
	private static final GenomicRegionPositionComparator instance = new GenomicRegionPositionComparator();
	
	private GenomicRegionPositionComparator() {
	}
	public static GenomicRegionPositionComparator getInstance() {
		return instance;
	}
	@Override
	public int compare(GenomicRegion r1, GenomicRegion r2) {
		int cmp = Integer.compare(r1.getFirst(), r2.getFirst());
		if(cmp!=0) return cmp;
		return Integer.compare(r1.getLast(), r2.getLast());
	}
}
