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

/**
 * Region within a named sequence of a genome. Coordinates are 1-based and inclusive
 */
public interface GenomicRegion {
	/**
	 * @return String Name of the sequence (chromosome) containing the region
	 */
	public String getSequenceName();
	/**
	 * @return int First position of the region (1-based)
	 */
	public int getFirst();
	/**
	 * @return int Last position of the region (1-based, inclusive)
	 */
	public int getLast();
	/**
	 * @return int Number of base pairs spanned by the region
	 */
	public int length();
	public boolean isPositiveStrand();
	public boolean isNegativeStrand();
}
