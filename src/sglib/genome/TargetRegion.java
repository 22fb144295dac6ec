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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named gene region used to annotate guide targets. Start and end are 0-based half open
 * coordinates over the forward strand of the sequence
 */
public class TargetRegion implements GenomicRegion {
	public static final char STRAND_POSITIVE = '+';
	public static final char STRAND_NEGATIVE = '-';
	
	private final String gene;
	private final String sequenceName;
	private final int start;
	private final int end;
	private final char strand;
	
	public TargetRegion(String gene, String sequenceName, int start, int end, char strand) {
		if(gene==null) throw new NullPointerException("Gene name of region can not be null");
		if(sequenceName==null) throw new NullPointerException("Sequence name of region can not be null");
		if(start<0 || end<start) throw new IllegalArgumentException("Invalid coordinates "+start+"-"+end+" for region of gene "+gene);
		if(strand!=STRAND_POSITIVE && strand!=STRAND_NEGATIVE) throw new IllegalArgumentException("Invalid strand "+strand+" for region of gene "+gene);
		this.gene = gene;
		this.sequenceName = sequenceName;
		this.start = start;
		this.end = end;
		this.strand = strand;
	}
	/**
	 * Creates the regions for a feature. Features on an unknown strand produce one region per strand
	 * @param gene Name of the gene
	 * @param sequenceName Name of the sequence
	 * @param start 0-based first position
	 * @param end 0-based position after the last position
	 * @param strand Strand of the feature. Any value different from + or - means unknown
	 * @return List<TargetRegion> One or two regions for the feature
	 */
	public static List<TargetRegion> createRegions(String gene, String sequenceName, int start, int end, char strand) {
		List<TargetRegion> answer = new ArrayList<>(2);
		if(strand == STRAND_POSITIVE || strand == STRAND_NEGATIVE) {
			answer.add(new TargetRegion(gene, sequenceName, start, end, strand));
		} else {
			answer.add(new TargetRegion(gene, sequenceName, start, end, STRAND_POSITIVE));
			answer.add(new TargetRegion(gene, sequenceName, start, end, STRAND_NEGATIVE));
		}
		return answer;
	}
	/**
	 * Groups the given regions by sequence name, keeping the order of first appearance of
	 * each sequence, and sorts the regions of each sequence by start. Sorting is stable
	 * @param regions to sort
	 * @return List<TargetRegion> New list with the sorted regions
	 */
	public static List<TargetRegion> sortPerSequence(List<TargetRegion> regions) {
		Map<String,List<TargetRegion>> regionsBySequence = new LinkedHashMap<>();
		for(TargetRegion region:regions) {
			List<TargetRegion> seqRegions = regionsBySequence.get(region.getSequenceName());
			if(seqRegions==null) {
				seqRegions = new ArrayList<>();
				regionsBySequence.put(region.getSequenceName(), seqRegions);
			}
			seqRegions.add(region);
		}
		List<TargetRegion> answer = new ArrayList<>(regions.size());
		for(List<TargetRegion> seqRegions:regionsBySequence.values()) {
			Collections.sort(seqRegions, GenomicRegionPositionComparator.getInstance());
			answer.addAll(seqRegions);
		}
		return answer;
	}
	
	public String getGene() {
		return gene;
	}
	@Override
	public String getSequenceName() {
		return sequenceName;
	}
	public int getStart() {
		return start;
	}
	public int getEnd() {
		return end;
	}
	public char getStrand() {
		return strand;
	}
	@Override
	public int getFirst() {
		return start+1;
	}
	@Override
	public int getLast() {
		return end;
	}
	@Override
	public int length() {
		return end-start;
	}
	@Override
	public boolean isPositiveStrand() {
		return strand == STRAND_POSITIVE;
	}
	@Override
	public boolean isNegativeStrand() {
		return strand == STRAND_NEGATIVE;
	}
	@Override
	public String toString() {
		return gene+"\t"+sequenceName+"\t"+start+"\t"+end+"\t"+strand;
	}
}
