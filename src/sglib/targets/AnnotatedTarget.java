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
package sglib.targets;

/**
 * Copy of a guide target annotated with an overlapping gene region. Unannotated copies have
 * null gene, offset and sense strand. Instances are immutable
 */
public class AnnotatedTarget {
	private final String sequence;
	private final String motif;
	private final String sequenceName;
	private final int start;
	private final int end;
	private final boolean reverse;
	private final int specificity;
	private final String gene;
	private final Integer offset;
	private final Boolean senseStrand;
	
	/**
	 * Creates an unannotated copy of the given target
	 * @param target to copy
	 */
	public AnnotatedTarget(GuideTarget target) {
		this(target, null, null, null);
	}
	/**
	 * Creates an annotated copy of the given target
	 * @param target to copy
	 * @param gene Name of the overlapping gene
	 * @param offset Distance from the transcription start of the gene to the target
	 * @param senseStrand true if the target is on the same strand as the gene
	 */
	public AnnotatedTarget(GuideTarget target, String gene, Integer offset, Boolean senseStrand) {
		this.sequence = target.getSequence();
		this.motif = target.getMotif();
		this.sequenceName = target.getSequenceName();
		this.start = target.getStart();
		this.end = target.getEnd();
		this.reverse = target.isReverse();
		this.specificity = target.getSpecificity();
		this.gene = gene;
		this.offset = offset;
		this.senseStrand = senseStrand;
	}
	public String getSequence() {
		return sequence;
	}
	public String getMotif() {
		return motif;
	}
	public String getSequenceName() {
		return sequenceName;
	}
	public int getStart() {
		return start;
	}
	public int getEnd() {
		return end;
	}
	public boolean isReverse() {
		return reverse;
	}
	public int getSpecificity() {
		return specificity;
	}
	public boolean isAnnotated() {
		return gene!=null;
	}
	public String getGene() {
		return gene;
	}
	public Integer getOffset() {
		return offset;
	}
	public Boolean getSenseStrand() {
		return senseStrand;
	}
	/**
	 * @return String Identity key of the target from which this copy was made
	 */
	public String getTargetKey() {
		return new GuideTarget(sequence, motif, sequenceName, start, end, reverse).getIdentityKey();
	}
}
