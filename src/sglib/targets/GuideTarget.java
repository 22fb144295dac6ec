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

import sglib.genome.GenomicRegion;

/**
 * Candidate guide site adjacent to a motif (PAM) match. The sequence and motif are given 5' to 3'
 * on the strand where the match was found. Start and end are 0-based half open coordinates of the
 * sequence over the forward strand of the chromosome.
 * The only mutable attribute is the specificity tier, which starts at 0 (not scored)
 */
public class GuideTarget implements GenomicRegion {
	public static final char KEY_SEPARATOR = '_';
	public static final String KEY_FORWARD = "fwd";
	public static final String KEY_REVERSE = "rev";
	
	private final String sequence;
	private final String motif;
	private final String sequenceName;
	private final int start;
	private final int end;
	private final boolean reverse;
	private int specificity = 0;
	
	public GuideTarget(String sequence, String motif, String sequenceName, int start, int end, boolean reverse) {
		if(sequenceName==null || sequenceName.length()==0) throw new IllegalArgumentException("Targets require a sequence name");
		if(sequence.length()!=end-start) throw new IllegalArgumentException("Target sequence "+sequence+" does not match coordinates "+start+"-"+end);
		this.sequence = sequence;
		this.motif = motif;
		this.sequenceName = sequenceName;
		this.start = start;
		this.end = end;
		this.reverse = reverse;
	}
	
	public String getSequence() {
		return sequence;
	}
	public String getMotif() {
		return motif;
	}
	/**
	 * @return String Target sequence followed by the motif, 5' to 3' on the strand of the target
	 */
	public String getSequenceWithMotif() {
		return sequence+motif;
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
	public boolean isReverse() {
		return reverse;
	}
	public int getSpecificity() {
		return specificity;
	}
	/**
	 * Raises the specificity tier. Values lower than or equal to the current tier are ignored
	 * @param specificity New tier
	 * @return boolean true if the tier changed
	 */
	public boolean updateSpecificity(int specificity) {
		if(specificity<=this.specificity) return false;
		this.specificity = specificity;
		return true;
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
		return end - start;
	}
	@Override
	public boolean isPositiveStrand() {
		return !reverse;
	}
	@Override
	public boolean isNegativeStrand() {
		return reverse;
	}
	/**
	 * Builds the identity key of this target. The key is also used as read name for the aligner,
	 * so it has no whitespace. Bases never contain the separator, so the sequence name is
	 * recovered as everything between the motif and the last three fields
	 * @return String sequence_motif_chrom_start_end_(fwd|rev)
	 */
	public String getIdentityKey() {
		StringBuilder key = new StringBuilder();
		key.append(sequence).append(KEY_SEPARATOR);
		key.append(motif).append(KEY_SEPARATOR);
		key.append(sequenceName).append(KEY_SEPARATOR);
		key.append(start).append(KEY_SEPARATOR);
		key.append(end).append(KEY_SEPARATOR);
		key.append(reverse?KEY_REVERSE:KEY_FORWARD);
		return key.toString();
	}
	/**
	 * Rebuilds a target from its identity key. The specificity of the new target is 0
	 * @param key Identity key built by getIdentityKey
	 * @return GuideTarget target with the data encoded in the key
	 */
	public static GuideTarget fromIdentityKey(String key) {
		int i1 = key.indexOf(KEY_SEPARATOR);
		int i2 = key.indexOf(KEY_SEPARATOR, i1+1);
		int i5 = key.lastIndexOf(KEY_SEPARATOR);
		int i4 = key.lastIndexOf(KEY_SEPARATOR, i5-1);
		int i3 = key.lastIndexOf(KEY_SEPARATOR, i4-1);
		if(i1<0 || i2<0 || i3<=i2) throw new IllegalArgumentException("Malformed target key: "+key);
		String direction = key.substring(i5+1);
		if(!KEY_FORWARD.equals(direction) && !KEY_REVERSE.equals(direction)) throw new IllegalArgumentException("Malformed direction in target key: "+key);
		try {
			return new GuideTarget(key.substring(0,i1), key.substring(i1+1,i2), key.substring(i2+1,i3), Integer.parseInt(key.substring(i3+1,i4)), Integer.parseInt(key.substring(i4+1,i5)), KEY_REVERSE.equals(direction));
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Malformed coordinates in target key: "+key,e);
		}
	}
	@Override
	public boolean equals(Object obj) {
		if(this==obj) return true;
		if(!(obj instanceof GuideTarget)) return false;
		return getIdentityKey().equals(((GuideTarget)obj).getIdentityKey());
	}
	@Override
	public int hashCode() {
		return getIdentityKey().hashCode();
	}
	@Override
	public String toString() {
		return getIdentityKey();
	}
}
