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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import sglib.alignments.ShortReadsAligner;
import sglib.sequences.DNASequence;
import sglib.sequences.RawRead;

/**
 * Assigns specificity tiers to targets aligning them back to the genome as synthetic reads.
 * Tolerances are tried in the given order and each round only submits targets that are still
 * unscored, so a target keeps the first tolerance at which it aligns uniquely.
 * Targets without a unique alignment at any tolerance keep specificity 0
 */
public class SpecificityScorer {
	public static final int [] DEF_TOLERANCES = {39,30,20,11,1};
	/**
	 * Qualities of the motif positions of a read. The read starts with the reverse complement of the motif
	 */
	public static final String MOTIF_QUALITIES = "I4!";
	/**
	 * Qualities of the window positions, from the base next to the motif to the far end
	 */
	public static final String WINDOW_QUALITIES = "=======44444++++++++";
	public static final char WINDOW_DISTAL_QUALITY = '+';
	public static final char MOTIF_EXTRA_QUALITY = '!';
	
	private Logger log = Logger.getLogger(SpecificityScorer.class.getName());
	
	private final ShortReadsAligner aligner;
	private int [] tolerances = DEF_TOLERANCES;
	
	public SpecificityScorer(ShortReadsAligner aligner) {
		this.aligner = aligner;
	}
	
	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}
	public int[] getTolerances() {
		return tolerances.clone();
	}
	/**
	 * Changes the tolerance schedule. Tolerances are tried in the given order
	 * @param tolerances New schedule. It must be non empty and have positive values
	 */
	public void setTolerances(int[] tolerances) {
		if(tolerances==null || tolerances.length==0) throw new IllegalArgumentException("At least one tolerance is required");
		for(int tolerance:tolerances) {
			if(tolerance<=0) throw new IllegalArgumentException("Tolerances must be positive. Given: "+tolerance);
		}
		this.tolerances = tolerances.clone();
	}
	
	/**
	 * Updates the specificity of the given targets. If the aligner fails, the exception is
	 * propagated and tiers assigned in previous rounds are kept
	 * @param targets Targets indexed by identity key
	 * @throws IOException If the aligner fails
	 */
	public void score(Map<String,GuideTarget> targets) throws IOException {
		aligner.prepareIndex();
		for(int tolerance:tolerances) {
			List<RawRead> reads = new ArrayList<>();
			for(GuideTarget t:targets.values()) {
				if(t.getSpecificity()>0) continue;
				reads.add(buildRead(t));
			}
			if(reads.isEmpty()) {
				log.info("No unscored targets remain. Skipping tolerance "+tolerance+" and lower");
				break;
			}
			log.info("Marking specificity threshold "+tolerance+" for "+reads.size()+" targets");
			Set<String> alignedNames = aligner.findUniquelyAlignedReads(reads, tolerance);
			int updated = 0;
			for(String name:alignedNames) {
				GuideTarget t = targets.get(name);
				if(t==null) {
					log.warning("Aligned read "+name+" does not correspond to any target");
					continue;
				}
				if(t.updateSpecificity(tolerance)) updated++;
			}
			log.info("Targets with unique alignment at threshold "+tolerance+": "+updated);
		}
	}
	/**
	 * Builds the synthetic read of a target. The read is the forward strand genomic sequence
	 * including the motif, which is the reverse complement of the target followed by its motif
	 * @param target to convert
	 * @return RawRead Read named with the identity key of the target
	 */
	public static RawRead buildRead(GuideTarget target) {
		String readSequence = DNASequence.getReverseComplement(target.getSequenceWithMotif());
		String qualities = buildQualityProfile(target.getMotif().length(), target.getSequence().length());
		return new RawRead(target.getIdentityKey(), readSequence, qualities);
	}
	/**
	 * Builds the fixed quality string of synthetic reads. For a motif of three bases and a window
	 * of twenty bases the profile is I4!=======44444++++++++
	 * @param motifLength Number of motif bases at the start of the read
	 * @param windowLength Number of window bases after the motif
	 * @return String qualities in phred+33 encoding with length motifLength+windowLength
	 */
	public static String buildQualityProfile(int motifLength, int windowLength) {
		StringBuilder answer = new StringBuilder(motifLength+windowLength);
		for(int i=0;i<motifLength;i++) {
			if(i<MOTIF_QUALITIES.length()) answer.append(MOTIF_QUALITIES.charAt(i));
			else answer.append(MOTIF_EXTRA_QUALITY);
		}
		for(int i=0;i<windowLength;i++) {
			if(i<WINDOW_QUALITIES.length()) answer.append(WINDOW_QUALITIES.charAt(i));
			else answer.append(WINDOW_DISTAL_QUALITY);
		}
		return answer.toString();
	}
}
