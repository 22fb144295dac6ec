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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import sglib.sequences.DNASequence;
import sglib.sequences.QualifiedSequence;

/**
 * Finds every window of a fixed length adjacent to a motif on both strands of a genome.
 * Overlapping matches are reported because patterns are zero width lookaheads
 */
public class TargetsExtractor {
	public static final int DEF_WINDOW_LENGTH = 20;
	public static final String DEF_MOTIF = ".GG";
	
	private Logger log = Logger.getLogger(TargetsExtractor.class.getName());
	
	private final MotifPattern motif;
	private final int windowLength;
	private final Pattern forwardPattern;
	private final Pattern reversePattern;
	
	public TargetsExtractor(MotifPattern motif, int windowLength) {
		if(windowLength<=0) throw new IllegalArgumentException("Window length must be positive. Given: "+windowLength);
		this.motif = motif;
		this.windowLength = windowLength;
		String window = "(.{"+windowLength+"})";
		forwardPattern = Pattern.compile("(?=("+window+"("+motif.getForwardRegex()+")))");
		reversePattern = Pattern.compile("(?=(("+motif.getReverseComplementRegex()+")"+window+"))");
	}
	
	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}
	public MotifPattern getMotif() {
		return motif;
	}
	public int getWindowLength() {
		return windowLength;
	}
	
	/**
	 * Extracts the targets of all the given sequences
	 * @param sequences Genome sequences
	 * @return Map<String,GuideTarget> Targets indexed by identity key, grouped by sequence in insertion order
	 */
	public Map<String,GuideTarget> extractTargets(List<QualifiedSequence> sequences) {
		Map<String,GuideTarget> targets = new LinkedHashMap<>();
		for(QualifiedSequence seq:sequences) {
			extractTargets(seq.getName(), seq.getCharacters(), targets);
		}
		log.info("Extracted "+targets.size()+" raw targets with motif "+motif+" and window length "+windowLength);
		return targets;
	}
	/**
	 * Adds to the given map the targets found in one sequence. Targets already present with the same
	 * identity key are replaced
	 * @param sequenceName Name of the sequence
	 * @param bases Bases of the sequence
	 * @param targets Map to update
	 */
	public void extractTargets(String sequenceName, CharSequence bases, Map<String,GuideTarget> targets) {
		String genome = bases.toString().toUpperCase();
		int motifLength = motif.length();
		Matcher forward = forwardPattern.matcher(genome);
		while(forward.find()) {
			String hit = forward.group(1);
			if(hit.indexOf(DNASequence.UNKNOWN_BASE)>=0) continue;
			int start = forward.start();
			GuideTarget t = new GuideTarget(forward.group(2), hit.substring(hit.length()-motifLength), sequenceName, start, start+windowLength, false);
			targets.put(t.getIdentityKey(), t);
		}
		Matcher reverse = reversePattern.matcher(genome);
		while(reverse.find()) {
			String hit = reverse.group(1);
			if(hit.indexOf(DNASequence.UNKNOWN_BASE)>=0) continue;
			int start = reverse.start()+motifLength;
			String sequence = DNASequence.getReverseComplement(reverse.group(3));
			String matchedMotif = DNASequence.getReverseComplement(reverse.group(2));
			GuideTarget t = new GuideTarget(sequence, matchedMotif, sequenceName, start, start+windowLength, true);
			targets.put(t.getIdentityKey(), t);
		}
	}
}
