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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import sglib.genome.GenomicRegionPositionComparator;
import sglib.genome.TargetRegion;

/**
 * Annotates targets with the gene regions that overlap them. Targets of each chromosome are
 * sorted by position and swept with a window whose bounds persist across the regions of the
 * chromosome. Regions of each chromosome must be given in non decreasing order of start.
 * Every target is reported either once per overlapping region or once without annotation
 */
public class TargetsAnnotator {
	
	private Logger log = Logger.getLogger(TargetsAnnotator.class.getName());
	
	private boolean allowPartialOverlap = true;
	private int numSkippedRegions = 0;
	private int numRegionsWithoutTargets = 0;
	
	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}
	public boolean isAllowPartialOverlap() {
		return allowPartialOverlap;
	}
	/**
	 * @param allowPartialOverlap true if targets partially overlapping a region should be annotated,
	 * false if only targets contained in the region are annotated
	 */
	public void setAllowPartialOverlap(boolean allowPartialOverlap) {
		this.allowPartialOverlap = allowPartialOverlap;
	}
	/**
	 * @return int Regions of the last run skipped because their sequence is unknown or they start beyond its length
	 */
	public int getNumSkippedRegions() {
		return numSkippedRegions;
	}
	/**
	 * @return int Regions of the last run that did not overlap any target
	 */
	public int getNumRegionsWithoutTargets() {
		return numRegionsWithoutTargets;
	}
	
	/**
	 * Builds the annotated targets
	 * @param targets Scored targets indexed by identity key. They are not modified
	 * @param regions Gene regions. Regions of each sequence must be sorted by start
	 * @param sequenceLengths Lengths of the genome sequences indexed by name
	 * @return List<AnnotatedTarget> Annotated copies in order of regions followed by unannotated copies
	 * of the targets that do not overlap any region, in the iteration order of the targets map
	 * @throws IllegalArgumentException If the regions of a sequence are not sorted by start
	 */
	public List<AnnotatedTarget> annotate(Map<String,GuideTarget> targets, List<TargetRegion> regions, Map<String,Integer> sequenceLengths) {
		log.info("Labeling "+targets.size()+" targets with "+regions.size()+" regions");
		checkRegionsOrder(regions);
		numSkippedRegions = 0;
		numRegionsWithoutTargets = 0;
		Map<String,List<GuideTarget>> sortedTargets = sortTargetsBySequence(targets);
		Map<String,AnnotationSweepCursor> cursors = new HashMap<>();
		for(String sequenceName:sequenceLengths.keySet()) cursors.put(sequenceName, AnnotationSweepCursor.START);
		List<AnnotatedTarget> answer = new ArrayList<>();
		Set<String> found = new HashSet<>();
		for(int i=0;i<regions.size();i++) {
			TargetRegion region = regions.get(i);
			if(i%100==0) log.info("Examining gene "+i+" ["+region.getGene()+"]");
			String sequenceName = region.getSequenceName();
			Integer sequenceLength = sequenceLengths.get(sequenceName);
			if(sequenceLength==null) {
				log.warning("Unknown sequence "+sequenceName+" for region of gene "+region.getGene()+". Region skipped");
				numSkippedRegions++;
				continue;
			}
			if(region.getStart()>=sequenceLength) {
				log.warning("Region of gene "+region.getGene()+" starts at "+region.getStart()+" beyond the length "+sequenceLength+" of sequence "+sequenceName+". Region skipped");
				numSkippedRegions++;
				continue;
			}
			List<GuideTarget> sequenceTargets = sortedTargets.get(sequenceName);
			if(sequenceTargets==null) sequenceTargets = Collections.emptyList();
			AnnotationSweepCursor cursor = advanceCursor(cursors.get(sequenceName), sequenceTargets, region, allowPartialOverlap);
			cursors.put(sequenceName, cursor);
			if(cursor.getWindowSize()==0) {
				log.warning("No overlapping targets for gene "+region.getGene());
				numRegionsWithoutTargets++;
				continue;
			}
			for(int j=cursor.getFront();j<cursor.getBack();j++) {
				GuideTarget target = sequenceTargets.get(j);
				found.add(target.getIdentityKey());
				answer.add(annotate(target, region));
			}
		}
		int unannotated = 0;
		for(Map.Entry<String,GuideTarget> entry:targets.entrySet()) {
			if(found.contains(entry.getKey())) continue;
			answer.add(new AnnotatedTarget(entry.getValue()));
			unannotated++;
		}
		if(numSkippedRegions>0) log.warning("Skipped "+numSkippedRegions+" regions outside the known sequences");
		log.info("Produced "+answer.size()+" records. Targets without annotation: "+unannotated+". Regions without targets: "+numRegionsWithoutTargets);
		return answer;
	}
	/**
	 * Moves the window of a chromosome to the targets overlapping the given region. The back bound
	 * moves first over targets that begin before the region ends, then the front bound moves over
	 * targets that end before the region begins. With full overlap the bounds use the target end
	 * and the target start respectively
	 * @param cursor Current window of the chromosome
	 * @param sortedTargets Targets of the chromosome sorted by start and end
	 * @param region Region to process
	 * @param allowPartialOverlap Overlap policy
	 * @return AnnotationSweepCursor New window. The bounds are never lower than the given bounds
	 */
	public static AnnotationSweepCursor advanceCursor(AnnotationSweepCursor cursor, List<GuideTarget> sortedTargets, TargetRegion region, boolean allowPartialOverlap) {
		int front = cursor.getFront();
		int back = cursor.getBack();
		int n = sortedTargets.size();
		int regionStart = region.getStart();
		int regionEnd = region.getEnd();
		if(allowPartialOverlap) {
			while (back < n && sortedTargets.get(back).getStart() + 1 < regionEnd) back++;
			while (front < n && sortedTargets.get(front).getEnd() + 1 <= regionStart) front++;
		} else {
			while (back < n && sortedTargets.get(back).getEnd() + 1 <= regionEnd) back++;
			while (front < n && sortedTargets.get(front).getStart() + 1 < regionStart) front++;
		}
		return new AnnotationSweepCursor(front, back);
	}
	/**
	 * Creates the annotated copy of a target for a region
	 * @param target Target overlapping the region
	 * @param region Gene region
	 * @return AnnotatedTarget copy with gene name, offset from the transcription start and sense flag
	 */
	public static AnnotatedTarget annotate(GuideTarget target, TargetRegion region) {
		boolean reverseStrandGene = region.isNegativeStrand();
		int offset;
		if(reverseStrandGene) offset = region.getEnd() - target.getEnd();
		else offset = target.getStart() - region.getStart();
		boolean senseStrand = reverseStrandGene == target.isReverse();
		return new AnnotatedTarget(target, region.getGene(), offset, senseStrand);
	}
	
	private static Map<String,List<GuideTarget>> sortTargetsBySequence(Map<String,GuideTarget> targets) {
		Map<String,List<GuideTarget>> answer = new HashMap<>();
		for(GuideTarget target:targets.values()) {
			List<GuideTarget> sequenceTargets = answer.get(target.getSequenceName());
			if(sequenceTargets==null) {
				sequenceTargets = new ArrayList<>();
				answer.put(target.getSequenceName(), sequenceTargets);
			}
			sequenceTargets.add(target);
		}
		for(List<GuideTarget> sequenceTargets:answer.values()) {
			Collections.sort(sequenceTargets, GenomicRegionPositionComparator.getInstance());
		}
		return answer;
	}
	private static void checkRegionsOrder(List<TargetRegion> regions) {
		Map<String,TargetRegion> lastRegions = new HashMap<>();
		for(TargetRegion region:regions) {
			TargetRegion last = lastRegions.get(region.getSequenceName());
			if(last!=null && region.getStart()<last.getStart()) {
				throw new IllegalArgumentException("Regions of sequence "+region.getSequenceName()+" are not sorted by start. Region of gene "+region.getGene()+" starts at "+region.getStart()+" after region of gene "+last.getGene()+" starting at "+last.getStart());
			}
			lastRegions.put(region.getSequenceName(), region);
		}
	}
}
