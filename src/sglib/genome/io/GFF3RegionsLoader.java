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
package sglib.genome.io;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.zip.GZIPInputStream;

import sglib.genome.TargetRegion;

/**
 * Loads target regions from the gene features of a gff3 file. For each sequence, features of type
 * gene are used. Sequences without gene features contribute their CDS features instead
 */
public class GFF3RegionsLoader {
	public static final String FEATURE_TYPE_GENE = "gene";
	public static final String FEATURE_TYPE_CDS = "CDS";
	public static final String ATTRIBUTE_LOCUS_TAG = "locus_tag";
	public static final String ATTRIBUTE_GENE = "gene";
	public static final String ATTRIBUTE_NAME = "Name";
	public static final String ATTRIBUTE_ID = "ID";
	/**
	 * Attributes searched in order to name a region
	 */
	public static final String [] NAME_ATTRIBUTES = {ATTRIBUTE_LOCUS_TAG, ATTRIBUTE_GENE, ATTRIBUTE_NAME, ATTRIBUTE_ID};
	
	private Logger log = Logger.getLogger(GFF3RegionsLoader.class.getName());
	private int numSkippedLines = 0;
	
	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}
	/**
	 * @return int Number of feature lines skipped in the last load because coordinates could not be parsed
	 */
	public int getNumSkippedLines() {
		return numSkippedLines;
	}
	
	public List<TargetRegion> loadRegions (String filename) throws IOException {
		log.info("Loading gene regions from gff3 file "+filename);
		try (InputStream fis = new FileInputStream(filename)) {
			InputStream is = fis;
			if(filename.toLowerCase().endsWith(".gz")) is = new GZIPInputStream(fis);
			return loadRegions(is);
		}
	}
	/**
	 * Loads the gene regions described in the given gff3 stream
	 * @param is Stream in gff3 format
	 * @return List<TargetRegion> Regions grouped by sequence and sorted by start within each sequence
	 * @throws IOException If the stream can not be read, if a feature line does not have the nine
	 * gff3 fields or if a selected feature does not have a usable name
	 */
	public List<TargetRegion> loadRegions(InputStream is) throws IOException {
		numSkippedLines = 0;
		Map<String,List<FeatureLine>> genesBySequence = new LinkedHashMap<>();
		Map<String,List<FeatureLine>> cdsBySequence = new HashMap<>();
		BufferedReader in = new BufferedReader(new InputStreamReader(is));
		String line=in.readLine();
		for(int i=1;line!=null;i++) {
			if("##FASTA".equals(line.trim())) break;
			if(line.length()>0 && line.charAt(0)!='#') {
				FeatureLine feature = loadFeatureLine(line, i);
				if(feature!=null) {
					if(!genesBySequence.containsKey(feature.sequenceName)) {
						genesBySequence.put(feature.sequenceName, new ArrayList<>());
						cdsBySequence.put(feature.sequenceName, new ArrayList<>());
					}
					if(FEATURE_TYPE_GENE.equals(feature.type)) genesBySequence.get(feature.sequenceName).add(feature);
					else if (FEATURE_TYPE_CDS.equals(feature.type)) cdsBySequence.get(feature.sequenceName).add(feature);
				}
			}
			line=in.readLine();
		}
		List<TargetRegion> regions = new ArrayList<>();
		for(Map.Entry<String,List<FeatureLine>> entry:genesBySequence.entrySet()) {
			List<FeatureLine> features = entry.getValue();
			if(features.isEmpty()) features = cdsBySequence.get(entry.getKey());
			for(FeatureLine feature:collapseSegments(features)) {
				regions.addAll(TargetRegion.createRegions(feature.getRegionName(), feature.sequenceName, feature.first-1, feature.last, feature.strand));
			}
		}
		if(numSkippedLines>0) log.warning("Skipped "+numSkippedLines+" feature lines with invalid coordinates");
		log.info("Found "+regions.size()+" target regions in gff3 file");
		return TargetRegion.sortPerSequence(regions);
	}
	
	/**
	 * Joins the lines of features spanning several segments, such as split CDS features.
	 * Lines are grouped by ID, or by region name if they have no ID, and each group
	 * spans from the first position of its first segment to the last position of its last segment
	 * @param features Lines of one sequence and feature type
	 * @return List<FeatureLine> One line per feature in order of first appearance
	 * @throws IOException If a line does not have a usable name
	 */
	private List<FeatureLine> collapseSegments(List<FeatureLine> features) throws IOException {
		Map<String,FeatureLine> byId = new LinkedHashMap<>();
		for(FeatureLine feature:features) {
			String name = feature.getRegionName();
			if(name==null) throw new IOException("No "+ATTRIBUTE_LOCUS_TAG+" or "+ATTRIBUTE_GENE+" name for feature of type "+feature.type+" at line "+feature.lineNumber+". Features without names can not be used to annotate targets");
			String id = feature.annotations.get(ATTRIBUTE_ID);
			if(id==null) id = name;
			FeatureLine joined = byId.get(id);
			if(joined==null) {
				byId.put(id, feature);
				continue;
			}
			if(joined.strand!=feature.strand) log.warning("Segment at line "+feature.lineNumber+" of feature "+id+" has strand "+feature.strand+" but previous segments have strand "+joined.strand);
			joined.first = Math.min(joined.first, feature.first);
			joined.last = Math.max(joined.last, feature.last);
		}
		return new ArrayList<>(byId.values());
	}
	
	private FeatureLine loadFeatureLine (String line, int lineNumber) throws IOException {
		String [] items = line.split("\t");
		if(items.length<9) throw new IOException("Gff3 line "+lineNumber+" has "+items.length+" fields. Nine tab separated fields are required. Line: "+line);
		FeatureLine answer = new FeatureLine();
		answer.sequenceName = items[0];
		answer.type = items[2];
		answer.lineNumber = lineNumber;
		try {
			answer.first = Integer.parseInt(items[3]);
			answer.last = Integer.parseInt(items[4]);
		} catch (NumberFormatException e) {
			log.warning("Error loading feature at line "+lineNumber+": "+line+". Coordinates must be positive integers");
			numSkippedLines++;
			return null;
		}
		if(answer.first<1 || answer.last<answer.first) {
			log.warning("Error loading feature at line "+lineNumber+": "+line+". Invalid coordinates "+answer.first+"-"+answer.last);
			numSkippedLines++;
			return null;
		}
		answer.strand = items[6].length()>0?items[6].charAt(0):'.';
		String [] annItems = items[8].split(";");
		for(int i=0;i<annItems.length;i++) {
			String annItem = annItems[i].trim();
			if(annItem.length()==0) continue;
			int idx = annItem.indexOf("=");
			if(idx <=0 || idx == annItem.length()-1) log.warning("Annotation "+annItem+" at line "+lineNumber+" is not a key-value pair");
			else answer.annotations.put(annItem.substring(0,idx),annItem.substring(idx+1));
		}
		return answer;
	}
	
	private static class FeatureLine {
		private String sequenceName;
		private String type;
		private int first;
		private int last;
		private char strand;
		private int lineNumber;
		private Map<String,String> annotations = new HashMap<>();
		
		private String getRegionName() {
			for(String attribute:NAME_ATTRIBUTES) {
				String value = annotations.get(attribute);
				if(value!=null) return value;
			}
			return null;
		}
	}
}
