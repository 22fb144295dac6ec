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

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.zip.GZIPInputStream;

import org.biojava.nbio.core.sequence.DNASequence;
import org.biojava.nbio.core.sequence.Strand;
import org.biojava.nbio.core.sequence.compound.NucleotideCompound;
import org.biojava.nbio.core.sequence.features.FeatureInterface;
import org.biojava.nbio.core.sequence.features.Qualifier;
import org.biojava.nbio.core.sequence.io.GenbankReaderHelper;
import org.biojava.nbio.core.sequence.location.template.AbstractLocation;
import org.biojava.nbio.core.sequence.template.AbstractSequence;

import sglib.genome.TargetRegion;
import sglib.sequences.QualifiedSequence;
import sglib.sequences.QualifiedSequenceList;

/**
 * Loads genome sequences and gene regions from genbank records. Records of consecutive loads
 * are accumulated in order, so several files can be merged into one genome. For each record,
 * features of type gene are used as regions. Records without gene features contribute their
 * CDS features instead
 */
public class GenbankGenomeLoader {
	public static final String FEATURE_TYPE_GENE = "gene";
	public static final String FEATURE_TYPE_CDS = "CDS";
	public static final String QUALIFIER_LOCUS_TAG = "locus_tag";
	public static final String QUALIFIER_GENE = "gene";
	
	private Logger log = Logger.getLogger(GenbankGenomeLoader.class.getName());
	
	private QualifiedSequenceList sequences = new QualifiedSequenceList();
	private List<TargetRegion> regions = new ArrayList<>();
	
	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}
	/**
	 * @return QualifiedSequenceList Sequences of all the records loaded so far, in load order
	 */
	public QualifiedSequenceList getSequences() {
		return sequences;
	}
	/**
	 * @return List<TargetRegion> Regions of all the records loaded so far, grouped by sequence and sorted by start
	 */
	public List<TargetRegion> getRegions() {
		return TargetRegion.sortPerSequence(regions);
	}
	
	public void loadFiles(List<String> filenames) throws IOException {
		for(String filename:filenames) loadFile(filename);
		log.info("Loaded "+sequences.size()+" genbank records with "+regions.size()+" target regions from "+filenames.size()+" files");
	}
	
	public void loadFile(String filename) throws IOException {
		log.info("Loading genbank records from "+filename);
		try (InputStream fis = new FileInputStream(filename)) {
			InputStream is = fis;
			if(filename.toLowerCase().endsWith(".gz")) is = new GZIPInputStream(fis);
			load(is, filename);
		}
	}
	/**
	 * Loads the records available in the given stream
	 * @param is Stream in genbank format
	 * @param sourceName Name of the source for error messages
	 * @throws IOException If the stream can not be parsed, if a sequence name was already loaded
	 * or if a selected feature does not have a locus_tag or gene name
	 */
	public void load(InputStream is, String sourceName) throws IOException {
		Map<String,DNASequence> records;
		try {
			records = GenbankReaderHelper.readGenbankDNASequence(is);
		} catch (IOException e) {
			throw e;
		} catch (Exception e) {
			throw new IOException("Can not parse genbank records from "+sourceName+". "+e.getMessage(),e);
		}
		if(records.isEmpty()) throw new IOException("No genbank records found in "+sourceName);
		for(Map.Entry<String,DNASequence> entry:records.entrySet()) {
			String name = entry.getKey();
			DNASequence record = entry.getValue();
			if(sequences.contains(name)) throw new IOException("Sequence "+name+" in "+sourceName+" is already present in a previous genbank file");
			sequences.add(new QualifiedSequence(name, record.getSequenceAsString().toUpperCase()));
			int n = loadRegions(name, record);
			log.info("Found "+n+" target regions in record "+name);
		}
	}
	
	private int loadRegions(String sequenceName, DNASequence record) throws IOException {
		String type = FEATURE_TYPE_GENE;
		List<FeatureInterface<AbstractSequence<NucleotideCompound>, NucleotideCompound>> features = record.getFeaturesByType(type);
		if(features==null || features.isEmpty()) {
			type = FEATURE_TYPE_CDS;
			features = record.getFeaturesByType(type);
		}
		if(features==null) return 0;
		int n = 0;
		for(FeatureInterface<AbstractSequence<NucleotideCompound>, NucleotideCompound> feature:features) {
			String name = getFeatureName(feature);
			if(name==null) throw new IOException("No "+QUALIFIER_LOCUS_TAG+" or "+QUALIFIER_GENE+" for feature of type "+type+" at "+feature.getSource()+" in record "+sequenceName+". Features without names can not be used to annotate targets");
			AbstractLocation location = feature.getLocations();
			int start = location.getStart().getPosition()-1;
			int end = location.getEnd().getPosition();
			List<TargetRegion> featureRegions = TargetRegion.createRegions(name, sequenceName, start, end, getStrand(location.getStrand()));
			regions.addAll(featureRegions);
			n+=featureRegions.size();
		}
		return n;
	}
	private static String getFeatureName(FeatureInterface<AbstractSequence<NucleotideCompound>, NucleotideCompound> feature) {
		Map<String,List<Qualifier>> qualifiers = feature.getQualifiers();
		if(qualifiers==null) return null;
		String name = getFirstValue(qualifiers, QUALIFIER_LOCUS_TAG);
		if(name==null) name = getFirstValue(qualifiers, QUALIFIER_GENE);
		return name;
	}
	private static String getFirstValue(Map<String,List<Qualifier>> qualifiers, String key) {
		List<Qualifier> values = qualifiers.get(key);
		if(values==null || values.isEmpty()) return null;
		String value = values.get(0).getValue();
		if(value==null) return null;
		value = value.trim();
		if(value.length()>1 && value.startsWith("\"") && value.endsWith("\"")) value = value.substring(1, value.length()-1);
		if(value.length()==0) return null;
		return value;
	}
	private static char getStrand(Strand strand) {
		if(strand==Strand.POSITIVE) return TargetRegion.STRAND_POSITIVE;
		if(strand==Strand.NEGATIVE) return TargetRegion.STRAND_NEGATIVE;
		return '.';
	}
}
