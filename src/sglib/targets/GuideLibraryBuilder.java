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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import sglib.alignments.AlignerException;
import sglib.alignments.BowtieAligner;
import sglib.alignments.ShortReadsAligner;
import sglib.genome.ReferenceGenome;
import sglib.genome.TargetRegion;
import sglib.genome.io.GFF3RegionsLoader;
import sglib.genome.io.GenbankGenomeLoader;
import sglib.genome.io.TargetRegionsFileHandler;
import sglib.main.CommandsDescriptor;
import sglib.main.OptionValuesDecoder;
import sglib.targets.io.TargetsReportWriter;

/**
 * Program that builds an annotated library of guide targets for a genome. Targets adjacent to a
 * motif are extracted from both strands, scored by specificity aligning them back to the genome
 * and labeled with the gene regions they overlap
 */
public class GuideLibraryBuilder {
	// Constants for default values
	public static final String DEF_MOTIF = TargetsExtractor.DEF_MOTIF;
	public static final int DEF_WINDOW_LENGTH = TargetsExtractor.DEF_WINDOW_LENGTH;
	public static final int [] DEF_TOLERANCES = SpecificityScorer.DEF_TOLERANCES;
	public static final int DEF_NUM_THREADS = BowtieAligner.DEF_NUM_THREADS;
	public static final String DEF_BOWTIE_PATH = BowtieAligner.DEF_BOWTIE_PATH;
	public static final String DEF_BOWTIE_BUILD_PATH = BowtieAligner.DEF_BOWTIE_BUILD_PATH;
	public static final String SUFFIX_MERGED_GENOME = ".merged";
	public static final String SUFFIX_OUTPUT = ".targets.all.tsv";
	public static final String SUFFIX_GENBANK_FASTA = ".fa";
	
	// Logging
	private Logger log = Logger.getLogger(GuideLibraryBuilder.class.getName());
	
	// Parameters
	private String outputFile = null;
	private String regionsFile = null;
	private String gff3File = null;
	private List<String> genbankFiles = new ArrayList<>();
	private String motif = DEF_MOTIF;
	private int windowLength = DEF_WINDOW_LENGTH;
	private int [] tolerances = DEF_TOLERANCES;
	private boolean onlyFullOverlap = false;
	private String samCopy = null;
	private String bowtiePath = DEF_BOWTIE_PATH;
	private String bowtieBuildPath = DEF_BOWTIE_BUILD_PATH;
	private int numThreads = DEF_NUM_THREADS;
	
	// Model attributes
	private ShortReadsAligner aligner = null;
	
	// Get and set methods
	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}
	
	public String getOutputFile() {
		return outputFile;
	}
	public void setOutputFile(String outputFile) {
		this.outputFile = outputFile;
	}
	
	public String getRegionsFile() {
		return regionsFile;
	}
	public void setRegionsFile(String regionsFile) {
		this.regionsFile = regionsFile;
	}
	
	public String getGff3File() {
		return gff3File;
	}
	public void setGff3File(String gff3File) {
		this.gff3File = gff3File;
	}
	
	public List<String> getGenbankFiles() {
		return genbankFiles;
	}
	/**
	 * Adds a genbank file to load the genome and the gene regions. Can be called more than once
	 * @param genbankFile New genbank file
	 */
	public void setGenbankFile(String genbankFile) {
		this.genbankFiles.add(genbankFile);
	}
	
	public String getMotif() {
		return motif;
	}
	public void setMotif(String motif) {
		new MotifPattern(motif);
		this.motif = motif;
	}
	
	public int getWindowLength() {
		return windowLength;
	}
	public void setWindowLength(int windowLength) {
		if(windowLength<=0) throw new IllegalArgumentException("Window length must be positive. Given: "+windowLength);
		this.windowLength = windowLength;
	}
	public void setWindowLength(String value) {
		setWindowLength((int)OptionValuesDecoder.decode(value, Integer.class));
	}
	
	public int[] getTolerances() {
		return tolerances.clone();
	}
	public void setTolerances(int[] tolerances) {
		this.tolerances = tolerances.clone();
	}
	public void setTolerances(String value) {
		setTolerances((int[])OptionValuesDecoder.decode(value, int[].class));
	}
	
	public boolean isOnlyFullOverlap() {
		return onlyFullOverlap;
	}
	public void setOnlyFullOverlap(boolean onlyFullOverlap) {
		this.onlyFullOverlap = onlyFullOverlap;
	}
	public void setOnlyFullOverlap(Boolean onlyFullOverlap) {
		setOnlyFullOverlap(onlyFullOverlap.booleanValue());
	}
	
	public String getSamCopy() {
		return samCopy;
	}
	public void setSamCopy(String samCopy) {
		this.samCopy = samCopy;
	}
	
	public String getBowtiePath() {
		return bowtiePath;
	}
	public void setBowtiePath(String bowtiePath) {
		this.bowtiePath = bowtiePath;
	}
	
	public String getBowtieBuildPath() {
		return bowtieBuildPath;
	}
	public void setBowtieBuildPath(String bowtieBuildPath) {
		this.bowtieBuildPath = bowtieBuildPath;
	}
	
	public int getNumThreads() {
		return numThreads;
	}
	public void setNumThreads(int numThreads) {
		if(numThreads<1) throw new IllegalArgumentException("Number of threads must be positive. Given: "+numThreads);
		this.numThreads = numThreads;
	}
	public void setNumThreads(String value) {
		setNumThreads((int)OptionValuesDecoder.decode(value, Integer.class));
	}
	
	public ShortReadsAligner getAligner() {
		return aligner;
	}
	/**
	 * Sets the aligner used to score targets. If not set, bowtie is called over the genome file
	 * @param aligner New aligner
	 */
	public void setAligner(ShortReadsAligner aligner) {
		this.aligner = aligner;
	}
	
	public static void main(String[] args) throws Exception {
		GuideLibraryBuilder instance = new GuideLibraryBuilder();
		int i = CommandsDescriptor.getInstance().loadOptions(instance, args);
		List<String> genomeFiles = new ArrayList<>(Arrays.asList(args).subList(i, args.length));
		try {
			instance.run(genomeFiles);
		} catch (AlignerException e) {
			instance.log.severe(e.getMessage());
			System.exit(e.getExitStatus());
		}
	}
	
	/**
	 * Builds the library for the genome in the given fasta files, or in the genbank files if any
	 * was set, and saves it in the output file
	 * @param genomeFiles Fasta files with the genome. Multiple files are merged in the given order
	 * @throws IOException If an input file can not be read, if an input is invalid or if the aligner fails
	 */
	public void run(List<String> genomeFiles) throws IOException {
		boolean genbank = !genbankFiles.isEmpty();
		if(genbank && !genomeFiles.isEmpty()) throw new IOException("Genome fasta files and genbank files are mutually exclusive");
		if(!genbank && genomeFiles.isEmpty()) throw new IOException("At least one genome fasta file or genbank file is required");
		if(!genbank && regionsFile==null && gff3File==null) throw new IOException("A regions file or a gff3 annotation file is required");
		if(regionsFile!=null && gff3File!=null) throw new IOException("Regions file and gff3 annotation file are mutually exclusive");
		logParameters(genomeFiles);
		ReferenceGenome genome;
		List<TargetRegion> regions;
		if(genbank) {
			GenbankGenomeLoader loader = new GenbankGenomeLoader();
			loader.setLog(log);
			loader.loadFiles(genbankFiles);
			String fastaFile = getBaseName(genbankFiles.get(0))+SUFFIX_MERGED_GENOME+SUFFIX_GENBANK_FASTA;
			log.info("Saving genbank sequences to "+fastaFile);
			genome = ReferenceGenome.save(loader.getSequences(), fastaFile);
			// Regions given explicitly replace the genbank features
			if(regionsFile!=null || gff3File!=null) regions = loadRegions();
			else regions = loader.getRegions();
		} else {
			genome = loadGenome(genomeFiles);
			regions = loadRegions();
		}
		List<AnnotatedTarget> library = buildLibrary(genome, regions);
		String outFile = outputFile;
		if(outFile==null) outFile = getBaseName(genome.getFilename())+SUFFIX_OUTPUT;
		log.info("Writing "+library.size()+" annotated targets to "+outFile);
		new TargetsReportWriter().write(library, outFile);
		log.info("Process finished");
	}
	/**
	 * Extracts, scores and annotates the targets of the given genome
	 * @param genome Genome to process. It must be associated with a fasta file if no aligner has been set
	 * @param regions Gene regions sorted by start within each sequence
	 * @return List<AnnotatedTarget> Annotated targets
	 * @throws IOException If the aligner fails
	 */
	public List<AnnotatedTarget> buildLibrary(ReferenceGenome genome, List<TargetRegion> regions) throws IOException {
		TargetsExtractor extractor = new TargetsExtractor(new MotifPattern(motif), windowLength);
		extractor.setLog(log);
		log.info("Extracting targets from genome "+genome.getFilename()+" with "+genome.getNumSequences()+" sequences and total length "+genome.getTotalLength());
		Map<String,GuideTarget> targets = extractor.extractTargets(genome.getSequencesList());
		
		SpecificityScorer scorer = new SpecificityScorer(getOrCreateAligner(genome));
		scorer.setLog(log);
		scorer.setTolerances(tolerances);
		scorer.score(targets);
		
		TargetsAnnotator annotator = new TargetsAnnotator();
		annotator.setLog(log);
		annotator.setAllowPartialOverlap(!onlyFullOverlap);
		return annotator.annotate(targets, regions, genome.getSequenceLengths());
	}
	
	private void logParameters(List<String> genomeFiles) {
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(os);
		if(!genomeFiles.isEmpty()) out.println("Genome files: "+genomeFiles);
		if(!genbankFiles.isEmpty()) out.println("Genbank files: "+genbankFiles);
		if(regionsFile!=null) out.println("Regions file: "+regionsFile);
		if(gff3File!=null) out.println("Gff3 annotation file: "+gff3File);
		if(outputFile!=null) out.println("Output file: "+outputFile);
		out.println("Motif: "+motif);
		out.println("Window length: "+windowLength);
		out.println("Specificity tolerances: "+Arrays.toString(tolerances));
		if(onlyFullOverlap) out.println("Label only targets fully contained in regions");
		else out.println("Label targets partially overlapping regions");
		if(samCopy!=null) out.println("Copy of aligner output: "+samCopy);
		out.flush();
		log.info(os.toString());
	}
	private ReferenceGenome loadGenome(List<String> genomeFiles) throws IOException {
		if(genomeFiles.size()==1) {
			log.info("Loading genome from "+genomeFiles.get(0));
			return new ReferenceGenome(genomeFiles.get(0));
		}
		String first = genomeFiles.get(0);
		String mergedFile = getBaseName(first)+SUFFIX_MERGED_GENOME+getExtension(first);
		log.info("Merging "+genomeFiles.size()+" genome files into "+mergedFile);
		return ReferenceGenome.merge(genomeFiles, mergedFile);
	}
	private List<TargetRegion> loadRegions() throws IOException {
		if(gff3File!=null) {
			GFF3RegionsLoader loader = new GFF3RegionsLoader();
			loader.setLog(log);
			return loader.loadRegions(gff3File);
		}
		TargetRegionsFileHandler handler = new TargetRegionsFileHandler();
		handler.setLog(log);
		return handler.loadRegions(regionsFile);
	}
	private ShortReadsAligner getOrCreateAligner(ReferenceGenome genome) throws IOException {
		if(aligner!=null) return aligner;
		if(genome.getFilename()==null) throw new IOException("The genome must be saved in a fasta file to be aligned with bowtie");
		BowtieAligner bowtie = new BowtieAligner(genome.getFilename());
		bowtie.setLog(log);
		bowtie.setBowtiePath(bowtiePath);
		bowtie.setBowtieBuildPath(bowtieBuildPath);
		bowtie.setNumThreads(numThreads);
		bowtie.setSamCopy(samCopy);
		return bowtie;
	}
	private static String getBaseName(String filename) {
		int idx = getExtensionStart(filename);
		if(idx<0) return filename;
		return filename.substring(0,idx);
	}
	private static String getExtension(String filename) {
		int idx = getExtensionStart(filename);
		if(idx<0) return "";
		return filename.substring(idx);
	}
	private static int getExtensionStart(String filename) {
		int idxDot = filename.lastIndexOf('.');
		int idxSeparator = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
		if(idxDot<=idxSeparator+1) return -1;
		return idxDot;
	}
}
