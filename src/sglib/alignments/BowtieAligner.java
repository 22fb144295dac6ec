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
package sglib.alignments;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import htsjdk.samtools.SAMRecord;
import htsjdk.samtools.SamReader;
import htsjdk.samtools.SamReaderFactory;
import htsjdk.samtools.ValidationStringency;
import sglib.sequences.RawRead;

/**
 * Runs bowtie (version 1) as an external process. The genome fasta file is also used as the
 * base name of the index. Reads are exchanged through temporary fastq and SAM files that
 * are deleted after each round
 */
public class BowtieAligner implements ShortReadsAligner {
	public static final String DEF_BOWTIE_PATH = "bowtie";
	public static final String DEF_BOWTIE_BUILD_PATH = "bowtie-build";
	public static final String INDEX_FIRST_FILE_SUFFIX = ".1.ebwt";
	public static final int DEF_NUM_THREADS = 6;
	public static final int DEF_SEED_MISMATCHES = 3;
	public static final int DEF_SEED_LENGTH = 15;
	public static final int DEF_CHUNK_MBS = 256;
	public static final int MAX_ALIGNMENTS = 1;
	public static final String TEMP_READS_PREFIX = "sglib_reads";
	public static final String TEMP_ALIGNMENTS_PREFIX = "sglib_alignments";
	
	private Logger log = Logger.getLogger(BowtieAligner.class.getName());
	
	private final String genomeFile;
	private String bowtiePath = DEF_BOWTIE_PATH;
	private String bowtieBuildPath = DEF_BOWTIE_BUILD_PATH;
	private int numThreads = DEF_NUM_THREADS;
	private int seedMismatches = DEF_SEED_MISMATCHES;
	private int seedLength = DEF_SEED_LENGTH;
	private int chunkMbs = DEF_CHUNK_MBS;
	private String samCopy = null;
	
	public BowtieAligner(String genomeFile) {
		this.genomeFile = genomeFile;
	}
	
	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}
	public String getGenomeFile() {
		return genomeFile;
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
	public int getSeedMismatches() {
		return seedMismatches;
	}
	public void setSeedMismatches(int seedMismatches) {
		this.seedMismatches = seedMismatches;
	}
	public int getSeedLength() {
		return seedLength;
	}
	public void setSeedLength(int seedLength) {
		this.seedLength = seedLength;
	}
	public int getChunkMbs() {
		return chunkMbs;
	}
	public void setChunkMbs(int chunkMbs) {
		this.chunkMbs = chunkMbs;
	}
	/**
	 * @return String Path where the SAM file of each round is copied. null if no copy is made
	 */
	public String getSamCopy() {
		return samCopy;
	}
	public void setSamCopy(String samCopy) {
		this.samCopy = samCopy;
	}

	@Override
	public void prepareIndex() throws IOException {
		File firstIndexFile = new File(genomeFile+INDEX_FIRST_FILE_SUFFIX);
		if(firstIndexFile.exists()) {
			log.info("Found bowtie index for genome "+genomeFile);
			return;
		}
		log.info("Building bowtie index for genome "+genomeFile);
		List<String> command = new ArrayList<>();
		command.add(bowtieBuildPath);
		command.add(genomeFile);
		command.add(genomeFile);
		int status = runCommand(command);
		if(status!=0) throw new AlignerException("Failed to build bowtie index for "+genomeFile, status);
	}

	@Override
	public Set<String> findUniquelyAlignedReads(List<RawRead> reads, int maxDissimilarity) throws IOException {
		File readsFile = File.createTempFile(TEMP_READS_PREFIX, ".fastq");
		File alignmentsFile = null;
		try {
			alignmentsFile = File.createTempFile(TEMP_ALIGNMENTS_PREFIX, ".sam");
			saveReads(reads, readsFile);
			List<String> command = buildAlignmentCommand(maxDissimilarity, readsFile.getAbsolutePath(), alignmentsFile.getAbsolutePath());
			int status = runCommand(command);
			if(status!=0) throw new AlignerException("Bowtie failed aligning reads with maximum dissimilarity "+maxDissimilarity, status);
			if(samCopy!=null) Files.copy(alignmentsFile.toPath(), new File(samCopy).toPath(), StandardCopyOption.REPLACE_EXISTING);
			return loadAlignedReadNames(alignmentsFile);
		} finally {
			Files.deleteIfExists(readsFile.toPath());
			if(alignmentsFile!=null) Files.deleteIfExists(alignmentsFile.toPath());
		}
	}
	/**
	 * Builds the bowtie command reporting reads with one alignment below the given dissimilarity.
	 * All alignments are searched with best effort so reads with more than one alignment are
	 * discarded
	 * @param maxDissimilarity Maximum sum of quality values at mismatched positions
	 * @param readsFile Fastq file with the reads
	 * @param outputFile SAM file to write
	 * @return List<String> Command and arguments
	 */
	public List<String> buildAlignmentCommand(int maxDissimilarity, String readsFile, String outputFile) {
		List<String> command = new ArrayList<>();
		command.add(bowtiePath);
		command.add("-S");
		command.add("--nomaqround");
		command.add("-q");
		command.add("-a");
		command.add("--best");
		command.add("--tryhard");
		command.add("--chunkmbs");
		command.add(String.valueOf(chunkMbs));
		command.add("-p");
		command.add(String.valueOf(numThreads));
		command.add("-n");
		command.add(String.valueOf(seedMismatches));
		command.add("-l");
		command.add(String.valueOf(seedLength));
		command.add("-e");
		command.add(String.valueOf(maxDissimilarity));
		command.add("-m");
		command.add(String.valueOf(MAX_ALIGNMENTS));
		command.add(genomeFile);
		command.add(readsFile);
		command.add(outputFile);
		return command;
	}
	/**
	 * Writes the given reads in fastq format
	 * @param reads to write
	 * @param file Destination file
	 * @throws IOException If the file can not be written
	 */
	public static void saveReads(List<RawRead> reads, File file) throws IOException {
		try (PrintStream out = new PrintStream(new FileOutputStream(file))) {
			for(RawRead read:reads) read.save(out);
			if(out.checkError()) throw new IOException("Error writing reads to "+file.getAbsolutePath());
		}
	}
	/**
	 * Loads the names of the aligned reads in a SAM file. Unmapped records are ignored
	 * @param samFile File with the alignments
	 * @return Set<String> Names of the reads with a mapped record
	 * @throws IOException If the file can not be read
	 */
	public static Set<String> loadAlignedReadNames(File samFile) throws IOException {
		Set<String> answer = new LinkedHashSet<>();
		SamReaderFactory factory = SamReaderFactory.makeDefault().validationStringency(ValidationStringency.SILENT);
		try (SamReader reader = factory.open(samFile)) {
			for(SAMRecord record:reader) {
				if(record.getReadUnmappedFlag()) continue;
				answer.add(record.getReadName());
			}
		}
		return answer;
	}
	
	private int runCommand(List<String> command) throws IOException {
		log.info(String.join(" ", command));
		ProcessBuilder pb = new ProcessBuilder(command);
		pb.redirectErrorStream(true);
		Process process = pb.start();
		try (BufferedReader in = new BufferedReader(new InputStreamReader(process.getInputStream()))) {
			String line = in.readLine();
			while(line!=null) {
				if(line.trim().length()>0) log.info(line);
				line = in.readLine();
			}
		}
		try {
			return process.waitFor();
		} catch (InterruptedException e) {
			process.destroy();
			Thread.currentThread().interrupt();
			throw new IOException("Interrupted while waiting for command "+command.get(0),e);
		}
	}
}
