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

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import sglib.sequences.QualifiedSequence;
import sglib.sequences.QualifiedSequenceList;
import sglib.sequences.io.FastaSequencesHandler;

/**
 * Genome made of named, upper case sequences loaded from one or more fasta files
 */
public class ReferenceGenome {
	public static final int FASTA_LINE_LENGTH = 60;
	private QualifiedSequenceList sequences;
	private String filename;
	
	/**
	 * Creates a new ReferenceGenome loading the given fasta file
	 * @param filename Name of the fasta file with the reference genome
	 * @throws IOException If the file can not be read
	 */
	public ReferenceGenome (String filename) throws IOException {
		this.filename = filename;
		FastaSequencesHandler handler = new FastaSequencesHandler();
		sequences = handler.loadSequences(filename);
		if(sequences.size()==0) throw new IOException("No sequences found in genome file "+filename);
	}
	/**
	 * Creates a genome with the given sequences. The genome is not associated with a file
	 * @param sequences of the new genome
	 */
	public ReferenceGenome(QualifiedSequenceList sequences) {
		this.sequences = sequences;
	}
	/**
	 * Merges the sequences of the given fasta files into a single genome saved in the given file
	 * @param files Fasta files to merge. Order is kept
	 * @param mergedFile File where the merged genome will be saved
	 * @return ReferenceGenome merged genome associated with mergedFile
	 * @throws IOException If a file can not be read or if a sequence name is repeated across files
	 */
	public static ReferenceGenome merge(List<String> files, String mergedFile) throws IOException {
		FastaSequencesHandler handler = new FastaSequencesHandler();
		QualifiedSequenceList merged = new QualifiedSequenceList();
		for(String file:files) {
			QualifiedSequenceList seqs = handler.loadSequences(file);
			for(QualifiedSequence seq:seqs) {
				if(merged.contains(seq.getName())) throw new IOException("Sequence "+seq.getName()+" in file "+file+" is already present in a previous genome file");
				merged.add(seq);
			}
		}
		if(merged.size()==0) throw new IOException("No sequences found in genome files "+files);
		return save(merged, mergedFile);
	}
	/**
	 * Saves the given sequences in fasta format and creates a genome associated with the saved file
	 * @param sequences Sequences of the genome
	 * @param filename Fasta file to write
	 * @return ReferenceGenome genome associated with filename
	 * @throws IOException If the file can not be written
	 */
	public static ReferenceGenome save(QualifiedSequenceList sequences, String filename) throws IOException {
		try (PrintStream out = new PrintStream(new FileOutputStream(filename))) {
			new FastaSequencesHandler().saveSequences(sequences, out, FASTA_LINE_LENGTH);
			if(out.checkError()) throw new IOException("Error writing genome to "+filename);
		}
		ReferenceGenome answer = new ReferenceGenome(sequences);
		answer.filename = filename;
		return answer;
	}
	/**
	 * @return String the path of the file from which this genome was loaded or saved
	 */
	public String getFilename() {
		return filename;
	}
	public QualifiedSequenceList getSequencesList() {
		return sequences;
	}
	public int getNumSequences() {
		return sequences.size();
	}
	public long getTotalLength() {
		long answer = 0;
		for(QualifiedSequence seq:sequences) answer+=seq.getLength();
		return answer;
	}
	public CharSequence getSequenceCharacters (String sequenceName) {
		QualifiedSequence qs = sequences.get(sequenceName);
		if(qs==null) return null;
		return qs.getCharacters();
	}
	/**
	 * @return Map<String,Integer> Lengths of the sequences indexed by name in genome order
	 */
	public Map<String,Integer> getSequenceLengths() {
		Map<String,Integer> answer = new LinkedHashMap<>();
		for(QualifiedSequence seq:sequences) answer.put(seq.getName(), seq.getLength());
		return answer;
	}
}
