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
package sglib.sequences.io;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.List;
import java.util.zip.GZIPInputStream;

import sglib.sequences.QualifiedSequence;
import sglib.sequences.QualifiedSequenceList;

/**
 * Handler for sequences in fasta format. Implements methods to load and write entire
 * sequence sets. Loaded sequences are converted to upper case
 */
public class FastaSequencesHandler {
	
	/**
	 * Loads the sequences present in the given filename
	 * @param filename Name of the fasta file where sequences must be loaded. It can be gzip compressed
	 * @return QualifiedSequenceList Sequences in the file in the same order
	 * @throws IOException If the file can not be read or if it has duplicated sequence names
	 */
	public QualifiedSequenceList loadSequences(String filename) throws IOException {
		try (InputStream fis = new FileInputStream(filename)) {
			InputStream is = fis;
			if(filename.toLowerCase().endsWith(".gz")) is = new GZIPInputStream(fis);
			return loadSequences(is);
		}
	}
	/**
	 * Loads the sequences in fasta format present in the given stream
	 * @param is Stream to read
	 * @return QualifiedSequenceList Sequences in the stream in the same order
	 * @throws IOException If the stream can not be read or if it has duplicated sequence names
	 */
	public QualifiedSequenceList loadSequences(InputStream is) throws IOException {
		QualifiedSequenceList answer = new QualifiedSequenceList();
		BufferedReader in = new BufferedReader(new InputStreamReader(is));
		String id = null;
		String comment = null;
		StringBuilder buffer = new StringBuilder();
		String line=in.readLine();
		while(line!=null) {
			if(line.startsWith(">")) {
				addSequence(answer, id, comment, buffer);
				String idLine = line.substring(1).trim();
				String [] items = idLine.split(" |\t");
				id = items[0];
				if(id.length()+1<idLine.length()) comment = idLine.substring(id.length()+1);
				else comment = null;
			} else if (!line.startsWith("#")) {
				appendBases(buffer, line);
			}
			line=in.readLine();
		}
		addSequence(answer, id, comment, buffer);
		return answer;
	}
	private void appendBases(StringBuilder buffer, String line) {
		for(int i=0;i<line.length();i++) {
			char c = line.charAt(i);
			if(!Character.isWhitespace(c) && !Character.isISOControl(c)) buffer.append(Character.toUpperCase(c));
		}
	}
	private void addSequence(QualifiedSequenceList sequences, String name, String comments, StringBuilder buffer) throws IOException {
		if(name!=null && buffer.length()>0) {
			QualifiedSequence seq = new QualifiedSequence(name,buffer.toString());
			if(comments !=null) seq.setComments(comments);
			try {
				sequences.add(seq);
			} catch (IllegalArgumentException e) {
				throw new IOException(e.getMessage(),e);
			}
		}
		buffer.delete(0, buffer.length());
	}

	/**
	 * Dump all sequences in the given print stream
	 * @param sequences to save
	 * @param out Stream to print the sequences
	 * @param lineLength Number of bases per line
	 */
	public void saveSequences(List<QualifiedSequence> sequences, PrintStream out,int lineLength) {
		for(QualifiedSequence seq: sequences) {
			out.print(">");
			out.print(seq.getName());
			if(seq.getComments()!=null) {
				out.print(" ");
				out.print(seq.getComments());
			}
			out.println();
			CharSequence characters = seq.getCharacters();
			int l = characters.length();
			for(int j=0;j<l;j+=lineLength) {
				out.println(characters.subSequence(j, Math.min(l, j+lineLength)));
			}
		}
		out.flush();
	}
}
