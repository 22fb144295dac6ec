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
package sglib.sequences;

import java.io.PrintStream;

/**
 * Represents a raw sequencing read including an id, the sequence and quality scores
 */
public class RawRead extends QualifiedSequence {
	public RawRead(String id, CharSequence sequence, String qualityScores) {
		super(id,sequence,qualityScores);
		if(qualityScores!=null && qualityScores.length()!=sequence.length()) throw new IllegalArgumentException("Quality scores of read "+id+" have length "+qualityScores.length()+" but sequence has length "+sequence.length());
	}
	public String getSequenceString() {
		return getCharacters().toString();
	}
	/**
	 * Writes this read in fastq format
	 * @param out Stream to write the read
	 */
	public void save (PrintStream out) {
		out.println("@"+this.getName());
		out.println(this.getCharacters());
		out.println("+");
		out.println(this.getQualityScores());
	}
}
