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
package sglib.targets.io;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

import sglib.targets.AnnotatedTarget;

/**
 * Writes annotated targets as a tab separated table with one header line
 */
public class TargetsReportWriter {
	public static final String [] COLUMNS = {"sequence","motif","chrom","start","end","reverse","specificity","gene","offset","sense_strand"};
	public static final String MISSING_VALUE = "NA";
	
	public static String getHeader() {
		return String.join("\t", COLUMNS);
	}
	
	public void write(List<AnnotatedTarget> targets, String filename) throws IOException {
		try (PrintStream out = new PrintStream(new FileOutputStream(filename))) {
			write(targets, out);
			if(out.checkError()) throw new IOException("Error writing annotated targets to "+filename);
		}
	}
	
	public void write(List<AnnotatedTarget> targets, PrintStream out) {
		out.println(getHeader());
		for(AnnotatedTarget target:targets) {
			out.println(format(target));
		}
		out.flush();
	}
	/**
	 * Formats one annotated target as a table row
	 * @param target to format
	 * @return String Row without line terminator. Missing annotations are written as NA
	 */
	public static String format(AnnotatedTarget target) {
		StringBuilder row = new StringBuilder();
		row.append(target.getSequence()).append('\t');
		row.append(target.getMotif()).append('\t');
		row.append(target.getSequenceName()).append('\t');
		row.append(target.getStart()).append('\t');
		row.append(target.getEnd()).append('\t');
		row.append(target.isReverse()).append('\t');
		row.append(target.getSpecificity()).append('\t');
		row.append(valueOrMissing(target.getGene())).append('\t');
		row.append(valueOrMissing(target.getOffset())).append('\t');
		row.append(valueOrMissing(target.getSenseStrand()));
		return row.toString();
	}
	private static String valueOrMissing(Object value) {
		if(value==null) return MISSING_VALUE;
		return value.toString();
	}
}
