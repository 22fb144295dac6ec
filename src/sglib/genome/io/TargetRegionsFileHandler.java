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
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import sglib.genome.TargetRegion;

/**
 * Loads target regions from a tab separated file with five columns: gene name, sequence name,
 * start (0-based), end (0-based, exclusive) and strand. Lines starting with # are ignored
 */
public class TargetRegionsFileHandler {
	
	private Logger log = Logger.getLogger(TargetRegionsFileHandler.class.getName());
	private int numSkippedLines = 0;
	
	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}
	/**
	 * @return int Number of lines skipped in the last load because their coordinates could not be parsed
	 */
	public int getNumSkippedLines() {
		return numSkippedLines;
	}
	
	public List<TargetRegion> loadRegions (String filename) throws IOException {
		log.info("Loading target regions from "+filename);
		try (FileReader reader = new FileReader(filename)) {
			return loadRegions(reader, filename);
		}
	}
	/**
	 * Loads the regions available in the given reader
	 * @param reader Source of the region lines
	 * @param sourceName Name of the source for error messages
	 * @return List<TargetRegion> Regions grouped by sequence and sorted by start within each sequence
	 * @throws IOException If the reader fails or if a line does not have the five required fields
	 */
	public List<TargetRegion> loadRegions (Reader reader, String sourceName) throws IOException {
		List<TargetRegion> regions = new ArrayList<TargetRegion>();
		numSkippedLines = 0;
		BufferedReader in = new BufferedReader(reader);
		String line=in.readLine();
		for(int i=1;line!=null;i++) {
			if(line.startsWith("#") || line.trim().length()==0) {
				line=in.readLine();
				continue;
			}
			String [] items = line.trim().split("\t");
			if(items.length!=5) throw new IOException("Could not parse from "+sourceName+" line "+i+": "+line+". Expected 5 tab separated fields but found "+items.length);
			try {
				int start = Integer.parseInt(items[2].trim());
				int end = Integer.parseInt(items[3].trim());
				char strand = items[4].trim().length()==1?items[4].trim().charAt(0):'.';
				regions.addAll(TargetRegion.createRegions(items[0], items[1], start, end, strand));
			} catch (IllegalArgumentException e) {
				log.warning("Could not fully parse line "+i+": "+line.trim()+". "+e.getMessage());
				numSkippedLines++;
			}
			line=in.readLine();
		}
		if(numSkippedLines>0) log.warning("Skipped "+numSkippedLines+" lines of "+sourceName+" with invalid coordinates");
		log.info("Found "+regions.size()+" target regions in region file "+sourceName);
		return TargetRegion.sortPerSequence(regions);
	}
}
