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

import java.io.IOException;
import java.util.List;
import java.util.Set;

import sglib.sequences.RawRead;

/**
 * Aligner of short reads against a genome that reports which reads have exactly one alignment
 * within a dissimilarity bound. Each call is a blocking round
 */
public interface ShortReadsAligner {
	/**
	 * Makes sure that the genome index exists, building it if needed. Must be idempotent
	 * @throws IOException If the index can not be built
	 */
	public void prepareIndex() throws IOException;
	/**
	 * Aligns the given reads and returns the names of the reads with a unique alignment
	 * @param reads Batch of reads. Names must be unique within the batch
	 * @param maxDissimilarity Maximum dissimilarity of accepted alignments
	 * @return Set<String> Names of the reads aligned to exactly one genomic location
	 * @throws AlignerException If the aligner finishes with an error status
	 * @throws IOException If the reads or the results can not be exchanged with the aligner
	 */
	public Set<String> findUniquelyAlignedReads(List<RawRead> reads, int maxDissimilarity) throws IOException;
}
