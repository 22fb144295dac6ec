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

/**
 * Utilities for DNA sequences. Bases outside the ACGT alphabet are kept unchanged by
 * complement operations
 */
public class DNASequence {
	public static final String BASES_STRING = "ACGT";
	public static final char UNKNOWN_BASE = 'N';
	private static final int [] ARRAY_BASES_INDEXING = {0,-1,1,-1,-1,-1,2,-1,-1,-1,-1,-1,-1,-1,-1,-1,-1,-1,-1,3,-1,-1,-1,-1,-1,-1};
	
	private DNASequence() {
	}
	
	private static int getDNAIndex (char base) {
		int i = Character.toUpperCase(base) - 'A';
		if(i<0 || i>=ARRAY_BASES_INDEXING.length) return -1;
		return ARRAY_BASES_INDEXING[i];
	}
	
	public static boolean isInAlphabet(char base) {
		return getDNAIndex(base)>=0;
	}
	
	/**
	 * Gets the complement of the given base preserving case
	 * @param base to complement
	 * @return char Complement of the given base. The same character if it is not a DNA base
	 */
	public static char getComplement(char base) {
		int index = getDNAIndex(base);
		if(index<0) return base;
		char complement = BASES_STRING.charAt(BASES_STRING.length()-index-1);
		if(Character.isLowerCase(base)) return Character.toLowerCase(complement);
		return complement;
	}
	/**
	 * Returns the reverse complement of a DNA sequence
	 * @param sequence Sequence to be translated
	 * @return String reverse complement of the given sequence
	 */
	public static String getReverseComplement(CharSequence sequence) {
		int l = sequence.length();
		StringBuilder answer = new StringBuilder(l);
		for(int i=l-1;i>=0;i--) {
			answer.append(getComplement(sequence.charAt(i)));
		}
		return answer.toString();
	}
}
