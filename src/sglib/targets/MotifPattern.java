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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import sglib.sequences.DNASequence;

/**
 * Motif expression describing one set of allowed bases per position. Supported symbols are
 * the bases A, C, G and T, the wildcard '.', the IUPAC ambiguity codes (N, R, Y, S, W, K, M, B,
 * D, H, V) and bracket classes of bases such as [AG]. Matching is case insensitive
 */
public class MotifPattern {
	private static final String ANY = ".";
	private static final String IUPAC_CODES = "NRYSWKMBDHV";
	private static final String [] IUPAC_BASES = {ANY, "AG", "CT", "CG", "AT", "GT", "AC", "CGT", "AGT", "ACT", "ACG"};
	
	private final String expression;
	private final List<String> positions;
	
	/**
	 * Parses the given motif expression
	 * @param expression Motif as a sequence of position symbols
	 * @throws IllegalArgumentException If the expression is empty or has unsupported symbols
	 */
	public MotifPattern(String expression) {
		if(expression==null || expression.trim().length()==0) throw new IllegalArgumentException("Motif expression can not be empty");
		this.expression = expression.trim().toUpperCase();
		this.positions = Collections.unmodifiableList(parse(this.expression));
	}
	
	private static List<String> parse(String expression) {
		List<String> answer = new ArrayList<>();
		for(int i=0;i<expression.length();i++) {
			char c = expression.charAt(i);
			if(c=='[') {
				int close = expression.indexOf(']', i);
				if(close<0) throw new IllegalArgumentException("Unclosed base class in motif "+expression);
				String bases = normalizeBases(expression.substring(i+1,close), expression);
				answer.add(bases);
				i = close;
			} else if (c=='.') {
				answer.add(ANY);
			} else if (DNASequence.isInAlphabet(c)) {
				answer.add(String.valueOf(c));
			} else {
				int idx = IUPAC_CODES.indexOf(c);
				if(idx<0) throw new IllegalArgumentException("Unsupported symbol "+c+" in motif "+expression);
				answer.add(IUPAC_BASES[idx]);
			}
		}
		return answer;
	}
	private static String normalizeBases(String classBases, String expression) {
		StringBuilder answer = new StringBuilder();
		for(char base:DNASequence.BASES_STRING.toCharArray()) {
			if(classBases.indexOf(base)>=0) answer.append(base);
		}
		for(int i=0;i<classBases.length();i++) {
			if(!DNASequence.isInAlphabet(classBases.charAt(i))) throw new IllegalArgumentException("Invalid base "+classBases.charAt(i)+" within base class of motif "+expression);
		}
		if(answer.length()==0) throw new IllegalArgumentException("Empty base class in motif "+expression);
		if(answer.length()==DNASequence.BASES_STRING.length()) return ANY;
		return answer.toString();
	}
	
	public String getExpression() {
		return expression;
	}
	/**
	 * @return int Number of bases matched by this motif
	 */
	public int length() {
		return positions.size();
	}
	/**
	 * @return String Regular expression matching the motif on the forward strand
	 */
	public String getForwardRegex() {
		StringBuilder regex = new StringBuilder();
		for(String bases:positions) regex.append(toRegex(bases));
		return regex.toString();
	}
	/**
	 * @return String Regular expression matching the reverse complement of the motif
	 */
	public String getReverseComplementRegex() {
		StringBuilder regex = new StringBuilder();
		for(int i=positions.size()-1;i>=0;i--) {
			String bases = positions.get(i);
			if(ANY.equals(bases)) regex.append(ANY);
			else regex.append(toRegex(complement(bases)));
		}
		return regex.toString();
	}
	private static String complement(String bases) {
		StringBuilder answer = new StringBuilder();
		for(char base:DNASequence.BASES_STRING.toCharArray()) {
			if(bases.indexOf(DNASequence.getComplement(base))>=0) answer.append(base);
		}
		return answer.toString();
	}
	private static String toRegex(String bases) {
		if(bases.length()==1) return bases;
		if(ANY.equals(bases)) return ANY;
		return "["+bases+"]";
	}
	@Override
	public String toString() {
		return expression;
	}
}
