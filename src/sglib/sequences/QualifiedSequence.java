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
 * Sequence with a name and optional quality scores and comments
 */
public class QualifiedSequence {
	private String name;
	private CharSequence characters;
	private String qualityScores;
	private String comments;
	
	public QualifiedSequence(String name, CharSequence characters) {
		this(name, characters, null);
	}
	public QualifiedSequence(String name, CharSequence characters, String qualityScores) {
		if(name==null) throw new NullPointerException("Name of sequence can not be null");
		this.name = name;
		this.characters = characters;
		this.qualityScores = qualityScores;
	}
	public String getName() {
		return name;
	}
	public CharSequence getCharacters() {
		return characters;
	}
	public void setCharacters(CharSequence characters) {
		this.characters = characters;
	}
	public String getQualityScores() {
		return qualityScores;
	}
	public void setQualityScores(String qualityScores) {
		this.qualityScores = qualityScores;
	}
	public String getComments() {
		return comments;
	}
	public void setComments(String comments) {
		this.comments = comments;
	}
	public int getLength() {
		if(characters==null) return 0;
		return characters.length();
	}
}
