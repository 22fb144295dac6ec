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

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * List of sequences that can also be queried by name. Names must be unique
 */
public class QualifiedSequenceList extends ArrayList<QualifiedSequence> {
	private static final long serialVersionUID = 1L;
	private Map<String,Integer> indexesByName = new HashMap<>();
	
	@Override
	public boolean add(QualifiedSequence seq) {
		if(indexesByName.containsKey(seq.getName())) throw new IllegalArgumentException("Duplicated sequence name: "+seq.getName());
		indexesByName.put(seq.getName(), size());
		return super.add(seq);
	}
	@Override
	public boolean addAll(Collection<? extends QualifiedSequence> sequences) {
		for(QualifiedSequence seq:sequences) add(seq);
		return sequences.size()>0;
	}
	/**
	 * @param name Name of the sequence to look for
	 * @return QualifiedSequence sequence with the given name or null if it is not present
	 */
	public QualifiedSequence get(String name) {
		Integer idx = indexesByName.get(name);
		if(idx==null) return null;
		return get(idx);
	}
	public int indexOf(String name) {
		Integer idx = indexesByName.get(name);
		if(idx==null) return -1;
		return idx;
	}
	public boolean contains(String name) {
		return indexesByName.containsKey(name);
	}
}
