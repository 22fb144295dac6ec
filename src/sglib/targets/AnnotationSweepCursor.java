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

/**
 * Window [front, back) over the sorted targets of one chromosome. Both bounds only move forward
 * while regions of the chromosome are processed in order of start
 */
public final class AnnotationSweepCursor {
	public static final AnnotationSweepCursor START = new AnnotationSweepCursor(0, 0);
	
	private final int front;
	private final int back;
	
	public AnnotationSweepCursor(int front, int back) {
		if(front<0 || back<0) throw new IllegalArgumentException("Invalid cursor bounds "+front+"-"+back);
		this.front = front;
		this.back = back;
	}
	public int getFront() {
		return front;
	}
	public int getBack() {
		return back;
	}
	/**
	 * @return int Number of targets within the window. Zero if front is not before back
	 */
	public int getWindowSize() {
		return Math.max(0, back-front);
	}
	@Override
	public boolean equals(Object obj) {
		if(!(obj instanceof AnnotationSweepCursor)) return false;
		AnnotationSweepCursor other = (AnnotationSweepCursor)obj;
		return front==other.front && back==other.back;
	}
	@Override
	public int hashCode() {
		return 31*front+back;
	}
	@Override
	public String toString() {
		return "["+front+","+back+")";
	}
}
