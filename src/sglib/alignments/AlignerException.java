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

/**
 * Error raised when an external aligner process finishes with a non zero exit status
 */
public class AlignerException extends IOException {
	private static final long serialVersionUID = 1L;
	private final int exitStatus;
	
	public AlignerException(String message, int exitStatus) {
		super(message+". Exit status: "+exitStatus);
		this.exitStatus = exitStatus;
	}
	public int getExitStatus() {
		return exitStatus;
	}
}
