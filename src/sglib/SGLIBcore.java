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
package sglib;

import java.lang.reflect.Method;
import java.util.Arrays;

import sglib.main.Command;
import sglib.main.CommandsDescriptor;

/**
 * Entry point of the command line interface. Dispatches the first argument to the program
 * registered for that command in the commands descriptor
 */
public class SGLIBcore {

	public static void main(String[] args) throws Exception {
		CommandsDescriptor descriptor = CommandsDescriptor.getInstance();
		if(args.length == 0 || args[0].equals("help") || args[0].equals("-h") || args[0].equals("--help")){
			descriptor.printUsage();
			return;
		} else if(args[0].equals("version") || args[0].equals("-v") || args[0].equals("--version")){
			descriptor.printVersion();
			return;
		}
		Command command = descriptor.getCommand(args[0]);
		if(command == null) {
			System.err.println("ERROR: Unrecognized command "+args[0]);
			descriptor.printUsage();
			System.exit(1);
		}
		Class<?> program = command.getProgram();
		Method main = program.getDeclaredMethod("main", String[].class);
		String[] mainArgs = Arrays.copyOfRange(args, 1, args.length);
		main.invoke(null, (Object)mainArgs);
	}
}
