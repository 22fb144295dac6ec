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
package sglib.main;

/**
 * Decodes values of command options given as strings
 */
public class OptionValuesDecoder {
	
	public static Object decode(String value, Class<?> type) {
		if(value == null) return null;
		value = value.trim();
		if(type.equals(String.class)) return value;
		if(type.equals(Integer.class) || type.equals(int.class)) return Integer.parseInt(value);
		if(type.equals(Double.class) || type.equals(double.class)) return Double.parseDouble(value);
		if(type.equals(Byte.class) || type.equals(byte.class)) return Byte.parseByte(value);
		if(type.equals(Boolean.class) || type.equals(boolean.class)) return Boolean.parseBoolean(value);
		if(type.equals(int[].class)) return decodeIntArray(value);
		throw new IllegalArgumentException("Can not decode values of type "+type.getName());
	}
	
	private static int [] decodeIntArray(String value) {
		if(value.length()==0) return new int[0];
		String [] items = value.split(",");
		int [] answer = new int[items.length];
		for(int i=0;i<items.length;i++) {
			answer[i] = Integer.parseInt(items[i].trim());
		}
		return answer;
	}
}
