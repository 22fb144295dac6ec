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

import java.lang.reflect.Method;

/**
 * Option of a command. The value is set in the program object calling the setter of
 * the attribute associated with the option
 */
public class CommandOption {
	public static final String TYPE_BOOLEAN = "BOOLEAN";
	public static final String TYPE_INT = "INT";
	public static final String TYPE_DOUBLE = "DOUBLE";
	public static final String TYPE_STRING = "STRING";
	public static final String TYPE_FILE = "FILE";
	public static final String TYPE_INT_LIST = "INT_LIST";
	
	private String id;
	private String type = TYPE_STRING;
	private String defaultValue;
	private String attribute;
	private String description;
	private boolean deprecated = false;
	
	public CommandOption(String id) {
		this.id = id;
	}
	public String getId() {
		return id;
	}
	public String getType() {
		return type;
	}
	public void setType(String type) {
		this.type = type;
	}
	public String getDefaultValue() {
		return defaultValue;
	}
	public void setDefaultValue(String defaultValue) {
		this.defaultValue = defaultValue;
	}
	/**
	 * @return String Name of the attribute set by this option. By default it is the option id
	 */
	public String getAttribute() {
		if(attribute==null) return id;
		return attribute;
	}
	public void setAttribute(String attribute) {
		this.attribute = attribute;
	}
	public String getDescription() {
		return description;
	}
	public void setDescription(String description) {
		this.description = description;
	}
	public boolean isDeprecated() {
		return deprecated;
	}
	public void setDeprecated(boolean deprecated) {
		this.deprecated = deprecated;
	}
	public boolean printType() {
		return !TYPE_BOOLEAN.equals(type);
	}
	public int getPrintLength() {
		int length = id.length()+1;
		if(printType()) length+=type.length()+1;
		return length;
	}
	/**
	 * Finds the setter of the attribute associated with this option in the given program.
	 * Setters receiving a String are preferred for non boolean options
	 * @param programInstance Object implementing the command
	 * @return Method Setter that receives the option value
	 */
	public Method findSetMethod(Object programInstance) {
		String attr = getAttribute();
		String methodName = "set"+Character.toUpperCase(attr.charAt(0))+attr.substring(1);
		Method answer = null;
		for(Method m:programInstance.getClass().getMethods()) {
			if(!m.getName().equals(methodName) || m.getParameterTypes().length!=1) continue;
			Class<?> paramType = m.getParameterTypes()[0];
			if(TYPE_BOOLEAN.equals(type)) {
				if(paramType.equals(Boolean.class) || paramType.equals(boolean.class)) return m;
			} else if (paramType.equals(String.class)) {
				return m;
			}
			if(answer==null) answer = m;
		}
		if(answer==null) throw new RuntimeException("Can not find method "+methodName+" for option "+id+" in class "+programInstance.getClass().getName());
		return answer;
	}
	/**
	 * Decodes the given value according to the type of this option
	 * @param value String representation of the value
	 * @return Object Decoded value
	 */
	public Object decodeValue(String value) {
		if(TYPE_INT.equals(type)) return OptionValuesDecoder.decode(value, Integer.class);
		if(TYPE_DOUBLE.equals(type)) return OptionValuesDecoder.decode(value, Double.class);
		if(TYPE_BOOLEAN.equals(type)) return OptionValuesDecoder.decode(value, Boolean.class);
		if(TYPE_INT_LIST.equals(type)) return OptionValuesDecoder.decode(value, int[].class);
		return value;
	}
}
