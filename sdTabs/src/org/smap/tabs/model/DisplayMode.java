package org.smap.tabs.model;

/*
 * Vertical shows column percentages, Horizontal row percentages and Both shows count (col %)
 */
public enum DisplayMode {
	VERTICAL("Vertical"),
	HORIZONTAL("Horizontal"),
	BOTH("Both");
	
	private final String name;
	
	DisplayMode(String name) {
		this.name = name;
	}
	
	public String getName() {
		return name;
	}
	
	public static DisplayMode fromString(String s) {
		if(s != null) {
			for(DisplayMode m : values()) {
				if(m.name.equalsIgnoreCase(s.trim())) {
					return m;
				}
			}
		}
		return BOTH;
	}
}
