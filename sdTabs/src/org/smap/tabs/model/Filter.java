package org.smap.tabs.model;

/*
 * A named reusable row condition
 */
public class Filter {
	public String name;
	public String formula;
	public boolean includeNulls = false;	// Rows where every referenced variable is missing pass the filter
	
	public Filter(String name, String formula) {
		this.name = name;
		this.formula = formula;
	}
	
	public Filter(String name, String formula, boolean includeNulls) {
		this(name, formula);
		this.includeNulls = includeNulls;
	}
	
	@Override
	public String toString() {
		return "Filter(name='" + name + "', includeNulls=" + includeNulls + ")";
	}
}
