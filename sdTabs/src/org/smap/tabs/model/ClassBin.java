package org.smap.tabs.model;

public class ClassBin {
	public String formula;		// X>=18 and X<30
	public String label;
	
	public ClassBin(String formula, String label) {
		this.formula = formula;
		this.label = label;
	}
}
