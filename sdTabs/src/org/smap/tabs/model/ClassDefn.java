package org.smap.tabs.model;

import java.util.ArrayList;

/*
 * Numeric binning definition
 * Bins are tested in order and the first one that matches supplies the label
 */
public class ClassDefn {
	public String name;
	public ArrayList<ClassBin> bins = new ArrayList<ClassBin> ();
	public boolean includeNulls = false;		// Label missing values as "No answer"
	
	public ClassDefn(String name) {
		this.name = name;
	}
	
	public ClassDefn(String name, boolean includeNulls) {
		this(name);
		this.includeNulls = includeNulls;
	}
	
	public ClassDefn addBin(String formula, String label) {
		bins.add(new ClassBin(formula, label));
		return this;
	}
	
	/*
	 * Get the labels in bin order
	 */
	public ArrayList<String> getLabels() {
		ArrayList<String> labels = new ArrayList<String> ();
		for(ClassBin b : bins) {
			if(!labels.contains(b.label)) {
				labels.add(b.label);
			}
		}
		return labels;
	}
	
	@Override
	public String toString() {
		return "ClassDefn(name='" + name + "', bins=" + bins.size() + ")";
	}
}
