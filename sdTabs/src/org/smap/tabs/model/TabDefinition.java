package org.smap.tabs.model;

/*
 * A single cross tabulation, row variable by column variable
 */
public class TabDefinition {
	public String title;
	public String rowVariable;
	public String columnVariable;
	public String secondColumnVariable;		// Optional nested column variable
	public String filterName;
	public String weightVariable;
	public String className;				// Bins a numeric row variable
	public String withNa = "";				// Any of RowNA/ColNA/SecondcolNA
	public DisplayMode displayMode = DisplayMode.BOTH;
	
	public TabDefinition(String title, String rowVariable, String columnVariable) {
		this.title = title;
		this.rowVariable = rowVariable;
		this.columnVariable = columnVariable;
	}
	
	public boolean hasRowNa() {
		return withNa != null && withNa.contains("RowNA");
	}
	
	public boolean hasColNa() {
		return withNa != null && withNa.contains("ColNA");
	}
	
	public boolean hasSecondColNa() {
		return withNa != null && withNa.contains("SecondcolNA");
	}
	
	@Override
	public String toString() {
		return "TabDefinition('" + title + "': " + rowVariable + " x " + columnVariable + ")";
	}
}
