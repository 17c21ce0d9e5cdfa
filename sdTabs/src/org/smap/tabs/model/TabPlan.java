package org.smap.tabs.model;

import java.util.ArrayList;

/*
 * A set of tabs produced together, the filter and weight apply to every tab in the plan
 */
public class TabPlan {
	public String name;
	public String filterName;
	public String weightVariable;
	public ArrayList<TabDefinition> tabs = new ArrayList<TabDefinition> ();
	
	public TabPlan(String name) {
		this.name = name;
	}
}
