package org.smap.tabs.model;

public class WeightCondition {
	public String condition;	// ["Country"=1]
	public double weight;
	
	public WeightCondition(String condition, double weight) {
		this.condition = condition;
		this.weight = weight;
	}
}
