package org.smap.tabs.model;

public class ChiSquareResult {
	public double statistic;
	public double pValue;
	public int degreesOfFreedom;
	
	public ChiSquareResult(double statistic, double pValue, int degreesOfFreedom) {
		this.statistic = statistic;
		this.pValue = pValue;
		this.degreesOfFreedom = degreesOfFreedom;
	}
}
