package org.smap.tabs.model;

/*
 * Summary of a numeric variable
 * The median is never weighted
 */
public class SummaryStatistics {
	public double mean;
	public double median;
	public double std;
	public double min;
	public double max;
	public int n;
	public boolean weighted;
}
