package org.smap.tabs.constants;

/*
 * Fixed category labels used in cross tabs
 */
public class TabLabels {
	public static final String TOTAL = "Total";
	public static final String NO_ANSWER = "No answer";
	public static final String SELECTED = "Selected";
	public static final String NOT_SELECTED = "Not selected";
	public static final String NESTED_SEPARATOR = " / ";
	public static final String FILTER_PREFIX = "FILTER_";
}
