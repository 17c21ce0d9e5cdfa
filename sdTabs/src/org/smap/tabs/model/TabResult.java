package org.smap.tabs.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/*
 * The output of one tabulation
 * Percentages are 0 - 100, a percentage with a zero base is 0
 */
public class TabResult {
	private final String title;
	private final CrossTable counts;
	private final CrossTable rowPercent;
	private final CrossTable columnPercent;
	private final SignificanceTable significance;		// null when there are less than two data columns
	private final boolean weighted;
	private final LinkedHashMap<String, Double> columnBase;
	
	public TabResult(String title, CrossTable counts, CrossTable rowPercent, CrossTable columnPercent,
			SignificanceTable significance, boolean weighted, Map<String, Double> columnBase) {
		this.title = title;
		this.counts = counts;
		this.rowPercent = rowPercent;
		this.columnPercent = columnPercent;
		this.significance = significance;
		this.weighted = weighted;
		this.columnBase = columnBase == null ? new LinkedHashMap<String, Double> () : new LinkedHashMap<String, Double> (columnBase);
	}
	
	/*
	 * Result returned when no rows survive the filters or the tab could not be generated
	 */
	public static TabResult empty(String title) {
		return new TabResult(title, CrossTable.empty(), CrossTable.empty(), CrossTable.empty(), null, false, null);
	}
	
	public String getTitle() {
		return title;
	}
	
	public CrossTable getCounts() {
		return counts;
	}
	
	public CrossTable getRowPercent() {
		return rowPercent;
	}
	
	public CrossTable getColumnPercent() {
		return columnPercent;
	}
	
	public SignificanceTable getSignificance() {
		return significance;
	}
	
	public boolean isWeighted() {
		return weighted;
	}
	
	public Map<String, Double> getColumnBase() {
		return Collections.unmodifiableMap(columnBase);
	}
	
	public boolean isEmpty() {
		return counts.isEmpty();
	}
	
	/*
	 * Get the text shown for a cell in the requested display mode
	 */
	public String getDisplayValue(int row, int col, DisplayMode mode) {
		if(mode == DisplayMode.VERTICAL) {
			return formatPercent(columnPercent.getValue(row, col));
		} else if(mode == DisplayMode.HORIZONTAL) {
			return formatPercent(rowPercent.getValue(row, col));
		} else {
			return formatCount(counts.getValue(row, col)) + " (" + formatPercent(columnPercent.getValue(row, col)) + ")";
		}
	}
	
	private String formatCount(double v) {
		if(weighted) {
			return String.format(Locale.ROOT, "%.1f", v);
		}
		return String.valueOf(Math.round(v));
	}
	
	private String formatPercent(double v) {
		return String.format(Locale.ROOT, "%.1f%%", v);
	}
	
	@Override
	public String toString() {
		return "TabResult('" + title + "', rows=" + counts.getRowCount() + ", columns=" + counts.getColumnCount() + ")";
	}
}
