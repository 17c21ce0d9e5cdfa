package org.smap.tabs.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.smap.tabs.constants.TabLabels;

/*
 * A labelled table of numbers, the last row and column are normally the "Total" margins
 */
public class CrossTable {
	
	public static final String TOTAL = TabLabels.TOTAL;
	
	private final ArrayList<String> rowLabels;
	private final ArrayList<String> columnLabels;
	private final double [][] values;
	
	public CrossTable(List<String> rowLabels, List<String> columnLabels, double [][] values) {
		this.rowLabels = new ArrayList<String> (rowLabels);
		this.columnLabels = new ArrayList<String> (columnLabels);
		this.values = new double[rowLabels.size()][];
		for(int i = 0; i < values.length; i++) {
			this.values[i] = values[i].clone();
		}
	}
	
	public static CrossTable empty() {
		return new CrossTable(new ArrayList<String> (), new ArrayList<String> (), new double[0][0]);
	}
	
	public boolean isEmpty() {
		return rowLabels.isEmpty();
	}
	
	public List<String> getRowLabels() {
		return Collections.unmodifiableList(rowLabels);
	}
	
	public List<String> getColumnLabels() {
		return Collections.unmodifiableList(columnLabels);
	}
	
	public int getRowCount() {
		return rowLabels.size();
	}
	
	public int getColumnCount() {
		return columnLabels.size();
	}
	
	public double getValue(int row, int col) {
		return values[row][col];
	}
	
	/*
	 * Get a value by label, throws IllegalArgumentException if a label is unknown
	 */
	public double getValue(String rowLabel, String columnLabel) {
		return values[getRowIndex(rowLabel)][getColumnIndex(columnLabel)];
	}
	
	public int getRowIndex(String label) {
		int idx = rowLabels.indexOf(label);
		if(idx < 0) {
			throw new IllegalArgumentException("Unknown row: " + label);
		}
		return idx;
	}
	
	public int getColumnIndex(String label) {
		int idx = columnLabels.indexOf(label);
		if(idx < 0) {
			throw new IllegalArgumentException("Unknown column: " + label);
		}
		return idx;
	}
	
	public boolean hasTotals() {
		return !rowLabels.isEmpty() && rowLabels.get(rowLabels.size() - 1).equals(TOTAL)
				&& !columnLabels.isEmpty() && columnLabels.get(columnLabels.size() - 1).equals(TOTAL);
	}
	
	/*
	 * Get a copy of the table without the Total row and column
	 */
	public CrossTable withoutTotals() {
		if(!hasTotals()) {
			return this;
		}
		int rows = rowLabels.size() - 1;
		int cols = columnLabels.size() - 1;
		double [][] v = new double[rows][cols];
		for(int i = 0; i < rows; i++) {
			System.arraycopy(values[i], 0, v[i], 0, cols);
		}
		return new CrossTable(rowLabels.subList(0, rows), columnLabels.subList(0, cols), v);
	}
}
