package org.smap.tabs.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/*
 * Significance letters for each data cell of a cross tab
 * A cell marked "BC" has a proportion significantly higher than columns B and C
 */
public class SignificanceTable {
	
	private final ArrayList<String> rowLabels;
	private final ArrayList<String> columnLabels;
	private final ArrayList<String> letters;		// Letter of each column
	private final String [][] markers;
	
	public SignificanceTable(List<String> rowLabels, List<String> columnLabels, List<String> letters, String [][] markers) {
		this.rowLabels = new ArrayList<String> (rowLabels);
		this.columnLabels = new ArrayList<String> (columnLabels);
		this.letters = new ArrayList<String> (letters);
		this.markers = new String[markers.length][];
		for(int i = 0; i < markers.length; i++) {
			this.markers[i] = markers[i].clone();
		}
	}
	
	public List<String> getRowLabels() {
		return Collections.unmodifiableList(rowLabels);
	}
	
	public List<String> getColumnLabels() {
		return Collections.unmodifiableList(columnLabels);
	}
	
	public List<String> getLetters() {
		return Collections.unmodifiableList(letters);
	}
	
	public String getMarker(int row, int col) {
		return markers[row][col];
	}
	
	public String getMarker(String rowLabel, String columnLabel) {
		return markers[rowLabels.indexOf(rowLabel)][columnLabels.indexOf(columnLabel)];
	}
	
	public boolean hasMarkers() {
		for(String [] row : markers) {
			for(String m : row) {
				if(m.length() > 0) {
					return true;
				}
			}
		}
		return false;
	}
}
