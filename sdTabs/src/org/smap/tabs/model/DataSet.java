package org.smap.tabs.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/*
 * Survey responses held as named columns of nullable values
 * Multiple choice cells hold the selected codes as text, for example "1,2,4"
 */
public class DataSet {
	
	private LinkedHashMap<String, ArrayList<Object>> columns = new LinkedHashMap<String, ArrayList<Object>> ();
	private int rowCount = -1;		// Set by the first column added
	
	public DataSet() {
	}
	
	/*
	 * Add a column, replacing any existing column with the same name
	 */
	public DataSet addColumn(String name, List<?> values) {
		if(rowCount >= 0 && values.size() != rowCount) {
			throw new IllegalArgumentException("Column " + name + " has " + values.size() 
					+ " values, expected " + rowCount);
		}
		rowCount = values.size();
		columns.put(name, new ArrayList<Object> (values));
		return this;
	}
	
	public DataSet addColumn(String name, Object... values) {
		return addColumn(name, Arrays.asList(values));
	}
	
	public boolean hasColumn(String name) {
		return columns.containsKey(name);
	}
	
	public ArrayList<Object> getColumn(String name) {
		return columns.get(name);
	}
	
	public Object getValue(String name, int row) {
		return columns.get(name).get(row);
	}
	
	public Set<String> getColumnNames() {
		return columns.keySet();
	}
	
	public int getColumnCount() {
		return columns.size();
	}
	
	public int getRowCount() {
		return rowCount < 0 ? 0 : rowCount;
	}
	
	/*
	 * Get a new data set containing the rows where the mask is true
	 */
	public DataSet subset(boolean [] mask) {
		DataSet out = new DataSet();
		for(String name : columns.keySet()) {
			ArrayList<Object> src = columns.get(name);
			ArrayList<Object> dest = new ArrayList<Object> ();
			for(int i = 0; i < src.size(); i++) {
				if(mask[i]) {
					dest.add(src.get(i));
				}
			}
			out.addColumn(name, dest);
		}
		return out;
	}
	
	@Override
	public String toString() {
		return "DataSet(rows=" + getRowCount() + ", columns=" + columns.size() + ")";
	}
}
