package org.smap.tabs.model;

import java.util.ArrayList;

import org.smap.tabs.managers.ClassManager;
import org.smap.tabs.managers.FilterManager;
import org.smap.tabs.managers.RecodeManager;

/*
 * Everything read from a configuration workbook
 */
public class StudyConfig {
	public DataMap dataMap = new DataMap();
	public RecodeManager recodes = new RecodeManager();
	public FilterManager filters = new FilterManager();
	public ClassManager classes = new ClassManager();
	public ArrayList<TabPlan> plans = new ArrayList<TabPlan> ();
	
	/*
	 * Check the configuration, returns a list of problems
	 */
	public ArrayList<String> validate() {
		ArrayList<String> errors = new ArrayList<String> ();
		errors.addAll(recodes.validate(dataMap));
		errors.addAll(filters.validate(dataMap));
		errors.addAll(classes.validate());
		return errors;
	}
}
