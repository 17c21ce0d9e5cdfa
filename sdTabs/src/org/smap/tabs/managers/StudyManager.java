package org.smap.tabs.managers;

/*
This file is part of SMAP.

SMAP is free software: you can redistribute it and/or modify
it under the terms of the GNU General Public License as published by
the Free Software Foundation, either version 3 of the License, or
(at your option) any later version.

SMAP is distributed in the hope that it will be useful,
but WITHOUT ANY WARRANTY; without even the implied warranty of
MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
GNU General Public License for more details.

You should have received a copy of the GNU General Public License
along with SMAP.  If not, see <http://www.gnu.org/licenses/>.

*/

import java.io.File;
import java.util.ArrayList;
import java.util.logging.Logger;

import org.smap.tabs.Utilities.ApplicationException;
import org.smap.tabs.model.DataSet;
import org.smap.tabs.model.Question;
import org.smap.tabs.model.StudyConfig;
import org.smap.tabs.model.TabDefinition;
import org.smap.tabs.model.TabPlan;
import org.smap.tabs.model.TabResult;

/*
 * Run a study from end to end: validate the data, calculate the recodes, generate
 * the tabs of each plan and write a report per plan
 */
public class StudyManager {
	
	private static Logger log =
			 Logger.getLogger(StudyManager.class.getName());
	
	public static final String AUTO_PLAN = "Tabs";
	private static final int AUTO_ROW_VARIABLES = 5;
	
	private StudyConfig config;
	
	public StudyManager(StudyConfig config) {
		this.config = config;
	}
	
	/*
	 * Problems with the configuration and with the data, nothing is thrown
	 */
	public ArrayList<String> validate(DataSet data) {
		ArrayList<String> errors = config.validate();
		errors.addAll(config.dataMap.validateData(data));
		return errors;
	}
	
	/*
	 * Returns the report files written
	 */
	public ArrayList<File> process(DataSet data, File outputDir) throws ApplicationException {
		
		ArrayList<String> errors = validate(data);
		for(String e : errors) {
			log.info("Warning: " + e);
		}
		
		if(config.recodes.size() > 0) {
			log.info("Calculating " + config.recodes.size() + " recodes");
			config.recodes.calculateAll(data, config.dataMap);
		}
		
		ArrayList<TabPlan> plans = config.plans;
		if(plans.isEmpty()) {
			plans = new ArrayList<TabPlan> ();
			TabPlan auto = getDefaultPlan();
			if(auto.tabs.size() > 0) {
				plans.add(auto);
			} else {
				log.info("Warning: no plans and not enough choice variables to create default tabs");
			}
		}
		
		TabManager tm = new TabManager(config.dataMap, config.filters, config.classes);
		XLSXTabReportsManager rm = new XLSXTabReportsManager();
		ArrayList<File> files = new ArrayList<File> ();
		for(TabPlan plan : plans) {
			ArrayList<TabResult> results = tm.generatePlan(data, plan);
			files.add(rm.writePlan(plan, results, outputDir));
		}
		return files;
	}
	
	/*
	 * Each of the next few choice variables against the first choice variable
	 */
	public TabPlan getDefaultPlan() {
		TabPlan plan = new TabPlan(AUTO_PLAN);
		String columnVariable = null;
		for(Question q : config.dataMap.getQuestions()) {
			if(q.type.isChoice()) {
				if(columnVariable == null) {
					columnVariable = q.name;
				} else if(plan.tabs.size() < AUTO_ROW_VARIABLES) {
					plan.tabs.add(new TabDefinition(q.name + " by " + columnVariable, q.name, columnVariable));
				}
			}
		}
		return plan;
	}
}
