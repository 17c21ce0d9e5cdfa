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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.logging.Logger;

import org.smap.tabs.Utilities.ApplicationException;
import org.smap.tabs.Utilities.FormulaParser;
import org.smap.tabs.Utilities.GeneralUtilityMethods;
import org.smap.tabs.Utilities.UnknownEntityException;
import org.smap.tabs.constants.TabLabels;
import org.smap.tabs.model.BinPredicate;
import org.smap.tabs.model.ClassBin;
import org.smap.tabs.model.ClassDefn;

/*
 * Manage the classes used to bin numeric variables into categories
 */
public class ClassManager {
	
	private static Logger log =
			 Logger.getLogger(ClassManager.class.getName());
	
	private LinkedHashMap<String, ClassDefn> classes = new LinkedHashMap<String, ClassDefn> ();
	
	public void addClass(ClassDefn c) {
		classes.put(c.name, c);
	}
	
	public ClassDefn getClassDefn(String name) {
		return classes.get(name);
	}
	
	public Collection<ClassDefn> getClasses() {
		return classes.values();
	}
	
	public int size() {
		return classes.size();
	}
	
	/*
	 * Get the label of each value
	 * The first bin that matches wins, values that match no bin get a null label
	 */
	public ArrayList<String> apply(List<Object> column, String className) throws ApplicationException {
		ClassDefn c = classes.get(className);
		if(c == null) {
			throw new UnknownEntityException("Class '" + className + "' not found");
		}
		
		ArrayList<BinPredicate> predicates = new ArrayList<BinPredicate> ();
		for(ClassBin b : c.bins) {
			try {
				predicates.add(FormulaParser.parseBinPredicate(b.formula));
			} catch (ApplicationException e) {
				throw e.addContext("Error applying class '" + className + "', bin '" + b.label + "'");
			}
		}
		
		ArrayList<String> labels = new ArrayList<String> ();
		int unmatched = 0;
		for(Object v : column) {
			String label = null;
			if(GeneralUtilityMethods.isNull(v)) {
				if(c.includeNulls) {
					label = TabLabels.NO_ANSWER;
				}
			} else {
				Double d = GeneralUtilityMethods.toDouble(v);
				if(d != null) {
					for(int i = 0; i < predicates.size(); i++) {
						if(predicates.get(i).matches(d)) {
							label = c.bins.get(i).label;
							break;
						}
					}
				}
				if(label == null) {
					unmatched++;
				}
			}
			labels.add(label);
		}
		if(unmatched > 0) {
			log.info("Class " + className + ": " + unmatched + " values did not match any bin");
		}
		return labels;
	}
	
	/*
	 * Check that every bin formula can be parsed
	 */
	public ArrayList<String> validate() {
		ArrayList<String> errors = new ArrayList<String> ();
		for(ClassDefn c : classes.values()) {
			for(ClassBin b : c.bins) {
				try {
					FormulaParser.parseBinPredicate(b.formula);
				} catch (ApplicationException e) {
					errors.add("Class '" + c.name + "', bin '" + b.label + "': " + e.getMessage());
				}
			}
		}
		return errors;
	}
	
	@Override
	public String toString() {
		return "ClassManager(classes=" + classes.size() + ")";
	}
}
