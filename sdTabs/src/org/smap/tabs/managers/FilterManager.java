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
import java.util.logging.Level;
import java.util.logging.Logger;

import org.smap.tabs.Utilities.ApplicationException;
import org.smap.tabs.Utilities.FormulaParser;
import org.smap.tabs.Utilities.GeneralUtilityMethods;
import org.smap.tabs.Utilities.UnknownEntityException;
import org.smap.tabs.constants.TabLabels;
import org.smap.tabs.model.DataSet;
import org.smap.tabs.model.Filter;
import org.smap.tabs.model.ParsedFormula;
import org.smap.tabs.model.SchemaLookup;
import org.smap.tabs.model.VariableCondition;

/*
 * Manage the named filters that can be applied to tabs
 */
public class FilterManager {
	
	private static Logger log =
			 Logger.getLogger(FilterManager.class.getName());
	
	private LinkedHashMap<String, Filter> filters = new LinkedHashMap<String, Filter> ();
	
	public void addFilter(Filter f) {
		filters.put(f.name, f);
	}
	
	public Filter getFilter(String name) {
		return filters.get(name);
	}
	
	public Collection<Filter> getFilters() {
		return filters.values();
	}
	
	public int size() {
		return filters.size();
	}
	
	/*
	 * Get the rows of data that pass the filter
	 */
	public boolean [] apply(DataSet data, String filterName, SchemaLookup schema) throws ApplicationException {
		Filter f = filters.get(filterName);
		if(f == null) {
			throw new UnknownEntityException("Filter '" + filterName + "' not found");
		}
		
		try {
			boolean [] mask = FormulaParser.evaluate(data, f.formula, schema);
			if(f.includeNulls) {
				addMissingRows(data, f, mask);
			}
			return mask;
		} catch (ApplicationException e) {
			throw e.addContext("Error applying filter '" + filterName + "'");
		}
	}
	
	/*
	 * Check that every filter formula can be parsed
	 * Returns a list of problems, nothing is thrown
	 */
	public ArrayList<String> validate(SchemaLookup schema) {
		ArrayList<String> errors = new ArrayList<String> ();
		for(Filter f : filters.values()) {
			try {
				ParsedFormula pf = FormulaParser.parseConditions(f.formula);
				for(VariableCondition c : pf.conditions) {
					if(schema != null && !schema.hasQuestion(c.variable)) {
						errors.add("Filter '" + f.name + "': variable '" + c.variable + "' not in datamap");
					}
				}
			} catch (ApplicationException e) {
				errors.add("Filter '" + f.name + "': " + e.getMessage());
			}
		}
		return errors;
	}
	
	/*
	 * Evaluate every filter against the data
	 * The result has a FILTER_<name> column per filter, null if the filter could not be applied
	 */
	public LinkedHashMap<String, boolean []> test(DataSet data, SchemaLookup schema) {
		LinkedHashMap<String, boolean []> results = new LinkedHashMap<String, boolean []> ();
		for(Filter f : filters.values()) {
			boolean [] mask = null;
			try {
				mask = apply(data, f.name, schema);
			} catch (ApplicationException e) {
				log.log(Level.WARNING, "Error testing filter '" + f.name + "'", e);
			}
			results.put(TabLabels.FILTER_PREFIX + f.name, mask);
		}
		return results;
	}
	
	/*
	 * Pass rows where every variable used by the filter is missing
	 */
	private void addMissingRows(DataSet data, Filter f, boolean [] mask) {
		ArrayList<String> refs = GeneralUtilityMethods.getVariableReferences(f.formula);
		for(int i = 0; i < mask.length; i++) {
			if(!mask[i]) {
				boolean allMissing = true;
				for(String r : refs) {
					if(!GeneralUtilityMethods.isNull(data.getValue(r, i))) {
						allMissing = false;
						break;
					}
				}
				mask[i] = allMissing;
			}
		}
	}
	
	@Override
	public String toString() {
		return "FilterManager(filters=" + filters.size() + ")";
	}
}
