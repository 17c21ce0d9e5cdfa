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
import java.util.HashSet;
import java.util.List;
import java.util.logging.Logger;

import org.smap.tabs.Utilities.ApplicationException;
import org.smap.tabs.model.DataMap;
import org.smap.tabs.model.DataSet;
import org.smap.tabs.model.Recode;
import org.smap.tabs.model.RecodeResult;
import org.smap.tabs.model.SchemaLookup;

/*
 * Manage the recodes that derive new variables from existing ones
 * Recodes are calculated in order so a recode can use the result of an earlier one
 */
public class RecodeManager {
	
	private static Logger log =
			 Logger.getLogger(RecodeManager.class.getName());
	
	private ArrayList<Recode> recodes = new ArrayList<Recode> ();
	
	public void addRecode(Recode r) {
		recodes.add(r);
	}
	
	public List<Recode> getRecodes() {
		return recodes;
	}
	
	public Recode getRecode(String name) {
		for(Recode r : recodes) {
			if(r.name.equals(name)) {
				return r;
			}
		}
		return null;
	}
	
	public int size() {
		return recodes.size();
	}
	
	/*
	 * Check the recodes against the schema
	 * Returns a list of problems, nothing is thrown
	 */
	public ArrayList<String> validate(SchemaLookup schema) {
		ArrayList<String> errors = new ArrayList<String> ();
		HashSet<String> names = new HashSet<String> ();
		for(Recode r : recodes) {
			if(names.contains(r.name)) {
				errors.add("Duplicate recode name: " + r.name);
			} else if(schema.hasQuestion(r.name)) {
				errors.add("Recode '" + r.name + "' replaces an existing variable");
			}
			
			for(String ref : r.getReferencedVariables()) {
				if(!schema.hasQuestion(ref) && !names.contains(ref)) {
					errors.add("Recode '" + r.name + "': variable '" + ref + "' not in datamap");
				}
			}
			names.add(r.name);
		}
		return errors;
	}
	
	/*
	 * Calculate each recode in turn and add the result to the data and the data map
	 * Recodes already added are kept if a later recode fails
	 */
	public void calculateAll(DataSet data, DataMap dataMap) throws ApplicationException {
		for(Recode r : recodes) {
			RecodeResult result = calculate(r, data, dataMap);
			data.addColumn(result.name, result.column);
			dataMap.addQuestion(result.question);
			log.info("Calculated recode " + r.name + " (" + r.getType().getTag() + ")");
		}
	}
	
	/*
	 * Calculate a single recode without changing the data
	 */
	public RecodeResult calculate(Recode r, DataSet data, SchemaLookup schema) throws ApplicationException {
		try {
			return r.apply(data, schema);
		} catch (ApplicationException e) {
			throw e.addContext("Error calculating recode '" + r.name + "'");
		} catch (RuntimeException e) {
			throw new ApplicationException("Error calculating recode '" + r.name + "': " + e.getMessage(), e);
		}
	}
	
	@Override
	public String toString() {
		return "RecodeManager(recodes=" + recodes.size() + ")";
	}
}
