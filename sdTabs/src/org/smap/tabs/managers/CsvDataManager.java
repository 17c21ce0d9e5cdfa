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
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.logging.Logger;

import org.smap.tabs.Utilities.ApplicationException;
import org.smap.tabs.Utilities.GeneralUtilityMethods;
import org.smap.tabs.model.DataSet;
import org.smap.tabs.model.Question;
import org.smap.tabs.model.QuestionType;
import org.smap.tabs.model.SchemaLookup;

import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvValidationException;

/*
 * Load survey data from CSV files
 * Values are typed using the data map, values that do not match their type are kept as text
 */
public class CsvDataManager {
	
	private static Logger log =
			 Logger.getLogger(CsvDataManager.class.getName());
	
	private static final String BOM = "\uFEFF";
	
	private SchemaLookup schema;
	
	public CsvDataManager(SchemaLookup schema) {
		this.schema = schema;
	}
	
	public DataSet read(File file) throws ApplicationException {
		try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
			return read(reader);
		} catch (IOException e) {
			throw new ApplicationException("Error reading data file " + file.getName() + ": " + e.getMessage(), e);
		}
	}
	
	public DataSet read(Reader reader) throws ApplicationException {
		
		ArrayList<String> names = new ArrayList<String> ();
		ArrayList<ArrayList<Object>> columns = new ArrayList<ArrayList<Object>> ();
		int lineNumber = 1;
		
		try (CSVReader csvReader = new CSVReader(reader)) {
			String [] cols = csvReader.readNext();
			if(cols == null) {
				throw new ApplicationException("Data file is empty");
			}
			for(int i = 0; i < cols.length; i++) {
				String n = cols[i].trim();
				if(i == 0 && n.startsWith(BOM)) {
					n = n.substring(1);
				}
				names.add(n);
				columns.add(new ArrayList<Object> ());
				if(!schema.hasQuestion(n)) {
					log.info("Column " + n + " is not in the data map and will be loaded as text");
				}
			}
			
			String [] line = csvReader.readNext();
			while(line != null) {
				lineNumber++;
				for(int i = 0; i < names.size(); i++) {
					String v = i < line.length ? line[i] : null;
					columns.get(i).add(getValue(names.get(i), v, lineNumber));
				}
				line = csvReader.readNext();
			}
		} catch (IOException | CsvValidationException e) {
			throw new ApplicationException("Error reading data at line " + lineNumber + ": " + e.getMessage(), e);
		}
		
		DataSet data = new DataSet();
		for(int i = 0; i < names.size(); i++) {
			data.addColumn(names.get(i), columns.get(i));
		}
		log.info("Loaded " + data.getRowCount() + " rows and " + data.getColumnCount() + " columns");
		return data;
	}
	
	/*
	 * Write the data with a header row, nulls are written as empty cells
	 */
	public void write(DataSet data, Writer writer) throws ApplicationException {
		try (CSVWriter csvWriter = new CSVWriter(writer)) {
			ArrayList<String> names = new ArrayList<String> (data.getColumnNames());
			csvWriter.writeNext(names.toArray(new String[0]));
			for(int i = 0; i < data.getRowCount(); i++) {
				String [] line = new String[names.size()];
				for(int j = 0; j < names.size(); j++) {
					Object v = data.getValue(names.get(j), i);
					if(v instanceof Double) {
						line[j] = GeneralUtilityMethods.formatNumber((Double) v);
					} else {
						line[j] = GeneralUtilityMethods.isNull(v) ? "" : v.toString();
					}
				}
				csvWriter.writeNext(line);
			}
		} catch (IOException e) {
			throw new ApplicationException("Error writing data: " + e.getMessage(), e);
		}
	}
	
	private Object getValue(String name, String v, int lineNumber) {
		if(v == null || v.trim().length() == 0) {
			return null;
		}
		v = v.trim();
		
		Question q = schema.getQuestion(name);
		QuestionType type = q == null ? QuestionType.OPEN : q.type;
		Object value = v;
		if(type == QuestionType.SINGLE_CHOICE) {
			try {
				value = GeneralUtilityMethods.parseCode(v, v);
			} catch (ApplicationException e) {
				log.warning("Line " + lineNumber + ", " + name + ": " + e.getMessage());
			}
		} else if(type == QuestionType.NUMERIC) {
			Double d = GeneralUtilityMethods.toDouble(v);
			if(d == null) {
				log.warning("Line " + lineNumber + ", " + name + ": not a number: " + v);
			} else {
				value = d;
			}
		} else if(type == QuestionType.MULTI_CHOICE) {
			try {
				value = GeneralUtilityMethods.joinCodes(GeneralUtilityMethods.getCodeSet(v));
			} catch (ApplicationException e) {
				log.warning("Line " + lineNumber + ", " + name + ": " + e.getMessage());
			}
		}
		return value;
	}
}
