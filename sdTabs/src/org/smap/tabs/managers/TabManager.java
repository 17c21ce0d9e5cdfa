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
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.lang3.StringUtils;
import org.smap.tabs.Utilities.ApplicationException;
import org.smap.tabs.Utilities.GeneralUtilityMethods;
import org.smap.tabs.Utilities.StatisticsUtilities;
import org.smap.tabs.Utilities.TypeMismatchException;
import org.smap.tabs.Utilities.UnknownVariableException;
import org.smap.tabs.constants.TabLabels;
import org.smap.tabs.model.ChiSquareResult;
import org.smap.tabs.model.ClassDefn;
import org.smap.tabs.model.CrossTable;
import org.smap.tabs.model.DataSet;
import org.smap.tabs.model.Question;
import org.smap.tabs.model.QuestionType;
import org.smap.tabs.model.SchemaLookup;
import org.smap.tabs.model.SignificanceTable;
import org.smap.tabs.model.SummaryStatistics;
import org.smap.tabs.model.TabDefinition;
import org.smap.tabs.model.TabPlan;
import org.smap.tabs.model.TabResult;

/*
 * Create cross tabs of a row variable against a column variable
 * The data and schema are only read
 */
public class TabManager {
	
	private static Logger log =
			 Logger.getLogger(TabManager.class.getName());
	
	private SchemaLookup schema;
	private FilterManager filterManager;
	private ClassManager classManager;
	
	/*
	 * The categories of one side of a table and the categories each data row falls into
	 */
	private static class Axis {
		ArrayList<String> labels = new ArrayList<String> ();
		int [][] members;
		
		Axis(int rows) {
			members = new int[rows][0];
		}
		
		int addLabel(String label) {
			labels.add(label);
			return labels.size() - 1;
		}
		
		int getLabelIndex(String label) {
			int idx = labels.indexOf(label);
			return idx >= 0 ? idx : addLabel(label);
		}
		
		void addNoAnswer(List<Integer> rows) {
			if(rows.size() > 0) {
				int idx = getLabelIndex(TabLabels.NO_ANSWER);
				for(int i : rows) {
					members[i] = new int[] {idx};
				}
			}
		}
		
		int size() {
			return labels.size();
		}
	}
	
	public TabManager(SchemaLookup schema, FilterManager filterManager, ClassManager classManager) {
		this.schema = schema;
		this.filterManager = filterManager == null ? new FilterManager() : filterManager;
		this.classManager = classManager == null ? new ClassManager() : classManager;
	}
	
	/*
	 * Generate a single tab
	 * The plan filter is combined with the tab filter, the plan weight replaces the tab weight
	 */
	public TabResult generateTab(DataSet data, TabDefinition def, String planFilter, String planWeight) throws ApplicationException {
		try {
			return generate(data, def, planFilter, planWeight);
		} catch (ApplicationException e) {
			throw e.addContext("Error generating tab '" + def.title + "'");
		}
	}
	
	/*
	 * Generate a list of tabs
	 * A tab that fails is logged and replaced by an empty result
	 */
	public ArrayList<TabResult> generateMultiple(DataSet data, List<TabDefinition> defs, String planFilter, String planWeight) {
		ArrayList<TabResult> results = new ArrayList<TabResult> ();
		for(TabDefinition def : defs) {
			try {
				results.add(generateTab(data, def, planFilter, planWeight));
			} catch (ApplicationException | RuntimeException e) {
				log.log(Level.WARNING, "Failed to generate tab '" + def.title + "'", e);
				results.add(TabResult.empty(def.title));
			}
		}
		return results;
	}
	
	public ArrayList<TabResult> generatePlan(DataSet data, TabPlan plan) {
		log.info("Generating plan " + plan.name + " with " + plan.tabs.size() + " tabs");
		return generateMultiple(data, plan.tabs, plan.filterName, plan.weightVariable);
	}
	
	/*
	 * Chi-square test of independence on the counts of a tab
	 * Returns null if the tab is empty or has too few non empty rows or columns
	 */
	public ChiSquareResult chiSquare(TabResult result) {
		if(result.isEmpty()) {
			return null;
		}
		return StatisticsUtilities.chiSquareTest(result.getCounts());
	}
	
	/*
	 * Summary statistics of a numeric variable, the weight variable is optional
	 * Rows with a missing value, or a missing weight, are ignored
	 */
	public SummaryStatistics summaryStatistics(DataSet data, String variable, String weightVariable) throws ApplicationException {
		Question q = getQuestion(data, variable);
		if(q.type != QuestionType.NUMERIC) {
			throw new TypeMismatchException("Variable '" + variable + "' is not numeric");
		}
		boolean weighted = StringUtils.isNotBlank(weightVariable);
		if(weighted) {
			getQuestion(data, weightVariable);
		}
		
		ArrayList<Double> values = new ArrayList<Double> ();
		ArrayList<Double> weights = new ArrayList<Double> ();
		for(int i = 0; i < data.getRowCount(); i++) {
			Double v = GeneralUtilityMethods.toDouble(data.getValue(variable, i));
			if(v == null || v.isNaN()) {
				continue;
			}
			if(weighted) {
				Double w = GeneralUtilityMethods.toDouble(data.getValue(weightVariable, i));
				if(w == null || w.isNaN()) {
					continue;
				}
				weights.add(w);
			}
			values.add(v);
		}
		
		return StatisticsUtilities.summarise(toArray(values), weighted ? toArray(weights) : null);
	}
	
	private TabResult generate(DataSet data, TabDefinition def, String planFilter, String planWeight) throws ApplicationException {
		
		/*
		 * Filter
		 */
		boolean [] mask = new boolean[data.getRowCount()];
		Arrays.fill(mask, true);
		if(StringUtils.isNotBlank(planFilter)) {
			and(mask, filterManager.apply(data, planFilter, schema));
		}
		if(StringUtils.isNotBlank(def.filterName)) {
			and(mask, filterManager.apply(data, def.filterName, schema));
		}
		DataSet filtered = data.subset(mask);
		if(filtered.getRowCount() == 0) {
			log.info("Tab " + def.title + ": no rows left after filtering");
			return TabResult.empty(def.title);
		}
		
		Axis rows = getRowAxis(filtered, def);
		Axis cols = getColumnAxis(filtered, def);
		
		String weightVariable = StringUtils.isNotBlank(planWeight) ? planWeight : def.weightVariable;
		double [] weights = null;
		if(StringUtils.isNotBlank(weightVariable)) {
			weights = getWeights(filtered, weightVariable);
		}
		
		/*
		 * Aggregate, the last row and column hold the totals
		 * The Total row counts respondents so a multiple choice row variable does not inflate the base
		 */
		int nRows = rows.size();
		int nCols = cols.size();
		double [][] counts = new double[nRows + 1][nCols + 1];
		for(int i = 0; i < filtered.getRowCount(); i++) {
			int [] rm = rows.members[i];
			int [] cm = cols.members[i];
			if(rm.length == 0 || cm.length == 0) {
				continue;
			}
			double w = weights == null ? 1.0 : weights[i];
			for(int r : rm) {
				for(int c : cm) {
					counts[r][c] += w;
					counts[r][nCols] += w;
				}
			}
			for(int c : cm) {
				counts[nRows][c] += w;
			}
			counts[nRows][nCols] += w;
		}
		
		double [][] colPct = new double[nRows + 1][nCols + 1];
		double [][] rowPct = new double[nRows + 1][nCols + 1];
		for(int r = 0; r <= nRows; r++) {
			for(int c = 0; c <= nCols; c++) {
				colPct[r][c] = percent(counts[r][c], counts[nRows][c]);
				rowPct[r][c] = percent(counts[r][c], counts[r][nCols]);
			}
		}
		
		ArrayList<String> rowLabels = new ArrayList<String> (rows.labels);
		rowLabels.add(TabLabels.TOTAL);
		ArrayList<String> colLabels = new ArrayList<String> (cols.labels);
		colLabels.add(TabLabels.TOTAL);
		
		CrossTable countTable = new CrossTable(rowLabels, colLabels, counts);
		SignificanceTable significance = null;
		if(nCols >= 2) {
			significance = StatisticsUtilities.columnZTests(countTable);
		}
		
		LinkedHashMap<String, Double> base = new LinkedHashMap<String, Double> ();
		for(int c = 0; c <= nCols; c++) {
			base.put(colLabels.get(c), counts[nRows][c]);
		}
		
		log.info("Tab " + def.title + ": " + nRows + " rows x " + nCols + " columns, base " + counts[nRows][nCols]);
		return new TabResult(def.title, countTable, 
				new CrossTable(rowLabels, colLabels, rowPct),
				new CrossTable(rowLabels, colLabels, colPct),
				significance, weights != null, base);
	}
	
	/*
	 * Row categories come from the class bins of a numeric variable, the code list of a choice
	 * variable or the distinct values of any other variable
	 */
	private Axis getRowAxis(DataSet data, TabDefinition def) throws ApplicationException {
		Question q = getQuestion(data, def.rowVariable);
		ArrayList<Object> column = data.getColumn(def.rowVariable);
		
		if(q.type == QuestionType.NUMERIC && StringUtils.isNotBlank(def.className)) {
			return getClassAxis(column, def);
		} else if(q.type.isChoice()) {
			return getCodeAxis(q, column, def.hasRowNa());
		} else {
			return getValueAxis(q, column, def.hasRowNa());
		}
	}
	
	private Axis getColumnAxis(DataSet data, TabDefinition def) throws ApplicationException {
		Question q = getQuestion(data, def.columnVariable);
		ArrayList<Object> column = data.getColumn(def.columnVariable);
		
		Axis axis;
		if(q.type == QuestionType.SINGLE_CHOICE) {
			axis = getCodeAxis(q, column, def.hasColNa());
		} else if(q.type == QuestionType.MULTI_CHOICE) {
			axis = getSelectedAxis(q, column);
		} else {
			throw new TypeMismatchException("Column variable '" + def.columnVariable 
					+ "' must be single or multiple choice, not " + q.type.getTag());
		}
		
		if(StringUtils.isNotBlank(def.secondColumnVariable)) {
			Question q2 = getQuestion(data, def.secondColumnVariable);
			if(q.type != QuestionType.SINGLE_CHOICE || q2.type != QuestionType.SINGLE_CHOICE) {
				throw new TypeMismatchException("Nested columns need single choice variables: " 
						+ def.columnVariable + ", " + def.secondColumnVariable);
			}
			Axis second = getCodeAxis(q2, data.getColumn(def.secondColumnVariable), def.hasSecondColNa());
			axis = nest(axis, second);
		}
		return axis;
	}
	
	private Axis getClassAxis(ArrayList<Object> column, TabDefinition def) throws ApplicationException {
		ArrayList<String> labels = classManager.apply(column, def.className);
		ClassDefn c = classManager.getClassDefn(def.className);
		
		Axis axis = new Axis(column.size());
		for(String l : c.getLabels()) {
			axis.addLabel(l);
		}
		
		ArrayList<Integer> naRows = new ArrayList<Integer> ();
		for(int i = 0; i < column.size(); i++) {
			String label = labels.get(i);
			if(label != null) {
				axis.members[i] = new int[] {axis.getLabelIndex(label)};
			} else if(def.hasRowNa() && GeneralUtilityMethods.isNull(column.get(i))) {
				naRows.add(i);
			}
		}
		axis.addNoAnswer(naRows);
		return axis;
	}
	
	/*
	 * Categories in code list order, codes found in the data but not in the code list are added at the end
	 */
	private Axis getCodeAxis(Question q, ArrayList<Object> column, boolean withNa) throws ApplicationException {
		Axis axis = new Axis(column.size());
		HashMap<Integer, Integer> index = new HashMap<Integer, Integer> ();
		for(Integer code : q.codes.keySet()) {
			index.put(code, axis.addLabel(q.getLabel(code)));
		}
		
		ArrayList<TreeSet<Integer>> selected = new ArrayList<TreeSet<Integer>> ();
		TreeSet<Integer> unknown = new TreeSet<Integer> ();
		for(Object v : column) {
			TreeSet<Integer> codes;
			try {
				codes = GeneralUtilityMethods.getCodeSet(v);
			} catch (ApplicationException e) {
				throw e.addContext("Variable '" + q.name + "'");
			}
			for(Integer code : codes) {
				if(!index.containsKey(code)) {
					unknown.add(code);
				}
			}
			selected.add(codes);
		}
		if(unknown.size() > 0) {
			log.warning("Variable " + q.name + " has values not in its code list: " + GeneralUtilityMethods.joinCodes(unknown));
			for(Integer code : unknown) {
				index.put(code, axis.addLabel(String.valueOf(code)));
			}
		}
		
		ArrayList<Integer> naRows = new ArrayList<Integer> ();
		for(int i = 0; i < selected.size(); i++) {
			TreeSet<Integer> codes = selected.get(i);
			if(codes.isEmpty()) {
				if(withNa) {
					naRows.add(i);
				}
			} else {
				int [] m = new int[codes.size()];
				int j = 0;
				for(Integer code : codes) {
					m[j++] = index.get(code);
				}
				axis.members[i] = m;
			}
		}
		axis.addNoAnswer(naRows);
		return axis;
	}
	
	/*
	 * Distinct values in sorted order, used for numeric and text row variables
	 */
	private Axis getValueAxis(Question q, ArrayList<Object> column, boolean withNa) {
		Axis axis = new Axis(column.size());
		String [] keys = new String[column.size()];
		if(q.type == QuestionType.NUMERIC) {
			TreeMap<Double, String> values = new TreeMap<Double, String> ();
			for(int i = 0; i < column.size(); i++) {
				Object v = column.get(i);
				if(!GeneralUtilityMethods.isNull(v)) {
					Double d = GeneralUtilityMethods.toDouble(v);
					keys[i] = d == null ? v.toString() : GeneralUtilityMethods.formatNumber(d);
					if(d != null) {
						values.put(d, keys[i]);
					}
				}
			}
			for(String label : values.values()) {
				axis.addLabel(label);
			}
		} else {
			TreeSet<String> values = new TreeSet<String> ();
			for(int i = 0; i < column.size(); i++) {
				Object v = column.get(i);
				if(!GeneralUtilityMethods.isNull(v)) {
					keys[i] = v.toString().trim();
					values.add(keys[i]);
				}
			}
			for(String label : values) {
				axis.addLabel(label);
			}
		}
		
		ArrayList<Integer> naRows = new ArrayList<Integer> ();
		for(int i = 0; i < keys.length; i++) {
			if(keys[i] != null) {
				axis.members[i] = new int[] {axis.getLabelIndex(keys[i])};
			} else if(withNa) {
				naRows.add(i);
			}
		}
		axis.addNoAnswer(naRows);
		return axis;
	}
	
	/*
	 * A multiple choice column is split on whether its first code was selected
	 * Only the first code is tabulated, the other codes are not shown
	 */
	private Axis getSelectedAxis(Question q, ArrayList<Object> column) throws ApplicationException {
		if(q.codes.isEmpty()) {
			throw new ApplicationException("Multiple choice column '" + q.name + "' has no codes");
		}
		Integer code = q.codes.keySet().iterator().next();
		if(q.codes.size() > 1) {
			log.info("Multiple choice column " + q.name + ": only code " + code + " is tabulated");
		}
		
		Axis axis = new Axis(column.size());
		int selected = axis.addLabel(TabLabels.SELECTED);
		int notSelected = axis.addLabel(TabLabels.NOT_SELECTED);
		for(int i = 0; i < column.size(); i++) {
			TreeSet<Integer> codes;
			try {
				codes = GeneralUtilityMethods.getCodeSet(column.get(i));
			} catch (ApplicationException e) {
				throw e.addContext("Variable '" + q.name + "'");
			}
			axis.members[i] = new int[] {codes.contains(code) ? selected : notSelected};
		}
		return axis;
	}
	
	private Axis nest(Axis first, Axis second) {
		Axis axis = new Axis(first.members.length);
		for(String a : first.labels) {
			for(String b : second.labels) {
				axis.addLabel(a + TabLabels.NESTED_SEPARATOR + b);
			}
		}
		for(int i = 0; i < axis.members.length; i++) {
			if(first.members[i].length > 0 && second.members[i].length > 0) {
				axis.members[i] = new int[] {first.members[i][0] * second.size() + second.members[i][0]};
			}
		}
		return axis;
	}
	
	private double [] getWeights(DataSet data, String weightVariable) throws ApplicationException {
		getQuestion(data, weightVariable);
		double [] weights = new double[data.getRowCount()];
		int missing = 0;
		for(int i = 0; i < weights.length; i++) {
			Double w = GeneralUtilityMethods.toDouble(data.getValue(weightVariable, i));
			if(w == null || w.isNaN()) {
				missing++;
			} else {
				weights[i] = w;
			}
		}
		if(missing > 0) {
			log.warning("Weight " + weightVariable + ": " + missing + " missing values treated as 0");
		}
		return weights;
	}
	
	private Question getQuestion(DataSet data, String name) throws UnknownVariableException {
		Question q = schema.getQuestion(name);
		if(q == null || !data.hasColumn(name)) {
			throw new UnknownVariableException(name, null);
		}
		return q;
	}
	
	private void and(boolean [] mask, boolean [] filter) {
		for(int i = 0; i < mask.length; i++) {
			mask[i] = mask[i] && filter[i];
		}
	}
	
	private double percent(double v, double base) {
		return base > 0 ? v / base * 100.0 : 0.0;
	}
	
	private double [] toArray(List<Double> values) {
		double [] a = new double[values.size()];
		for(int i = 0; i < a.length; i++) {
			a[i] = values.get(i);
		}
		return a;
	}
}
