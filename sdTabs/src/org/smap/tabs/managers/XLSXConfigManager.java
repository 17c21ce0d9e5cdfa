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
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.lang3.StringUtils;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.smap.tabs.Utilities.ApplicationException;
import org.smap.tabs.Utilities.FormulaParseException;
import org.smap.tabs.Utilities.GeneralUtilityMethods;
import org.smap.tabs.Utilities.XLSUtilities;
import org.smap.tabs.model.ClassBin;
import org.smap.tabs.model.ClassDefn;
import org.smap.tabs.model.CombinationRecode;
import org.smap.tabs.model.DataMap;
import org.smap.tabs.model.DisplayMode;
import org.smap.tabs.model.Filter;
import org.smap.tabs.model.MultiChoiceRecode;
import org.smap.tabs.model.NumberOfAnswersRecode;
import org.smap.tabs.model.NumericRecode;
import org.smap.tabs.model.Question;
import org.smap.tabs.model.QuestionType;
import org.smap.tabs.model.Recode;
import org.smap.tabs.model.RecodeType;
import org.smap.tabs.model.SingleChoiceRecode;
import org.smap.tabs.model.StudyConfig;
import org.smap.tabs.model.SubtotalMultiChoiceRecode;
import org.smap.tabs.model.TabDefinition;
import org.smap.tabs.model.TabPlan;
import org.smap.tabs.model.WeightCondition;
import org.smap.tabs.model.WeightRecode;

/*
 * Read and write the configuration workbook
 * Sheets: Datamap, Recode, Filters, Classes and Tabs
 */
public class XLSXConfigManager {
	
	private static Logger log =
			 Logger.getLogger(XLSXConfigManager.class.getName());
	
	public static final String DATAMAP_SHEET = "Datamap";
	public static final String RECODE_SHEET = "Recode";
	public static final String FILTERS_SHEET = "Filters";
	public static final String CLASSES_SHEET = "Classes";
	public static final String TABS_SHEET = "Tabs";
	
	private static final String DEFAULT_PLAN = "Default";
	private static final int CLASS_BIN_START_ROW = 3;
	
	public StudyConfig read(File file) throws ApplicationException {
		try (InputStream is = new FileInputStream(file)) {
			return read(is);
		} catch (IOException e) {
			throw new ApplicationException("Error reading configuration file " + file.getName() + ": " + e.getMessage(), e);
		}
	}
	
	public StudyConfig read(InputStream is) throws ApplicationException {
		try (Workbook wb = WorkbookFactory.create(is)) {
			return read(wb);
		} catch (IOException e) {
			throw new ApplicationException("Error reading configuration: " + e.getMessage(), e);
		}
	}
	
	public StudyConfig read(Workbook wb) throws ApplicationException {
		StudyConfig config = new StudyConfig();
		config.dataMap = readDataMap(wb);
		readRecodes(wb, config.recodes);
		readFilters(wb, config.filters);
		readClasses(wb, config.classes);
		config.plans = readPlans(wb);
		log.info("Read configuration: " + config.dataMap.size() + " variables, " + config.recodes.size() 
				+ " recodes, " + config.filters.size() + " filters, " + config.classes.size() 
				+ " classes, " + config.plans.size() + " plans");
		return config;
	}
	
	/*
	 * Questions, one per row: Name, Type, Title followed by code / label pairs
	 */
	public DataMap readDataMap(Workbook wb) throws ApplicationException {
		Sheet sheet = wb.getSheet(DATAMAP_SHEET);
		if(sheet == null) {
			throw new ApplicationException("Sheet not found: " + DATAMAP_SHEET);
		}
		
		DataMap dm = new DataMap();
		int headerRow = XLSUtilities.findHeaderRow(sheet, "Name", "Type");
		if(headerRow < 0) {
			log.warning("Could not find the header row of the " + DATAMAP_SHEET + " sheet");
			return dm;
		}
		HashMap<String, Integer> header = XLSUtilities.getHeader(sheet.getRow(headerRow));
		int codeStart = header.containsKey("title") ? header.get("title") + 1 : header.get("type") + 1;
		
		for(int i = headerRow + 1; i <= sheet.getLastRowNum(); i++) {
			Row row = sheet.getRow(i);
			String name = XLSUtilities.getColumn(row, "Name", header, null);
			String type = XLSUtilities.getColumn(row, "Type", header, null);
			if(name == null || type == null) {
				continue;
			}
			String title = XLSUtilities.getColumn(row, "Title", header, name);
			
			Question q = new Question(name.trim(), QuestionType.fromString(type), title);
			for(int j = codeStart; j + 1 < row.getLastCellNum(); j += 2) {
				String code = XLSUtilities.getCellValue(row, j);
				String label = XLSUtilities.getCellValue(row, j + 1);
				if(code != null && label != null) {
					try {
						q.addCode(GeneralUtilityMethods.parseCode(code.trim(), code), label);
					} catch (ApplicationException e) {
						log.warning("Datamap row " + (i + 1) + ": ignoring code " + code + " of " + name);
					}
				}
			}
			dm.addQuestion(q);
		}
		return dm;
	}
	
	/*
	 * A recode starts on a row with a name and continues until the next name
	 * Recodes that cannot be created are logged and skipped
	 */
	public void readRecodes(Workbook wb, RecodeManager recodes) {
		Sheet sheet = wb.getSheet(RECODE_SHEET);
		if(sheet == null) {
			log.info("No " + RECODE_SHEET + " sheet");
			return;
		}
		int headerRow = XLSUtilities.findHeaderRow(sheet, "Name", "Type");
		if(headerRow < 0) {
			log.warning("Could not find the header row of the " + RECODE_SHEET + " sheet");
			return;
		}
		HashMap<String, Integer> header = XLSUtilities.getHeader(sheet.getRow(headerRow));
		
		String name = null;
		String type = null;
		String title = null;
		boolean optionNa = false;
		ArrayList<String> lines = new ArrayList<String> ();
		LinkedHashMap<Integer, String> codes = new LinkedHashMap<Integer, String> ();
		
		for(int i = headerRow + 1; i <= sheet.getLastRowNum() + 1; i++) {
			Row row = sheet.getRow(i);
			String rowName = row == null ? null : XLSUtilities.getColumn(row, "Name", header, null);
			boolean end = i > sheet.getLastRowNum();
			
			if((rowName != null || end) && name != null) {
				addRecode(recodes, name, type, title, optionNa, lines, codes);
				lines = new ArrayList<String> ();
				codes = new LinkedHashMap<Integer, String> ();
			}
			if(end || row == null) {
				continue;
			}
			
			if(rowName != null) {
				name = rowName.trim();
				type = XLSUtilities.getColumn(row, "Type", header, RecodeType.SINGLE_CHOICE.getTag());
				title = XLSUtilities.getColumn(row, "Title", header, name);
				optionNa = XLSUtilities.isYes(XLSUtilities.getColumn(row, "Option NA", header, null));
			}
			
			String line = XLSUtilities.getColumn(row, "Formula", header, null);
			if(line != null) {
				lines.add(line.trim());
			}
			String code = XLSUtilities.getColumn(row, "Code", header, null);
			String label = XLSUtilities.getColumn(row, "Label", header, null);
			if(code != null && label != null) {
				try {
					codes.put(GeneralUtilityMethods.parseCode(code.trim(), code), label);
				} catch (ApplicationException e) {
					log.warning("Recode row " + (i + 1) + ": ignoring code " + code);
				}
			}
		}
	}
	
	private void addRecode(RecodeManager recodes, String name, String type, String title, boolean optionNa,
			ArrayList<String> lines, LinkedHashMap<Integer, String> codes) {
		try {
			Recode r = createRecode(name, RecodeType.fromString(type), title, lines, codes);
			r.includeNulls = optionNa;
			recodes.addRecode(r);
		} catch (ApplicationException e) {
			log.log(Level.WARNING, "Failed to create recode '" + name + "'", e);
		}
	}
	
	public Recode createRecode(String name, RecodeType type, String title, ArrayList<String> lines, 
			LinkedHashMap<Integer, String> codes) throws ApplicationException {
		
		String formula = String.join("\n", lines);
		switch(type) {
		case MULTI_CHOICE:
			return new MultiChoiceRecode(name, title, formula, codes);
		case NUMERIC:
			return new NumericRecode(name, title, formula);
		case NUMBER_OF_ANSWERS:
			return new NumberOfAnswersRecode(name, title, formula);
		case COMBINATION:
			return new CombinationRecode(name, title, formula);
		case WEIGHT:
			WeightRecode wr = new WeightRecode(name, title);
			for(String line : lines) {
				int idx = line.lastIndexOf(':');
				if(idx < 0) {
					throw new FormulaParseException("Weight line without a weight: " + line);
				}
				try {
					wr.addWeight(line.substring(0, idx).trim(), Double.parseDouble(line.substring(idx + 1).trim()));
				} catch (NumberFormatException e) {
					throw new FormulaParseException("Invalid weight in: " + line);
				}
			}
			return wr;
		case SUBTOTAL_MULTI_CHOICE:
			ArrayList<String> source = new ArrayList<String> ();
			ArrayList<String> subtotalLines = new ArrayList<String> ();
			for(String line : lines) {
				if(line.startsWith("[")) {
					source.add(line);
				} else {
					subtotalLines.add(line);
				}
			}
			SubtotalMultiChoiceRecode sr = new SubtotalMultiChoiceRecode(name, title, String.join("\n", source), codes);
			for(String line : subtotalLines) {
				int idx = line.indexOf(':');
				if(idx < 0) {
					throw new FormulaParseException("Sub total line without members: " + line);
				}
				sr.addSubtotal(GeneralUtilityMethods.parseCode(line.substring(0, idx).trim(), line),
						new ArrayList<Integer> (GeneralUtilityMethods.getCodeSet(line.substring(idx + 1))));
			}
			return sr;
		default:
			return new SingleChoiceRecode(name, title, formula, codes);
		}
	}
	
	/*
	 * Name, Formula, With NA
	 */
	public void readFilters(Workbook wb, FilterManager filters) {
		Sheet sheet = wb.getSheet(FILTERS_SHEET);
		if(sheet == null) {
			log.info("No " + FILTERS_SHEET + " sheet");
			return;
		}
		int headerRow = XLSUtilities.findHeaderRow(sheet, "Name", "Formula");
		if(headerRow < 0) {
			log.warning("Could not find the header row of the " + FILTERS_SHEET + " sheet");
			return;
		}
		HashMap<String, Integer> header = XLSUtilities.getHeader(sheet.getRow(headerRow));
		for(int i = headerRow + 1; i <= sheet.getLastRowNum(); i++) {
			Row row = sheet.getRow(i);
			String name = XLSUtilities.getColumn(row, "Name", header, null);
			String formula = XLSUtilities.getColumn(row, "Formula", header, null);
			if(name != null && formula != null) {
				boolean withNa = XLSUtilities.isYes(XLSUtilities.getColumn(row, "With NA", header, null));
				filters.addFilter(new Filter(name.trim(), formula.trim(), withNa));
			}
		}
	}
	
	/*
	 * Each class uses a pair of columns starting at column B
	 * Row 1 has the name, row 2 the Option NA flag, bins of formula and label start on row 4
	 */
	public void readClasses(Workbook wb, ClassManager classes) {
		Sheet sheet = wb.getSheet(CLASSES_SHEET);
		if(sheet == null) {
			log.info("No " + CLASSES_SHEET + " sheet");
			return;
		}
		Row nameRow = sheet.getRow(0);
		if(nameRow == null) {
			return;
		}
		for(int col = 1; col < nameRow.getLastCellNum(); col += 2) {
			String name = XLSUtilities.getCellValue(nameRow, col);
			if(name == null) {
				continue;
			}
			boolean optionNa = XLSUtilities.isYes(XLSUtilities.getCellValue(sheet.getRow(1), col + 1));
			ClassDefn c = new ClassDefn(name.trim(), optionNa);
			for(int i = CLASS_BIN_START_ROW; i <= sheet.getLastRowNum(); i++) {
				Row row = sheet.getRow(i);
				String formula = XLSUtilities.getCellValue(row, col);
				if(formula == null) {
					break;
				}
				String label = XLSUtilities.getCellValue(row, col + 1);
				if(label != null) {
					c.addBin(formula.trim(), label);
				}
			}
			if(c.bins.size() > 0) {
				classes.addClass(c);
			} else {
				log.warning("Class " + name + " has no bins");
			}
		}
	}
	
	/*
	 * One tab per row, the plan columns are only needed on the first row of each plan
	 */
	public ArrayList<TabPlan> readPlans(Workbook wb) {
		ArrayList<TabPlan> plans = new ArrayList<TabPlan> ();
		Sheet sheet = wb.getSheet(TABS_SHEET);
		if(sheet == null) {
			log.info("No " + TABS_SHEET + " sheet");
			return plans;
		}
		int headerRow = XLSUtilities.findHeaderRow(sheet, "Row", "Column");
		if(headerRow < 0) {
			log.warning("Could not find the header row of the " + TABS_SHEET + " sheet");
			return plans;
		}
		HashMap<String, Integer> header = XLSUtilities.getHeader(sheet.getRow(headerRow));
		
		TabPlan plan = null;
		for(int i = headerRow + 1; i <= sheet.getLastRowNum(); i++) {
			Row row = sheet.getRow(i);
			if(row == null) {
				continue;
			}
			String planName = XLSUtilities.getColumn(row, "Plan", header, null);
			if(planName != null || plan == null) {
				plan = new TabPlan(planName == null ? DEFAULT_PLAN : planName.trim());
				plan.filterName = XLSUtilities.getColumn(row, "Filter", header, null);
				plan.weightVariable = XLSUtilities.getColumn(row, "Weight", header, null);
				plans.add(plan);
			}
			
			String rowVariable = XLSUtilities.getColumn(row, "Row", header, null);
			String columnVariable = XLSUtilities.getColumn(row, "Column", header, null);
			if(rowVariable == null || columnVariable == null) {
				continue;
			}
			TabDefinition def = new TabDefinition(
					XLSUtilities.getColumn(row, "Title", header, rowVariable + " x " + columnVariable),
					rowVariable.trim(), columnVariable.trim());
			def.secondColumnVariable = XLSUtilities.getColumn(row, "Second column", header, null);
			def.filterName = XLSUtilities.getColumn(row, "Tab filter", header, null);
			def.weightVariable = XLSUtilities.getColumn(row, "Tab weight", header, null);
			def.className = XLSUtilities.getColumn(row, "Class", header, null);
			def.withNa = XLSUtilities.getColumn(row, "With NA", header, "");
			def.displayMode = DisplayMode.fromString(XLSUtilities.getColumn(row, "Display", header, null));
			plan.tabs.add(def);
		}
		return plans;
	}
	
	/*
	 * Write the configuration in the layout that read() expects
	 */
	public void write(StudyConfig config, OutputStream os) throws ApplicationException {
		try (XSSFWorkbook wb = new XSSFWorkbook()) {
			Map<String, CellStyle> styles = XLSUtilities.createStyles(wb);
			writeDataMap(wb, config.dataMap, styles);
			writeRecodes(wb, config.recodes, styles);
			writeFilters(wb, config.filters, styles);
			writeClasses(wb, config.classes, styles);
			writePlans(wb, config.plans, styles);
			wb.write(os);
		} catch (IOException e) {
			throw new ApplicationException("Error writing configuration: " + e.getMessage(), e);
		}
	}
	
	private void writeDataMap(Workbook wb, DataMap dm, Map<String, CellStyle> styles) {
		Sheet sheet = wb.createSheet(DATAMAP_SHEET);
		CellStyle headerStyle = styles.get("header");
		
		int maxCodes = 0;
		for(Question q : dm.getQuestions()) {
			maxCodes = Math.max(maxCodes, q.codes.size());
		}
		Row row = sheet.createRow(0);
		int col = writeHeader(row, headerStyle, "Name", "Type", "Title");
		for(int i = 0; i < maxCodes; i++) {
			XLSUtilities.setCellValue(row, col++, "Code", headerStyle);
			XLSUtilities.setCellValue(row, col++, "Label", headerStyle);
		}
		
		int rowNumber = 1;
		for(Question q : dm.getQuestions()) {
			row = sheet.createRow(rowNumber++);
			XLSUtilities.setCellValue(row, 0, q.name, null);
			XLSUtilities.setCellValue(row, 1, q.type.getTag(), null);
			XLSUtilities.setCellValue(row, 2, q.title, null);
			col = 3;
			for(Map.Entry<Integer, String> code : q.codes.entrySet()) {
				XLSUtilities.setCellValue(row, col++, code.getKey(), null);
				XLSUtilities.setCellValue(row, col++, code.getValue(), null);
			}
		}
	}
	
	private void writeRecodes(Workbook wb, RecodeManager recodes, Map<String, CellStyle> styles) {
		Sheet sheet = wb.createSheet(RECODE_SHEET);
		writeHeader(sheet.createRow(0), styles.get("header"), 
				"Name", "Type", "Title", "Option NA", "Formula", "Code", "Label");
		
		int rowNumber = 1;
		for(Recode r : recodes.getRecodes()) {
			ArrayList<String> lines = getFormulaLines(r);
			ArrayList<Map.Entry<Integer, String>> codes = new ArrayList<Map.Entry<Integer, String>> ();
			if(r.getType() != RecodeType.COMBINATION) {
				codes.addAll(r.getCodes().entrySet());
			}
			int n = Math.max(1, Math.max(lines.size(), codes.size()));
			for(int i = 0; i < n; i++) {
				Row row = sheet.createRow(rowNumber++);
				if(i == 0) {
					XLSUtilities.setCellValue(row, 0, r.name, null);
					XLSUtilities.setCellValue(row, 1, r.getType().getTag(), null);
					XLSUtilities.setCellValue(row, 2, r.title, null);
					XLSUtilities.setCellValue(row, 3, r.includeNulls ? "Yes" : "No", null);
				}
				if(i < lines.size()) {
					XLSUtilities.setCellValue(row, 4, lines.get(i), null);
				}
				if(i < codes.size()) {
					XLSUtilities.setCellValue(row, 5, codes.get(i).getKey(), null);
					XLSUtilities.setCellValue(row, 6, codes.get(i).getValue(), null);
				}
			}
		}
	}
	
	private ArrayList<String> getFormulaLines(Recode r) {
		ArrayList<String> lines = new ArrayList<String> ();
		if(r instanceof WeightRecode) {
			for(WeightCondition w : ((WeightRecode) r).weights) {
				lines.add(w.condition + ": " + GeneralUtilityMethods.formatNumber(w.weight));
			}
		} else {
			for(String line : r.formula.split("\r?\n")) {
				if(StringUtils.isNotBlank(line)) {
					lines.add(line.trim());
				}
			}
			if(r instanceof SubtotalMultiChoiceRecode) {
				for(Map.Entry<Integer, ArrayList<Integer>> st : ((SubtotalMultiChoiceRecode) r).subtotals.entrySet()) {
					lines.add(st.getKey() + ": " + GeneralUtilityMethods.joinCodes(st.getValue()));
				}
			}
		}
		return lines;
	}
	
	private void writeFilters(Workbook wb, FilterManager filters, Map<String, CellStyle> styles) {
		Sheet sheet = wb.createSheet(FILTERS_SHEET);
		writeHeader(sheet.createRow(0), styles.get("header"), "Name", "Formula", "With NA");
		int rowNumber = 1;
		for(Filter f : filters.getFilters()) {
			Row row = sheet.createRow(rowNumber++);
			XLSUtilities.setCellValue(row, 0, f.name, null);
			XLSUtilities.setCellValue(row, 1, f.formula, null);
			XLSUtilities.setCellValue(row, 2, f.includeNulls ? "Yes" : "No", null);
		}
	}
	
	private void writeClasses(Workbook wb, ClassManager classes, Map<String, CellStyle> styles) {
		Sheet sheet = wb.createSheet(CLASSES_SHEET);
		CellStyle headerStyle = styles.get("header");
		Row nameRow = sheet.createRow(0);
		Row naRow = sheet.createRow(1);
		Row binHeaderRow = sheet.createRow(2);
		
		int col = 1;
		for(ClassDefn c : classes.getClasses()) {
			XLSUtilities.setCellValue(nameRow, col, c.name, styles.get("header2"));
			XLSUtilities.setCellValue(naRow, col, "Option NA", null);
			XLSUtilities.setCellValue(naRow, col + 1, c.includeNulls ? "Yes" : "No", null);
			XLSUtilities.setCellValue(binHeaderRow, col, "Formula", headerStyle);
			XLSUtilities.setCellValue(binHeaderRow, col + 1, "Label", headerStyle);
			int rowNumber = CLASS_BIN_START_ROW;
			for(ClassBin b : c.bins) {
				Row row = sheet.getRow(rowNumber);
				if(row == null) {
					row = sheet.createRow(rowNumber);
				}
				rowNumber++;
				XLSUtilities.setCellValue(row, col, b.formula, null);
				XLSUtilities.setCellValue(row, col + 1, b.label, null);
			}
			col += 2;
		}
	}
	
	private void writePlans(Workbook wb, ArrayList<TabPlan> plans, Map<String, CellStyle> styles) {
		Sheet sheet = wb.createSheet(TABS_SHEET);
		writeHeader(sheet.createRow(0), styles.get("header"), "Plan", "Filter", "Weight", "Title", "Row", "Column", 
				"Second column", "Tab filter", "Tab weight", "Class", "With NA", "Display");
		int rowNumber = 1;
		for(TabPlan plan : plans) {
			Row row = sheet.createRow(rowNumber++);
			XLSUtilities.setCellValue(row, 0, plan.name, null);
			XLSUtilities.setCellValue(row, 1, plan.filterName, null);
			XLSUtilities.setCellValue(row, 2, plan.weightVariable, null);
			boolean first = true;
			for(TabDefinition def : plan.tabs) {
				if(!first) {
					row = sheet.createRow(rowNumber++);
				}
				first = false;
				XLSUtilities.setCellValue(row, 3, def.title, null);
				XLSUtilities.setCellValue(row, 4, def.rowVariable, null);
				XLSUtilities.setCellValue(row, 5, def.columnVariable, null);
				XLSUtilities.setCellValue(row, 6, def.secondColumnVariable, null);
				XLSUtilities.setCellValue(row, 7, def.filterName, null);
				XLSUtilities.setCellValue(row, 8, def.weightVariable, null);
				XLSUtilities.setCellValue(row, 9, def.className, null);
				XLSUtilities.setCellValue(row, 10, def.withNa, null);
				XLSUtilities.setCellValue(row, 11, def.displayMode.getName(), null);
			}
		}
	}
	
	private int writeHeader(Row row, CellStyle style, String... names) {
		int col = 0;
		for(String n : names) {
			XLSUtilities.setCellValue(row, col++, n, style);
		}
		return col;
	}
}
