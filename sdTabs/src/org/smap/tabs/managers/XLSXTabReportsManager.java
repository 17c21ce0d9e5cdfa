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
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import org.apache.commons.io.FileUtils;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.smap.tabs.Utilities.ApplicationException;
import org.smap.tabs.Utilities.StatisticsUtilities;
import org.smap.tabs.Utilities.XLSUtilities;
import org.smap.tabs.model.ChiSquareResult;
import org.smap.tabs.model.CrossTable;
import org.smap.tabs.model.DisplayMode;
import org.smap.tabs.model.SignificanceTable;
import org.smap.tabs.model.TabDefinition;
import org.smap.tabs.model.TabPlan;
import org.smap.tabs.model.TabResult;

/*
 * Write cross tabs to an XLSX workbook, one sheet per tab
 */
public class XLSXTabReportsManager {
	
	private static Logger log =
			 Logger.getLogger(XLSXTabReportsManager.class.getName());
	
	public static final String SUMMARY_SHEET = "Summary";
	
	private boolean includeSummary = true;
	
	public XLSXTabReportsManager() {
	}
	
	public XLSXTabReportsManager(boolean includeSummary) {
		this.includeSummary = includeSummary;
	}
	
	/*
	 * Write the results of a plan to <plan name>.xlsx in the output directory
	 */
	public File writePlan(TabPlan plan, List<TabResult> results, File outputDir) throws ApplicationException {
		ArrayList<DisplayMode> modes = new ArrayList<DisplayMode> ();
		for(TabDefinition def : plan.tabs) {
			modes.add(def.displayMode);
		}
		
		File file = new File(outputDir, WorkbookUtil.createSafeSheetName(plan.name) + ".xlsx");
		try {
			FileUtils.forceMkdir(outputDir);
			try (OutputStream os = new FileOutputStream(file)) {
				write(results, modes, os);
			}
		} catch (IOException e) {
			throw new ApplicationException("Error writing report " + file.getName() + ": " + e.getMessage(), e);
		}
		log.info("Report written to " + file.getAbsolutePath());
		return file;
	}
	
	public void write(List<TabResult> results, OutputStream os) throws ApplicationException {
		write(results, null, os);
	}
	
	/*
	 * The display mode of each tab, Both is used if modes is null
	 */
	public void write(List<TabResult> results, List<DisplayMode> modes, OutputStream os) throws ApplicationException {
		try (XSSFWorkbook wb = new XSSFWorkbook()) {
			Map<String, CellStyle> styles = XLSUtilities.createStyles(wb);
			
			if(includeSummary) {
				writeSummary(wb, results, styles);
			}
			
			int idx = 1;
			for(TabResult result : results) {
				DisplayMode mode = modes != null && idx <= modes.size() ? modes.get(idx - 1) : DisplayMode.BOTH;
				Sheet sheet = wb.createSheet(WorkbookUtil.createSafeSheetName(idx + " " + result.getTitle()));
				writeTab(sheet, result, mode, styles);
				idx++;
			}
			wb.write(os);
		} catch (IOException e) {
			throw new ApplicationException("Error writing report: " + e.getMessage(), e);
		}
	}
	
	private void writeSummary(Workbook wb, List<TabResult> results, Map<String, CellStyle> styles) {
		Sheet sheet = wb.createSheet(SUMMARY_SHEET);
		CellStyle headerStyle = styles.get("header");
		CellStyle numericStyle = styles.get("numeric");
		
		Row row = sheet.createRow(0);
		XLSUtilities.setCellValue(row, 0, "Sheet", headerStyle);
		XLSUtilities.setCellValue(row, 1, "Title", headerStyle);
		XLSUtilities.setCellValue(row, 2, "Base", headerStyle);
		XLSUtilities.setCellValue(row, 3, "Weighted", headerStyle);
		XLSUtilities.setCellValue(row, 4, "Chi-square", headerStyle);
		XLSUtilities.setCellValue(row, 5, "p", headerStyle);
		
		int rowNumber = 1;
		for(TabResult result : results) {
			row = sheet.createRow(rowNumber);
			XLSUtilities.setCellValue(row, 0, rowNumber, null);
			XLSUtilities.setCellValue(row, 1, result.getTitle(), null);
			if(result.isEmpty()) {
				XLSUtilities.setCellValue(row, 2, "No data", styles.get("note"));
			} else {
				CrossTable counts = result.getCounts();
				XLSUtilities.setCellValue(row, 2, counts.getValue(counts.getRowCount() - 1, counts.getColumnCount() - 1), numericStyle);
				XLSUtilities.setCellValue(row, 3, result.isWeighted() ? "Yes" : "No", null);
				ChiSquareResult chi = StatisticsUtilities.chiSquareTest(counts);
				if(chi != null) {
					XLSUtilities.setCellValue(row, 4, chi.statistic, numericStyle);
					XLSUtilities.setCellValue(row, 5, chi.pValue, null);
				}
			}
			rowNumber++;
		}
		sheet.setColumnWidth(1, 40 * 256);
	}
	
	private void writeTab(Sheet sheet, TabResult result, DisplayMode mode, Map<String, CellStyle> styles) {
		int rowNumber = 0;
		Row row = sheet.createRow(rowNumber++);
		XLSUtilities.setCellValue(row, 0, result.getTitle(), styles.get("title"));
		
		if(result.isEmpty()) {
			row = sheet.createRow(rowNumber++);
			XLSUtilities.setCellValue(row, 0, "No data", styles.get("note"));
			return;
		}
		
		row = sheet.createRow(rowNumber++);
		XLSUtilities.setCellValue(row, 0, getModeNote(mode) + (result.isWeighted() ? ", weighted" : ""), styles.get("note"));
		
		CrossTable counts = result.getCounts();
		SignificanceTable significance = result.getSignificance();
		List<String> colLabels = counts.getColumnLabels();
		List<String> rowLabels = counts.getRowLabels();
		
		/*
		 * Column headings, data columns are followed by their significance letter
		 */
		CellStyle groupStyle = styles.get("group");
		row = sheet.createRow(rowNumber++);
		XLSUtilities.setCellValue(row, 0, "", groupStyle);
		for(int c = 0; c < colLabels.size(); c++) {
			String label = colLabels.get(c);
			if(significance != null && c < significance.getLetters().size()) {
				label += " (" + significance.getLetters().get(c) + ")";
			}
			XLSUtilities.setCellValue(row, c + 1, label, groupStyle);
		}
		
		CellStyle dataStyle = styles.get("data");
		for(int r = 0; r < rowLabels.size(); r++) {
			row = sheet.createRow(rowNumber++);
			XLSUtilities.setCellValue(row, 0, rowLabels.get(r), groupStyle);
			for(int c = 0; c < colLabels.size(); c++) {
				XLSUtilities.setCellValue(row, c + 1, result.getDisplayValue(r, c, mode), dataStyle);
			}
		}
		
		row = sheet.createRow(rowNumber++);
		XLSUtilities.setCellValue(row, 0, "Base", groupStyle);
		int c = 1;
		for(Double base : result.getColumnBase().values()) {
			XLSUtilities.setCellValue(row, c++, base, styles.get("base"));
		}
		
		if(significance != null) {
			rowNumber++;
			row = sheet.createRow(rowNumber++);
			XLSUtilities.setCellValue(row, 0, "Significance (p < " + StatisticsUtilities.ALPHA + ")", styles.get("header2"));
			List<String> sigRows = significance.getRowLabels();
			for(int r = 0; r < sigRows.size(); r++) {
				row = sheet.createRow(rowNumber++);
				XLSUtilities.setCellValue(row, 0, sigRows.get(r), groupStyle);
				for(int j = 0; j < significance.getColumnLabels().size(); j++) {
					String marker = significance.getMarker(r, j);
					XLSUtilities.setCellValue(row, j + 1, marker, 
							marker.length() > 0 ? styles.get("significant") : dataStyle);
				}
			}
		}
		
		sheet.setColumnWidth(0, 30 * 256);
		for(int j = 1; j <= colLabels.size(); j++) {
			sheet.setColumnWidth(j, 16 * 256);
		}
	}
	
	private String getModeNote(DisplayMode mode) {
		if(mode == DisplayMode.VERTICAL) {
			return "Column percentages";
		} else if(mode == DisplayMode.HORIZONTAL) {
			return "Row percentages";
		}
		return "Count (column percentage)";
	}
}
