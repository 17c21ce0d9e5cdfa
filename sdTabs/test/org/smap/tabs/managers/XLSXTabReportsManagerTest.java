package org.smap.tabs.managers;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;

import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.smap.tabs.Utilities.XLSUtilities;
import org.smap.tabs.model.DataMap;
import org.smap.tabs.model.DataSet;
import org.smap.tabs.model.DisplayMode;
import org.smap.tabs.model.Question;
import org.smap.tabs.model.QuestionType;
import org.smap.tabs.model.TabDefinition;
import org.smap.tabs.model.TabPlan;
import org.smap.tabs.model.TabResult;

public class XLSXTabReportsManagerTest {
	
	private TabResult result;
	
	@BeforeEach
	void setUp() throws Exception {
		DataMap dm = new DataMap();
		dm.addQuestion(new Question("R", QuestionType.SINGLE_CHOICE, "R").addCode(1, "A").addCode(2, "B"));
		dm.addQuestion(new Question("C", QuestionType.SINGLE_CHOICE, "C").addCode(1, "col1").addCode(2, "col2"));
		
		ArrayList<Object> r = new ArrayList<Object> ();
		ArrayList<Object> c = new ArrayList<Object> ();
		addRows(r, c, 1, 1, 40);
		addRows(r, c, 1, 2, 20);
		addRows(r, c, 2, 1, 20);
		addRows(r, c, 2, 2, 40);
		DataSet data = new DataSet();
		data.addColumn("R", r);
		data.addColumn("C", c);
		
		result = new TabManager(dm, null, null).generateTab(data, new TabDefinition("R x C", "R", "C"), null, null);
	}
	
	private void addRows(ArrayList<Object> r, ArrayList<Object> c, int rv, int cv, int n) {
		for(int i = 0; i < n; i++) {
			r.add(rv);
			c.add(cv);
		}
	}
	
	@Test
	@DisplayName("Counts, base and significance letters are written to the tab sheet")
	void testWrite() throws Exception {
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		new XLSXTabReportsManager().write(Arrays.asList(result, TabResult.empty("Nothing")), os);
		
		try (XSSFWorkbook wb = new XSSFWorkbook(new ByteArrayInputStream(os.toByteArray()))) {
			assertEquals(3, wb.getNumberOfSheets());
			assertEquals(XLSXTabReportsManager.SUMMARY_SHEET, wb.getSheetName(0));
			
			Sheet summary = wb.getSheetAt(0);
			assertEquals("R x C", XLSUtilities.getCellValue(summary.getRow(1), 1));
			assertEquals("120", XLSUtilities.getCellValue(summary.getRow(1), 2));
			assertEquals("0.0", summary.getRow(1).getCell(2).getCellStyle().getDataFormatString());
			assertEquals("0.0", summary.getRow(1).getCell(4).getCellStyle().getDataFormatString());
			assertEquals("No", XLSUtilities.getCellValue(summary.getRow(1), 3));
			assertNotNull(XLSUtilities.getCellValue(summary.getRow(1), 5));
			assertEquals("No data", XLSUtilities.getCellValue(summary.getRow(2), 2));
			
			Sheet tab = wb.getSheet("1 R x C");
			assertNotNull(tab);
			assertEquals("R x C", XLSUtilities.getCellValue(tab.getRow(0), 0));
			assertEquals("Count (column percentage)", XLSUtilities.getCellValue(tab.getRow(1), 0));
			assertEquals("col1 (A)", XLSUtilities.getCellValue(tab.getRow(2), 1));
			assertEquals("Total", XLSUtilities.getCellValue(tab.getRow(2), 3));
			assertEquals("A", XLSUtilities.getCellValue(tab.getRow(3), 0));
			assertEquals("40 (66.7%)", XLSUtilities.getCellValue(tab.getRow(3), 1));
			assertEquals("Total", XLSUtilities.getCellValue(tab.getRow(5), 0));
			assertEquals("Base", XLSUtilities.getCellValue(tab.getRow(6), 0));
			assertEquals("60", XLSUtilities.getCellValue(tab.getRow(6), 1));
			
			assertEquals("Significance (p < 0.05)", XLSUtilities.getCellValue(tab.getRow(8), 0));
			assertEquals("B", XLSUtilities.getCellValue(tab.getRow(9), 1));
			assertEquals("A", XLSUtilities.getCellValue(tab.getRow(10), 2));
			assertNull(XLSUtilities.getCellValue(tab.getRow(9), 2));
			
			Sheet empty = wb.getSheet("2 Nothing");
			assertEquals("No data", XLSUtilities.getCellValue(empty.getRow(1), 0));
		}
	}
	
	@Test
	@DisplayName("The plan display mode is used and the summary can be left out")
	void testWritePlan(@TempDir Path dir) throws Exception {
		TabPlan plan = new TabPlan("Main plan");
		TabDefinition def = new TabDefinition("R x C", "R", "C");
		def.displayMode = DisplayMode.HORIZONTAL;
		plan.tabs.add(def);
		
		File outputDir = dir.resolve("reports").toFile();
		File file = new XLSXTabReportsManager(false).writePlan(plan, Arrays.asList(result), outputDir);
		assertEquals("Main plan.xlsx", file.getName());
		assertTrue(file.exists());
		
		try (XSSFWorkbook wb = new XSSFWorkbook(new FileInputStream(file))) {
			assertEquals(1, wb.getNumberOfSheets());
			Sheet tab = wb.getSheetAt(0);
			assertEquals("Row percentages", XLSUtilities.getCellValue(tab.getRow(1), 0));
			assertEquals("66.7%", XLSUtilities.getCellValue(tab.getRow(3), 1));
		}
	}
}
