package org.smap.tabs.Utilities;

import java.util.HashMap;
import java.util.Map;

import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormat;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;

public class XLSUtilities {
	
	private static final int HEADER_SEARCH_ROWS = 20;

	/**
	 * create a library of cell styles
	 */
	public static Map<String, CellStyle> createStyles(Workbook wb){

		Map<String, CellStyle> styles = new HashMap<String, CellStyle>();
		DataFormat format = wb.createDataFormat();

		/*
		 * Create fonts
		 */
		Font largeFont = wb.createFont();
		largeFont.setBold(true);
		largeFont.setFontHeightInPoints((short) 14);

		Font boldFont = wb.createFont();
		boldFont.setBold(true);
		
		Font italicFont = wb.createFont();
		italicFont.setItalic(true);
		
		Font redFont = wb.createFont();
		redFont.setColor(IndexedColors.RED.getIndex());
		redFont.setBold(true);

		CellStyle style = wb.createCellStyle();
		style.setFont(boldFont);
		styles.put("header", style);
		
		style = wb.createCellStyle();
		style.setFont(boldFont);
		style.setFillForegroundColor(IndexedColors.CORNFLOWER_BLUE.getIndex());
		style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
		styles.put("header2", style);

		style = wb.createCellStyle();
		style.setFont(largeFont);
		style.setAlignment(HorizontalAlignment.LEFT);
		styles.put("title", style);
		
		style = wb.createCellStyle();
		style.setFont(italicFont);
		styles.put("note", style);

		style = getBaseStyle(wb);
		style.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.index);
		style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
		style.setFont(boldFont);
		styles.put("group", style);

		style = getBaseStyle(wb);
		style.setAlignment(HorizontalAlignment.CENTER);
		styles.put("data", style);
		
		style = getBaseStyle(wb);
		style.setAlignment(HorizontalAlignment.CENTER);
		style.setDataFormat(format.getFormat("0.0"));
		styles.put("numeric", style);
		
		style = getBaseStyle(wb);
		style.setAlignment(HorizontalAlignment.CENTER);
		style.setFont(boldFont);
		style.setDataFormat(format.getFormat("0.0"));
		styles.put("base", style);
		
		style = getBaseStyle(wb);
		style.setAlignment(HorizontalAlignment.CENTER);
		style.setFont(redFont);
		style.setFillForegroundColor(IndexedColors.LIGHT_YELLOW.index);
		style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
		styles.put("significant", style);

		return styles;
	}
	
	private static CellStyle getBaseStyle(Workbook wb) {
		CellStyle style = wb.createCellStyle();
		style.setWrapText(true);
		style.setAlignment(HorizontalAlignment.LEFT);
		style.setBorderBottom(BorderStyle.THIN);
		style.setBottomBorderColor(IndexedColors.BLACK.getIndex());
		style.setBorderLeft(BorderStyle.THIN);
		style.setLeftBorderColor(IndexedColors.BLACK.getIndex());
		style.setBorderRight(BorderStyle.THIN);
		style.setRightBorderColor(IndexedColors.BLACK.getIndex());
		style.setBorderTop(BorderStyle.THIN);
		style.setTopBorderColor(IndexedColors.BLACK.getIndex());
		return style;
	}
	
	/*
	 * Find the header row, the first row that contains all of the names
	 * Returns -1 if there is no such row near the top of the sheet
	 */
	public static int findHeaderRow(Sheet sheet, String... names) {
		for(int i = 0; i < HEADER_SEARCH_ROWS && i <= sheet.getLastRowNum(); i++) {
			Row row = sheet.getRow(i);
			if(row != null) {
				HashMap<String, Integer> header = getHeader(row);
				boolean found = true;
				for(String n : names) {
					if(!header.containsKey(n.toLowerCase())) {
						found = false;
						break;
					}
				}
				if(found) {
					return i;
				}
			}
		}
		return -1;
	}
	
	/*
	 * Get a hashmap of column name and column index
	 * Where a name is repeated the first column is used
	 */
    public static HashMap<String, Integer> getHeader(Row row) {
		HashMap<String, Integer> header = new HashMap<String, Integer> ();
		
        for(int i = 0; i < row.getLastCellNum(); i++) {
            Cell cell = row.getCell(i);
            if(cell != null && cell.getCellType() == CellType.STRING) {
                String name = cell.getStringCellValue();
                if(name != null && name.trim().length() > 0) {
                	name = name.trim().toLowerCase();
                	if(!header.containsKey(name)) {
                		header.put(name, i);
                	}
                }
            }
        }
            
		return header;
	}
	
	/*
	 * Get the value of a cell at the specified column
	 */
	public static String getColumn(Row row, String name, HashMap<String, Integer> header, String def) {
		Integer cellIndex = header.get(name.toLowerCase());
		String value = null;
		if(cellIndex != null && row != null) {
			value = getCellValue(row.getCell(cellIndex));
		} 

		if(value == null) {		// Set to default value if null
			value = def;
		}
		return value;
	}
	
	/*
	 * Get the text of a cell, whole numbers are returned without the decimal point
	 */
	public static String getCellValue(Cell c) {
		String value = null;
		if(c != null) {
			CellType type = c.getCellType();
			if(type == CellType.FORMULA) {
				type = c.getCachedFormulaResultType();
			}
			if(type == CellType.NUMERIC) {
				value = String.valueOf(c.getNumericCellValue());
				if(value.endsWith(".0")) {
					value = value.substring(0, value.lastIndexOf('.'));
				}
			} else if(type == CellType.STRING) {
				value = c.getStringCellValue();
				if(value.trim().length() == 0) {
					value = null;
				}
			} else if(type == CellType.BOOLEAN) {
				value = String.valueOf(c.getBooleanCellValue());
			}
		}
		return value;
	}
	
	public static String getCellValue(Row row, int idx) {
		return row == null ? null : getCellValue(row.getCell(idx));
	}
	
	/*
	 * Write a text value, nothing is written for null
	 */
	public static Cell setCellValue(Row row, int idx, String value, CellStyle style) {
		Cell cell = row.createCell(idx);
		if(value != null) {
			cell.setCellValue(value);
		}
		if(style != null) {
			cell.setCellStyle(style);
		}
		return cell;
	}
	
	public static Cell setCellValue(Row row, int idx, double value, CellStyle style) {
		Cell cell = row.createCell(idx);
		cell.setCellValue(value);
		if(style != null) {
			cell.setCellStyle(style);
		}
		return cell;
	}
	
	public static boolean isYes(String v) {
		return v != null && (v.trim().equalsIgnoreCase("yes") || v.trim().equalsIgnoreCase("true"));
	}
}
