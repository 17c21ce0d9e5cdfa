package org.smap.tabs.managers;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.smap.tabs.Utilities.ApplicationException;
import org.smap.tabs.model.DataMap;
import org.smap.tabs.model.DataSet;
import org.smap.tabs.model.Question;
import org.smap.tabs.model.QuestionType;

public class CsvDataManagerTest {
	
	private DataMap dm;
	
	@BeforeEach
	void setUp() {
		dm = new DataMap();
		dm.addQuestion(new Question("Gender", QuestionType.SINGLE_CHOICE, "Gender")
				.addCode(1, "Men").addCode(2, "Women"));
		dm.addQuestion(new Question("Age", QuestionType.NUMERIC, "Age"));
		dm.addQuestion(new Question("Brands", QuestionType.MULTI_CHOICE, "Brands")
				.addCode(1, "X").addCode(2, "Y").addCode(3, "Z"));
	}
	
	@Test
	@DisplayName("Values are typed from the data map")
	void testRead() throws Exception {
		String csv = "\uFEFFGender,Age,Brands,Comment\n"
				+ "1,25,\"3,1\",hello\n"
				+ "2,,,\n"
				+ "x,old,2,\n";
		DataSet data = new CsvDataManager(dm).read(new StringReader(csv));
		
		assertEquals(3, data.getRowCount());
		assertEquals(Arrays.asList("Gender", "Age", "Brands", "Comment"), new ArrayList<String> (data.getColumnNames()));
		assertEquals(1, data.getValue("Gender", 0));
		assertEquals(25.0, data.getValue("Age", 0));
		assertEquals("1,3", data.getValue("Brands", 0));
		assertEquals("hello", data.getValue("Comment", 0));
		
		assertNull(data.getValue("Age", 1));
		assertNull(data.getValue("Brands", 1));
		assertNull(data.getValue("Comment", 1));
		
		// Invalid values are kept as text for validation to report
		assertEquals("x", data.getValue("Gender", 2));
		assertEquals("old", data.getValue("Age", 2));
		assertEquals(3, dm.validateData(data).size());
	}
	
	@Test
	void testShortLines() throws Exception {
		DataSet data = new CsvDataManager(dm).read(new StringReader("Gender,Age\n1\n"));
		assertEquals(1, data.getRowCount());
		assertNull(data.getValue("Age", 0));
	}
	
	@Test
	void testEmptyFile() {
		ApplicationException e = assertThrows(ApplicationException.class, 
				() -> new CsvDataManager(dm).read(new StringReader("")));
		assertEquals("Data file is empty", e.getMessage());
	}
	
	@Test
	@DisplayName("Written data reads back with the same values")
	void testWrite(@TempDir Path dir) throws Exception {
		DataSet data = new DataSet();
		data.addColumn("Gender", 1, 2);
		data.addColumn("Age", 30.0, 42.5);
		data.addColumn("Brands", "1,2", null);
		
		CsvDataManager manager = new CsvDataManager(dm);
		StringWriter writer = new StringWriter();
		manager.write(data, writer);
		String csv = writer.toString();
		assertTrue(csv.contains("\"30\""));
		assertTrue(csv.contains("\"42.5\""));
		
		File file = dir.resolve("data.csv").toFile();
		FileUtils.writeStringToFile(file, csv, StandardCharsets.UTF_8);
		DataSet back = manager.read(file);
		assertEquals(2, back.getRowCount());
		assertEquals(2, back.getValue("Gender", 1));
		assertEquals(42.5, back.getValue("Age", 1));
		assertEquals("1,2", back.getValue("Brands", 0));
		assertNull(back.getValue("Brands", 1));
	}
	
	@Test
	void testMissingFile(@TempDir Path dir) {
		ApplicationException e = assertThrows(ApplicationException.class, 
				() -> new CsvDataManager(dm).read(dir.resolve("none.csv").toFile()));
		assertTrue(e.getMessage().startsWith("Error reading data file none.csv"));
	}
}
