package org.smap.tabs.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.smap.tabs.Utilities.ApplicationException;
import org.smap.tabs.Utilities.FormulaParseException;
import org.smap.tabs.Utilities.FormulaParser;
import org.smap.tabs.Utilities.TypeMismatchException;
import org.smap.tabs.Utilities.UnknownVariableException;

/**
 * Tests for each type of recode.
 */
public class RecodeTest {
	
	private DataMap dm;
	private DataSet data;
	
	@BeforeEach
	void setUp() {
		dm = new DataMap();
		dm.addQuestion(new Question("Age", QuestionType.NUMERIC, "Age"));
		dm.addQuestion(new Question("Country", QuestionType.SINGLE_CHOICE, "Country")
				.addCode(1, "France").addCode(2, "Spain"));
		dm.addQuestion(new Question("Q5", QuestionType.MULTI_CHOICE, "Channels")
				.addCode(1, "TV").addCode(2, "Radio").addCode(3, "Press").addCode(4, "Web"));
		dm.addQuestion(new Question("Price1", QuestionType.NUMERIC, "Price 1"));
		dm.addQuestion(new Question("Price2", QuestionType.NUMERIC, "Price 2"));
		
		data = new DataSet();
		data.addColumn("Age", 25.0, 35.0, null, 17.0);
		data.addColumn("Country", 1, 2, 1, 2);
		data.addColumn("Q5", "1,2,4", "3", null, "2,1");
		data.addColumn("Price1", 10.0, 20.0, 5.0, null);
		data.addColumn("Price2", 2.0, 0.0, 1.0, 1.0);
	}
	
	private LinkedHashMap<Integer, String> codes(String... labels) {
		LinkedHashMap<Integer, String> codes = new LinkedHashMap<Integer, String> ();
		for(int i = 0; i < labels.length; i++) {
			codes.put(i + 1, labels[i]);
		}
		return codes;
	}
	
	@Test
	@DisplayName("Age groups from two condition lines")
	void testSingleChoiceScenario() throws Exception {
		DataSet d = new DataSet();
		d.addColumn("Age", 25, 35);
		SingleChoiceRecode r = new SingleChoiceRecode("AgeGroup", "Age group",
				"1: [\"Age\">=18] and [\"Age\"<30]\n2: [\"Age\">=30]", codes("18-29", "30+"));
		assertEquals(Arrays.asList(1, 2), r.calculate(d, dm));
	}
	
	@Test
	@DisplayName("The first matching line wins")
	void testSingleChoiceFirstMatch() throws Exception {
		SingleChoiceRecode r = new SingleChoiceRecode("R", "R",
				"1: [\"Age\">=30]\n2: [\"Age\">=18]\n3: [\"Country\"=2]", codes("a", "b", "c"));
		assertEquals(Arrays.asList(2, 1, null, 3), r.calculate(data, dm));
	}
	
	@Test
	@DisplayName("The result question carries the type and codes")
	void testApply() throws Exception {
		SingleChoiceRecode r = new SingleChoiceRecode("R", null, "1: [\"Age\">=30]", codes("Old"));
		RecodeResult result = r.apply(data, dm);
		assertEquals("R", result.name);
		assertEquals(QuestionType.SINGLE_CHOICE, result.question.type);
		assertEquals("R", result.question.title);
		assertEquals("Old", result.question.getLabel(1));
		assertEquals(4, result.column.size());
	}
	
	@Test
	@DisplayName("Every matching line adds its code, sorted")
	void testMultiChoice() throws Exception {
		MultiChoiceRecode r = new MultiChoiceRecode("M", "M",
				"3: [\"Q5\"C4]\n1: [\"Q5\"C1,2]\n2: [\"Country\"=1]\n1: [\"Age\">=18]", codes("a", "b", "c"));
		ArrayList<Object> col = r.calculate(data, dm);
		assertEquals("1,2,3", col.get(0));
		assertEquals("1", col.get(1));
		assertEquals("2", col.get(2));
		assertEquals("1", col.get(3));
		assertEquals(QuestionType.MULTI_CHOICE, r.getQuestionType());
	}
	
	@Test
	@DisplayName("No matching line gives a missing value")
	void testMultiChoiceNoMatch() throws Exception {
		MultiChoiceRecode r = new MultiChoiceRecode("M", "M", "1: [\"Age\">100]", codes("a"));
		ArrayList<Object> col = r.calculate(data, dm);
		for(Object v : col) {
			assertNull(v);
		}
	}
	
	@Test
	@DisplayName("Bad codes and bad conditions")
	void testChoiceErrors() {
		SingleChoiceRecode bad = new SingleChoiceRecode("R", "R", "x: [\"Age\">1]", codes("a"));
		assertThrows(FormulaParseException.class, () -> bad.calculate(data, dm));
		
		SingleChoiceRecode unknown = new SingleChoiceRecode("R", "R", "1: [\"Age\">1]\n2: [\"Nope\"=1]", codes("a", "b"));
		UnknownVariableException e = assertThrows(UnknownVariableException.class, () -> unknown.calculate(data, dm));
		assertTrue(e.getMessage().startsWith("line 2: "));
	}
	
	@Test
	void testNumeric() throws Exception {
		NumericRecode r = new NumericRecode("Total", "Total", "[\"Price1\"] * [\"Price2\"] + 1");
		ArrayList<Object> col = r.calculate(data, dm);
		assertEquals(21.0, col.get(0));
		assertEquals(1.0, col.get(1));
		assertEquals(6.0, col.get(2));
		assertNull(col.get(3));
		
		NumericRecode ratio = new NumericRecode("Ratio", "Ratio", "[\"Price1\"] / [\"Price2\"]");
		assertNull(ratio.calculate(data, dm).get(1));
		
		NumericRecode unknown = new NumericRecode("X", "X", "[\"Price3\"] * 2");
		assertThrows(UnknownVariableException.class, () -> unknown.calculate(data, dm));
	}
	
	@Test
	void testNumberOfAnswers() throws Exception {
		NumberOfAnswersRecode r = new NumberOfAnswersRecode("N", "N", "[\"Q5\"]");
		assertEquals(Arrays.asList(3, 1, 0, 2), r.calculate(data, dm));
		assertEquals(QuestionType.NUMERIC, r.getQuestionType());
	}
	
	@Test
	@DisplayName("Every answer is counted, repeated codes included")
	void testNumberOfAnswersRepeated() throws Exception {
		DataSet d = new DataSet();
		d.addColumn("Q5", "1,1,2", "3, ,4", "", null);
		NumberOfAnswersRecode r = new NumberOfAnswersRecode("N", "N", "[\"Q5\"]");
		assertEquals(Arrays.asList(3, 2, 0, 0), r.calculate(d, dm));
	}
	
	@Test
	@DisplayName("A negated zero still matches conditions on zero")
	void testNegatedZero() throws Exception {
		NumericRecode r = new NumericRecode("Neg", "Neg", "[\"Price2\"] * -1");
		DataSet d = new DataSet();
		d.addColumn("Price2", r.calculate(data, dm));
		assertArrayEquals(new boolean[] {false, true, false, false}, 
				FormulaParser.evaluate(d, "[\"Price2\"=0]", dm));
	}
	
	@Test
	@DisplayName("Recodes of a multiple choice variable check the source")
	void testSourceVariable() {
		NumberOfAnswersRecode single = new NumberOfAnswersRecode("N", "N", "[\"Country\"]");
		assertThrows(TypeMismatchException.class, () -> single.calculate(data, dm));
		
		NumberOfAnswersRecode two = new NumberOfAnswersRecode("N", "N", "[\"Q5\"] [\"Country\"]");
		assertThrows(FormulaParseException.class, () -> two.calculate(data, dm));
		
		NumberOfAnswersRecode missing = new NumberOfAnswersRecode("N", "N", "[\"Q9\"]");
		assertThrows(UnknownVariableException.class, () -> missing.calculate(data, dm));
	}
	
	@Test
	@DisplayName("Each observed combination gets a code in sorted order")
	void testCombination() throws Exception {
		DataSet d = new DataSet();
		d.addColumn("Q5", "2", "1,2", null, "2", "1");
		CombinationRecode r = new CombinationRecode("C", "C", "[\"Q5\"]");
		ArrayList<Object> col = r.calculate(d, dm);
		
		assertEquals(Arrays.asList(3, 2, null, 3, 1), col);
		assertEquals(Integer.valueOf(2), r.getCombinationCodes().get("1,2"));
		assertEquals("TV + Radio", r.getCodes().get(2));
		assertEquals("Radio", r.getCodes().get(3));
		assertEquals(QuestionType.SINGLE_CHOICE, r.apply(d, dm).question.type);
	}
	
	@Test
	@DisplayName("Weights start at 1 and later conditions win")
	void testWeight() throws Exception {
		WeightRecode r = new WeightRecode("W", "Weight")
				.addWeight("[\"Country\"=1]", 0.5)
				.addWeight("[\"Age\">=30]", 2.0);
		assertEquals(Arrays.asList(0.5, 2.0, 0.5, 1.0), r.calculate(data, dm));
		assertEquals(Arrays.asList("Country", "Age"), r.getReferencedVariables());
		
		WeightRecode bad = new WeightRecode("W", "W").addWeight("[\"Nope\"=1]", 2.0);
		ApplicationException e = assertThrows(UnknownVariableException.class, () -> bad.calculate(data, dm));
		assertTrue(e.getMessage().contains("weight condition"));
	}
	
	@Test
	@DisplayName("Sub totals are added when any member is selected")
	void testSubtotal() throws Exception {
		SubtotalMultiChoiceRecode r = new SubtotalMultiChoiceRecode("S", "S", "[\"Q5\"]", 
				codes("TV", "Radio", "Press", "Web"));
		r.codes.put(101, "Broadcast");
		r.codes.put(102, "Print and web");
		r.addSubtotal(101, new ArrayList<Integer> (Arrays.asList(1, 2)));
		r.addSubtotal(102, new ArrayList<Integer> (Arrays.asList(3, 4)));
		
		ArrayList<Object> col = r.calculate(data, dm);
		assertEquals("1,2,4,101,102", col.get(0));
		assertEquals("3,102", col.get(1));
		assertNull(col.get(2));
		assertEquals("1,2,101", col.get(3));
		assertEquals("Broadcast", r.apply(data, dm).question.getLabel(101));
	}
	
	@Test
	void testRecodeTypeTags() {
		assertEquals(RecodeType.SINGLE_CHOICE, RecodeType.fromString("quali_unique"));
		assertEquals(RecodeType.SINGLE_CHOICE, RecodeType.fromString("Qualitative unique"));
		assertEquals(RecodeType.MULTI_CHOICE, RecodeType.fromString("quali_multi"));
		assertEquals(RecodeType.SUBTOTAL_MULTI_CHOICE, RecodeType.fromString("Quali Multi INI"));
		assertEquals(RecodeType.NUMBER_OF_ANSWERS, RecodeType.fromString("count"));
		assertEquals(RecodeType.NUMERIC, RecodeType.fromString("numeric"));
		assertEquals(RecodeType.COMBINATION, RecodeType.fromString("combination"));
		assertEquals(RecodeType.WEIGHT, RecodeType.fromString("weight"));
		assertEquals(RecodeType.SINGLE_CHOICE, RecodeType.fromString(null));
	}
}
