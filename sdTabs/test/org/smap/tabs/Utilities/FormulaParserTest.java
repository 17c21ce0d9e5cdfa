package org.smap.tabs.Utilities;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.smap.tabs.model.BinPredicate;
import org.smap.tabs.model.ConditionOperator;
import org.smap.tabs.model.DataMap;
import org.smap.tabs.model.DataSet;
import org.smap.tabs.model.NumericExpression;
import org.smap.tabs.model.ParsedFormula;
import org.smap.tabs.model.Question;
import org.smap.tabs.model.QuestionType;

/**
 * Tests for parsing and evaluating conditions, class bins and numeric expressions.
 */
public class FormulaParserTest {
	
	private DataMap dm;
	private DataSet data;
	
	@BeforeEach
	void setUp() {
		dm = new DataMap();
		dm.addQuestion(new Question("S9", QuestionType.SINGLE_CHOICE, "Region")
				.addCode(1, "A").addCode(2, "B").addCode(3, "C"));
		dm.addQuestion(new Question("Q23", QuestionType.MULTI_CHOICE, "Brands")
				.addCode(1, "X").addCode(2, "Y").addCode(3, "Z"));
		dm.addQuestion(new Question("Age", QuestionType.NUMERIC, "Age"));
		dm.addQuestion(new Question("City", QuestionType.OPEN, "City"));
		
		data = new DataSet();
		data.addColumn("S9", 1, 2, 1, 3, 1, 2);
		data.addColumn("Q23", "1,2", "3", null, "1,2,3", "2", "2,1");
		data.addColumn("Age", 25.0, 35.0, null, 18.0, 60.0, 29.9);
		data.addColumn("City", "Paris", "Lyon", "", "Nice", "Paris", null);
	}
	
	@Test
	@DisplayName("Equality filter on a single choice variable")
	void testSingleChoiceEquals() throws Exception {
		boolean [] r = FormulaParser.evaluate(data, "[\"S9\"=1]", dm);
		assertArrayEquals(new boolean [] {true, false, true, false, true, false}, r);
	}
	
	@Test
	@DisplayName("Negative zero compares equal to zero")
	void testNegativeZero() throws Exception {
		dm.addQuestion(new Question("Neg", QuestionType.NUMERIC, "Negated"));
		DataSet d = new DataSet();
		d.addColumn("Neg", -0.0, -2.0);
		
		assertArrayEquals(new boolean[] {true, false}, FormulaParser.evaluate(d, "[\"Neg\"=0]", dm));
		assertArrayEquals(new boolean[] {true, false}, FormulaParser.evaluate(d, "[\"Neg\">=0]", dm));
		assertArrayEquals(new boolean[] {false, true}, FormulaParser.evaluate(d, "[\"Neg\"<0]", dm));
		assertArrayEquals(new boolean[] {false, true}, FormulaParser.evaluate(d, "[\"Neg\"!=0]", dm));
		
		BinPredicate bin = FormulaParser.parseBinPredicate("X>=0 and X<=0");
		assertTrue(bin.matches(-0.0));
		assertFalse(FormulaParser.parseBinPredicate("X<0").matches(-0.0));
	}
	
	@Test
	@DisplayName("Conditions are split with their joins")
	void testParseConditions() throws Exception {
		ParsedFormula pf = FormulaParser.parseConditions("[\"S9\"=1] and [\"Q23\"C2,3] or [\"Age\">=18]");
		assertEquals(3, pf.conditions.size());
		assertEquals(2, pf.joins.size());
		assertEquals(ParsedFormula.JoinOperator.AND, pf.joins.get(0));
		assertEquals(ParsedFormula.JoinOperator.OR, pf.joins.get(1));
		assertTrue(pf.hasMixedJoins());
		
		assertEquals("Q23", pf.conditions.get(1).variable);
		assertEquals(ConditionOperator.CONTAINS, pf.conditions.get(1).operator);
		assertEquals(2, pf.conditions.get(1).codes.size());
		assertEquals(18.0, pf.conditions.get(2).number);
	}
	
	@Test
	@DisplayName("NCO is not read as NC")
	void testLongestOperatorFirst() throws Exception {
		ParsedFormula pf = FormulaParser.parseConditions("[\"Q23\"NCO1,2]");
		assertEquals(ConditionOperator.NOT_CONTAINS_ONLY, pf.conditions.get(0).operator);
	}
	
	@Test
	@DisplayName("A formula without conditions cannot be parsed")
	void testNoConditions() {
		assertThrows(FormulaParseException.class, () -> FormulaParser.parseConditions("S9 = 1"));
		assertThrows(FormulaParseException.class, () -> FormulaParser.parseConditions(null));
		assertThrows(FormulaParseException.class, () -> FormulaParser.parseConditions("[\"Q23\"C]"));
	}
	
	@Test
	@DisplayName("C matches any of the codes, NC none of them")
	void testContains() throws Exception {
		boolean [] c = FormulaParser.evaluate(data, "[\"Q23\"C2,3]", dm);
		assertArrayEquals(new boolean [] {true, true, false, true, true, true}, c);
		
		boolean [] nc = FormulaParser.evaluate(data, "[\"Q23\"NC3]", dm);
		assertArrayEquals(new boolean [] {true, false, false, false, true, true}, nc);
	}
	
	@Test
	@DisplayName("CO matches the exact set of codes whatever their order")
	void testContainsOnly() throws Exception {
		boolean [] co = FormulaParser.evaluate(data, "[\"Q23\"CO1,2]", dm);
		assertArrayEquals(new boolean [] {true, false, false, false, false, true}, co);
		
		boolean [] nco = FormulaParser.evaluate(data, "[\"Q23\"NCO1,2]", dm);
		assertArrayEquals(new boolean [] {false, true, false, true, true, false}, nco);
	}
	
	@Test
	@DisplayName("Missing values never match, for every operator")
	void testNullIsFalse() throws Exception {
		String [] formulas = {
				"[\"Age\"=25]", "[\"Age\"!=25]", "[\"Age\">0]", "[\"Age\"<1000]", "[\"Age\">=0]", "[\"Age\"<=1000]",
				"[\"Q23\"C1]", "[\"Q23\"NC1]", "[\"Q23\"CO1]", "[\"Q23\"NCO1]"};
		for(String f : formulas) {
			boolean [] r = FormulaParser.evaluate(data, f, dm);
			assertFalse(r[2], "Row with missing value matched " + f);
		}
		assertFalse(FormulaParser.evaluate(data, "[\"City\"!=\"Rome\"]", dm)[2]);
		assertFalse(FormulaParser.evaluate(data, "[\"City\"!=\"Rome\"]", dm)[5]);
	}
	
	@Test
	@DisplayName("Numeric comparisons")
	void testNumeric() throws Exception {
		boolean [] r = FormulaParser.evaluate(data, "[\"Age\">=18] and [\"Age\"<30]", dm);
		assertArrayEquals(new boolean [] {true, false, false, true, false, true}, r);
		
		r = FormulaParser.evaluate(data, "[\"Age\"!=35]", dm);
		assertArrayEquals(new boolean [] {true, false, false, true, true, true}, r);
	}
	
	@Test
	@DisplayName("Quoted text values")
	void testText() throws Exception {
		boolean [] r = FormulaParser.evaluate(data, "[\"City\"=\"Paris\"]", dm);
		assertArrayEquals(new boolean [] {true, false, false, false, true, false}, r);
	}
	
	@Test
	@DisplayName("Or combines conditions")
	void testOr() throws Exception {
		boolean [] r = FormulaParser.evaluate(data, "[\"S9\"=3] or [\"S9\"=2]", dm);
		assertArrayEquals(new boolean [] {false, true, false, true, false, true}, r);
	}
	
	@Test
	@DisplayName("Mixed joins are applied left to right")
	void testMixedJoins() throws Exception {
		// (S9=1 or S9=3) and Age>=30
		boolean [] r = FormulaParser.evaluate(data, "[\"S9\"=1] or [\"S9\"=3] and [\"Age\">=30]", dm);
		assertArrayEquals(new boolean [] {false, false, false, false, true, false}, r);
	}
	
	@Test
	@DisplayName("Unknown variables are reported with the formula")
	void testUnknownVariable() {
		UnknownVariableException e = assertThrows(UnknownVariableException.class,
				() -> FormulaParser.evaluate(data, "[\"S9\"=1] and [\"Nope\"=2]", dm));
		assertEquals("Nope", e.variable);
		assertTrue(e.getMessage().contains("[\"Nope\"=2]"));
	}
	
	@Test
	@DisplayName("Class bin predicates")
	void testBinPredicate() throws Exception {
		BinPredicate bp = FormulaParser.parseBinPredicate("X>=18 and X<30");
		assertTrue(bp.matches(18));
		assertTrue(bp.matches(29.99));
		assertFalse(bp.matches(30));
		assertFalse(bp.matches(17));
		
		assertTrue(FormulaParser.parseBinPredicate("x == 5").matches(5));
		assertTrue(FormulaParser.parseBinPredicate("X > -1").matches(0));
		assertTrue(FormulaParser.parseBinPredicate("X != 2").matches(3));
	}
	
	@Test
	@DisplayName("Invalid class bin predicates")
	void testInvalidBinPredicate() {
		FormulaParseException e = assertThrows(FormulaParseException.class, 
				() -> FormulaParser.parseBinPredicate("X >= 1; System.exit(0)"));
		assertTrue(e.getMessage().contains("Invalid characters"));
		assertThrows(FormulaParseException.class, () -> FormulaParser.parseBinPredicate("X >="));
		assertThrows(FormulaParseException.class, () -> FormulaParser.parseBinPredicate("X > 1 and"));
		assertThrows(FormulaParseException.class, () -> FormulaParser.parseBinPredicate("X > 1 X < 3"));
		assertThrows(FormulaParseException.class, () -> FormulaParser.parseBinPredicate(""));
	}
	
	@Test
	@DisplayName("Numeric expressions follow operator precedence")
	void testNumericExpression() throws Exception {
		DataSet d = new DataSet();
		d.addColumn("P1", 10.0, 4.0, null);
		d.addColumn("P2", 5.0, 0.0, 1.0);
		
		NumericExpression e = FormulaParser.parseNumericExpression("([\"P1\"] + [\"P2\"]) * 2 - 1");
		assertEquals(29.0, e.evaluate(d, 0));
		assertNull(e.evaluate(d, 2));
		
		e = FormulaParser.parseNumericExpression("[\"P1\"] + [\"P2\"] * 2");
		assertEquals(20.0, e.evaluate(d, 0));
		
		e = FormulaParser.parseNumericExpression("-[\"P1\"] / [\"P2\"]");
		assertEquals(-2.0, e.evaluate(d, 0));
		assertNull(e.evaluate(d, 1));
	}
	
	@Test
	@DisplayName("Invalid numeric expressions")
	void testInvalidNumericExpression() {
		assertThrows(FormulaParseException.class, () -> FormulaParser.parseNumericExpression("([\"P1\"] + 1"));
		assertThrows(FormulaParseException.class, () -> FormulaParser.parseNumericExpression("[\"P1\"] ^ 2"));
		assertThrows(FormulaParseException.class, () -> FormulaParser.parseNumericExpression("Math.max(1, 2)"));
		assertThrows(FormulaParseException.class, () -> FormulaParser.parseNumericExpression("[P1] + 1"));
		assertThrows(FormulaParseException.class, () -> FormulaParser.parseNumericExpression(" "));
	}
}
