package org.smap.tabs.Utilities;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

public class GeneralUtilityMethodsTest {
	
	@Test
	void testIsNull() {
		assertTrue(GeneralUtilityMethods.isNull(null));
		assertTrue(GeneralUtilityMethods.isNull(""));
		assertTrue(GeneralUtilityMethods.isNull("  "));
		assertTrue(GeneralUtilityMethods.isNull(Double.NaN));
		assertFalse(GeneralUtilityMethods.isNull(0));
		assertFalse(GeneralUtilityMethods.isNull("0"));
	}
	
	@Test
	void testCodeSet() throws Exception {
		assertEquals(Arrays.asList(1, 2, 4), new ArrayList<Integer> (GeneralUtilityMethods.getCodeSet("4, 2,1,2")));
		assertEquals(Arrays.asList(3), new ArrayList<Integer> (GeneralUtilityMethods.getCodeSet(3)));
		assertEquals(Arrays.asList(3), new ArrayList<Integer> (GeneralUtilityMethods.getCodeSet("3.0")));
		assertTrue(GeneralUtilityMethods.getCodeSet(null).isEmpty());
		assertThrows(ApplicationException.class, () -> GeneralUtilityMethods.getCodeSet("1,a"));
	}
	
	@Test
	void testJoinCodes() {
		assertEquals("1,2,10", GeneralUtilityMethods.joinCodes(Arrays.asList(10, 2, 1, 2)));
		assertEquals("", GeneralUtilityMethods.joinCodes(new ArrayList<Integer> ()));
	}
	
	@Test
	void testVariableReferences() {
		ArrayList<String> refs = GeneralUtilityMethods.getVariableReferences(
				"1: [\"Age\">=18] and [\"S9\"=1]\n2: [\"Age\"<18]");
		assertEquals(Arrays.asList("Age", "S9"), refs);
		assertTrue(GeneralUtilityMethods.getVariableReferences(null).isEmpty());
	}
	
	@Test
	void testColumnLetter() {
		assertEquals("A", GeneralUtilityMethods.getColumnLetter(0));
		assertEquals("Z", GeneralUtilityMethods.getColumnLetter(25));
		assertEquals("AA", GeneralUtilityMethods.getColumnLetter(26));
		assertEquals("AB", GeneralUtilityMethods.getColumnLetter(27));
	}
	
	@Test
	void testFormatNumber() {
		assertEquals("3", GeneralUtilityMethods.formatNumber(3.0));
		assertEquals("2.5", GeneralUtilityMethods.formatNumber(2.5));
	}
	
	@Test
	void testExceptionContext() {
		ApplicationException e = new FormulaParseException("Bad formula");
		e.addContext("line 2").addContext("Error calculating recode 'R1'");
		assertEquals("Bad formula", e.getBaseMessage());
		assertEquals("Error calculating recode 'R1': line 2: Bad formula", e.getMessage());
		assertEquals(2, e.getContext().size());
	}
}
