package org.smap.tabs.Utilities;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.smap.tabs.model.ChiSquareResult;
import org.smap.tabs.model.CrossTable;
import org.smap.tabs.model.SignificanceTable;
import org.smap.tabs.model.SummaryStatistics;

public class StatisticsUtilitiesTest {
	
	private CrossTable table(List<String> rows, List<String> cols, double [][] values) {
		return new CrossTable(rows, cols, values);
	}
	
	@Test
	@DisplayName("Higher proportions are marked with the letter of the lower column")
	void testColumnZTests() {
		CrossTable counts = table(Arrays.asList("Yes", "No", "Total"), Arrays.asList("Men", "Women", "Total"),
				new double [][] {{40, 20, 60}, {20, 40, 60}, {60, 60, 120}});
		SignificanceTable sig = StatisticsUtilities.columnZTests(counts);
		
		assertEquals(Arrays.asList("A", "B"), sig.getLetters());
		assertEquals(Arrays.asList("Yes", "No"), sig.getRowLabels());
		assertEquals("B", sig.getMarker("Yes", "Men"));
		assertEquals("", sig.getMarker("Yes", "Women"));
		assertEquals("", sig.getMarker("No", "Men"));
		assertEquals("A", sig.getMarker("No", "Women"));
		assertTrue(sig.hasMarkers());
	}
	
	@Test
	@DisplayName("Small differences are not significant")
	void testNotSignificant() {
		CrossTable counts = table(Arrays.asList("A", "B", "Total"), Arrays.asList("c1", "c2", "Total"),
				new double [][] {{10, 5, 15}, {5, 10, 15}, {15, 15, 30}});
		SignificanceTable sig = StatisticsUtilities.columnZTests(counts);
		assertFalse(sig.hasMarkers());
	}
	
	@Test
	@DisplayName("A column is never marked with its own letter and never both ways")
	void testLetterExclusivity() {
		CrossTable counts = table(Arrays.asList("r1", "r2", "r3", "Total"), Arrays.asList("c1", "c2", "c3", "Total"),
				new double [][] {
					{80, 20, 50, 150}, 
					{10, 70, 30, 110}, 
					{10, 10, 20, 40}, 
					{100, 100, 100, 300}});
		SignificanceTable sig = StatisticsUtilities.columnZTests(counts);
		List<String> letters = sig.getLetters();
		
		for(int r = 0; r < 3; r++) {
			for(int i = 0; i < 3; i++) {
				String mi = sig.getMarker(r, i);
				assertFalse(mi.contains(letters.get(i)));
				for(int j = 0; j < 3; j++) {
					if(mi.contains(letters.get(j))) {
						assertFalse(sig.getMarker(r, j).contains(letters.get(i)));
					}
				}
			}
		}
		assertEquals("BC", sig.getMarker(0, 0));
		assertEquals("AC", sig.getMarker(1, 1));
	}
	
	@Test
	@DisplayName("Empty columns are skipped")
	void testZeroBase() {
		CrossTable counts = table(Arrays.asList("r1", "Total"), Arrays.asList("c1", "c2", "Total"),
				new double [][] {{10, 0, 10}, {20, 0, 20}});
		SignificanceTable sig = StatisticsUtilities.columnZTests(counts);
		assertFalse(sig.hasMarkers());
	}
	
	@Test
	void testChiSquare() {
		CrossTable counts = table(Arrays.asList("Yes", "No", "Total"), Arrays.asList("Men", "Women", "Total"),
				new double [][] {{40, 20, 60}, {20, 40, 60}, {60, 60, 120}});
		ChiSquareResult chi = StatisticsUtilities.chiSquareTest(counts);
		assertEquals(40.0 / 3.0, chi.statistic, 1e-9);
		assertEquals(1, chi.degreesOfFreedom);
		assertTrue(chi.pValue < 0.001);
		assertTrue(chi.pValue > 0.0);
	}
	
	@Test
	@DisplayName("Rows and columns without any count are dropped")
	void testChiSquareDropsEmpty() {
		CrossTable counts = table(Arrays.asList("Yes", "No", "Maybe", "Total"), Arrays.asList("Men", "Women", "Other", "Total"),
				new double [][] {{40, 20, 0, 60}, {20, 40, 0, 60}, {0, 0, 0, 0}, {60, 60, 0, 120}});
		ChiSquareResult chi = StatisticsUtilities.chiSquareTest(counts);
		assertEquals(40.0 / 3.0, chi.statistic, 1e-9);
		assertEquals(1, chi.degreesOfFreedom);
	}
	
	@Test
	@DisplayName("No test with a single column")
	void testChiSquareSingleColumn() {
		CrossTable counts = table(Arrays.asList("Yes", "No", "Total"), Arrays.asList("All", "Total"),
				new double [][] {{40, 40}, {20, 20}, {60, 60}});
		assertNull(StatisticsUtilities.chiSquareTest(counts));
	}
	
	@Test
	void testSummary() {
		SummaryStatistics s = StatisticsUtilities.summarise(new double [] {1, 2, 3, 4}, null);
		assertEquals(2.5, s.mean, 1e-9);
		assertEquals(2.5, s.median, 1e-9);
		assertEquals(Math.sqrt(5.0 / 3.0), s.std, 1e-9);
		assertEquals(1.0, s.min);
		assertEquals(4.0, s.max);
		assertEquals(4, s.n);
		assertFalse(s.weighted);
	}
	
	@Test
	@DisplayName("Weighted summary keeps the unweighted median")
	void testWeightedSummary() {
		SummaryStatistics s = StatisticsUtilities.summarise(new double [] {1, 2, 3, 4}, new double [] {1, 1, 1, 3});
		assertEquals(3.0, s.mean, 1e-9);
		assertEquals(Math.sqrt(8.0 / 6.0), s.std, 1e-9);
		assertEquals(2.5, s.median, 1e-9);
		assertTrue(s.weighted);
	}
}
