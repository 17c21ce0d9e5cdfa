package org.smap.tabs.Utilities;

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
import java.util.TreeSet;

import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.smap.tabs.model.ChiSquareResult;
import org.smap.tabs.model.CrossTable;
import org.smap.tabs.model.SignificanceTable;
import org.smap.tabs.model.SummaryStatistics;

/*
 * Statistical tests run on cross tabs
 */
public class StatisticsUtilities {
	
	public static final double ALPHA = 0.05;
	
	private static final NormalDistribution standardNormal = new NormalDistribution();
	
	/*
	 * Pairwise test of column proportions
	 * Each data cell gets the letters of the columns whose proportion it is significantly higher than
	 * The table must include the Total row which is used as the base of each column
	 */
	public static SignificanceTable columnZTests(CrossTable counts) {
		return columnZTests(counts, ALPHA);
	}
	
	public static SignificanceTable columnZTests(CrossTable counts, double alpha) {
		int rows = counts.getRowCount() - 1;
		int cols = counts.getColumnCount() - 1;
		int baseRow = rows;
		
		ArrayList<String> letters = new ArrayList<String> ();
		for(int j = 0; j < cols; j++) {
			letters.add(GeneralUtilityMethods.getColumnLetter(j));
		}
		
		String [][] markers = new String[rows][cols];
		for(int r = 0; r < rows; r++) {
			for(int i = 0; i < cols; i++) {
				TreeSet<String> higherThan = new TreeSet<String> ();
				for(int j = 0; j < cols; j++) {
					if(i != j && isSignificantlyHigher(counts.getValue(r, i), counts.getValue(baseRow, i),
							counts.getValue(r, j), counts.getValue(baseRow, j), alpha)) {
						higherThan.add(letters.get(j));
					}
				}
				markers[r][i] = String.join("", higherThan);
			}
		}
		
		return new SignificanceTable(counts.getRowLabels().subList(0, rows), 
				counts.getColumnLabels().subList(0, cols), letters, markers);
	}
	
	/*
	 * Two proportion z-test using the pooled proportion
	 */
	public static boolean isSignificantlyHigher(double ci, double ni, double cj, double nj, double alpha) {
		if(ni <= 0 || nj <= 0) {
			return false;
		}
		double pi = ci / ni;
		double pj = cj / nj;
		if(pi <= pj) {
			return false;
		}
		double pPool = (ci + cj) / (ni + nj);
		double se = Math.sqrt(pPool * (1 - pPool) * (1 / ni + 1 / nj));
		if(!(se > 0)) {
			return false;
		}
		double z = (pi - pj) / se;
		double pValue = 2 * (1 - standardNormal.cumulativeProbability(Math.abs(z)));
		return pValue < alpha;
	}
	
	/*
	 * Pearson chi-square test of independence
	 * Rows and columns with a zero total are dropped, null is returned if fewer than 2 remain of either
	 */
	public static ChiSquareResult chiSquareTest(CrossTable counts) {
		CrossTable t = counts.withoutTotals();
		
		ArrayList<Integer> keepRows = new ArrayList<Integer> ();
		ArrayList<Integer> keepCols = new ArrayList<Integer> ();
		double [] rowTotals = new double[t.getRowCount()];
		double [] colTotals = new double[t.getColumnCount()];
		for(int r = 0; r < t.getRowCount(); r++) {
			for(int c = 0; c < t.getColumnCount(); c++) {
				rowTotals[r] += t.getValue(r, c);
				colTotals[c] += t.getValue(r, c);
			}
		}
		for(int r = 0; r < rowTotals.length; r++) {
			if(rowTotals[r] > 0) {
				keepRows.add(r);
			}
		}
		for(int c = 0; c < colTotals.length; c++) {
			if(colTotals[c] > 0) {
				keepCols.add(c);
			}
		}
		
		int df = (keepRows.size() - 1) * (keepCols.size() - 1);
		if(keepRows.size() < 2 || keepCols.size() < 2) {
			return null;
		}
		
		double grandTotal = 0.0;
		for(int r : keepRows) {
			grandTotal += rowTotals[r];
		}
		
		double statistic = 0.0;
		for(int r : keepRows) {
			for(int c : keepCols) {
				double expected = rowTotals[r] * colTotals[c] / grandTotal;
				double diff = t.getValue(r, c) - expected;
				statistic += diff * diff / expected;
			}
		}
		
		ChiSquaredDistribution dist = new ChiSquaredDistribution(df);
		double pValue = 1.0 - dist.cumulativeProbability(statistic);
		return new ChiSquareResult(statistic, pValue, df);
	}
	
	/*
	 * Summarise values, weights may be null
	 * With weights the mean and standard deviation are weighted, the median is not
	 */
	public static SummaryStatistics summarise(double [] values, double [] weights) {
		SummaryStatistics s = new SummaryStatistics();
		s.n = values.length;
		s.weighted = weights != null;
		if(values.length == 0) {
			s.mean = Double.NaN;
			s.median = Double.NaN;
			s.std = Double.NaN;
			s.min = Double.NaN;
			s.max = Double.NaN;
			return s;
		}
		
		s.median = new Median().evaluate(values);
		s.min = StatUtils.min(values);
		s.max = StatUtils.max(values);
		
		if(weights == null) {
			s.mean = StatUtils.mean(values);
			s.std = values.length > 1 ? new StandardDeviation().evaluate(values) : Double.NaN;
		} else {
			double sumW = 0.0;
			double sumWX = 0.0;
			for(int i = 0; i < values.length; i++) {
				sumW += weights[i];
				sumWX += weights[i] * values[i];
			}
			if(sumW > 0) {
				s.mean = sumWX / sumW;
				double sumSq = 0.0;
				for(int i = 0; i < values.length; i++) {
					double d = values[i] - s.mean;
					sumSq += weights[i] * d * d;
				}
				s.std = Math.sqrt(sumSq / sumW);
			} else {
				s.mean = Double.NaN;
				s.std = Double.NaN;
			}
		}
		return s;
	}
}
