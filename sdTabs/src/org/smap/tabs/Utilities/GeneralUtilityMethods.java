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
import java.util.Collection;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

public class GeneralUtilityMethods {
	
	/*
	 * Matches the start of any variable reference, either ["Var"] or ["Var"<op><values>]
	 */
	private static final Pattern VARIABLE_REFERENCE = Pattern.compile("\\[\"([^\"]+)\"");
	
	/*
	 * Cells that are null, a NaN double or blank text are missing values
	 */
	public static boolean isNull(Object v) {
		if(v == null) {
			return true;
		} else if(v instanceof Double) {
			return ((Double) v).isNaN();
		} else if(v instanceof String) {
			return StringUtils.isBlank((String) v);
		}
		return false;
	}
	
	/*
	 * Get the numeric value of a cell or null if it is not a number
	 */
	public static Double toDouble(Object v) {
		Double d = null;
		if(v instanceof Number) {
			d = ((Number) v).doubleValue();
			if(d.isNaN()) {
				d = null;
			}
		} else if(v instanceof String) {
			String s = ((String) v).trim();
			if(s.length() > 0) {
				try {
					d = Double.parseDouble(s);
				} catch (NumberFormatException e) {
					d = null;
				}
			}
		} else if(v instanceof Boolean) {
			d = ((Boolean) v) ? 1.0 : 0.0;
		}
		return d;
	}
	
	/*
	 * Get the set of codes selected in a multiple choice cell
	 * A single number is treated as a single selected code
	 */
	public static TreeSet<Integer> getCodeSet(Object v) throws ApplicationException {
		TreeSet<Integer> codes = new TreeSet<Integer> ();
		if(isNull(v)) {
			return codes;
		}
		if(v instanceof Number) {
			codes.add(((Number) v).intValue());
		} else {
			String [] tokens = v.toString().split(",");
			for(String t : tokens) {
				t = t.trim();
				if(t.length() > 0) {
					codes.add(parseCode(t, v.toString()));
				}
			}
		}
		return codes;
	}
	
	/*
	 * Parse a single code, "3" and "3.0" are both accepted
	 */
	public static int parseCode(String t, String source) throws ApplicationException {
		try {
			return Integer.parseInt(t);
		} catch (NumberFormatException e) {
			Double d = toDouble(t);
			if(d != null && d == Math.rint(d)) {
				return d.intValue();
			}
			throw new ApplicationException("Invalid code '" + t + "' in: " + source);
		}
	}
	
	/*
	 * Serialise codes as a sorted comma separated list
	 */
	public static String joinCodes(Collection<Integer> codes) {
		TreeSet<Integer> sorted = new TreeSet<Integer> (codes);
		StringBuilder sb = new StringBuilder("");
		for(Integer c : sorted) {
			if(sb.length() > 0) {
				sb.append(",");
			}
			sb.append(c);
		}
		return sb.toString();
	}
	
	/*
	 * Get the names of the variables referenced in a formula, in order of first use
	 */
	public static ArrayList<String> getVariableReferences(String formula) {
		ArrayList<String> names = new ArrayList<String> ();
		if(formula != null) {
			Matcher m = VARIABLE_REFERENCE.matcher(formula);
			while(m.find()) {
				String name = m.group(1);
				if(!names.contains(name)) {
					names.add(name);
				}
			}
		}
		return names;
	}
	
	/*
	 * Column letter used for significance markers, 0 -> A
	 */
	public static String getColumnLetter(int idx) {
		StringBuilder sb = new StringBuilder("");
		int n = idx;
		do {
			sb.insert(0, (char) ('A' + (n % 26)));
			n = n / 26 - 1;
		} while(n >= 0);
		return sb.toString();
	}
	
	/*
	 * Compare two numbers with -0.0 equal to 0.0
	 */
	public static int compareNumbers(double a, double b) {
		return Double.compare(a + 0.0, b + 0.0);
	}

	/*
	 * Format a number without a trailing .0 when it is a whole number
	 */
	public static String formatNumber(double d) {
		if(d == Math.rint(d) && !Double.isInfinite(d)) {
			return String.valueOf((long) d);
		}
		return String.valueOf(d);
	}
}
