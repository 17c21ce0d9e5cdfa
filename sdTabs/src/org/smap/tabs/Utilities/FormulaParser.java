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
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.smap.tabs.model.BinPredicate;
import org.smap.tabs.model.ConditionOperator;
import org.smap.tabs.model.DataSet;
import org.smap.tabs.model.NumericExpression;
import org.smap.tabs.model.ParsedFormula;
import org.smap.tabs.model.ParsedFormula.JoinOperator;
import org.smap.tabs.model.SchemaLookup;
import org.smap.tabs.model.VariableCondition;

/*
 * Parse and evaluate the formula language
 *  Variable conditions:	["S9"=1], ["Q23A"C1,2,3], ["S9"=1] and ["Q10"C2,3]
 *  Class bins:				X>=1 and X<3
 *  Numeric recodes:		(["Price1"] + ["Price2"]) * 1.2
 */
public class FormulaParser {
	
	private static Logger log =
			 Logger.getLogger(FormulaParser.class.getName());
	
	// Longer operators first so that NCO is not read as NC followed by a value of O
	private static final Pattern CONDITION = Pattern.compile(
			"\\[\"([^\"]+)\"\\s*(NCO|NC|CO|C|!=|>=|<=|=|>|<)\\s*(\"[^\"]*\"|[^\\]]*)\\]");
	
	private static final String BIN_CHARACTERS = "xX0123456789 \t.<>=!-andAND";

	/*
	 * Get the atomic conditions of a formula and the joins between them
	 */
	public static ParsedFormula parseConditions(String formula) throws FormulaParseException {
		ParsedFormula pf = new ParsedFormula(formula);
		if(formula == null) {
			throw new FormulaParseException("No valid conditions found in formula: null");
		}
		
		Matcher m = CONDITION.matcher(formula);
		int lastEnd = -1;
		while(m.find()) {
			if(lastEnd >= 0) {
				pf.joins.add(getJoin(formula.substring(lastEnd, m.start())));
			}
			pf.conditions.add(getCondition(m.group(1), m.group(2), m.group(3).trim(), formula));
			lastEnd = m.end();
		}
		
		if(pf.conditions.isEmpty()) {
			throw new FormulaParseException("No valid conditions found in formula: " + formula);
		}
		return pf;
	}
	
	/*
	 * Evaluate a complete formula, true for each row that matches
	 * Conditions are combined left to right using the join that precedes each one
	 */
	public static boolean [] evaluate(DataSet data, String formula, SchemaLookup schema) throws ApplicationException {
		ParsedFormula pf = parseConditions(formula);
		if(pf.hasMixedJoins()) {
			log.info("Warning: formula mixes and / or, evaluated left to right without precedence: " + formula);
		}
		
		boolean [] result = evaluateCondition(data, pf.conditions.get(0), formula, schema);
		for(int i = 1; i < pf.conditions.size(); i++) {
			boolean [] next = evaluateCondition(data, pf.conditions.get(i), formula, schema);
			JoinOperator join = pf.joins.get(i - 1);
			for(int j = 0; j < result.length; j++) {
				if(join == JoinOperator.OR) {
					result[j] = result[j] || next[j];
				} else {
					result[j] = result[j] && next[j];
				}
			}
		}
		return result;
	}
	
	/*
	 * Evaluate one atomic condition
	 * A missing value never matches, whatever the operator
	 */
	public static boolean [] evaluateCondition(DataSet data, VariableCondition c, String formula, 
			SchemaLookup schema) throws ApplicationException {
		
		if(!schema.hasQuestion(c.variable) || !data.hasColumn(c.variable)) {
			throw new UnknownVariableException(c.variable, formula);
		}
		
		ArrayList<Object> column = data.getColumn(c.variable);
		boolean [] result = new boolean[column.size()];
		TreeSet<Integer> required = c.codes == null ? null : new TreeSet<Integer> (c.codes);
		
		for(int i = 0; i < column.size(); i++) {
			Object v = column.get(i);
			if(GeneralUtilityMethods.isNull(v)) {
				result[i] = false;
			} else if(c.operator.isSetOperator()) {
				result[i] = testSet(c.operator, GeneralUtilityMethods.getCodeSet(v), required);
			} else {
				result[i] = testScalar(c, v);
			}
		}
		return result;
	}
	
	/*
	 * Parse a class bin formula such as X>=1 and X<3
	 */
	public static BinPredicate parseBinPredicate(String formula) throws FormulaParseException {
		if(formula == null || formula.trim().length() == 0) {
			throw new FormulaParseException("Empty class formula");
		}
		for(int i = 0; i < formula.length(); i++) {
			if(BIN_CHARACTERS.indexOf(formula.charAt(i)) < 0) {
				throw new FormulaParseException("Invalid characters in class formula: " + formula);
			}
		}
		
		BinPredicate bp = new BinPredicate(formula);
		ArrayList<String> tokens = tokenizeBin(formula);
		int idx = 0;
		while(true) {
			// X <op> <number>
			if(idx + 2 >= tokens.size()) {
				throw new FormulaParseException("Failed to parse class formula: " + formula);
			}
			if(!tokens.get(idx).equalsIgnoreCase("x")) {
				throw new FormulaParseException("Expected X in class formula: " + formula);
			}
			String opToken = tokens.get(idx + 1);
			ConditionOperator op = opToken.equals("==") ? ConditionOperator.EQUALS : ConditionOperator.fromSymbol(opToken);
			if(op == null || op.isSetOperator()) {
				throw new FormulaParseException("Invalid operator '" + opToken + "' in class formula: " + formula);
			}
			Double limit = GeneralUtilityMethods.toDouble(tokens.get(idx + 2));
			if(limit == null) {
				throw new FormulaParseException("Invalid number '" + tokens.get(idx + 2) + "' in class formula: " + formula);
			}
			bp.addComparison(op, limit);
			idx += 3;
			
			if(idx == tokens.size()) {
				break;
			}
			if(!tokens.get(idx).equalsIgnoreCase("and")) {
				throw new FormulaParseException("Expected 'and' in class formula: " + formula);
			}
			idx++;
		}
		return bp;
	}
	
	/*
	 * Parse the arithmetic expression of a numeric recode
	 * Grammar:
	 *   expression := term (('+' | '-') term)*
	 *   term       := factor (('*' | '/') factor)*
	 *   factor     := number | ["Var"] | '-' factor | '(' expression ')'
	 */
	public static NumericExpression parseNumericExpression(String formula) throws FormulaParseException {
		if(formula == null || formula.trim().length() == 0) {
			throw new FormulaParseException("Empty numeric formula");
		}
		ExpressionReader reader = new ExpressionReader(formula);
		NumericExpression e = reader.expression();
		reader.skipSpace();
		if(!reader.atEnd()) {
			throw new FormulaParseException("Unexpected '" + reader.peek() + "' at position " 
					+ reader.pos + " in formula: " + formula);
		}
		return e;
	}
	
	/*
	 * Get the join operator from the text between two conditions
	 */
	private static JoinOperator getJoin(String text) {
		JoinOperator join = JoinOperator.AND;
		String [] words = text.trim().toLowerCase().split("\\s+");
		for(String w : words) {
			if(w.equals("or")) {
				join = JoinOperator.OR;
				break;
			}
		}
		return join;
	}
	
	private static VariableCondition getCondition(String variable, String opSymbol, String value, 
			String formula) throws FormulaParseException {
		
		ConditionOperator op = ConditionOperator.fromSymbol(opSymbol);
		VariableCondition c = new VariableCondition(variable, op);
		
		if(value.length() == 0) {
			throw new FormulaParseException("Missing value for variable '" + variable + "' in formula: " + formula);
		}
		
		if(op.isSetOperator()) {
			c.codes = new ArrayList<Integer> ();
			for(String t : value.split(",")) {
				t = t.trim();
				if(t.length() > 0) {
					try {
						c.codes.add(GeneralUtilityMethods.parseCode(t, formula));
					} catch (ApplicationException e) {
						throw new FormulaParseException("Invalid code '" + t + "' for variable '" + variable 
								+ "' in formula: " + formula);
					}
				}
			}
			if(c.codes.isEmpty()) {
				throw new FormulaParseException("Missing codes for variable '" + variable + "' in formula: " + formula);
			}
		} else if(value.startsWith("\"") && value.endsWith("\"") && value.length() >= 2) {
			c.text = value.substring(1, value.length() - 1);
		} else {
			c.number = GeneralUtilityMethods.toDouble(value);
			if(c.number == null) {
				throw new FormulaParseException("Invalid value '" + value + "' for variable '" + variable 
						+ "' in formula: " + formula);
			}
		}
		return c;
	}
	
	private static boolean testSet(ConditionOperator op, TreeSet<Integer> selected, TreeSet<Integer> required) {
		boolean any = false;
		for(Integer r : required) {
			if(selected.contains(r)) {
				any = true;
				break;
			}
		}
		switch(op) {
		case CONTAINS:
			return any;
		case NOT_CONTAINS:
			return !any;
		case CONTAINS_ONLY:
			return selected.equals(required);
		case NOT_CONTAINS_ONLY:
			return !selected.equals(required);
		default:
			return false;
		}
	}
	
	private static boolean testScalar(VariableCondition c, Object v) {
		if(c.number != null) {
			Double d = GeneralUtilityMethods.toDouble(v);
			if(d != null) {
				return c.operator.test(GeneralUtilityMethods.compareNumbers(d, c.number));
			}
			// Text cell compared with a number, only equality makes sense
			if(c.operator == ConditionOperator.EQUALS || c.operator == ConditionOperator.NOT_EQUALS) {
				boolean same = v.toString().trim().equals(GeneralUtilityMethods.formatNumber(c.number));
				return c.operator == ConditionOperator.EQUALS ? same : !same;
			}
			return false;
		}
		return c.operator.test(v.toString().trim().compareTo(c.text));
	}
	
	private static ArrayList<String> tokenizeBin(String formula) {
		ArrayList<String> tokens = new ArrayList<String> ();
		int i = 0;
		while(i < formula.length()) {
			char ch = formula.charAt(i);
			if(Character.isWhitespace(ch)) {
				i++;
			} else if(ch == '<' || ch == '>' || ch == '=' || ch == '!') {
				int start = i++;
				if(i < formula.length() && formula.charAt(i) == '=') {
					i++;
				}
				tokens.add(formula.substring(start, i));
			} else if(Character.isDigit(ch) || ch == '.' || ch == '-') {
				int start = i++;
				while(i < formula.length() && (Character.isDigit(formula.charAt(i)) || formula.charAt(i) == '.')) {
					i++;
				}
				tokens.add(formula.substring(start, i));
			} else {
				int start = i++;
				while(i < formula.length() && Character.isLetter(formula.charAt(i))) {
					i++;
				}
				tokens.add(formula.substring(start, i));
			}
		}
		return tokens;
	}
	
	/*
	 * Recursive descent reader for numeric expressions
	 */
	private static class ExpressionReader {
		String in;
		int pos = 0;
		
		ExpressionReader(String in) {
			this.in = in;
		}
		
		NumericExpression expression() throws FormulaParseException {
			NumericExpression e = term();
			skipSpace();
			while(!atEnd() && (peek() == '+' || peek() == '-')) {
				char op = in.charAt(pos++);
				e = new NumericExpression.Binary(op, e, term());
				skipSpace();
			}
			return e;
		}
		
		NumericExpression term() throws FormulaParseException {
			NumericExpression e = factor();
			skipSpace();
			while(!atEnd() && (peek() == '*' || peek() == '/')) {
				char op = in.charAt(pos++);
				e = new NumericExpression.Binary(op, e, factor());
				skipSpace();
			}
			return e;
		}
		
		NumericExpression factor() throws FormulaParseException {
			skipSpace();
			if(atEnd()) {
				throw new FormulaParseException("Unexpected end of formula: " + in);
			}
			char ch = peek();
			if(ch == '-') {
				pos++;
				return new NumericExpression.Negate(factor());
			} else if(ch == '(') {
				pos++;
				NumericExpression e = expression();
				skipSpace();
				if(atEnd() || peek() != ')') {
					throw new FormulaParseException("Missing ')' in formula: " + in);
				}
				pos++;
				return e;
			} else if(ch == '[') {
				int end = in.indexOf("\"]", pos + 2);
				if(pos + 1 >= in.length() || in.charAt(pos + 1) != '"' || end < 0) {
					throw new FormulaParseException("Invalid variable reference at position " + pos + " in formula: " + in);
				}
				String name = in.substring(pos + 2, end);
				pos = end + 2;
				return new NumericExpression.Reference(name);
			} else if(Character.isDigit(ch) || ch == '.') {
				int start = pos;
				while(!atEnd() && (Character.isDigit(peek()) || peek() == '.')) {
					pos++;
				}
				Double d = GeneralUtilityMethods.toDouble(in.substring(start, pos));
				if(d == null) {
					throw new FormulaParseException("Invalid number '" + in.substring(start, pos) + "' in formula: " + in);
				}
				return new NumericExpression.Literal(d);
			}
			throw new FormulaParseException("Unexpected '" + ch + "' at position " + pos + " in formula: " + in);
		}
		
		void skipSpace() {
			while(!atEnd() && Character.isWhitespace(peek())) {
				pos++;
			}
		}
		
		boolean atEnd() {
			return pos >= in.length();
		}
		
		char peek() {
			return in.charAt(pos);
		}
	}
}
