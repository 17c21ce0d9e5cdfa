package org.smap.tabs.model;

import java.util.ArrayList;

/*
 * The atomic conditions of a formula and the join between each consecutive pair
 * joins.get(i) combines the result so far with conditions.get(i + 1)
 */
public class ParsedFormula {
	public String formula;
	public ArrayList<VariableCondition> conditions = new ArrayList<VariableCondition> ();
	public ArrayList<JoinOperator> joins = new ArrayList<JoinOperator> ();
	
	public enum JoinOperator {
		AND,
		OR
	}
	
	public ParsedFormula(String formula) {
		this.formula = formula;
	}
	
	public boolean hasMixedJoins() {
		return joins.contains(JoinOperator.AND) && joins.contains(JoinOperator.OR);
	}
}
