package org.smap.tabs.model;

import java.util.ArrayList;

/*
 * A single ["<variable>"<operator><value>] condition
 */
public class VariableCondition {
	public String variable;
	public ConditionOperator operator;
	public ArrayList<Integer> codes;	// Set operators
	public Double number;				// Scalar operators with a numeric value
	public String text;					// Scalar operators with a quoted text value
	
	public VariableCondition(String variable, ConditionOperator operator) {
		this.variable = variable;
		this.operator = operator;
	}
	
	@Override
	public String toString() {
		String value;
		if(codes != null) {
			value = codes.toString();
		} else if(number != null) {
			value = number.toString();
		} else {
			value = "\"" + text + "\"";
		}
		return "(" + variable + ", " + operator.getSymbol() + ", " + value + ")";
	}
}
