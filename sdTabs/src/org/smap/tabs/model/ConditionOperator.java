package org.smap.tabs.model;

/*
 * Operators of an atomic condition
 * The set operators are used with multiple choice questions and take a list of codes
 */
public enum ConditionOperator {
	EQUALS("="),
	NOT_EQUALS("!="),
	GREATER(">"),
	LESS("<"),
	GREATER_EQUALS(">="),
	LESS_EQUALS("<="),
	CONTAINS("C"),
	NOT_CONTAINS("NC"),
	CONTAINS_ONLY("CO"),
	NOT_CONTAINS_ONLY("NCO");
	
	private final String symbol;
	
	ConditionOperator(String symbol) {
		this.symbol = symbol;
	}
	
	public String getSymbol() {
		return symbol;
	}
	
	public boolean isSetOperator() {
		return this == CONTAINS || this == NOT_CONTAINS || this == CONTAINS_ONLY || this == NOT_CONTAINS_ONLY;
	}
	
	public static ConditionOperator fromSymbol(String s) {
		for(ConditionOperator op : values()) {
			if(op.symbol.equals(s)) {
				return op;
			}
		}
		return null;
	}
	
	/*
	 * Apply a scalar comparison to the result of compareTo
	 */
	public boolean test(int cmp) {
		switch(this) {
		case EQUALS:
			return cmp == 0;
		case NOT_EQUALS:
			return cmp != 0;
		case GREATER:
			return cmp > 0;
		case LESS:
			return cmp < 0;
		case GREATER_EQUALS:
			return cmp >= 0;
		case LESS_EQUALS:
			return cmp <= 0;
		default:
			return false;
		}
	}
}
