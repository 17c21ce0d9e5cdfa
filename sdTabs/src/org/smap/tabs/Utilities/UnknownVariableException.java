package org.smap.tabs.Utilities;

/*
 * A formula references a variable that is not in the data map
 */
public class UnknownVariableException extends ApplicationException {

	private static final long serialVersionUID = 1L;

	public String variable;
	public String formula;

	public UnknownVariableException(String variable, String formula) {
		super("Variable '" + variable + "' not in datamap"
				+ (formula == null ? "" : " (formula: " + formula + ")"));
		this.variable = variable;
		this.formula = formula;
	}
}
