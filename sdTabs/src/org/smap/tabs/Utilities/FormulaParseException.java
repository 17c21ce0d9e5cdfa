package org.smap.tabs.Utilities;

/*
 * A formula that could not be parsed
 */
public class FormulaParseException extends ApplicationException {

	private static final long serialVersionUID = 1L;

	public FormulaParseException(String msg) {
		super(msg);
	}
}
