package org.smap.tabs.Utilities;

/*
 * A variable has the wrong question type for the way it is used
 */
public class TypeMismatchException extends ApplicationException {

	private static final long serialVersionUID = 1L;

	public TypeMismatchException(String msg) {
		super(msg);
	}
}
