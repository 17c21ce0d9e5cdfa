package org.smap.tabs.Utilities;

/*
 * A filter, class or recode name that has not been registered
 */
public class UnknownEntityException extends ApplicationException {

	private static final long serialVersionUID = 1L;

	public UnknownEntityException(String msg) {
		super(msg);
	}
}
