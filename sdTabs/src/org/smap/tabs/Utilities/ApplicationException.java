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

/*
 * Base class of all errors raised while evaluating formulas, recodes, filters, classes and tabs
 * The context names the recode, filter, class or tab that was being processed
 */
public class ApplicationException extends Exception {

	private static final long serialVersionUID = 1L;
	
	private ArrayList<String> context = new ArrayList<String> ();

	public ApplicationException(String msg) {
		super(msg);
	}
	
	public ApplicationException(String msg, Throwable cause) {
		super(msg, cause);
	}
	
	/*
	 * Add the name of the enclosing item, outermost last
	 */
	public ApplicationException addContext(String c) {
		context.add(0, c);
		return this;
	}
	
	public ArrayList<String> getContext() {
		return context;
	}
	
	/*
	 * The message without any context
	 */
	public String getBaseMessage() {
		return super.getMessage();
	}
	
	@Override
	public String getMessage() {
		if(context.isEmpty()) {
			return super.getMessage();
		}
		StringBuilder sb = new StringBuilder("");
		for(String c : context) {
			sb.append(c).append(": ");
		}
		sb.append(super.getMessage());
		return sb.toString();
	}
}
