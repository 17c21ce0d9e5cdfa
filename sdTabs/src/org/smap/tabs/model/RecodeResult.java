package org.smap.tabs.model;

import java.util.ArrayList;

/*
 * The output of one recode, a new column and the question that describes it
 */
public class RecodeResult {
	public String name;
	public ArrayList<Object> column;
	public Question question;
	
	public RecodeResult(String name, ArrayList<Object> column, Question question) {
		this.name = name;
		this.column = column;
		this.question = question;
	}
}
