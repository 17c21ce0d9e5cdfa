package org.smap.tabs.model;

import java.util.LinkedHashMap;
import java.util.TreeSet;
import java.util.logging.Logger;

import org.smap.tabs.Utilities.ApplicationException;
import org.smap.tabs.Utilities.GeneralUtilityMethods;

/*
 * A survey variable
 * The codes are only used by single and multiple choice questions
 */
public class Question {
	public String name;
	public QuestionType type;
	public String title;
	public LinkedHashMap<Integer, String> codes = new LinkedHashMap<Integer, String> ();	// code -> label in display order
	
	private static Logger log =
			 Logger.getLogger(Question.class.getName());
	
	public Question(String name, QuestionType type, String title) {
		this.name = name;
		this.type = type;
		this.title = title;
	}
	
	public Question(String name, QuestionType type, String title, LinkedHashMap<Integer, String> codes) {
		this(name, type, title);
		if(codes != null) {
			this.codes.putAll(codes);
		}
	}
	
	public Question addCode(int code, String label) {
		codes.put(code, label);
		return this;
	}
	
	/*
	 * Get the label for a code, the code itself is returned if there is no label
	 */
	public String getLabel(int code) {
		String label = codes.get(code);
		return label == null ? String.valueOf(code) : label;
	}
	
	/*
	 * Check that a single value is acceptable for this question type
	 * Nulls are always valid
	 */
	public boolean isValidValue(Object value) {
		if(GeneralUtilityMethods.isNull(value)) {
			return true;
		}
		
		boolean valid = true;
		if(type == QuestionType.NUMERIC) {
			valid = GeneralUtilityMethods.toDouble(value) != null;
		} else if(type == QuestionType.SINGLE_CHOICE) {
			Double d = GeneralUtilityMethods.toDouble(value);
			valid = d != null && d == Math.rint(d) && codes.containsKey(d.intValue());
		} else if(type == QuestionType.MULTI_CHOICE) {
			if(value instanceof String) {
				try {
					TreeSet<Integer> selected = GeneralUtilityMethods.getCodeSet(value);
					for(Integer c : selected) {
						if(!codes.containsKey(c)) {
							valid = false;
							break;
						}
					}
				} catch (ApplicationException e) {
					log.fine("Invalid multiple choice value for " + name + ": " + value);
					valid = false;
				}
			} else {
				valid = false;
			}
		}
		return valid;
	}
	
	@Override
	public String toString() {
		return "Question(name='" + name + "', type=" + type + ", codes=" + codes.size() + ")";
	}
}
