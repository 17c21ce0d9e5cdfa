package org.smap.tabs.model;

/*
 * Recode types, the tag is the name used in the Recode worksheet
 */
public enum RecodeType {
	SINGLE_CHOICE("quali_unique"),
	MULTI_CHOICE("quali_multi"),
	NUMERIC("numeric"),
	NUMBER_OF_ANSWERS("number_of_answers"),
	COMBINATION("combination"),
	WEIGHT("weight"),
	SUBTOTAL_MULTI_CHOICE("quali_multi_ini");
	
	private final String tag;
	
	RecodeType(String tag) {
		this.tag = tag;
	}
	
	public String getTag() {
		return tag;
	}
	
	/*
	 * Map the type text of a configuration workbook, default is single choice
	 */
	public static RecodeType fromString(String s) {
		RecodeType t = SINGLE_CHOICE;
		if(s != null) {
			String v = s.trim().toLowerCase().replace(' ', '_');
			if(v.contains("quali_unique") || v.contains("qualitative_unique")) {
				t = SINGLE_CHOICE;
			} else if(v.contains("quali_multi") && v.contains("ini")) {
				t = SUBTOTAL_MULTI_CHOICE;
			} else if(v.contains("quali_multi") || v.contains("qualitative_multi")) {
				t = MULTI_CHOICE;
			} else if(v.contains("number_of_answer") || v.contains("count")) {
				t = NUMBER_OF_ANSWERS;
			} else if(v.contains("numeric")) {
				t = NUMERIC;
			} else if(v.contains("combination")) {
				t = COMBINATION;
			} else if(v.contains("weight")) {
				t = WEIGHT;
			}
		}
		return t;
	}
}
