package org.smap.tabs.model;

/*
 * The four kinds of survey variable
 * The tag is the short stable name used in configuration workbooks and json
 */
public enum QuestionType {
	SINGLE_CHOICE("QU"),
	MULTI_CHOICE("QM"),
	NUMERIC("N"),
	OPEN("O");
	
	private final String tag;
	
	QuestionType(String tag) {
		this.tag = tag;
	}
	
	public String getTag() {
		return tag;
	}
	
	public boolean isChoice() {
		return this == SINGLE_CHOICE || this == MULTI_CHOICE;
	}
	
	/*
	 * Accept either the short tag or the long name, unknown types are treated as open text
	 */
	public static QuestionType fromString(String s) {
		QuestionType t = OPEN;
		if(s != null) {
			String v = s.trim().toUpperCase();
			if(v.equals("QU") || v.equals("QUALI UNIQUE")) {
				t = SINGLE_CHOICE;
			} else if(v.equals("QM") || v.equals("QUALI MULTIPLE")) {
				t = MULTI_CHOICE;
			} else if(v.equals("N") || v.equals("NUMERIC")) {
				t = NUMERIC;
			}
		}
		return t;
	}
	
	/*
	 * Strict lookup of the short tag, used when reading json
	 */
	public static QuestionType fromTag(String tag) {
		for(QuestionType t : values()) {
			if(t.tag.equals(tag)) {
				return t;
			}
		}
		throw new IllegalArgumentException("Unknown question type: " + tag);
	}
}
