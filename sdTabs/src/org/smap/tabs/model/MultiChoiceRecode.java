package org.smap.tabs.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.TreeSet;

import org.smap.tabs.Utilities.ApplicationException;
import org.smap.tabs.Utilities.FormulaParser;
import org.smap.tabs.Utilities.GeneralUtilityMethods;

/*
 * Creates a multiple choice variable
 * Every line that matches adds its code, the result is stored as a sorted list "1,2,3"
 */
public class MultiChoiceRecode extends Recode {
	public LinkedHashMap<Integer, String> codes = new LinkedHashMap<Integer, String> ();
	
	public MultiChoiceRecode(String name, String title, String formula, LinkedHashMap<Integer, String> codes) {
		super(name, title, formula);
		if(codes != null) {
			this.codes.putAll(codes);
		}
	}
	
	@Override
	public RecodeType getType() {
		return RecodeType.MULTI_CHOICE;
	}
	
	@Override
	public QuestionType getQuestionType() {
		return QuestionType.MULTI_CHOICE;
	}
	
	@Override
	public LinkedHashMap<Integer, String> getCodes() {
		return codes;
	}
	
	@Override
	public ArrayList<Object> calculate(DataSet data, SchemaLookup schema) throws ApplicationException {
		ArrayList<TreeSet<Integer>> selections = new ArrayList<TreeSet<Integer>> ();
		for(int i = 0; i < data.getRowCount(); i++) {
			selections.add(new TreeSet<Integer> ());
		}
		
		for(CodeLine line : getCodeLines()) {
			boolean [] mask;
			try {
				mask = FormulaParser.evaluate(data, line.condition, schema);
			} catch (ApplicationException e) {
				throw e.addContext("line " + line.code);
			}
			for(int i = 0; i < mask.length; i++) {
				if(mask[i]) {
					selections.get(i).add(line.code);
				}
			}
		}
		
		ArrayList<Object> result = new ArrayList<Object> ();
		for(TreeSet<Integer> s : selections) {
			result.add(s.isEmpty() ? null : GeneralUtilityMethods.joinCodes(s));
		}
		return result;
	}
}
