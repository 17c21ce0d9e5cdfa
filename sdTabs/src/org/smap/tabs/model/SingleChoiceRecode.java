package org.smap.tabs.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;

import org.smap.tabs.Utilities.ApplicationException;
import org.smap.tabs.Utilities.FormulaParser;

/*
 * Creates a single choice variable
 *  1: ["Age">=18] and ["Age"<30]
 *  2: ["Age">=30]
 * Each row gets the code of the first line that matches, rows that match no line are missing
 */
public class SingleChoiceRecode extends Recode {
	public LinkedHashMap<Integer, String> codes = new LinkedHashMap<Integer, String> ();
	
	public SingleChoiceRecode(String name, String title, String formula, LinkedHashMap<Integer, String> codes) {
		super(name, title, formula);
		if(codes != null) {
			this.codes.putAll(codes);
		}
	}
	
	@Override
	public RecodeType getType() {
		return RecodeType.SINGLE_CHOICE;
	}
	
	@Override
	public QuestionType getQuestionType() {
		return QuestionType.SINGLE_CHOICE;
	}
	
	@Override
	public LinkedHashMap<Integer, String> getCodes() {
		return codes;
	}
	
	@Override
	public ArrayList<Object> calculate(DataSet data, SchemaLookup schema) throws ApplicationException {
		ArrayList<Object> result = new ArrayList<Object> ();
		for(int i = 0; i < data.getRowCount(); i++) {
			result.add(null);
		}
		
		for(CodeLine line : getCodeLines()) {
			boolean [] mask;
			try {
				mask = FormulaParser.evaluate(data, line.condition, schema);
			} catch (ApplicationException e) {
				throw e.addContext("line " + line.code);
			}
			for(int i = 0; i < mask.length; i++) {
				if(mask[i] && result.get(i) == null) {
					result.set(i, line.code);
				}
			}
		}
		return result;
	}
}
