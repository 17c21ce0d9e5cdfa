package org.smap.tabs.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;

import org.smap.tabs.Utilities.ApplicationException;
import org.smap.tabs.Utilities.GeneralUtilityMethods;

/*
 * Multiple choice variable with sub totals (INI)
 * Source codes 1 to 5 with sub total 101 = {1,2} and 102 = {3,4,5}: "1,4" -> "1,4,101,102"
 */
public class SubtotalMultiChoiceRecode extends Recode {
	public LinkedHashMap<Integer, String> codes = new LinkedHashMap<Integer, String> ();
	public LinkedHashMap<Integer, ArrayList<Integer>> subtotals = new LinkedHashMap<Integer, ArrayList<Integer>> ();
	
	public SubtotalMultiChoiceRecode(String name, String title, String formula, LinkedHashMap<Integer, String> codes) {
		super(name, title, formula);
		if(codes != null) {
			this.codes.putAll(codes);
		}
	}
	
	public SubtotalMultiChoiceRecode addSubtotal(int code, ArrayList<Integer> members) {
		subtotals.put(code, members);
		return this;
	}
	
	@Override
	public RecodeType getType() {
		return RecodeType.SUBTOTAL_MULTI_CHOICE;
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
		String source = getSourceVariable(data, schema);
		
		ArrayList<Object> result = new ArrayList<Object> ();
		for(Object v : data.getColumn(source)) {
			if(GeneralUtilityMethods.isNull(v)) {
				result.add(null);
				continue;
			}
			TreeSet<Integer> selected = GeneralUtilityMethods.getCodeSet(v);
			TreeSet<Integer> out = new TreeSet<Integer> (selected);
			for(Map.Entry<Integer, ArrayList<Integer>> st : subtotals.entrySet()) {
				for(Integer member : st.getValue()) {
					if(selected.contains(member)) {
						out.add(st.getKey());
						break;
					}
				}
			}
			result.add(GeneralUtilityMethods.joinCodes(out));
		}
		return result;
	}
}
