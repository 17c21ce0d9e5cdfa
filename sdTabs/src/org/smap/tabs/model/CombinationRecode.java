package org.smap.tabs.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.TreeSet;
import java.util.logging.Logger;

import org.smap.tabs.Utilities.ApplicationException;
import org.smap.tabs.Utilities.GeneralUtilityMethods;

/*
 * Convert a multiple choice variable into a single choice variable with one code per combination
 * Codes are assigned to the observed combinations in sorted order, "1" -> 1, "1,2" -> 2, "2" -> 3
 */
public class CombinationRecode extends Recode {
	
	private static Logger log =
			 Logger.getLogger(CombinationRecode.class.getName());
	
	private LinkedHashMap<String, Integer> combinationCodes = new LinkedHashMap<String, Integer> ();
	private LinkedHashMap<Integer, String> codes = new LinkedHashMap<Integer, String> ();
	
	public CombinationRecode(String name, String title, String formula) {
		super(name, title, formula);
	}
	
	@Override
	public RecodeType getType() {
		return RecodeType.COMBINATION;
	}
	
	@Override
	public QuestionType getQuestionType() {
		return QuestionType.SINGLE_CHOICE;
	}
	
	/*
	 * Labels are built from the labels of the source codes once the recode has been calculated
	 */
	@Override
	public LinkedHashMap<Integer, String> getCodes() {
		return codes;
	}
	
	/*
	 * The code assigned to each combination by the last calculation
	 */
	public LinkedHashMap<String, Integer> getCombinationCodes() {
		return combinationCodes;
	}
	
	@Override
	public ArrayList<Object> calculate(DataSet data, SchemaLookup schema) throws ApplicationException {
		String source = getSourceVariable(data, schema);
		Question sourceQuestion = schema.getQuestion(source);
		ArrayList<Object> column = data.getColumn(source);
		
		TreeSet<String> combinations = new TreeSet<String> ();
		for(Object v : column) {
			if(!GeneralUtilityMethods.isNull(v)) {
				combinations.add(v.toString().trim());
			}
		}
		
		combinationCodes = new LinkedHashMap<String, Integer> ();
		codes = new LinkedHashMap<Integer, String> ();
		int code = 1;
		for(String c : combinations) {
			combinationCodes.put(c, code);
			codes.put(code, getCombinationLabel(c, sourceQuestion));
			code++;
		}
		
		ArrayList<Object> result = new ArrayList<Object> ();
		for(Object v : column) {
			result.add(GeneralUtilityMethods.isNull(v) ? null : combinationCodes.get(v.toString().trim()));
		}
		return result;
	}
	
	private String getCombinationLabel(String combination, Question sourceQuestion) {
		StringBuilder sb = new StringBuilder("");
		try {
			for(Integer c : GeneralUtilityMethods.getCodeSet(combination)) {
				if(sb.length() > 0) {
					sb.append(" + ");
				}
				sb.append(sourceQuestion.getLabel(c));
			}
		} catch (ApplicationException e) {
			log.info("Warning: combination " + combination + " of " + name + " is labelled with its value: " + e.getMessage());
			return combination;
		}
		return sb.toString();
	}
}
