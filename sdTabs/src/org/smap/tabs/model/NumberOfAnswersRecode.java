package org.smap.tabs.model;

import java.util.ArrayList;

import org.apache.commons.lang3.StringUtils;
import org.smap.tabs.Utilities.ApplicationException;
import org.smap.tabs.Utilities.GeneralUtilityMethods;

/*
 * Count the answers given to a multiple choice question
 * ["Q23A"]: "1,2,3" -> 3, "1,1" -> 2, missing -> 0
 */
public class NumberOfAnswersRecode extends Recode {
	
	public NumberOfAnswersRecode(String name, String title, String formula) {
		super(name, title, formula);
	}
	
	@Override
	public RecodeType getType() {
		return RecodeType.NUMBER_OF_ANSWERS;
	}
	
	@Override
	public QuestionType getQuestionType() {
		return QuestionType.NUMERIC;
	}
	
	@Override
	public ArrayList<Object> calculate(DataSet data, SchemaLookup schema) throws ApplicationException {
		String source = getSourceVariable(data, schema);
		
		ArrayList<Object> result = new ArrayList<Object> ();
		for(Object v : data.getColumn(source)) {
			int count = 0;
			if(!GeneralUtilityMethods.isNull(v)) {
				for(String token : v.toString().split(",")) {
					if(StringUtils.isNotBlank(token)) {
						count++;
					}
				}
			}
			result.add(count);
		}
		return result;
	}
}
