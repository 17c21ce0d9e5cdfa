package org.smap.tabs.model;

import java.util.ArrayList;

import org.smap.tabs.Utilities.ApplicationException;
import org.smap.tabs.Utilities.FormulaParser;
import org.smap.tabs.Utilities.UnknownVariableException;

/*
 * Arithmetic on other variables, for example ["Price1"] + ["Price2"] or ["Sales"] * 1.2
 */
public class NumericRecode extends Recode {
	
	public NumericRecode(String name, String title, String formula) {
		super(name, title, formula);
	}
	
	@Override
	public RecodeType getType() {
		return RecodeType.NUMERIC;
	}
	
	@Override
	public QuestionType getQuestionType() {
		return QuestionType.NUMERIC;
	}
	
	@Override
	public ArrayList<Object> calculate(DataSet data, SchemaLookup schema) throws ApplicationException {
		NumericExpression expression = FormulaParser.parseNumericExpression(formula);
		
		ArrayList<String> refs = new ArrayList<String> ();
		expression.getReferences(refs);
		for(String ref : refs) {
			if(!schema.hasQuestion(ref) || !data.hasColumn(ref)) {
				throw new UnknownVariableException(ref, formula);
			}
		}
		
		ArrayList<Object> result = new ArrayList<Object> ();
		for(int i = 0; i < data.getRowCount(); i++) {
			result.add(expression.evaluate(data, i));
		}
		return result;
	}
}
