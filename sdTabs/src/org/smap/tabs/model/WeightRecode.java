package org.smap.tabs.model;

import java.util.ArrayList;

import org.smap.tabs.Utilities.ApplicationException;
import org.smap.tabs.Utilities.FormulaParser;
import org.smap.tabs.Utilities.GeneralUtilityMethods;

/*
 * Weighting variable
 *  ["Country"=1] -> 0.62
 *  ["Country"=2] -> 1.36
 * Rows start with a weight of 1.0, where conditions overlap the later one wins
 */
public class WeightRecode extends Recode {
	public ArrayList<WeightCondition> weights = new ArrayList<WeightCondition> ();
	
	public WeightRecode(String name, String title) {
		super(name, title, "");
	}
	
	public WeightRecode addWeight(String condition, double weight) {
		weights.add(new WeightCondition(condition, weight));
		return this;
	}
	
	@Override
	public RecodeType getType() {
		return RecodeType.WEIGHT;
	}
	
	@Override
	public QuestionType getQuestionType() {
		return QuestionType.NUMERIC;
	}
	
	@Override
	public ArrayList<String> getReferencedVariables() {
		ArrayList<String> refs = new ArrayList<String> ();
		for(WeightCondition w : weights) {
			for(String r : GeneralUtilityMethods.getVariableReferences(w.condition)) {
				if(!refs.contains(r)) {
					refs.add(r);
				}
			}
		}
		return refs;
	}
	
	@Override
	public ArrayList<Object> calculate(DataSet data, SchemaLookup schema) throws ApplicationException {
		ArrayList<Object> result = new ArrayList<Object> ();
		for(int i = 0; i < data.getRowCount(); i++) {
			result.add(1.0);
		}
		
		for(WeightCondition w : weights) {
			boolean [] mask;
			try {
				mask = FormulaParser.evaluate(data, w.condition, schema);
			} catch (ApplicationException e) {
				throw e.addContext("weight condition " + w.condition);
			}
			for(int i = 0; i < mask.length; i++) {
				if(mask[i]) {
					result.set(i, w.weight);
				}
			}
		}
		return result;
	}
}
