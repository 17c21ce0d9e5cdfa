package org.smap.tabs.model;

import java.util.ArrayList;

import org.smap.tabs.Utilities.GeneralUtilityMethods;

/*
 * A class bin predicate such as X>=18 and X<30
 * All comparisons must hold for the value to match
 */
public class BinPredicate {
	public String formula;
	public ArrayList<ConditionOperator> operators = new ArrayList<ConditionOperator> ();
	public ArrayList<Double> limits = new ArrayList<Double> ();
	
	public BinPredicate(String formula) {
		this.formula = formula;
	}
	
	public void addComparison(ConditionOperator op, double limit) {
		operators.add(op);
		limits.add(limit);
	}
	
	public boolean matches(double x) {
		for(int i = 0; i < operators.size(); i++) {
			if(!operators.get(i).test(GeneralUtilityMethods.compareNumbers(x, limits.get(i)))) {
				return false;
			}
		}
		return true;
	}
}
