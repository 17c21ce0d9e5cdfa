package org.smap.tabs.model;

import java.util.ArrayList;

import org.smap.tabs.Utilities.GeneralUtilityMethods;

/*
 * Parsed arithmetic expression of a numeric recode
 * Evaluates to null when a referenced value is missing or on division by zero
 */
public abstract class NumericExpression {
	
	public abstract Double evaluate(DataSet data, int row);
	
	public abstract void getReferences(ArrayList<String> names);
	
	public static class Literal extends NumericExpression {
		double value;
		
		public Literal(double value) {
			this.value = value;
		}
		
		@Override
		public Double evaluate(DataSet data, int row) {
			return value;
		}

		@Override
		public void getReferences(ArrayList<String> names) {
		}
	}
	
	public static class Reference extends NumericExpression {
		String name;
		
		public Reference(String name) {
			this.name = name;
		}
		
		@Override
		public Double evaluate(DataSet data, int row) {
			return GeneralUtilityMethods.toDouble(data.getValue(name, row));
		}
		
		@Override
		public void getReferences(ArrayList<String> names) {
			if(!names.contains(name)) {
				names.add(name);
			}
		}
	}
	
	public static class Negate extends NumericExpression {
		NumericExpression operand;
		
		public Negate(NumericExpression operand) {
			this.operand = operand;
		}
		
		@Override
		public Double evaluate(DataSet data, int row) {
			Double v = operand.evaluate(data, row);
			return v == null ? null : -v;
		}
		
		@Override
		public void getReferences(ArrayList<String> names) {
			operand.getReferences(names);
		}
	}
	
	public static class Binary extends NumericExpression {
		char op;
		NumericExpression left;
		NumericExpression right;
		
		public Binary(char op, NumericExpression left, NumericExpression right) {
			this.op = op;
			this.left = left;
			this.right = right;
		}
		
		@Override
		public Double evaluate(DataSet data, int row) {
			Double l = left.evaluate(data, row);
			Double r = right.evaluate(data, row);
			if(l == null || r == null) {
				return null;
			}
			switch(op) {
			case '+':
				return l + r;
			case '-':
				return l - r;
			case '*':
				return l * r;
			default:
				return r == 0.0 ? null : l / r;
			}
		}
		
		@Override
		public void getReferences(ArrayList<String> names) {
			left.getReferences(names);
			right.getReferences(names);
		}
	}
}
