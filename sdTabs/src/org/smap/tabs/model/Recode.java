package org.smap.tabs.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.logging.Logger;

import org.smap.tabs.Utilities.ApplicationException;
import org.smap.tabs.Utilities.FormulaParseException;
import org.smap.tabs.Utilities.GeneralUtilityMethods;
import org.smap.tabs.Utilities.TypeMismatchException;
import org.smap.tabs.Utilities.UnknownVariableException;

/*
 * A derived variable
 * Each type of recode calculates a new column from the existing columns, the recode manager
 * then adds the column to the data and a question describing it to the data map
 */
public abstract class Recode {
	public String name;
	public String title;
	public String formula;
	public boolean includeNulls = false;
	
	private static Logger log =
			 Logger.getLogger(Recode.class.getName());
	
	/*
	 * One "<code>: <condition>" line of a choice recode
	 */
	protected static class CodeLine {
		int code;
		String condition;
		
		CodeLine(int code, String condition) {
			this.code = code;
			this.condition = condition;
		}
	}
	
	public Recode(String name, String title, String formula) {
		this.name = name;
		this.title = title == null ? name : title;
		this.formula = formula == null ? "" : formula;
	}
	
	public abstract RecodeType getType();
	
	/*
	 * The type of the question added to the data map for the result
	 */
	public abstract QuestionType getQuestionType();
	
	/*
	 * Calculate the values of the new column, one per row of data
	 */
	public abstract ArrayList<Object> calculate(DataSet data, SchemaLookup schema) throws ApplicationException;
	
	/*
	 * The code table of the result, empty for numeric results
	 */
	public LinkedHashMap<Integer, String> getCodes() {
		return new LinkedHashMap<Integer, String> ();
	}
	
	public ArrayList<String> getReferencedVariables() {
		return GeneralUtilityMethods.getVariableReferences(formula);
	}
	
	/*
	 * Calculate the column and the question that describes it
	 */
	public RecodeResult apply(DataSet data, SchemaLookup schema) throws ApplicationException {
		ArrayList<Object> column = calculate(data, schema);
		Question q = new Question(name, getQuestionType(), title, getCodes());
		return new RecodeResult(name, column, q);
	}
	
	/*
	 * Split a formula into "<code>: <condition>" lines
	 * Lines without a code are ignored
	 */
	protected ArrayList<CodeLine> getCodeLines() throws FormulaParseException {
		ArrayList<CodeLine> lines = new ArrayList<CodeLine> ();
		for(String line : formula.split("\\r?\\n")) {
			line = line.trim();
			if(line.length() == 0) {
				continue;
			}
			int idx = line.indexOf(':');
			if(idx < 0) {
				log.info("Warning: recode " + name + " line has no code and is ignored: " + line);
				continue;
			}
			String codeText = line.substring(0, idx).trim();
			int code;
			try {
				code = GeneralUtilityMethods.parseCode(codeText, line);
			} catch (ApplicationException e) {
				throw new FormulaParseException("Invalid code '" + codeText + "' in line: " + line);
			}
			lines.add(new CodeLine(code, line.substring(idx + 1).trim()));
		}
		return lines;
	}
	
	/*
	 * Get the single multiple choice variable named by the formula
	 */
	protected String getSourceVariable(DataSet data, SchemaLookup schema) throws ApplicationException {
		ArrayList<String> refs = getReferencedVariables();
		if(refs.size() != 1) {
			throw new FormulaParseException("Expected exactly one variable in formula: " + formula);
		}
		String source = refs.get(0);
		Question q = schema.getQuestion(source);
		if(q == null || !data.hasColumn(source)) {
			throw new UnknownVariableException(source, formula);
		}
		if(q.type != QuestionType.MULTI_CHOICE) {
			throw new TypeMismatchException("Variable '" + source + "' must be multiple choice, it is " + q.type);
		}
		return source;
	}
	
	@Override
	public String toString() {
		return getClass().getSimpleName() + "(name='" + name + "', formula='" + formula + "')";
	}
}
