package org.smap.tabs.model;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.reflect.TypeToken;

/*
 * The catalogue of survey variables, in the order they were added
 * This is the only source of truth for how a column of data is interpreted
 */
public class DataMap implements SchemaLookup {
	
	private static final int VALIDATE_SAMPLE_ROWS = 100;
	
	private LinkedHashMap<String, Question> questions = new LinkedHashMap<String, Question> ();
	
	/*
	 * The json representation of a single question
	 */
	private static class QuestionDefn {
		String type;
		String title;
		LinkedHashMap<Integer, String> codes;
	}
	
	public void addQuestion(Question q) {
		questions.put(q.name, q);
	}
	
	@Override
	public Question getQuestion(String name) {
		return questions.get(name);
	}
	
	@Override
	public boolean hasQuestion(String name) {
		return questions.containsKey(name);
	}
	
	@Override
	public Collection<Question> getQuestions() {
		return questions.values();
	}
	
	@Override
	public int size() {
		return questions.size();
	}
	
	/*
	 * Check that the data matches the data map
	 * Returns a list of problems, an empty list if the data is valid
	 */
	public ArrayList<String> validateData(DataSet data) {
		ArrayList<String> errors = new ArrayList<String> ();
		
		ArrayList<String> missing = new ArrayList<String> ();
		for(String name : questions.keySet()) {
			if(!data.hasColumn(name)) {
				missing.add(name);
			}
		}
		if(missing.size() > 0) {
			errors.add("Missing columns in data: " + missing);
		}
		
		ArrayList<String> extra = new ArrayList<String> ();
		for(String name : data.getColumnNames()) {
			if(!questions.containsKey(name)) {
				extra.add(name);
			}
		}
		if(extra.size() > 0) {
			errors.add("Extra columns in data (ignored): " + extra);
		}
		
		// Only a sample of rows is checked
		int sample = Math.min(VALIDATE_SAMPLE_ROWS, data.getRowCount());
		for(Question q : questions.values()) {
			if(!data.hasColumn(q.name)) {
				continue;
			}
			ArrayList<Object> column = data.getColumn(q.name);
			int invalid = 0;
			for(int i = 0; i < sample; i++) {
				if(!q.isValidValue(column.get(i))) {
					invalid++;
				}
			}
			if(invalid > 0) {
				errors.add("Column '" + q.name + "' has " + invalid + " invalid values (type: " + q.type + ")");
			}
		}
		
		return errors;
	}
	
	/*
	 * Serialise to json as name -> {type, title, codes}
	 */
	public String toJson() {
		LinkedHashMap<String, QuestionDefn> defns = new LinkedHashMap<String, QuestionDefn> ();
		for(Question q : questions.values()) {
			QuestionDefn d = new QuestionDefn();
			d.type = q.type.getTag();
			d.title = q.title;
			d.codes = q.codes;
			defns.put(q.name, d);
		}
		Gson gson = new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();
		return gson.toJson(defns);
	}
	
	public static DataMap fromJson(String json) {
		Gson gson = new GsonBuilder().disableHtmlEscaping().create();
		Type defnType = new TypeToken<LinkedHashMap<String, QuestionDefn>>(){}.getType();
		LinkedHashMap<String, QuestionDefn> defns = gson.fromJson(json, defnType);
		
		DataMap dm = new DataMap();
		if(defns != null) {
			for(Map.Entry<String, QuestionDefn> e : defns.entrySet()) {
				QuestionDefn d = e.getValue();
				dm.addQuestion(new Question(e.getKey(), QuestionType.fromTag(d.type), d.title, d.codes));
			}
		}
		return dm;
	}
	
	@Override
	public String toString() {
		return "DataMap(questions=" + questions.size() + ")";
	}
}
