package org.smap.tabs.model;

import java.util.Collection;

/*
 * Read only view of the data map
 * Filters, classes and tabs only get this view, the recode manager gets the DataMap itself
 */
public interface SchemaLookup {
	
	Question getQuestion(String name);
	
	boolean hasQuestion(String name);
	
	Collection<Question> getQuestions();
	
	int size();
}
