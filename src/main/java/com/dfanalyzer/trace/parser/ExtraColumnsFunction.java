package com.dfanalyzer.trace.parser;

import java.util.Map;

import org.json.JSONObject;

/**
 * Derives additional event columns from the raw event object. Implementations
 * must be stateless; they are called concurrently from parser threads.
 */
@FunctionalInterface
public interface ExtraColumnsFunction {

    /**
     * @return column name to value for this event, never null
     */
    Map<String, Object> extract(JSONObject rawEvent);
}
