package io.codelab.analyzer.python;

import java.util.LinkedHashMap;
import java.util.Map;

/** Size and complexity figures for one module. {@code numFunctions} counts methods too. */
public record CodeStatistics(
        int totalLines,
        int nonEmptyLines,
        int numFunctions,
        int numClasses,
        int numImports,
        int numGlobals,
        double avgComplexity,
        int maxComplexity,
        int functionsWithoutDocstrings) {

    Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("total_lines", totalLines);
        map.put("non_empty_lines", nonEmptyLines);
        map.put("num_functions", numFunctions);
        map.put("num_classes", numClasses);
        map.put("num_imports", numImports);
        map.put("num_globals", numGlobals);
        map.put("avg_complexity", avgComplexity);
        map.put("max_complexity", maxComplexity);
        map.put("functions_without_docstrings", functionsWithoutDocstrings);
        return map;
    }
}
