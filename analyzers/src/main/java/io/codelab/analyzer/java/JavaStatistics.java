package io.codelab.analyzer.java;

import java.util.LinkedHashMap;
import java.util.Map;

/** Counts for one Java file. {@code numClasses} counts every kind of type declaration, nested ones included. */
public record JavaStatistics(
        String packageName,
        int numClasses,
        int numImports,
        int numMethods,
        int publicMethods,
        int privateMethods,
        int staticMethods) {

    Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("package", packageName);
        map.put("num_classes", numClasses);
        map.put("num_imports", numImports);
        map.put("num_methods", numMethods);
        map.put("public_methods", publicMethods);
        map.put("private_methods", privateMethods);
        map.put("static_methods", staticMethods);
        return map;
    }
}
