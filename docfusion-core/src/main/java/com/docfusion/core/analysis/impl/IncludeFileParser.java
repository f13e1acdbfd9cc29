package com.docfusion.core.analysis.impl;

import com.docfusion.core.analysis.IncludedDocumentation;
import com.docfusion.core.analysis.IncludedDocumentation.Scope;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits include files into module and package documentation.
 *
 * <p>Text before the first {@code # Module} or {@code # Package} heading is ignored.
 */
final class IncludeFileParser {

    private static final Pattern HEADING = Pattern.compile("^#\\s+(Module|Package)\\s+(\\S*)\\s*$");

    private IncludeFileParser() {
        // Utility class
    }

    static List<IncludedDocumentation> parse(List<String> lines) {
        List<IncludedDocumentation> result = new ArrayList<>();
        Scope scope = null;
        String name = null;
        StringBuilder text = new StringBuilder();

        for (String line : lines) {
            Matcher matcher = HEADING.matcher(line);
            if (matcher.matches()) {
                if (scope != null) {
                    result.add(new IncludedDocumentation(scope, name, text.toString()));
                }
                scope = "Module".equals(matcher.group(1)) ? Scope.MODULE : Scope.PACKAGE;
                name = matcher.group(2);
                text.setLength(0);
            } else if (scope != null) {
                text.append(line).append('\n');
            }
        }
        if (scope != null) {
            result.add(new IncludedDocumentation(scope, name, text.toString()));
        }
        return result;
    }
}
