package com.docfusion.core.translator.impl;

import com.docfusion.core.analysis.AnalyzedSourceFile;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Method bodies of the sample files of one pass, looked up by {@code @sample} references.
 *
 * <p>A reference names the method by qualified type and method name, either as
 * {@code com.example.CacheSamples#put} or {@code com.example.CacheSamples.put}. Overloads share
 * a reference; the first declared wins.
 */
final class SampleIndex {

    static final String SAMPLE_TAG = "sample";

    private final Map<String, String> bodies = new HashMap<>();

    SampleIndex(List<AnalyzedSourceFile> sampleFiles) {
        for (AnalyzedSourceFile file : sampleFiles) {
            String prefix = file.packageName().isEmpty() ? "" : file.packageName() + ".";
            for (TypeDeclaration<?> type : file.unit().getTypes()) {
                index(type, prefix + type.getNameAsString());
            }
        }
    }

    private void index(TypeDeclaration<?> type, String qualifiedName) {
        for (MethodDeclaration method : type.getMethods()) {
            method.getBody().ifPresent(body -> bodies.putIfAbsent(qualifiedName + "." + method.getNameAsString(),
                body.getStatements().stream().map(Node::toString).collect(Collectors.joining("\n"))));
        }
        for (BodyDeclaration<?> member : type.getMembers()) {
            if (member instanceof TypeDeclaration<?> nested) {
                index(nested, qualifiedName + "." + nested.getNameAsString());
            }
        }
    }

    /**
     * Renders the body of the referenced sample as a Java code fence.
     *
     * @param reference {@code @sample} tag content
     * @return code fence, if the reference resolves
     */
    Optional<String> render(String reference) {
        String key = reference.strip().replace('#', '.');
        return Optional.ofNullable(bodies.get(key))
            .map(body -> "```java\n" + body + "\n```");
    }
}
