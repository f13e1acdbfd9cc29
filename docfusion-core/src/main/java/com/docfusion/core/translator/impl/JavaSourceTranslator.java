package com.docfusion.core.translator.impl;

import com.docfusion.core.analysis.AnalyzedSourceFile;
import com.docfusion.core.analysis.MessageCollector;
import com.docfusion.core.analysis.PlatformContext;
import com.docfusion.core.analysis.Severity;
import com.docfusion.core.model.Documentable;
import com.docfusion.core.model.DocumentableId;
import com.docfusion.core.model.DocumentableKind;
import com.docfusion.core.model.Module;
import com.docfusion.core.model.PlatformData;
import com.docfusion.core.model.PlatformFacts;
import com.docfusion.core.model.SourceLocation;
import com.docfusion.core.model.Visibility;
import com.docfusion.core.plugin.DocContext;
import com.docfusion.core.translator.FileTranslator;
import com.docfusion.core.util.FileUtils;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.AnnotationMemberDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithAnnotations;
import com.github.javaparser.ast.nodeTypes.NodeWithJavadoc;
import com.github.javaparser.ast.nodeTypes.NodeWithImplements;
import com.github.javaparser.ast.nodeTypes.NodeWithModifiers;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.javadoc.Javadoc;
import com.github.javaparser.javadoc.JavadocBlockTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Translates parsed Java compilation units into documentables.
 *
 * <p><b>Mapping:</b>
 * <ul>
 *   <li>classes, interfaces, enums, records and annotation types become classifiers; nested
 *       types become children of their owner</li>
 *   <li>methods and annotation members become {@code FUNCTION}s, constructors
 *       {@code CONSTRUCTOR}s, fields and record components {@code PROPERTY}s, enum constants
 *       {@code ENUM_ENTRY}s</li>
 *   <li>Javadoc description text becomes documentation; {@code package-info.java} documents
 *       its package</li>
 *   <li>{@code @Deprecated} or a {@code @deprecated} Javadoc tag marks a declaration
 *       deprecated</li>
 *   <li>a {@code @sample} Javadoc tag appends the body of the referenced sample method as a
 *       code block</li>
 *   <li>extended and implemented types are recorded as supertypes, qualified through the
 *       file's single-type imports, {@code java.lang} or else the file's own package</li>
 * </ul>
 *
 * <p>Members of interfaces and annotation types without an access modifier are public;
 * anything else without one is package-private.
 */
public class JavaSourceTranslator implements FileTranslator {

    private static final Logger log = LoggerFactory.getLogger(JavaSourceTranslator.class);

    private static final String PACKAGE_INFO = "package-info.java";

    @Override
    public Module translate(PlatformContext platform, DocContext context) {
        ModuleAssembler assembler = new ModuleAssembler(platform);
        List<AnalyzedSourceFile> files = platform.analysis().sourceFiles();
        SampleIndex samples = new SampleIndex(platform.analysis().sampleFiles());

        for (AnalyzedSourceFile file : files) {
            String packageName = file.packageName();
            assembler.ensurePackage(packageName);

            if (PACKAGE_INFO.equals(file.path().getFileName().toString())) {
                assembler.documentPackage(packageName, packageDocumentation(file));
                continue;
            }

            FileScope scope = new FileScope(platform.platformData(), FileUtils.toUnixPath(file.path()),
                platform.analysis().messageCollector(), packageName, imports(file), samples);
            DocumentableId packageId = DocumentableId.of(packageName);
            for (TypeDeclaration<?> type : file.unit().getTypes()) {
                assembler.add(packageName, translateType(type, packageId, false, scope));
            }
        }

        log.debug("Translated {} Java file(s) for {}", files.size(), platform.platformData());
        return assembler.build();
    }

    private Documentable translateType(TypeDeclaration<?> type, DocumentableId parentId,
                                       boolean implicitlyPublic, FileScope scope) {
        DocumentableKind kind = kindOf(type);
        DocumentableId id = parentId.child(type.getNameAsString(), "");
        boolean publicMembers = kind == DocumentableKind.INTERFACE || kind == DocumentableKind.ANNOTATION;

        Children children = new Children(scope);
        if (type instanceof EnumDeclaration enumDeclaration) {
            for (EnumConstantDeclaration entry : enumDeclaration.getEntries()) {
                children.add(declaration(entry, id, entry.getNameAsString(), "",
                    DocumentableKind.ENUM_ENTRY, Visibility.PUBLIC, scope));
            }
        }
        if (type instanceof RecordDeclaration record) {
            for (Parameter component : record.getParameters()) {
                children.add(declaration(component, id, component.getNameAsString(), "",
                    DocumentableKind.PROPERTY, Visibility.PUBLIC, scope));
            }
        }
        for (BodyDeclaration<?> member : type.getMembers()) {
            translateMember(member, id, type.getNameAsString(), publicMembers, scope).forEach(children::add);
        }

        PlatformFacts facts = facts(type, type, visibility(type, implicitlyPublic), scope)
            .withSupertypes(supertypes(type, scope));
        return new Documentable(id, type.getNameAsString(), kind, Map.of(scope.platform(), facts),
            children.list(), parentId);
    }

    private List<Documentable> translateMember(BodyDeclaration<?> member, DocumentableId ownerId, String ownerName,
                                               boolean publicMembers, FileScope scope) {
        if (member instanceof TypeDeclaration<?> nested) {
            return List.of(translateType(nested, ownerId, publicMembers, scope));
        }
        if (member instanceof MethodDeclaration method) {
            return List.of(callable(method, ownerId, method.getNameAsString(), DocumentableKind.FUNCTION,
                publicMembers, scope));
        }
        if (member instanceof ConstructorDeclaration constructor) {
            return List.of(callable(constructor, ownerId, ownerName, DocumentableKind.CONSTRUCTOR,
                publicMembers, scope));
        }
        if (member instanceof AnnotationMemberDeclaration annotationMember) {
            return List.of(declaration(annotationMember, ownerId, annotationMember.getNameAsString(),
                DocumentableId.signatureOf(List.of()), DocumentableKind.FUNCTION, Visibility.PUBLIC, scope));
        }
        if (member instanceof FieldDeclaration field) {
            Visibility visibility = visibility(field, publicMembers);
            List<Documentable> properties = new ArrayList<>();
            for (VariableDeclarator variable : field.getVariables()) {
                PlatformFacts facts = facts(field, field, visibility, scope, line(variable));
                properties.add(new Documentable(ownerId.child(variable.getNameAsString(), ""),
                    variable.getNameAsString(), DocumentableKind.PROPERTY, Map.of(scope.platform(), facts),
                    List.of(), ownerId));
            }
            return properties;
        }
        return List.of();
    }

    private Documentable callable(CallableDeclaration<?> callable, DocumentableId ownerId, String name,
                                  DocumentableKind kind, boolean publicMembers, FileScope scope) {
        List<String> parameterTypes = new ArrayList<>();
        for (Parameter parameter : callable.getParameters()) {
            String type = parameter.getType().asString();
            parameterTypes.add(parameter.isVarArgs() ? type + "..." : type);
        }
        return declaration(callable, ownerId, name, DocumentableId.signatureOf(parameterTypes), kind,
            visibility(callable, publicMembers), scope);
    }

    private <N extends Node & NodeWithAnnotations<?>> Documentable declaration(
            N node, DocumentableId ownerId, String name, String signature, DocumentableKind kind,
            Visibility visibility, FileScope scope) {
        NodeWithJavadoc<?> javadocHolder = node instanceof NodeWithJavadoc<?> holder ? holder : null;
        PlatformFacts facts = facts(node, javadocHolder, visibility, scope);
        return new Documentable(ownerId.child(name, signature), name, kind, Map.of(scope.platform(), facts),
            List.of(), ownerId);
    }

    private <N extends Node & NodeWithAnnotations<?>> PlatformFacts facts(
            N node, NodeWithJavadoc<?> javadocHolder, Visibility visibility, FileScope scope) {
        return facts(node, javadocHolder, visibility, scope, line(node));
    }

    private PlatformFacts facts(NodeWithAnnotations<?> annotated, NodeWithJavadoc<?> javadocHolder,
                                Visibility visibility, FileScope scope, int line) {
        Optional<Javadoc> javadoc = javadocHolder == null ? Optional.empty() : javadocHolder.getJavadoc();
        String documentation = javadoc
            .map(doc -> withSamples(doc, scope, line))
            .filter(text -> !text.isEmpty())
            .orElse(null);

        List<String> annotations = annotated.getAnnotations().stream()
            .map(AnnotationExpr::getNameAsString)
            .toList();

        boolean deprecated = annotations.contains("Deprecated")
            || annotations.contains("java.lang.Deprecated")
            || javadoc.map(doc -> doc.getBlockTags().stream()
                    .anyMatch(tag -> tag.getType() == JavadocBlockTag.Type.DEPRECATED))
                .orElse(false);

        return new PlatformFacts(documentation, visibility, new SourceLocation(scope.path(), line),
            annotations, deprecated, List.of(), List.of());
    }

    private static String withSamples(Javadoc javadoc, FileScope scope, int line) {
        StringBuilder text = new StringBuilder(javadoc.getDescription().toText().strip());
        for (JavadocBlockTag tag : javadoc.getBlockTags()) {
            if (!SampleIndex.SAMPLE_TAG.equals(tag.getTagName())) {
                continue;
            }
            String reference = tag.getContent().toText().strip();
            Optional<String> sample = scope.samples().render(reference);
            if (sample.isPresent()) {
                if (text.length() > 0) {
                    text.append("\n\n");
                }
                text.append(sample.get());
            } else {
                scope.collector().report(Severity.WARNING, "Unresolved sample reference " + reference,
                    new SourceLocation(scope.path(), line));
            }
        }
        return text.toString();
    }

    private static List<String> supertypes(TypeDeclaration<?> type, FileScope scope) {
        List<ClassOrInterfaceType> declared = new ArrayList<>();
        if (type instanceof ClassOrInterfaceDeclaration classOrInterface) {
            declared.addAll(classOrInterface.getExtendedTypes());
        }
        if (type instanceof NodeWithImplements<?> implementing) {
            declared.addAll(implementing.getImplementedTypes());
        }
        return declared.stream()
            .map(supertype -> qualify(supertype.getNameWithScope(), scope))
            .toList();
    }

    private static String qualify(String name, FileScope scope) {
        int dot = name.indexOf('.');
        String first = dot < 0 ? name : name.substring(0, dot);
        String imported = scope.imports().get(first);
        if (imported != null) {
            return dot < 0 ? imported : imported + name.substring(dot);
        }
        if (dot >= 0 && Character.isLowerCase(first.charAt(0))) {
            return name;
        }
        if (dot < 0 && isJavaLang(name)) {
            return "java.lang." + name;
        }
        return scope.packageName().isEmpty() ? name : scope.packageName() + "." + name;
    }

    private static boolean isJavaLang(String simpleName) {
        try {
            Class.forName("java.lang." + simpleName, false, ClassLoader.getPlatformClassLoader());
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    private static Map<String, String> imports(AnalyzedSourceFile file) {
        Map<String, String> imports = new HashMap<>();
        for (ImportDeclaration declaration : file.unit().getImports()) {
            if (!declaration.isStatic() && !declaration.isAsterisk()) {
                String qualified = declaration.getNameAsString();
                imports.put(qualified.substring(qualified.lastIndexOf('.') + 1), qualified);
            }
        }
        return imports;
    }

    private static DocumentableKind kindOf(TypeDeclaration<?> type) {
        if (type instanceof ClassOrInterfaceDeclaration classOrInterface) {
            return classOrInterface.isInterface() ? DocumentableKind.INTERFACE : DocumentableKind.CLASS;
        }
        if (type instanceof EnumDeclaration) {
            return DocumentableKind.ENUM;
        }
        if (type instanceof RecordDeclaration) {
            return DocumentableKind.RECORD;
        }
        if (type instanceof AnnotationDeclaration) {
            return DocumentableKind.ANNOTATION;
        }
        return DocumentableKind.CLASS;
    }

    private static Visibility visibility(NodeWithModifiers<?> node, boolean implicitlyPublic) {
        if (node.hasModifier(Modifier.Keyword.PUBLIC)) {
            return Visibility.PUBLIC;
        }
        if (node.hasModifier(Modifier.Keyword.PROTECTED)) {
            return Visibility.PROTECTED;
        }
        if (node.hasModifier(Modifier.Keyword.PRIVATE)) {
            return Visibility.PRIVATE;
        }
        return implicitlyPublic ? Visibility.PUBLIC : Visibility.PACKAGE_PRIVATE;
    }

    private static int line(Node node) {
        return node.getBegin().map(position -> position.line).orElse(0);
    }

    private static String packageDocumentation(AnalyzedSourceFile file) {
        // A leading comment is attributed to the compilation unit, not the package declaration
        return file.unit().getPackageDeclaration()
            .flatMap(Node::getComment)
            .or(() -> file.unit().getComment())
            .filter(Comment::isJavadocComment)
            .map(comment -> comment.asJavadocComment().parse().getDescription().toText().strip())
            .filter(text -> !text.isEmpty())
            .orElse(null);
    }

    private record FileScope(PlatformData platform, String path, MessageCollector collector, String packageName,
                             Map<String, String> imports, SampleIndex samples) {}

    private static final class Children {

        private final FileScope scope;
        private final List<Documentable> list = new ArrayList<>();
        private final Set<DocumentableId> ids = new LinkedHashSet<>();

        private Children(FileScope scope) {
            this.scope = scope;
        }

        void add(Documentable child) {
            if (ids.add(child.id())) {
                list.add(child);
            } else {
                int line = child.factsFor(scope.platform()).map(f -> f.location().line()).orElse(0);
                scope.collector().report(Severity.WARNING, "Duplicate declaration " + child.id() + " ignored",
                    new SourceLocation(scope.path(), line));
            }
        }

        List<Documentable> list() {
            return list;
        }
    }
}
