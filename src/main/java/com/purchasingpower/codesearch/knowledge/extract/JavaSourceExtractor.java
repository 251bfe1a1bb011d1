package com.purchasingpower.codesearch.knowledge.extract;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithJavadoc;
import com.github.javaparser.ast.nodeTypes.NodeWithSimpleName;
import com.github.javaparser.javadoc.Javadoc;
import com.purchasingpower.codesearch.core.Symbol;
import com.purchasingpower.codesearch.core.SymbolKind;
import com.purchasingpower.codesearch.exception.SourceParseException;
import com.purchasingpower.codesearch.knowledge.ExtractedFile;
import com.purchasingpower.codesearch.knowledge.LanguageExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JavaParser based extractor for Java sources.
 *
 * <p>Types (classes, interfaces, enums, records) and methods become symbols. Calls
 * made from constructors count for the enclosing type. A parser is created per
 * call because {@link JavaParser} instances are not thread-safe.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class JavaSourceExtractor implements LanguageExtractor {

    @Override
    public String language() {
        return "java";
    }

    @Override
    public Set<String> extensions() {
        return Set.of(".java");
    }

    @Override
    public ExtractedFile extract(String filePath, String content) {
        ParserConfiguration configuration = new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(content);

        CompilationUnit cu = result.getResult()
            .filter(unit -> result.isSuccessful())
            .orElseThrow(() -> new SourceParseException(filePath, firstProblemLine(result),
                result.getProblems().isEmpty()
                    ? "unparseable Java source"
                    : result.getProblems().get(0).getMessage()));

        List<Symbol> symbols = new ArrayList<>();

        for (ImportDeclaration imp : cu.getImports()) {
            String name = imp.getNameAsString() + (imp.isAsterisk() ? ".*" : "");
            symbols.add(Symbol.builder()
                .name(name)
                .kind(SymbolKind.IMPORT)
                .filePath(filePath)
                .lineNumber(lineOf(imp))
                .definition(SourceText.collapse(imp.toString()))
                .build());
        }

        for (TypeDeclaration<?> type : cu.findAll(TypeDeclaration.class)) {
            symbols.add(typeSymbol(filePath, type));
        }
        for (MethodDeclaration method : cu.findAll(MethodDeclaration.class)) {
            symbols.add(methodSymbol(filePath, method));
        }

        symbols.sort(Comparator.comparingInt(Symbol::getLineNumber));
        log.debug("Extracted {} symbols from {}", symbols.size(), filePath);

        return ExtractedFile.builder().symbols(symbols).build();
    }

    private Symbol typeSymbol(String filePath, TypeDeclaration<?> type) {
        Set<String> calls = new LinkedHashSet<>();
        for (ConstructorDeclaration constructor : type.getConstructors()) {
            collectCalls(constructor, calls);
        }
        for (MethodDeclaration method : type.getMethods()) {
            collectCalls(method, calls);
        }
        // Field initializers
        type.getFields().forEach(field -> collectCalls(field, calls));

        String keyword = type.isClassOrInterfaceDeclaration()
            ? (type.asClassOrInterfaceDeclaration().isInterface() ? "interface" : "class")
            : type.isEnumDeclaration() ? "enum"
            : type.isRecordDeclaration() ? "record"
            : "@interface";

        return Symbol.builder()
            .name(type.getNameAsString())
            .kind(SymbolKind.CLASS)
            .filePath(filePath)
            .lineNumber(nameLine(type))
            .definition(SourceText.collapse(type.getModifiers().stream()
                .map(modifier -> modifier.getKeyword().asString())
                .collect(Collectors.joining(" ")) + " " + keyword + " " + type.getNameAsString()))
            .docstring(javadocOf(type))
            .dependencies(new ArrayList<>(calls))
            .build();
    }

    private Symbol methodSymbol(String filePath, MethodDeclaration method) {
        Set<String> calls = new LinkedHashSet<>();
        collectCalls(method, calls);

        return Symbol.builder()
            .name(method.getNameAsString())
            .kind(SymbolKind.FUNCTION)
            .filePath(filePath)
            .lineNumber(nameLine(method))
            .definition(SourceText.collapse(
                method.getDeclarationAsString(true, false, true)))
            .docstring(javadocOf(method))
            .dependencies(new ArrayList<>(calls))
            .build();
    }

    private static void collectCalls(Node node, Set<String> calls) {
        node.findAll(MethodCallExpr.class).forEach(call -> calls.add(call.getNameAsString()));
        node.findAll(ObjectCreationExpr.class).forEach(creation -> calls.add(creation.getType().getNameAsString()));
    }

    private static String javadocOf(NodeWithJavadoc<?> node) {
        return node.getJavadoc()
            .map(Javadoc::getDescription)
            .map(description -> description.toText().strip())
            .filter(text -> !text.isEmpty())
            .orElse(null);
    }

    private static int nameLine(NodeWithSimpleName<?> node) {
        return lineOf(node.getName());
    }

    private static int lineOf(Node node) {
        return node.getBegin().map(position -> position.line).orElse(0);
    }

    private static int firstProblemLine(ParseResult<CompilationUnit> result) {
        return result.getProblems().stream()
            .findFirst()
            .flatMap(Problem::getLocation)
            .flatMap(location -> location.getBegin().getRange())
            .map(range -> range.begin.line)
            .orElse(0);
    }
}
