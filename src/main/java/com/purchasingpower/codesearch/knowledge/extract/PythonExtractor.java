package com.purchasingpower.codesearch.knowledge.extract;

import com.purchasingpower.codesearch.core.Symbol;
import com.purchasingpower.codesearch.core.SymbolKind;
import com.purchasingpower.codesearch.exception.SourceParseException;
import com.purchasingpower.codesearch.knowledge.ExtractedFile;
import com.purchasingpower.codesearch.knowledge.LanguageExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Python extractor backed by the tree-sitter Python grammar.
 *
 * <p>Extracts {@code def}, {@code async def} and {@code class} definitions at any
 * nesting depth, {@code import} and {@code from ... import} statements, and the
 * direct and attribute calls made in each definition body. A call inside a nested
 * definition also counts for every enclosing definition. Calls in a definition
 * header (decorators, default values, base class expressions) belong to the
 * enclosing scope, which at module level means the file's top-level calls.
 *
 * <p>Any {@code ERROR} or missing node in the tree is reported as a
 * {@link SourceParseException}.
 */
@Slf4j
@Component
public class PythonExtractor implements LanguageExtractor {

    private static final TSLanguage PY_LANGUAGE = new TreeSitterPython();

    // TSParser is not threadsafe, so each extraction thread gets its own
    private static final ThreadLocal<TSParser> PARSER = ThreadLocal.withInitial(() -> {
        TSParser parser = new TSParser();
        if (!parser.setLanguage(PY_LANGUAGE)) {
            throw new IllegalStateException("Failed to set tree-sitter Python language on parser");
        }
        return parser;
    });

    @Override
    public String language() {
        return "python";
    }

    @Override
    public Set<String> extensions() {
        return Set.of(".py", ".pyi");
    }

    @Override
    public ExtractedFile extract(String filePath, String content) {
        String src = content.replace("\r\n", "\n").replace('\r', '\n');
        if (!src.isEmpty() && src.charAt(0) == '\uFEFF') {
            src = src.substring(1);
        }
        if (src.isBlank()) {
            return ExtractedFile.empty();
        }

        TSTree tree = PARSER.get().parseString(null, src);
        TSNode root = tree.getRootNode();
        if (root.isNull()) {
            throw new SourceParseException(filePath, 1, "parser produced no syntax tree");
        }
        if (root.hasError()) {
            throw syntaxError(filePath, root, src.getBytes(StandardCharsets.UTF_8));
        }

        ExtractedFile extracted = new TreeWalker(filePath, src.getBytes(StandardCharsets.UTF_8)).walk(root);
        log.debug("Extracted {} symbols from {}", extracted.getSymbols().size(), filePath);
        return extracted;
    }

    private static SourceParseException syntaxError(String filePath, TSNode root, byte[] bytes) {
        TSNode bad = firstBadNode(root);
        if (bad == null) {
            return new SourceParseException(filePath, 1, "invalid syntax");
        }
        int line = bad.getStartPoint().getRow() + 1;
        if (bad.isMissing()) {
            return new SourceParseException(filePath, line, "missing '" + bad.getType() + "'");
        }
        String near = slice(bytes, bad).lines().findFirst().orElse("").strip();
        return new SourceParseException(filePath, line,
            near.isEmpty() ? "invalid syntax" : "invalid syntax near '" + near + "'");
    }

    private static TSNode firstBadNode(TSNode node) {
        if ("ERROR".equals(node.getType()) || node.isMissing()) {
            return node;
        }
        if (!node.hasError()) {
            return null;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode found = firstBadNode(node.getChild(i));
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    static String slice(byte[] bytes, TSNode node) {
        return new String(bytes, node.getStartByte(), node.getEndByte() - node.getStartByte(), StandardCharsets.UTF_8);
    }

    /**
     * Dedent a docstring the way {@code inspect.cleandoc} does.
     */
    static String cleanDocstring(String raw) {
        String[] lines = raw.replace("\t", "        ").split("\n", -1);
        int margin = Integer.MAX_VALUE;
        for (int i = 1; i < lines.length; i++) {
            String stripped = lines[i].stripLeading();
            if (!stripped.isEmpty()) {
                margin = Math.min(margin, lines[i].length() - stripped.length());
            }
        }

        List<String> cleaned = new ArrayList<>();
        cleaned.add(lines[0].strip());
        for (int i = 1; i < lines.length; i++) {
            String current = lines[i];
            if (margin == Integer.MAX_VALUE || current.length() < margin) {
                cleaned.add(current.strip());
            } else {
                cleaned.add(current.substring(margin).stripTrailing());
            }
        }
        while (!cleaned.isEmpty() && cleaned.get(0).isEmpty()) {
            cleaned.remove(0);
        }
        while (!cleaned.isEmpty() && cleaned.get(cleaned.size() - 1).isEmpty()) {
            cleaned.remove(cleaned.size() - 1);
        }
        return cleaned.isEmpty() ? null : String.join("\n", cleaned);
    }

    private static final class PendingSymbol {
        final Symbol.SymbolBuilder builder;
        final Set<String> calls = new LinkedHashSet<>();

        PendingSymbol(Symbol.SymbolBuilder builder) {
            this.builder = builder;
        }

        Symbol build() {
            return builder.dependencies(new ArrayList<>(calls)).build();
        }
    }

    /**
     * Single-use walk over one parsed file.
     */
    private static final class TreeWalker {

        private final String filePath;
        private final byte[] bytes;
        private final List<PendingSymbol> symbols = new ArrayList<>();
        private final Set<String> topLevelCalls = new LinkedHashSet<>();

        TreeWalker(String filePath, byte[] bytes) {
            this.filePath = filePath;
            this.bytes = bytes;
        }

        ExtractedFile walk(TSNode root) {
            visit(root, List.of());

            ExtractedFile.ExtractedFileBuilder result = ExtractedFile.builder();
            symbols.forEach(pending -> result.symbol(pending.build()));
            result.topLevelCalls(new ArrayList<>(topLevelCalls));
            return result.build();
        }

        /**
         * Visit {@code node} with {@code scopes} being the definitions whose body encloses it, innermost last.
         */
        private void visit(TSNode node, List<PendingSymbol> scopes) {
            switch (node.getType()) {
                case "function_definition", "class_definition" -> {
                    visitDefinition(node, scopes);
                    return;
                }
                case "import_statement" -> {
                    visitImport(node);
                    return;
                }
                case "import_from_statement", "future_import_statement" -> {
                    visitFromImport(node);
                    return;
                }
                case "call" -> recordCall(node, scopes);
                default -> {
                }
            }
            visitChildren(node, scopes);
        }

        private void visitChildren(TSNode node, List<PendingSymbol> scopes) {
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                visit(node.getNamedChild(i), scopes);
            }
        }

        private void visitDefinition(TSNode node, List<PendingSymbol> scopes) {
            TSNode name = node.getChildByFieldName("name");
            TSNode body = node.getChildByFieldName("body");
            boolean isClass = "class_definition".equals(node.getType());

            PendingSymbol symbol = new PendingSymbol(Symbol.builder()
                .name(text(name))
                .kind(isClass ? SymbolKind.CLASS : SymbolKind.FUNCTION)
                .filePath(filePath)
                .lineNumber(name.getStartPoint().getRow() + 1)
                .definition(SourceText.collapse(header(node, body)))
                .docstring(docstringOf(body)));
            symbols.add(symbol);

            List<PendingSymbol> inner = new ArrayList<>(scopes);
            inner.add(symbol);
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                TSNode child = node.getNamedChild(i);
                if (child.getStartByte() == body.getStartByte() && child.getType().equals(body.getType())) {
                    visitChildren(child, inner);
                } else if (child.getStartByte() != name.getStartByte()) {
                    visit(child, scopes);
                }
            }
        }

        /**
         * Header text from the start of the definition through its {@code :}.
         */
        private String header(TSNode definition, TSNode body) {
            for (int i = 0; i < definition.getChildCount(); i++) {
                TSNode child = definition.getChild(i);
                if (":".equals(child.getType())) {
                    return new String(bytes, definition.getStartByte(),
                        child.getEndByte() - definition.getStartByte(), StandardCharsets.UTF_8);
                }
            }
            return new String(bytes, definition.getStartByte(),
                body.getStartByte() - definition.getStartByte(), StandardCharsets.UTF_8);
        }

        /**
         * Docstring formed by the first statement of {@code body}, or {@code null}
         * when that statement is not a plain string literal.
         */
        private String docstringOf(TSNode body) {
            TSNode first = null;
            for (int i = 0; i < body.getNamedChildCount(); i++) {
                TSNode child = body.getNamedChild(i);
                if (!"comment".equals(child.getType())) {
                    first = child;
                    break;
                }
            }
            if (first == null || !"expression_statement".equals(first.getType()) || first.getNamedChildCount() != 1) {
                return null;
            }

            TSNode literal = first.getNamedChild(0);
            StringBuilder value = new StringBuilder();
            if ("string".equals(literal.getType())) {
                if (!appendStringContent(literal, value)) {
                    return null;
                }
            } else if ("concatenated_string".equals(literal.getType())) {
                for (int i = 0; i < literal.getNamedChildCount(); i++) {
                    TSNode part = literal.getNamedChild(i);
                    if ("string".equals(part.getType()) && !appendStringContent(part, value)) {
                        return null;
                    }
                }
            } else {
                return null;
            }
            return cleanDocstring(value.toString());
        }

        /**
         * Append the raw text between the quotes; byte strings do not count as docstrings.
         */
        private boolean appendStringContent(TSNode string, StringBuilder value) {
            String raw = text(string);
            int quoteAt = 0;
            while (quoteAt < raw.length() && raw.charAt(quoteAt) != '\'' && raw.charAt(quoteAt) != '"') {
                quoteAt++;
            }
            if (raw.substring(0, quoteAt).toLowerCase(Locale.ROOT).contains("b")) {
                return false;
            }
            char quote = raw.charAt(quoteAt);
            int quoteLength = raw.startsWith(String.valueOf(quote).repeat(3), quoteAt) ? 3 : 1;
            int start = quoteAt + quoteLength;
            int end = Math.max(start, raw.length() - quoteLength);
            value.append(raw, start, end);
            return true;
        }

        private void visitImport(TSNode node) {
            int line = node.getStartPoint().getRow() + 1;
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                String dotted = importedName(node.getNamedChild(i));
                if (dotted != null) {
                    addImport(dotted, "import " + dotted, line);
                }
            }
        }

        private void visitFromImport(TSNode node) {
            int line = node.getStartPoint().getRow() + 1;
            TSNode module = node.getChildByFieldName("module_name");
            String moduleName = module == null || module.isNull() ? "__future__" : compact(text(module));

            for (int i = 0; i < node.getNamedChildCount(); i++) {
                TSNode child = node.getNamedChild(i);
                if (module != null && !module.isNull() && child.getStartByte() == module.getStartByte()) {
                    continue;
                }
                String imported = "wildcard_import".equals(child.getType()) ? "*" : importedName(child);
                if (imported == null) {
                    continue;
                }
                String qualified = moduleName.endsWith(".") ? moduleName + imported : moduleName + "." + imported;
                addImport(qualified, "from " + moduleName + " import " + imported, line);
            }
        }

        /**
         * Dotted name of an import clause, ignoring any {@code as} alias.
         */
        private String importedName(TSNode clause) {
            return switch (clause.getType()) {
                case "dotted_name" -> compact(text(clause));
                case "aliased_import" -> compact(text(clause.getChildByFieldName("name")));
                default -> null;
            };
        }

        private void addImport(String name, String definition, int lineNumber) {
            symbols.add(new PendingSymbol(Symbol.builder()
                .name(name)
                .kind(SymbolKind.IMPORT)
                .filePath(filePath)
                .lineNumber(lineNumber)
                .definition(definition)));
        }

        /**
         * Record a direct or attribute call against every enclosing definition.
         */
        private void recordCall(TSNode call, List<PendingSymbol> scopes) {
            TSNode function = call.getChildByFieldName("function");
            String callee = switch (function.getType()) {
                case "identifier" -> text(function);
                case "attribute" -> text(function.getChildByFieldName("attribute"));
                default -> null;
            };
            if (callee == null) {
                return;
            }
            if (scopes.isEmpty()) {
                topLevelCalls.add(callee);
            } else {
                scopes.forEach(scope -> scope.calls.add(callee));
            }
        }

        private String text(TSNode node) {
            return slice(bytes, node);
        }

        private static String compact(String text) {
            return text.replaceAll("\\s+", "");
        }
    }
}
