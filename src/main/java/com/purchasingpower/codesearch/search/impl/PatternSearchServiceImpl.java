package com.purchasingpower.codesearch.search.impl;

import com.purchasingpower.codesearch.configuration.CodeSearchProperties;
import com.purchasingpower.codesearch.knowledge.IndexSnapshot;
import com.purchasingpower.codesearch.knowledge.IndexedFile;
import com.purchasingpower.codesearch.knowledge.LanguageRegistry;
import com.purchasingpower.codesearch.search.CodeNormalizer;
import com.purchasingpower.codesearch.search.PatternMatch;
import com.purchasingpower.codesearch.search.PatternSearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Block-level similarity search.
 *
 * <p>Each candidate file is read from disk and cut into blocks starting at
 * function or class header lines. A Python block runs over the header's indented
 * body; a brace block runs to the brace closing the first one opened, or up to
 * the next header when braces never balance.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PatternSearchServiceImpl implements PatternSearchService {

    private static final String JAVA_MODIFIERS =
        "(?:(?:public|protected|private|static|final|abstract|synchronized|default|native|sealed)\\s+)";

    private static final Map<String, Pattern> HEADERS = Map.of(
        "python", Pattern.compile("^\\s*(?:async\\s+)?(?:def|class)\\s+\\w+"),
        "javascript", Pattern.compile(
            "^\\s*(?:export\\s+)?(?:default\\s+)?(?:abstract\\s+)?(?:async\\s+)?(?:function|class)\\b\\s*\\*?\\s*[\\w$]+"),
        "java", Pattern.compile("^\\s*(?:@\\w+\\s+)*" + JAVA_MODIFIERS + "*(?:class|interface|enum|record)\\s+\\w+"
            + "|^\\s*" + JAVA_MODIFIERS + "+[\\w<>\\[\\]?,.\\s]+?\\s+\\w+\\s*\\("),
        "go", Pattern.compile("^\\s*(?:func|type)\\s+"),
        "rust", Pattern.compile(
            "^\\s*(?:pub(?:\\([^)]*\\))?\\s+)?(?:async\\s+)?(?:unsafe\\s+)?(?:fn|struct|enum|trait|impl)\\b"));

    private static final Comparator<PatternMatch> RANKING =
        Comparator.comparingDouble(PatternMatch::getSimilarity).reversed()
            .thenComparing(PatternMatch::getFilePath)
            .thenComparingInt(PatternMatch::getLineNumber);

    private final CodeNormalizer normalizer;
    private final LanguageRegistry languageRegistry;
    private final CodeSearchProperties properties;

    private record Block(int lineNumber, String code) {
    }

    @Override
    public List<PatternMatch> findSimilar(IndexSnapshot snapshot, String snippet, String language,
                                          double threshold, int maxResults) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Threshold must be between 0 and 1: " + threshold);
        }
        String family = null;
        if (language != null && !language.isBlank()) {
            family = languageRegistry.resolveLanguage(language)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported language: " + language));
        }
        if (snippet == null || snippet.isBlank()) {
            return List.of();
        }

        // With no language given the snippet is normalized once per candidate language
        Map<String, Set<String>> queryTokensByLanguage = new HashMap<>();

        List<PatternMatch> matches = new ArrayList<>();
        for (IndexedFile file : snapshot.getIndex().files()) {
            String fileLanguage = file.getLanguage();
            if (fileLanguage == null || !HEADERS.containsKey(fileLanguage)) {
                continue;
            }
            if (family != null && !family.equals(fileLanguage)) {
                continue;
            }
            Set<String> queryTokens = queryTokensByLanguage.computeIfAbsent(fileLanguage,
                lang -> normalizer.tokens(normalizer.normalize(snippet, lang)));
            if (queryTokens.isEmpty()) {
                continue;
            }
            Optional<String> content = read(snapshot, file.getFilePath());
            if (content.isEmpty()) {
                continue;
            }

            for (Block block : blocks(content.get(), fileLanguage)) {
                Set<String> blockTokens = normalizer.tokens(normalizer.normalize(block.code(), fileLanguage));
                double similarity = normalizer.similarity(queryTokens, blockTokens);
                if (similarity > 0.0 && similarity >= threshold) {
                    matches.add(PatternMatch.builder()
                        .filePath(file.getFilePath())
                        .lineNumber(block.lineNumber())
                        .codeBlock(block.code())
                        .similarity(similarity)
                        .language(fileLanguage)
                        .build());
                }
            }
        }

        int limit = maxResults > 0 ? maxResults : properties.getPattern().getMaxResults();
        matches.sort(RANKING);
        log.debug("Pattern search ({}): {} blocks at or above {}", family == null ? "all" : family,
            matches.size(), threshold);
        return List.copyOf(matches.subList(0, Math.min(limit, matches.size())));
    }

    private Optional<String> read(IndexSnapshot snapshot, String filePath) {
        try {
            return Optional.of(Files.readString(snapshot.getRoot().resolve(filePath), StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("⚠️  Skipping {} in pattern search: {}", filePath, e.getMessage());
            return Optional.empty();
        }
    }

    private List<Block> blocks(String content, String language) {
        String[] lines = content.split("\\r?\\n", -1);
        Pattern header = HEADERS.get(language);

        List<Integer> starts = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            if (header.matcher(lines[i]).find()) {
                starts.add(i);
            }
        }

        List<Block> blocks = new ArrayList<>();
        for (int n = 0; n < starts.size(); n++) {
            int start = starts.get(n);
            int nextHeader = n + 1 < starts.size() ? starts.get(n + 1) : lines.length;
            int end = "python".equals(language)
                ? indentedBlockEnd(lines, start)
                : braceBlockEnd(lines, start, nextHeader);
            blocks.add(new Block(start + 1, String.join("\n", List.of(lines).subList(start, end))));
        }
        return blocks;
    }

    /**
     * Exclusive end of a Python block: the first later non-blank line indented no deeper than the header.
     */
    private static int indentedBlockEnd(String[] lines, int start) {
        int headerIndent = indentOf(lines[start]);
        int end = start + 1;
        int lastContent = start;
        while (end < lines.length) {
            String line = lines[end];
            if (!line.isBlank()) {
                if (indentOf(line) <= headerIndent) {
                    break;
                }
                lastContent = end;
            }
            end++;
        }
        return lastContent + 1;
    }

    /**
     * Exclusive end of a brace block, falling back to {@code nextHeader} when braces do not balance.
     */
    private static int braceBlockEnd(String[] lines, int start, int nextHeader) {
        int depth = 0;
        boolean opened = false;
        for (int i = start; i < lines.length; i++) {
            for (char c : lines[i].toCharArray()) {
                if (c == '{') {
                    depth++;
                    opened = true;
                } else if (c == '}') {
                    depth--;
                    if (opened && depth == 0) {
                        return i + 1;
                    }
                } else if (c == ';' && !opened && i == start) {
                    // Declaration without a body
                    return i + 1;
                }
            }
        }
        return Math.max(nextHeader, start + 1);
    }

    private static int indentOf(String line) {
        int indent = 0;
        for (char c : line.toCharArray()) {
            if (c == ' ') {
                indent++;
            } else if (c == '\t') {
                indent = (indent / 8 + 1) * 8;
            } else {
                break;
            }
        }
        return indent;
    }
}
