package com.purchasingpower.codesearch.knowledge;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps file extensions to extractors and language aliases to language families.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class LanguageRegistry {

    private static final Map<String, String> ALIASES = Map.ofEntries(
        Map.entry("py", "python"),
        Map.entry("python", "python"),
        Map.entry("js", "javascript"),
        Map.entry("jsx", "javascript"),
        Map.entry("ts", "javascript"),
        Map.entry("tsx", "javascript"),
        Map.entry("javascript", "javascript"),
        Map.entry("typescript", "javascript"),
        Map.entry("java", "java"),
        Map.entry("go", "go"),
        Map.entry("golang", "go"),
        Map.entry("rs", "rust"),
        Map.entry("rust", "rust"));

    private final Map<String, LanguageExtractor> byExtension = new LinkedHashMap<>();

    public LanguageRegistry(List<LanguageExtractor> extractors) {
        for (LanguageExtractor extractor : extractors) {
            for (String extension : extractor.extensions()) {
                LanguageExtractor previous = byExtension.putIfAbsent(extension, extractor);
                if (previous != null) {
                    log.warn("Extension {} claimed by both {} and {}, keeping {}",
                        extension, previous.language(), extractor.language(), previous.language());
                }
            }
        }
        log.info("Language registry ready: {} extensions", byExtension.size());
    }

    /**
     * Extractor for the extension of {@code filePath}, if any.
     */
    public Optional<LanguageExtractor> forPath(String filePath) {
        return Optional.ofNullable(byExtension.get(extensionOf(filePath)));
    }

    /**
     * Language family of {@code filePath}, if its extension is registered.
     */
    public Optional<String> languageOf(String filePath) {
        LanguageExtractor extractor = byExtension.get(extensionOf(filePath));
        return Optional.ofNullable(extractor).map(LanguageExtractor::language);
    }

    /**
     * Resolve a user supplied language name or alias to a family name.
     *
     * @return the family, or empty for a blank or unknown name
     */
    public Optional<String> resolveLanguage(String nameOrAlias) {
        if (nameOrAlias == null || nameOrAlias.isBlank()) {
            return Optional.empty();
        }
        String key = nameOrAlias.trim().toLowerCase(Locale.ROOT);
        if (key.startsWith(".")) {
            key = key.substring(1);
        }
        return Optional.ofNullable(ALIASES.get(key));
    }

    public Map<String, LanguageExtractor> extractorsByExtension() {
        return Collections.unmodifiableMap(byExtension);
    }

    static String extensionOf(String filePath) {
        if (filePath == null) {
            return "";
        }
        int slash = filePath.lastIndexOf('/');
        int dot = filePath.lastIndexOf('.');
        return dot > slash ? filePath.substring(dot) : "";
    }
}
