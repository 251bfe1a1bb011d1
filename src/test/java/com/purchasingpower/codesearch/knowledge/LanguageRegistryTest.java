package com.purchasingpower.codesearch.knowledge;

import com.purchasingpower.codesearch.testutil.TestEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Language Registry Tests")
class LanguageRegistryTest {

    private LanguageRegistry registry;

    @BeforeEach
    void setUp() {
        registry = TestEngine.registry();
    }

    @Test
    @DisplayName("Should route files to extractors by extension")
    void forPath_ShouldMatchExtension() {
        assertThat(registry.languageOf("src/app.py")).contains("python");
        assertThat(registry.languageOf("web/App.tsx")).contains("javascript");
        assertThat(registry.languageOf("Main.java")).contains("java");
        assertThat(registry.languageOf("cmd/main.go")).contains("go");
        assertThat(registry.languageOf("src/lib.rs")).contains("rust");
        assertThat(registry.forPath("README.md")).isEmpty();
        assertThat(registry.forPath("Makefile")).isEmpty();
        assertThat(registry.forPath("some.dir/Makefile")).isEmpty();
    }

    @Test
    @DisplayName("Should resolve language aliases case-insensitively")
    void resolveLanguage_ShouldAcceptAliases() {
        assertThat(registry.resolveLanguage("Python")).contains("python");
        assertThat(registry.resolveLanguage("ts")).contains("javascript");
        assertThat(registry.resolveLanguage(".js")).contains("javascript");
        assertThat(registry.resolveLanguage("golang")).contains("go");
        assertThat(registry.resolveLanguage("rs")).contains("rust");
        assertThat(registry.resolveLanguage("cobol")).isEmpty();
        assertThat(registry.resolveLanguage(" ")).isEmpty();
    }

    @Test
    @DisplayName("Should register every extension of every extractor")
    void extractorsByExtension_ShouldCoverAllLanguages() {
        assertThat(registry.extractorsByExtension())
            .containsKeys(".py", ".pyi", ".js", ".jsx", ".ts", ".tsx", ".mjs", ".cjs", ".java", ".go", ".rs");
    }
}
