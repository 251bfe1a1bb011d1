package com.purchasingpower.codesearch.knowledge;

import com.purchasingpower.codesearch.core.Symbol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from relative file path to the symbols extracted from it.
 *
 * <p>Files keep the order of the scan that produced them ("index order"), and
 * symbols keep extraction order inside a file. A secondary map gives every
 * symbol with a given name across all files.
 *
 * <p>New generations are derived through {@link #derive()}, which reuses entries
 * of unchanged files and drops files that are not carried over.
 *
 * @since 1.0.0
 */
public final class SymbolIndex {

    private static final SymbolIndex EMPTY = new SymbolIndex(new LinkedHashMap<>());

    private final Map<String, IndexedFile> files;
    private final Map<String, List<Symbol>> byName;
    private final List<Symbol> allSymbols;
    private final Set<String> topLevelCalls;

    private SymbolIndex(LinkedHashMap<String, IndexedFile> files) {
        this.files = Collections.unmodifiableMap(files);

        Map<String, List<Symbol>> names = new LinkedHashMap<>();
        List<Symbol> symbols = new ArrayList<>();
        Set<String> calls = new LinkedHashSet<>();
        for (IndexedFile file : files.values()) {
            for (Symbol symbol : file.getSymbols()) {
                symbols.add(symbol);
                names.computeIfAbsent(symbol.getName(), name -> new ArrayList<>()).add(symbol);
            }
            calls.addAll(file.getTopLevelCalls());
        }
        names.replaceAll((name, list) -> List.copyOf(list));

        this.byName = Collections.unmodifiableMap(names);
        this.allSymbols = List.copyOf(symbols);
        this.topLevelCalls = Collections.unmodifiableSet(calls);
    }

    public static SymbolIndex empty() {
        return EMPTY;
    }

    /**
     * Start a new generation based on this one.
     */
    public Builder derive() {
        return new Builder(this);
    }

    public List<Symbol> symbolsOf(String filePath) {
        IndexedFile file = files.get(filePath);
        return file == null ? List.of() : file.getSymbols();
    }

    public Optional<IndexedFile> file(String filePath) {
        return Optional.ofNullable(files.get(filePath));
    }

    public boolean contains(String filePath) {
        return files.containsKey(filePath);
    }

    /**
     * Files in index order.
     */
    public Collection<IndexedFile> files() {
        return files.values();
    }

    /**
     * Every symbol in index order.
     */
    public List<Symbol> allSymbols() {
        return allSymbols;
    }

    /**
     * Symbols of every kind named exactly {@code name}, in index order.
     */
    public List<Symbol> findByName(String name) {
        return byName.getOrDefault(name, List.of());
    }

    /**
     * Names called from module-level code of any file.
     */
    public Set<String> topLevelCalls() {
        return topLevelCalls;
    }

    public int fileCount() {
        return files.size();
    }

    public int symbolCount() {
        return allSymbols.size();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    /**
     * Assembles the next generation in scan order.
     */
    public static final class Builder {

        private final SymbolIndex previous;
        private final LinkedHashMap<String, IndexedFile> files = new LinkedHashMap<>();

        private Builder(SymbolIndex previous) {
            this.previous = previous;
        }

        /**
         * Add or replace the entry of one file.
         */
        public Builder upsert(IndexedFile file) {
            files.remove(file.getFilePath());
            files.put(file.getFilePath(), file);
            return this;
        }

        /**
         * Carry the previous entry of {@code filePath} over unchanged.
         *
         * @return false when the previous generation has no such file
         */
        public boolean keep(String filePath) {
            IndexedFile existing = previous.files.get(filePath);
            if (existing == null) {
                return false;
            }
            upsert(existing);
            return true;
        }

        /**
         * Paths of the previous generation that were not carried into this one.
         */
        public Set<String> droppedFiles() {
            Set<String> dropped = new LinkedHashSet<>(previous.files.keySet());
            dropped.removeAll(files.keySet());
            return dropped;
        }

        public SymbolIndex build() {
            return new SymbolIndex(new LinkedHashMap<>(files));
        }
    }
}
