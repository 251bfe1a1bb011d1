package com.purchasingpower.codesearch.knowledge.impl;

import com.purchasingpower.codesearch.configuration.CodeSearchProperties;
import com.purchasingpower.codesearch.exception.SourceParseException;
import com.purchasingpower.codesearch.graph.DependencyGraph;
import com.purchasingpower.codesearch.graph.DependencyGraphBuilder;
import com.purchasingpower.codesearch.knowledge.ExtractedFile;
import com.purchasingpower.codesearch.knowledge.FileScanner;
import com.purchasingpower.codesearch.knowledge.IndexSnapshot;
import com.purchasingpower.codesearch.knowledge.IndexState;
import com.purchasingpower.codesearch.knowledge.IndexedFile;
import com.purchasingpower.codesearch.knowledge.IndexingResult;
import com.purchasingpower.codesearch.knowledge.IndexingService;
import com.purchasingpower.codesearch.knowledge.LanguageExtractor;
import com.purchasingpower.codesearch.knowledge.LanguageRegistry;
import com.purchasingpower.codesearch.knowledge.ScannedFile;
import com.purchasingpower.codesearch.knowledge.SymbolIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Single-writer implementation of {@link IndexingService}.
 *
 * <p>A rebuild runs under one lock. Files are scanned in order, unchanged files are
 * carried over from the current snapshot, and the others are extracted on the
 * indexing executor. Results are collected in scan order into a new
 * {@link SymbolIndex}, the dependency graph is built or spliced, and the new
 * snapshot replaces the current one in a single reference swap.
 *
 * <p>A rebuild that runs past the configured budget is abandoned: pending
 * extractions are cancelled and the current snapshot stays in place.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class IndexingServiceImpl implements IndexingService {

    private final FileScanner fileScanner;
    private final LanguageRegistry languageRegistry;
    private final DependencyGraphBuilder graphBuilder;
    private final CodeSearchProperties properties;
    private final Executor indexingExecutor;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicReference<IndexSnapshot> current = new AtomicReference<>(IndexSnapshot.empty());
    private final AtomicLong generations = new AtomicLong();
    private volatile IndexState state = IndexState.EMPTY;

    public IndexingServiceImpl(FileScanner fileScanner,
                               LanguageRegistry languageRegistry,
                               DependencyGraphBuilder graphBuilder,
                               CodeSearchProperties properties,
                               @Qualifier("indexingExecutor") Executor indexingExecutor) {
        this.fileScanner = fileScanner;
        this.languageRegistry = languageRegistry;
        this.graphBuilder = graphBuilder;
        this.properties = properties;
        this.indexingExecutor = indexingExecutor;
    }

    /**
     * A file of the current scan: either carried over or being extracted.
     */
    private record Slot(String filePath, CompletableFuture<IndexedFile> extraction) {

        boolean kept() {
            return extraction == null;
        }
    }

    @Override
    public IndexingResult index(Path root, List<String> extensions, List<String> excludeDirs) {
        if (root == null || !Files.isDirectory(root)) {
            throw new IllegalArgumentException("Root path does not exist or is not a directory: " + root);
        }
        Path normalizedRoot = root.toAbsolutePath().normalize();
        List<String> effectiveExtensions = extensions == null || extensions.isEmpty()
            ? properties.getDefaultExtensions()
            : extensions;
        List<String> effectiveExcludes = excludeDirs == null ? properties.getExcludeDirs() : excludeDirs;

        writeLock.lock();
        try {
            return rebuild(normalizedRoot, effectiveExtensions, effectiveExcludes);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Build and publish the next generation. Runs with the write lock held.
     */
    private IndexingResult rebuild(Path normalizedRoot, List<String> effectiveExtensions,
                                   List<String> effectiveExcludes) {
        IndexState before = state;
        long startNanos = System.nanoTime();
        Duration budget = properties.getIndexTimeout();
        List<String> warnings = Collections.synchronizedList(new ArrayList<>());
        List<Slot> slots = new ArrayList<>();

        try {
            state = IndexState.INDEXING;
            IndexSnapshot previous = current.get();
            boolean incremental = !previous.isEmpty() && normalizedRoot.equals(previous.getRoot());
            SymbolIndex base = incremental ? previous.getIndex() : SymbolIndex.empty();

            log.info("🔍 Indexing {} ({}, extensions={})", normalizedRoot,
                incremental ? "incremental" : "full", effectiveExtensions);

            Set<String> changedFiles = new LinkedHashSet<>();
            try (Stream<ScannedFile> files = fileScanner.scan(normalizedRoot, effectiveExtensions,
                effectiveExcludes, warnings::add)) {
                Iterator<ScannedFile> iterator = files.iterator();
                while (iterator.hasNext()) {
                    checkBudget(startNanos, budget);
                    ScannedFile file = iterator.next();
                    Optional<IndexedFile> existing = base.file(file.getRelativePath());
                    if (existing.isPresent() && existing.get().getContentHash().equals(file.getContentHash())) {
                        slots.add(new Slot(file.getRelativePath(), null));
                    } else {
                        changedFiles.add(file.getRelativePath());
                        slots.add(new Slot(file.getRelativePath(),
                            CompletableFuture.supplyAsync(() -> extract(file, warnings), indexingExecutor)));
                    }
                }
            }

            SymbolIndex.Builder builder = base.derive();
            int failed = 0;
            for (Slot slot : slots) {
                if (slot.kept()) {
                    builder.keep(slot.filePath());
                    continue;
                }
                IndexedFile extracted = slot.extraction().get(remaining(startNanos, budget), TimeUnit.NANOSECONDS);
                if (extracted.isParseFailed()) {
                    failed++;
                }
                builder.upsert(extracted);
            }

            Set<String> removedFiles = builder.droppedFiles();
            int unchanged = slots.size() - changedFiles.size();

            if (incremental && changedFiles.isEmpty() && removedFiles.isEmpty()) {
                state = IndexState.READY;
                log.info("✅ Index of {} is up to date (generation {}, {} files)",
                    normalizedRoot, previous.getGeneration(), unchanged);
                return result(previous, true, 0, unchanged, 0, 0, warnings, startNanos);
            }

            changedFiles.addAll(removedFiles);
            SymbolIndex index = builder.build();
            DependencyGraph graph = incremental
                ? graphBuilder.rebuild(previous.getGraph(), previous.getIndex(), index, changedFiles)
                : graphBuilder.build(index);

            IndexSnapshot next = new IndexSnapshot(normalizedRoot, generations.incrementAndGet(), index, graph,
                Instant.now(), properties.getSearch().getCacheMaxEntries());
            current.set(next);
            state = IndexState.READY;

            int extracted = changedFiles.size() - removedFiles.size();
            log.info("✅ Indexed {}: generation {}, {} files ({} extracted, {} unchanged, {} removed, {} failed), "
                    + "{} symbols, {} graph nodes in {}ms",
                normalizedRoot, next.getGeneration(), index.fileCount(), extracted, unchanged,
                removedFiles.size(), failed, index.symbolCount(), graph.nodeCount(), elapsedMs(startNanos));

            return result(next, incremental, extracted, unchanged, removedFiles.size(), failed, warnings, startNanos);

        } catch (TimeoutException e) {
            cancel(slots);
            state = before;
            String message = "Indexing exceeded the time budget of " + budget + "; previous index kept";
            log.error("❌ {} ({})", message, normalizedRoot);
            return IndexingResult.failure(normalizedRoot.toString(), message, copy(warnings), elapsedMs(startNanos));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(slots);
            state = before;
            log.error("❌ Indexing of {} interrupted", normalizedRoot);
            return IndexingResult.failure(normalizedRoot.toString(), "Indexing interrupted", copy(warnings),
                elapsedMs(startNanos));

        } catch (ExecutionException | RuntimeException e) {
            cancel(slots);
            state = before;
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            log.error("❌ Indexing of {} failed: {}", normalizedRoot, cause.getMessage(), cause);
            return IndexingResult.failure(normalizedRoot.toString(), "Indexing failed: " + cause.getMessage(),
                copy(warnings), elapsedMs(startNanos));
        }
    }

    @Override
    public IndexSnapshot current() {
        return current.get();
    }

    @Override
    public IndexState state() {
        return state;
    }

    @Override
    public void clear() {
        writeLock.lock();
        try {
            current.set(IndexSnapshot.empty());
            state = IndexState.EMPTY;
            log.info("🗑️  Index cleared");
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Extract one file. Never throws: a file that fails to parse is indexed without symbols.
     */
    private IndexedFile extract(ScannedFile file, List<String> warnings) {
        String path = file.getRelativePath();
        IndexedFile.IndexedFileBuilder entry = IndexedFile.builder()
            .filePath(path)
            .contentHash(file.getContentHash());

        Optional<LanguageExtractor> extractor = languageRegistry.forPath(path);
        if (extractor.isEmpty()) {
            log.debug("No extractor for {}, indexing without symbols", path);
            return entry.build();
        }
        entry.language(extractor.get().language());

        try {
            ExtractedFile extracted = extractor.get().extract(path, file.getContent());
            return entry
                .symbols(extracted.getSymbols())
                .topLevelCalls(extracted.getTopLevelCalls())
                .build();
        } catch (SourceParseException e) {
            log.warn("⚠️  Parse error, indexing without symbols: {}", e.getMessage());
            warnings.add("Parse error in " + e.getMessage());
            return entry.parseFailed(true).build();
        } catch (RuntimeException e) {
            log.warn("⚠️  Extractor {} failed on {}: {}", extractor.get().language(), path, e.getMessage(), e);
            warnings.add("Extraction failed for " + path + ": " + e.getMessage());
            return entry.parseFailed(true).build();
        }
    }

    private IndexingResult result(IndexSnapshot snapshot, boolean incremental, int extracted, int unchanged,
                                  int removed, int failed, List<String> warnings, long startNanos) {
        return IndexingResult.builder()
            .success(true)
            .root(snapshot.getRoot().toString())
            .indexedFiles(snapshot.getIndex().fileCount())
            .totalSymbols(snapshot.getIndex().symbolCount())
            .extractedFiles(extracted)
            .unchangedFiles(unchanged)
            .removedFiles(removed)
            .failedFiles(failed)
            .incremental(incremental)
            .generation(snapshot.getGeneration())
            .elapsedMs(elapsedMs(startNanos))
            .warnings(copy(warnings))
            .build();
    }

    private static void checkBudget(long startNanos, Duration budget) throws TimeoutException {
        if (System.nanoTime() - startNanos >= budget.toNanos()) {
            throw new TimeoutException("Indexing budget of " + budget + " exceeded");
        }
    }

    private static long remaining(long startNanos, Duration budget) throws TimeoutException {
        long remaining = budget.toNanos() - (System.nanoTime() - startNanos);
        if (remaining <= 0) {
            throw new TimeoutException("Indexing budget of " + budget + " exceeded");
        }
        return remaining;
    }

    private static void cancel(List<Slot> slots) {
        slots.stream()
            .filter(slot -> !slot.kept())
            .forEach(slot -> slot.extraction().cancel(true));
    }

    private static List<String> copy(List<String> warnings) {
        synchronized (warnings) {
            return new ArrayList<>(warnings);
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
