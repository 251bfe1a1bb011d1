package com.purchasingpower.codesearch.knowledge.impl;

import com.purchasingpower.codesearch.configuration.CodeSearchProperties;
import com.purchasingpower.codesearch.knowledge.FileScanner;
import com.purchasingpower.codesearch.knowledge.ScannedFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * File system implementation of {@link FileScanner}.
 *
 * <p>Files are read one at a time as the returned stream is consumed. Raw bytes
 * are fingerprinted with SHA-256 and decoded as strict UTF-8; files that fail
 * to read or decode are skipped with a warning.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemScanner implements FileScanner {

    private static final Comparator<Path> BY_NAME =
        Comparator.comparing(path -> path.getFileName().toString());

    private final CodeSearchProperties properties;

    @Override
    public Stream<ScannedFile> scan(Path root, Collection<String> extensions,
                                    Collection<String> excludeDirs, Consumer<String> warnings) {
        if (root == null || !Files.isDirectory(root)) {
            throw new IllegalArgumentException("Root is not a directory: " + root);
        }

        Path normalizedRoot = root.toAbsolutePath().normalize();
        Set<String> suffixes = normalizeExtensions(extensions);
        Set<String> excluded = excludeDirs == null ? Set.of() : Set.copyOf(excludeDirs);

        log.debug("Scanning {} for {} (excluding {})", normalizedRoot, suffixes, excluded);

        Iterator<ScannedFile> iterator = new ScanIterator(normalizedRoot, suffixes, excluded, warnings);
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
            false);
    }

    static Set<String> normalizeExtensions(Collection<String> extensions) {
        Set<String> normalized = new LinkedHashSet<>();
        if (extensions == null) {
            return normalized;
        }
        for (String ext : extensions) {
            if (ext == null || ext.isBlank()) {
                continue;
            }
            String trimmed = ext.trim();
            normalized.add(trimmed.startsWith(".") ? trimmed : "." + trimmed);
        }
        return normalized;
    }

    static String hashBytes(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(data);
            return bytesToHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm is not available", e);
        }
    }

    private static String bytesToHex(byte[] hash) {
        StringBuilder builder = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            builder.append(String.format("%02x", b));
        }
        return builder.toString();
    }

    private static String decodeUtf8(byte[] data) throws CharacterCodingException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder();
        decoder.onMalformedInput(CodingErrorAction.REPORT);
        decoder.onUnmappableCharacter(CodingErrorAction.REPORT);
        return decoder.decode(ByteBuffer.wrap(data)).toString();
    }

    /**
     * Depth-first walk driven by an explicit stack of pending directories.
     */
    private final class ScanIterator implements Iterator<ScannedFile> {

        private final Path root;
        private final Set<String> suffixes;
        private final Set<String> excluded;
        private final Consumer<String> warnings;

        private final Deque<Path> pendingDirs = new ArrayDeque<>();
        private final Deque<Path> pendingFiles = new ArrayDeque<>();
        private ScannedFile next;

        ScanIterator(Path root, Set<String> suffixes, Set<String> excluded, Consumer<String> warnings) {
            this.root = root;
            this.suffixes = suffixes;
            this.excluded = excluded;
            this.warnings = warnings;
            pendingDirs.push(root);
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public ScannedFile next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ScannedFile current = next;
            next = null;
            return current;
        }

        private ScannedFile advance() {
            while (true) {
                while (!pendingFiles.isEmpty()) {
                    ScannedFile file = read(pendingFiles.poll());
                    if (file != null) {
                        return file;
                    }
                }
                if (pendingDirs.isEmpty()) {
                    return null;
                }
                expand(pendingDirs.pop());
            }
        }

        private void expand(Path dir) {
            List<Path> entries;
            try (Stream<Path> listing = Files.list(dir)) {
                entries = listing.sorted(BY_NAME).toList();
            } catch (IOException | SecurityException e) {
                warn("Skipped directory (unable to list) " + relativize(dir) + ": " + e.getMessage());
                return;
            }

            List<Path> subDirs = new ArrayList<>();
            for (Path entry : entries) {
                if (Files.isSymbolicLink(entry)) {
                    continue;
                }
                String name = entry.getFileName().toString();
                if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    if (!excluded.contains(name)) {
                        subDirs.add(entry);
                    }
                } else if (Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS) && matches(name)) {
                    pendingFiles.add(entry);
                }
            }

            // Reverse push so the first sub-directory by name is walked first
            for (int i = subDirs.size() - 1; i >= 0; i--) {
                pendingDirs.push(subDirs.get(i));
            }
        }

        private boolean matches(String fileName) {
            for (String suffix : suffixes) {
                if (fileName.endsWith(suffix)) {
                    return true;
                }
            }
            return false;
        }

        private ScannedFile read(Path file) {
            String relativePath = relativize(file);
            byte[] rawBytes;
            try {
                long size = Files.size(file);
                if (size > properties.getMaxFileSizeBytes()) {
                    warn("Skipped file (too large, " + size + " bytes) " + relativePath);
                    return null;
                }
                rawBytes = Files.readAllBytes(file);
            } catch (IOException | SecurityException e) {
                warn("Skipped file (unable to read) " + relativePath + ": " + e.getMessage());
                return null;
            }

            String content;
            try {
                content = decodeUtf8(rawBytes);
            } catch (CharacterCodingException e) {
                warn("Skipped non-UTF-8 file " + relativePath + ": " + e.getMessage());
                return null;
            }

            return ScannedFile.builder()
                .relativePath(relativePath)
                .content(content)
                .contentHash(hashBytes(rawBytes))
                .build();
        }

        private String relativize(Path path) {
            return root.relativize(path.toAbsolutePath().normalize()).toString().replace('\\', '/');
        }

        private void warn(String message) {
            log.warn("⚠️  {}", message);
            if (warnings != null) {
                warnings.accept(message);
            }
        }
    }
}
