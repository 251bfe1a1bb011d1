package com.purchasingpower.codesearch.graph;

import com.purchasingpower.codesearch.configuration.CodeSearchProperties;
import com.purchasingpower.codesearch.core.SourcePaths;
import com.purchasingpower.codesearch.knowledge.IndexSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reports functions and classes nothing in the index refers to.
 *
 * <p>A node is reported when nobody depends on it, its name has no leading
 * underscore, it is not a configured entry point and no file calls it from
 * module-level code. This is a heuristic: reflection, framework callbacks and
 * callers outside the indexed tree all produce false positives.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeadCodeDetector {

    static final String REASON = "No references found";

    private final CodeSearchProperties properties;

    /**
     * @param scope relative path prefix; empty for the whole index
     */
    public List<DeadCodeFinding> findDeadCode(IndexSnapshot snapshot, String scope) {
        Set<String> entryPoints = Set.copyOf(properties.getDeadCode().getEntryPoints());
        Set<String> calledFromTopLevel = snapshot.getIndex().topLevelCalls();

        List<DeadCodeFinding> findings = new ArrayList<>();
        for (DependencyNode node : snapshot.getGraph().nodes()) {
            if (!SourcePaths.inScope(node.getFilePath(), scope)) {
                continue;
            }
            String name = node.getName();
            if (!node.getDependedBy().isEmpty()
                || name.startsWith("_")
                || entryPoints.contains(name)
                || calledFromTopLevel.contains(name)) {
                continue;
            }
            findings.add(DeadCodeFinding.builder()
                .symbol(name)
                .kind(node.getKind())
                .filePath(node.getFilePath())
                .lineNumber(node.getLineNumber())
                .reason(REASON)
                .build());
        }

        log.info("Dead code scan of '{}': {} candidates", scope, findings.size());
        return findings;
    }
}
