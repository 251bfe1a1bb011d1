package com.purchasingpower.codesearch.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Blast radius of changing one symbol: everything that transitively depends on it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImpactAnalysisReport {

    private String symbol;
    private String analyzedNode;

    private List<String> affectedSymbols;
    private List<String> affectedFiles;
    private List<String> directDependents;

    /**
     * Number of distinct affected symbols, the origin excluded.
     */
    private int impactScore;

    /**
     * Longest BFS distance reached from the origin.
     */
    private int maxDepth;

    private RiskLevel riskLevel;
    private String warning;

    public enum RiskLevel {
        LOW,      // up to 5 affected
        MEDIUM,   // 6-10 affected
        HIGH,     // 11-20 affected
        CRITICAL; // more than 20 affected

        public static RiskLevel of(int affected) {
            if (affected <= 5) {
                return LOW;
            }
            if (affected <= 10) {
                return MEDIUM;
            }
            return affected <= 20 ? HIGH : CRITICAL;
        }
    }

    public String toMarkdown() {
        return String.format("""
            # Impact Analysis: %s

            ## Risk Assessment
            - **Risk Level**: %s
            - **Impact Score**: %d
            - **Max Depth**: %d

            ## Dependents (Who uses this?)
            - Direct: %d symbols
            - Transitive: %d symbols in %d files

            ## Affected Symbols
            %s

            ## Recommendation
            %s
            """,
            analyzedNode,
            riskLevel,
            impactScore,
            maxDepth,
            directDependents.size(),
            affectedSymbols.size(),
            affectedFiles.size(),
            affectedSymbols.isEmpty() ? "None" : String.join("\n", affectedSymbols.stream().map(s -> "- " + s).toList()),
            getRecommendation()
        );
    }

    private String getRecommendation() {
        return switch (riskLevel) {
            case CRITICAL -> "⚠️ HIGH RISK: Changes will affect 20+ symbols. Consider splitting this symbol or deprecating gradually.";
            case HIGH -> "⚠️ MODERATE RISK: Thoroughly test all dependent symbols.";
            case MEDIUM -> "✓ MANAGEABLE: Standard testing should suffice. Monitor dependent symbols.";
            case LOW -> "✓ LOW RISK: Few dependents. Safe to modify with basic testing.";
        };
    }
}
