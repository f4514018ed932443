package com.designtool.lowering.pipeline;

import java.util.List;
import java.util.Set;

import com.designtool.lowering.normalize.FilterOptions;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Configuration for a lowering run.
 *
 * Only the normalizer is tunable; every later stage is a pure function of
 * the tree it receives. The two detector switches decide whether the raw
 * tree is inspected for device chrome and modal overlays first.
 */
@Data
@Builder
public class PipelineOptions {

    /**
     * Extra wildcard name patterns to drop ({@code *} matches anything).
     */
    @Singular
    private List<String> ignorePatterns;

    /**
     * Node ids to drop together with their subtrees.
     */
    @Singular
    private Set<String> excludeIds;

    /**
     * Whether the built-in annotation and guide patterns apply.
     */
    @Builder.Default
    private boolean useDefaultIgnorePatterns = true;

    /**
     * Whether detected status bars and home indicators are excluded.
     */
    @Builder.Default
    private boolean detectSafeArea = true;

    /**
     * Whether a screen demonstrating a modal is lowered to the modal content only.
     */
    @Builder.Default
    private boolean detectModalOverlay = true;

    public static PipelineOptions defaults() {
        return PipelineOptions.builder().build();
    }

    /**
     * Filter options for the normalizer, with the chrome ids found by the
     * safe-area detector added to the caller's own exclusions.
     */
    public FilterOptions toFilterOptions(List<String> chromeIds) {
        return FilterOptions.builder()
                .ignorePatterns(ignorePatterns)
                .excludeIds(excludeIds)
                .excludeIds(chromeIds)
                .useDefaultIgnorePatterns(useDefaultIgnorePatterns)
                .build();
    }
}
