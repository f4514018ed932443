package com.designtool.lowering.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Inputs of the normalizer: extra ignore patterns and node ids to drop.
 */
@Value
@Builder
public class FilterOptions {

    public static final List<String> DEFAULT_IGNORE_PATTERNS = List.of(
            "*annotation*",
            "*measure*",
            "*measurement*",
            "*redline*",
            "*spec*",
            "*-guide",
            "*_guide");

    @Singular
    List<String> ignorePatterns;
    @Singular
    Set<String> excludeIds;
    @Builder.Default
    boolean useDefaultIgnorePatterns = true;

    public static FilterOptions defaults() {
        return FilterOptions.builder().build();
    }

    /**
     * Default patterns (when enabled) followed by the caller's own.
     */
    public List<String> effectiveIgnorePatterns() {
        List<String> patterns = new ArrayList<>();
        if (useDefaultIgnorePatterns) {
            patterns.addAll(DEFAULT_IGNORE_PATTERNS);
        }
        patterns.addAll(ignorePatterns);
        return patterns;
    }
}
