package com.designtool.lowering.styles;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.designtool.lowering.model.style.ExtractedStyle;
import com.designtool.lowering.util.NamingUtil;
import com.designtool.lowering.util.SignatureHash;

/**
 * Name-to-style table with content deduplication. Identical content always
 * resolves to the name it was first registered under; a preferred name that
 * is already taken by different content gets a numeric suffix.
 */
public class StyleRegistry {

    private static final Logger log = LoggerFactory.getLogger(StyleRegistry.class);

    private final Map<String, ExtractedStyle> stylesByName = new LinkedHashMap<>();
    private final Map<String, String> nameByHash = new HashMap<>();
    private int dedupedCount;

    /**
     * @return the name the style is registered under
     */
    public String register(String preferredName, ExtractedStyle style) {
        String hash = hash(style);
        String existing = nameByHash.get(hash);
        if (existing != null) {
            if (!existing.equals(preferredName)) {
                dedupedCount++;
                log.debug("DEDUPED STYLE: {} has the same content as {} (hash {}) -> using {}",
                        preferredName, existing, hash, existing);
            }
            return existing;
        }

        String name = NamingUtil.disambiguate(preferredName, stylesByName::containsKey);
        stylesByName.put(name, style);
        nameByHash.put(hash, name);
        return name;
    }

    public Map<String, ExtractedStyle> getStyles() {
        return Collections.unmodifiableMap(stylesByName);
    }

    public int getDedupedCount() {
        return dedupedCount;
    }

    /**
     * Hash over the sorted property map, so property order never matters.
     */
    static String hash(ExtractedStyle style) {
        StringBuilder sb = new StringBuilder();
        style.toPropertyMap().forEach((key, value) -> sb.append(key).append('=').append(value).append('\n'));
        return SignatureHash.hashString(sb.toString());
    }
}
