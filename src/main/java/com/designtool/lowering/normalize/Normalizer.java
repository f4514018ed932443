package com.designtool.lowering.normalize;

import com.designtool.lowering.model.normalized.NormalizedNode;
import com.designtool.lowering.model.raw.RawNode;

/**
 * First lowering pass: filtering followed by wrapper-group removal.
 */
public class Normalizer {

    private final NodeFilter filter;
    private final GroupUnwrapper unwrapper;

    public Normalizer() {
        this(new NodeFilter(), new GroupUnwrapper());
    }

    public Normalizer(NodeFilter filter, GroupUnwrapper unwrapper) {
        this.filter = filter;
        this.unwrapper = unwrapper;
    }

    /**
     * @return the normalized tree, or {@code null} if the root was filtered out
     */
    public NormalizedNode normalize(RawNode root, FilterOptions options) {
        NormalizedNode filtered = filter.filter(root, options);
        if (filtered == null) {
            return null;
        }
        return unwrapper.unwrap(filtered);
    }
}
