package com.memflow.memflow_backend.executor;

import com.memflow.memflow_backend.engine.expression.TemplatePart;

import java.util.List;
import java.util.Set;

/**
 * Splits an output template around the first placeholder that reads from a direct
 * predecessor. While that predecessor streams, the caller has already received
 * everything up to and including the placeholder; only the suffix is still owed.
 */
public final class StreamingOutputSplitter {

    private StreamingOutputSplitter() {
    }

    /**
     * @param prefix parts before the anchor
     * @param anchor placeholder reading the streamed node
     * @param suffix parts after the anchor
     */
    public record Split(List<TemplatePart> prefix, TemplatePart.Placeholder anchor, List<TemplatePart> suffix) {

        public String anchorNodeId() {
            return anchor.referencedNodeId();
        }
    }

    /** Returns {@code null} when no placeholder references a predecessor. */
    public static Split split(List<TemplatePart> parts, Set<String> predecessors) {
        for (int i = 0; i < parts.size(); i++) {
            if (parts.get(i) instanceof TemplatePart.Placeholder placeholder) {
                String nodeId = placeholder.referencedNodeId();
                if (nodeId != null && predecessors.contains(nodeId)) {
                    return new Split(parts.subList(0, i), placeholder, parts.subList(i + 1, parts.size()));
                }
            }
        }
        return null;
    }
}
