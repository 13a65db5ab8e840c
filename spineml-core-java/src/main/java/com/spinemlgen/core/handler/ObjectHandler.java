package com.spinemlgen.core.handler;

import org.w3c.dom.Element;

/**
 * Callback invoked by the regime traversal once per transition or dynamics node.
 *
 * Implementations emit text into buffers they own; they must not touch the regime table.
 */
@FunctionalInterface
public interface ObjectHandler {

    /**
     * @param node             the OnCondition, OnEvent, OnImpulse or TimeDerivative element
     * @param currentRegimeId  ID of the regime containing {@code node}
     * @param targetRegimeId   ID of the regime the transition leads to (the current one for derivatives)
     */
    void onObject(Element node, int currentRegimeId, int targetRegimeId);

    /** Runs this handler, then {@code next}, on every node. */
    default ObjectHandler andThen(ObjectHandler next) {
        return (node, currentRegimeId, targetRegimeId) -> {
            onObject(node, currentRegimeId, targetRegimeId);
            next.onObject(node, currentRegimeId, targetRegimeId);
        };
    }
}
