package com.morphirbridge.core.visitor;

import com.morphirbridge.core.model.Distribution;

/**
 * Outcome of a walk: the (possibly rewritten) distribution, the reduced value and how many
 * nodes the visitor was shown.
 */
public record TraversalResult<R>(Distribution distribution, R value, long nodesVisited) {
}
