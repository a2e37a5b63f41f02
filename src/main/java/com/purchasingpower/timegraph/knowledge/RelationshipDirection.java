package com.purchasingpower.timegraph.knowledge;

/**
 * Relationship traversal direction.
 *
 * @since 1.0.0
 */
public enum RelationshipDirection {
    INCOMING,
    OUTGOING,
    BOTH
}
