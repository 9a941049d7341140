package org.tessera.autotile;

/**
 * Expected neighbor state within a ruleset pattern.
 */
public enum AutoTileRulesetValue {
    /** The neighbor must be empty. */
    NONE,
    /** The neighbor must be filled. */
    TILE,
    /** Wildcard: the neighbor is not inspected. */
    ANY
}
