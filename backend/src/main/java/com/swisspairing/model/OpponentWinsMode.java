package com.swisspairing.model;

/**
 * How opponent match wins are accumulated when a player met the same opponent
 * more than once.
 */
public enum OpponentWinsMode {
    /** Opponent's wins are added once for every match played against them. */
    PER_MATCH,
    /** Opponent's wins are added once, however often they were met. */
    DISTINCT_OPPONENT
}
