package org.arcanabar.model;

/**
 * Позиции трёхкарточного расклада, в порядке выдачи карт.
 */
public enum SpreadPosition {
    PAST,
    PRESENT,
    FUTURE
}
