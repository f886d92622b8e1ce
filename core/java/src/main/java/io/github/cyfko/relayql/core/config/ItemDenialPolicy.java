package io.github.cyfko.relayql.core.config;

/**
 * Policies for handling items denied by a subject rule inside a collection.
 */
public enum ItemDenialPolicy {
    /** Fail the whole operation with an access-denied error. */
    FAIL,
    /** Drop denied items from the window; totals and cursors are left untouched. */
    OMIT;
}
