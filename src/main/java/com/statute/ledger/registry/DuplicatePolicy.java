package com.statute.ledger.registry;

/**
 * What {@link StatuteRegistry#add} does when a statute id is already registered.
 */
public enum DuplicatePolicy {
    /**
     * Refuse the second registration with {@link DuplicateStatuteException}.
     */
    REJECT,

    /**
     * Replace the registered statute when the new one carries a strictly higher version.
     * The replacement keeps the original's position; equal or lower versions are refused.
     */
    REPLACE_NEWER_VERSION
}
