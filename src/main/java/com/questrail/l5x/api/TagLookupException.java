package com.questrail.l5x.api;

/**
 * Indicates that a tag member address could not be resolved: the member does
 * not exist, is not an array, or the element or bit index is out of range.
 *
 * <p>This is deliberately a checked exception. Every caller of
 * {@link ControllerTag#bitDescription(String, int, int)} has to decide what a
 * failed lookup means in its context.</p>
 */
public final class TagLookupException extends Exception
{
    public TagLookupException(String message) {
        super(message);
    }
}
