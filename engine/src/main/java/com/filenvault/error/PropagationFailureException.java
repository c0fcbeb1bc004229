package com.filenvault.error;

import com.filenvault.model.NonRootObject;

/**
 * One recipient, link or descendant operation of a fan-out failed. Sibling operations were
 * cancelled; targets already updated keep their new state. Propagation is idempotent, so
 * the usual recovery is to run it again.
 *
 * <p>When the failure follows a successful upload or rename, {@link #getItem()} returns the
 * item as it now exists on the server.
 */
public class PropagationFailureException extends FilenException {

    private final NonRootObject item;

    public PropagationFailureException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public PropagationFailureException(String message, Throwable cause, NonRootObject item) {
        super(message, cause);
        this.item = item;
    }

    public NonRootObject getItem() {
        return item;
    }
}
