package org.cognita.continuation;

/**
 * The outcome of an extension attach attempt. None of these are errors; callers are only
 * informed whether their extension will be used.
 */
public enum AttachResult {
    /** The extension was attached and will replace the default flow. */
    ACCEPTED,
    /** The continuation was already extended, timed out or resolved; the extension is not used. */
    ALREADY_RESOLVED,
    /** No continuation with the given id or name is known. */
    NOT_FOUND,
    /** The extension targets a different model or continuation point. */
    MISMATCHED
}
