package io.cachetx.transaction;

/**
 * The backend operation a deferred action replays at commit time.
 */
public enum DeferredKind {
    SET,
    SET_MULTI,
    DELETE,
    DELETE_MULTI,
    ADD,
    REPLACE,
    CAS,
    INCREMENT,
    DECREMENT,
    TOUCH,
    FLUSH
}
