package com.deepansh.rag.session;

/**
 * Why a session lookup did not return a usable session.
 */
public enum InvalidReason {
    /** No session with this ID exists */
    NOT_FOUND,
    /** The session idled past its TTL and was removed by this lookup */
    EXPIRED
}
