package com.example.sessionrelay.model;

/**
 * Which path executes a call. Resolved once per call and never switched afterwards.
 */
public enum ExecutionPolicy {
    /** Backend sends the HTTP request itself with the stored partial credentials. */
    SERVER,
    /** Request is forwarded to the user's authenticated browser session. */
    DELEGATED
}
