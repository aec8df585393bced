package ai.pipestream.workspace.error;

/**
 * Transport-neutral classification of engine failures.
 * Callers map these to their own status codes.
 */
public enum ErrorCategory {

    /**
     * Node or grant absent. Maps to HTTP 404 Not Found.
     */
    NOT_FOUND,

    /**
     * Resolved level insufficient, or the target is hidden from the caller.
     * Maps to HTTP 403 Forbidden.
     */
    PERMISSION_DENIED,

    /**
     * Structural violation on create or move.
     * Maps to HTTP 400 Bad Request.
     */
    VALIDATION,

    /**
     * Identifier issuance halted. Maps to HTTP 503 Service Unavailable.
     */
    UNAVAILABLE
}
