/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.mindscribe.exception.SessionAlreadyActiveException} → 409 Conflict</li>
 *   <li>{@link IllegalArgumentException} (unknown command) → 400 Bad Request</li>
 *   <li>{@link java.util.concurrent.RejectedExecutionException} (command queue full) → 503 Service Unavailable</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "SESSION_ALREADY_ACTIVE",
 *   "message": "A session is already active",
 *   "details": "Stop, cancel or acknowledge session ... first",
 *   "timestamp": "2026-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.mindscribe.presentation.exception;
