/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.estatesearch.exception.UnknownSessionException} → 404 Not Found</li>
 *   <li>{@link com.phillippitts.estatesearch.exception.InvalidWorkerReplyException}, blank or
 *       oversized messages, unreadable bodies → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.estatesearch.exception.WorkerUnavailableException} → 503 Service Unavailable (retry)</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "InvalidWorkerReplyException",
 *   "message": "Invalid worker reply",
 *   "details": "successful reply without result",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * @see com.phillippitts.estatesearch.exception
 * @since 1.0
 */
package com.phillippitts.estatesearch.presentation.exception;
