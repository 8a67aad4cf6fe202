/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.estatesearch.exception.EstateSearchException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.estatesearch.exception.WorkerUnavailableException} - A worker
 *       could not accept a dispatched request</li>
 *   <li>{@link com.phillippitts.estatesearch.exception.UnknownSessionException} - A correlated
 *       message referenced a session that does not exist</li>
 *   <li>{@link com.phillippitts.estatesearch.exception.InvalidWorkerReplyException} - A worker
 *       reply failed structural validation</li>
 *   <li>{@link com.phillippitts.estatesearch.exception.SessionStateException} - Illegal session
 *       phase transition (programming error)</li>
 * </ul>
 *
 * <p>Per-property enrichment failures are not exceptions: they degrade the affected field to
 * absent. Exceptions map to HTTP status codes in {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.estatesearch.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.estatesearch.exception;
