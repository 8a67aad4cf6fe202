/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@link com.phillippitts.estatesearch.presentation.controller.ChatController}
 *       - {@code POST /api/sessions/{id}/messages}, {@code GET /api/sessions/{id}} and
 *       {@code GET /api/sessions/{id}/responses}</li>
 *   <li>{@link com.phillippitts.estatesearch.presentation.controller.WorkerReplyController}
 *       - {@code POST /api/worker-replies} for asynchronous worker results</li>
 * </ul>
 *
 * <p>Controllers are thin adapters: they delegate to the
 * {@link com.phillippitts.estatesearch.service.orchestration.EstateSearchCoordinator} and
 * let {@code GlobalExceptionHandler} translate exceptions.
 *
 * @see com.phillippitts.estatesearch.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.estatesearch.presentation.controller;
