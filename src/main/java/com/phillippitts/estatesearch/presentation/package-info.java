/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>This package contains the HTTP/REST boundary of the application. Presentation depends
 * on service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - chat and worker-reply endpoints, markdown rendering</li>
 *   <li>{@code presentation.dto} - request and response bodies</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * @see com.phillippitts.estatesearch.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.estatesearch.presentation;
