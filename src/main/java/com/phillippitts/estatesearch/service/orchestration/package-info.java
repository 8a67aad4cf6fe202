/**
 * Coordinator engine: routes user turns to workers, merges their replies and assembles
 * one response per turn.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.estatesearch.service.orchestration.EstateSearchCoordinator} -
 *       entry point; serializes all inputs of a session on its mailbox</li>
 *   <li>{@link com.phillippitts.estatesearch.service.orchestration.Dispatcher} - issues
 *       correlated worker requests and decides where a Scoping verdict leads</li>
 *   <li>{@link com.phillippitts.estatesearch.service.orchestration.Aggregator} - merges replies
 *       and evaluates the completion predicate</li>
 *   <li>{@link com.phillippitts.estatesearch.service.orchestration.ResponseAssembler} and
 *       {@link com.phillippitts.estatesearch.service.orchestration.MapComposer} - build the
 *       immutable response and its static map</li>
 *   <li>{@link com.phillippitts.estatesearch.service.orchestration.SessionStateMachine} -
 *       validates phase transitions</li>
 * </ul>
 *
 * <p>Design Patterns:
 * <ul>
 *   <li><b>Event-Driven:</b> dispatch failures, enrichment failures and completed turns are
 *       Spring application events</li>
 *   <li><b>Fail-Safe:</b> a failed or late enrichment leaves its field absent and never fails
 *       the turn</li>
 * </ul>
 *
 * @see com.phillippitts.estatesearch.service.session
 * @see com.phillippitts.estatesearch.service.worker
 * @since 1.0
 */
package com.phillippitts.estatesearch.service.orchestration;
