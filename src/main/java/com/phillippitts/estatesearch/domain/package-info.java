/**
 * Immutable domain model shared by the orchestration core and the outer surfaces.
 *
 * <p>Records here carry no behaviour beyond validation. Listing, geocoding, discovery,
 * community and leverage data originate from worker replies; {@link
 * com.phillippitts.estatesearch.domain.CompositeResponse} is the assembled per-turn answer.
 *
 * @since 1.0
 */
package com.phillippitts.estatesearch.domain;
