package com.phillippitts.estatesearch.service.orchestration;

import java.util.Locale;

/**
 * Why an outstanding request resolved without a result. All three are permanent for the
 * current turn.
 */
public enum FailureReason {
    /** Worker unreachable at dispatch time, after the retry bound was spent. */
    DISPATCH,
    /** Worker replied with an explicit failure. */
    WORKER,
    /** No reply before the request deadline or the enrichment window closed. */
    TIMEOUT;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
