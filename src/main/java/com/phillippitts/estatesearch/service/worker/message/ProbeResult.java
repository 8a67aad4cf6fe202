package com.phillippitts.estatesearch.service.worker.message;

import com.phillippitts.estatesearch.domain.LeverageReport;

public record ProbeResult(LeverageReport report) implements ReplyPayload {
}
