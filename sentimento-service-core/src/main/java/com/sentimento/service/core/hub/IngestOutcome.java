package com.sentimento.service.core.hub;

import com.sentimento.live.model.LiveEvent;
import com.sentimento.service.core.ingest.ValidationError;

/** Result of {@link BroadcastDispatcher#accept}. */
public sealed interface IngestOutcome permits IngestOutcome.Accepted, IngestOutcome.Rejected {

    /** The event was sampled once and offered to every registered connection. */
    record Accepted(LiveEvent event, FanOutReport report, int clientCount) implements IngestOutcome {}

    /** Nothing was sampled or broadcast. */
    record Rejected(ValidationError error) implements IngestOutcome {}
}
