package com.sentimento.controller.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.sentimento.service.core.hub.BroadcastDispatcher;
import com.sentimento.service.core.hub.IngestOutcome;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** Producer-facing ingest. Unauthenticated here; authentication can be layered in front of it. */
@RestController
public class IngestController {
    private final BroadcastDispatcher dispatcher;

    public IngestController(BroadcastDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping(
            path = "/ingest",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> ingest(@RequestBody(required = false) JsonNode body) {
        IngestOutcome outcome = dispatcher.accept(body);
        if (outcome instanceof IngestOutcome.Rejected rejected) {
            throw new InvalidPayloadException(rejected.error());
        }
        IngestOutcome.Accepted accepted = (IngestOutcome.Accepted) outcome;
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("message", "Event broadcast to " + accepted.report().sent() + " of "
                + accepted.report().attempted() + " client(s)");
        response.put("clientCount", accepted.clientCount());
        response.put("timestamp", accepted.event().timestamp());
        return response;
    }
}
