package com.sentimento.controller.rest;

import com.sentimento.controller.rest.security.RoleGuard;
import com.sentimento.live.model.IsoTimestamps;
import com.sentimento.service.core.window.MetricsSnapshot;
import com.sentimento.service.core.window.Sample;
import com.sentimento.service.core.window.SampleWindow;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/metrics", produces = MediaType.APPLICATION_JSON_VALUE)
public class MetricsController {
    private final SampleWindow window;
    private final RoleGuard roleGuard;
    private final Clock clock;

    public MetricsController(SampleWindow window, RoleGuard roleGuard, Clock clock) {
        this.window = window;
        this.roleGuard = roleGuard;
        this.clock = clock;
    }

    /** Rolling hope/sorrow statistics. Council or Seedbringer. */
    @GetMapping
    public Map<String, Object> metrics(
            @RequestParam(value = "recent", required = false) Integer recent, HttpServletRequest request) {
        roleGuard.require(request, RoleGuard.COUNCIL_OR_SEEDBRINGER);
        MetricsSnapshot snapshot = window.snapshot(boundedCount(recent, "recent"));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("hopeRatio", snapshot.hopeRatio());
        body.put("sampleCount", snapshot.sampleCount());
        body.put("avgHope", snapshot.avgHope());
        body.put("avgSorrow", snapshot.avgSorrow());
        body.put("recentCount", snapshot.recentCount());
        body.put("totalAccepted", snapshot.totalAccepted());
        body.put("timestamp", IsoTimestamps.now(clock));
        return body;
    }

    /** Raw recent samples, oldest first. Seedbringer only. */
    @GetMapping("/samples")
    public Map<String, Object> samples(
            @RequestParam(value = "count", required = false) Integer count, HttpServletRequest request) {
        roleGuard.require(request, RoleGuard.SEEDBRINGER);
        List<Sample> samples = window.recent(boundedCount(count, "count"));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("samples", samples.stream().map(MetricsController::toRow).toList());
        body.put("count", samples.size());
        body.put("timestamp", IsoTimestamps.now(clock));
        return body;
    }

    private int boundedCount(Integer requested, String name) {
        if (requested == null) {
            return Math.min(window.defaultRecentCount(), window.capacity());
        }
        if (requested <= 0) {
            throw new IllegalArgumentException(name + " must be a positive integer");
        }
        return Math.min(requested, window.capacity());
    }

    private static Map<String, Object> toRow(Sample sample) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("hope", sample.hope());
        row.put("sorrow", sample.sorrow());
        row.put("recordedAt", IsoTimestamps.format(sample.recordedAt()));
        return row;
    }
}
