package com.sentimento.service.core.window;

import java.time.Instant;

/** One accepted composite pair as held by the {@link SampleWindow}. */
public record Sample(double hope, double sorrow, Instant recordedAt) {}
