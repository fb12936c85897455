package com.sentimento.service.core.ingest;

/** Field-level reason an inbound payload was refused. */
public record ValidationError(String field, String message) {}
