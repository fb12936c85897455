package com.sentimento.service.core.spi;

/** Claims returned by an external identity provider for a token it accepted. */
public record VerifiedToken(String email, String sub, String issuer) {}
