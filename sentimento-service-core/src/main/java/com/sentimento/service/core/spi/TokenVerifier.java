package com.sentimento.service.core.spi;

/**
 * Verifies raw bearer tokens against an external identity provider. The hub ships no implementation;
 * deployments contribute one as a Spring bean.
 */
public interface TokenVerifier {

    /**
     * @throws TokenVerificationException if the token is malformed, expired or not signed by the provider
     */
    VerifiedToken verify(String rawToken) throws TokenVerificationException;
}
