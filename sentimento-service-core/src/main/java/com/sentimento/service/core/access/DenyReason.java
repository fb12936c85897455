package com.sentimento.service.core.access;

public enum DenyReason {
    /** The caller never authenticated. */
    NO_PRINCIPAL,
    /** The caller authenticated but its role is not among the required ones. */
    INSUFFICIENT_ROLE
}
