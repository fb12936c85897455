package com.sentimento.service.core.hub;

public enum SendDecision {
    SEND,
    DROP
}
