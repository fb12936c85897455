package com.sentimento.live.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** First frame a subscriber receives after the upgrade completes. */
@JsonPropertyOrder({"type", "message", "timestamp"})
public record WelcomeFrame(String type, String message, String timestamp) {

    public static WelcomeFrame connected(String timestamp) {
        return new WelcomeFrame("welcome", "connected", timestamp);
    }
}
