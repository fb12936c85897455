package com.sentimento.service.core.hub;

/**
 * Outcome of one broadcast.
 *
 * @param attempted registered connections the event was offered to
 * @param sent frames enqueued on a transport
 * @param dropped {@code attempted - sent}
 * @param failed the part of {@code dropped} caused by transport errors rather than backpressure
 */
public record FanOutReport(int attempted, int sent, int dropped, int failed) {

    public static final FanOutReport NONE = new FanOutReport(0, 0, 0, 0);

    public FanOutReport {
        if (sent + dropped != attempted || failed > dropped || failed < 0 || sent < 0) {
            throw new IllegalArgumentException(
                    "inconsistent fan-out report attempted=" + attempted + " sent=" + sent + " dropped=" + dropped
                            + " failed=" + failed);
        }
    }

    public int backpressured() {
        return dropped - failed;
    }
}
