package com.sentimento.controller.live;

import jakarta.websocket.SendHandler;

/**
 * Starts writing one text frame and returns without waiting for the network. The handler runs when
 * the write finishes, possibly on a container thread.
 */
@FunctionalInterface
interface FrameWriter {

    void write(String payload, SendHandler completion);
}
