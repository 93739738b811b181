package com.autowake.core.idle;

import java.time.Instant;

/**
 * Keep-alive reservation for a loaded inference model.
 *
 * @param modelName      model identifier as the inference runtime knows it (e.g. "llama3.2:3b")
 * @param keepAliveUntil after this instant the model may be unloaded
 */
public record ModelLease(String modelName, Instant keepAliveUntil) {

    public boolean isExpired(Instant now) {
        return now.isAfter(keepAliveUntil);
    }
}
