package com.vcfops.client.transport;

import java.io.Closeable;
import java.io.IOException;

/**
 * Minimal transport SPI: perform one HTTP exchange against a VCF Operations instance.
 *
 * <p>Implementations return every response, successful or not; status handling belongs to the caller. An
 * {@link IOException} means no response was obtained (connect failure, timeout, interrupted).
 */
public interface ApiTransport extends Closeable {

    ApiResponse execute(ApiRequest request) throws IOException;

    @Override
    default void close() throws IOException {
        /* no-op */
    }
}
