package com.vcfops.client.testkit;

import com.vcfops.client.transport.ApiResponse;
import java.io.IOException;

/** Produces the scripted response for one matched request. */
@FunctionalInterface
public interface ApiHandler {
    ApiResponse handle(RecordedApiRequest request) throws IOException;
}
