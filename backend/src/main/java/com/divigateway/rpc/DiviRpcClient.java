package com.divigateway.rpc;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * JSON-RPC client for the single configured Divi node.
 * No retries: one call, one HTTP request.
 */
public interface DiviRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param method e.g. "getblock"
     * @param params positional params, serialized as a JSON array
     * @return the classified outcome; the Mono never errors
     */
    Mono<RpcOutcome> call(String method, List<?> params);
}
