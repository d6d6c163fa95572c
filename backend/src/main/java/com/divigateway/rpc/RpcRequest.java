package com.divigateway.rpc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A single JSON-RPC request as sent to the node. Field order matches the wire body.
 */
public record RpcRequest(String jsonrpc, String method, List<?> params, int id) {

    public static final String PROTOCOL_VERSION = "2.0";
    public static final int REQUEST_ID = 1;

    public static RpcRequest of(String method, List<?> params) {
        return new RpcRequest(PROTOCOL_VERSION, method, params != null ? copyOf(params) : List.of(), REQUEST_ID);
    }

    /** Unlike List.copyOf this keeps null elements, which JSON-RPC sends as null. */
    private static List<?> copyOf(List<?> params) {
        return Collections.unmodifiableList(new ArrayList<>(params));
    }
}
