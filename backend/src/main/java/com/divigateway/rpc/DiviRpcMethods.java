package com.divigateway.rpc;

/**
 * Upstream JSON-RPC method names used by the gateway.
 */
public final class DiviRpcMethods {

    public static final String GET_BLOCK_COUNT = "getblockcount";
    public static final String GET_BLOCK = "getblock";
    public static final String GET_BLOCK_HASH = "getblockhash";
    public static final String GET_INFO = "getinfo";
    public static final String GET_RAW_TRANSACTION = "getrawtransaction";
    public static final String DECODE_RAW_TRANSACTION = "decoderawtransaction";
    public static final String SEND_RAW_TRANSACTION = "sendrawtransaction";
    public static final String GET_CONNECTION_COUNT = "getconnectioncount";
    public static final String GET_PEER_INFO = "getpeerinfo";
    public static final String GET_ADDRESS_BALANCE = "getaddressbalance";
    public static final String GET_ADDRESS_DELTAS = "getaddressdeltas";
    public static final String GET_ADDRESS_TXIDS = "getaddresstxids";
    public static final String GET_ADDRESS_UTXOS = "getaddressutxos";
    public static final String GET_RAW_MEMPOOL = "getrawmempool";
    public static final String GET_MEMPOOL_INFO = "getmempoolinfo";
    public static final String GET_LOTTERY_BLOCK_WINNERS = "getlotteryblockwinners";

    private DiviRpcMethods() {
    }
}
