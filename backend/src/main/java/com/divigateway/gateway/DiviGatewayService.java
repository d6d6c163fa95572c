package com.divigateway.gateway;

import com.divigateway.domain.GatewayResponse;
import com.divigateway.rpc.DiviRpcClient;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static com.divigateway.rpc.DiviRpcMethods.*;

/**
 * One method per gateway operation: picks the upstream method and positional params,
 * performs the call and normalizes the outcome. Inputs are validated by the caller.
 */
@Service
@RequiredArgsConstructor
public class DiviGatewayService {

    private final DiviRpcClient rpcClient;
    private final ResponseNormalizer normalizer;

    public Mono<ResponseEntity<GatewayResponse>> getBlockCount() {
        return forward(GET_BLOCK_COUNT, List.of());
    }

    public Mono<ResponseEntity<GatewayResponse>> getBlock(String blockHash, boolean verbose) {
        return forward(GET_BLOCK, List.of(blockHash, verbose));
    }

    public Mono<ResponseEntity<GatewayResponse>> getBlockHash(long height) {
        return forward(GET_BLOCK_HASH, List.of(height));
    }

    public Mono<ResponseEntity<GatewayResponse>> getInfo() {
        return forward(GET_INFO, List.of());
    }

    /** The node expects the verbose flag as 1/0 for this method. */
    public Mono<ResponseEntity<GatewayResponse>> getRawTransaction(String txid, boolean verbose) {
        return forward(GET_RAW_TRANSACTION, List.of(txid, verbose ? 1 : 0));
    }

    public Mono<ResponseEntity<GatewayResponse>> decodeRawTransaction(String hex) {
        return forward(DECODE_RAW_TRANSACTION, List.of(hex));
    }

    public Mono<ResponseEntity<GatewayResponse>> sendRawTransaction(String hex, boolean allowHighFees) {
        return forward(SEND_RAW_TRANSACTION, List.of(hex, allowHighFees));
    }

    public Mono<ResponseEntity<GatewayResponse>> getConnectionCount() {
        return forward(GET_CONNECTION_COUNT, List.of());
    }

    public Mono<ResponseEntity<GatewayResponse>> getAddressBalance(String address, boolean isVault) {
        return forward(GET_ADDRESS_BALANCE, addressQuery(address, isVault));
    }

    public Mono<ResponseEntity<GatewayResponse>> getAddressDeltas(String address, boolean isVault) {
        return forward(GET_ADDRESS_DELTAS, addressQuery(address, isVault));
    }

    public Mono<ResponseEntity<GatewayResponse>> getAddressTxids(String address, boolean isVault) {
        return forward(GET_ADDRESS_TXIDS, addressQuery(address, isVault));
    }

    public Mono<ResponseEntity<GatewayResponse>> getAddressUtxos(String address, boolean isVault) {
        return forward(GET_ADDRESS_UTXOS, addressQuery(address, isVault));
    }

    public Mono<ResponseEntity<GatewayResponse>> getRawMempool() {
        return forward(GET_RAW_MEMPOOL, List.of());
    }

    public Mono<ResponseEntity<GatewayResponse>> getMempoolInfo() {
        return forward(GET_MEMPOOL_INFO, List.of());
    }

    /**
     * Lottery candidates for the given block, or the current candidates when height is null.
     */
    public Mono<ResponseEntity<GatewayResponse>> getLotteryBlockWinners(Long blockHeight) {
        return forward(GET_LOTTERY_BLOCK_WINNERS, blockHeight != null ? List.of(blockHeight) : List.of());
    }

    private Mono<ResponseEntity<GatewayResponse>> forward(String method, List<?> params) {
        return rpcClient.call(method, params).map(normalizer::toResponseEntity);
    }

    /** Address methods take {"addresses": [...]} plus the vault-owner-key flag. */
    private static List<Object> addressQuery(String address, boolean isVault) {
        return List.of(Map.of("addresses", List.of(address)), isVault);
    }
}
