package com.divigateway.peer;

import com.divigateway.common.DerivedViewCache;
import com.divigateway.config.PeerViewProperties;
import com.divigateway.domain.GatewayResponse;
import com.divigateway.gateway.ResponseNormalizer;
import com.divigateway.rpc.DiviRpcClient;
import com.divigateway.rpc.RpcOutcome;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

import static com.divigateway.rpc.DiviRpcMethods.GET_BLOCK_COUNT;
import static com.divigateway.rpc.DiviRpcMethods.GET_PEER_INFO;

/**
 * Filtered peer list (getpeerinfo + getblockcount through {@link PeerFilter}), cached for
 * divi.peers.cache-ttl. Each value of the IPv6 flag has its own slot. Only successful views
 * are cached; failures are returned as normalized envelopes.
 */
@Service
@Slf4j
public class PeerViewService {

    private static final TypeReference<List<PeerRecord>> PEER_LIST = new TypeReference<>() {
    };

    private final DiviRpcClient rpcClient;
    private final ResponseNormalizer normalizer;
    private final ObjectMapper objectMapper;
    private final PeerFilter peerFilter;
    private final DerivedViewCache<ResponseEntity<GatewayResponse>> ipv4View;
    private final DerivedViewCache<ResponseEntity<GatewayResponse>> ipv6View;

    public PeerViewService(DiviRpcClient rpcClient,
                           ResponseNormalizer normalizer,
                           ObjectMapper objectMapper,
                           PeerViewProperties properties,
                           Clock clock) {
        this.rpcClient = rpcClient;
        this.normalizer = normalizer;
        this.objectMapper = objectMapper;
        this.peerFilter = new PeerFilter(properties.getMinimumVersion(), properties.getHeightWindow());
        this.ipv4View = new DerivedViewCache<>(properties.getCacheTtl(), clock, PeerViewService::isServable);
        this.ipv6View = new DerivedViewCache<>(properties.getCacheTtl(), clock, PeerViewService::isServable);
    }

    public Mono<ResponseEntity<GatewayResponse>> getPeers(boolean includeIpv6) {
        DerivedViewCache<ResponseEntity<GatewayResponse>> view = includeIpv6 ? ipv6View : ipv4View;
        return view.getOrCompute(() -> computeView(includeIpv6));
    }

    private Mono<ResponseEntity<GatewayResponse>> computeView(boolean includeIpv6) {
        log.info("Recomputing peer view (ipv6={})", includeIpv6);
        return Mono.zip(rpcClient.call(GET_PEER_INFO, List.of()), rpcClient.call(GET_BLOCK_COUNT, List.of()))
                .map(outcomes -> buildView(outcomes.getT1(), outcomes.getT2(), includeIpv6));
    }

    ResponseEntity<GatewayResponse> buildView(RpcOutcome peersOutcome, RpcOutcome heightOutcome, boolean includeIpv6) {
        if (!(peersOutcome instanceof RpcOutcome.Success peers)) {
            return normalizer.toResponseEntity(peersOutcome);
        }
        if (!(heightOutcome instanceof RpcOutcome.Success height)) {
            return normalizer.toResponseEntity(heightOutcome);
        }
        JsonNode heightNode = ResponseNormalizer.unwrap(height.payload());
        if (heightNode == null || !heightNode.isIntegralNumber()) {
            log.warn("getblockcount returned a non-integer result: {}", heightNode);
            return normalizer.internalError();
        }
        JsonNode peerNodes = ResponseNormalizer.unwrap(peers.payload());
        if (peerNodes == null || !peerNodes.isArray()) {
            log.warn("getpeerinfo returned a non-array result: {}", peerNodes);
            return normalizer.internalError();
        }
        try {
            List<PeerRecord> records = objectMapper.convertValue(peerNodes, PEER_LIST);
            List<FilteredPeerGroup> groups = peerFilter.filter(records, heightNode.asLong(), includeIpv6);
            return normalizer.toResponseEntity(new RpcOutcome.Success(objectMapper.valueToTree(groups)));
        } catch (MalformedPeerAddressException e) {
            log.warn("Peer view rejected, node reported address '{}'", e.getAddress());
            return normalizer.internalError();
        } catch (IllegalArgumentException e) {
            log.warn("Unreadable getpeerinfo entry", e);
            return normalizer.internalError();
        }
    }

    private static boolean isServable(ResponseEntity<GatewayResponse> response) {
        return response.getStatusCode().is2xxSuccessful();
    }
}
