package com.divigateway.api.controller;

import com.divigateway.api.dto.PingResponse;
import com.divigateway.domain.GatewayResponse;
import com.divigateway.gateway.DiviGatewayService;
import com.divigateway.peer.PeerViewService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Node and network status: ping, info, connection count, filtered peer list.
 */
@RestController
@RequiredArgsConstructor
public class NetworkController {

    private final DiviGatewayService gatewayService;
    private final PeerViewService peerViewService;

    /** Gateway liveness only; does not reach the node. */
    @GetMapping("/ping")
    public PingResponse ping() {
        return PingResponse.pong();
    }

    @GetMapping("/info")
    public Mono<ResponseEntity<GatewayResponse>> getInfo() {
        return gatewayService.getInfo();
    }

    @GetMapping("/connectioncount")
    public Mono<ResponseEntity<GatewayResponse>> getConnectionCount() {
        return gatewayService.getConnectionCount();
    }

    @GetMapping("/peers")
    public Mono<ResponseEntity<GatewayResponse>> getPeers(@RequestParam(name = "ipv6", defaultValue = "false") boolean includeIpv6) {
        return peerViewService.getPeers(includeIpv6);
    }
}
