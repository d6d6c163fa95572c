package com.divigateway.api.controller;

import com.divigateway.domain.GatewayResponse;
import com.divigateway.gateway.DiviGatewayService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequiredArgsConstructor
public class MempoolController {

    private final DiviGatewayService gatewayService;

    @GetMapping("/getrawmempool")
    public Mono<ResponseEntity<GatewayResponse>> getRawMempool() {
        return gatewayService.getRawMempool();
    }

    @GetMapping("/getmempoolinfo")
    public Mono<ResponseEntity<GatewayResponse>> getMempoolInfo() {
        return gatewayService.getMempoolInfo();
    }
}
