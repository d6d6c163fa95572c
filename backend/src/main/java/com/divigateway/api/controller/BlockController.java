package com.divigateway.api.controller;

import com.divigateway.api.validation.RequestValidator;
import com.divigateway.domain.GatewayResponse;
import com.divigateway.gateway.DiviGatewayService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * GET /blockcount, /block/{hash}, /blockhash/{height}.
 */
@RestController
@RequiredArgsConstructor
public class BlockController {

    private final DiviGatewayService gatewayService;
    private final RequestValidator requestValidator;

    @GetMapping("/blockcount")
    public Mono<ResponseEntity<GatewayResponse>> getBlockCount() {
        return gatewayService.getBlockCount();
    }

    @GetMapping("/block/{hash}")
    public Mono<ResponseEntity<GatewayResponse>> getBlock(
            @PathVariable String hash,
            @RequestParam(name = "verbose", defaultValue = "true") boolean verbose
    ) {
        return gatewayService.getBlock(requestValidator.requireHash(hash, "block hash"), verbose);
    }

    @GetMapping("/blockhash/{height}")
    public Mono<ResponseEntity<GatewayResponse>> getBlockHash(@PathVariable String height) {
        return gatewayService.getBlockHash(requestValidator.requireHeight(height));
    }
}
