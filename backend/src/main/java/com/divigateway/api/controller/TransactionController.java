package com.divigateway.api.controller;

import com.divigateway.api.validation.RequestValidator;
import com.divigateway.domain.GatewayResponse;
import com.divigateway.gateway.DiviGatewayService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Transaction lookup, decode and broadcast.
 */
@RestController
@RequiredArgsConstructor
public class TransactionController {

    private final DiviGatewayService gatewayService;
    private final RequestValidator requestValidator;

    @GetMapping("/tx/{txid}")
    public Mono<ResponseEntity<GatewayResponse>> getTransaction(
            @PathVariable String txid,
            @RequestParam(name = "verbose", defaultValue = "true") boolean verbose
    ) {
        return gatewayService.getRawTransaction(requestValidator.requireHash(txid, "txid"), verbose);
    }

    @GetMapping("/decode-raw-tx/{hex}")
    public Mono<ResponseEntity<GatewayResponse>> decodeRawTransaction(@PathVariable String hex) {
        return gatewayService.decodeRawTransaction(requestValidator.requireHex(hex, "raw transaction"));
    }

    /** Query params, not a JSON body: POST /sendrawtransaction?hexstring=...&allowhighfees=false. */
    @PostMapping("/sendrawtransaction")
    public Mono<ResponseEntity<GatewayResponse>> sendRawTransaction(
            @RequestParam(name = "hexstring", required = false) String hexstring,
            @RequestParam(name = "allowhighfees", defaultValue = "false") boolean allowHighFees
    ) {
        return gatewayService.sendRawTransaction(requestValidator.requireHex(hexstring, "hexstring"), allowHighFees);
    }
}
