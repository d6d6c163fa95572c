package com.divigateway.api.controller;

import com.divigateway.api.validation.RequestValidator;
import com.divigateway.domain.GatewayResponse;
import com.divigateway.gateway.DiviGatewayService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Address index queries. {isVault}=true looks the value up as a vault owner key.
 */
@RestController
@RequiredArgsConstructor
public class AddressController {

    private final DiviGatewayService gatewayService;
    private final RequestValidator requestValidator;

    @GetMapping("/getaddressbalance/{address}/{isVault}")
    public Mono<ResponseEntity<GatewayResponse>> getAddressBalance(@PathVariable String address, @PathVariable String isVault) {
        return gatewayService.getAddressBalance(requestValidator.requireAddress(address), RequestValidator.parseFlag(isVault));
    }

    @GetMapping("/getaddressdeltas/{address}/{isVault}")
    public Mono<ResponseEntity<GatewayResponse>> getAddressDeltas(@PathVariable String address, @PathVariable String isVault) {
        return gatewayService.getAddressDeltas(requestValidator.requireAddress(address), RequestValidator.parseFlag(isVault));
    }

    @GetMapping("/getaddresstxids/{address}/{isVault}")
    public Mono<ResponseEntity<GatewayResponse>> getAddressTxids(@PathVariable String address, @PathVariable String isVault) {
        return gatewayService.getAddressTxids(requestValidator.requireAddress(address), RequestValidator.parseFlag(isVault));
    }

    @GetMapping("/getaddressutxos/{address}/{isVault}")
    public Mono<ResponseEntity<GatewayResponse>> getAddressUtxos(@PathVariable String address, @PathVariable String isVault) {
        return gatewayService.getAddressUtxos(requestValidator.requireAddress(address), RequestValidator.parseFlag(isVault));
    }
}
