package com.divigateway.api.controller;

import com.divigateway.api.validation.InvalidRequestException;
import com.divigateway.domain.GatewayResponse;
import com.divigateway.gateway.DiviGatewayService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * GET /getlottery[?blockheight=N]. Without a height the node returns the current candidates;
 * the list is purged on the payout block.
 */
@RestController
@RequiredArgsConstructor
public class LotteryController {

    private final DiviGatewayService gatewayService;

    @GetMapping("/getlottery")
    public Mono<ResponseEntity<GatewayResponse>> getLottery(@RequestParam(name = "blockheight", required = false) Long blockHeight) {
        if (blockHeight != null && blockHeight < 0) {
            throw new InvalidRequestException("Invalid block height: expected a non-negative integer");
        }
        return gatewayService.getLotteryBlockWinners(blockHeight);
    }
}
