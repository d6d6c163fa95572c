package com.divigateway.rpc;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Divi JSON-RPC client using WebClient. The WebClient carries the node URL and basic auth;
 * every call is bounded by the call deadline.
 */
@Slf4j
public class WebClientDiviRpcClient implements DiviRpcClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration callDeadline;

    public WebClientDiviRpcClient(WebClient webClient, ObjectMapper objectMapper, Duration callDeadline) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.callDeadline = callDeadline;
    }

    @Override
    public Mono<RpcOutcome> call(String method, List<?> params) {
        RpcRequest request = RpcRequest.of(method, params);
        return webClient.post()
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> RpcOutcomeClassifier.fromResponse(response.statusCode().value(), body, objectMapper)))
                .timeout(callDeadline)
                .onErrorResume(e -> Mono.just(RpcOutcomeClassifier.fromError(e)))
                .doOnNext(outcome -> logOutcome(request, outcome));
    }

    private static void logOutcome(RpcRequest request, RpcOutcome outcome) {
        if (outcome instanceof RpcOutcome.Success) {
            log.debug("RPC {} params={} -> OK", request.method(), request.params());
        } else if (outcome instanceof RpcOutcome.TransportFailure failure) {
            log.warn("RPC {} params={} -> {}: {}", request.method(), request.params(), failure.kind(), failure.message());
        } else if (outcome instanceof RpcOutcome.UpstreamError error) {
            log.warn("RPC {} params={} -> node error {}: {}", request.method(), request.params(), error.code(), error.message());
        }
    }
}
