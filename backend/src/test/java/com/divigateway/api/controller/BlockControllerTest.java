package com.divigateway.api.controller;

import com.divigateway.api.validation.RequestValidator;
import com.divigateway.gateway.DiviGatewayService;
import com.divigateway.gateway.ResponseNormalizer;
import com.divigateway.rpc.DiviRpcClient;
import com.divigateway.rpc.RpcOutcome;
import com.divigateway.rpc.TransportFailureKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BlockControllerTest {

    private static final String HASH = "00000000839a8e6886ab5951d76f411475428afc90947ee320161bbf18eb6048";

    @Mock
    private DiviRpcClient rpcClient;

    private WebTestClient webTestClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        ResponseNormalizer normalizer = new ResponseNormalizer(Clock.systemUTC());
        BlockController controller = new BlockController(new DiviGatewayService(rpcClient, normalizer), new RequestValidator());
        webTestClient = WebTestClient.bindToController(controller)
                .controllerAdvice(new GatewayExceptionHandler(normalizer))
                .build();
    }

    @Test
    void blockCount_returnsUnwrappedResult() throws Exception {
        when(rpcClient.call(anyString(), anyList()))
                .thenReturn(Mono.just(new RpcOutcome.Success(objectMapper.readTree("{\"result\":1234,\"error\":null,\"id\":1}"))));

        webTestClient.get().uri("/blockcount")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.result").isEqualTo(1234)
                .jsonPath("$.error").isEmpty()
                .jsonPath("$.timestamp_utc").isNotEmpty();
    }

    @Test
    @DisplayName("malformed hash is rejected locally without calling the node")
    void malformedHash() {
        webTestClient.get().uri("/block/zz")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.result").isEmpty()
                .jsonPath("$.error.message").isEqualTo("Invalid block hash: expected 64 hexadecimal characters");

        verifyNoInteractions(rpcClient);
    }

    @Test
    void validHash_forwardsVerbosity() throws Exception {
        when(rpcClient.call(anyString(), anyList()))
                .thenReturn(Mono.just(new RpcOutcome.Success(objectMapper.readTree("{\"result\":\"0100abcd\",\"error\":null,\"id\":1}"))));

        webTestClient.get().uri("/block/{hash}?verbose=false", HASH)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.result").isEqualTo("0100abcd");

        verify(rpcClient).call("getblock", List.of(HASH, false));
    }

    @Test
    void nonBooleanVerbose_isBadRequest() {
        webTestClient.get().uri("/block/{hash}?verbose=maybe", HASH)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.message").isNotEmpty();

        verifyNoInteractions(rpcClient);
    }

    @Test
    void blockHash_rejectsNegativeAndNonNumericHeight() {
        webTestClient.get().uri("/blockhash/-1").exchange().expectStatus().isBadRequest();
        webTestClient.get().uri("/blockhash/tip").exchange().expectStatus().isBadRequest();

        verifyNoInteractions(rpcClient);
    }

    @Test
    @DisplayName("node down maps to 503 with a null result")
    void nodeUnavailable() {
        when(rpcClient.call(anyString(), anyList()))
                .thenReturn(Mono.just(new RpcOutcome.TransportFailure(TransportFailureKind.UNAVAILABLE, "Connection refused")));

        webTestClient.get().uri("/blockhash/100")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.result").isEmpty()
                .jsonPath("$.error.message").isEqualTo(ResponseNormalizer.UNAVAILABLE_MESSAGE);
    }

    @Test
    @DisplayName("node timeout maps to 504")
    void nodeTimeout() {
        when(rpcClient.call(anyString(), anyList()))
                .thenReturn(Mono.just(new RpcOutcome.TransportFailure(TransportFailureKind.TIMEOUT, "deadline")));

        webTestClient.get().uri("/blockcount")
                .exchange()
                .expectStatus().isEqualTo(504)
                .expectBody()
                .jsonPath("$.error.message").isEqualTo(ResponseNormalizer.TIMEOUT_MESSAGE);
    }

    @Test
    @DisplayName("node rejection maps to 400 with the fixed upstream message")
    void upstreamRejection() {
        when(rpcClient.call(anyString(), anyList()))
                .thenReturn(Mono.just(new RpcOutcome.UpstreamError("Block height out of range", -8)));

        webTestClient.get().uri("/blockhash/99999999")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.message").isEqualTo(ResponseNormalizer.UPSTREAM_ERROR_MESSAGE);
    }
}
