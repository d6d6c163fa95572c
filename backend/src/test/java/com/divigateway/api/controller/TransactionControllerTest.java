package com.divigateway.api.controller;

import com.divigateway.api.validation.RequestValidator;
import com.divigateway.gateway.DiviGatewayService;
import com.divigateway.gateway.ResponseNormalizer;
import com.divigateway.rpc.DiviRpcClient;
import com.divigateway.rpc.RpcOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
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
class TransactionControllerTest {

    private static final String TXID = "a1075db55d416d3ca199f55b6084e2115b9345e16c5cf302fc80e9d5fbf5d48d";

    @Mock
    private DiviRpcClient rpcClient;

    private WebTestClient webTestClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        ResponseNormalizer normalizer = new ResponseNormalizer(Clock.systemUTC());
        TransactionController controller =
                new TransactionController(new DiviGatewayService(rpcClient, normalizer), new RequestValidator());
        webTestClient = WebTestClient.bindToController(controller)
                .controllerAdvice(new GatewayExceptionHandler(normalizer))
                .build();
    }

    private void nodeReturns(String body) throws Exception {
        when(rpcClient.call(anyString(), anyList()))
                .thenReturn(Mono.just(new RpcOutcome.Success(objectMapper.readTree(body))));
    }

    @Test
    void tx_defaultsToVerbose() throws Exception {
        nodeReturns("{\"result\":{\"txid\":\"" + TXID + "\"},\"error\":null,\"id\":1}");

        webTestClient.get().uri("/tx/{txid}", TXID)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.result.txid").isEqualTo(TXID);

        verify(rpcClient).call("getrawtransaction", List.of(TXID, 1));
    }

    @Test
    void tx_invalidTxid() {
        webTestClient.get().uri("/tx/not-a-txid")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.message").isEqualTo("Invalid txid: expected 64 hexadecimal characters");

        verifyNoInteractions(rpcClient);
    }

    @Test
    void decode_rejectsOddLengthHex() {
        webTestClient.get().uri("/decode-raw-tx/abc")
                .exchange()
                .expectStatus().isBadRequest();

        verifyNoInteractions(rpcClient);
    }

    @Test
    void decode_forwardsHex() throws Exception {
        nodeReturns("{\"result\":{\"version\":1},\"error\":null,\"id\":1}");

        webTestClient.get().uri("/decode-raw-tx/0100ff")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.result.version").isEqualTo(1);

        verify(rpcClient).call("decoderawtransaction", List.of("0100ff"));
    }

    @Test
    void send_usesQueryParameters() throws Exception {
        nodeReturns("{\"result\":\"" + TXID + "\",\"error\":null,\"id\":1}");

        webTestClient.post().uri("/sendrawtransaction?hexstring=0100&allowhighfees=true")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.result").isEqualTo(TXID);

        verify(rpcClient).call("sendrawtransaction", List.of("0100", true));
    }

    @Test
    void send_missingHexstring_isBadRequest() {
        webTestClient.post().uri("/sendrawtransaction")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.message").isNotEmpty();

        verifyNoInteractions(rpcClient);
    }
}
