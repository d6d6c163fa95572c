package com.divigateway.config;

import com.divigateway.rpc.DiviRpcClient;
import com.divigateway.rpc.WebClientDiviRpcClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the node client: WebClient with base URL, basic auth and timeouts.
 */
@Configuration
@EnableConfigurationProperties({ DiviRpcProperties.class, PeerViewProperties.class, CorsProperties.class })
@Slf4j
public class RpcClientConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DiviRpcClient diviRpcClient(WebClient.Builder webClientBuilder, DiviRpcProperties properties, ObjectMapper objectMapper) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, properties.getConnectTimeoutMs())
                .responseTimeout(Duration.ofMillis(properties.getResponseTimeoutMs()));
        webClientBuilder.clientConnector(new ReactorClientHttpConnector(httpClient));
        log.info("Divi node RPC endpoint {} (user {})", properties.endpointUrl(), properties.getUser());
        return new WebClientDiviRpcClient(
                nodeWebClient(webClientBuilder, properties),
                objectMapper,
                Duration.ofMillis(properties.getCallDeadlineMs()));
    }

    /**
     * WebClient bound to the node URL with basic auth. Credentials stay out of the URL.
     */
    static WebClient nodeWebClient(WebClient.Builder webClientBuilder, DiviRpcProperties properties) {
        return webClientBuilder
                .baseUrl(properties.endpointUrl())
                .defaultHeaders(headers -> headers.setBasicAuth(properties.getUser(), properties.getPassword()))
                .build();
    }
}
