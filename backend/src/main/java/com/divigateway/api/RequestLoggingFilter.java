package com.divigateway.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.net.InetSocketAddress;

/**
 * Logs client address, method and path of every inbound request.
 */
@Component
@Slf4j
public class RequestLoggingFilter implements WebFilter {

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        InetSocketAddress remote = exchange.getRequest().getRemoteAddress();
        log.info("{} {} from {}",
                exchange.getRequest().getMethod(),
                exchange.getRequest().getPath().value(),
                remote != null ? remote.getHostString() : "unknown");
        return chain.filter(exchange);
    }
}
