package com.divigateway.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the upstream Divi node. User and password come from divi.conf,
 * falling back to RPC_USER / RPC_PASS; startup fails when either is missing.
 */
@ConfigurationProperties(prefix = "divi.rpc")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class DiviRpcProperties {

    @NotBlank(message = "Missing rpcuser in divi.conf or RPC_USER")
    private String user;

    @NotBlank(message = "Missing rpcpassword in divi.conf or RPC_PASS")
    private String password;

    @NotBlank
    private String scheme = "http";

    @NotBlank
    private String host = "localhost";

    @Min(1)
    @Max(65535)
    private int port = 51473;

    /** TCP connect timeout. A node that cannot be reached in time is reported unavailable. */
    @Positive
    private int connectTimeoutMs = 5_000;

    /** Max wait for the node's response once connected. */
    @Positive
    private long responseTimeoutMs = 30_000;

    /** Upper bound for a whole call, connect included. */
    @Positive
    private long callDeadlineMs = 35_000;

    public String endpointUrl() {
        return scheme + "://" + host + ":" + port + "/";
    }
}
