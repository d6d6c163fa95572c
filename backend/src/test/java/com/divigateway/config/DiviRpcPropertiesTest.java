package com.divigateway.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class DiviRpcPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfig.class);

    @Test
    @DisplayName("startup fails when the RPC password is missing")
    void missingPassword() {
        contextRunner.withPropertyValues("divi.rpc.user=alice")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).hasStackTraceContaining("Missing rpcpassword");
                });
    }

    @Test
    @DisplayName("startup fails when the RPC user is missing")
    void missingUser() {
        contextRunner.withPropertyValues("divi.rpc.password=hunter2")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void defaults() {
        contextRunner.withPropertyValues("divi.rpc.user=alice", "divi.rpc.password=hunter2")
                .run(context -> {
                    DiviRpcProperties properties = context.getBean(DiviRpcProperties.class);
                    assertThat(properties.endpointUrl()).isEqualTo("http://localhost:51473/");
                    assertThat(properties.getCallDeadlineMs()).isGreaterThan(properties.getResponseTimeoutMs());
                });
    }

    @Test
    void portOutOfRange_fails() {
        contextRunner.withPropertyValues("divi.rpc.user=alice", "divi.rpc.password=hunter2", "divi.rpc.port=70000")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration
    @EnableConfigurationProperties({DiviRpcProperties.class, PeerViewProperties.class})
    static class PropertiesConfig {
    }
}
