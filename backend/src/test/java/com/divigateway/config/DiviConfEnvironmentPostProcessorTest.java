package com.divigateway.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.SpringApplication;
import org.springframework.mock.env.MockEnvironment;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class DiviConfEnvironmentPostProcessorTest {

    @TempDir
    Path tempDir;

    private final DiviConfEnvironmentPostProcessor postProcessor =
            new DiviConfEnvironmentPostProcessor(destination -> destination.get());

    @Test
    void exposesConfValuesAsProperties() throws Exception {
        Path conf = tempDir.resolve("divi.conf");
        Files.writeString(conf, "rpcuser=alice\nrpcpassword=hunter2\nrpcport=52000\n");
        MockEnvironment environment = new MockEnvironment()
                .withProperty(DiviConfEnvironmentPostProcessor.PATH_PROPERTY, conf.toString())
                .withProperty("divi.rpc.user", "${divi.conf.rpcuser:${RPC_USER:}}");

        postProcessor.postProcessEnvironment(environment, new SpringApplication());

        assertThat(environment.getPropertySources().contains(DiviConfEnvironmentPostProcessor.PROPERTY_SOURCE_NAME)).isTrue();
        assertThat(environment.getProperty("divi.conf.rpcpassword")).isEqualTo("hunter2");
        assertThat(environment.getProperty("divi.conf.rpcport")).isEqualTo("52000");
        assertThat(environment.getProperty("divi.rpc.user")).isEqualTo("alice");
    }

    @Test
    void missingFile_leavesEnvironmentUntouched() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty(DiviConfEnvironmentPostProcessor.PATH_PROPERTY, tempDir.resolve("absent.conf").toString());

        postProcessor.postProcessEnvironment(environment, new SpringApplication());

        assertThat(environment.getPropertySources().contains(DiviConfEnvironmentPostProcessor.PROPERTY_SOURCE_NAME)).isFalse();
        assertThat(environment.getProperty("divi.conf.rpcuser")).isNull();
    }
}
