package com.divigateway.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "divi.cors")
@NoArgsConstructor
@Getter
@Setter
public class CorsProperties {

    /** Origin patterns allowed to call the API; "*" allows any. */
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
}
