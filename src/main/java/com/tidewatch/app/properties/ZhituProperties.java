package com.tidewatch.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Credentials for the Zhitu market data API.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "zhitu")
public class ZhituProperties {
    private String token = "";
}
