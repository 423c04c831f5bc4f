package com.tidewatch.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "db")
public class DbProperties {
    private String url = "jdbc:postgresql://localhost:5432/tidewatch";
    private String user = "tidewatch";
    private String pass = "tidewatch";
    private String schema = "tidewatch";
}
