package com.chatauth.backend.global.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app")
public record AppProperties(@DefaultValue("production") String environment) {

    public static final String DEVELOPMENT = "development";

    public boolean isDevelopment() {
        return DEVELOPMENT.equals(environment);
    }
}
