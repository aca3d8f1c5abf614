package com.esmp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Server settings bound from the {@code esmp.*} namespace of application.yml.
 */
@ConfigurationProperties(prefix = "esmp")
public record EsmpProperties(
        @DefaultValue Tcp tcp,
        @DefaultValue Profile profile
) {

    /**
     * Newline-delimited JSON listener.
     *
     * @param maxLineBytes lines longer than this are rejected and the connection is closed
     */
    public record Tcp(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("0.0.0.0") String host,
            @DefaultValue("5888") int port,
            @DefaultValue("65536") int maxLineBytes
    ) {}

    /**
     * @param addressKey base64 32-byte secret the address encryption keys are derived from
     * @param readSkew   how far an owner-read timestamp may drift from server time
     */
    public record Profile(
            String addressKey,
            @DefaultValue("PT5M") Duration readSkew
    ) {}
}
