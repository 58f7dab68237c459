package com.jasmin.outbreakguard.services;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "outbreak-guard.publisher")
public class PublisherProperties {

    /** Hand emitted anomalies to the downstream consumer over redis pub/sub. */
    private boolean enabled = false;

    @NotBlank private String channel = "surveillance:anomalies";
}
