package com.jasmin.trafficinsights.services;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "identifier")
public class IdentifierProperties {

    /**
     * Where the hashing salt lives. Created with a fresh random salt on first start;
     * replacing it changes every hash, so keep it across restarts.
     */
    @NotBlank private String saltFile = "data/.salt";
}
