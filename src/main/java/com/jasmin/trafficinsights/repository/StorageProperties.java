package com.jasmin.trafficinsights.repository;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "storage")
public class StorageProperties {

    /**
     * Namespace of every key this service reads or writes.
     */
    @NotBlank private String keyPrefix = "ti";
}
