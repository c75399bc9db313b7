package com.di.fleetnova.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Fleet data API connection settings ({@code fleetnova.api.*}).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "fleetnova.api")
public class ApiProperties {

    @NotBlank
    private String baseUrl = "https://api.hoppe-sts.com/";

    /** Sent as {@code Authorization: ApiKey <key>}. */
    private String apiKey = "";

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);

    @NotNull
    private Duration readTimeout = Duration.ofSeconds(45);

    /** Attempts per request, including the first one. */
    @Min(1)
    private int maxRetries = 3;

    /** Wait before retry n (0-based) is {@code backoffBase * 2^n}. */
    @NotNull
    private Duration backoffBase = Duration.ofSeconds(2);
}
