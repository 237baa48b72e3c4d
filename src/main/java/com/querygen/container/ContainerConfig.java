package com.querygen.container;

import java.time.Duration;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings for the disposable PostgreSQL container used for live type resolution.
 */
@Value
@Builder(toBuilder = true)
public class ContainerConfig {

    @NonNull
    @Builder.Default
    String containerName = "querygen_postgres";

    @NonNull
    @Builder.Default
    String image = "postgres";

    /**
     * Host port mapped to the container's 5432.
     */
    @Builder.Default
    int hostPort = 5432;

    @NonNull
    @Builder.Default
    String password = "postgres";

    /**
     * Health probes attempted before giving up.
     */
    @Builder.Default
    int maxRetries = 120;

    @NonNull
    @Builder.Default
    Duration retryInterval = Duration.ofMillis(1000);

    /**
     * A progress notice is logged every this many failed probes.
     */
    @Builder.Default
    int progressEvery = 10;

    public static ContainerConfig defaults() {
        return ContainerConfig.builder().build();
    }
}
