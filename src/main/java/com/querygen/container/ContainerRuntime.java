package com.querygen.container;

/**
 * Container engine binary to drive.
 */
public enum ContainerRuntime {
    DOCKER("docker"),
    PODMAN("podman");

    private final String executable;

    ContainerRuntime(String executable) {
        this.executable = executable;
    }

    public String getExecutable() {
        return executable;
    }

    public static ContainerRuntime of(boolean useAlternateRuntime) {
        return useAlternateRuntime ? PODMAN : DOCKER;
    }
}
