package com.querygen.container;

import java.io.IOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.RequiredArgsConstructor;

/**
 * Starts and tears down a throwaway PostgreSQL container through the docker or
 * podman CLI. Only exit statuses are interpreted.
 */
@RequiredArgsConstructor
public class ContainerManager {

    private static final Logger log = LoggerFactory.getLogger(ContainerManager.class);

    private final ContainerConfig config;
    private final CommandRunner runner;

    public ContainerManager(ContainerConfig config) {
        this(config, new ProcessCommandRunner());
    }

    /**
     * Starts the container and blocks until PostgreSQL accepts connections.
     */
    public void setup(boolean useAlternateRuntime) throws ContainerException {
        ContainerRuntime runtime = ContainerRuntime.of(useAlternateRuntime);
        log.info("Starting database container {} with {}...", config.getContainerName(), runtime.getExecutable());
        spawnContainer(runtime);
        healthcheck(runtime);
        log.info("Database container {} is ready", config.getContainerName());
    }

    /**
     * Stops the container, then removes it with its volumes.
     */
    public void cleanup(boolean useAlternateRuntime) throws ContainerException {
        ContainerRuntime runtime = ContainerRuntime.of(useAlternateRuntime);
        log.info("Removing database container {}...", config.getContainerName());
        runStep(ContainerException.Reason.STOP,
                List.of(runtime.getExecutable(), "stop", config.getContainerName()));
        runStep(ContainerException.Reason.REMOVE,
                List.of(runtime.getExecutable(), "rm", "-v", config.getContainerName()));
    }

    private void spawnContainer(ContainerRuntime runtime) throws ContainerException {
        runStep(ContainerException.Reason.SPAWN, List.of(
                runtime.getExecutable(), "run", "-d",
                "--name", config.getContainerName(),
                "-p", config.getHostPort() + ":5432",
                "-e", "POSTGRES_PASSWORD=" + config.getPassword(),
                config.getImage()));
    }

    private void healthcheck(ContainerRuntime runtime) throws ContainerException {
        int retries = 0;
        while (!isPostgresHealthy(runtime)) {
            if (retries >= config.getMaxRetries()) {
                throw new ContainerException(ContainerException.Reason.MAX_RETRIES);
            }
            sleep(config.getRetryInterval().toMillis());
            retries++;

            if (config.getProgressEvery() > 0 && retries % config.getProgressEvery() == 0) {
                log.info("Container startup slower than expected ({} retries out of {})",
                        retries, config.getMaxRetries());
            }
        }
    }

    private boolean isPostgresHealthy(ContainerRuntime runtime) throws ContainerException {
        try {
            return runner.run(List.of(runtime.getExecutable(), "exec", config.getContainerName(), "pg_isready")) == 0;
        } catch (IOException e) {
            throw new ContainerException(ContainerException.Reason.HEALTH_CHECK, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContainerException(ContainerException.Reason.HEALTH_CHECK, e);
        }
    }

    private void runStep(ContainerException.Reason reason, List<String> command) throws ContainerException {
        int status;
        try {
            status = runner.run(command);
        } catch (IOException e) {
            throw new ContainerException(reason, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContainerException(reason, e);
        }
        if (status != 0) {
            throw new ContainerException(reason, "command returned with an error status: " + status);
        }
    }

    private static void sleep(long millis) throws ContainerException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContainerException(ContainerException.Reason.HEALTH_CHECK, e);
        }
    }
}
