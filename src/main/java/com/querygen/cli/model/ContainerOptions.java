package com.querygen.cli.model;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "container" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ContainerOptions {

	@Parameters(index = "0", description = "Action to perform: ${COMPLETION-CANDIDATES}")
	private ContainerAction action;

	@Option(names = { "--podman" }, description = "Use podman instead of docker")
	private boolean podman;

	@Option(names = { "--container-name" }, defaultValue = "querygen_postgres", description = "Name of the database container")
	private String containerName;

	@Option(names = { "--image" }, defaultValue = "postgres", description = "PostgreSQL image to run")
	private String image;

	@Option(names = { "--port" }, defaultValue = "5432", description = "Host port mapped to PostgreSQL")
	private int port;

	@Option(names = { "--max-retries" }, defaultValue = "120", description = "Health probes before giving up")
	private int maxRetries;

	@Option(names = { "--retry-interval-ms" }, defaultValue = "1000", description = "Delay between health probes in milliseconds")
	private long retryIntervalMs;

}
