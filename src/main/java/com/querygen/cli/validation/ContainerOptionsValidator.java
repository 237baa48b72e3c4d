package com.querygen.cli.validation;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.querygen.cli.exception.OptionsValidationException;
import com.querygen.cli.model.ContainerOptions;
import com.querygen.container.ContainerConfig;

public class ContainerOptionsValidator {

	// Same rule docker applies to container names
	private static final Pattern CONTAINER_NAME = Pattern.compile("[a-zA-Z0-9][a-zA-Z0-9_.-]*");

	public ContainerConfig validate(ContainerOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getAction() == null) {
			errors.add("An action is required (setup or cleanup).");
		}

		if (isBlank(o.getContainerName())) {
			errors.add("Container name is required (--container-name).");
		} else if (!CONTAINER_NAME.matcher(o.getContainerName()).matches()) {
			errors.add("Invalid container name: " + o.getContainerName());
		}

		if (isBlank(o.getImage())) {
			errors.add("Image is required (--image).");
		}

		if (o.getPort() <= 0 || o.getPort() > 65535) {
			errors.add("Port must be in range 1-65535. Got: " + o.getPort());
		}
		if (o.getMaxRetries() < 0) {
			errors.add("Max retries must be >= 0. Got: " + o.getMaxRetries());
		}
		if (o.getRetryIntervalMs() < 0) {
			errors.add("Retry interval must be >= 0. Got: " + o.getRetryIntervalMs());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException("container", errors);
		}

		return ContainerConfig.builder()
				.containerName(o.getContainerName())
				.image(o.getImage())
				.hostPort(o.getPort())
				.maxRetries(o.getMaxRetries())
				.retryInterval(Duration.ofMillis(o.getRetryIntervalMs()))
				.build();
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
