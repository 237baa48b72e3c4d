package com.querygen.cli.model;

/**
 * What the {@code container} command should do.
 */
public enum ContainerAction {
    SETUP,
    CLEANUP
}
