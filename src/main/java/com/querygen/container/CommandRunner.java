package com.querygen.container;

import java.io.IOException;
import java.util.List;

/**
 * Runs an external command to completion and reports its exit status.
 * Output is never inspected.
 */
@FunctionalInterface
public interface CommandRunner {

    int run(List<String> command) throws IOException, InterruptedException;
}
