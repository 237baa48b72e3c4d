package com.querygen.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querygen.cli.exception.OptionsValidationException;
import com.querygen.cli.model.ContainerOptions;
import com.querygen.cli.validation.ContainerOptionsValidator;
import com.querygen.container.CommandRunner;
import com.querygen.container.ContainerConfig;
import com.querygen.container.ContainerException;
import com.querygen.container.ContainerManager;
import com.querygen.container.ProcessCommandRunner;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command for starting and removing the throwaway PostgreSQL container.
 */
@Command(
        name = "container",
        mixinStandardHelpOptions = true,
        description = "Starts (setup) or removes (cleanup) the disposable PostgreSQL container used for type resolution."
)
public class ContainerCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ContainerCommand.class);

    @Mixin
    private ContainerOptions options = new ContainerOptions();

    private final CommandRunner runner;

    public ContainerCommand() {
        this(new ProcessCommandRunner());
    }

    ContainerCommand(CommandRunner runner) {
        this.runner = runner;
    }

    @Override
    public Integer call() {
        ContainerConfig config;
        try {
            config = new ContainerOptionsValidator().validate(options);
        } catch (OptionsValidationException e) {
            log.error(e.getMessage());
            return 1;
        }

        ContainerManager manager = new ContainerManager(config, runner);
        try {
            switch (options.getAction()) {
                case SETUP -> manager.setup(options.isPodman());
                case CLEANUP -> manager.cleanup(options.isPodman());
            }
            return 0;
        } catch (ContainerException e) {
            log.error(e.getMessage(), e.getCause());
            return 1;
        }
    }
}
