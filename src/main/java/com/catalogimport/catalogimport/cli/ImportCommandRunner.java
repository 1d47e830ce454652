package com.catalogimport.catalogimport.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * Executes the import command with the process arguments and keeps its exit code for
 * {@link org.springframework.boot.SpringApplication#exit}.
 */
@Component
@ConditionalOnProperty(prefix = "catalog.import.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ImportCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    private final ProductAttributesImportCommand command;
    private int exitCode;

    public ImportCommandRunner(ProductAttributesImportCommand command) {
        this.command = command;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(command).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
