package com.docforge.cli;

import com.docforge.core.config.ConfigLoader;
import com.docforge.core.config.PipelineConfig;
import com.docforge.core.model.RepoConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to validate the configuration file.
 */
@Command(
    name = "validate",
    description = "Validate the configuration file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Config file to validate", defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configFile;

    @Override
    public Integer call() {
        log.info("Validating configuration: {}", configFile);
        if (!Files.isRegularFile(configFile)) {
            System.err.println("✗ Configuration file not found: " + configFile);
            return 1;
        }

        PipelineConfig config = ConfigLoader.load(configFile);
        List<String> problems = config.problems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> System.err.println("✗ " + problem));
            return 1;
        }

        System.out.println("✓ " + configFile + " is valid");
        for (RepoConfig repo : config.repositories()) {
            System.out.println("  " + repo.displayName() + " -> " + repo.location()
                + (repo.isRestricted() ? " " + repo.paths() : ""));
        }
        return 0;
    }
}
