package org.kernform.validator.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Tunables of the validator, read from the {@code kernform.validator} block of the configuration.
 *
 * <pre>
 * kernform.validator {
 *   parallelism = 1
 *   include-standard-builtins = true
 *   reject-multiple-reductions = false
 * }
 * </pre>
 *
 * @param parallelism Number of worker threads; 1 validates on the calling thread.
 * @param includeStandardBuiltIns Whether the standard built-in catalog is registered in every unit.
 * @param rejectMultipleReductions Whether a built-in may declare only one reduction.
 */
public record ValidatorOptions(int parallelism, boolean includeStandardBuiltIns, boolean rejectMultipleReductions) {

    /** Path of the validator block inside the application configuration. */
    public static final String CONFIG_PATH = "kernform.validator";

    public ValidatorOptions {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
    }

    /**
     * Returns the options defined in the classpath {@code reference.conf}.
     * @return The default options.
     */
    public static ValidatorOptions defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Reads the options from an application configuration.
     * @param config The root configuration; must contain or fall back to {@value #CONFIG_PATH}.
     * @return The options.
     * @throws ConfigException if a value is missing or invalid.
     */
    public static ValidatorOptions fromConfig(Config config) {
        Config validator = config.getConfig(CONFIG_PATH);
        int parallelism = validator.getInt("parallelism");
        if (parallelism < 1) {
            throw new ConfigException.BadValue(validator.origin(), "parallelism", "must be at least 1");
        }
        return new ValidatorOptions(
                parallelism,
                validator.getBoolean("include-standard-builtins"),
                validator.getBoolean("reject-multiple-reductions"));
    }

    public ValidatorOptions withParallelism(int newParallelism) {
        return new ValidatorOptions(newParallelism, includeStandardBuiltIns, rejectMultipleReductions);
    }

    public ValidatorOptions withStandardBuiltIns(boolean include) {
        return new ValidatorOptions(parallelism, include, rejectMultipleReductions);
    }
}
