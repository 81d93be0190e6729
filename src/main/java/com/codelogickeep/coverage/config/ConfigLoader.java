package com.codelogickeep.coverage.config;

import com.codelogickeep.coverage.exception.CoverageGateException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads {@link AppConfig} by layering YAML files on top of each other. Later layers win:
 * <ol>
 *   <li>classpath {@code coverage-gate.yml}</li>
 *   <li>{@code ~/.coverage-gate/config.yml}</li>
 *   <li>{@code ./coverage-gate.yml}</li>
 *   <li>an explicit file passed with {@code --config}</li>
 * </ol>
 * String values may contain {@code ${env:NAME}} placeholders.
 */
public class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String CONFIG_FILE_NAME = "coverage-gate.yml";
    private static final Pattern ENV_PLACEHOLDER = Pattern.compile("\\$\\{env:([A-Za-z_][A-Za-z0-9_]*)}");

    // Later layers override single keys; lists are replaced as a whole
    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory()).setDefaultMergeable(true);
    private final Path userHome;
    private final Path workingDir;
    private final UnaryOperator<String> env;

    public ConfigLoader() {
        this(Paths.get(System.getProperty("user.home")), Paths.get("").toAbsolutePath(), System::getenv);
    }

    ConfigLoader(Path userHome, Path workingDir, UnaryOperator<String> env) {
        this.userHome = userHome;
        this.workingDir = workingDir;
        this.env = env;
    }

    /**
     * @param explicitPath optional {@code --config} path; must exist when given
     */
    public AppConfig load(String explicitPath) {
        AppConfig config = new AppConfig();

        try (InputStream in = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE_NAME)) {
            if (in != null) {
                mapper.readerForUpdating(config).readValue(in);
            }
        } catch (IOException e) {
            log.warn("Failed to read bundled defaults: {}", e.getMessage());
        }

        mergeConfigFromFile(config, userHome.resolve(".coverage-gate").resolve("config.yml").toFile());
        mergeConfigFromFile(config, workingDir.resolve(CONFIG_FILE_NAME).toFile());

        if (explicitPath != null) {
            File file = new File(explicitPath);
            if (!file.exists()) {
                throw new CoverageGateException(CoverageGateException.ErrorCode.CONFIG_NOT_FOUND,
                        "Configuration file not found: " + explicitPath, file.getAbsolutePath());
            }
            try {
                mapper.readerForUpdating(config).readValue(file);
                log.info("Merged configuration from {}", file.getAbsolutePath());
            } catch (IOException e) {
                throw new CoverageGateException(CoverageGateException.ErrorCode.CONFIG_INVALID,
                        "Cannot parse configuration: " + e.getMessage(), file.getAbsolutePath(), e);
            }
        }

        substituteEnvVars(config);
        return config;
    }

    private void mergeConfigFromFile(AppConfig config, File file) {
        if (file.exists()) {
            try {
                mapper.readerForUpdating(config).readValue(file);
                log.info("Merged configuration from {}", file.getAbsolutePath());
            } catch (IOException e) {
                log.warn("Failed to merge config from {}: {}", file.getAbsolutePath(), e.getMessage());
            }
        }
    }

    private void substituteEnvVars(AppConfig config) {
        AppConfig.AnalysisConfig analysis = config.getAnalysis();
        analysis.setSourceDir(replaceEnvVars(analysis.getSourceDir()));
        analysis.setTestDir(replaceEnvVars(analysis.getTestDir()));
        analysis.setJacocoReport(replaceEnvVars(analysis.getJacocoReport()));

        config.getTracking().setDataDir(replaceEnvVars(config.getTracking().getDataDir()));
        config.getReporting().setOutputDir(replaceEnvVars(config.getReporting().getOutputDir()));
        config.getProbe().setReportsDir(replaceEnvVars(config.getProbe().getReportsDir()));

        List<String> command = config.getProbe().getCommand();
        if (command != null) {
            command.replaceAll(this::replaceEnvVars);
        }
    }

    /**
     * Replaces every {@code ${env:NAME}} occurrence. Unset variables are left as written.
     */
    String replaceEnvVars(String value) {
        if (value == null || !value.contains("${env:")) {
            return value;
        }
        Matcher matcher = ENV_PLACEHOLDER.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String resolved = env.apply(matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(resolved != null ? resolved : matcher.group()));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
