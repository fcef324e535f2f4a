package io.github.yok.flexconfigure.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.flexconfigure.model.ConfigureConfig;
import io.github.yok.flexconfigure.model.ConfigurePackage;
import io.github.yok.flexconfigure.parser.ConfigDefaults;
import io.github.yok.flexconfigure.parser.ConfigFormat;
import io.github.yok.flexconfigure.parser.ConfigParserFactory;
import io.github.yok.flexconfigure.parser.RawConfigureFile;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Loads configuration sources from a file or a directory and merges them.
 *
 * <p>
 * <strong>Loading:</strong>
 * </p>
 * <ul>
 * <li>A single file must have a recognized extension ({@code .yml}, {@code .yaml},
 * {@code .json}) and must parse.</li>
 * <li>For a directory, every regular file with a recognized extension is parsed in file-name
 * order. Files that fail are logged and skipped; at least one must succeed.</li>
 * </ul>
 *
 * <p>
 * <strong>Merging:</strong> package lists are concatenated in discovery order without
 * de-duplication. The prefix given explicitly wins; otherwise the first source's declared prefix is
 * used.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ConfigLoader {

    private final ConfigParserFactory parserFactory;

    public ConfigLoader() {
        this(new ConfigParserFactory());
    }

    ConfigLoader(ConfigParserFactory parserFactory) {
        this.parserFactory = parserFactory;
    }

    /**
     * Loads all sources found at the path.
     *
     * @param path file or directory
     * @return loaded sources, never empty
     * @throws ConfigLoadException if the path is not accessible or no source could be loaded
     */
    public List<LoadedConfig> load(File path) throws ConfigLoadException {
        if (!path.exists()) {
            throw new ConfigLoadException("Configuration path does not exist: " + path);
        }
        if (path.isDirectory()) {
            return loadFromDirectory(path);
        }
        try {
            return ImmutableList.of(loadFile(path));
        } catch (IOException | IllegalArgumentException e) {
            throw new ConfigLoadException(
                    "Failed to load configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Merges loaded sources into one configuration.
     *
     * @param configs loaded sources in discovery order
     * @param overridePrefix explicit prefix; blank means "not given"
     * @return merged configuration
     */
    public ConfigureConfig merge(List<LoadedConfig> configs, String overridePrefix) {
        String prefix = "";
        if (StringUtils.isNotEmpty(overridePrefix)) {
            prefix = overridePrefix;
        } else if (!configs.isEmpty()) {
            prefix = configs.get(0).getConfig().getDeploymentPrefix();
        }

        ImmutableList.Builder<ConfigurePackage> packages = ImmutableList.builder();
        for (LoadedConfig loaded : configs) {
            log.info("  Merging packages from: {}", loaded.getFileName());
            packages.addAll(loaded.getConfig().getPackages());
        }
        return new ConfigureConfig(prefix, packages.build());
    }

    private List<LoadedConfig> loadFromDirectory(File dir) throws ConfigLoadException {
        File[] files = dir.listFiles(f -> f.isFile()
                && ConfigFormat.fromFileName(f.getName()).isPresent());
        if (files == null) {
            throw new ConfigLoadException("Failed to read directory: " + dir);
        }
        Arrays.sort(files, Comparator.comparing(File::getName));

        List<LoadedConfig> loaded = new ArrayList<>();
        for (File file : files) {
            try {
                loaded.add(loadFile(file));
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Failed to load config file {}: {}", file.getName(), e.getMessage());
            }
        }

        if (loaded.isEmpty()) {
            throw new ConfigLoadException("No valid configuration files found in folder: " + dir);
        }
        log.info("Loaded {} configuration file(s) from folder", loaded.size());
        return loaded;
    }

    private LoadedConfig loadFile(File file) throws IOException {
        Optional<ConfigFormat> format = ConfigFormat.fromFileName(file.getName());
        if (format.isEmpty()) {
            throw new IOException("Unrecognized configuration file extension: " + file.getName());
        }
        RawConfigureFile raw = parserFactory.create(format.get()).parse(file);
        ConfigureConfig config = ConfigDefaults.apply(raw);
        log.debug("Parsed {}: {} package(s)", file.getName(), config.getPackages().size());
        return new LoadedConfig(config, file.getPath(), file.getName());
    }
}
