package io.github.yok.flexconfigure.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

/**
 * Implementation of {@link ConfigParser} for YAML sources.
 *
 * <p>
 * SnakeYAML loads the document into plain maps and lists, which are then bound to
 * {@link RawConfigureFile} with the shared Jackson mapper so that YAML and JSON sources follow the
 * same binding rules.
 * </p>
 *
 * <p>
 * Plain scalars are kept as the text written in the file. Dates, octal, hexadecimal, underscored
 * numbers, {@code yes}/{@code no} and trailing zeros are therefore never rewritten before they
 * reach a parameter value. Only {@code ~}, {@code null} and empty values resolve to null.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class YamlConfigParser implements ConfigParser {

    private final ObjectMapper mapper;

    public YamlConfigParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public RawConfigureFile parse(File file) throws IOException {
        Object document;
        try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            document = newYaml().load(reader);
        } catch (YAMLException e) {
            throw new IOException("Invalid YAML in " + file.getName() + ": " + e.getMessage(), e);
        }

        if (document == null) {
            return new RawConfigureFile();
        }
        if (!(document instanceof Map)) {
            throw new IOException("Top level of " + file.getName() + " must be a mapping");
        }

        try {
            return mapper.convertValue(document, RawConfigureFile.class);
        } catch (IllegalArgumentException e) {
            throw new IOException(
                    "Unexpected structure in " + file.getName() + ": " + e.getMessage(), e);
        }
    }

    private static Yaml newYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        DumperOptions dumperOptions = new DumperOptions();
        return new Yaml(new SafeConstructor(loaderOptions), new Representer(dumperOptions),
                dumperOptions, loaderOptions, new StringScalarResolver());
    }

    /**
     * Resolver that leaves every plain scalar as a string except null and merge keys.
     */
    private static final class StringScalarResolver extends Resolver {

        @Override
        protected void addImplicitResolvers() {
            addImplicitResolver(Tag.MERGE, MERGE, "<");
            addImplicitResolver(Tag.NULL, NULL, "~nN\0");
            addImplicitResolver(Tag.NULL, EMPTY, null);
        }
    }
}
