package io.github.yok.flexconfigure.parser;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory that creates the {@link ConfigParser} for a {@link ConfigFormat}.
 *
 * <p>
 * All parsers share one {@link ObjectMapper}. Unknown keys in a source are ignored.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ConfigParserFactory {

    private final ObjectMapper mapper;

    public ConfigParserFactory() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Creates the parser for the given format.
     *
     * @param format source format
     * @return parser implementation for the format
     * @throws IllegalArgumentException if the format is not supported
     */
    public ConfigParser create(ConfigFormat format) {
        if (format == ConfigFormat.YAML) {
            return new YamlConfigParser(mapper);
        }
        if (format == ConfigFormat.JSON) {
            return new JsonConfigParser(mapper);
        }
        throw new IllegalArgumentException("Unsupported format: " + format);
    }
}
