package io.github.yok.flexconfigure.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;

/**
 * Implementation of {@link ConfigParser} for JSON sources.
 *
 * @author Yasuharu.Okawauchi
 */
public class JsonConfigParser implements ConfigParser {

    private final ObjectMapper mapper;

    public JsonConfigParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public RawConfigureFile parse(File file) throws IOException {
        RawConfigureFile raw = mapper.readValue(file, RawConfigureFile.class);
        return raw != null ? raw : new RawConfigureFile();
    }
}
