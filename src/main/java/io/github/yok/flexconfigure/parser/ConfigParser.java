package io.github.yok.flexconfigure.parser;

import java.io.File;
import java.io.IOException;

/**
 * Interface for reading one configuration source file into a {@link RawConfigureFile}.
 *
 * @author Yasuharu.Okawauchi
 */
public interface ConfigParser {

    /**
     * Parses the specified file.
     *
     * @param file configuration source file
     * @return the declaration as written, without defaults
     * @throws IOException if the file cannot be read or is not a valid document
     */
    RawConfigureFile parse(File file) throws IOException;
}
