package io.github.yok.flexconfigure.parser;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;
import org.apache.commons.io.FilenameUtils;

/**
 * Enumeration of supported configuration source formats.
 *
 * <p>
 * Each format defines one or more file extensions that are recognized as belonging to that format.
 * For example, {@link #YAML} supports both {@code .yaml} and {@code .yml}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum ConfigFormat {

    // YAML Ain't Markup Language format (YAML/YML).
    YAML("yaml", "yml"),

    // JavaScript Object Notation format (JSON).
    JSON("json");

    // Set of valid extensions for this format (all lowercase).
    private final Set<String> extensions;

    ConfigFormat(String... exts) {
        this.extensions = Arrays.stream(exts).map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    /**
     * Determines whether the given file extension belongs to this format.
     *
     * @param ext file extension to check (case-insensitive, without dot)
     * @return {@code true} if the extension matches this format, {@code false} otherwise
     */
    public boolean matches(String ext) {
        return extensions.contains(ext.toLowerCase(Locale.ROOT));
    }

    /**
     * Resolves the format of a file from its name.
     *
     * @param fileName file name or path
     * @return the format, or empty if the extension is not recognized
     */
    public static Optional<ConfigFormat> fromFileName(String fileName) {
        String ext = FilenameUtils.getExtension(fileName);
        return Arrays.stream(values()).filter(f -> f.matches(ext)).findFirst();
    }
}
