package io.github.yok.flexconfigure.model;

import java.util.Locale;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Enumeration of deployable artifact types.
 *
 * <p>
 * Each type carries the name used for it in declarative sources. Matching against source values is
 * case-insensitive so that {@code integration} and {@code Integration} resolve to the same type.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum ArtifactType {

    // Integration flow.
    INTEGRATION("Integration"),

    // Message mapping.
    MESSAGE_MAPPING("MessageMapping"),

    // Script collection.
    SCRIPT_COLLECTION("ScriptCollection"),

    // Value mapping.
    VALUE_MAPPING("ValueMapping");

    // Name as written in declarative sources.
    private final String sourceName;

    ArtifactType(String sourceName) {
        this.sourceName = sourceName;
    }

    /**
     * Resolves the type declared in a source.
     *
     * @param name declared type name; {@code null} or blank resolves to {@link #INTEGRATION}
     * @return the matching type
     * @throws IllegalArgumentException if the name matches no type
     */
    public static ArtifactType fromSourceName(String name) {
        if (StringUtils.isBlank(name)) {
            return INTEGRATION;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ArtifactType type : values()) {
            if (type.sourceName.toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown artifact type: " + name);
    }

    @Override
    public String toString() {
        return sourceName;
    }
}
