package io.github.yok.flexconfigure.parser;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Data;

/**
 * Configuration source exactly as declared, before any default is applied.
 *
 * <p>
 * Every optional field is a wrapper type so that "not declared" stays distinguishable from a
 * declared {@code false} or {@code 0}. {@link ConfigDefaults} turns an instance into the immutable
 * {@link io.github.yok.flexconfigure.model.ConfigureConfig}.
 * </p>
 *
 * <pre>
 * deploymentPrefix: "DEV_"
 * packages:
 *   - integrationSuiteId: "MyPackage"
 *     deploy: false
 *     artifacts:
 *       - artifactId: "MyFlow"
 *         type: "Integration"
 *         parameters:
 *           - key: "DatabaseURL"
 *             value: "jdbc:mysql://localhost:3306/mydb"
 *         batch:
 *           batchSize: 50
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class RawConfigureFile {

    // Optional deployment prefix
    private String deploymentPrefix;

    // Declared packages
    private List<RawPackage> packages;

    /**
     * Package entry.
     */
    @Data
    public static class RawPackage {
        @JsonProperty("integrationSuiteId")
        private String id;
        private String displayName;
        private Boolean deploy;
        private List<RawArtifact> artifacts;
    }

    /**
     * Artifact entry.
     */
    @Data
    public static class RawArtifact {
        @JsonProperty("artifactId")
        private String id;
        private String displayName;
        private String type;
        private String version;
        private Boolean deploy;
        private List<RawParameter> parameters;
        private RawBatch batch;
    }

    /**
     * Parameter entry.
     */
    @Data
    public static class RawParameter {
        private String key;
        private String value;
    }

    /**
     * Batch settings entry.
     */
    @Data
    public static class RawBatch {
        private Boolean enabled;
        private Integer batchSize;
    }
}
