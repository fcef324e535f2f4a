package io.github.yok.flexconfigure.parser;

import com.google.common.collect.ImmutableList;
import io.github.yok.flexconfigure.model.ArtifactType;
import io.github.yok.flexconfigure.model.BatchSettings;
import io.github.yok.flexconfigure.model.ConfigurationParameter;
import io.github.yok.flexconfigure.model.ConfigureArtifact;
import io.github.yok.flexconfigure.model.ConfigureConfig;
import io.github.yok.flexconfigure.model.ConfigurePackage;
import java.util.Collections;
import java.util.List;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Turns a {@link RawConfigureFile} into the immutable model, applying defaults and validating
 * required fields.
 *
 * <p>
 * <strong>Defaults:</strong>
 * </p>
 * <ul>
 * <li>package and artifact {@code deploy}: {@code false}</li>
 * <li>artifact {@code version}: {@value ConfigureArtifact#DEFAULT_VERSION}</li>
 * <li>artifact {@code type}: {@code Integration}</li>
 * <li>{@code batch.enabled}: {@code true}</li>
 * <li>{@code batch.batchSize}: {@value BatchSettings#DEFAULT_BATCH_SIZE}</li>
 * </ul>
 *
 * <p>
 * This is a pure transformation: the same input always yields an equal result and the input is not
 * modified.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ConfigDefaults {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private ConfigDefaults() {
        throw new AssertionError("No ConfigDefaults instances for you!");
    }

    /**
     * Applies defaults and validates the declaration.
     *
     * @param raw declaration as parsed
     * @return the immutable model
     * @throws IllegalArgumentException if a required field is missing or a value is invalid
     */
    public static ConfigureConfig apply(RawConfigureFile raw) {
        String prefix = StringUtils.defaultString(raw.getDeploymentPrefix());
        ImmutableList.Builder<ConfigurePackage> packages = ImmutableList.builder();
        List<RawConfigureFile.RawPackage> rawPackages = nullToEmpty(raw.getPackages());
        for (int i = 0; i < rawPackages.size(); i++) {
            packages.add(applyPackage(rawPackages.get(i), i));
        }
        return new ConfigureConfig(prefix, packages.build());
    }

    private static ConfigurePackage applyPackage(RawConfigureFile.RawPackage raw, int index) {
        if (raw == null || StringUtils.isBlank(raw.getId())) {
            throw new IllegalArgumentException(
                    "packages[" + index + "]: integrationSuiteId is required");
        }
        ImmutableList.Builder<ConfigureArtifact> artifacts = ImmutableList.builder();
        List<RawConfigureFile.RawArtifact> rawArtifacts = nullToEmpty(raw.getArtifacts());
        for (int i = 0; i < rawArtifacts.size(); i++) {
            artifacts.add(applyArtifact(rawArtifacts.get(i), raw.getId(), i));
        }
        return ConfigurePackage.builder()
                .id(raw.getId())
                .displayName(raw.getDisplayName())
                .deploy(Boolean.TRUE.equals(raw.getDeploy()))
                .artifacts(artifacts.build())
                .build();
    }

    private static ConfigureArtifact applyArtifact(RawConfigureFile.RawArtifact raw,
            String packageId, int index) {
        String where = "package " + packageId + ", artifacts[" + index + "]";
        if (raw == null || StringUtils.isBlank(raw.getId())) {
            throw new IllegalArgumentException(where + ": artifactId is required");
        }
        where = "package " + packageId + ", artifact " + raw.getId();

        ArtifactType type;
        try {
            type = ArtifactType.fromSourceName(raw.getType());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(where + ": " + e.getMessage(), e);
        }

        ImmutableList.Builder<ConfigurationParameter> parameters = ImmutableList.builder();
        for (RawConfigureFile.RawParameter p : nullToEmpty(raw.getParameters())) {
            if (p == null || StringUtils.isBlank(p.getKey())) {
                throw new IllegalArgumentException(where + ": parameter key is required");
            }
            if (p.getValue() == null) {
                throw new IllegalArgumentException(
                        where + ": value of parameter " + p.getKey() + " is required");
            }
            parameters.add(new ConfigurationParameter(p.getKey(), p.getValue()));
        }

        return ConfigureArtifact.builder()
                .id(raw.getId())
                .displayName(raw.getDisplayName())
                .type(type)
                .version(StringUtils.isBlank(raw.getVersion()) ? ConfigureArtifact.DEFAULT_VERSION
                        : raw.getVersion())
                .deploy(Boolean.TRUE.equals(raw.getDeploy()))
                .parameters(parameters.build())
                .batch(applyBatch(raw.getBatch(), where))
                .build();
    }

    private static BatchSettings applyBatch(RawConfigureFile.RawBatch raw, String where) {
        if (raw == null) {
            return null;
        }
        Integer size = raw.getBatchSize();
        if (size != null && size <= 0) {
            throw new IllegalArgumentException(where + ": batchSize must be greater than 0");
        }
        return new BatchSettings(!Boolean.FALSE.equals(raw.getEnabled()),
                size != null ? size : BatchSettings.DEFAULT_BATCH_SIZE);
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list != null ? list : Collections.emptyList();
    }
}
