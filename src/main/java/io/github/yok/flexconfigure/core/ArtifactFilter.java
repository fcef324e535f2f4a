package io.github.yok.flexconfigure.core;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import java.util.Set;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Restricts processing to named packages and artifacts.
 *
 * <p>
 * Names are matched case-sensitively against the declared (unprefixed) ids. An empty filter
 * includes everything.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class ArtifactFilter {

    private static final Splitter COMMA = Splitter.on(',').trimResults().omitEmptyStrings();

    private final Set<String> packageIds;
    private final Set<String> artifactIds;

    public ArtifactFilter(Set<String> packageIds, Set<String> artifactIds) {
        this.packageIds = ImmutableSet.copyOf(packageIds);
        this.artifactIds = ImmutableSet.copyOf(artifactIds);
    }

    /**
     * Creates a filter from comma-separated lists.
     *
     * @param packageFilter comma-separated package ids, may be {@code null} or blank
     * @param artifactFilter comma-separated artifact ids, may be {@code null} or blank
     * @return the filter
     */
    public static ArtifactFilter parse(String packageFilter, String artifactFilter) {
        return new ArtifactFilter(split(packageFilter), split(artifactFilter));
    }

    /**
     * Returns a filter that includes everything.
     *
     * @return empty filter
     */
    public static ArtifactFilter none() {
        return new ArtifactFilter(ImmutableSet.of(), ImmutableSet.of());
    }

    public boolean includesPackage(String declaredPackageId) {
        return packageIds.isEmpty() || packageIds.contains(declaredPackageId);
    }

    public boolean includesArtifact(String declaredArtifactId) {
        return artifactIds.isEmpty() || artifactIds.contains(declaredArtifactId);
    }

    private static Set<String> split(String list) {
        if (StringUtils.isBlank(list)) {
            return ImmutableSet.of();
        }
        return ImmutableSet.copyOf(COMMA.split(list));
    }
}
