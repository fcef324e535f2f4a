package io.github.yok.flexconfigure.core;

import java.util.regex.Pattern;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Validation and application of the deployment prefix.
 *
 * <p>
 * The prefix scopes packages and artifacts to an environment: the same declaration deployed with
 * {@code DEV_} and {@code QA_} targets different remote ids.
 * </p>
 */
public final class DeploymentPrefix {

    private static final Pattern VALID = Pattern.compile("[A-Za-z0-9_]*");

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private DeploymentPrefix() {
        throw new AssertionError("No DeploymentPrefix instances for you!");
    }

    /**
     * Validates a prefix.
     *
     * @param prefix prefix to validate; {@code null} and empty are valid
     * @throws IllegalArgumentException if the prefix contains characters other than letters,
     *         digits and underscores
     */
    public static void validate(String prefix) {
        if (prefix != null && !VALID.matcher(prefix).matches()) {
            throw new IllegalArgumentException("Deployment prefix '" + prefix
                    + "' may only contain letters, digits and underscores");
        }
    }

    /**
     * Returns the effective id for a declared id.
     *
     * @param prefix deployment prefix, may be {@code null} or empty
     * @param declaredId id as declared in the source
     * @return {@code prefix + declaredId}, or {@code declaredId} when the prefix is empty
     */
    public static String apply(String prefix, String declaredId) {
        return StringUtils.isEmpty(prefix) ? declaredId : prefix + declaredId;
    }
}
