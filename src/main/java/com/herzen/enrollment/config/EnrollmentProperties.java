package com.herzen.enrollment.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Enrollment rule settings.
 *
 * <pre>{@code
 * enrollment:
 *   max-credits: 24
 *   demo:
 *     enabled: false
 * }</pre>
 */
@ConfigurationProperties(prefix = "enrollment")
public record EnrollmentProperties(@DefaultValue("24") int maxCredits,
                                   @DefaultValue Demo demo) {

    public EnrollmentProperties {
        if (maxCredits < 0) {
            throw new IllegalArgumentException("enrollment.max-credits must not be negative, got: " + maxCredits);
        }
        if (demo == null) demo = new Demo(false);
    }

    public static EnrollmentProperties withMaxCredits(int maxCredits) {
        return new EnrollmentProperties(maxCredits, new Demo(false));
    }

    public record Demo(@DefaultValue("false") boolean enabled) {}
}
