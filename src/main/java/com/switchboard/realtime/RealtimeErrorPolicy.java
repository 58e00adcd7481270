package com.switchboard.realtime;

import com.switchboard.config.SwitchboardProperties.ErrorPolicyConfig;
import lombok.Value;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-provider data that decides the severity and terminality of a provider error code.
 * Unlisted codes are non-terminal {@link ErrorSeverity#ERROR}s.
 */
@Value
public class RealtimeErrorPolicy {

    Set<String> criticalCodes;
    Set<String> warningCodes;
    Set<String> terminalCodes;

    public static RealtimeErrorPolicy of(Collection<String> critical, Collection<String> warning,
                                         Collection<String> terminal) {
        return new RealtimeErrorPolicy(normalize(critical), normalize(warning), normalize(terminal));
    }

    public RealtimeError classify(String code, String message) {
        String key = code != null ? code.toLowerCase(Locale.ROOT) : "unknown";
        ErrorSeverity severity;
        if (criticalCodes.contains(key)) {
            severity = ErrorSeverity.CRITICAL;
        } else if (warningCodes.contains(key)) {
            severity = ErrorSeverity.WARNING;
        } else {
            severity = ErrorSeverity.ERROR;
        }
        return new RealtimeError(code != null ? code : "unknown",
                message != null ? message : "Unknown error", severity, terminalCodes.contains(key));
    }

    /**
     * Replace each code list that the override configures; unconfigured lists keep their defaults.
     */
    public RealtimeErrorPolicy overriddenBy(ErrorPolicyConfig override) {
        if (override == null) {
            return this;
        }
        return new RealtimeErrorPolicy(
                override.getCriticalCodes().isEmpty() ? criticalCodes : normalize(override.getCriticalCodes()),
                override.getWarningCodes().isEmpty() ? warningCodes : normalize(override.getWarningCodes()),
                override.getTerminalCodes().isEmpty() ? terminalCodes : normalize(override.getTerminalCodes()));
    }

    private static Set<String> normalize(Collection<String> codes) {
        return codes.stream()
                .map(code -> code.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
