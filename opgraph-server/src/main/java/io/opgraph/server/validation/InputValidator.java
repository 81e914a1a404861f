package io.opgraph.server.validation;

import jakarta.ws.rs.BadRequestException;
import java.util.regex.Pattern;

/// Checks applied to path parameters and logged values at the REST boundary.
///
/// Workflow and record ids must start with an alphanumeric character and contain only
/// alphanumerics, dots, hyphens and underscores (max 255 characters).
public final class InputValidator {

    static final Pattern SAFE_ID = Pattern.compile("[a-zA-Z0-9][a-zA-Z0-9._-]{0,254}");

    private InputValidator() {}

    public static boolean isSafeId(String value) {
        return value != null && SAFE_ID.matcher(value).matches();
    }

    /// @param field parameter name used in the error message
    /// @param value the identifier to check
    /// @return the value, unchanged
    /// @throws BadRequestException if the value is not a safe identifier
    public static String requireSafeId(String field, String value) {
        if (!isSafeId(value)) {
            throw new BadRequestException("Invalid " + field + ": " + sanitize(value));
        }
        return value;
    }

    /// Removes carriage returns and newlines so user input cannot forge log lines.
    ///
    /// @param value the string to sanitize, may be null
    /// @return sanitized string, or `"null"` if input is null
    public static String sanitize(String value) {
        if (value == null) {
            return "null";
        }
        return value.replace("\r", "").replace("\n", "");
    }
}
