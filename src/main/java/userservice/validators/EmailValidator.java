package userservice.validators;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Shape check for email addresses: a local part of at most 64 characters, {@code @}, then
 * dot separated labels of 1 to 63 alphanumeric or hyphen characters that neither start nor
 * end with a hyphen. Nothing is resolved over the network.
 */
public final class EmailValidator {

    private static final int MIN_LENGTH = 3;
    private static final int MAX_LENGTH = 254;

    private static final Pattern EMAIL = Pattern.compile(
            "^[a-zA-Z0-9.!#$%&'*+/=?^_`{|}~-]{1,64}@[a-zA-Z0-9]" +
                    "(?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?(?:\\.[a-zA-Z0-9]" +
                    "(?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?)*$");

    private EmailValidator() {
    }

    public static boolean isValid(String email) {
        if (email == null) {
            return false;
        }
        // Bounds are in bytes.
        int length = email.getBytes(StandardCharsets.UTF_8).length;
        if (length < MIN_LENGTH || length > MAX_LENGTH) {
            return false;
        }
        return EMAIL.matcher(email).matches();
    }
}
