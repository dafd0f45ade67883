package userservice.users;

/**
 * Raised by a {@link UserRepository} when the underlying store call fails.
 */
public class UserStoreException extends RuntimeException {

    public enum Kind {
        READ,
        DECODE,
        ENCODE,
        WRITE,
        DELETE
    }

    private final Kind kind;

    public UserStoreException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public UserStoreException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
