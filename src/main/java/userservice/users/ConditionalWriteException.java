package userservice.users;

/**
 * A conditional put was refused because the key was (or wasn't) already present.
 */
public class ConditionalWriteException extends UserStoreException {

    private final String email;

    public ConditionalWriteException(String email, String message) {
        super(Kind.WRITE, message);
        this.email = email;
    }

    public ConditionalWriteException(String email, String message, Throwable cause) {
        super(Kind.WRITE, message, cause);
        this.email = email;
    }

    public String getEmail() {
        return email;
    }
}
