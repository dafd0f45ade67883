package userservice.users;

/**
 * A failed user operation. The message is what the client gets back in the error body.
 */
public class UserException extends RuntimeException {

    public static final String FAILED_TO_FETCH_RECORD = "failed to fetch record from store";
    public static final String FAILED_TO_DECODE_RECORD = "failed to decode record";
    public static final String INVALID_USER_DATA = "invalid user data";
    public static final String INVALID_EMAIL = "invalid email";
    public static final String COULD_NOT_MARSHAL_ITEM = "couldn't marshal the item";
    public static final String COULD_NOT_DELETE_ITEM = "couldn't delete the item";
    public static final String COULD_NOT_PUT_ITEM = "could not store put item";
    public static final String USER_ALREADY_EXISTS = "user already exists";
    public static final String USER_DOES_NOT_EXIST = "user doesn't exist";

    public UserException(String message) {
        super(message);
    }

    public UserException(String message, Throwable cause) {
        super(message, cause);
    }
}
