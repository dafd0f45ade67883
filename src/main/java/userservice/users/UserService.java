package userservice.users;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import io.vavr.collection.List;
import io.vavr.control.Option;
import io.vavr.control.Try;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import userservice.validators.EmailValidator;

import java.io.IOException;
import java.util.function.Function;
import java.util.function.Supplier;

import static userservice.users.UserException.*;

/**
 * Validates, checks existence and writes users through the configured {@link UserRepository}.
 * <p>
 * Without conditional writes the existence check and the put are two separate store calls,
 * so two concurrent creates for the same email can both succeed.
 */
public class UserService {

    private final static Logger LOGGER = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final ObjectReader userReader;
    private final boolean conditionalWrites;

    public UserService(UserRepository userRepository, ObjectMapper mapper, boolean conditionalWrites) {
        this.userRepository = userRepository;
        // A body is exactly one JSON value: "{...} garbage" is unreadable.
        this.userReader = mapper.readerFor(User.class).with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.conditionalWrites = conditionalWrites;
    }

    public User fetch(String email) {
        LOGGER.debug("Fetching user {}", email);
        return read(() -> userRepository.get(email)).getOrElse(User::empty);
    }

    public List<User> fetchAll() {
        LOGGER.debug("Fetching all users");
        return read(userRepository::list);
    }

    public User create(String body) {
        User user = decode(body, INVALID_USER_DATA);

        if (!EmailValidator.isValid(user.email)) {
            LOGGER.warn("Rejecting user with invalid email {}", user.email);
            throw new UserException(INVALID_EMAIL);
        }

        if (lookup(user.email).flatMap(u -> u).exists(User::hasEmail)) {
            LOGGER.warn("User {} already exists", user.email);
            throw new UserException(USER_ALREADY_EXISTS);
        }

        write(user, conditionalWrites ? userRepository::create : userRepository::save, USER_ALREADY_EXISTS);
        LOGGER.info("Created user {}", user.email);
        return user;
    }

    public User update(String body) {
        // Decode failures keep the "invalid email" message existing clients match on.
        User user = decode(body, INVALID_EMAIL);

        Option<Option<User>> existing = lookup(user.email);
        if (existing.isDefined() && !existing.get().getOrElse(User::empty).hasEmail()) {
            LOGGER.warn("User {} doesn't exist", user.email);
            throw new UserException(USER_DOES_NOT_EXIST);
        }

        write(user, conditionalWrites ? userRepository::replace : userRepository::save, USER_DOES_NOT_EXIST);
        LOGGER.info("Updated user {}", user.email);
        return user;
    }

    public void delete(String email) {
        try {
            userRepository.delete(email);
            LOGGER.info("Deleted user {}", email);
        } catch (UserStoreException e) {
            LOGGER.error("Error deleting user {}", email, e);
            throw new UserException(COULD_NOT_DELETE_ITEM, e);
        }
    }

    private User decode(String body, String errorMessage) {
        try {
            User user = userReader.readValue(body == null ? "" : body);
            return user == null ? User.empty() : user;
        } catch (IOException e) {
            LOGGER.warn("Unreadable user payload: {}", e.getMessage());
            throw new UserException(errorMessage, e);
        }
    }

    /**
     * Existence lookup used before writes. Empty when the store read itself failed: the
     * check is skipped and the write that follows reports its own failure if the store is down.
     */
    private Option<Option<User>> lookup(String email) {
        return Try.of(() -> userRepository.get(email))
                .onFailure(e -> LOGGER.warn("Existence check for {} failed, skipping it", email, e))
                .toOption();
    }

    private <T> T read(Supplier<T> call) {
        try {
            return call.get();
        } catch (UserStoreException e) {
            LOGGER.error("Error reading users from store", e);
            if (e.getKind() == UserStoreException.Kind.DECODE) {
                throw new UserException(FAILED_TO_DECODE_RECORD, e);
            }
            throw new UserException(FAILED_TO_FETCH_RECORD, e);
        }
    }

    private void write(User user, Function<User, User> put, String conflictMessage) {
        try {
            put.apply(user);
        } catch (ConditionalWriteException e) {
            LOGGER.warn("Conditional write refused for {}: {}", e.getEmail(), e.getMessage());
            throw new UserException(conflictMessage, e);
        } catch (UserStoreException e) {
            LOGGER.error("Error writing user {}", user.email, e);
            if (e.getKind() == UserStoreException.Kind.ENCODE) {
                throw new UserException(COULD_NOT_MARSHAL_ITEM, e);
            }
            throw new UserException(COULD_NOT_PUT_ITEM, e);
        }
    }
}
