package userservice.users;

import io.vavr.collection.List;
import io.vavr.control.Option;

public interface UserRepository {

    Option<User> get(String email);

    List<User> list();

    /**
     * Unconditional put, replacing whatever is stored under the same email.
     */
    User save(User user);

    /**
     * Put that fails with {@link ConditionalWriteException} if the email is already stored.
     */
    User create(User user);

    /**
     * Put that fails with {@link ConditionalWriteException} if the email is not stored yet.
     */
    User replace(User user);

    void delete(String email);
}
