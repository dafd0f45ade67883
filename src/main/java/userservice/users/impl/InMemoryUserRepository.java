package userservice.users.impl;

import io.vavr.collection.HashMap;
import io.vavr.collection.List;
import io.vavr.collection.Map;
import io.vavr.control.Option;
import userservice.users.ConditionalWriteException;
import userservice.users.User;
import userservice.users.UserRepository;

/**
 * Keeps users in process memory, for local runs and tests. Contents are lost on restart.
 */
public class InMemoryUserRepository implements UserRepository {

    private volatile Map<String, User> users = HashMap.empty();

    @Override
    public Option<User> get(String email) {
        return users.get(email).map(InMemoryUserRepository::copy);
    }

    @Override
    public List<User> list() {
        return users.values().toList().map(InMemoryUserRepository::copy);
    }

    @Override
    public synchronized User save(User user) {
        this.users = this.users.put(user.email, copy(user));
        return user;
    }

    @Override
    public synchronized User create(User user) {
        if (users.containsKey(user.email)) {
            throw new ConditionalWriteException(user.email, "User " + user.email + " is already stored");
        }
        return save(user);
    }

    @Override
    public synchronized User replace(User user) {
        if (!users.containsKey(user.email)) {
            throw new ConditionalWriteException(user.email, "User " + user.email + " is not stored");
        }
        return save(user);
    }

    @Override
    public synchronized void delete(String email) {
        this.users = users.remove(email);
    }

    private static User copy(User user) {
        return new User(user.email, user.firstName, user.lastName);
    }
}
