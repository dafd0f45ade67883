package userservice.users.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vavr.collection.List;
import io.vavr.control.Option;
import org.iq80.leveldb.DB;
import org.iq80.leveldb.DBException;
import org.iq80.leveldb.DBIterator;
import org.iq80.leveldb.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import userservice.users.ConditionalWriteException;
import userservice.users.User;
import userservice.users.UserRepository;
import userservice.users.UserStoreException;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.util.Map;

import static org.iq80.leveldb.impl.Iq80DBFactory.bytes;
import static org.iq80.leveldb.impl.Iq80DBFactory.factory;
import static userservice.users.UserStoreException.Kind.*;

/**
 * Users stored in an embedded LevelDB database, one JSON document per email.
 * Conditional writes are serialized on this instance, which is enough as long as a
 * single process owns the database directory.
 */
public class UserLevelDbRepository implements UserRepository, Closeable {

    private final static Logger LOGGER = LoggerFactory.getLogger(UserLevelDbRepository.class);

    private final String path;
    private final DB db;
    private final ObjectMapper mapper;

    public UserLevelDbRepository(String path, ObjectMapper mapper) throws IOException {
        this.path = path;
        Options options = new Options();
        options.createIfMissing(true);
        this.db = factory.open(new File(path), options);
        this.mapper = mapper;
        LOGGER.info("Opened users database at {}", path);
    }

    @Override
    public Option<User> get(String email) {
        byte[] src;
        try {
            src = db.get(bytes(email));
        } catch (DBException e) {
            throw new UserStoreException(READ, "Error reading " + email + " from " + path, e);
        }
        return Option.of(src).map(this::decode);
    }

    @Override
    public List<User> list() {
        List<User> users = List.empty();
        try (DBIterator iterator = db.iterator()) {
            iterator.seekToFirst();
            while (iterator.hasNext()) {
                Map.Entry<byte[], byte[]> entry = iterator.next();
                users = users.prepend(decode(entry.getValue()));
            }
        } catch (DBException | IOException e) {
            throw new UserStoreException(READ, "Error scanning " + path, e);
        }
        return users.reverse();
    }

    @Override
    public User save(User user) {
        byte[] raw = encode(user);
        try {
            db.put(bytes(user.email), raw);
            return user;
        } catch (DBException e) {
            throw new UserStoreException(WRITE, "Error writing " + user.email + " to " + path, e);
        }
    }

    @Override
    public synchronized User create(User user) {
        if (get(user.email).isDefined()) {
            throw new ConditionalWriteException(user.email, "User " + user.email + " is already stored");
        }
        return save(user);
    }

    @Override
    public synchronized User replace(User user) {
        if (get(user.email).isEmpty()) {
            throw new ConditionalWriteException(user.email, "User " + user.email + " is not stored");
        }
        return save(user);
    }

    @Override
    public void delete(String email) {
        try {
            db.delete(bytes(email));
        } catch (DBException e) {
            throw new UserStoreException(DELETE, "Error deleting " + email + " from " + path, e);
        }
    }

    @Override
    public void close() throws IOException {
        if (this.db != null) {
            this.db.close();
        }
    }

    private User decode(byte[] src) {
        try {
            return mapper.readValue(src, User.class);
        } catch (IOException e) {
            throw new UserStoreException(DECODE, "Error decoding user from " + path, e);
        }
    }

    private byte[] encode(User user) {
        try {
            return bytes(mapper.writeValueAsString(user));
        } catch (JsonProcessingException e) {
            throw new UserStoreException(ENCODE, "Error encoding " + user.email, e);
        }
    }
}
