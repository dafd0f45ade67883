package userservice.users.impl;

import io.vavr.collection.HashMap;
import io.vavr.collection.List;
import io.vavr.control.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import userservice.users.ConditionalWriteException;
import userservice.users.User;
import userservice.users.UserRepository;
import userservice.users.UserStoreException;

import java.util.Map;

import static userservice.users.UserStoreException.Kind.*;

/**
 * Users stored in a DynamoDB table keyed by {@code email}, with {@code firstname} and
 * {@code lastname} string attributes.
 * <p>
 * {@link #list()} walks every scan page in one call. There is no pagination exposed to
 * callers so this is only suitable for small tables.
 */
public class UserDynamoDbRepository implements UserRepository {

    private final static Logger LOGGER = LoggerFactory.getLogger(UserDynamoDbRepository.class);

    static final String EMAIL = "email";
    static final String FIRST_NAME = "firstname";
    static final String LAST_NAME = "lastname";

    private final DynamoDbClient dynamoDb;
    private final String tableName;

    public UserDynamoDbRepository(DynamoDbClient dynamoDb, String tableName) {
        this.dynamoDb = dynamoDb;
        this.tableName = tableName;
    }

    @Override
    public Option<User> get(String email) {
        GetItemResponse response;
        try {
            response = dynamoDb.getItem(GetItemRequest.builder()
                    .tableName(tableName)
                    .key(key(email))
                    .build());
        } catch (SdkException e) {
            throw new UserStoreException(READ, "Error reading " + email + " from " + tableName, e);
        }
        if (!response.hasItem() || response.item().isEmpty()) {
            return Option.none();
        }
        return Option.of(decode(response.item()));
    }

    @Override
    public List<User> list() {
        try {
            return List.ofAll(dynamoDb.scanPaginator(ScanRequest.builder().tableName(tableName).build()).items())
                    .map(this::decode);
        } catch (SdkException e) {
            throw new UserStoreException(READ, "Error scanning " + tableName, e);
        }
    }

    @Override
    public User save(User user) {
        put(user, null);
        return user;
    }

    @Override
    public User create(User user) {
        put(user, "attribute_not_exists(" + EMAIL + ")");
        return user;
    }

    @Override
    public User replace(User user) {
        put(user, "attribute_exists(" + EMAIL + ")");
        return user;
    }

    @Override
    public void delete(String email) {
        try {
            dynamoDb.deleteItem(DeleteItemRequest.builder()
                    .tableName(tableName)
                    .key(key(email))
                    .build());
        } catch (SdkException e) {
            throw new UserStoreException(DELETE, "Error deleting " + email + " from " + tableName, e);
        }
    }

    private void put(User user, String condition) {
        PutItemRequest request = PutItemRequest.builder()
                .tableName(tableName)
                .item(encode(user))
                .conditionExpression(condition)
                .build();
        try {
            dynamoDb.putItem(request);
        } catch (ConditionalCheckFailedException e) {
            throw new ConditionalWriteException(user.email, "Condition " + condition + " failed for " + user.email, e);
        } catch (SdkException e) {
            throw new UserStoreException(WRITE, "Error writing " + user.email + " to " + tableName, e);
        }
        LOGGER.debug("Put {} into {}", user.email, tableName);
    }

    private static Map<String, AttributeValue> key(String email) {
        return HashMap.of(EMAIL, string(email)).toJavaMap();
    }

    static Map<String, AttributeValue> encode(User user) {
        return HashMap.of(
                EMAIL, string(user.email),
                FIRST_NAME, string(user.firstName),
                LAST_NAME, string(user.lastName)
        ).toJavaMap();
    }

    User decode(Map<String, AttributeValue> item) {
        return new User(
                attribute(item, EMAIL),
                attribute(item, FIRST_NAME),
                attribute(item, LAST_NAME)
        );
    }

    private String attribute(Map<String, AttributeValue> item, String name) {
        AttributeValue value = item.get(name);
        if (value == null) {
            return "";
        }
        if (value.s() == null) {
            throw new UserStoreException(DECODE, "Attribute " + name + " of an item in " + tableName + " is not a string");
        }
        return value.s();
    }

    private static AttributeValue string(String value) {
        return AttributeValue.builder().s(value == null ? "" : value).build();
    }
}
