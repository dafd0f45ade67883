package userservice.users.impl;

import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemResponse;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.paginators.ScanIterable;
import userservice.users.ConditionalWriteException;
import userservice.users.User;
import userservice.users.UserStoreException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class UserDynamoDbRepositoryTest {

    private static final String TABLE = "users";

    private DynamoDbClient dynamoDb;
    private UserDynamoDbRepository repository;

    @Before
    public void setUp() {
        dynamoDb = mock(DynamoDbClient.class);
        repository = new UserDynamoDbRepository(dynamoDb, TABLE);
    }

    @Test
    public void getReadsByEmailKey() {
        when(dynamoDb.getItem(any(GetItemRequest.class)))
                .thenReturn(GetItemResponse.builder().item(item("john@example.com", "John", "Doe")).build());

        assertThat(repository.get("john@example.com").get()).isEqualTo(new User("john@example.com", "John", "Doe"));

        ArgumentCaptor<GetItemRequest> captor = ArgumentCaptor.forClass(GetItemRequest.class);
        verify(dynamoDb).getItem(captor.capture());
        assertThat(captor.getValue().tableName()).isEqualTo(TABLE);
        assertThat(captor.getValue().key().get("email").s()).isEqualTo("john@example.com");
    }

    @Test
    public void getWithoutItemIsNone() {
        when(dynamoDb.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());

        assertThat(repository.get("nobody@example.com").isEmpty()).isTrue();
    }

    @Test
    public void getFailureIsAReadError() {
        when(dynamoDb.getItem(any(GetItemRequest.class)))
                .thenThrow(DynamoDbException.builder().message("boom").build());

        assertThatThrownBy(() -> repository.get("john@example.com"))
                .isInstanceOfSatisfying(UserStoreException.class,
                        e -> assertThat(e.getKind()).isEqualTo(UserStoreException.Kind.READ));
    }

    @Test
    public void nonStringAttributeIsADecodeError() {
        Map<String, AttributeValue> item = item("john@example.com", "John", "Doe");
        item.put("lastname", AttributeValue.builder().n("42").build());
        when(dynamoDb.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().item(item).build());

        assertThatThrownBy(() -> repository.get("john@example.com"))
                .isInstanceOfSatisfying(UserStoreException.class,
                        e -> assertThat(e.getKind()).isEqualTo(UserStoreException.Kind.DECODE));
    }

    @Test
    public void listScansEveryItem() {
        when(dynamoDb.scanPaginator(any(ScanRequest.class)))
                .thenAnswer(invocation -> new ScanIterable(dynamoDb, invocation.getArgument(0)));
        when(dynamoDb.scan(any(ScanRequest.class))).thenReturn(ScanResponse.builder()
                .items(item("a@example.com", "A", "A"), item("b@example.com", "B", "B"))
                .build());

        assertThat(repository.list().map(u -> u.email)).containsExactly("a@example.com", "b@example.com");
    }

    @Test
    public void saveIsAnUnconditionalPut() {
        when(dynamoDb.putItem(any(PutItemRequest.class))).thenReturn(PutItemResponse.builder().build());

        repository.save(new User("john@example.com", "John", "Doe"));

        ArgumentCaptor<PutItemRequest> captor = ArgumentCaptor.forClass(PutItemRequest.class);
        verify(dynamoDb).putItem(captor.capture());
        assertThat(captor.getValue().tableName()).isEqualTo(TABLE);
        assertThat(captor.getValue().conditionExpression()).isNull();
        assertThat(captor.getValue().item()).isEqualTo(item("john@example.com", "John", "Doe"));
    }

    @Test
    public void createRequiresAnAbsentKey() {
        when(dynamoDb.putItem(any(PutItemRequest.class)))
                .thenThrow(ConditionalCheckFailedException.builder().message("exists").build());

        assertThatThrownBy(() -> repository.create(new User("john@example.com", "John", "Doe")))
                .isInstanceOf(ConditionalWriteException.class);

        ArgumentCaptor<PutItemRequest> captor = ArgumentCaptor.forClass(PutItemRequest.class);
        verify(dynamoDb).putItem(captor.capture());
        assertThat(captor.getValue().conditionExpression()).isEqualTo("attribute_not_exists(email)");
    }

    @Test
    public void replaceRequiresAPresentKey() {
        when(dynamoDb.putItem(any(PutItemRequest.class))).thenReturn(PutItemResponse.builder().build());

        repository.replace(new User("john@example.com", "John", "Doe"));

        ArgumentCaptor<PutItemRequest> captor = ArgumentCaptor.forClass(PutItemRequest.class);
        verify(dynamoDb).putItem(captor.capture());
        assertThat(captor.getValue().conditionExpression()).isEqualTo("attribute_exists(email)");
    }

    @Test
    public void putFailureIsAWriteError() {
        when(dynamoDb.putItem(any(PutItemRequest.class)))
                .thenThrow(DynamoDbException.builder().message("boom").build());

        assertThatThrownBy(() -> repository.save(new User("john@example.com", "John", "Doe")))
                .isInstanceOfSatisfying(UserStoreException.class, e -> {
                    assertThat(e).isNotInstanceOf(ConditionalWriteException.class);
                    assertThat(e.getKind()).isEqualTo(UserStoreException.Kind.WRITE);
                });
    }

    @Test
    public void deleteFailureIsADeleteError() {
        when(dynamoDb.deleteItem(any(DeleteItemRequest.class)))
                .thenThrow(DynamoDbException.builder().message("boom").build());

        assertThatThrownBy(() -> repository.delete("john@example.com"))
                .isInstanceOfSatisfying(UserStoreException.class,
                        e -> assertThat(e.getKind()).isEqualTo(UserStoreException.Kind.DELETE));
    }

    @Test
    public void deleteUsesTheEmailKey() {
        repository.delete("john@example.com");

        ArgumentCaptor<DeleteItemRequest> captor = ArgumentCaptor.forClass(DeleteItemRequest.class);
        verify(dynamoDb).deleteItem(captor.capture());
        assertThat(captor.getValue().key()).isEqualTo(Collections.singletonMap("email",
                AttributeValue.builder().s("john@example.com").build()));
    }

    private static Map<String, AttributeValue> item(String email, String firstName, String lastName) {
        Map<String, AttributeValue> item = new HashMap<>();
        item.put("email", AttributeValue.builder().s(email).build());
        item.put("firstname", AttributeValue.builder().s(firstName).build());
        item.put("lastname", AttributeValue.builder().s(lastName).build());
        return item;
    }
}
