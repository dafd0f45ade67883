package userservice.users;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.junit4.SpringJUnit4ClassRunner;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import userservice.Application;
import userservice.users.impl.UserDynamoDbRepository;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

@RunWith(SpringJUnit4ClassRunner.class)
@SpringBootTest(classes = Application.class, properties = {
        "users.store.backend=dynamodb",
        "users.store.endpoint=http://localhost:8000"
})
@ActiveProfiles(profiles = "test")
public class UserConfigurationDynamoDbTest {

    @Autowired
    UserRepository userRepository;

    @Autowired
    DynamoDbClient dynamoDbClient;

    @Test
    public void dynamoDbBackendIsWired() {
        assertThat(userRepository).isInstanceOf(UserDynamoDbRepository.class);
    }

    @Test
    public void clientUsesConfiguredRegionAndEndpoint() {
        assertThat(dynamoDbClient.serviceClientConfiguration().region()).isEqualTo(Region.EU_WEST_3);
        assertThat(dynamoDbClient.serviceClientConfiguration().endpointOverride())
                .contains(URI.create("http://localhost:8000"));
    }
}
