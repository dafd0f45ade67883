package userservice.users;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vavr.control.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;
import userservice.handlers.UserHandlers;
import userservice.handlers.UserRouter;
import userservice.users.impl.InMemoryUserRepository;
import userservice.users.impl.UserDynamoDbRepository;
import userservice.users.impl.UserLevelDbRepository;

import java.io.IOException;
import java.net.URI;

@Configuration
@EnableConfigurationProperties(UserStoreProperties.class)
public class UserConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(UserConfiguration.class);

    @Bean
    @ConditionalOnProperty(prefix = "users.store", name = "backend", havingValue = "memory", matchIfMissing = true)
    public UserRepository inMemoryUserRepository() {
        LOGGER.info("Storing users in memory");
        return new InMemoryUserRepository();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "users.store", name = "backend", havingValue = "leveldb")
    public UserRepository levelDbUserRepository(ObjectMapper mapper, UserStoreProperties properties) throws IOException {
        return new UserLevelDbRepository(properties.getLeveldb().getPath(), mapper);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "users.store", name = "backend", havingValue = "dynamodb")
    public DynamoDbClient dynamoDbClient(UserStoreProperties properties) {
        LOGGER.debug("Creating dynamodb client with configuration {}", properties);
        DynamoDbClientBuilder builder = DynamoDbClient.builder()
                .region(Region.of(properties.getRegion()));
        Option.of(properties.getEndpoint())
                .filter(s -> !s.isEmpty())
                .forEach(endpoint -> builder.endpointOverride(URI.create(endpoint)));
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "users.store", name = "backend", havingValue = "dynamodb")
    public UserRepository dynamoDbUserRepository(DynamoDbClient dynamoDbClient, UserStoreProperties properties) {
        LOGGER.info("Storing users in dynamodb table {} ({})", properties.getTable(), properties.getRegion());
        return new UserDynamoDbRepository(dynamoDbClient, properties.getTable());
    }

    @Bean
    public UserService userService(UserRepository userRepository, ObjectMapper mapper, UserStoreProperties properties) {
        return new UserService(userRepository, mapper, properties.isConditionalWrites());
    }

    @Bean
    public UserHandlers userHandlers(UserService userService, ObjectMapper mapper) {
        return new UserHandlers(userService, mapper);
    }

    @Bean
    public UserRouter userRouter(UserHandlers userHandlers) {
        return new UserRouter(userHandlers);
    }
}
