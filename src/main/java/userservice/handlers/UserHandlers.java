package userservice.handlers;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import userservice.users.UserException;
import userservice.users.UserService;

import java.util.function.Supplier;

/**
 * One handler per operation. Each runs the matching {@link UserService} call and wraps its
 * result, or its {@link UserException}, into an {@link ApiResponse}.
 */
public class UserHandlers {

    private final static Logger LOGGER = LoggerFactory.getLogger(UserHandlers.class);

    public static final String EMAIL = "email";
    public static final String METHOD_NOT_ALLOWED = "method not allowed";
    public static final String USER_DELETED = "User deleted successfully";

    private final UserService userService;
    private final ObjectMapper mapper;

    public UserHandlers(UserService userService, ObjectMapper mapper) {
        this.userService = userService;
        this.mapper = mapper;
    }

    public ApiResponse getUser(UserRequest request) {
        String email = request.queryParameter(EMAIL);
        if (!email.isEmpty()) {
            return handle(HttpStatus.OK, () -> userService.fetch(email));
        }
        return handle(HttpStatus.OK, userService::fetchAll);
    }

    public ApiResponse createUser(UserRequest request) {
        return handle(HttpStatus.CREATED, () -> userService.create(request.body));
    }

    public ApiResponse updateUser(UserRequest request) {
        return handle(HttpStatus.OK, () -> userService.update(request.body));
    }

    public ApiResponse deleteUser(UserRequest request) {
        return handle(HttpStatus.OK, () -> {
            userService.delete(request.queryParameter(EMAIL));
            return USER_DELETED;
        });
    }

    public ApiResponse unhandledMethod(UserRequest request) {
        LOGGER.warn("Method {} not allowed", request.method);
        return ApiResponse.of(mapper, HttpStatus.METHOD_NOT_ALLOWED.value(), METHOD_NOT_ALLOWED);
    }

    private ApiResponse handle(HttpStatus success, Supplier<Object> operation) {
        try {
            return ApiResponse.of(mapper, success.value(), operation.get());
        } catch (UserException e) {
            return ApiResponse.of(mapper, HttpStatus.BAD_REQUEST.value(), new ErrorBody(e.getMessage()));
        }
    }
}
