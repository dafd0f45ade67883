package userservice.handlers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches a request to its handler by HTTP method.
 */
public class UserRouter {

    private final static Logger LOGGER = LoggerFactory.getLogger(UserRouter.class);

    private final UserHandlers handlers;

    public UserRouter(UserHandlers handlers) {
        this.handlers = handlers;
    }

    public ApiResponse route(UserRequest request) {
        LOGGER.debug("Routing {}", request);
        String method = request.method == null ? "" : request.method;
        switch (method) {
            case "GET":
                return handlers.getUser(request);
            case "POST":
                return handlers.createUser(request);
            case "PUT":
                return handlers.updateUser(request);
            case "DELETE":
                return handlers.deleteUser(request);
            default:
                return handlers.unhandledMethod(request);
        }
    }
}
