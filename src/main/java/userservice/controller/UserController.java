package userservice.controller;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import userservice.handlers.ApiResponse;
import userservice.handlers.UserRequest;
import userservice.handlers.UserRouter;

import javax.servlet.http.HttpServletRequest;
import java.util.Map;

import static org.springframework.web.bind.annotation.RequestMethod.*;

/**
 * Hands every request on {@code /api/users}, whatever its method, to the {@link UserRouter}.
 * OPTIONS and TRACE are mapped explicitly so the router answers them rather than the servlet.
 */
@RestController
@RequestMapping("/api/users")
public class UserController {

    private final UserRouter userRouter;

    @Autowired
    public UserController(UserRouter userRouter) {
        this.userRouter = userRouter;
    }

    @RequestMapping(method = {GET, HEAD, POST, PUT, PATCH, DELETE, OPTIONS, TRACE})
    public ResponseEntity<String> handle(HttpServletRequest request,
                                         @RequestParam Map<String, String> queryParameters,
                                         @RequestBody(required = false) String body) {
        ApiResponse response = userRouter.route(new UserRequest(request.getMethod(), queryParameters, body));
        HttpHeaders headers = new HttpHeaders();
        response.headers.forEach(headers::set);
        return ResponseEntity.status(response.statusCode).headers(headers).body(response.body);
    }
}
