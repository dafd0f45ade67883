package userservice.handlers;

import java.util.Collections;
import java.util.Map;

/**
 * An inbound request as the router sees it: method token, query string parameters and raw body.
 */
public class UserRequest {

    public final String method;
    public final Map<String, String> queryParameters;
    public final String body;

    public UserRequest(String method, Map<String, String> queryParameters, String body) {
        this.method = method;
        this.queryParameters = queryParameters == null ? Collections.emptyMap() : queryParameters;
        this.body = body == null ? "" : body;
    }

    public String queryParameter(String name) {
        return queryParameters.getOrDefault(name, "");
    }

    @Override
    public String toString() {
        return "UserRequest{" +
                "method='" + method + '\'' +
                ", queryParameters=" + queryParameters +
                '}';
    }
}
