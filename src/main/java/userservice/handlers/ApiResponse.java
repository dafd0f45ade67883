package userservice.handlers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;

/**
 * Status code, headers and JSON body returned for every request.
 */
public class ApiResponse {

    private final static Logger LOGGER = LoggerFactory.getLogger(ApiResponse.class);

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String APPLICATION_JSON = "application/json";

    public final int statusCode;
    public final Map<String, String> headers;
    public final String body;

    public ApiResponse(int statusCode, Map<String, String> headers, String body) {
        this.statusCode = statusCode;
        this.headers = headers;
        this.body = body;
    }

    /**
     * Encodes {@code payload} as the JSON body. An unencodable payload gives an empty body.
     */
    public static ApiResponse of(ObjectMapper mapper, int status, Object payload) {
        String body;
        try {
            body = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            LOGGER.error("Error encoding response body for status {}", status, e);
            body = "";
        }
        return new ApiResponse(status, Collections.singletonMap(CONTENT_TYPE, APPLICATION_JSON), body);
    }

    @Override
    public String toString() {
        return "ApiResponse{" +
                "statusCode=" + statusCode +
                ", headers=" + headers +
                ", body='" + body + '\'' +
                '}';
    }
}
