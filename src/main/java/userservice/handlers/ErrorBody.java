package userservice.handlers;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorBody {

    public String error;

    public ErrorBody() {
    }

    public ErrorBody(String error) {
        this.error = error;
    }
}
