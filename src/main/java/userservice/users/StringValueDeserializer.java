package userservice.users;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Reads JSON strings only. Numbers, booleans, arrays and objects are rejected instead of
 * being coerced to their text. An explicit {@code null} reads as the empty string.
 */
public class StringValueDeserializer extends StdDeserializer<String> {

    public StringValueDeserializer() {
        super(String.class);
    }

    @Override
    public String deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.hasToken(JsonToken.VALUE_STRING)) {
            return p.getText();
        }
        return (String) ctxt.handleUnexpectedToken(String.class, p);
    }

    @Override
    public Object getEmptyValue(DeserializationContext ctxt) {
        return "";
    }
}
