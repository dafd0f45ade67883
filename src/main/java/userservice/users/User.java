package userservice.users;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonFormat(with = JsonFormat.Feature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
public class User {

    @JsonProperty("email")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonDeserialize(using = StringValueDeserializer.class)
    public String email = "";

    @JsonProperty("firstname")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonDeserialize(using = StringValueDeserializer.class)
    public String firstName = "";

    @JsonProperty("lastname")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonDeserialize(using = StringValueDeserializer.class)
    public String lastName = "";

    public User() {
    }

    public User(String email, String firstName, String lastName) {
        this.email = email == null ? "" : email;
        this.firstName = firstName == null ? "" : firstName;
        this.lastName = lastName == null ? "" : lastName;
    }

    /**
     * The zero-valued user returned for a key the store doesn't hold.
     */
    public static User empty() {
        return new User();
    }

    public boolean hasEmail() {
        return email != null && !email.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        User user = (User) o;
        return Objects.equals(email, user.email) &&
                Objects.equals(firstName, user.firstName) &&
                Objects.equals(lastName, user.lastName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(email, firstName, lastName);
    }

    @Override
    public String toString() {
        return "User{" +
                "email='" + email + '\'' +
                ", firstName='" + firstName + '\'' +
                ", lastName='" + lastName + '\'' +
                '}';
    }
}
