package userservice.users;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.Valid;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.Pattern;

@Validated
@ConfigurationProperties(prefix = "users.store")
public class UserStoreProperties {

    @Pattern(regexp = "(memory|leveldb|dynamodb)")
    private String backend = "memory";
    @NotEmpty
    private String region;
    @NotEmpty
    private String table;
    private String endpoint;
    private boolean conditionalWrites = false;
    @Valid
    private LevelDb leveldb = new LevelDb();

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getTable() {
        return table;
    }

    public void setTable(String table) {
        this.table = table;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public boolean isConditionalWrites() {
        return conditionalWrites;
    }

    public void setConditionalWrites(boolean conditionalWrites) {
        this.conditionalWrites = conditionalWrites;
    }

    public LevelDb getLeveldb() {
        return leveldb;
    }

    public void setLeveldb(LevelDb leveldb) {
        this.leveldb = leveldb;
    }

    @Override
    public String toString() {
        return "UserStoreProperties{" +
                "backend='" + backend + '\'' +
                ", region='" + region + '\'' +
                ", table='" + table + '\'' +
                ", endpoint='" + endpoint + '\'' +
                ", conditionalWrites=" + conditionalWrites +
                ", leveldb=" + leveldb.path +
                '}';
    }

    public static class LevelDb {

        @NotEmpty
        private String path = "target/users-leveldb";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }
}
