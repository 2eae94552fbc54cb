package com.chatbot.resilience.config;

/**
 * Connection details and pool bounds for one PostgreSQL server, primary or read replica.
 */
public class DatabaseEndpoint {
    
    private final String host;
    private final int port;
    private final String user;
    private final String password;
    private final String database;
    private final int minPoolSize;
    private final int maxPoolSize;
    private final boolean readOnly;
    
    private DatabaseEndpoint(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.user = builder.user;
        this.password = builder.password;
        this.database = builder.database;
        this.minPoolSize = builder.minPoolSize;
        this.maxPoolSize = builder.maxPoolSize;
        this.readOnly = builder.readOnly;
    }
    
    public String getHost() {
        return host;
    }
    
    public int getPort() {
        return port;
    }
    
    public String getUser() {
        return user;
    }
    
    public String getPassword() {
        return password;
    }
    
    public String getDatabase() {
        return database;
    }
    
    public int getMinPoolSize() {
        return minPoolSize;
    }
    
    public int getMaxPoolSize() {
        return maxPoolSize;
    }
    
    public boolean isReadOnly() {
        return readOnly;
    }
    
    public String getJdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s", host, port, database);
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private String host = "localhost";
        private int port = 5432;
        private String user = "postgres";
        private String password = "";
        private String database = "chatbot";
        private int minPoolSize = 2;
        private int maxPoolSize = 15;
        private boolean readOnly = false;
        
        public Builder host(String host) {
            if (host == null || host.isBlank()) {
                throw new IllegalArgumentException("Host cannot be null or empty");
            }
            this.host = host;
            return this;
        }
        
        public Builder port(int port) {
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("Port must be between 1 and 65535");
            }
            this.port = port;
            return this;
        }
        
        public Builder user(String user) {
            this.user = user;
            return this;
        }
        
        public Builder password(String password) {
            this.password = password != null ? password : "";
            return this;
        }
        
        public Builder database(String database) {
            this.database = database;
            return this;
        }
        
        public Builder minPoolSize(int minPoolSize) {
            if (minPoolSize < 0) {
                throw new IllegalArgumentException("Min pool size must not be negative");
            }
            this.minPoolSize = minPoolSize;
            return this;
        }
        
        public Builder maxPoolSize(int maxPoolSize) {
            if (maxPoolSize <= 0) {
                throw new IllegalArgumentException("Max pool size must be positive");
            }
            this.maxPoolSize = maxPoolSize;
            return this;
        }
        
        public Builder readOnly(boolean readOnly) {
            this.readOnly = readOnly;
            return this;
        }
        
        public DatabaseEndpoint build() {
            if (minPoolSize > maxPoolSize) {
                throw new IllegalArgumentException("Min pool size cannot exceed max pool size");
            }
            return new DatabaseEndpoint(this);
        }
    }
    
    @Override
    public String toString() {
        // password omitted
        return String.format("DatabaseEndpoint{host='%s', port=%d, database='%s', user='%s', pool=%d-%d, readOnly=%s}",
            host, port, database, user, minPoolSize, maxPoolSize, readOnly);
    }
}
