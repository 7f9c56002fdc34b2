package com.example.rentalchat.config;

import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "chat")
public class ChatProperties {

    @NestedConfigurationProperty
    private final Redis redis = new Redis();

    @NestedConfigurationProperty
    private final Kafka kafka = new Kafka();

    @NestedConfigurationProperty
    private final Messages messages = new Messages();

    @NestedConfigurationProperty
    private final Conversations conversations = new Conversations();

    @NestedConfigurationProperty
    private final Locks locks = new Locks();

    @NestedConfigurationProperty
    private final Collaborators collaborators = new Collaborators();

    @NestedConfigurationProperty
    private final Socketio socketio = new Socketio();

    public Redis getRedis() {
        return redis;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Messages getMessages() {
        return messages;
    }

    public Conversations getConversations() {
        return conversations;
    }

    public Locks getLocks() {
        return locks;
    }

    public Collaborators getCollaborators() {
        return collaborators;
    }

    public Socketio getSocketio() {
        return socketio;
    }

    @Validated
    public static class Redis {

        /**
         * Prefix applied to all Redis keys controlled by the chat module.
         */
        private String keyPrefix = "rental-chat";

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }

    @Validated
    public static class Kafka {

        /**
         * Kafka topic receiving conversation and message integration events.
         */
        private String lifecycleTopic = "chat.lifecycle";

        /**
         * Whether integration events are published at all.
         */
        private boolean enabled = true;

        public String getLifecycleTopic() {
            return lifecycleTopic;
        }

        public void setLifecycleTopic(String lifecycleTopic) {
            this.lifecycleTopic = lifecycleTopic;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    @Validated
    public static class Messages {

        /**
         * Maximum number of characters accepted in one message.
         */
        @Min(1)
        private int maxLength = 2000;

        /**
         * Number of messages returned when the caller does not ask for a page size.
         */
        @Min(1)
        private int defaultPageSize = 100;

        /**
         * Upper bound on any requested message page size.
         */
        @Min(1)
        private int maxPageSize = 500;

        public int getMaxLength() {
            return maxLength;
        }

        public void setMaxLength(int maxLength) {
            this.maxLength = maxLength;
        }

        public int getDefaultPageSize() {
            return defaultPageSize;
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
        }

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }
    }

    @Validated
    public static class Conversations {

        /**
         * Number of conversations returned in the list view by default.
         */
        @Min(1)
        private int defaultPageSize = 50;

        /**
         * Upper bound on any requested conversation page size.
         */
        @Min(1)
        private int maxPageSize = 200;

        /**
         * Content of the system message appended when a conversation is first created. It is excluded from unread counts.
         */
        private String startedMessage = "Conversation started";

        public int getDefaultPageSize() {
            return defaultPageSize;
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
        }

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }

        public String getStartedMessage() {
            return startedMessage;
        }

        public void setStartedMessage(String startedMessage) {
            this.startedMessage = startedMessage;
        }
    }

    @Validated
    public static class Locks {

        /**
         * How long a caller waits for a conversation lock before giving up.
         */
        private Duration waitTime = Duration.ofSeconds(5);

        /**
         * Lease after which a lock held by a crashed node is released.
         */
        private Duration leaseTime = Duration.ofSeconds(30);

        public Duration getWaitTime() {
            return waitTime;
        }

        public void setWaitTime(Duration waitTime) {
            this.waitTime = waitTime;
        }

        public Duration getLeaseTime() {
            return leaseTime;
        }

        public void setLeaseTime(Duration leaseTime) {
            this.leaseTime = leaseTime;
        }
    }

    @Validated
    public static class Collaborators {

        /**
         * Base URL of the account service, e.g. {@code http://accounts/api/users}. Blank disables lookups.
         */
        private String usersUrl;

        /**
         * Base URL of the listing service, e.g. {@code http://listings/api/properties}. Blank disables lookups.
         */
        private String listingsUrl;

        private Duration timeout = Duration.ofSeconds(2);

        public String getUsersUrl() {
            return usersUrl;
        }

        public void setUsersUrl(String usersUrl) {
            this.usersUrl = usersUrl;
        }

        public String getListingsUrl() {
            return listingsUrl;
        }

        public void setListingsUrl(String listingsUrl) {
            this.listingsUrl = listingsUrl;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    @Validated
    public static class Socketio {

        private String host = "0.0.0.0";

        private int port = 9094;

        /**
         * Allowed origin for browser clients.
         */
        private String origin = "*";

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getOrigin() {
            return origin;
        }

        public void setOrigin(String origin) {
            this.origin = origin;
        }
    }
}
