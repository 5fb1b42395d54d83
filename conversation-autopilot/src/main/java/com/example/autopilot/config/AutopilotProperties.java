package com.example.autopilot.config;

import jakarta.validation.constraints.Min;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "autopilot")
public class AutopilotProperties {

    @NestedConfigurationProperty
    private final Redis redis = new Redis();

    @NestedConfigurationProperty
    private final Kafka kafka = new Kafka();

    @NestedConfigurationProperty
    private final Debounce debounce = new Debounce();

    @NestedConfigurationProperty
    private final Approval approval = new Approval();

    @NestedConfigurationProperty
    private final Reasoning reasoning = new Reasoning();

    @NestedConfigurationProperty
    private final Retry retry = new Retry();

    @NestedConfigurationProperty
    private final History history = new History();

    @NestedConfigurationProperty
    private final Workers workers = new Workers();

    @NestedConfigurationProperty
    private final Housekeeping housekeeping = new Housekeeping();

    @NestedConfigurationProperty
    private final Listing listing = new Listing();

    public Redis getRedis() {
        return redis;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Debounce getDebounce() {
        return debounce;
    }

    public Approval getApproval() {
        return approval;
    }

    public Reasoning getReasoning() {
        return reasoning;
    }

    public Retry getRetry() {
        return retry;
    }

    public History getHistory() {
        return history;
    }

    public Workers getWorkers() {
        return workers;
    }

    public Housekeeping getHousekeeping() {
        return housekeeping;
    }

    public Listing getListing() {
        return listing;
    }

    @Validated
    public static class Redis {

        /**
         * Prefix applied to all Redis keys controlled by the autopilot.
         */
        private String keyPrefix = "autopilot";

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
         * Kafka topic receiving conversation lifecycle events.
         */
        private String lifecycleTopic = "autopilot.lifecycle";

        /**
         * Kafka topic the chat connector consumes replies from.
         */
        private String outboundTopic = "autopilot.outbound";

        /**
         * Kafka topic the chat connector publishes inbound messages to.
         */
        private String inboundTopic = "autopilot.inbound";

        /**
         * Consumer group used for the inbound topic.
         */
        private String consumerGroup = "conversation-autopilot";

        /**
         * How long an outbound reply waits for the broker acknowledgement.
         */
        private Duration sendTimeout = Duration.ofSeconds(10);

        /**
         * Whether inbound messages are consumed from {@link #inboundTopic}.
         */
        private boolean inboundEnabled = true;

        public boolean isInboundEnabled() {
            return inboundEnabled;
        }

        public void setInboundEnabled(boolean inboundEnabled) {
            this.inboundEnabled = inboundEnabled;
        }

        public String getLifecycleTopic() {
            return lifecycleTopic;
        }

        public void setLifecycleTopic(String lifecycleTopic) {
            this.lifecycleTopic = lifecycleTopic;
        }

        public String getOutboundTopic() {
            return outboundTopic;
        }

        public void setOutboundTopic(String outboundTopic) {
            this.outboundTopic = outboundTopic;
        }

        public String getInboundTopic() {
            return inboundTopic;
        }

        public void setInboundTopic(String inboundTopic) {
            this.inboundTopic = inboundTopic;
        }

        public String getConsumerGroup() {
            return consumerGroup;
        }

        public void setConsumerGroup(String consumerGroup) {
            this.consumerGroup = consumerGroup;
        }

        public Duration getSendTimeout() {
            return sendTimeout;
        }

        public void setSendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
        }
    }

    @Validated
    public static class Debounce {

        /**
         * Silence required after the last inbound message before a batch is closed.
         */
        private Duration quietWindow = Duration.ofSeconds(3);

        /**
         * Batch size that closes a batch immediately regardless of the quiet window.
         */
        @Min(1)
        private int maxBatchSize = 8;

        /**
         * Whether messages held while a conversation was busy open a new batch once it is released.
         */
        private boolean replayHeldMessages = true;

        public Duration getQuietWindow() {
            return quietWindow;
        }

        public void setQuietWindow(Duration quietWindow) {
            this.quietWindow = quietWindow;
        }

        public int getMaxBatchSize() {
            return maxBatchSize;
        }

        public void setMaxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
        }

        public boolean isReplayHeldMessages() {
            return replayHeldMessages;
        }

        public void setReplayHeldMessages(boolean replayHeldMessages) {
            this.replayHeldMessages = replayHeldMessages;
        }
    }

    @Validated
    public static class Approval {

        /**
         * Time a pending approval waits for a human before it expires.
         */
        private Duration timeout = Duration.ofHours(1);

        /**
         * Shared secret approval console clients must present when connecting. Empty disables the check.
         */
        private String consoleToken;

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public String getConsoleToken() {
            return consoleToken;
        }

        public void setConsoleToken(String consoleToken) {
            this.consoleToken = consoleToken;
        }
    }

    @Validated
    public static class Reasoning {

        /**
         * OpenAI-compatible base URLs, tried in order until one answers.
         */
        private List<String> baseUrls = new ArrayList<>(List.of("http://127.0.0.1:8045/v1"));

        private String apiKey;

        private String model = "gemini-3-flash";

        private double temperature = 0.2;

        /**
         * Attempts against a single base URL before moving on to the next one.
         */
        @Min(1)
        private int attemptsPerEndpoint = 2;

        private Duration connectTimeout = Duration.ofSeconds(5);

        private Duration readTimeout = Duration.ofSeconds(30);

        public List<String> getBaseUrls() {
            return baseUrls;
        }

        public void setBaseUrls(List<String> baseUrls) {
            this.baseUrls = baseUrls;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getAttemptsPerEndpoint() {
            return attemptsPerEndpoint;
        }

        public void setAttemptsPerEndpoint(int attemptsPerEndpoint) {
            this.attemptsPerEndpoint = attemptsPerEndpoint;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }

    @Validated
    public static class Retry {

        /**
         * Attempts made for a storage or delivery call before the failure is surfaced.
         */
        @Min(1)
        private int maxAttempts = 3;

        private Duration initialBackoff = Duration.ofMillis(200);

        private double multiplier = 2.0;

        private Duration maxBackoff = Duration.ofSeconds(5);

        /**
         * Delay before a conversation whose storage failed resumes its pending decision.
         */
        private Duration pause = Duration.ofSeconds(30);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public Duration getPause() {
            return pause;
        }

        public void setPause(Duration pause) {
            this.pause = pause;
        }
    }

    @Validated
    public static class History {

        /**
         * Most recent messages passed to the reasoning collaborator as context.
         */
        @Min(1)
        private int contextLimit = 140;

        /**
         * Default page size for the message inspection endpoint.
         */
        @Min(1)
        private int pageLimit = 100;

        public int getContextLimit() {
            return contextLimit;
        }

        public void setContextLimit(int contextLimit) {
            this.contextLimit = contextLimit;
        }

        public int getPageLimit() {
            return pageLimit;
        }

        public void setPageLimit(int pageLimit) {
            this.pageLimit = pageLimit;
        }
    }

    @Validated
    public static class Workers {

        /**
         * Threads shared by all conversation workers.
         */
        @Min(1)
        private int poolSize = 8;

        /**
         * Threads firing debounce and expiry timers.
         */
        @Min(1)
        private int schedulerPoolSize = 2;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public int getSchedulerPoolSize() {
            return schedulerPoolSize;
        }

        public void setSchedulerPoolSize(int schedulerPoolSize) {
            this.schedulerPoolSize = schedulerPoolSize;
        }
    }

    @Validated
    public static class Housekeeping {

        /**
         * Interval between expiry sweeps over pending approvals.
         */
        private Duration interval = Duration.ofMinutes(1);

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    @Validated
    public static class Listing {

        private List<Item> items = new ArrayList<>();

        private String activeItemId;

        /**
         * Pickup spot quoted to buyers.
         */
        private String location;

        /**
         * Free-form note about when the seller is around.
         */
        private String availabilityNote;

        /**
         * Zone used to tell the reasoning collaborator the seller's local time.
         */
        private String timeZone = "America/Vancouver";

        public List<Item> getItems() {
            return items;
        }

        public void setItems(List<Item> items) {
            this.items = items;
        }

        public String getActiveItemId() {
            return activeItemId;
        }

        public void setActiveItemId(String activeItemId) {
            this.activeItemId = activeItemId;
        }

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }

        public String getAvailabilityNote() {
            return availabilityNote;
        }

        public void setAvailabilityNote(String availabilityNote) {
            this.availabilityNote = availabilityNote;
        }

        public String getTimeZone() {
            return timeZone;
        }

        public void setTimeZone(String timeZone) {
            this.timeZone = timeZone;
        }

        public static class Item {

            private String id;

            private String name;

            private BigDecimal listedPrice;

            /**
             * Lowest price the seller accepts. Never quoted to buyers directly.
             */
            private BigDecimal bottomPrice;

            public String getId() {
                return id;
            }

            public void setId(String id) {
                this.id = id;
            }

            public String getName() {
                return name;
            }

            public void setName(String name) {
                this.name = name;
            }

            public BigDecimal getListedPrice() {
                return listedPrice;
            }

            public void setListedPrice(BigDecimal listedPrice) {
                this.listedPrice = listedPrice;
            }

            public BigDecimal getBottomPrice() {
                return bottomPrice;
            }

            public void setBottomPrice(BigDecimal bottomPrice) {
                this.bottomPrice = bottomPrice;
            }
        }
    }
}
