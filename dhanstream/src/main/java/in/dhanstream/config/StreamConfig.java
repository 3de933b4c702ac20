package in.dhanstream.config;

import in.dhanstream.util.Env;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable settings for the streaming sessions and the order tracker.
 *
 * @param clientId            Dhan client id used in feed URLs and SELF login
 * @param accessToken         access token used in feed URLs and SELF login
 * @param userType            SELF or PARTNER login for the order channel
 * @param partnerId           partner id (PARTNER login only)
 * @param partnerSecret       partner secret (PARTNER login only)
 * @param feedVersion         market feed protocol version query parameter
 * @param depthLevel          20 or 200 level depth endpoint
 * @param orderUrl            order update endpoint
 * @param connectTimeout      upper bound for one websocket handshake
 * @param maxAuthRejections   consecutive login rejections before giving up, 0 keeps retrying
 * @param maxTrackedOrders    order tracker capacity
 * @param maxOrderAge         order tracker entry lifetime since last update
 * @param orderSweepInterval  order tracker sweep period
 */
public record StreamConfig(
        String clientId,
        String accessToken,
        UserType userType,
        String partnerId,
        String partnerSecret,
        int feedVersion,
        int depthLevel,
        String orderUrl,
        Duration connectTimeout,
        int maxAuthRejections,
        int maxTrackedOrders,
        Duration maxOrderAge,
        Duration orderSweepInterval
) {

    public static final String DEFAULT_ORDER_URL = "wss://api-order-update.dhan.co";

    public enum UserType { SELF, PARTNER }

    public StreamConfig {
        Objects.requireNonNull(userType, "userType");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(maxOrderAge, "maxOrderAge");
        Objects.requireNonNull(orderSweepInterval, "orderSweepInterval");
        if (depthLevel != 20 && depthLevel != 200) {
            throw new IllegalArgumentException("depthLevel must be 20 or 200, got " + depthLevel);
        }
        if (maxAuthRejections < 0) {
            throw new IllegalArgumentException("maxAuthRejections must not be negative");
        }
        if (maxTrackedOrders <= 0) {
            throw new IllegalArgumentException("maxTrackedOrders must be positive");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (orderUrl == null || orderUrl.isBlank()) {
            orderUrl = DEFAULT_ORDER_URL;
        }
    }

    /**
     * Build from DHAN_* environment variables (or system properties of the same name).
     */
    public static StreamConfig fromEnv() {
        return builder()
            .clientId(Env.get("DHAN_CLIENT_ID", null))
            .accessToken(Env.get("DHAN_ACCESS_TOKEN", null))
            .userType(UserType.valueOf(Env.get("DHAN_WS_USER_TYPE", "SELF").toUpperCase(Locale.ROOT)))
            .partnerId(Env.get("DHAN_PARTNER_ID", null))
            .partnerSecret(Env.get("DHAN_PARTNER_SECRET", null))
            .feedVersion(Env.getInt("DHAN_WS_VERSION", 2))
            .depthLevel(Env.getInt("DHAN_MARKET_DEPTH_LEVEL", 20))
            .orderUrl(Env.get("DHAN_WS_ORDER_URL", DEFAULT_ORDER_URL))
            .connectTimeout(Duration.ofMillis(Env.getLong("DHAN_CONNECT_TIMEOUT_MS", 10_000)))
            .maxAuthRejections(Env.getInt("DHAN_MAX_AUTH_REJECTIONS", 0))
            .maxTrackedOrders(Env.getInt("DHAN_MAX_TRACKED_ORDERS", 10_000))
            .maxOrderAge(Duration.ofMinutes(Env.getLong("DHAN_MAX_ORDER_AGE_MINUTES", 24 * 60)))
            .orderSweepInterval(Duration.ofSeconds(Env.getLong("DHAN_ORDER_SWEEP_INTERVAL_SECONDS", 300)))
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fail fast when a channel needs credentials that were never configured.
     */
    public void requireFeedCredentials() {
        if (clientId == null || accessToken == null) {
            throw new IllegalStateException("DHAN_CLIENT_ID and DHAN_ACCESS_TOKEN are required for market channels");
        }
    }

    public void requireLoginCredentials() {
        if (userType == UserType.PARTNER) {
            if (partnerId == null || partnerSecret == null) {
                throw new IllegalStateException("DHAN_PARTNER_ID and DHAN_PARTNER_SECRET are required for PARTNER login");
            }
        } else {
            requireFeedCredentials();
        }
    }

    @Override
    public String toString() {
        return "StreamConfig[clientId=" + clientId
            + ", accessToken=" + Env.mask(accessToken)
            + ", userType=" + userType
            + ", partnerId=" + partnerId
            + ", feedVersion=" + feedVersion
            + ", depthLevel=" + depthLevel
            + ", orderUrl=" + orderUrl
            + ", connectTimeout=" + connectTimeout
            + ", maxAuthRejections=" + maxAuthRejections
            + ", maxTrackedOrders=" + maxTrackedOrders
            + ", maxOrderAge=" + maxOrderAge
            + ", orderSweepInterval=" + orderSweepInterval + "]";
    }

    public static class Builder {
        private String clientId;
        private String accessToken;
        private UserType userType = UserType.SELF;
        private String partnerId;
        private String partnerSecret;
        private int feedVersion = 2;
        private int depthLevel = 20;
        private String orderUrl = DEFAULT_ORDER_URL;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private int maxAuthRejections = 0;
        private int maxTrackedOrders = 10_000;
        private Duration maxOrderAge = Duration.ofHours(24);
        private Duration orderSweepInterval = Duration.ofMinutes(5);

        public Builder clientId(String clientId) { this.clientId = clientId; return this; }
        public Builder accessToken(String accessToken) { this.accessToken = accessToken; return this; }
        public Builder userType(UserType userType) { this.userType = userType; return this; }
        public Builder partnerId(String partnerId) { this.partnerId = partnerId; return this; }
        public Builder partnerSecret(String partnerSecret) { this.partnerSecret = partnerSecret; return this; }
        public Builder feedVersion(int feedVersion) { this.feedVersion = feedVersion; return this; }
        public Builder depthLevel(int depthLevel) { this.depthLevel = depthLevel; return this; }
        public Builder orderUrl(String orderUrl) { this.orderUrl = orderUrl; return this; }
        public Builder connectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; return this; }
        public Builder maxAuthRejections(int maxAuthRejections) { this.maxAuthRejections = maxAuthRejections; return this; }
        public Builder maxTrackedOrders(int maxTrackedOrders) { this.maxTrackedOrders = maxTrackedOrders; return this; }
        public Builder maxOrderAge(Duration maxOrderAge) { this.maxOrderAge = maxOrderAge; return this; }
        public Builder orderSweepInterval(Duration orderSweepInterval) { this.orderSweepInterval = orderSweepInterval; return this; }

        public StreamConfig build() {
            return new StreamConfig(clientId, accessToken, userType, partnerId, partnerSecret, feedVersion,
                depthLevel, orderUrl, connectTimeout, maxAuthRejections, maxTrackedOrders, maxOrderAge,
                orderSweepInterval);
        }
    }
}
