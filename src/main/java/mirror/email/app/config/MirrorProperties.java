package mirror.email.app.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for credential refresh, mailbox sync and the provider endpoints.
 * Bound from {@code mirror.*} in application.properties.
 */
@Data
@Component
@ConfigurationProperties(prefix = "mirror")
public class MirrorProperties {
    private final Token token = new Token();
    private final Sync sync = new Sync();
    private final Provider provider = new Provider();
    private final Security security = new Security();

    @Data
    public static class Token {
        /** A token expiring within this window is treated as expired. */
        private Duration refreshSkew = Duration.ofSeconds(300);
        /** How long a REFRESHING claim is honoured before another node may take it over. */
        private Duration refreshLease = Duration.ofSeconds(30);
        /** Upper bound for a caller waiting on someone else's refresh. */
        private Duration waitTimeout = Duration.ofSeconds(30);
        private Duration pollInterval = Duration.ofMillis(250);
    }

    @Data
    public static class Sync {
        private int pageSize = 50;
        /** Safety cap on list calls per run. */
        private int maxPages = 20;
        private int defaultMaxMessages = 100;
        /** Provider search query every listing starts from; empty lists all mail outside spam and trash. */
        private String baseQuery = "";
        private long intervalMs = 300000;
        private boolean classifyOnIngest = false;
        private Duration lockTtl = Duration.ofMinutes(10);
    }

    @Data
    public static class Provider {
        private String applicationName = "Mail Mirror";
        private String tokenEndpoint = "https://oauth2.googleapis.com/token";
        private Duration connectTimeout = Duration.ofSeconds(5);
        /** Must leave the token call, connect plus read, inside the refresh lease and the wait timeout. */
        private Duration readTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Security {
        /** OAuth subjects ({@code sub}) granted ROLE_ADMIN at login. */
        private List<String> adminSubjects = new ArrayList<>();
    }

    /**
     * Rejects timeouts that would let one token call outlive the REFRESHING lease,
     * since another node could then start a second refresh with the same grant.
     */
    public void validateTokenCallBudget() {
        Duration budget = provider.getConnectTimeout().plus(provider.getReadTimeout());
        if (provider.getConnectTimeout().isNegative() || provider.getConnectTimeout().isZero()
                || provider.getReadTimeout().isNegative() || provider.getReadTimeout().isZero()) {
            throw new IllegalStateException("mirror.provider.connect-timeout and read-timeout must be positive");
        }
        if (budget.compareTo(token.getRefreshLease()) >= 0) {
            throw new IllegalStateException("Token call budget " + budget + " must be shorter than mirror.token.refresh-lease "
                + token.getRefreshLease());
        }
        if (budget.compareTo(token.getWaitTimeout()) >= 0) {
            throw new IllegalStateException("Token call budget " + budget + " must be shorter than mirror.token.wait-timeout "
                + token.getWaitTimeout());
        }
    }
}
