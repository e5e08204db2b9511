package com.example.pawpal.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

@ConfigurationProperties(prefix = "pawpal")
public class PawPalProperties {

    @NestedConfigurationProperty
    private final Owner owner;

    @NestedConfigurationProperty
    private final CorrelationFilter correlationFilter;

    public PawPalProperties(Owner owner, CorrelationFilter correlationFilter) {
        this.owner = owner != null ? owner : new Owner(null, null, null);
        this.correlationFilter = correlationFilter != null ? correlationFilter : new CorrelationFilter(null, null);
    }

    public Owner getOwner() {
        return owner;
    }

    public CorrelationFilter getCorrelationFilter() {
        return correlationFilter;
    }

    /** The single owner whose schedule this service manages. */
    public static class Owner {

        private static final String DEFAULT_ID = "user_001";
        private static final String DEFAULT_NAME = "Malik";
        private static final String DEFAULT_EMAIL = "malik@pawpal.com";

        private final String id;
        private final String name;
        private final String email;

        public Owner(String id, String name, String email) {
            this.id = isBlank(id) ? DEFAULT_ID : id;
            this.name = isBlank(name) ? DEFAULT_NAME : name;
            this.email = isBlank(email) ? DEFAULT_EMAIL : email;
        }

        public String getId() {
            return id;
        }

        public String getName() {
            return name;
        }

        public String getEmail() {
            return email;
        }
    }

    public static class CorrelationFilter {

        private static final String DEFAULT_HEADER = "X-Correlation-Id";

        private final boolean enabled;
        private final String headerName;

        public CorrelationFilter(Boolean enabled, String headerName) {
            this.enabled = enabled == null || enabled;
            this.headerName = isBlank(headerName) ? DEFAULT_HEADER : headerName;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public String getHeaderName() {
            return headerName;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
