package com.sentimento.service.core.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Runtime settings for the live hub. Every value defaults to the matching environment variable in
 * {@code application.yml}; the defaults here apply when the hub is used outside Spring Boot.
 *
 * <pre>{@code
 * sentimento:
 *   hub:
 *     buffer-max-kb: 512
 *     max-connections: 10000
 *   window:
 *     capacity: 1000
 *     recent-count: 100
 *   access:
 *     seedbringer-emails: [founder@example.org]
 *     council-emails: [member@example.org]
 * }</pre>
 */
@Component
@ConfigurationProperties(prefix = "sentimento")
public class SentimentoProperties {

    private Hub hub = new Hub();
    private Window window = new Window();
    private Access access = new Access();
    private Cors cors = new Cors();

    public Hub getHub() {
        return hub;
    }

    public void setHub(Hub hub) {
        this.hub = hub == null ? new Hub() : hub;
    }

    public Window getWindow() {
        return window;
    }

    public void setWindow(Window window) {
        this.window = window == null ? new Window() : window;
    }

    public Access getAccess() {
        return access;
    }

    public void setAccess(Access access) {
        this.access = access == null ? new Access() : access;
    }

    public Cors getCors() {
        return cors;
    }

    public void setCors(Cors cors) {
        this.cors = cors == null ? new Cors() : cors;
    }

    public static class Hub {
        private int bufferMaxKb = 512;
        private int maxConnections = 10_000;
        private String livePath = "/live";
        private int sendWorkers = 4;

        public int getBufferMaxKb() {
            return bufferMaxKb;
        }

        public void setBufferMaxKb(int bufferMaxKb) {
            this.bufferMaxKb = requirePositive("sentimento.hub.buffer-max-kb", bufferMaxKb);
        }

        /** Backpressure ceiling in bytes. */
        public long getBufferMaxBytes() {
            return bufferMaxKb * 1024L;
        }

        public int getMaxConnections() {
            return maxConnections;
        }

        public void setMaxConnections(int maxConnections) {
            this.maxConnections = requirePositive("sentimento.hub.max-connections", maxConnections);
        }

        public String getLivePath() {
            return livePath;
        }

        public void setLivePath(String livePath) {
            if (livePath == null || !livePath.startsWith("/")) {
                throw new IllegalArgumentException("sentimento.hub.live-path must start with '/': " + livePath);
            }
            this.livePath = livePath;
        }

        public int getSendWorkers() {
            return sendWorkers;
        }

        public void setSendWorkers(int sendWorkers) {
            this.sendWorkers = requirePositive("sentimento.hub.send-workers", sendWorkers);
        }
    }

    public static class Window {
        private int capacity = 1000;
        private int recentCount = 100;

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = requirePositive("sentimento.window.capacity", capacity);
        }

        public int getRecentCount() {
            return recentCount;
        }

        public void setRecentCount(int recentCount) {
            this.recentCount = requirePositive("sentimento.window.recent-count", recentCount);
        }
    }

    public static class Access {
        private List<String> seedbringerEmails = new ArrayList<>();
        private List<String> councilEmails = new ArrayList<>();
        private List<String> allowedIssuers = new ArrayList<>(List.of("accounts.google.com", "https://accounts.google.com"));
        private boolean headerPrincipalEnabled;

        public List<String> getSeedbringerEmails() {
            return seedbringerEmails;
        }

        public void setSeedbringerEmails(List<String> seedbringerEmails) {
            this.seedbringerEmails = seedbringerEmails == null ? new ArrayList<>() : new ArrayList<>(seedbringerEmails);
        }

        public List<String> getCouncilEmails() {
            return councilEmails;
        }

        public void setCouncilEmails(List<String> councilEmails) {
            this.councilEmails = councilEmails == null ? new ArrayList<>() : new ArrayList<>(councilEmails);
        }

        public List<String> getAllowedIssuers() {
            return allowedIssuers;
        }

        public void setAllowedIssuers(List<String> allowedIssuers) {
            this.allowedIssuers = allowedIssuers == null ? new ArrayList<>() : new ArrayList<>(allowedIssuers);
        }

        public boolean isHeaderPrincipalEnabled() {
            return headerPrincipalEnabled;
        }

        public void setHeaderPrincipalEnabled(boolean headerPrincipalEnabled) {
            this.headerPrincipalEnabled = headerPrincipalEnabled;
        }
    }

    public static class Cors {
        private String allowOrigin = "*";

        public String getAllowOrigin() {
            return allowOrigin;
        }

        public void setAllowOrigin(String allowOrigin) {
            this.allowOrigin = (allowOrigin == null || allowOrigin.isBlank()) ? "*" : allowOrigin.trim();
        }
    }

    private static int requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
        return value;
    }
}
