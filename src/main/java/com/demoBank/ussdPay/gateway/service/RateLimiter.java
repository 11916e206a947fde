package com.demoBank.ussdPay.gateway.service;

import com.demoBank.ussdPay.config.UssdProperties;
import com.demoBank.ussdPay.gateway.util.SecretMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory limiter for USSD session starts.
 *
 * Every started session costs carrier airtime, so starts are limited per customer
 * over a sliding one minute window.
 */
@Slf4j
@Service
public class RateLimiter {

    private static final long WINDOW_SIZE_SECONDS = 60;

    private final int maxStartsPerMinute;

    // customerId -> session start times inside the window
    private final Map<String, StartWindow> customerWindows = new ConcurrentHashMap<>();

    public RateLimiter(UssdProperties properties) {
        this.maxStartsPerMinute = properties.getMaxSessionStartsPerMinute();
    }

    /**
     * Checks whether the customer may start another session, and counts the start if so.
     *
     * @param customerId customer starting a session
     * @return true if the start is allowed, false if the limit is reached
     */
    public boolean isAllowed(String customerId) {
        StartWindow window = customerWindows.computeIfAbsent(customerId, k -> new StartWindow());

        Instant now = Instant.now();
        synchronized (window) {
            window.evictBefore(now.minusSeconds(WINDOW_SIZE_SECONDS));
            if (window.size() >= maxStartsPerMinute) {
                log.warn("Session start limit reached - customerId: {}, limit: {}",
                        SecretMasker.maskCustomerId(customerId), maxStartsPerMinute);
                return false;
            }
            window.record(now);
        }
        return true;
    }

    private static class StartWindow {
        private final List<Instant> starts = new ArrayList<>();

        void record(Instant startedAt) {
            starts.add(startedAt);
        }

        void evictBefore(Instant cutoff) {
            starts.removeIf(startedAt -> startedAt.isBefore(cutoff));
        }

        int size() {
            return starts.size();
        }
    }
}
