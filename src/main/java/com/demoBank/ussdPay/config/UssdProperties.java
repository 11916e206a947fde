package com.demoBank.ussdPay.config;

import com.demoBank.ussdPay.engine.EngineTimings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * USSD automation settings, bound from the "ussd" prefix.
 */
@Data
@ConfigurationProperties(prefix = "ussd")
public class UssdProperties {

    /**
     * Short code dialed to open the banking menu.
     */
    private String shortCode = "*99#";

    /**
     * Packages whose screens may host the USSD dialog. Events from anything else are ignored.
     */
    private List<String> sourcePackages = new ArrayList<>(List.of(
            "com.android.phone",
            "com.samsung.android.phone",
            "com.google.android.dialer",
            "com.android.server.telecom"));

    private int maxSessionStartsPerMinute = 6;

    private Timing timing = new Timing();

    private Device device = new Device();

    public EngineTimings toEngineTimings() {
        return new EngineTimings(
                timing.getEventDebounce(),
                timing.getDialogStabilize(),
                timing.getTextInjectionDelay(),
                timing.getPostSendCooldown(),
                timing.getMinSendInterval(),
                timing.getFocusRetry(),
                timing.getDismissDelay(),
                timing.getSessionTimeout());
    }

    @Data
    public static class Timing {
        private Duration eventDebounce = Duration.ofMillis(100);
        private Duration dialogStabilize = Duration.ofMillis(200);
        private Duration textInjectionDelay = Duration.ofMillis(300);
        private Duration postSendCooldown = Duration.ofMillis(300);
        private Duration minSendInterval = Duration.ofMillis(300);
        private Duration focusRetry = Duration.ofMillis(200);
        private Duration dismissDelay = Duration.ofMillis(500);
        private Duration sessionTimeout = Duration.ofSeconds(120);
    }

    @Data
    public static class Device {
        private int commandBufferSize = 500;
    }
}
