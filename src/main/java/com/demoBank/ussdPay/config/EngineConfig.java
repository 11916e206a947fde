package com.demoBank.ussdPay.config;

import com.demoBank.ussdPay.device.remote.RemoteDeviceBridge;
import com.demoBank.ussdPay.engine.UssdAutomationEngine;
import com.demoBank.ussdPay.engine.cascade.ResponseDecider;
import com.demoBank.ussdPay.engine.classifier.SnapshotClassifier;
import com.demoBank.ussdPay.engine.loop.ScheduledEventLoop;
import com.demoBank.ussdPay.engine.outcome.OutcomeExtractor;
import com.demoBank.ussdPay.engine.outcome.TerminalMessageClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.HashSet;

/**
 * Wires the automation engine to its event loop and the device bridge.
 */
@Slf4j
@Configuration
public class EngineConfig {

    @Bean(destroyMethod = "shutdown")
    public ScheduledEventLoop ussdEventLoop() {
        return new ScheduledEventLoop("ussd-engine");
    }

    @Bean
    public RemoteDeviceBridge remoteDeviceBridge(UssdProperties properties) {
        return new RemoteDeviceBridge(properties.getDevice().getCommandBufferSize());
    }

    @Bean
    public UssdAutomationEngine ussdAutomationEngine(ScheduledEventLoop ussdEventLoop,
                                                     RemoteDeviceBridge remoteDeviceBridge,
                                                     SnapshotClassifier snapshotClassifier,
                                                     TerminalMessageClassifier terminalMessageClassifier,
                                                     ResponseDecider responseDecider,
                                                     OutcomeExtractor outcomeExtractor,
                                                     UssdProperties properties) {
        UssdAutomationEngine engine = new UssdAutomationEngine(
                ussdEventLoop,
                remoteDeviceBridge,
                remoteDeviceBridge,
                snapshotClassifier,
                terminalMessageClassifier,
                responseDecider,
                outcomeExtractor,
                properties.toEngineTimings(),
                new HashSet<>(properties.getSourcePackages()));
        remoteDeviceBridge.addListener(engine);
        log.info("USSD engine ready - shortCode: {}, sources: {}", properties.getShortCode(), properties.getSourcePackages());
        return engine;
    }
}
