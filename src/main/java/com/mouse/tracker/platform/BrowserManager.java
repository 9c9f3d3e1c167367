package com.mouse.tracker.platform;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.options.ServiceWorkerPolicy;
import com.mouse.tracker.config.TrackerConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class BrowserManager {

    private final TrackerConfig config;

    public BrowserType.LaunchOptions createLaunchOptions() {
        return new BrowserType.LaunchOptions()
                .setHeadless(config.isHeadless())
                .setArgs(config.getBrowserFlags());
    }

    /**
     * Service workers are blocked so every API call goes through the page's own network
     * stack, where both hooks can see it.
     */
    public Browser.NewContextOptions createContextOptions() {
        log.debug("Creating sandbox context options");
        Browser.NewContextOptions options = new Browser.NewContextOptions()
                .setViewportSize(config.getViewportWidth(), config.getViewportHeight())
                .setLocale(config.getLocale())
                .setIgnoreHTTPSErrors(true)
                .setServiceWorkers(ServiceWorkerPolicy.BLOCK);

        if (config.getUserAgent() != null && !config.getUserAgent().isBlank()) {
            options.setUserAgent(config.getUserAgent());
        }
        return options;
    }
}
