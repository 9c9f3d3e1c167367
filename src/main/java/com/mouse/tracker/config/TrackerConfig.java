package com.mouse.tracker.config;

import com.mouse.tracker.utils.UrlMatcher;
import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Component
@Data
public class TrackerConfig {

    public static final List<String> DEFAULT_ALTERNATE_PATTERNS = List.of(
            "/api/v4/pdp/get_pc",
            "api/v4/pdp/get_pc",
            "/api/v4/item/get",
            "api/v4/item/get",
            "/api/v4/product/",
            "api/v4/product/"
    );

    private final List<String> browserFlags = Arrays.asList(
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-blink-features=AutomationControlled",
            "--disable-infobars",
            "--disable-extensions",
            "--disable-default-apps",
            "--disable-popup-blocking",
            "--disable-notifications",
            "--mute-audio",
            "--no-first-run",
            "--lang=en-US",
            "--disable-background-timer-throttling",
            "--disable-backgrounding-occluded-windows",
            "--disable-renderer-backgrounding"
    );

    // ==================== TRACKING ====================

    @Value("${tracker.tracking.pattern:https://shopee.vn/api/v4/pdp/get_pc}")
    private String trackingPattern = "https://shopee.vn/api/v4/pdp/get_pc";

    @Value("${tracker.tracking.alternates:/api/v4/pdp/get_pc,api/v4/pdp/get_pc,/api/v4/item/get,api/v4/item/get,/api/v4/product/,api/v4/product/}")
    private List<String> alternatePatterns = new ArrayList<>(DEFAULT_ALTERNATE_PATTERNS);

    @Value("${tracker.extraction.path:data.item.models}")
    private String extractionPath = "data.item.models";

    @Value("${tracker.capture.max-per-schedule:1000}")
    private int captureCap = 1000;

    @Value("${tracker.bridge.proximity-ms:3000}")
    private long proximityMs = 3_000;

    // ==================== DISPATCHER ====================

    @Value("${tracker.dispatcher.auto-start:true}")
    private boolean autoStart = true;

    @Value("${tracker.dispatcher.batch-size:3}")
    private int batchSize = 3;

    @Value("${tracker.dispatcher.inter-batch-delay-ms:2000}")
    private long interBatchDelayMs = 2_000;

    @Value("${tracker.schedule.zone:UTC}")
    private String scheduleZone = "UTC";

    // ==================== WORKER CONTEXTS ====================

    @Value("${tracker.worker.timeout-ms:45000}")
    private long workerTimeoutMs = 45_000;

    @Value("${tracker.worker.capture-window-ms:20000}")
    private long captureWindowMs = 20_000;

    @Value("${tracker.worker.complete-on-payload:true}")
    private boolean completeOnPayload = true;

    @Value("${tracker.worker.injection-delays-ms:0,2000,5000}")
    private List<Long> injectionDelaysMs = new ArrayList<>(List.of(0L, 2_000L, 5_000L));

    @Value("${tracker.worker.heartbeat-ms:5000}")
    private long heartbeatMs = 5_000;

    @Value("${tracker.worker.stall-after-ms:15000}")
    private long stallAfterMs = 15_000;

    @Value("${tracker.worker.global-max-contexts:0}")
    private int globalMaxContexts = 0;

    // ==================== BROWSER ====================

    @Value("${tracker.browser.headless:true}")
    private boolean headless = true;

    @Value("${tracker.browser.navigation-timeout-ms:30000}")
    private double navigationTimeoutMs = 30_000;

    @Value("${tracker.browser.user-agent:}")
    private String userAgent = "";

    @Value("${tracker.browser.locale:en-US}")
    private String locale = "en-US";

    @Value("${tracker.browser.viewport-width:1366}")
    private int viewportWidth = 1366;

    @Value("${tracker.browser.viewport-height:768}")
    private int viewportHeight = 768;

    @Value("${tracker.browser.event-pump-ms:50}")
    private long eventPumpMs = 50;

    public UrlMatcher urlMatcher() {
        return new UrlMatcher(trackingPattern, alternatePatterns);
    }
}
