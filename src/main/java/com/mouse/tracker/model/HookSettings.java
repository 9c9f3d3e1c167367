package com.mouse.tracker.model;

import com.google.gson.Gson;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Configuration shared with the hooks running inside a sandbox.
 */
@Value
@Builder
public class HookSettings {

    private static final Gson GSON = new Gson();

    String sandboxId;
    String scheduleId;
    String targetId;
    String pattern;
    List<String> alternates;
    String extractionPath;
    String channel;
    long heartbeatMs;

    public String toJson() {
        return GSON.toJson(this);
    }

    /** Publishes the settings on the page as a frozen global. */
    public String toSettingsScript() {
        return String.format("(() => { window.__apiTrackerSettings = Object.freeze(%s); return true; })()", toJson());
    }
}
