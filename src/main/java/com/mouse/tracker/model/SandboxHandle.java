package com.mouse.tracker.model;

import lombok.Value;

@Value
public class SandboxHandle {
    String sandboxId;
    String url;
}
