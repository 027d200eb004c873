package com.splitttr.gateway.session;

public record SessionRequest(
    String format,      // "text", "json", "base64"
    String type         // "file", "notebook"
) {}
