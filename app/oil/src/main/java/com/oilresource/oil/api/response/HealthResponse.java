package com.oilresource.oil.api.response;

public record HealthResponse(String status, String version) {}
