package com.nutrilog.backend.common.web;

public record Trace(String requestId) {}
