package com.omnioracle.api.dto;

public record FreshResponse(boolean fresh) {}
