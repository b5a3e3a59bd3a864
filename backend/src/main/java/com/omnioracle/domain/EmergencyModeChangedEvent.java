package com.omnioracle.domain;

import java.math.BigInteger;

/**
 * Application event: emergency override toggled. {@code price} is null on deactivation.
 */
public record EmergencyModeChangedEvent(boolean active, BigInteger price) {}
