package com.licensor.application.service;

import java.util.Locale;

public enum ActivationAction {
    /** A new device took a free slot. */
    CAN_ACTIVATE,
    /** A bound but inactive device was switched back on. */
    REACTIVATED,
    /** Nothing changed. */
    ALREADY_ACTIVE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
