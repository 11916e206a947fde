package com.demoBank.ussdPay.device.remote;

public enum DeviceCommandType {
    SET_TEXT,
    ACTIVATE,
    REQUEST_FOCUS,
    DIAL
}
