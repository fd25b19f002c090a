package com.hwsc.userservice.availability;

public enum ServiceState {
    AVAILABLE,
    UNAVAILABLE
}
