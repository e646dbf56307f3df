package com.voxlink.servicebackend.call;

public enum CallStatus {
    RINGING,
    ACTIVE
}
