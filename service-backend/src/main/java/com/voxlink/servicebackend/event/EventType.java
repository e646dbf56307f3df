package com.voxlink.servicebackend.event;

public enum EventType {
    INCOMING_CALL("incoming_call"),
    CALL_ACCEPTED("call_accepted"),
    CALL_STARTED("call_started"),
    CALL_DECLINED("call_declined"),
    CALL_ENDED("call_ended");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
