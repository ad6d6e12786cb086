package com.hltvsync.domain.model;

public enum EventType {
    LAN,
    ONLINE,
    MIXED
}
