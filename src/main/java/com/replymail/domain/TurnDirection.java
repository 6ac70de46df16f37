package com.replymail.domain;

public enum TurnDirection {
    INCOMING,
    OUTGOING
}
