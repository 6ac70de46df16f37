package com.replymail.domain;

public enum TriggerResult {
    ACCEPTED,
    ALREADY_RUNNING,
    REJECTED
}
