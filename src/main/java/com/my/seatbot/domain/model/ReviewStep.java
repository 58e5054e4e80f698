package com.my.seatbot.domain.model;

public enum ReviewStep {
    SELECT,
    ACTION
}
