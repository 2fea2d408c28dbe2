package com.grantradar.eventbus.dto;

public enum GroupCreation {
    CREATED,
    ALREADY_EXISTED
}
