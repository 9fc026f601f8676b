package com.copyradar.domain;

/**
 * Role of an account in a pool swap.
 */
public enum PartyRole {
    SENDER,
    RECIPIENT
}
