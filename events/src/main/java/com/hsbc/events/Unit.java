package com.hsbc.events;

/**
 * The single value carried by a {@link Signal}.
 */
public enum Unit {
    INSTANCE
}
