package com.taskfactory.core.model;

/**
 * Who initiated a transition.
 */
public enum Actor {
    USER,
    AGENT,
    SYSTEM
}
