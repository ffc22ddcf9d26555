package com.morphirbridge.core.model;

/**
 * Visibility of a module, type, value or constructor list.
 */
public enum Access {
    PUBLIC,
    PRIVATE
}
