package com.salesdw.model;

/**
 * Pipeline layer a log row or quality result belongs to.
 */
public enum Layer {
    RAW,
    STAGING,
    WAREHOUSE
}
