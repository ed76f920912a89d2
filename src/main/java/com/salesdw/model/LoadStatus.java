package com.salesdw.model;

public enum LoadStatus {
    SUCCESS,
    FAILED
}
