package com.foliovault.api.controller;

final class ApiHeaders {

    /** Caller identity for every mutating endpoint. */
    static final String ACCOUNT = "X-Account";

    private ApiHeaders() {
    }
}
