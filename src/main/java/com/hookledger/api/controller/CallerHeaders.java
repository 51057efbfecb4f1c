package com.hookledger.api.controller;

/**
 * Request headers carrying the authenticated caller.
 *
 * The gateway in front of the service authenticates the request and sets the
 * header; the ledger trusts it.
 */
public final class CallerHeaders {

    public static final String CALLER = "X-Caller-Account";

    private CallerHeaders() {
    }
}
