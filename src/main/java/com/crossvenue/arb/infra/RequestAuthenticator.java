package com.crossvenue.arb.infra;

import okhttp3.Request;

/**
 * Signs or decorates outbound venue requests. Credential handling lives outside this service;
 * an implementation is supplied as a bean when trading live.
 */
@FunctionalInterface
public interface RequestAuthenticator {

    Request authenticate(Request request);

    static RequestAuthenticator none() {
        return request -> request;
    }
}
