package com.nosota.mloan.adapter;

/**
 * A blocking WebClient exchange.
 */
@FunctionalInterface
interface RemoteCall<T> {

    T execute();
}
