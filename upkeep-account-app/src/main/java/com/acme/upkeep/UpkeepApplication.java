package com.acme.upkeep;

import io.micronaut.runtime.Micronaut;

/**
 * Upkeep Account runtime - hosts a single recurring payment account.
 * Polls for due subscriptions on a schedule and serves a read-only view over HTTP.
 */
public class UpkeepApplication {
    public static void main(String[] args) {
        Micronaut.run(UpkeepApplication.class, args);
    }
}
