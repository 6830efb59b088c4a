package com.example.renditions.service.impl;

import com.example.renditions.domain.RenditionKey;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed set of locks striped by rendition key. Two operations on the same key always
 * share a lock; unrelated keys rarely do.
 */
final class KeyedLocks {

    static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    KeyedLocks() {
        this(DEFAULT_STRIPES);
    }

    KeyedLocks(int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("Stripe count must be positive: " + stripeCount);
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    ReentrantLock lockFor(RenditionKey key) {
        return stripes[Math.floorMod(key.hashCode(), stripes.length)];
    }
}
