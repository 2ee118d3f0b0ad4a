package org.ofc.service.util;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Objects;

/** Striped monitors, one shared by every game id hashing to the same stripe. */
@Component
public class Locks {
    private final Object[] stripes;

    public Locks(@Value("${ofc.lock-stripes:128}") int stripeCount) {
        if (stripeCount < 1 || Integer.bitCount(stripeCount) != 1)
            throw new IllegalArgumentException("Stripe count must be a power of two, got " + stripeCount);
        stripes = new Object[stripeCount];
        for (int i = 0; i < stripes.length; i++) stripes[i] = new Object();
    }

    public Object of(String gameId) {
        int idx = Objects.hashCode(gameId) & (stripes.length - 1);
        return stripes[idx];
    }

    public int size() { return stripes.length; }
}
