package com.ai.leasing.component;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes work per lead. Locks are striped by phone number: two leads may share
 * a stripe, one lead always maps to the same one.
 */
@Component
public class LeadLockRegistry {

    private static final Logger log = LoggerFactory.getLogger(LeadLockRegistry.class);

    private final ReentrantLock[] stripes;

    public LeadLockRegistry(@Value("${leasing.lock-stripes:256}") int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("leasing.lock-stripes must be positive");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock(true);
        }
    }

    public <T> T withLead(String phone, Supplier<T> work) {
        ReentrantLock lock = lockFor(phone);
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLead(String phone, Runnable work) {
        withLead(phone, () -> {
            work.run();
            return null;
        });
    }

    ReentrantLock lockFor(String phone) {
        if (StringUtils.isBlank(phone)) {
            throw new IllegalArgumentException("Lead phone is required");
        }
        int index = Math.floorMod(phone.trim().hashCode(), stripes.length);
        if (log.isTraceEnabled()) {
            log.trace("Lead {} -> lock stripe {}", phone, index);
        }
        return stripes[index];
    }
}
