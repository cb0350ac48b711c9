package com.startsmart.data;

import com.startsmart.model.BoundingBox;
import com.startsmart.model.SocialSignal;

import java.util.List;

public final class RetryingSocialSource implements SocialSource {
    private final SocialSource delegate;
    private final RetryPolicy retry;

    public RetryingSocialSource(SocialSource delegate, RetryPolicy retry) {
        this.delegate = delegate;
        this.retry = retry;
    }

    @Override
    public List<SocialSignal> fetch(String category, BoundingBox bounds, int windowDays) {
        return retry.call("social.fetch", () -> delegate.fetch(category, bounds, windowDays));
    }
}
