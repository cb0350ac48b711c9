package com.startsmart.data;

import com.startsmart.model.BoundingBox;
import com.startsmart.model.BusinessRecord;
import com.startsmart.model.GeoPoint;

import java.util.List;

public final class RetryingBusinessSource implements BusinessSource {
    private final BusinessSource delegate;
    private final RetryPolicy retry;

    public RetryingBusinessSource(BusinessSource delegate, RetryPolicy retry) {
        this.delegate = delegate;
        this.retry = retry;
    }

    @Override
    public List<BusinessRecord> fetch(String category, BoundingBox bounds) {
        return retry.call("business.fetch", () -> delegate.fetch(category, bounds));
    }

    @Override
    public List<BusinessRecord> fetchNear(String category, GeoPoint point, double radiusM) {
        return retry.call("business.fetchNear", () -> delegate.fetchNear(category, point, radiusM));
    }
}
