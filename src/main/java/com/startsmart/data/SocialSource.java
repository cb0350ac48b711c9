package com.startsmart.data;

import com.startsmart.model.BoundingBox;
import com.startsmart.model.SocialSignal;

import java.util.List;

/**
 * Social-post collaborator, same failure contract as {@link BusinessSource}.
 */
public interface SocialSource {
    List<SocialSignal> fetch(String category, BoundingBox bounds, int windowDays);
}
