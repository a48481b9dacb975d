package com.socialfeed.application.port.out;

import com.socialfeed.domain.model.TagAffinity;
import com.socialfeed.domain.model.UserId;

import java.util.Collection;
import java.util.List;

public interface TagAffinityRepository {

    /**
     * Adds {@code delta} to the user's weight for each tag, creating missing rows. Weights never drop below zero.
     */
    void increment(UserId userId, Collection<String> tags, double delta);

    /**
     * Highest-weighted tags with a positive weight.
     */
    List<TagAffinity> findTopTags(UserId userId, int limit);

    /**
     * Users whose weight for any of the given tags is at least 1.
     */
    List<UserId> findUsersInterestedIn(Collection<String> tags);
}
