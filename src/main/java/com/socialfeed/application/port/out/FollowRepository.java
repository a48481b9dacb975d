package com.socialfeed.application.port.out;

import com.socialfeed.domain.model.FollowEdge;
import com.socialfeed.domain.model.UserId;

import java.util.List;

public interface FollowRepository {
    /**
     * @return false when the edge already existed
     */
    boolean save(FollowEdge follow);

    /**
     * @return false when there was no edge to remove
     */
    boolean delete(UserId followerId, UserId followeeId);
    boolean exists(UserId followerId, UserId followeeId);

    List<UserId> findFollowingIds(UserId userId);

    List<UserId> findAllFollowerIds(UserId userId);

    long count();
}
