package com.socialfeed.application.port.out;

import com.socialfeed.domain.model.UserId;

import java.util.UUID;

public interface LikeRepository {

    /**
     * @return false if the like edge already existed
     */
    boolean add(UserId userId, UUID contentId);

    /**
     * @return false if there was no like edge to remove
     */
    boolean remove(UserId userId, UUID contentId);
}
