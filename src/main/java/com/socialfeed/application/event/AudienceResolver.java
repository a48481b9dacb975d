package com.socialfeed.application.event;

import com.socialfeed.application.port.out.FollowRepository;
import com.socialfeed.application.port.out.TagAffinityRepository;
import com.socialfeed.domain.event.ContentCreated;
import com.socialfeed.domain.model.UserId;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Users whose personalized feed a new post lands in: the author's followers plus everyone
 * with an affinity for one of its tags. The author is never part of the audience.
 */
@Component
public class AudienceResolver {

    private final FollowRepository followRepository;
    private final TagAffinityRepository tagAffinityRepository;

    public AudienceResolver(FollowRepository followRepository, TagAffinityRepository tagAffinityRepository) {
        this.followRepository = followRepository;
        this.tagAffinityRepository = tagAffinityRepository;
    }

    public Set<UserId> audienceOf(ContentCreated event) {
        Set<UserId> audience = new LinkedHashSet<>(followRepository.findAllFollowerIds(event.authorId()));
        if (!event.tags().isEmpty()) {
            audience.addAll(tagAffinityRepository.findUsersInterestedIn(event.tags()));
        }
        audience.remove(event.authorId());
        return audience;
    }
}
