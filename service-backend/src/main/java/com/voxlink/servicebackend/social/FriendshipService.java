package com.voxlink.servicebackend.social;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

@Service
public class FriendshipService implements FriendDirectory {
    private static final Logger log = LoggerFactory.getLogger(FriendshipService.class);

    private final FriendshipRepository repository;
    private final Clock clock;

    public FriendshipService(FriendshipRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public boolean areFriends(String userA, String userB) {
        if (isBlank(userA) || isBlank(userB) || userA.equals(userB)) {
            return false;
        }
        return repository.existsByUserLowAndUserHigh(low(userA, userB), high(userA, userB));
    }

    /**
     * Records a friendship; returns false when the pair is invalid or already present.
     */
    @Transactional
    public boolean befriend(String userA, String userB) {
        if (isBlank(userA) || isBlank(userB) || userA.equals(userB) || areFriends(userA, userB)) {
            return false;
        }
        repository.save(new Friendship(low(userA, userB), high(userA, userB), clock.instant()));
        log.info("'{}' and '{}' are now friends", userA, userB);
        return true;
    }

    private static String low(String a, String b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static String high(String a, String b) {
        return a.compareTo(b) <= 0 ? b : a;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
