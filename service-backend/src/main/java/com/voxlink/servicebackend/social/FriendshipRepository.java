package com.voxlink.servicebackend.social;

import org.springframework.data.jpa.repository.JpaRepository;

public interface FriendshipRepository extends JpaRepository<Friendship, Long> {
    boolean existsByUserLowAndUserHigh(String userLow, String userHigh);
}
