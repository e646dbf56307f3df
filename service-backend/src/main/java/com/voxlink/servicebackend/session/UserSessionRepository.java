package com.voxlink.servicebackend.session;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface UserSessionRepository extends JpaRepository<UserSession, String> {

    @Query("""
            select count(s) from UserSession s
            where s.login = :login
              and s.expiresAt > :now
              and (s.lastSeen >= :since or s.createdAt >= :since)
            """)
    long countOnline(@Param("login") String login, @Param("now") Instant now, @Param("since") Instant since);

    @Query("""
            select distinct s.login from UserSession s
            where s.login in :logins
              and s.expiresAt > :now
              and (s.lastSeen >= :since or s.createdAt >= :since)
            """)
    List<String> findOnlineLogins(@Param("logins") Collection<String> logins,
                                  @Param("now") Instant now,
                                  @Param("since") Instant since);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update UserSession s set s.lastSeen = :lastSeen where s.id = :id")
    int updateLastSeen(@Param("id") String id, @Param("lastSeen") Instant lastSeen);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from UserSession s where s.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
