package com.voxlink.servicebackend.user;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

public interface UserCredentialService {
    boolean verifyCredentials(String login, String rawPassword);
    boolean userExists(String login);
    Optional<UserProfile> findProfile(String login);
    Map<String, UserProfile> findProfiles(Collection<String> logins);
}
