package com.voxlink.servicebackend.user;

import com.voxlink.servicebackend.common.ErrorKind;
import com.voxlink.servicebackend.common.ServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class UserService implements UserCredentialService {
    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final AppUserRepository repository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public UserService(AppUserRepository repository, PasswordEncoder passwordEncoder, Clock clock) {
        this.repository = repository;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    @Transactional
    public UserProfile register(String login, String rawPassword, String nickname, String avatar) {
        String normalizedLogin = login == null ? "" : login.trim();
        String normalizedNickname = nickname == null ? "" : nickname.trim();
        if (normalizedLogin.isEmpty() || rawPassword == null || rawPassword.isEmpty() || normalizedNickname.isEmpty()) {
            throw new ServiceException(ErrorKind.MALFORMED, "Login, password and nickname are required");
        }
        if (repository.existsByLogin(normalizedLogin)) {
            throw new ServiceException(ErrorKind.CONFLICT, "Login is already taken");
        }

        AppUser user = new AppUser(
                normalizedLogin,
                normalizedNickname,
                avatar,
                passwordEncoder.encode(rawPassword),
                clock.instant()
        );
        AppUser saved = repository.save(user);
        log.info("Registered new user '{}'", saved.getLogin());
        return UserProfile.from(saved);
    }

    /**
     * @throws ServiceException {@link ErrorKind#FORBIDDEN} for an unknown login or a wrong password
     */
    public UserProfile authenticate(String login, String rawPassword) {
        if (!verifyCredentials(login, rawPassword)) {
            log.warn("Rejected sign-in for '{}'", login);
            throw new ServiceException(ErrorKind.FORBIDDEN, "Invalid login or password");
        }
        return findProfile(login).orElseGet(() -> UserProfile.placeholder(login.trim()));
    }

    /**
     * Profiles keyed by login; logins without an account are absent from the map.
     */
    @Override
    public Map<String, UserProfile> findProfiles(Collection<String> logins) {
        if (logins.isEmpty()) {
            return Map.of();
        }
        return repository.findByLoginIn(logins).stream()
                .map(UserProfile::from)
                .collect(Collectors.toMap(UserProfile::login, Function.identity()));
    }

    @Override
    public boolean verifyCredentials(String login, String rawPassword) {
        if (login == null || rawPassword == null) {
            return false;
        }
        return repository.findByLogin(login.trim())
                .map(user -> passwordEncoder.matches(rawPassword, user.getPasswordHash()))
                .orElse(false);
    }

    @Override
    public boolean userExists(String login) {
        if (login == null) {
            return false;
        }
        return repository.existsByLogin(login.trim());
    }

    @Override
    public Optional<UserProfile> findProfile(String login) {
        if (login == null) {
            return Optional.empty();
        }
        return repository.findByLogin(login.trim()).map(UserProfile::from);
    }
}
