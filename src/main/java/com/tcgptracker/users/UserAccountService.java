package com.tcgptracker.users;

import com.tcgptracker.collection.UserCardRepository;
import com.tcgptracker.common.exception.DuplicateUsernameException;
import com.tcgptracker.common.exception.UserNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Service for registration, account maintenance and profile settings.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserAccountService {

    private final AppUserRepository userRepository;
    private final UserProfileRepository profileRepository;
    private final FriendRequestRepository friendRequestRepository;
    private final UserCardRepository userCardRepository;
    private final PasswordEncoder passwordEncoder;

    /**
     * Register a new user together with its (public) profile.
     */
    @Transactional
    public AppUser register(String username, String email, String rawPassword) {
        if (userRepository.existsByUsernameIgnoreCase(username)) {
            throw new DuplicateUsernameException(username);
        }
        AppUser user = new AppUser(username, email, passwordEncoder.encode(rawPassword));
        userRepository.save(user);
        profileRepository.save(new UserProfile(user));

        log.info("Registered user {}", username);
        return user;
    }

    @Transactional(readOnly = true)
    public AppUser getUser(String username) {
        return userRepository.findByUsername(username)
            .orElseThrow(() -> new UserNotFoundException(username));
    }

    @Transactional(readOnly = true)
    public UserProfile getProfile(String username) {
        return profileRepository.findByUserUsername(username)
            .orElseThrow(() -> new UserNotFoundException(username));
    }

    /**
     * Change the password after checking the current one.
     *
     * @return false when the current password does not match
     */
    @Transactional
    public boolean changePassword(String username, String currentPassword, String newPassword) {
        AppUser user = getUser(username);
        if (!passwordEncoder.matches(currentPassword, user.getPasswordHash())) {
            log.info("Rejected password change for {}: current password mismatch", username);
            return false;
        }
        user.setPasswordHash(passwordEncoder.encode(newPassword));
        userRepository.save(user);
        log.info("Changed password for {}", username);
        return true;
    }

    @Transactional
    public UserProfile updateProfile(String username, String friendCode, boolean publicProfile) {
        UserProfile profile = getProfile(username);
        profile.setFriendCode(StringUtils.hasText(friendCode) ? friendCode.trim() : null);
        profile.setPublicProfile(publicProfile);
        profileRepository.save(profile);
        log.info("Updated profile of {} (public={})", username, publicProfile);
        return profile;
    }

    /**
     * Delete the user and everything that belongs to it: collection, friend requests, profile.
     */
    @Transactional
    public void deleteAccount(String username) {
        AppUser user = getUser(username);
        profileRepository.findByUserUsername(username).ifPresent(profile -> {
            friendRequestRepository.deleteAllInvolving(profile.getId());
            profileRepository.delete(profile);
        });
        userCardRepository.deleteByUserId(user.getId());
        userRepository.delete(user);
        log.info("Deleted account {}", username);
    }
}
