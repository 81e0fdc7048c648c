package com.tcgptracker.users;

import com.tcgptracker.common.exception.FriendRequestNotFoundException;
import com.tcgptracker.common.exception.UserNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Service for profile search and friend requests.
 *
 * Two profiles are friends once a request between them, in either direction, is accepted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FriendService {

    private final UserProfileRepository profileRepository;
    private final FriendRequestRepository friendRequestRepository;

    /**
     * Send a friend request to a public profile. Sending to oneself is a no-op and
     * sending twice returns the existing request.
     */
    @Transactional
    public Optional<FriendRequest> sendFriendRequest(String fromUsername, Long toProfileId) {
        UserProfile to = profileRepository.findByIdAndPublicProfileTrue(toProfileId)
            .orElseThrow(() -> new UserNotFoundException(toProfileId));
        UserProfile from = getProfile(fromUsername);
        if (from.getId().equals(to.getId())) {
            return Optional.empty();
        }

        Optional<FriendRequest> existing =
            friendRequestRepository.findByFromProfileIdAndToProfileId(from.getId(), to.getId());
        if (existing.isPresent()) {
            log.debug("Friend request {} -> {} already exists", fromUsername, to.getUsername());
            return existing;
        }

        FriendRequest request = friendRequestRepository.save(new FriendRequest(from, to));
        log.info("Friend request sent from {} to {}", fromUsername, to.getUsername());
        return Optional.of(request);
    }

    /**
     * Accept a pending request addressed to the given user.
     */
    @Transactional
    public FriendRequest acceptFriendRequest(String username, Long requestId) {
        UserProfile profile = getProfile(username);
        FriendRequest request = friendRequestRepository
            .findByIdAndToProfileIdAndAcceptedFalse(requestId, profile.getId())
            .orElseThrow(() -> new FriendRequestNotFoundException(requestId));
        request.accept();
        friendRequestRepository.save(request);
        log.info("{} accepted friend request from {}", username, request.getFromProfile().getUsername());
        return request;
    }

    @Transactional(readOnly = true)
    public List<UserProfile> getFriends(String username) {
        UserProfile profile = getProfile(username);
        return friendRequestRepository.findAccepted(profile.getId()).stream()
            .map(request -> request.getFromProfile().getId().equals(profile.getId())
                ? request.getToProfile()
                : request.getFromProfile())
            .distinct()
            .sorted(Comparator.comparing(UserProfile::getUsername))
            .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public Set<Long> getFriendIds(String username) {
        return getFriends(username).stream()
            .map(UserProfile::getId)
            .collect(Collectors.toSet());
    }

    @Transactional(readOnly = true)
    public List<FriendRequest> getPendingRequests(String username) {
        UserProfile profile = getProfile(username);
        return friendRequestRepository.findByToProfileIdAndAcceptedFalseOrderByCreatedAtDesc(profile.getId());
    }

    @Transactional(readOnly = true)
    public Set<Long> getSentRequestTargetIds(String username) {
        UserProfile profile = getProfile(username);
        return friendRequestRepository.findByFromProfileId(profile.getId()).stream()
            .map(request -> request.getToProfile().getId())
            .collect(Collectors.toSet());
    }

    /**
     * Search public profiles by username or friend code, never returning the searcher.
     */
    @Transactional(readOnly = true)
    public List<UserProfile> searchProfiles(String username, String query) {
        if (!StringUtils.hasText(query)) {
            return List.of();
        }
        UserProfile profile = getProfile(username);
        return profileRepository.searchPublic(query.trim(), profile.getId());
    }

    @Transactional(readOnly = true)
    public UserProfile getPublicProfile(String username) {
        return profileRepository.findByUserUsernameAndPublicProfileTrue(username)
            .orElseThrow(() -> new UserNotFoundException(username));
    }

    @Transactional(readOnly = true)
    public boolean hasSentRequest(String fromUsername, Long toProfileId) {
        UserProfile from = getProfile(fromUsername);
        return friendRequestRepository.existsByFromProfileIdAndToProfileId(from.getId(), toProfileId);
    }

    private UserProfile getProfile(String username) {
        return profileRepository.findByUserUsername(username)
            .orElseThrow(() -> new UserNotFoundException(username));
    }
}
