package com.tcgptracker.users;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Loads tracker users for form login.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackerUserDetailsService implements UserDetailsService {

    private final AppUserRepository userRepository;

    @Override
    @Transactional(readOnly = true)
    public UserDetails loadUserByUsername(String username) throws UsernameNotFoundException {
        return userRepository.findByUsername(username)
            .map(this::toUserDetails)
            .orElseThrow(() -> {
                log.debug("Login attempt for unknown user {}", username);
                return new UsernameNotFoundException("User not found: " + username);
            });
    }

    private UserDetails toUserDetails(AppUser user) {
        return User.withUsername(user.getUsername())
            .password(user.getPasswordHash())
            .roles(user.isAdmin() ? new String[] {"USER", "ADMIN"} : new String[] {"USER"})
            .build();
    }
}
