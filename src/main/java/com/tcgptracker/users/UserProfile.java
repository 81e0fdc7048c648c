package com.tcgptracker.users;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Profile of a user: visibility and in-game friend code.
 */
@Entity
@Table(name = "user_profiles")
@Getter
@Setter
@NoArgsConstructor
public class UserProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(optional = false)
    @JoinColumn(name = "user_id", unique = true)
    private AppUser user;

    /**
     * Public profiles can be found by search and receive friend requests.
     */
    @Column(name = "is_public", nullable = false)
    private boolean publicProfile = true;

    @Column(name = "friend_code", length = 10)
    private String friendCode;

    public UserProfile(AppUser user) {
        this.user = user;
    }

    public String getUsername() {
        return user.getUsername();
    }
}
