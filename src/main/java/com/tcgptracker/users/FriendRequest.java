package com.tcgptracker.users;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * A friend request between two profiles. Accepted requests make the two profiles friends.
 */
@Entity
@Table(name = "friend_requests", uniqueConstraints = {
    @UniqueConstraint(name = "uk_friend_request_pair", columnNames = {"from_profile_id", "to_profile_id"})
})
@Getter
@Setter
@NoArgsConstructor
public class FriendRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "from_profile_id")
    private UserProfile fromProfile;

    @ManyToOne(optional = false)
    @JoinColumn(name = "to_profile_id")
    private UserProfile toProfile;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    private boolean accepted;

    public FriendRequest(UserProfile fromProfile, UserProfile toProfile) {
        this.fromProfile = fromProfile;
        this.toProfile = toProfile;
        this.createdAt = Instant.now();
    }

    public void accept() {
        this.accepted = true;
    }
}
