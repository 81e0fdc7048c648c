package com.tcgptracker.users;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for friend requests.
 */
@Repository
public interface FriendRequestRepository extends JpaRepository<FriendRequest, Long> {

    Optional<FriendRequest> findByFromProfileIdAndToProfileId(Long fromProfileId, Long toProfileId);

    boolean existsByFromProfileIdAndToProfileId(Long fromProfileId, Long toProfileId);

    List<FriendRequest> findByFromProfileId(Long fromProfileId);

    List<FriendRequest> findByToProfileIdAndAcceptedFalseOrderByCreatedAtDesc(Long toProfileId);

    Optional<FriendRequest> findByIdAndToProfileIdAndAcceptedFalse(Long id, Long toProfileId);

    @Query("select r from FriendRequest r "
        + "where r.accepted = true and (r.fromProfile.id = :profileId or r.toProfile.id = :profileId)")
    List<FriendRequest> findAccepted(@Param("profileId") Long profileId);

    @Modifying
    @Query("delete from FriendRequest r where r.fromProfile.id = :profileId or r.toProfile.id = :profileId")
    void deleteAllInvolving(@Param("profileId") Long profileId);
}
