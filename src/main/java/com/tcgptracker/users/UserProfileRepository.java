package com.tcgptracker.users;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for user profiles.
 */
@Repository
public interface UserProfileRepository extends JpaRepository<UserProfile, Long> {

    Optional<UserProfile> findByUserUsername(String username);

    Optional<UserProfile> findByUserUsernameAndPublicProfileTrue(String username);

    Optional<UserProfile> findByIdAndPublicProfileTrue(Long id);

    /**
     * Public profiles whose username or friend code contains the query, excluding one profile.
     */
    @Query("select p from UserProfile p join fetch p.user u "
        + "where p.publicProfile = true and p.id <> :excludedId "
        + "and (lower(u.username) like lower(concat('%', :query, '%')) "
        + "or lower(p.friendCode) like lower(concat('%', :query, '%'))) "
        + "order by u.username")
    List<UserProfile> searchPublic(@Param("query") String query, @Param("excludedId") Long excludedId);
}
