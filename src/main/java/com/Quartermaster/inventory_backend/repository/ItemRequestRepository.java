package com.Quartermaster.inventory_backend.repository;

import com.Quartermaster.inventory_backend.enums.RequestStatus;
import com.Quartermaster.inventory_backend.model.ItemRequest;
import com.Quartermaster.inventory_backend.model.User;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ItemRequestRepository extends JpaRepository<ItemRequest, Long> {

    @EntityGraph(attributePaths = {"requester", "reviewedBy"})
    List<ItemRequest> findAllByOrderByCreatedDateDesc();

    @EntityGraph(attributePaths = {"requester", "reviewedBy"})
    List<ItemRequest> findByStatusOrderByCreatedDateDesc(RequestStatus status);

    @EntityGraph(attributePaths = {"requester", "reviewedBy"})
    List<ItemRequest> findByRequesterIdOrderByCreatedDateDesc(Long requesterId);

    @EntityGraph(attributePaths = {"requester", "reviewedBy"})
    Optional<ItemRequest> findWithUsersById(Long id);

    /**
     * Records a review only while the request is still pending. Returns 0 when another
     * reviewer got there first.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ItemRequest r SET r.status = :status, r.reviewedBy = :reviewer, " +
            "r.reviewedDate = :now, r.denialReason = :reason " +
            "WHERE r.id = :id AND r.status = :expected")
    int markReviewed(@Param("id") Long id,
                     @Param("expected") RequestStatus expected,
                     @Param("status") RequestStatus status,
                     @Param("reviewer") User reviewer,
                     @Param("reason") String reason,
                     @Param("now") LocalDateTime now);
}
