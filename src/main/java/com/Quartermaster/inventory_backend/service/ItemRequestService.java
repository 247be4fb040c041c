package com.Quartermaster.inventory_backend.service;

import com.Quartermaster.inventory_backend.dto.request.ItemRequestSubmission;
import com.Quartermaster.inventory_backend.dto.request.ReviewRequest;
import com.Quartermaster.inventory_backend.dto.response.ItemRequestResponse;
import com.Quartermaster.inventory_backend.dto.response.ReviewOutcomeResponse;
import com.Quartermaster.inventory_backend.dto.response.ReviewOutcomeResponse.SideEffect;
import com.Quartermaster.inventory_backend.enums.Operation;
import com.Quartermaster.inventory_backend.enums.RequestStatus;
import com.Quartermaster.inventory_backend.enums.ReviewDecision;
import com.Quartermaster.inventory_backend.enums.SideEffectType;
import com.Quartermaster.inventory_backend.exception.InvalidRequestShapeException;
import com.Quartermaster.inventory_backend.exception.MissingDenialReasonException;
import com.Quartermaster.inventory_backend.exception.RequestAlreadyReviewedException;
import com.Quartermaster.inventory_backend.exception.ResourceNotFoundException;
import com.Quartermaster.inventory_backend.model.Item;
import com.Quartermaster.inventory_backend.model.ItemRequest;
import com.Quartermaster.inventory_backend.model.User;
import com.Quartermaster.inventory_backend.repository.ItemRepository;
import com.Quartermaster.inventory_backend.repository.ItemRequestRepository;
import com.Quartermaster.inventory_backend.security.AccessPolicy;
import com.Quartermaster.inventory_backend.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Add/remove proposals and their one-shot review. Approval applies the proposal to the
 * inventory through {@link ItemService}; denial only changes the request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ItemRequestService {

    private final ItemRequestRepository itemRequestRepository;
    private final ItemRepository itemRepository;
    private final ItemService itemService;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    @Transactional
    public ItemRequestResponse submitRequest(User requester, ItemRequestSubmission submission) {
        accessPolicy.enforce(requester, Operation.SUBMIT_REQUEST);

        String itemName = TextUtils.trimToNull(submission.getItemName());
        switch (submission.getRequestType()) {
            case ADD_ITEM -> {
                if (submission.getItemId() != null) {
                    throw new InvalidRequestShapeException("add_item requests must not reference an existing item");
                }
                if (itemName == null) {
                    throw new InvalidRequestShapeException("add_item requests must name the proposed item");
                }
            }
            case REMOVE_ITEM -> {
                if (submission.getItemId() == null) {
                    throw new InvalidRequestShapeException("remove_item requests must reference the item to remove");
                }
                Item target = itemRepository.findById(submission.getItemId())
                        .orElseThrow(() -> new ResourceNotFoundException("Item", "id", submission.getItemId()));
                if (itemName == null) {
                    itemName = target.getName();
                }
            }
        }

        ItemRequest itemRequest = ItemRequest.builder()
                .requester(requester)
                .requestType(submission.getRequestType())
                .itemName(itemName)
                .description(submission.getDescription().trim())
                .itemId(submission.getItemId())
                .status(RequestStatus.PENDING)
                .createdDate(LocalDateTime.now(clock))
                .build();

        ItemRequest savedRequest = itemRequestRepository.save(itemRequest);
        log.info("Item request {} ({}) submitted by user {}", savedRequest.getId(),
                savedRequest.getRequestType().getValue(), requester.getId());
        return mapToResponses(List.of(savedRequest)).get(0);
    }

    /**
     * Approves or denies a pending request. The status change is gated on the request still
     * being pending, so concurrent reviewers cannot both succeed.
     */
    @Transactional
    public ReviewOutcomeResponse reviewRequest(User reviewer, Long requestId, ReviewRequest review) {
        accessPolicy.enforce(reviewer, Operation.REVIEW_REQUEST);

        ItemRequest itemRequest = itemRequestRepository.findById(requestId)
                .orElseThrow(() -> new ResourceNotFoundException("Request", "id", requestId));
        if (itemRequest.getStatus().isTerminal()) {
            throw new RequestAlreadyReviewedException(requestId, itemRequest.getStatus());
        }

        ReviewDecision decision = review.getDecision();
        String denialReason = TextUtils.trimToNull(review.getDenialReason());
        if (decision == ReviewDecision.DENIED && denialReason == null) {
            throw new MissingDenialReasonException(requestId);
        }

        int updated = itemRequestRepository.markReviewed(
                requestId,
                RequestStatus.PENDING,
                decision.toStatus(),
                reviewer,
                decision == ReviewDecision.DENIED ? denialReason : null,
                LocalDateTime.now(clock));
        if (updated == 0) {
            RequestStatus current = itemRequestRepository.findById(requestId)
                    .map(ItemRequest::getStatus)
                    .orElseThrow(() -> new ResourceNotFoundException("Request", "id", requestId));
            log.warn("Request {} was reviewed concurrently, now {}", requestId, current.getValue());
            throw new RequestAlreadyReviewedException(requestId, current);
        }
        log.info("Request {} {} by user {}", requestId, decision.getValue(), reviewer.getId());

        SideEffect sideEffect = decision == ReviewDecision.APPROVED
                ? applyApproval(itemRequest)
                : SideEffect.none();

        ItemRequest reviewed = itemRequestRepository.findWithUsersById(requestId)
                .orElseThrow(() -> new ResourceNotFoundException("Request", "id", requestId));
        return ReviewOutcomeResponse.builder()
                .request(mapToResponses(List.of(reviewed)).get(0))
                .sideEffect(sideEffect)
                .build();
    }

    private SideEffect applyApproval(ItemRequest itemRequest) {
        return switch (itemRequest.getRequestType()) {
            case ADD_ITEM -> {
                if (TextUtils.trimToNull(itemRequest.getItemName()) == null) {
                    log.error("Approved add request {} has no item name, nothing created", itemRequest.getId());
                    yield SideEffect.failed("Request has no item name");
                }
                Item created = itemService.createFromApprovedRequest(itemRequest.getItemName(),
                        itemRequest.getDescription());
                yield SideEffect.of(SideEffectType.ITEM_CREATED, created.getId());
            }
            case REMOVE_ITEM -> {
                Long targetId = itemRequest.getItemId();
                if (targetId == null) {
                    log.error("Approved remove request {} has no target item, nothing removed", itemRequest.getId());
                    yield SideEffect.failed("Request has no target item");
                }
                if (itemService.removeIfPresent(targetId)) {
                    yield SideEffect.of(SideEffectType.ITEM_REMOVED, targetId);
                }
                log.info("Target item {} of request {} was already removed", targetId, itemRequest.getId());
                yield SideEffect.of(SideEffectType.TARGET_ALREADY_REMOVED, targetId);
            }
        };
    }

    @Transactional(readOnly = true)
    public List<ItemRequestResponse> getAllRequests(User actor) {
        accessPolicy.enforce(actor, Operation.REVIEW_REQUEST);
        return mapToResponses(itemRequestRepository.findAllByOrderByCreatedDateDesc());
    }

    @Transactional(readOnly = true)
    public List<ItemRequestResponse> getPendingRequests(User actor) {
        accessPolicy.enforce(actor, Operation.REVIEW_REQUEST);
        return mapToResponses(itemRequestRepository.findByStatusOrderByCreatedDateDesc(RequestStatus.PENDING));
    }

    @Transactional(readOnly = true)
    public List<ItemRequestResponse> getRequestsByRequester(User actor, Long requesterId) {
        accessPolicy.enforce(actor, Operation.READ_OWN_REQUESTS);
        if (!Objects.equals(actor.getId(), requesterId)) {
            accessPolicy.enforce(actor, Operation.REVIEW_REQUEST);
        }
        return mapToResponses(itemRequestRepository.findByRequesterIdOrderByCreatedDateDesc(requesterId));
    }

    @Transactional(readOnly = true)
    public ItemRequestResponse getRequestById(User actor, Long requestId) {
        accessPolicy.enforce(actor, Operation.READ_OWN_REQUESTS);
        ItemRequest itemRequest = itemRequestRepository.findWithUsersById(requestId)
                .orElseThrow(() -> new ResourceNotFoundException("Request", "id", requestId));
        if (!Objects.equals(itemRequest.getRequester().getId(), actor.getId())) {
            accessPolicy.enforce(actor, Operation.REVIEW_REQUEST);
        }
        return mapToResponses(List.of(itemRequest)).get(0);
    }

    private List<ItemRequestResponse> mapToResponses(List<ItemRequest> requests) {
        List<Long> targetIds = requests.stream()
                .map(ItemRequest::getItemId)
                .filter(Objects::nonNull)
                .distinct()
                .collect(Collectors.toList());
        Map<Long, String> currentNames = targetIds.isEmpty() ? Map.of() : itemService.findNamesByIds(targetIds);

        return requests.stream()
                .map(request -> mapToResponse(request, currentNames))
                .collect(Collectors.toList());
    }

    private ItemRequestResponse mapToResponse(ItemRequest request, Map<Long, String> currentNames) {
        ItemRequestResponse.ItemRequestResponseBuilder builder = ItemRequestResponse.builder()
                .id(request.getId())
                .requestType(request.getRequestType())
                .itemName(request.getItemName())
                .description(request.getDescription())
                .itemId(request.getItemId())
                .currentItemName(request.getItemId() != null ? currentNames.get(request.getItemId()) : null)
                .status(request.getStatus())
                .denialReason(request.getDenialReason())
                .createdDate(request.getCreatedDate())
                .reviewedDate(request.getReviewedDate());

        if (request.getRequester() != null) {
            builder.requesterId(request.getRequester().getId())
                    .requesterName(request.getRequester().getFullName());
        }
        if (request.getReviewedBy() != null) {
            builder.reviewedById(request.getReviewedBy().getId())
                    .reviewedByName(request.getReviewedBy().getFullName());
        }
        return builder.build();
    }
}
