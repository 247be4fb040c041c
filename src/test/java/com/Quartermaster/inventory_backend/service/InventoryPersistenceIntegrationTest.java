package com.Quartermaster.inventory_backend.service;

import com.Quartermaster.inventory_backend.dto.request.CustodyRequest;
import com.Quartermaster.inventory_backend.dto.request.ItemCreateRequest;
import com.Quartermaster.inventory_backend.dto.request.ItemRequestSubmission;
import com.Quartermaster.inventory_backend.dto.request.ReviewRequest;
import com.Quartermaster.inventory_backend.dto.response.ItemRequestResponse;
import com.Quartermaster.inventory_backend.dto.response.ItemResponse;
import com.Quartermaster.inventory_backend.dto.response.ReviewOutcomeResponse;
import com.Quartermaster.inventory_backend.enums.HistoryAction;
import com.Quartermaster.inventory_backend.enums.RequestStatus;
import com.Quartermaster.inventory_backend.enums.RequestType;
import com.Quartermaster.inventory_backend.enums.ReviewDecision;
import com.Quartermaster.inventory_backend.enums.Role;
import com.Quartermaster.inventory_backend.enums.SideEffectType;
import com.Quartermaster.inventory_backend.exception.ItemAlreadyCheckedOutException;
import com.Quartermaster.inventory_backend.exception.MissingDenialReasonException;
import com.Quartermaster.inventory_backend.exception.RequestAlreadyReviewedException;
import com.Quartermaster.inventory_backend.exception.ResourceNotFoundException;
import com.Quartermaster.inventory_backend.model.HistoryEntry;
import com.Quartermaster.inventory_backend.model.User;
import com.Quartermaster.inventory_backend.repository.HistoryEntryRepository;
import com.Quartermaster.inventory_backend.repository.ItemRepository;
import com.Quartermaster.inventory_backend.repository.ItemRequestRepository;
import com.Quartermaster.inventory_backend.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the services against PostgreSQL so the conditional updates and the item row lock
 * are exercised by the real store.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class InventoryPersistenceIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    @DynamicPropertySource
    static void registerProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @Autowired private ItemService itemService;
    @Autowired private ItemRequestService itemRequestService;
    @Autowired private ItemRepository itemRepository;
    @Autowired private HistoryEntryRepository historyEntryRepository;
    @Autowired private ItemRequestRepository itemRequestRepository;
    @Autowired private UserRepository userRepository;

    private User member;
    private User admin;
    private User quartermaster;

    @BeforeEach
    void cleanup() {
        historyEntryRepository.deleteAllInBatch();
        itemRequestRepository.deleteAllInBatch();
        itemRepository.deleteAllInBatch();
        userRepository.deleteAllInBatch();

        member = createUser("member", Role.MEMBER);
        admin = createUser("admin", Role.ADMIN);
        quartermaster = createUser("quartermaster", Role.QUARTERMASTER);
    }

    @Test
    void checkoutConflictThenCheckinRecordsHistoryNewestFirst() {
        Long itemId = createItem("Tent");

        itemService.checkoutItem(member, itemId, new CustodyRequest("Jane", "demo"));
        assertThatThrownBy(() -> itemService.checkoutItem(member, itemId, new CustodyRequest("Bob", "")))
                .isInstanceOf(ItemAlreadyCheckedOutException.class)
                .extracting("currentHolder")
                .isEqualTo("Jane");
        ItemResponse returned = itemService.checkinItem(member, itemId, new CustodyRequest("Jane", ""));

        assertThat(returned.isCheckedOut()).isFalse();
        assertThat(returned.getCheckedOutBy()).isNull();
        assertThat(returned.getCheckedOutDate()).isNull();
        assertThat(historyEntryRepository.findByItemIdOrderByTimestampDescIdDesc(itemId))
                .extracting(HistoryEntry::getAction)
                .containsExactly(HistoryAction.CHECKIN, HistoryAction.CHECKOUT);
    }

    @Test
    void concurrentCheckoutsLetExactlyOneThrough() throws Exception {
        Long itemId = createItem("Lantern");

        List<Throwable> failures = race(
                () -> itemService.checkoutItem(member, itemId, new CustodyRequest("Jane", "")),
                () -> itemService.checkoutItem(member, itemId, new CustodyRequest("Bob", "")));

        assertThat(failures).hasSize(1);
        assertThat(failures.get(0)).isInstanceOf(ItemAlreadyCheckedOutException.class);
        assertThat(historyEntryRepository.findByItemIdOrderByTimestampDescIdDesc(itemId)).hasSize(1);
        assertThat(itemRepository.findById(itemId)).get()
                .satisfies(item -> assertThat(item.isCheckedOut()).isTrue());
    }

    @Test
    void concurrentReviewsApplyTheRequestOnce() throws Exception {
        ItemRequestResponse request = itemRequestService.submitRequest(admin,
                submission(RequestType.ADD_ITEM, "Water filter", null));
        ReviewRequest approve = new ReviewRequest(ReviewDecision.APPROVED, null);

        List<Throwable> failures = race(
                () -> itemRequestService.reviewRequest(quartermaster, request.getId(), approve),
                () -> itemRequestService.reviewRequest(quartermaster, request.getId(), approve));

        assertThat(failures).hasSize(1);
        assertThat(failures.get(0)).isInstanceOf(RequestAlreadyReviewedException.class);
        assertThat(itemRepository.count()).isEqualTo(1L);
        assertThat(itemRequestRepository.findById(request.getId())).get()
                .satisfies(stored -> assertThat(stored.getStatus()).isEqualTo(RequestStatus.APPROVED));
    }

    @Test
    void denialNeedsReasonAndLeavesTargetInPlace() {
        Long itemId = createItem("Old tarp");
        ItemRequestResponse request = itemRequestService.submitRequest(admin,
                submission(RequestType.REMOVE_ITEM, null, itemId));

        assertThatThrownBy(() -> itemRequestService.reviewRequest(quartermaster, request.getId(),
                new ReviewRequest(ReviewDecision.DENIED, "")))
                .isInstanceOf(MissingDenialReasonException.class);
        assertThat(itemRequestRepository.findById(request.getId())).get()
                .satisfies(stored -> assertThat(stored.getStatus()).isEqualTo(RequestStatus.PENDING));

        ReviewOutcomeResponse outcome = itemRequestService.reviewRequest(quartermaster, request.getId(),
                new ReviewRequest(ReviewDecision.DENIED, "not justified"));

        assertThat(outcome.getRequest().getStatus()).isEqualTo(RequestStatus.DENIED);
        assertThat(outcome.getRequest().getDenialReason()).isEqualTo("not justified");
        assertThat(outcome.getRequest().getReviewedByName()).isEqualTo(quartermaster.getFullName());
        assertThat(itemRepository.existsById(itemId)).isTrue();
    }

    @Test
    void approvingRemovalOfDeletedItemStillApproves() {
        Long itemId = createItem("Broken stove");
        ItemRequestResponse request = itemRequestService.submitRequest(admin,
                submission(RequestType.REMOVE_ITEM, null, itemId));
        itemService.deleteItem(quartermaster, itemId);

        ReviewOutcomeResponse outcome = itemRequestService.reviewRequest(quartermaster, request.getId(),
                new ReviewRequest(ReviewDecision.APPROVED, null));

        assertThat(outcome.getRequest().getStatus()).isEqualTo(RequestStatus.APPROVED);
        assertThat(outcome.getRequest().getCurrentItemName()).isNull();
        assertThat(outcome.getSideEffect().getType()).isEqualTo(SideEffectType.TARGET_ALREADY_REMOVED);
    }

    @Test
    void deleteRacingCheckoutLeavesNoHistoryBehind() throws Exception {
        Long itemId = createItem("Compass");
        itemService.checkoutItem(member, itemId, new CustodyRequest("Jane", ""));
        itemService.checkinItem(member, itemId, new CustodyRequest("Jane", ""));

        List<Throwable> failures = race(
                () -> itemService.deleteItem(quartermaster, itemId),
                () -> itemService.checkoutItem(member, itemId, new CustodyRequest("Bob", "")));

        assertThat(failures).allSatisfy(failure -> assertThat(failure).isInstanceOf(ResourceNotFoundException.class));
        assertThat(itemRepository.existsById(itemId)).isFalse();
        assertThat(historyEntryRepository.findByItemIdOrderByTimestampDescIdDesc(itemId)).isEmpty();
    }

    // Starts both actions together and returns the failures, in no particular order
    private List<Throwable> race(Runnable first, Runnable second) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Throwable>> futures = new ArrayList<>();
            for (Runnable action : List.of(first, second)) {
                Callable<Throwable> attempt = () -> {
                    start.await();
                    try {
                        action.run();
                        return null;
                    } catch (RuntimeException e) {
                        return e;
                    }
                };
                futures.add(pool.submit(attempt));
            }
            start.countDown();

            List<Throwable> failures = new ArrayList<>();
            for (Future<Throwable> future : futures) {
                Throwable failure = future.get(30, TimeUnit.SECONDS);
                if (failure != null) {
                    failures.add(failure);
                }
            }
            return failures;
        } finally {
            pool.shutdownNow();
        }
    }

    private User createUser(String username, Role role) {
        return userRepository.save(User.builder()
                .username(username)
                .password("not-used")
                .fullName("Test " + username)
                .role(role)
                .active(true)
                .createdDate(LocalDateTime.now())
                .build());
    }

    private Long createItem(String name) {
        ItemCreateRequest request = new ItemCreateRequest();
        request.setName(name);
        return itemService.createItem(quartermaster, request).getId();
    }

    private static ItemRequestSubmission submission(RequestType type, String itemName, Long itemId) {
        ItemRequestSubmission submission = new ItemRequestSubmission();
        submission.setRequestType(type);
        submission.setItemName(itemName);
        submission.setItemId(itemId);
        submission.setDescription("Needed for the next trip");
        return submission;
    }
}
