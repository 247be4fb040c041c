package com.Quartermaster.inventory_backend.service;

import com.Quartermaster.inventory_backend.dto.request.CustodyRequest;
import com.Quartermaster.inventory_backend.dto.request.ItemCreateRequest;
import com.Quartermaster.inventory_backend.dto.request.ItemUpdateRequest;
import com.Quartermaster.inventory_backend.dto.response.HistoryEntryResponse;
import com.Quartermaster.inventory_backend.dto.response.InventoryStatsResponse;
import com.Quartermaster.inventory_backend.dto.response.ItemResponse;
import com.Quartermaster.inventory_backend.enums.HistoryAction;
import com.Quartermaster.inventory_backend.enums.Operation;
import com.Quartermaster.inventory_backend.exception.DuplicateBarcodeException;
import com.Quartermaster.inventory_backend.exception.ItemAlreadyCheckedOutException;
import com.Quartermaster.inventory_backend.exception.ItemNotCheckedOutException;
import com.Quartermaster.inventory_backend.exception.ResourceNotFoundException;
import com.Quartermaster.inventory_backend.model.HistoryEntry;
import com.Quartermaster.inventory_backend.model.Item;
import com.Quartermaster.inventory_backend.model.User;
import com.Quartermaster.inventory_backend.repository.HistoryEntryRepository;
import com.Quartermaster.inventory_backend.repository.ItemRepository;
import com.Quartermaster.inventory_backend.security.AccessPolicy;
import com.Quartermaster.inventory_backend.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Item records and their checkout/checkin state machine. Every public operation checks the
 * acting user against {@link AccessPolicy} before touching the store.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ItemService {

    static final String UNCATEGORIZED = "Uncategorized";

    private final ItemRepository itemRepository;
    private final HistoryEntryRepository historyEntryRepository;
    private final AccessPolicy accessPolicy;
    private final ModelMapper modelMapper;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<ItemResponse> getAllItems(User actor) {
        accessPolicy.enforce(actor, Operation.READ_ITEMS);
        return itemRepository.findAllByOrderByNameAsc()
                .stream()
                .map(this::mapToItemResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public ItemResponse getItemById(User actor, Long id) {
        accessPolicy.enforce(actor, Operation.READ_ITEMS);
        return mapToItemResponse(findItem(id));
    }

    @Transactional(readOnly = true)
    public List<ItemResponse> searchItems(User actor, String query) {
        accessPolicy.enforce(actor, Operation.READ_ITEMS);
        String term = TextUtils.trimToNull(query);
        if (term == null) {
            return List.of();
        }
        return itemRepository.search(term)
                .stream()
                .map(this::mapToItemResponse)
                .collect(Collectors.toList());
    }

    @Transactional
    public ItemResponse createItem(User actor, ItemCreateRequest request) {
        accessPolicy.enforce(actor, Operation.CREATE_ITEM);

        String barcode = TextUtils.trimToNull(request.getBarcode());
        if (barcode != null && itemRepository.existsByBarcode(barcode)) {
            throw new DuplicateBarcodeException(barcode);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Item item = Item.builder()
                .name(request.getName().trim())
                .description(request.getDescription())
                .category(request.getCategory())
                .barcode(barcode)
                .serialNumber(request.getSerialNumber())
                .storageLocation(request.getStorageLocation())
                .imageUrl(request.getImageUrl())
                .notes(request.getNotes())
                .checkedOut(false)
                .createdDate(now)
                .lastModifiedDate(now)
                .build();

        Item savedItem = saveCheckingBarcode(item);
        log.info("Item created with ID: {} by user {}", savedItem.getId(), actor.getId());
        return mapToItemResponse(savedItem);
    }

    /**
     * Creates the item proposed by an approved add request. Callers have already been authorized.
     */
    @Transactional
    public Item createFromApprovedRequest(String name, String description) {
        LocalDateTime now = LocalDateTime.now(clock);
        Item item = Item.builder()
                .name(name)
                .description(description)
                .checkedOut(false)
                .createdDate(now)
                .lastModifiedDate(now)
                .build();

        Item savedItem = itemRepository.save(item);
        log.info("Item created with ID: {} from approved request", savedItem.getId());
        return savedItem;
    }

    @Transactional
    public ItemResponse updateItem(User actor, Long id, ItemUpdateRequest request) {
        accessPolicy.enforce(actor, Operation.UPDATE_ITEM);
        Item item = findItem(id);

        if (request.getBarcode() != null) {
            String barcode = TextUtils.trimToNull(request.getBarcode());
            if (barcode != null && itemRepository.existsByBarcodeAndIdNot(barcode, id)) {
                throw new DuplicateBarcodeException(barcode);
            }
            item.setBarcode(barcode);
        }
        if (request.getName() != null) {
            item.setName(request.getName().trim());
        }
        if (request.getDescription() != null) {
            item.setDescription(request.getDescription());
        }
        if (request.getCategory() != null) {
            item.setCategory(request.getCategory());
        }
        if (request.getSerialNumber() != null) {
            item.setSerialNumber(request.getSerialNumber());
        }
        if (request.getStorageLocation() != null) {
            item.setStorageLocation(request.getStorageLocation());
        }
        if (request.getImageUrl() != null) {
            item.setImageUrl(request.getImageUrl());
        }
        if (request.getNotes() != null) {
            item.setNotes(request.getNotes());
        }
        item.setLastModifiedDate(LocalDateTime.now(clock));

        Item updatedItem = saveCheckingBarcode(item);
        log.info("Item updated with ID: {}", id);
        return mapToItemResponse(updatedItem);
    }

    @Transactional
    public void deleteItem(User actor, Long id) {
        accessPolicy.enforce(actor, Operation.DELETE_ITEM);
        if (!removeIfPresent(id)) {
            throw new ResourceNotFoundException("Item", "id", id);
        }
    }

    /**
     * Deletes the item and its history. Returns false when the item no longer exists.
     */
    @Transactional
    public boolean removeIfPresent(Long id) {
        if (itemRepository.findByIdForUpdate(id).isEmpty()) {
            return false;
        }
        // No checkout or checkin can append history while the row lock is held
        int historyRemoved = historyEntryRepository.deleteAllByItemId(id);
        itemRepository.deleteById(id);
        log.info("Item deleted with ID: {} ({} history entries removed)", id, historyRemoved);
        return true;
    }

    @Transactional
    public ItemResponse checkoutItem(User actor, Long id, CustodyRequest request) {
        accessPolicy.enforce(actor, Operation.CHECKOUT_CHECKIN);
        String personName = request.getPersonName().trim();
        LocalDateTime now = LocalDateTime.now(clock);

        if (itemRepository.checkOutIfAvailable(id, personName, now) == 0) {
            Item current = findItem(id);
            if (!current.isCheckedOut()) {
                log.warn("Checkout of item {} rejected, holder returned it concurrently", id);
                throw ItemAlreadyCheckedOutException.releasedConcurrently(id);
            }
            log.warn("Checkout of item {} rejected, held by {}", id, current.getCheckedOutBy());
            throw new ItemAlreadyCheckedOutException(id, current.getCheckedOutBy());
        }

        recordHistory(id, HistoryAction.CHECKOUT, personName, request.getNotes(), now);
        log.info("Item {} checked out to {}", id, personName);
        return mapToItemResponse(findItem(id));
    }

    @Transactional
    public ItemResponse checkinItem(User actor, Long id, CustodyRequest request) {
        accessPolicy.enforce(actor, Operation.CHECKOUT_CHECKIN);
        String personName = request.getPersonName().trim();
        LocalDateTime now = LocalDateTime.now(clock);

        if (itemRepository.checkInIfCheckedOut(id, now) == 0) {
            findItem(id);
            log.warn("Checkin of item {} rejected, not checked out", id);
            throw new ItemNotCheckedOutException(id);
        }

        recordHistory(id, HistoryAction.CHECKIN, personName, request.getNotes(), now);
        log.info("Item {} checked in by {}", id, personName);
        return mapToItemResponse(findItem(id));
    }

    @Transactional(readOnly = true)
    public List<HistoryEntryResponse> getItemHistory(User actor, Long id) {
        accessPolicy.enforce(actor, Operation.READ_ITEMS);
        if (!itemRepository.existsById(id)) {
            throw new ResourceNotFoundException("Item", "id", id);
        }
        return historyEntryRepository.findByItemIdOrderByTimestampDescIdDesc(id)
                .stream()
                .map(entry -> modelMapper.map(entry, HistoryEntryResponse.class))
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public InventoryStatsResponse getStats(User actor) {
        accessPolicy.enforce(actor, Operation.VIEW_STATS);
        long total = itemRepository.count();
        long checkedOut = itemRepository.countByCheckedOutTrue();

        Map<String, Long> categories = new TreeMap<>();
        for (Object[] row : itemRepository.countByCategory()) {
            String category = TextUtils.trimToNull((String) row[0]);
            categories.merge(category != null ? category : UNCATEGORIZED, (Long) row[1], Long::sum);
        }

        return InventoryStatsResponse.builder()
                .totalItems(total)
                .checkedOut(checkedOut)
                .available(total - checkedOut)
                .categories(categories)
                .build();
    }

    @Transactional(readOnly = true)
    public Map<Long, String> findNamesByIds(Iterable<Long> ids) {
        return itemRepository.findAllById(ids)
                .stream()
                .collect(Collectors.toMap(Item::getId, Item::getName));
    }

    private void recordHistory(Long itemId, HistoryAction action, String personName, String notes,
                               LocalDateTime timestamp) {
        HistoryEntry entry = HistoryEntry.builder()
                .itemId(itemId)
                .action(action)
                .personName(personName)
                .timestamp(timestamp)
                .notes(TextUtils.orEmpty(notes))
                .build();
        historyEntryRepository.save(entry);
    }

    // The unique index closes the gap between the exists check and the insert
    private Item saveCheckingBarcode(Item item) {
        try {
            return itemRepository.saveAndFlush(item);
        } catch (DataIntegrityViolationException e) {
            if (item.getBarcode() != null) {
                throw new DuplicateBarcodeException(item.getBarcode());
            }
            throw e;
        }
    }

    private Item findItem(Long id) {
        return itemRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Item", "id", id));
    }

    private ItemResponse mapToItemResponse(Item item) {
        return modelMapper.map(item, ItemResponse.class);
    }
}
