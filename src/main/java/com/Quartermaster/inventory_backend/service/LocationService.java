package com.Quartermaster.inventory_backend.service;

import com.Quartermaster.inventory_backend.dto.request.CatalogEntryRequest;
import com.Quartermaster.inventory_backend.dto.response.CatalogEntryResponse;
import com.Quartermaster.inventory_backend.enums.Operation;
import com.Quartermaster.inventory_backend.exception.DuplicateNameException;
import com.Quartermaster.inventory_backend.exception.ResourceNotFoundException;
import com.Quartermaster.inventory_backend.model.Location;
import com.Quartermaster.inventory_backend.model.User;
import com.Quartermaster.inventory_backend.repository.LocationRepository;
import com.Quartermaster.inventory_backend.security.AccessPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class LocationService {

    private final LocationRepository locationRepository;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<CatalogEntryResponse> getAllLocations(User actor) {
        accessPolicy.enforce(actor, Operation.READ_CATALOG);
        return locationRepository.findAllByOrderByNameAsc()
                .stream()
                .map(this::mapToLocationResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public CatalogEntryResponse getLocationById(User actor, Long id) {
        accessPolicy.enforce(actor, Operation.READ_CATALOG);
        return mapToLocationResponse(findLocation(id));
    }

    @Transactional
    public CatalogEntryResponse createLocation(User actor, CatalogEntryRequest request) {
        accessPolicy.enforce(actor, Operation.MANAGE_CATALOG);
        String name = request.getName().trim();
        if (locationRepository.existsByName(name)) {
            throw new DuplicateNameException("Location", name);
        }

        Location location = Location.builder()
                .name(name)
                .createdBy(actor)
                .createdDate(LocalDateTime.now(clock))
                .build();

        Location savedLocation = locationRepository.save(location);
        log.info("Location created: {}", name);
        return mapToLocationResponse(savedLocation);
    }

    @Transactional
    public CatalogEntryResponse updateLocation(User actor, Long id, CatalogEntryRequest request) {
        accessPolicy.enforce(actor, Operation.MANAGE_CATALOG);
        Location location = findLocation(id);

        String name = request.getName().trim();
        if (locationRepository.existsByNameAndIdNot(name, id)) {
            throw new DuplicateNameException("Location", name);
        }
        location.setName(name);

        Location updatedLocation = locationRepository.save(location);
        log.info("Location {} renamed to {}", id, name);
        return mapToLocationResponse(updatedLocation);
    }

    @Transactional
    public void deleteLocation(User actor, Long id) {
        accessPolicy.enforce(actor, Operation.MANAGE_CATALOG);
        Location location = findLocation(id);
        locationRepository.delete(location);
        log.info("Location deleted: {}", location.getName());
    }

    private Location findLocation(Long id) {
        return locationRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Location", "id", id));
    }

    private CatalogEntryResponse mapToLocationResponse(Location location) {
        return CatalogEntryResponse.builder()
                .id(location.getId())
                .name(location.getName())
                .createdBy(location.getCreatedBy() != null ? location.getCreatedBy().getFullName() : null)
                .createdDate(location.getCreatedDate())
                .build();
    }
}
