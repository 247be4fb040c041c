package com.Quartermaster.inventory_backend.service;

import com.Quartermaster.inventory_backend.dto.request.CatalogEntryRequest;
import com.Quartermaster.inventory_backend.dto.response.CatalogEntryResponse;
import com.Quartermaster.inventory_backend.enums.Operation;
import com.Quartermaster.inventory_backend.exception.DuplicateNameException;
import com.Quartermaster.inventory_backend.exception.ResourceNotFoundException;
import com.Quartermaster.inventory_backend.model.Category;
import com.Quartermaster.inventory_backend.model.User;
import com.Quartermaster.inventory_backend.repository.CategoryRepository;
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
public class CategoryService {

    private final CategoryRepository categoryRepository;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<CatalogEntryResponse> getAllCategories(User actor) {
        accessPolicy.enforce(actor, Operation.READ_CATALOG);
        return categoryRepository.findAllByOrderByNameAsc()
                .stream()
                .map(this::mapToCategoryResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public CatalogEntryResponse getCategoryById(User actor, Long id) {
        accessPolicy.enforce(actor, Operation.READ_CATALOG);
        return mapToCategoryResponse(findCategory(id));
    }

    @Transactional
    public CatalogEntryResponse createCategory(User actor, CatalogEntryRequest request) {
        accessPolicy.enforce(actor, Operation.MANAGE_CATALOG);
        String name = request.getName().trim();
        if (categoryRepository.existsByName(name)) {
            throw new DuplicateNameException("Category", name);
        }

        Category category = Category.builder()
                .name(name)
                .createdBy(actor)
                .createdDate(LocalDateTime.now(clock))
                .build();

        Category savedCategory = categoryRepository.save(category);
        log.info("Category created: {}", name);
        return mapToCategoryResponse(savedCategory);
    }

    @Transactional
    public CatalogEntryResponse updateCategory(User actor, Long id, CatalogEntryRequest request) {
        accessPolicy.enforce(actor, Operation.MANAGE_CATALOG);
        Category category = findCategory(id);

        String name = request.getName().trim();
        if (categoryRepository.existsByNameAndIdNot(name, id)) {
            throw new DuplicateNameException("Category", name);
        }
        category.setName(name);

        Category updatedCategory = categoryRepository.save(category);
        log.info("Category {} renamed to {}", id, name);
        return mapToCategoryResponse(updatedCategory);
    }

    @Transactional
    public void deleteCategory(User actor, Long id) {
        accessPolicy.enforce(actor, Operation.MANAGE_CATALOG);
        Category category = findCategory(id);
        categoryRepository.delete(category);
        log.info("Category deleted: {}", category.getName());
    }

    private Category findCategory(Long id) {
        return categoryRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Category", "id", id));
    }

    private CatalogEntryResponse mapToCategoryResponse(Category category) {
        return CatalogEntryResponse.builder()
                .id(category.getId())
                .name(category.getName())
                .createdBy(category.getCreatedBy() != null ? category.getCreatedBy().getFullName() : null)
                .createdDate(category.getCreatedDate())
                .build();
    }
}
