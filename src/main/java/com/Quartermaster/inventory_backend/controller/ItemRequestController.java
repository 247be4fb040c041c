package com.Quartermaster.inventory_backend.controller;

import com.Quartermaster.inventory_backend.dto.request.ItemRequestSubmission;
import com.Quartermaster.inventory_backend.dto.request.ReviewRequest;
import com.Quartermaster.inventory_backend.dto.response.ApiResponse;
import com.Quartermaster.inventory_backend.dto.response.ItemRequestResponse;
import com.Quartermaster.inventory_backend.dto.response.ReviewOutcomeResponse;
import com.Quartermaster.inventory_backend.model.User;
import com.Quartermaster.inventory_backend.service.ItemRequestService;
import com.Quartermaster.inventory_backend.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/requests")
@RequiredArgsConstructor
public class ItemRequestController {

    private final ItemRequestService itemRequestService;
    private final UserService userService;

    @PostMapping
    public ResponseEntity<ApiResponse<ItemRequestResponse>> submitRequest(
            @Valid @RequestBody ItemRequestSubmission submission) {

        ItemRequestResponse request = itemRequestService.submitRequest(userService.getCurrentUser(), submission);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(request, "Request submitted successfully"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<ItemRequestResponse>>> getAllRequests() {
        return ResponseEntity.ok(ApiResponse.success(
                itemRequestService.getAllRequests(userService.getCurrentUser())));
    }

    @GetMapping("/pending")
    public ResponseEntity<ApiResponse<List<ItemRequestResponse>>> getPendingRequests() {
        return ResponseEntity.ok(ApiResponse.success(
                itemRequestService.getPendingRequests(userService.getCurrentUser())));
    }

    @GetMapping("/mine")
    public ResponseEntity<ApiResponse<List<ItemRequestResponse>>> getMyRequests() {
        User currentUser = userService.getCurrentUser();
        return ResponseEntity.ok(ApiResponse.success(
                itemRequestService.getRequestsByRequester(currentUser, currentUser.getId())));
    }

    @GetMapping("/user/{userId}")
    public ResponseEntity<ApiResponse<List<ItemRequestResponse>>> getRequestsByUser(@PathVariable Long userId) {
        return ResponseEntity.ok(ApiResponse.success(
                itemRequestService.getRequestsByRequester(userService.getCurrentUser(), userId)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ItemRequestResponse>> getRequestById(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(
                itemRequestService.getRequestById(userService.getCurrentUser(), id)));
    }

    @PostMapping("/{id}/review")
    public ResponseEntity<ApiResponse<ReviewOutcomeResponse>> reviewRequest(
            @PathVariable Long id,
            @Valid @RequestBody ReviewRequest review) {

        ReviewOutcomeResponse outcome = itemRequestService.reviewRequest(userService.getCurrentUser(), id, review);
        return ResponseEntity.ok(ApiResponse.success(outcome,
                "Request " + outcome.getRequest().getStatus().getValue()));
    }
}
