package com.Quartermaster.inventory_backend.controller;

import com.Quartermaster.inventory_backend.dto.request.CustodyRequest;
import com.Quartermaster.inventory_backend.dto.response.ItemResponse;
import com.Quartermaster.inventory_backend.enums.Role;
import com.Quartermaster.inventory_backend.exception.GlobalExceptionHandler;
import com.Quartermaster.inventory_backend.exception.ItemAlreadyCheckedOutException;
import com.Quartermaster.inventory_backend.model.User;
import com.Quartermaster.inventory_backend.service.ItemService;
import com.Quartermaster.inventory_backend.service.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ItemControllerTest {

    @Mock private ItemService itemService;
    @Mock private UserService userService;

    private MockMvc mockMvc;

    private final User member = User.builder().id(1L).username("m").fullName("M").role(Role.MEMBER).build();

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ItemController(itemService, userService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void checkoutReturnsUpdatedItem() throws Exception {
        when(userService.getCurrentUser()).thenReturn(member);
        when(itemService.checkoutItem(eq(member), eq(1L), any(CustodyRequest.class))).thenReturn(
                ItemResponse.builder().id(1L).name("Tent").checkedOut(true).checkedOutBy("Jane").build());

        mockMvc.perform(post("/api/items/1/checkout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"personName\":\"Jane\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.checkedOutBy").value("Jane"));
    }

    @Test
    void checkoutOfHeldItemIsConflict() throws Exception {
        when(userService.getCurrentUser()).thenReturn(member);
        when(itemService.checkoutItem(eq(member), eq(1L), any(CustodyRequest.class)))
                .thenThrow(new ItemAlreadyCheckedOutException(1L, "Jane"));

        mockMvc.perform(post("/api/items/1/checkout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"personName\":\"Bob\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("ALREADY_CHECKED_OUT"))
                .andExpect(jsonPath("$.details.checkedOutBy").value("Jane"));
    }

    @Test
    void blankPersonNameFailsValidation() throws Exception {
        mockMvc.perform(post("/api/items/1/checkout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"personName\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));

        verifyNoInteractions(itemService);
    }
}
