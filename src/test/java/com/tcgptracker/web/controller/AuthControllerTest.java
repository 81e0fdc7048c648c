package com.tcgptracker.web.controller;

import com.tcgptracker.users.AppUserRepository;
import com.tcgptracker.users.UserAccountService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestBuilders.formLogin;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.security.test.web.servlet.response.SecurityMockMvcResultMatchers.authenticated;
import static org.springframework.security.test.web.servlet.response.SecurityMockMvcResultMatchers.unauthenticated;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests for login and registration.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
class AuthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private UserAccountService userAccountService;

    @Autowired
    private AppUserRepository userRepository;

    @Test
    void testHomeRedirectsToLogin() throws Exception {
        mockMvc.perform(get("/"))
            .andExpect(status().is3xxRedirection())
            .andExpect(redirectedUrlPattern("**/login"));
    }

    @Test
    void testLoginPage() throws Exception {
        mockMvc.perform(get("/login"))
            .andExpect(status().isOk())
            .andExpect(view().name("login"));
    }

    @Test
    void testFormLogin() throws Exception {
        userAccountService.register("ash", "ash@example.com", "pikachu-123");

        mockMvc.perform(formLogin("/login").user("ash").password("pikachu-123"))
            .andExpect(authenticated().withUsername("ash"));

        mockMvc.perform(formLogin("/login").user("ash").password("wrong"))
            .andExpect(unauthenticated());
    }

    @Test
    void testRegister() throws Exception {
        mockMvc.perform(post("/register")
                .with(csrf())
                .param("username", "misty")
                .param("email", "misty@example.com")
                .param("password", "staryu-123")
                .param("confirmPassword", "staryu-123"))
            .andExpect(status().is3xxRedirection());

        assertTrue(userRepository.findByUsername("misty").isPresent());
        assertTrue(userAccountService.getProfile("misty").isPublicProfile());
    }

    @Test
    void testRegister_PasswordMismatch() throws Exception {
        mockMvc.perform(post("/register")
                .with(csrf())
                .param("username", "misty")
                .param("email", "misty@example.com")
                .param("password", "staryu-123")
                .param("confirmPassword", "starmie-123"))
            .andExpect(status().isOk())
            .andExpect(view().name("register"))
            .andExpect(model().attributeHasFieldErrors("form", "confirmPassword"));

        assertFalse(userRepository.findByUsername("misty").isPresent());
    }

    @Test
    void testRegister_DuplicateUsername() throws Exception {
        userAccountService.register("misty", "misty@example.com", "staryu-123");

        mockMvc.perform(post("/register")
                .with(csrf())
                .param("username", "misty")
                .param("email", "other@example.com")
                .param("password", "psyduck-123")
                .param("confirmPassword", "psyduck-123"))
            .andExpect(status().isOk())
            .andExpect(model().attributeHasFieldErrors("form", "username"));
    }

    @Test
    void testRegister_ShortPassword() throws Exception {
        mockMvc.perform(post("/register")
                .with(csrf())
                .param("username", "brock")
                .param("email", "brock@example.com")
                .param("password", "onix")
                .param("confirmPassword", "onix"))
            .andExpect(status().isOk())
            .andExpect(model().attributeHasFieldErrors("form", "password"));
    }
}
