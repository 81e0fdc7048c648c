package com.tcgptracker.web.controller;

import com.tcgptracker.common.exception.DuplicateUsernameException;
import com.tcgptracker.users.UserAccountService;
import com.tcgptracker.web.form.RegisterForm;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;

/**
 * Login page and registration. Spring Security processes the login form itself.
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    private final UserAccountService userAccountService;

    @GetMapping("/login")
    public String login() {
        return "login";
    }

    @GetMapping("/register")
    public String registerForm(Model model) {
        model.addAttribute("form", new RegisterForm());
        return "register";
    }

    /**
     * Register and sign the new user in right away.
     */
    @PostMapping("/register")
    public String register(@Valid @ModelAttribute("form") RegisterForm form,
                           BindingResult bindingResult,
                           HttpServletRequest request) {
        if (!bindingResult.hasFieldErrors("confirmPassword") && !form.passwordsMatch()) {
            bindingResult.rejectValue("confirmPassword", "mismatch", "The two passwords do not match");
        }
        if (bindingResult.hasErrors()) {
            return "register";
        }

        try {
            userAccountService.register(form.getUsername(), form.getEmail(), form.getPassword());
        } catch (DuplicateUsernameException e) {
            bindingResult.rejectValue("username", "duplicate", "This username is already taken");
            return "register";
        }

        try {
            request.login(form.getUsername(), form.getPassword());
        } catch (ServletException e) {
            log.warn("Automatic login after registration failed for {}", form.getUsername(), e);
            return "redirect:/login";
        }
        return "redirect:/";
    }
}
