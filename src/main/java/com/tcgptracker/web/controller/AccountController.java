package com.tcgptracker.web.controller;

import com.tcgptracker.users.UserAccountService;
import com.tcgptracker.web.form.PasswordChangeForm;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.authentication.logout.SecurityContextLogoutHandler;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

/**
 * Password change and account deletion.
 */
@Controller
@RequestMapping("/account")
@RequiredArgsConstructor
public class AccountController {

    private final UserAccountService userAccountService;

    @GetMapping
    public String account(Model model) {
        model.addAttribute("passwordForm", new PasswordChangeForm());
        return "tracker/account";
    }

    @PostMapping("/password")
    public String changePassword(@Valid @ModelAttribute("passwordForm") PasswordChangeForm form,
                                 BindingResult bindingResult,
                                 Authentication authentication,
                                 RedirectAttributes redirectAttributes) {
        if (!bindingResult.hasFieldErrors("confirmPassword") && !form.passwordsMatch()) {
            bindingResult.rejectValue("confirmPassword", "mismatch", "The two passwords do not match");
        }
        if (bindingResult.hasErrors()) {
            return "tracker/account";
        }
        if (!userAccountService.changePassword(authentication.getName(), form.getCurrentPassword(), form.getNewPassword())) {
            bindingResult.rejectValue("currentPassword", "mismatch", "Your current password is incorrect");
            return "tracker/account";
        }
        redirectAttributes.addFlashAttribute("message", "Your password was changed.");
        return "redirect:/account";
    }

    /**
     * Delete the account and end the session.
     */
    @PostMapping("/delete")
    public String deleteAccount(Authentication authentication,
                                HttpServletRequest request,
                                HttpServletResponse response) {
        userAccountService.deleteAccount(authentication.getName());
        new SecurityContextLogoutHandler().logout(request, response, authentication);
        return "redirect:/login?deleted";
    }
}
