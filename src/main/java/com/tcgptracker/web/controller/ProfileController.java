package com.tcgptracker.web.controller;

import com.tcgptracker.users.FriendRequest;
import com.tcgptracker.users.FriendService;
import com.tcgptracker.users.UserAccountService;
import com.tcgptracker.users.UserProfile;
import com.tcgptracker.web.form.ProfileForm;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.util.StringUtils;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

import java.security.Principal;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Own profile, public profiles, profile search and friend requests.
 */
@Controller
@RequiredArgsConstructor
public class ProfileController {

    private final UserAccountService userAccountService;
    private final FriendService friendService;

    @GetMapping("/profile")
    public String profile(Principal principal, Model model) {
        UserProfile profile = userAccountService.getProfile(principal.getName());
        model.addAttribute("form", ProfileForm.from(profile));
        addProfileAttributes(principal.getName(), profile, model);
        return "tracker/profile";
    }

    @PostMapping("/profile")
    public String updateProfile(@Valid @ModelAttribute("form") ProfileForm form,
                                BindingResult bindingResult,
                                Principal principal,
                                Model model,
                                RedirectAttributes redirectAttributes) {
        if (bindingResult.hasErrors()) {
            addProfileAttributes(principal.getName(), userAccountService.getProfile(principal.getName()), model);
            return "tracker/profile";
        }
        userAccountService.updateProfile(principal.getName(), form.getFriendCode(), form.isPublicProfile());
        redirectAttributes.addFlashAttribute("message", "Your profile was updated.");
        return "redirect:/profile";
    }

    @GetMapping("/profile/{username}")
    public String publicProfile(@PathVariable String username, Principal principal, Model model) {
        UserProfile profile = friendService.getPublicProfile(username);
        boolean canSendRequest = principal != null && !principal.getName().equals(profile.getUsername());
        boolean alreadySent = canSendRequest && friendService.hasSentRequest(principal.getName(), profile.getId());

        model.addAttribute("profile", profile);
        model.addAttribute("canSendRequest", canSendRequest);
        model.addAttribute("alreadySent", alreadySent);
        return "tracker/public_profile";
    }

    @GetMapping("/users/search")
    public String userSearch(@RequestParam(name = "q", defaultValue = "") String query, Principal principal, Model model) {
        String username = principal.getName();
        List<FriendRequest> receivedRequests = friendService.getPendingRequests(username);
        Set<Long> receivedFromIds = receivedRequests.stream()
            .map(request -> request.getFromProfile().getId())
            .collect(Collectors.toSet());

        model.addAttribute("query", query.trim());
        model.addAttribute("results", friendService.searchProfiles(username, query));
        model.addAttribute("sentToIds", friendService.getSentRequestTargetIds(username));
        model.addAttribute("receivedFromIds", receivedFromIds);
        model.addAttribute("friendIds", friendService.getFriendIds(username));
        model.addAttribute("receivedRequests", receivedRequests);
        return "tracker/user_search";
    }

    @PostMapping("/users/send_friend_request/{profileId}")
    public String sendFriendRequest(@PathVariable Long profileId,
                                    @RequestParam(required = false) String next,
                                    Principal principal,
                                    RedirectAttributes redirectAttributes) {
        Optional<FriendRequest> request = friendService.sendFriendRequest(principal.getName(), profileId);
        request.ifPresent(r -> redirectAttributes.addFlashAttribute("message",
            "Friend request sent to " + r.getToProfile().getUsername() + "!"));
        return "redirect:" + localTarget(next, "/users/search");
    }

    @PostMapping("/friends/accept/{requestId}")
    public String acceptFriendRequest(@PathVariable Long requestId,
                                      @RequestParam(required = false) String next,
                                      Principal principal,
                                      RedirectAttributes redirectAttributes) {
        FriendRequest request = friendService.acceptFriendRequest(principal.getName(), requestId);
        redirectAttributes.addFlashAttribute("message",
            request.getFromProfile().getUsername() + " is now your friend!");
        return "redirect:" + localTarget(next, "/profile");
    }

    private void addProfileAttributes(String username, UserProfile profile, Model model) {
        model.addAttribute("profile", profile);
        model.addAttribute("friends", friendService.getFriends(username));
        model.addAttribute("friendRequests", friendService.getPendingRequests(username));
    }

    /**
     * Only redirect to paths on this site.
     */
    static String localTarget(String next, String fallback) {
        if (StringUtils.hasText(next) && next.startsWith("/") && !next.startsWith("//")) {
            return next;
        }
        return fallback;
    }
}
