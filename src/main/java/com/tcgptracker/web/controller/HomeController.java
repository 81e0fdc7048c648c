package com.tcgptracker.web.controller;

import com.tcgptracker.catalog.Card;
import com.tcgptracker.catalog.CatalogService;
import com.tcgptracker.catalog.PokemonSet;
import com.tcgptracker.collection.CollectionAction;
import com.tcgptracker.collection.CollectionService;
import com.tcgptracker.collection.ProgressService;
import com.tcgptracker.users.AppUser;
import com.tcgptracker.users.UserAccountService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.util.UriComponentsBuilder;

import java.security.Principal;
import java.util.List;

/**
 * Home page: every set with its progress, plus card search.
 */
@Controller
@RequiredArgsConstructor
public class HomeController {

    private final CatalogService catalogService;
    private final CollectionService collectionService;
    private final ProgressService progressService;
    private final UserAccountService userAccountService;

    @GetMapping("/")
    public String home(@RequestParam(name = "q", defaultValue = "") String query, Principal principal, Model model) {
        AppUser user = userAccountService.getUser(principal.getName());
        List<PokemonSet> sets = catalogService.getSetsNewestFirst();
        String searchQuery = query.trim();

        model.addAttribute("sets", progressService.getSetProgress(user, sets));
        model.addAttribute("searchQuery", searchQuery);
        model.addAttribute("searchResults", catalogService.searchCards(searchQuery));
        model.addAttribute("userCardIds", collectionService.getCollectedCardIds(user));
        return "tracker/home";
    }

    /**
     * Collect or uncollect a card from the search results, then return to the search.
     */
    @PostMapping("/")
    public String changeStatus(@RequestParam("card_id") Long cardId,
                               @RequestParam("action") String action,
                               @RequestParam(name = "q", defaultValue = "") String query,
                               Principal principal) {
        AppUser user = userAccountService.getUser(principal.getName());
        Card card = catalogService.getCard(cardId);
        collectionService.apply(user, card, CollectionAction.fromParameter(action));

        if (!StringUtils.hasText(query)) {
            return "redirect:/";
        }
        return "redirect:" + UriComponentsBuilder.fromPath("/").queryParam("q", query).encode().toUriString();
    }
}
