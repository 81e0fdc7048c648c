package com.tcgptracker.web.controller;

import com.tcgptracker.api.dto.CollectionStatusResponse;
import com.tcgptracker.catalog.Card;
import com.tcgptracker.catalog.CatalogService;
import com.tcgptracker.catalog.PokemonSet;
import com.tcgptracker.catalog.Rarity;
import com.tcgptracker.collection.CollectionAction;
import com.tcgptracker.collection.CollectionService;
import com.tcgptracker.collection.ProgressService;
import com.tcgptracker.config.TrackerProperties;
import com.tcgptracker.table.CardTable;
import com.tcgptracker.table.SortDirection;
import com.tcgptracker.table.SortKey;
import com.tcgptracker.table.SortState;
import com.tcgptracker.users.AppUser;
import com.tcgptracker.users.UserAccountService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

import java.security.Principal;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The card table of one set.
 *
 * Row clicks post {@code card_id} and {@code action} to the page itself. Script requests
 * (header {@code X-Requested-With: XMLHttpRequest}) get the resulting status as JSON, plain
 * form posts are redirected back to the page.
 */
@Controller
@RequestMapping({"/set/{setNumber}", "/set/{setNumber}/"})
@RequiredArgsConstructor
@Slf4j
public class SetDetailController {

    static final String AJAX_HEADER = "X-Requested-With=XMLHttpRequest";
    static final String RARITY_PROGRESS_FRAGMENT = "rarity_progress";

    private final CatalogService catalogService;
    private final CollectionService collectionService;
    private final ProgressService progressService;
    private final UserAccountService userAccountService;
    private final TrackerProperties properties;

    @GetMapping
    public String setDetail(@PathVariable String setNumber,
                            @RequestParam(required = false) String sort,
                            @RequestParam(required = false) String dir,
                            @RequestParam(defaultValue = "") String filter,
                            @RequestParam(required = false) String fragment,
                            Principal principal,
                            Model model) {
        AppUser user = userAccountService.getUser(principal.getName());
        PokemonSet set = catalogService.getSet(setNumber);

        model.addAttribute("set", set);
        model.addAttribute("progress", progressService.getSetProgress(user, set));
        if (RARITY_PROGRESS_FRAGMENT.equals(fragment)) {
            return "tracker/set_detail :: rarityProgress";
        }

        List<Card> cards = catalogService.getCards(set);
        Set<Long> collectedIds = collectionService.getCollectedCardIds(user, set);
        CardTable table = CardTable.of(cards, collectedIds, sortState(sort, dir), filter);
        CardTable unfiltered = CardTable.of(cards, collectedIds, SortState.initial(), null);

        Map<String, SortState> headerTargets = new LinkedHashMap<>();
        for (SortKey key : SortKey.values()) {
            headerTargets.put(key.getParameter(), table.headerTarget(key));
        }

        model.addAttribute("table", table);
        model.addAttribute("sortKeys", SortKey.values());
        model.addAttribute("headerTargets", headerTargets);
        model.addAttribute("rarityOrder", rarityOrder(cards));
        model.addAttribute("baseCardsMissing", unfiltered.rowsToCollect(properties.getUi().getBaseRarities()).size());
        model.addAttribute("hasJumpTarget", unfiltered.firstRowOfRarity(properties.getUi().getJumpRarity()).isPresent());
        return "tracker/set_detail";
    }

    @PostMapping(headers = AJAX_HEADER)
    @ResponseBody
    public CollectionStatusResponse changeStatusAsync(@PathVariable String setNumber,
                                                      @RequestParam("card_id") Long cardId,
                                                      @RequestParam("action") String action,
                                                      Principal principal) {
        boolean collected = changeStatus(setNumber, cardId, action, principal.getName());
        return CollectionStatusResponse.success(cardId, collected);
    }

    @PostMapping
    public String changeStatusForm(@PathVariable String setNumber,
                                   @RequestParam(name = "card_id", required = false) Long cardId,
                                   @RequestParam(name = "action", required = false) String action,
                                   @RequestParam(required = false) String bulk,
                                   Principal principal,
                                   RedirectAttributes redirectAttributes) {
        if ("base".equals(bulk)) {
            AppUser user = userAccountService.getUser(principal.getName());
            PokemonSet set = catalogService.getSet(setNumber);
            int count = collectionService.collectRarities(user, set, properties.getUi().getBaseRarities()).size();
            redirectAttributes.addFlashAttribute("message", "Collected " + count + " base cards.");
        } else {
            if (cardId == null || action == null) {
                throw new IllegalArgumentException("card_id and action are required");
            }
            changeStatus(setNumber, cardId, action, principal.getName());
        }
        redirectAttributes.addAttribute("setNumber", setNumber);
        return "redirect:/set/{setNumber}";
    }

    private boolean changeStatus(String setNumber, Long cardId, String action, String username) {
        CollectionAction collectionAction = CollectionAction.fromParameter(action);
        AppUser user = userAccountService.getUser(username);
        PokemonSet set = catalogService.getSet(setNumber);
        Card card = catalogService.getCardInSet(cardId, set);
        return collectionService.apply(user, card, collectionAction);
    }

    private static SortState sortState(String sort, String dir) {
        if (sort == null) {
            return SortState.initial();
        }
        SortKey key = SortKey.fromParameter(sort, SortKey.NUMBER);
        return SortState.of(key, SortDirection.fromParameter(dir, SortDirection.ASC));
    }

    /**
     * Sort order of the rarities used in the set, for the browser-side rarity sort.
     */
    private static Map<String, Integer> rarityOrder(List<Card> cards) {
        Map<String, Integer> order = new LinkedHashMap<>();
        cards.stream()
            .map(Card::getRarity)
            .distinct()
            .sorted(Comparator.comparingInt(Rarity::getSortOrder))
            .forEach(rarity -> order.put(rarity.getName(), rarity.getSortOrder()));
        return order;
    }
}
