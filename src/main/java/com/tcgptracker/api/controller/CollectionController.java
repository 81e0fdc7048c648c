package com.tcgptracker.api.controller;

import com.tcgptracker.api.dto.CollectRaritiesRequest;
import com.tcgptracker.api.dto.CollectRaritiesResponse;
import com.tcgptracker.api.dto.CollectionStatusResponse;
import com.tcgptracker.api.dto.SetProgressResponse;
import com.tcgptracker.catalog.Card;
import com.tcgptracker.catalog.CatalogService;
import com.tcgptracker.catalog.PokemonSet;
import com.tcgptracker.collection.CollectionAction;
import com.tcgptracker.collection.CollectionService;
import com.tcgptracker.collection.ProgressService;
import com.tcgptracker.users.AppUser;
import com.tcgptracker.users.UserAccountService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;

/**
 * REST API for the signed-in user's collection.
 */
@RestController
@RequestMapping("/api/v1/collection")
@RequiredArgsConstructor
@Tag(name = "Collection", description = "Collection status API")
public class CollectionController {

    private final CatalogService catalogService;
    private final CollectionService collectionService;
    private final ProgressService progressService;
    private final UserAccountService userAccountService;

    @GetMapping("/sets/{setNumber}")
    @Operation(summary = "Get collection progress for a set")
    public ResponseEntity<SetProgressResponse> getSetProgress(@PathVariable String setNumber, Principal principal) {
        AppUser user = userAccountService.getUser(principal.getName());
        PokemonSet set = catalogService.getSet(setNumber);
        return ResponseEntity.ok(SetProgressResponse.of(progressService.getSetProgress(user, set)));
    }

    @PostMapping("/cards/{cardId}/{action}")
    @Operation(summary = "Collect or uncollect a card")
    public ResponseEntity<CollectionStatusResponse> changeStatus(@PathVariable Long cardId,
                                                                 @PathVariable String action,
                                                                 Principal principal) {
        AppUser user = userAccountService.getUser(principal.getName());
        Card card = catalogService.getCard(cardId);
        boolean collected = collectionService.apply(user, card, CollectionAction.fromParameter(action));
        return ResponseEntity.ok(CollectionStatusResponse.success(cardId, collected));
    }

    @PostMapping("/sets/{setNumber}/collect")
    @Operation(summary = "Collect all cards of the given rarities in a set")
    public ResponseEntity<CollectRaritiesResponse> collectRarities(@PathVariable String setNumber,
                                                                   @Valid @RequestBody CollectRaritiesRequest request,
                                                                   Principal principal) {
        AppUser user = userAccountService.getUser(principal.getName());
        PokemonSet set = catalogService.getSet(setNumber);
        List<Long> collectedIds = collectionService.collectRarities(user, set, request.getRarities()).stream()
            .map(Card::getId)
            .toList();
        return ResponseEntity.ok(new CollectRaritiesResponse(setNumber, collectedIds));
    }
}
