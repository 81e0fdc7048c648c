package com.tcgptracker.web.controller;

import com.tcgptracker.packs.PackListService;
import com.tcgptracker.users.UserAccountService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

import java.security.Principal;

@Controller
@RequiredArgsConstructor
public class PackListController {

    private final PackListService packListService;
    private final UserAccountService userAccountService;

    @GetMapping("/packs")
    public String packList(Principal principal, Model model) {
        model.addAttribute("groupedPacks", packListService.getPackList(userAccountService.getUser(principal.getName())));
        return "tracker/pack_list";
    }
}
